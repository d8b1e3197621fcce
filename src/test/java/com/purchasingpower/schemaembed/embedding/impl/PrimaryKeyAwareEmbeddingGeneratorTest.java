package com.purchasingpower.schemaembed.embedding.impl;

import com.purchasingpower.schemaembed.core.EmbeddingVector;
import com.purchasingpower.schemaembed.core.SchemaMetadata;
import com.purchasingpower.schemaembed.core.WordIndex;
import com.purchasingpower.schemaembed.embedding.WeightTable;
import com.purchasingpower.schemaembed.embedding.WeightedHashProjector;
import com.purchasingpower.schemaembed.text.SchemaTokenizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Primary Key Aware Generator Tests")
class PrimaryKeyAwareEmbeddingGeneratorTest {

    private static final String USERS = "create table users (id int primary key, name varchar(50))";

    private static final SchemaMetadata USERS_METADATA = SchemaMetadata.builder()
            .entities(List.of("users", "id", "name"))
            .primaryKey("id")
            .build();

    private final PrimaryKeyAwareEmbeddingGenerator generator = new PrimaryKeyAwareEmbeddingGenerator(
            16, WeightTable.primaryKeyAwareDefaults(), new SchemaTokenizer());

    @Test
    @DisplayName("Primary key slot outweighs an ordinary column slot")
    void primaryKeySlot_outweighsOrdinaryColumn() {
        // Given
        WordIndex index = new WordIndex();

        // When
        double[] raw = generator.accumulate(USERS, USERS_METADATA, index);

        // Then
        int idSlot = WeightedHashProjector.slot(index.getOrAdd("id"), 16);
        int nameSlot = WeightedHashProjector.slot(index.getOrAdd("name"), 16);
        assertThat(raw[idSlot]).isGreaterThan(raw[nameSlot]);

        // base 1 + pk token 10 + pk extra 15 + domain keyword 5 + entity 2
        assertThat(raw[idSlot]).isEqualTo(33.0);
        // base 1 + entity 2
        assertThat(raw[nameSlot]).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Key types count only when present; domain keywords always count")
    void conditionalAndDomainKeywords() {
        WordIndex index = new WordIndex();

        double[] raw = generator.accumulate(USERS, USERS_METADATA, index);

        // "int" appears in the text: base 1 + conditional 3
        assertThat(raw[WeightedHashProjector.slot(index.getOrAdd("int"), 16)]).isEqualTo(4.0);
        // "identifier" never appears but is still registered and weighted
        assertThat(index.contains("identifier")).isTrue();
        assertThat(raw[WeightedHashProjector.slot(index.getOrAdd("identifier"), 16)]).isEqualTo(5.0);
        // "uuid" is absent from the text, so it is never registered
        assertThat(index.contains("uuid")).isFalse();
    }

    @Test
    @DisplayName("Missing primary key skips primary key weighting without failing")
    void missingPrimaryKey_isSkipped() {
        WordIndex index = new WordIndex();
        SchemaMetadata noKey = SchemaMetadata.builder()
                .entities(List.of("users", "id", "name"))
                .primaryKey("")
                .build();

        double[] raw = generator.accumulate(USERS, noKey, index);

        // base 1 + domain keyword 5 + entity 2
        assertThat(raw[WeightedHashProjector.slot(index.getOrAdd("id"), 16)]).isEqualTo(8.0);
    }

    @Test
    @DisplayName("Generated vector has unit length")
    void generate_isNormalized() {
        EmbeddingVector vector = generator.generate(USERS, USERS_METADATA);

        assertThat(vector.dimension()).isEqualTo(16);
        assertThat(vector.magnitude()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Empty schema text yields the zero vector")
    void emptySchema_yieldsZeroVector() {
        EmbeddingVector vector = generator.generate("", USERS_METADATA);

        assertThat(vector.isZero()).isTrue();
        assertThat(vector.dimension()).isEqualTo(16);
    }

    @Test
    @DisplayName("Same input produces the same vector")
    void generate_isDeterministic() {
        assertThat(generator.generate(USERS, USERS_METADATA))
                .isEqualTo(generator.generate(USERS, USERS_METADATA));
    }

    @Test
    @DisplayName("Metadata is matched case-insensitively against tokens")
    void metadata_isCaseInsensitive() {
        WordIndex lower = new WordIndex();
        WordIndex upper = new WordIndex();
        SchemaMetadata shouting = SchemaMetadata.builder()
                .entities(List.of("USERS", "ID", "NAME"))
                .primaryKey(" ID ")
                .build();

        double[] expected = generator.accumulate(USERS, USERS_METADATA, lower);
        double[] actual = generator.accumulate(USERS, shouting, upper);

        assertThat(actual).containsExactly(expected);
    }
}
