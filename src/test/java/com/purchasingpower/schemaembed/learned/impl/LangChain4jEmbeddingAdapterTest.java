package com.purchasingpower.schemaembed.learned.impl;

import com.purchasingpower.schemaembed.core.EmbeddingVector;
import com.purchasingpower.schemaembed.exception.EmbeddingGenerationException;
import com.purchasingpower.schemaembed.learned.FoldingDimensionReducer;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("LangChain4j Embedding Adapter Tests")
class LangChain4jEmbeddingAdapterTest {

    @Test
    @DisplayName("Model output is folded to the target size and normalized")
    void embed_foldsAndNormalizes() {
        FixedEmbeddingModel model = new FixedEmbeddingModel(new float[]{1f, 2f, 3f, 4f, 5f, 6f});
        LangChain4jEmbeddingAdapter adapter = new LangChain4jEmbeddingAdapter(
                model, "fixed", new FoldingDimensionReducer(3), 6);

        EmbeddingVector vector = adapter.embed("create table users (id int)");

        assertThat(adapter.dimension()).isEqualTo(3);
        assertThat(vector.dimension()).isEqualTo(3);
        assertThat(vector.magnitude()).isCloseTo(1.0, within(1e-9));
        // folded: [5, 7, 9]
        assertThat(vector.get(2) / vector.get(0)).isCloseTo(9.0 / 5.0, within(1e-9));
    }

    @Test
    @DisplayName("Without a reducer the model dimension must match")
    void embed_withoutReducer_checksDimension() {
        LangChain4jEmbeddingAdapter adapter = new LangChain4jEmbeddingAdapter(
                new FixedEmbeddingModel(new float[]{1f, 2f}), "fixed", null, 3);

        assertThatThrownBy(() -> adapter.embed("users"))
                .isInstanceOf(EmbeddingGenerationException.class)
                .hasMessageContaining("expected 3");
    }

    @Test
    @DisplayName("Non-finite model values are rejected")
    void embed_nonFinite_rejected() {
        LangChain4jEmbeddingAdapter adapter = new LangChain4jEmbeddingAdapter(
                new FixedEmbeddingModel(new float[]{1f, Float.NaN}), "fixed", null, 2);

        assertThatThrownBy(() -> adapter.embed("users"))
                .isInstanceOf(EmbeddingGenerationException.class)
                .hasMessageContaining("non-finite");
    }

    @Test
    @DisplayName("Blank text yields the zero vector without calling the model")
    void embed_blank_skipsModel() {
        FixedEmbeddingModel model = new FixedEmbeddingModel(new float[]{1f, 2f});
        LangChain4jEmbeddingAdapter adapter = new LangChain4jEmbeddingAdapter(model, "fixed", null, 2);

        EmbeddingVector vector = adapter.embed("  ");

        assertThat(vector.isZero()).isTrue();
        assertThat(model.calls.get()).isZero();
    }

    @Test
    @DisplayName("Model failures are wrapped")
    void embed_modelFailure_wrapped() {
        EmbeddingModel failing = new EmbeddingModel() {
            @Override
            public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
                throw new IllegalStateException("connection refused");
            }
        };
        LangChain4jEmbeddingAdapter adapter = new LangChain4jEmbeddingAdapter(failing, "broken", null, 2);

        assertThatThrownBy(() -> adapter.embed("users"))
                .isInstanceOf(EmbeddingGenerationException.class)
                .hasRootCauseMessage("connection refused");
    }

    private static class FixedEmbeddingModel implements EmbeddingModel {

        private final float[] vector;
        private final AtomicInteger calls = new AtomicInteger();

        FixedEmbeddingModel(float[] vector) {
            this.vector = vector;
        }

        @Override
        public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
            calls.incrementAndGet();
            return Response.from(segments.stream()
                    .map(s -> Embedding.from(vector.clone()))
                    .collect(Collectors.toList()));
        }
    }
}
