package com.purchasingpower.schemaembed.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.schemaembed.core.ColumnRecord;
import com.purchasingpower.schemaembed.core.SchemaMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for EmbeddingController.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class EmbeddingControllerTest {

    private static final String USERS = "CREATE TABLE users (id int, name varchar)";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("POST /schema returns the combined embedding")
    void embedSchema_success() throws Exception {
        // Given
        SchemaEmbeddingRequest request = SchemaEmbeddingRequest.builder()
                .schemaText(USERS)
                .metadata(SchemaMetadata.builder()
                        .entities(List.of("users", "id", "name"))
                        .primaryKey("id")
                        .build())
                .build();

        // When & Then
        mockMvc.perform(post("/api/v1/embeddings/schema")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.dimension").value(256))
                .andExpect(jsonPath("$.embedding.length()").value(256))
                .andExpect(jsonPath("$.generators.enhanced.length()").value(256))
                .andExpect(jsonPath("$.weights['primary-key-aware']").value(1.0));
    }

    @Test
    @DisplayName("POST /schema accepts introspection column records")
    void embedSchema_columns() throws Exception {
        SchemaEmbeddingRequest request = SchemaEmbeddingRequest.builder()
                .schemaText(USERS)
                .columns(List.of(ColumnRecord.builder()
                        .table("users").column("id").dataType("int").primaryKey(true).build()))
                .build();

        mockMvc.perform(post("/api/v1/embeddings/schema")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    @DisplayName("POST /schema without schema text is rejected")
    void embedSchema_missingText() throws Exception {
        mockMvc.perform(post("/api/v1/embeddings/schema")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value(containsString("Schema text")));
    }

    @Test
    @DisplayName("POST /similarity of a schema with itself returns 1")
    void similarity_identical() throws Exception {
        SchemaEmbeddingRequest side = SchemaEmbeddingRequest.builder().schemaText(USERS).build();
        SimilarityRequest request = SimilarityRequest.builder().left(side).right(side).build();

        mockMvc.perform(post("/api/v1/embeddings/similarity")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.similarity").value(closeTo(1.0, 1e-9)));
    }

    @Test
    @DisplayName("POST /similarity with a missing side is rejected")
    void similarity_missingSide() throws Exception {
        SimilarityRequest request = SimilarityRequest.builder()
                .left(SchemaEmbeddingRequest.builder().schemaText(USERS).build())
                .build();

        mockMvc.perform(post("/api/v1/embeddings/similarity")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }
}
