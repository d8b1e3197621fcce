package com.purchasingpower.schemaembed.api;

import com.purchasingpower.schemaembed.core.SchemaDocument;
import com.purchasingpower.schemaembed.core.SchemaEmbedding;
import com.purchasingpower.schemaembed.schema.SchemaMetadataExtractor;
import com.purchasingpower.schemaembed.service.SchemaEmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for schema embeddings.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/embeddings")
@RequiredArgsConstructor
public class EmbeddingController {

    private final SchemaEmbeddingService embeddingService;
    private final SchemaMetadataExtractor metadataExtractor;

    /**
     * Embed one schema.
     *
     * POST /api/v1/embeddings/schema
     */
    @PostMapping("/schema")
    public ResponseEntity<SchemaEmbeddingResponse> embed(@RequestBody SchemaEmbeddingRequest request) {
        try {
            String invalid = validate(request);
            if (invalid != null) {
                return ResponseEntity.badRequest().body(SchemaEmbeddingResponse.error(invalid));
            }

            log.info("Embedding schema ({} chars)", request.getSchemaText().length());
            SchemaDocument document = toDocument(request);
            SchemaEmbedding result = embeddingService.embed(document.getSchemaText(), document.getMetadata());
            return ResponseEntity.ok(SchemaEmbeddingResponse.success(result));

        } catch (IllegalArgumentException e) {
            log.warn("Rejected embedding request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(SchemaEmbeddingResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Embedding failed", e);
            return ResponseEntity.internalServerError()
                .body(SchemaEmbeddingResponse.error("Embedding failed: " + e.getMessage()));
        }
    }

    /**
     * Cosine similarity of two schemas' combined embeddings. Both schemas
     * are embedded in one batch so they share a vocabulary.
     *
     * POST /api/v1/embeddings/similarity
     */
    @PostMapping("/similarity")
    public ResponseEntity<SimilarityResponse> similarity(@RequestBody SimilarityRequest request) {
        try {
            String invalid = request.getLeft() == null || request.getRight() == null
                ? "Both left and right schemas are required"
                : firstNonNull(validate(request.getLeft()), validate(request.getRight()));
            if (invalid != null) {
                return ResponseEntity.badRequest().body(SimilarityResponse.error(invalid));
            }

            double similarity = embeddingService.similarity(
                toDocument(request.getLeft()), toDocument(request.getRight()));

            log.info("Schema similarity: {}", similarity);
            return ResponseEntity.ok(SimilarityResponse.success(similarity));

        } catch (IllegalArgumentException e) {
            log.warn("Rejected similarity request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(SimilarityResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Similarity failed", e);
            return ResponseEntity.internalServerError()
                .body(SimilarityResponse.error("Similarity failed: " + e.getMessage()));
        }
    }

    private SchemaDocument toDocument(SchemaEmbeddingRequest request) {
        if (request.getMetadata() == null && request.getColumns() != null) {
            return SchemaDocument.of(request.getSchemaText(), metadataExtractor.extract(request.getColumns()));
        }
        return SchemaDocument.of(request.getSchemaText(), request.getMetadata());
    }

    private String validate(SchemaEmbeddingRequest request) {
        if (request.getSchemaText() == null) {
            return "Schema text is required";
        }
        if (request.getMetadata() != null && request.getColumns() != null) {
            return "Provide either metadata or columns, not both";
        }
        return null;
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
