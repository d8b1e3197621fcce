/**
 * Core domain models for schema embeddings.
 *
 * <p>Contains the fundamental value types shared by every generator:
 * <ul>
 *   <li>WordIndex - word to slot-index vocabulary, scoped to one request</li>
 *   <li>SchemaMetadata - entities, primary key and foreign keys of a schema</li>
 *   <li>EmbeddingVector - immutable, fixed-length result vector</li>
 *   <li>GeneratorType - identifiers used in weight configuration</li>
 * </ul>
 *
 * <p>This package has no Spring dependencies.
 *
 * @since 1.0.0
 */
package com.purchasingpower.schemaembed.core;
