/**
 * File-backed adapters: PNG snapshot loading, capsule export as PNG plus JSON, and the NDJSON capsule registry.
 * <p><strong>Role:</strong> Storage-side implementations of the raster source, export and registry ports.</p>
 * <p><strong>Concurrency:</strong> Export writes distinct files per capsule; the registry serializes appends.</p>
 * <p><strong>Durability:</strong> Exported files are written to a temporary sibling and moved into place.</p>
 */
package ca.gc.cra.glyphforge.infrastructure.persistence;
