/**
 * Capsule model: the final raster together with template metadata, quality metrics, validation verdicts and
 * provenance.
 * <p><strong>Ownership:</strong> A capsule owns its raster; closing the capsule releases it.</p>
 * <p><strong>Concurrency:</strong> Capsules are confined to the request that built them until handed to the caller.</p>
 */
package ca.gc.cra.glyphforge.domain.capsule;
