/** Canonical content hashing and the capsule ids derived from it. */
package ca.gc.cra.glyphforge.domain.provenance;
