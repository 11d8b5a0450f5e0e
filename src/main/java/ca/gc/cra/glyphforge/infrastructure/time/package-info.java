/** System clock adapter. */
package ca.gc.cra.glyphforge.infrastructure.time;
