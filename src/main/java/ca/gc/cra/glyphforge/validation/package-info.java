/**
 * Argument validation helpers shared by configuration, domain records and adapters.
 * <p><strong>Failure model:</strong> All helpers throw {@link java.lang.IllegalArgumentException} with a message
 * naming the offending parameter.</p>
 */
package ca.gc.cra.glyphforge.validation;
