/** Runtime adjustments to the Logback configuration. */
package ca.gc.cra.glyphforge.logging;
