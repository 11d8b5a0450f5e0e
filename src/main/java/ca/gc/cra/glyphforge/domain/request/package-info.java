/** Generation and morph requests, including audited validator overrides. */
package ca.gc.cra.glyphforge.domain.request;
