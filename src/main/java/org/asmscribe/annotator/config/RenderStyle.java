package org.asmscribe.annotator.config;

/**
 * Banner style of the rendered header and function banners.
 */
public enum RenderStyle {
    /** Rules made of {@code =} and {@code -} characters. */
    PLAIN,
    /** Box-drawing frames. */
    BOX
}
