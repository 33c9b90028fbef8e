package com.actexport.core.markup;

/**
 * Character styles understood by the inline markup converter.
 */
public enum InlineStyle {
    BOLD,
    ITALIC,
    UNDERLINE
}
