package com.actexport.core.grid;

/**
 * Role of a cell in a positional description.
 */
public enum CellKind {
    HEADER,
    DATA
}
