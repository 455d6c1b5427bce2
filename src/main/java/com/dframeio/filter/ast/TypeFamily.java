package com.dframeio.filter.ast;

/**
 * Groups of mutually comparable value types.
 * Two values can only be compared when they belong to the same family.
 */
public enum TypeFamily {
    STRING,
    NUMERIC,
    BOOLEAN,
    TIMESTAMP
}
