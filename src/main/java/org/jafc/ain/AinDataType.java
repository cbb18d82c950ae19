package org.jafc.ain;

/**
 * The data types a value can have in the bytecode object.
 */
public enum AinDataType {
    /** No value; only valid as a function return type. */
    VOID,
    /** A 32-bit signed integer. */
    INT,
    /** A 32-bit floating point number. */
    FLOAT,
    /** A string. */
    STRING,
    /** An instance of a structure, identified by its structure index. */
    STRUCT;

    /**
     * @return {@code true} for {@link #INT} and {@link #FLOAT}.
     */
    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }
}
