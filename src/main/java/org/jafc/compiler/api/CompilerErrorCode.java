package org.jafc.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during static analysis.
 * This decouples the test logic from the error messages.
 */
public enum CompilerErrorCode {
    // region Unsupported constructs
    /** A structure was defined without a name. */
    ANONYMOUS_STRUCT,
    /** An enumerated type was used. */
    ENUM_NOT_SUPPORTED,
    /** A function was declared inside another function's body. */
    NESTED_FUNCTION,
    // endregion

    // region Redefinitions
    /** A structure with the same name was already defined. */
    STRUCT_REDEFINED,
    // endregion

    // region Resolution Errors
    /** A typedef name does not resolve to a known structure. */
    UNRESOLVED_TYPEDEF,
    /** A structure was referenced by name but never defined. */
    UNRESOLVED_STRUCT,
    /** A type specifier carries a type tag that cannot be mapped to the object model. */
    UNKNOWN_TYPE,
    /** An identifier is neither a visible local nor a global. */
    UNDEFINED_IDENTIFIER,
    /** A called function is not declared. */
    UNDEFINED_FUNCTION,
    /** A structure has no member with the accessed name. */
    UNDEFINED_MEMBER,
    // endregion

    // region Type Errors
    /** The initializer of a global variable is not a compile-time constant. */
    NON_CONSTANT_INITIALIZER,
    /** An expression's type is not compatible with the required type. */
    TYPE_MISMATCH,
    /** A call passes a different number of arguments than the function declares. */
    ARGUMENT_COUNT_MISMATCH,
    /** An assignment or increment targets something that is not assignable. */
    NOT_AN_LVALUE,
    /** A return statement appears outside of any function. */
    RETURN_OUTSIDE_FUNCTION,
    // endregion

    // region Internal Errors
    /** A declaration node lacks its type or name where one is required. */
    MALFORMED_DECLARATION,
    /** An invariant of the analyzer was violated; indicates a bug in an earlier stage. */
    INTERNAL_ERROR
    // endregion
}
