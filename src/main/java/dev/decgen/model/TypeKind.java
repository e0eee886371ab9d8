package dev.decgen.model;

/**
 * Classification of a type reference. Only what the generator needs to tell apart:
 * the context carrier, types with a literal zero value, and everything else.
 */
public enum TypeKind {
    CONTEXT,
    SCALAR,
    NAMED_SCALAR,
    REFERENCE,
    ARRAY,
    INTERFACE,
    ENUM,
    ERROR
}
