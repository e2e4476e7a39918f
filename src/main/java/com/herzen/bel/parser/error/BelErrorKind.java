package com.herzen.bel.parser.error;

public enum BelErrorKind {
    MALFORMED_IDENTIFIER,
    MALFORMED_TERM,
    INVALID_MODIFIER,
    INVALID_VARIANT_NOTATION,
    INVALID_RELATION,
    AMBIGUOUS_CONCEPT,
    CONTROL_STATEMENT
}
