package com.herzen.bel.parser.error;

import com.herzen.bel.domain.SourceSpan;

public class AmbiguousConceptException extends BelSyntaxException {
    public AmbiguousConceptException(String message, SourceSpan span, String token) {
        super(BelErrorKind.AMBIGUOUS_CONCEPT, message, span, token);
    }
}
