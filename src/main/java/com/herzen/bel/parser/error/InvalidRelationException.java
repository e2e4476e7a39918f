package com.herzen.bel.parser.error;

import com.herzen.bel.domain.SourceSpan;

public class InvalidRelationException extends BelSyntaxException {
    public InvalidRelationException(String message, SourceSpan span, String token) {
        super(BelErrorKind.INVALID_RELATION, message, span, token);
    }
}
