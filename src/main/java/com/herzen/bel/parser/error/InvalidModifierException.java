package com.herzen.bel.parser.error;

import com.herzen.bel.domain.SourceSpan;

public class InvalidModifierException extends BelSyntaxException {
    public InvalidModifierException(String message, SourceSpan span, String token) {
        super(BelErrorKind.INVALID_MODIFIER, message, span, token);
    }
}
