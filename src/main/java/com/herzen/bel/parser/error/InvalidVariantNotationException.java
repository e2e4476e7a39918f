package com.herzen.bel.parser.error;

import com.herzen.bel.domain.SourceSpan;

public class InvalidVariantNotationException extends BelSyntaxException {
    public InvalidVariantNotationException(String message, SourceSpan span, String token) {
        super(BelErrorKind.INVALID_VARIANT_NOTATION, message, span, token);
    }
}
