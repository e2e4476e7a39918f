package com.herzen.bel.parser.error;

import com.herzen.bel.domain.SourceSpan;

public class MalformedIdentifierException extends BelSyntaxException {
    public MalformedIdentifierException(String message, SourceSpan span, String token) {
        super(BelErrorKind.MALFORMED_IDENTIFIER, message, span, token);
    }
}
