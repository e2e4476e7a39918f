package com.herzen.bel.parser.error;

import com.herzen.bel.domain.SourceSpan;

public class MalformedTermException extends BelSyntaxException {
    public MalformedTermException(String message, SourceSpan span, String token) {
        super(BelErrorKind.MALFORMED_TERM, message, span, token);
    }
}
