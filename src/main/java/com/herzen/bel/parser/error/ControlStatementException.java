package com.herzen.bel.parser.error;

import com.herzen.bel.domain.SourceSpan;

public class ControlStatementException extends BelSyntaxException {
    public ControlStatementException(String message, SourceSpan span, String token) {
        super(BelErrorKind.CONTROL_STATEMENT, message, span, token);
    }
}
