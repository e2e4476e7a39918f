package com.herzen.bel.parser.error;

import com.herzen.bel.domain.SourceSpan;

/**
 * Base of all statement parse failures. Carries the offending span of the statement and, where one was
 * matched, the token the parser stopped at.
 */
public abstract class BelSyntaxException extends RuntimeException {
    private final BelErrorKind kind;
    private final SourceSpan span;
    private final String token;

    protected BelSyntaxException(BelErrorKind kind, String message, SourceSpan span, String token) {
        super(message);
        this.kind = kind;
        this.span = span == null ? SourceSpan.UNKNOWN : span;
        this.token = token;
    }

    public BelErrorKind kind() {
        return kind;
    }

    public SourceSpan span() {
        return span;
    }

    public String token() {
        return token;
    }

    @Override
    public String toString() {
        return kind + " at [" + span.start() + "," + span.end() + ")" + (token == null ? "" : " '" + token + "'") + ": " + getMessage();
    }
}
