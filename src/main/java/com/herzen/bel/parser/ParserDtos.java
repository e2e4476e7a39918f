package com.herzen.bel.parser;

import com.herzen.bel.domain.SourceSpan;
import com.herzen.bel.domain.Statements.BelStatement;
import com.herzen.bel.domain.Statements.ParseWarning;
import com.herzen.bel.parser.error.BelSyntaxException;

import java.util.List;
import java.util.Map;

public class ParserDtos {
    public record ParsedLine(int line, String text, BelStatement statement) {}

    public record DocumentParseResult(Map<String, String> metadata,
                                      List<ParsedLine> statements,
                                      List<ParseError> errors) {}

    public record ParseError(String code, String message, int line, SourceSpan span, String token) {
        public static ParseError from(BelSyntaxException e, int line) {
            return new ParseError(e.kind().name(), e.getMessage(), line, e.span(), e.token());
        }

        public static ParseError semantic(String code, String message, int line, String token) {
            return new ParseError(code, message, line, SourceSpan.UNKNOWN, token);
        }
    }

    public record LineWarning(String code, String message, int line, SourceSpan span) {
        public static LineWarning of(ParseWarning warning, int line) {
            return new LineWarning(warning.code(), warning.message(), line, warning.span());
        }
    }
}
