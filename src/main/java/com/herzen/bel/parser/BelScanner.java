package com.herzen.bel.parser;

import com.herzen.bel.domain.SourceSpan;
import com.herzen.bel.domain.Statements.ParseWarning;
import com.herzen.bel.parser.error.MalformedIdentifierException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;

public class BelScanner {
    private final String text;
    private final int offset;
    private int position;
    private int depth;
    private final List<ParseWarning> warnings = new ArrayList<>();

    public BelScanner(String text) {
        this(text, 0);
    }

    public BelScanner(String text, int offset) {
        this.text = text;
        this.offset = offset;
    }

    public static boolean isWordChar(int c) {
        return c == '_' || (c < 128 && Character.isLetterOrDigit(c));
    }

    public String text() {
        return text;
    }

    public int position() {
        return position;
    }

    public void reset(int position) {
        this.position = position;
    }

    public void skipWhitespace() {
        while (position < text.length() && Character.isWhitespace(text.charAt(position))) position++;
    }

    public boolean atEnd() {
        skipWhitespace();
        return position >= text.length();
    }

    public int peek() {
        skipWhitespace();
        return position < text.length() ? text.charAt(position) : -1;
    }

    public boolean peekIs(char c) {
        return peek() == c;
    }

    public int peekRaw() {
        return position < text.length() ? text.charAt(position) : -1;
    }

    public boolean consume(char c) {
        if (peek() != c) return false;
        position++;
        return true;
    }

    public boolean consume(String literal) {
        skipWhitespace();
        if (!text.startsWith(literal, position)) return false;
        position += literal.length();
        return true;
    }

    public boolean consumeKeyword(String keyword) {
        skipWhitespace();
        if (!text.startsWith(keyword, position)) return false;
        int end = position + keyword.length();
        if (end < text.length() && isWordChar(text.charAt(end))) return false;
        position = end;
        return true;
    }

    public String readWord() {
        skipWhitespace();
        return readWhile(BelScanner::isWordChar);
    }

    public String peekWord() {
        int mark = position;
        String word = readWord();
        position = mark;
        return word;
    }

    public boolean peekFunctionCall() {
        int mark = position;
        try {
            return readWord() != null && peek() == '(';
        } finally {
            position = mark;
        }
    }

    /**
     * Reads a double-quoted string with {@code \"} and {@code \\} escapes. Returns null when the next char
     * is not a quote.
     */
    public String readQuoted() {
        if (peek() != '"') return null;
        int start = position++;
        StringBuilder sb = new StringBuilder();
        while (position < text.length()) {
            char c = text.charAt(position++);
            if (c == '"') return sb.toString();
            if (c == '\\' && position < text.length()) {
                sb.append(text.charAt(position++));
            } else {
                sb.append(c);
            }
        }
        throw new MalformedIdentifierException("Unterminated quoted string", spanFrom(start), text.substring(start));
    }

    public String readWordOrQuoted() {
        String quoted = readQuoted();
        return quoted != null ? quoted : readWord();
    }

    /** Reads chars at the cursor (no whitespace skipping) while they match; null when none do. */
    public String readWhile(IntPredicate predicate) {
        int start = position;
        while (position < text.length() && predicate.test(text.charAt(position))) position++;
        return position == start ? null : text.substring(start, position);
    }

    public String rest() {
        skipWhitespace();
        return text.substring(position).trim();
    }

    public String upcomingToken() {
        skipWhitespace();
        int end = position;
        while (end < text.length() && !Character.isWhitespace(text.charAt(end))
                && ",()".indexOf(text.charAt(end)) < 0) end++;
        return end == position && position < text.length() ? text.substring(position, position + 1) : text.substring(position, end);
    }

    public SourceSpan spanFrom(int start) {
        return new SourceSpan(start + offset, Math.max(start + 1, position) + offset);
    }

    public SourceSpan spanHere() {
        skipWhitespace();
        return SourceSpan.at(position + offset);
    }

    public SourceSpan spanOfUpcoming() {
        skipWhitespace();
        return new SourceSpan(position + offset, position + Math.max(1, upcomingToken().length()) + offset);
    }

    public int offset() {
        return offset;
    }

    public int enter() {
        return ++depth;
    }

    public void leave() {
        depth--;
    }

    public void warn(String code, String message, SourceSpan span) {
        warnings.add(new ParseWarning(code, message, span));
    }

    public List<ParseWarning> warnings() {
        return List.copyOf(warnings);
    }
}
