package com.herzen.bel.parser;

import com.herzen.bel.domain.Concept;
import com.herzen.bel.domain.SourceSpan;
import com.herzen.bel.parser.error.AmbiguousConceptException;
import com.herzen.bel.parser.error.MalformedIdentifierException;

import java.util.function.IntPredicate;

public class ConceptParser {
    private static final IntPredicate NAMESPACE_CHAR = c -> BelScanner.isWordChar(c) || c == '.' || c == '-';
    private static final IntPredicate NAME_CHAR = c -> BelScanner.isWordChar(c) || c == '.' || c == '-' || c == '+' || c == '\'';

    private final boolean allowNakedNames;

    public ConceptParser(boolean allowNakedNames) {
        this.allowNakedNames = allowNakedNames;
    }

    public boolean atQualifiedConcept(BelScanner scanner) {
        int mark = scanner.position();
        try {
            scanner.skipWhitespace();
            return scanner.readWhile(NAMESPACE_CHAR) != null && scanner.peekRaw() == ':';
        } finally {
            scanner.reset(mark);
        }
    }

    public Concept parse(BelScanner scanner) {
        scanner.skipWhitespace();
        int start = scanner.position();
        if (scanner.peekRaw() == '"') {
            return naked(scanner, scanner.readQuoted(), start);
        }
        String namespace = scanner.readWhile(NAMESPACE_CHAR);
        if (namespace == null) {
            throw new MalformedIdentifierException("Expected NAMESPACE:name", scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        if (scanner.peekRaw() != ':') {
            rejectTrailing(scanner, start);
            return naked(scanner, namespace, start);
        }
        scanner.reset(scanner.position() + 1);

        String first = part(scanner);
        if (first == null) {
            throw new MalformedIdentifierException("Namespace " + namespace + " is not followed by a name",
                    scanner.spanFrom(start), namespace + ":");
        }
        String identifier = null;
        String name = first;
        if (scanner.peekRaw() == '!') {
            scanner.reset(scanner.position() + 1);
            identifier = first;
            name = part(scanner);
            if (name == null) {
                throw new MalformedIdentifierException("Expected a name after '!'", scanner.spanFrom(start),
                        scanner.text().substring(start, scanner.position()));
            }
        }
        rejectTrailing(scanner, start);
        if (name.isBlank() && (identifier == null || identifier.isBlank())) {
            throw new AmbiguousConceptException("Concept in namespace " + namespace + " has neither name nor identifier",
                    scanner.spanFrom(start), scanner.text().substring(start, scanner.position()));
        }
        return new Concept(namespace, name, identifier);
    }

    private String part(BelScanner scanner) {
        if (scanner.peekRaw() == '"') return scanner.readQuoted();
        return scanner.readWhile(NAME_CHAR);
    }

    private void rejectTrailing(BelScanner scanner, int start) {
        int end = scanner.position();
        int next = scanner.peekRaw();
        if (next < 0 || next == ',' || next == ')') return;
        if (Character.isWhitespace(next)) {
            int following = scanner.peek();
            scanner.reset(end);
            if (following < 0 || !(BelScanner.isWordChar(following) || following == '"')) return;
            scanner.peek();
            String token = scanner.text().substring(start, scanner.position()) + scanner.upcomingToken();
            scanner.reset(end);
            throw new MalformedIdentifierException("Names containing whitespace must be quoted",
                    new SourceSpan(start + scanner.offset(), start + token.length() + scanner.offset()), token);
        }
        throw new MalformedIdentifierException("Unexpected character '" + (char) next + "' in name, quote the name",
                scanner.spanFrom(start), scanner.text().substring(start, end + 1));
    }

    private Concept naked(BelScanner scanner, String name, int start) {
        if (!allowNakedNames) {
            throw new MalformedIdentifierException("Missing namespace for '" + name + "'", scanner.spanFrom(start), name);
        }
        if (name == null || name.isBlank()) {
            throw new AmbiguousConceptException("Empty name", scanner.spanFrom(start), name);
        }
        scanner.warn("NAKED_NAME", "Name '" + name + "' has no namespace", scanner.spanFrom(start));
        return Concept.of(Concept.DIRTY_NAMESPACE, name);
    }
}
