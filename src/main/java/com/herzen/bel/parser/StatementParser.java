package com.herzen.bel.parser;

import com.herzen.bel.domain.FunctionKind;
import com.herzen.bel.domain.Relation;
import com.herzen.bel.domain.Statements.*;
import com.herzen.bel.parser.error.InvalidRelationException;
import com.herzen.bel.parser.error.MalformedTermException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.herzen.bel.parser.BelLanguage.LIST;

public class StatementParser {
    private static final Set<FunctionKind> TRANSCRIPTS = Set.of(FunctionKind.RNA, FunctionKind.MIRNA);

    private final TermParser termParser;
    private final ControlParser controlParser;
    private final boolean allowNested;

    public StatementParser(TermParser termParser, ControlParser controlParser, boolean allowNested) {
        this.termParser = termParser;
        this.controlParser = controlParser;
        this.allowNested = allowNested;
    }

    public BelStatement parse(String text) {
        return parse(new BelScanner(text));
    }

    public BelStatement parse(BelScanner scanner) {
        if (controlParser.isControlStatement(scanner)) {
            return controlParser.parse(scanner);
        }
        scanner.skipWhitespace();
        int start = scanner.position();
        Participant subject = termParser.parseParticipant(scanner);
        if (scanner.atEnd()) {
            return new TermStatement(subject, scanner.spanFrom(start), scanner.warnings());
        }

        Relation relation = relation(scanner);
        BelStatement statement;
        if (relation.isListRelation()) {
            statement = new ListStatement(subject, relation.expanded(), list(scanner, relation),
                    scanner.spanFrom(start), scanner.warnings());
        } else if (scanner.peekIs('(')) {
            statement = nested(scanner, subject, relation, start);
        } else {
            Participant object = termParser.parseParticipant(scanner);
            checkTypes(scanner, subject, relation, object, start);
            statement = new RelationStatement(subject, relation, object, scanner.spanFrom(start), scanner.warnings());
        }
        if (!scanner.atEnd()) {
            throw new MalformedTermException("Unexpected text after statement", scanner.spanOfUpcoming(), scanner.rest());
        }
        return statement;
    }

    private NestedStatement nested(BelScanner scanner, Participant subject, Relation relation, int start) {
        if (!allowNested) {
            throw new InvalidRelationException("Nested statements are not enabled: " + relation.belLabel() + " (...)",
                    scanner.spanOfUpcoming(), "(");
        }
        scanner.consume('(');
        int innerStart = scanner.position();
        Participant innerSubject = termParser.parseParticipant(scanner);
        Relation innerRelation = relation(scanner);
        if (innerRelation.isListRelation() || scanner.peekIs('(')) {
            throw new InvalidRelationException("Nested statements cannot contain lists or further nesting",
                    scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        Participant innerObject = termParser.parseParticipant(scanner);
        checkTypes(scanner, innerSubject, innerRelation, innerObject, innerStart);
        if (!scanner.consume(')')) {
            throw new MalformedTermException("Expected ')' to close the nested statement", scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        RelationStatement inner = new RelationStatement(innerSubject, innerRelation, innerObject,
                scanner.spanFrom(innerStart), List.of());
        return new NestedStatement(subject, relation, inner, scanner.spanFrom(start), scanner.warnings());
    }

    private List<Participant> list(BelScanner scanner, Relation relation) {
        scanner.skipWhitespace();
        int start = scanner.position();
        if (!scanner.consumeKeyword(LIST) || !scanner.consume('(')) {
            throw new MalformedTermException(relation.belLabel() + " expects list(...)", scanner.spanFrom(start), scanner.upcomingToken());
        }
        List<Participant> objects = new ArrayList<>();
        do {
            objects.add(termParser.parseParticipant(scanner));
        } while (scanner.consume(','));
        if (!scanner.consume(')')) {
            throw new MalformedTermException("Expected ')' to close list()", scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        return objects;
    }

    private Relation relation(BelScanner scanner) {
        scanner.skipWhitespace();
        int start = scanner.position();
        for (String symbol : Relation.symbols()) {
            if (scanner.consume(symbol)) {
                return Relation.fromToken(symbol).orElseThrow();
            }
        }
        String word = scanner.readWord();
        if (word == null) {
            throw new InvalidRelationException("Expected a relation", scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        return Relation.fromToken(word)
                .orElseThrow(() -> new InvalidRelationException("Unknown relation: " + word, scanner.spanFrom(start), word));
    }

    private void checkTypes(BelScanner scanner, Participant subject, Relation relation, Participant object, int start) {
        FunctionKind from = subject.term().function();
        FunctionKind to = object.term().function();
        boolean valid = switch (relation) {
            case TRANSCRIBED_TO -> from == FunctionKind.GENE && TRANSCRIPTS.contains(to);
            case TRANSLATED_TO -> TRANSCRIPTS.contains(from) && to == FunctionKind.PROTEIN;
            default -> true;
        };
        if (!valid) {
            throw new InvalidRelationException(relation.belLabel() + " cannot connect " + from.belTag() + "() to " + to.belTag() + "()",
                    scanner.spanFrom(start), relation.belLabel());
        }
    }
}
