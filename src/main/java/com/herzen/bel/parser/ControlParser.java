package com.herzen.bel.parser;

import com.herzen.bel.domain.Statements.ControlMutation;
import com.herzen.bel.domain.Statements.ControlStatement;
import com.herzen.bel.parser.error.ControlStatementException;

import java.util.ArrayList;
import java.util.List;

import static com.herzen.bel.parser.BelLanguage.*;

public class ControlParser {

    public boolean isControlStatement(BelScanner scanner) {
        int mark = scanner.position();
        try {
            return scanner.consumeKeyword(SET) || scanner.consumeKeyword(UNSET);
        } finally {
            scanner.reset(mark);
        }
    }

    public ControlStatement parse(BelScanner scanner) {
        scanner.skipWhitespace();
        int start = scanner.position();
        ControlMutation mutation;
        if (scanner.consumeKeyword(SET)) {
            mutation = set(scanner);
        } else if (scanner.consumeKeyword(UNSET)) {
            mutation = unset(scanner);
        } else {
            throw new ControlStatementException("Expected SET or UNSET", scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        if (!scanner.atEnd()) {
            throw new ControlStatementException("Unexpected text after control statement", scanner.spanOfUpcoming(), scanner.rest());
        }
        return new ControlStatement(mutation, scanner.spanFrom(start), scanner.warnings());
    }

    private ControlMutation set(BelScanner scanner) {
        String key = key(scanner);
        if (DOCUMENT.equals(key)) {
            throw new ControlStatementException("SET DOCUMENT is only valid in a document header", scanner.spanFrom(0), key);
        }
        if (!scanner.consume('=')) {
            throw new ControlStatementException("Expected '=' after SET " + key, scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        if (scanner.peekIs('{')) {
            return ControlMutation.setList(key, values(scanner));
        }
        if (scanner.peekIs('"')) {
            return ControlMutation.set(key, scanner.readQuoted());
        }
        String value = scanner.rest();
        if (value.isEmpty()) {
            throw new ControlStatementException("Missing value for SET " + key, scanner.spanHere(), key);
        }
        scanner.reset(scanner.text().length());
        return ControlMutation.set(key, value);
    }

    private ControlMutation unset(BelScanner scanner) {
        if (scanner.consumeKeyword(ALL)) {
            return ControlMutation.unsetAll();
        }
        if (scanner.peekIs('{')) {
            return ControlMutation.unset(values(scanner));
        }
        return ControlMutation.unset(List.of(key(scanner)));
    }

    private String key(BelScanner scanner) {
        String key = scanner.readWordOrQuoted();
        if (key == null || key.isBlank()) {
            throw new ControlStatementException("Expected an annotation key", scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        return key;
    }

    private List<String> values(BelScanner scanner) {
        int start = scanner.position();
        scanner.consume('{');
        List<String> values = new ArrayList<>();
        if (!scanner.peekIs('}')) {
            do {
                String value = scanner.readWordOrQuoted();
                if (value == null) {
                    throw new ControlStatementException("Expected a quoted value in list", scanner.spanOfUpcoming(), scanner.upcomingToken());
                }
                values.add(value);
            } while (scanner.consume(','));
        }
        if (!scanner.consume('}')) {
            throw new ControlStatementException("Expected '}' to close the value list", scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        if (values.isEmpty()) {
            throw new ControlStatementException("Empty value list", scanner.spanFrom(start), "{}");
        }
        return values;
    }
}
