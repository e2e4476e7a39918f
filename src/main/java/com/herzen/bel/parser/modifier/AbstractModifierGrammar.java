package com.herzen.bel.parser.modifier;

import com.herzen.bel.parser.BelScanner;
import com.herzen.bel.parser.error.InvalidModifierException;

abstract class AbstractModifierGrammar implements ModifierGrammar {
    protected abstract String name();

    protected void open(BelScanner scanner) {
        if (!scanner.consume('(')) {
            throw new InvalidModifierException(name() + " expects '('", scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
    }

    protected void close(BelScanner scanner, int maxArguments) {
        if (scanner.peekIs(',')) {
            throw new InvalidModifierException(name() + " takes at most " + maxArguments + " argument" + (maxArguments == 1 ? "" : "s"),
                    scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        if (!scanner.consume(')')) {
            throw new InvalidModifierException("Expected ')' to close " + name(), scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
    }

    protected void separator(BelScanner scanner, String expected) {
        if (!scanner.consume(',')) {
            throw new InvalidModifierException(name() + " is missing its " + expected, scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
    }

    protected int position(BelScanner scanner) {
        scanner.skipWhitespace();
        int start = scanner.position();
        String digits = scanner.readWhile(Character::isDigit);
        if (digits == null) {
            throw new InvalidModifierException(name() + " position must be a positive integer", scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        int value;
        try {
            value = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new InvalidModifierException(name() + " position is out of range: " + digits, scanner.spanFrom(start), digits);
        }
        if (value <= 0) {
            throw new InvalidModifierException(name() + " position must be a positive integer", scanner.spanFrom(start), digits);
        }
        return value;
    }

    protected String word(BelScanner scanner, String expected) {
        String word = scanner.readWordOrQuoted();
        if (word == null || word.isEmpty()) {
            throw new InvalidModifierException(name() + " expects " + expected, scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        return word;
    }
}
