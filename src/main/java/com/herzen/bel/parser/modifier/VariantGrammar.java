package com.herzen.bel.parser.modifier;

import com.herzen.bel.domain.FunctionKind;
import com.herzen.bel.domain.Modifiers.Variant;
import com.herzen.bel.parser.BelScanner;
import com.herzen.bel.parser.error.InvalidModifierException;

import java.util.Set;

public class VariantGrammar extends AbstractModifierGrammar {
    private static final String UNQUOTED = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789._*=?>+-";

    @Override
    public Set<String> tags() {
        return Set.of("var", "variant");
    }

    @Override
    protected String name() {
        return "var";
    }

    @Override
    public Variant parse(BelScanner scanner, FunctionKind function) {
        open(scanner);
        scanner.skipWhitespace();
        int start = scanner.position();
        String notation;
        int notationOffset;
        if (scanner.peekRaw() == '"') {
            notationOffset = start + 1;
            notation = scanner.readQuoted();
        } else {
            notationOffset = start;
            notation = scanner.readWhile(c -> UNQUOTED.indexOf(c) >= 0);
        }
        if (notation == null || notation.isEmpty()) {
            throw new InvalidModifierException("var expects an HGVS string", scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        HgvsParser.parse(notation, notationOffset + scanner.offset());
        close(scanner, 1);
        return new Variant(notation);
    }
}
