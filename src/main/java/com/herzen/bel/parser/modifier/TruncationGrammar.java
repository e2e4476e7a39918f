package com.herzen.bel.parser.modifier;

import com.herzen.bel.domain.FunctionKind;
import com.herzen.bel.domain.Modifiers.Variant;
import com.herzen.bel.parser.BelScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

public class TruncationGrammar extends AbstractModifierGrammar {
    private static final Logger log = LoggerFactory.getLogger(TruncationGrammar.class);

    @Override
    public Set<String> tags() {
        return Set.of("trunc", "truncation");
    }

    @Override
    protected String name() {
        return "trunc";
    }

    @Override
    public Variant parse(BelScanner scanner, FunctionKind function) {
        int start = scanner.position();
        open(scanner);
        int position = position(scanner);
        close(scanner, 1);
        String hgvs = "p." + position + "*";
        log.warn("trunc({}) has no reference amino acid, upgraded to var(\"{}\")", position, hgvs);
        scanner.warn("DEPRECATED_TRUNCATION", "trunc() lacks the reference amino acid, upgraded to var(\"" + hgvs + "\")",
                scanner.spanFrom(start));
        return new Variant(hgvs);
    }
}
