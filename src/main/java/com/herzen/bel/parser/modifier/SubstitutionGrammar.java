package com.herzen.bel.parser.modifier;

import com.herzen.bel.domain.FunctionKind;
import com.herzen.bel.domain.Modifiers.Variant;
import com.herzen.bel.parser.BelScanner;
import com.herzen.bel.parser.error.InvalidModifierException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

import static com.herzen.bel.parser.BelLanguage.DNA_NUCLEOTIDES;

public class SubstitutionGrammar extends AbstractModifierGrammar {
    private static final Logger log = LoggerFactory.getLogger(SubstitutionGrammar.class);

    @Override
    public Set<String> tags() {
        return Set.of("sub", "substitution");
    }

    @Override
    protected String name() {
        return "sub";
    }

    @Override
    public Variant parse(BelScanner scanner, FunctionKind function) {
        int start = scanner.position();
        open(scanner);
        String reference = residue(scanner, function);
        separator(scanner, "position");
        int position = position(scanner);
        separator(scanner, "substituted residue");
        String variant = residue(scanner, function);
        close(scanner, 3);

        String hgvs = function == FunctionKind.PROTEIN
                ? "p." + reference + position + variant
                : "c." + position + reference + ">" + variant;
        log.debug("Upgrading legacy substitution to var(\"{}\")", hgvs);
        scanner.warn("DEPRECATED_SUBSTITUTION", "sub() is deprecated, use var(\"" + hgvs + "\")", scanner.spanFrom(start));
        return new Variant(hgvs);
    }

    private String residue(BelScanner scanner, FunctionKind function) {
        scanner.skipWhitespace();
        int start = scanner.position();
        String token = word(scanner, function == FunctionKind.PROTEIN ? "an amino acid" : "a nucleotide");
        if (function == FunctionKind.PROTEIN) {
            return AminoAcids.resolve(token, scanner.spanFrom(start));
        }
        if (token.length() != 1 || !DNA_NUCLEOTIDES.contains(Character.toUpperCase(token.charAt(0)))) {
            throw new InvalidModifierException("Expected a nucleotide (A, C, G or T): " + token, scanner.spanFrom(start), token);
        }
        return token.toUpperCase();
    }
}
