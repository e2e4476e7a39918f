package com.herzen.bel.parser.modifier;

import com.herzen.bel.domain.Concept;
import com.herzen.bel.domain.FunctionKind;
import com.herzen.bel.domain.Modifiers.ProteinModification;
import com.herzen.bel.domain.SourceSpan;
import com.herzen.bel.parser.BelScanner;
import com.herzen.bel.parser.ConceptParser;
import com.herzen.bel.parser.error.InvalidModifierException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

import static com.herzen.bel.parser.BelLanguage.*;

public class ProteinModificationGrammar extends AbstractModifierGrammar {
    private static final Logger log = LoggerFactory.getLogger(ProteinModificationGrammar.class);

    private final ConceptParser conceptParser;

    public ProteinModificationGrammar(ConceptParser conceptParser) {
        this.conceptParser = conceptParser;
    }

    @Override
    public Set<String> tags() {
        return Set.of("pmod", "proteinModification");
    }

    @Override
    protected String name() {
        return "pmod";
    }

    @Override
    public ProteinModification parse(BelScanner scanner, FunctionKind function) {
        open(scanner);
        Concept type = type(scanner);
        String code = null;
        Integer position = null;
        if (scanner.consume(',')) {
            code = code(scanner);
            if (scanner.consume(',')) {
                position = position(scanner);
            }
        }
        close(scanner, 3);
        return new ProteinModification(type, code, position);
    }

    private Concept type(BelScanner scanner) {
        if (conceptParser.atQualifiedConcept(scanner)) {
            return conceptParser.parse(scanner);
        }
        scanner.skipWhitespace();
        int start = scanner.position();
        String token = word(scanner, "a modification type");
        String preferred = PMOD_TYPES.get(token);
        if (preferred != null) return Concept.belDefault(preferred);

        String legacy = PMOD_LEGACY.get(token);
        if (legacy != null) {
            log.debug("Upgrading legacy pmod code {} to {}", token, legacy);
            scanner.warn("LEGACY_PMOD", "Single-letter modification '" + token + "' upgraded to " + legacy, scanner.spanFrom(start));
            return Concept.belDefault(legacy);
        }
        throw new InvalidModifierException("Unknown protein modification: " + token, scanner.spanFrom(start), token);
    }

    private String code(BelScanner scanner) {
        scanner.skipWhitespace();
        int start = scanner.position();
        String token = scanner.readWord();
        SourceSpan span = scanner.spanFrom(start);
        if (token == null) {
            throw new InvalidModifierException("pmod expects an amino acid code", scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        if (!AminoAcids.isKnown(token)) {
            throw new InvalidModifierException("Unknown amino acid code in pmod: " + token, span, token);
        }
        return AminoAcids.resolve(token, span);
    }
}
