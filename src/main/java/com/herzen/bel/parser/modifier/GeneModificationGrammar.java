package com.herzen.bel.parser.modifier;

import com.herzen.bel.domain.Concept;
import com.herzen.bel.domain.FunctionKind;
import com.herzen.bel.domain.Modifiers.GeneModification;
import com.herzen.bel.parser.BelScanner;
import com.herzen.bel.parser.ConceptParser;
import com.herzen.bel.parser.error.InvalidModifierException;

import java.util.Set;

import static com.herzen.bel.parser.BelLanguage.GMOD_TYPES;

public class GeneModificationGrammar extends AbstractModifierGrammar {
    private final ConceptParser conceptParser;

    public GeneModificationGrammar(ConceptParser conceptParser) {
        this.conceptParser = conceptParser;
    }

    @Override
    public Set<String> tags() {
        return Set.of("gmod", "geneModification");
    }

    @Override
    protected String name() {
        return "gmod";
    }

    @Override
    public GeneModification parse(BelScanner scanner, FunctionKind function) {
        open(scanner);
        Concept type;
        if (conceptParser.atQualifiedConcept(scanner)) {
            type = conceptParser.parse(scanner);
        } else {
            scanner.skipWhitespace();
            int start = scanner.position();
            String token = word(scanner, "a modification type");
            String preferred = GMOD_TYPES.get(token);
            if (preferred == null) {
                throw new InvalidModifierException("Unknown gene modification: " + token, scanner.spanFrom(start), token);
            }
            type = Concept.belDefault(preferred);
        }
        close(scanner, 1);
        return new GeneModification(type);
    }
}
