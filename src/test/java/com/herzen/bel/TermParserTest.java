package com.herzen.bel;

import com.herzen.bel.config.BelParserProperties;
import com.herzen.bel.domain.Concept;
import com.herzen.bel.domain.FunctionKind;
import com.herzen.bel.domain.Terms.*;
import com.herzen.bel.parser.BelParser;
import com.herzen.bel.parser.error.AmbiguousConceptException;
import com.herzen.bel.parser.error.MalformedIdentifierException;
import com.herzen.bel.parser.error.MalformedTermException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TermParserTest {
    private final BelParser parser = new BelParser(new BelParserProperties());

    @Test
    void parsesConceptForms() {
        var plain = (EntityTerm) parser.parseTerm("p(HGNC:AKT1)");
        assertEquals(FunctionKind.PROTEIN, plain.function());
        assertEquals(Concept.of("HGNC", "AKT1"), plain.concept());

        var quoted = (EntityTerm) parser.parseTerm("a(CHEBI:\"nitric oxide\")");
        assertEquals("nitric oxide", quoted.concept().name());

        var obo = (EntityTerm) parser.parseTerm("bp(GO:0006915!apoptosis)");
        assertEquals("0006915", obo.concept().identifier());
        assertEquals("apoptosis", obo.concept().name());

        var longForm = (EntityTerm) parser.parseTerm("proteinAbundance(HGNC:AKT1)");
        assertEquals(plain, longForm);
    }

    @Test
    void rejectsMalformedIdentifiers() {
        assertThrows(MalformedIdentifierException.class, () -> parser.parseTerm("p(HGNC:)"));
        assertThrows(MalformedIdentifierException.class, () -> parser.parseTerm("p(AKT1)"));
        var error = assertThrows(MalformedIdentifierException.class, () -> parser.parseTerm("a(CHEBI:nitric oxide)"));
        assertTrue(error.token().startsWith("CHEBI:nitric"));
        assertTrue(error.span().start() >= 2);
        assertThrows(MalformedIdentifierException.class, () -> parser.parseTerm("a(CHEBI:\"nitric oxide)"));
        assertThrows(AmbiguousConceptException.class, () -> parser.parseTerm("p(HGNC:\"\")"));
    }

    @Test
    void permissiveModeAcceptsNakedNames() {
        BelParserProperties properties = new BelParserProperties();
        properties.setAllowNakedNames(true);
        var term = (EntityTerm) new BelParser(properties).parseTerm("p(AKT1)");
        assertEquals(Concept.of(Concept.DIRTY_NAMESPACE, "AKT1"), term.concept());
    }

    @Test
    void distinguishesNamedAndAdHocComplexes() {
        var named = parser.parseTerm("complex(SCOMP:\"AP-1 Complex\")");
        assertInstanceOf(EntityTerm.class, named);
        assertEquals(FunctionKind.COMPLEX, named.function());

        var adHoc = parser.parseTerm("complex(p(HGNC:FOS), p(HGNC:JUN))");
        var list = assertInstanceOf(ListTerm.class, adHoc);
        assertEquals(2, list.members().size());

        var nested = assertInstanceOf(ListTerm.class, parser.parseTerm("composite(complex(p(HGNC:A), p(HGNC:B)), a(CHEBI:lipid))"));
        assertInstanceOf(ListTerm.class, nested.members().get(0));
        assertThrows(MalformedTermException.class, () -> parser.parseTerm("complex()"));
    }

    @Test
    void parsesReactionGroupsInFixedOrder() {
        var reaction = assertInstanceOf(ReactionTerm.class,
                parser.parseTerm("rxn(reactants(a(CHEBI:superoxide)), products(a(CHEBI:\"hydrogen peroxide\"), a(CHEBI:oxygen)))"));
        assertEquals(1, reaction.reactants().size());
        assertEquals(2, reaction.products().size());

        var swapped = assertThrows(MalformedTermException.class,
                () -> parser.parseTerm("rxn(products(a(CHEBI:oxygen)), reactants(a(CHEBI:superoxide)))"));
        assertTrue(swapped.getMessage().contains("reactants"));

        var missing = assertThrows(MalformedTermException.class, () -> parser.parseTerm("rxn(reactants(a(CHEBI:superoxide)))"));
        assertTrue(missing.getMessage().contains("products"));

        assertThrows(MalformedTermException.class,
                () -> parser.parseTerm("rxn(reactants(a(CHEBI:a)), products(a(CHEBI:b)), products(a(CHEBI:c)))"));
    }

    @Test
    void parsesFusions() {
        var fusion = assertInstanceOf(FusionTerm.class,
                parser.parseTerm("p(fus(HGNC:BCR, \"p.1_426\", HGNC:JAK2, \"p.812_1132\"))"));
        assertEquals(Concept.of("HGNC", "BCR"), fusion.partner5p());
        assertEquals(new FusionRange("p", "812", "1132"), fusion.range3p());

        var unknown = assertInstanceOf(FusionTerm.class, parser.parseTerm("r(fus(HGNC:TMPRSS2, ?, HGNC:ERG, ?))"));
        assertTrue(unknown.range5p().isMissing());
        assertThrows(MalformedTermException.class, () -> parser.parseTerm("p(fus(HGNC:BCR, \"1-426\", HGNC:JAK2, ?))"));
    }

    @Test
    void rejectsStructuralMistakes() {
        assertThrows(MalformedTermException.class, () -> parser.parseTerm("q(HGNC:AKT1)"));
        assertThrows(MalformedTermException.class, () -> parser.parseTerm("p(pmod(Ph), HGNC:AKT1)"));
        assertThrows(MalformedTermException.class, () -> parser.parseTerm("p(HGNC:AKT1"));
        assertThrows(MalformedTermException.class, () -> parser.parseTerm("p(HGNC:AKT1, loc(GO:nucleus), pmod(Ph))"));
        assertThrows(MalformedTermException.class, () -> parser.parseTerm("p(HGNC:AKT1, glow(Ph))"));
    }
}
