package com.herzen.bel;

import com.herzen.bel.config.BelParserProperties;
import com.herzen.bel.domain.Concept;
import com.herzen.bel.domain.Modifiers.Fragment;
import com.herzen.bel.domain.Modifiers.GeneModification;
import com.herzen.bel.domain.Modifiers.ProteinModification;
import com.herzen.bel.domain.Modifiers.Variant;
import com.herzen.bel.domain.Terms.EntityTerm;
import com.herzen.bel.parser.BelParser;
import com.herzen.bel.parser.error.BelErrorKind;
import com.herzen.bel.parser.error.BelSyntaxException;
import com.herzen.bel.parser.error.InvalidModifierException;
import com.herzen.bel.parser.error.InvalidVariantNotationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModifierGrammarTest {
    private final BelParser parser = new BelParser(new BelParserProperties());

    private EntityTerm term(String text) {
        return (EntityTerm) parser.parseTerm(text);
    }

    @Test
    void pmodAcceptsOneToThreeArguments() {
        var typeOnly = (ProteinModification) term("p(HGNC:AKT1, pmod(Ph))").variants().get(0);
        var withCode = (ProteinModification) term("p(HGNC:AKT1, pmod(Ph, Ser))").variants().get(0);
        var full = (ProteinModification) term("p(HGNC:AKT1, pmod(Ph, Ser, 473))").variants().get(0);

        assertEquals(1, typeOnly.resolvedFields());
        assertEquals(2, withCode.resolvedFields());
        assertEquals(3, full.resolvedFields());
        assertEquals("Ser", full.code());
        assertEquals(473, full.position());
    }

    @Test
    void pmodRejectsFourthArgument() {
        var error = assertThrows(InvalidModifierException.class, () -> term("p(HGNC:AKT1, pmod(Ph, Ser, 473, extra))"));
        assertEquals(BelErrorKind.INVALID_MODIFIER, error.kind());
    }

    @Test
    void pmodNormalizesSynonymsLegacyCodesAndSingleLetterResidues() {
        var synonym = (ProteinModification) term("p(HGNC:AKT1, pmod(phosphorylation, S, 473))").variants().get(0);
        assertEquals(Concept.belDefault("Ph"), synonym.type());
        assertEquals("Ser", synonym.code());

        var legacy = (ProteinModification) term("p(HGNC:AKT1, pmod(P, S, 473))").variants().get(0);
        assertEquals(Concept.belDefault("Ph"), legacy.type());

        var namespaced = (ProteinModification) term("p(HGNC:AKT1, pmod(MOD:PhosRes))").variants().get(0);
        assertEquals(Concept.of("MOD", "PhosRes"), namespaced.type());
    }

    @Test
    void pmodRejectsBadContent() {
        assertThrows(InvalidModifierException.class, () -> term("p(HGNC:AKT1, pmod(Glowing))"));
        assertThrows(InvalidModifierException.class, () -> term("p(HGNC:AKT1, pmod(Ph, Zzz))"));
        assertThrows(InvalidModifierException.class, () -> term("p(HGNC:AKT1, pmod(Ph, Ser, 0))"));
    }

    @Test
    void legacySubstitutionBecomesHgvsVariant() {
        assertEquals(new Variant("p.Arg275His"), term("p(HGNC:TP53, sub(R, 275, H))").variants().get(0));
        assertEquals(new Variant("c.308G>A"), term("g(HGNC:TNF, sub(G, 308, A))").variants().get(0));
    }

    @Test
    void truncationBecomesStopVariant() {
        assertEquals(new Variant("p.40*"), term("p(HGNC:AKT1, trunc(40))").variants().get(0));
    }

    @Test
    void variantStringIsCheckedAgainstHgvs() {
        assertEquals(new Variant("p.Phe508del"), term("p(HGNC:CFTR, var(\"p.Phe508del\"))").variants().get(0));
        assertEquals(new Variant("="), term("p(HGNC:CFTR, var(=))").variants().get(0));
        assertThrows(InvalidVariantNotationException.class, () -> term("p(HGNC:CFTR, var(\"p.Phe\"))"));
    }

    @Test
    void fragmentsAndGeneModifications() {
        assertEquals(new Fragment("5", "20", null), term("p(HGNC:APP, frag(\"5_20\"))").variants().get(0));
        assertEquals(new Fragment("1", "*", "55kD"), term("p(HGNC:APP, frag(\"1_*\", \"55kD\"))").variants().get(0));
        assertTrue(((Fragment) term("p(HGNC:APP, frag(?))").variants().get(0)).isMissing());
        assertThrows(InvalidModifierException.class, () -> term("p(HGNC:APP, frag(\"20_5\"))"));

        assertEquals(new GeneModification(Concept.belDefault("Me")), term("g(HGNC:MGMT, gmod(Me))").variants().get(0));
    }

    @Test
    void modifierNotAllowedForFunctionIsAnInvalidModifier() {
        BelSyntaxException error = assertThrows(BelSyntaxException.class, () -> term("g(HGNC:AKT1, pmod(Ph))"));
        assertEquals(BelErrorKind.INVALID_MODIFIER, error.kind());
        assertThrows(InvalidModifierException.class, () -> term("r(HGNC:AKT1, frag(\"1_2\"))"));
        assertThrows(InvalidModifierException.class, () -> term("a(CHEBI:water, var(\"p.Gly1Ala\"))"));
    }

    @Test
    void oversizedNumbersAreModifierErrors() {
        var fragment = assertThrows(InvalidModifierException.class, () -> term("p(HGNC:APP, frag(\"99999999999999999999_5\"))"));
        assertEquals("99999999999999999999_5", fragment.token());
        assertEquals(17, fragment.span().start());
        assertEquals(new Fragment("5", "99999999999999999999", null),
                term("p(HGNC:APP, frag(\"5_99999999999999999999\"))").variants().get(0));

        var position = assertThrows(InvalidModifierException.class, () -> term("p(HGNC:AKT1, pmod(Ph, Ser, 99999999999))"));
        assertEquals(BelErrorKind.INVALID_MODIFIER, position.kind());
        assertEquals("99999999999", position.token());
        assertThrows(InvalidModifierException.class, () -> term("p(HGNC:TP53, sub(R, 99999999999, H))"));
    }

    @Test
    void pmodPlaceholderCodeIsModifierError() {
        var error = assertThrows(InvalidModifierException.class, () -> term("p(HGNC:AKT1, pmod(Ph, X, 473))"));
        assertEquals(BelErrorKind.INVALID_MODIFIER, error.kind());
        assertEquals("X", error.token());
    }
}
