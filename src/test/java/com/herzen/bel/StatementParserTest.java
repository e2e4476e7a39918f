package com.herzen.bel;

import com.herzen.bel.config.BelParserProperties;
import com.herzen.bel.domain.Concept;
import com.herzen.bel.domain.FunctionKind;
import com.herzen.bel.domain.Relation;
import com.herzen.bel.domain.Statements.*;
import com.herzen.bel.domain.Terms.EntityTerm;
import com.herzen.bel.parser.BelParser;
import com.herzen.bel.parser.error.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatementParserTest {
    private final BelParser parser = new BelParser(new BelParserProperties());

    @Test
    void parsesSymbolicRelation() {
        var statement = assertInstanceOf(RelationStatement.class, parser.parseStatement("p(HGNC:1234) -> p(HGNC:1235)"));
        assertEquals(EntityTerm.of(FunctionKind.PROTEIN, Concept.of("HGNC", "1234")), statement.subject().term());
        assertEquals(Relation.INCREASES, statement.relation());
        assertEquals(EntityTerm.of(FunctionKind.PROTEIN, Concept.of("HGNC", "1235")), statement.object().term());
        assertEquals(0, statement.span().start());
    }

    @Test
    void relationKeywordsAndSymbolsAgree() {
        var word = (RelationStatement) parser.parseStatement("p(HGNC:A) directlyDecreases p(HGNC:B)");
        var symbol = (RelationStatement) parser.parseStatement("p(HGNC:A) =| p(HGNC:B)");
        assertEquals(Relation.DIRECTLY_DECREASES, word.relation());
        assertEquals(word.relation(), symbol.relation());
        assertEquals(Relation.ASSOCIATION, ((RelationStatement) parser.parseStatement("p(HGNC:A) -- p(HGNC:B)")).relation());
    }

    @Test
    void keepsSubjectAndObjectOrder() {
        var forward = (RelationStatement) parser.parseStatement("p(HGNC:A) increases p(HGNC:B)");
        var backward = (RelationStatement) parser.parseStatement("p(HGNC:B) increases p(HGNC:A)");
        assertEquals(forward.subject(), backward.object());
        assertEquals(forward.object(), backward.subject());
    }

    @Test
    void parsesBareTerm() {
        var statement = assertInstanceOf(TermStatement.class, parser.parseStatement("  p(HGNC:AKT1, pmod(Ph))  "));
        assertEquals(FunctionKind.PROTEIN, statement.term().term().function());
    }

    @Test
    void distinguishesRelationErrorsFromTermErrors() {
        var relation = assertThrows(InvalidRelationException.class, () -> parser.parseStatement("p(HGNC:A) activates p(HGNC:B)"));
        assertEquals(BelErrorKind.INVALID_RELATION, relation.kind());
        assertEquals("activates", relation.token());
        assertEquals(10, relation.span().start());

        var term = assertThrows(MalformedTermException.class, () -> parser.parseStatement("p(HGNC:A) increases q(HGNC:B)"));
        assertEquals(BelErrorKind.MALFORMED_TERM, term.kind());

        assertThrows(MalformedTermException.class, () -> parser.parseStatement("p(HGNC:A) increases p(HGNC:B) p(HGNC:C)"));
    }

    @Test
    void wrapsTermsInProcessModifiers() {
        var statement = (RelationStatement) parser.parseStatement(
                "act(p(HGNC:AKT1), ma(kin)) -> tloc(p(HGNC:FOXO1), fromLoc(GO:nucleus), toLoc(GO:cytoplasm))");
        ProcessModifier subject = statement.subject().modifier();
        assertEquals(ProcessKind.ACTIVITY, subject.kind());
        assertEquals(Concept.belDefault("kin"), subject.effect());
        ProcessModifier object = statement.object().modifier();
        assertEquals(ProcessKind.TRANSLOCATION, object.kind());
        assertEquals(Concept.of("GO", "nucleus"), object.fromLocation());
        assertEquals(Concept.of("GO", "cytoplasm"), object.toLocation());

        var degraded = (RelationStatement) parser.parseStatement("p(HGNC:A, loc(GO:cytoplasm)) -> deg(p(HGNC:B))");
        assertEquals(Concept.of("GO", "cytoplasm"), degraded.subject().location());
        assertEquals(ProcessKind.DEGRADATION, degraded.object().modifier().kind());

        assertThrows(MalformedTermException.class, () -> parser.parseStatement("tloc(p(HGNC:A)) -> p(HGNC:B)"));
    }

    @Test
    void upgradesLegacyActivity() {
        var legacy = (RelationStatement) parser.parseStatement("kin(p(HGNC:AKT1)) -> p(HGNC:B)");
        assertEquals(ProcessModifier.activity(Concept.belDefault("kin")), legacy.subject().modifier());
        assertTrue(legacy.warnings().stream().anyMatch(w -> w.code().equals("LEGACY_ACTIVITY")));
    }

    @Test
    void expandsListRelations() {
        var statement = assertInstanceOf(ListStatement.class,
                parser.parseStatement("p(FPLX:AKT) hasMembers list(p(HGNC:AKT1), p(HGNC:AKT2), p(HGNC:AKT3))"));
        assertEquals(Relation.HAS_MEMBER, statement.relation());
        assertEquals(3, statement.objects().size());
        assertThrows(MalformedTermException.class, () -> parser.parseStatement("p(FPLX:AKT) hasMembers p(HGNC:AKT1)"));
    }

    @Test
    void nestedStatementsNeedToBeEnabled() {
        String text = "p(HGNC:A) -> (p(HGNC:B) -| p(HGNC:C))";
        assertThrows(InvalidRelationException.class, () -> parser.parseStatement(text));

        BelParserProperties properties = new BelParserProperties();
        properties.setAllowNested(true);
        var nested = assertInstanceOf(NestedStatement.class, new BelParser(properties).parseStatement(text));
        assertEquals(Relation.INCREASES, nested.relation());
        assertEquals(Relation.DECREASES, nested.object().relation());
    }

    @Test
    void checksTranscriptionAndTranslationEndpoints() {
        assertInstanceOf(RelationStatement.class, parser.parseStatement("g(HGNC:AKT1) :> r(HGNC:AKT1)"));
        assertInstanceOf(RelationStatement.class, parser.parseStatement("r(HGNC:AKT1) translatedTo p(HGNC:AKT1)"));
        assertThrows(InvalidRelationException.class, () -> parser.parseStatement("p(HGNC:AKT1) transcribedTo r(HGNC:AKT1)"));
    }

    @Test
    void deprecatedSpellingsOnlyWarn() {
        var statement = parser.parseStatement("p(HGNC:AKT1, trunc(40)) -> p(HGNC:TP53, sub(R, 275, H))");
        assertEquals(2, statement.warnings().size());
        assertTrue(statement.warnings().stream().anyMatch(w -> w.code().equals("DEPRECATED_TRUNCATION")));
    }
}
