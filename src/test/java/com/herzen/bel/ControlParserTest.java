package com.herzen.bel;

import com.herzen.bel.config.BelParserProperties;
import com.herzen.bel.domain.SourceSpan;
import com.herzen.bel.domain.Statements.ControlMutation;
import com.herzen.bel.domain.Statements.ControlOperation;
import com.herzen.bel.domain.Statements.ControlStatement;
import com.herzen.bel.parser.BelParser;
import com.herzen.bel.parser.error.BelErrorKind;
import com.herzen.bel.parser.error.ControlStatementException;
import com.herzen.bel.service.StatementContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ControlParserTest {
    private final BelParser parser = new BelParser(new BelParserProperties());

    private ControlMutation mutation(String text) {
        return assertInstanceOf(ControlStatement.class, parser.parseStatement(text)).mutation();
    }

    @Test
    void parsesSetWithPlainValue() {
        ControlMutation mutation = mutation("SET Citation = pmid:1234");
        assertEquals(ControlOperation.SET, mutation.operation());
        assertEquals("Citation", mutation.key());
        assertEquals("pmid:1234", mutation.value());
        assertFalse(mutation.listValued());
    }

    @Test
    void parsesQuotedAndListValues() {
        assertEquals("AKT1 is phosphorylated", mutation("SET Evidence = \"AKT1 is phosphorylated\"").value());

        ControlMutation list = mutation("SET Disease = {\"breast cancer\", \"asthma\"}");
        assertTrue(list.listValued());
        assertEquals(List.of("breast cancer", "asthma"), list.values());
    }

    @Test
    void parsesUnsetForms() {
        assertEquals(List.of("Disease"), mutation("UNSET Disease").keys());
        assertEquals(List.of("Disease", "Species"), mutation("UNSET {Disease, Species}").keys());
        assertEquals(ControlOperation.UNSET_ALL, mutation("UNSET ALL").operation());
        assertEquals(List.of("STATEMENT_GROUP"), mutation("UNSET STATEMENT_GROUP").keys());
    }

    @Test
    void rejectsMalformedControlStatements() {
        var missingEquals = assertThrows(ControlStatementException.class, () -> parser.parseStatement("SET Citation pmid:1234"));
        assertEquals(BelErrorKind.CONTROL_STATEMENT, missingEquals.kind());
        assertThrows(ControlStatementException.class, () -> parser.parseStatement("SET Disease ="));
        assertThrows(ControlStatementException.class, () -> parser.parseStatement("SET Disease = {}"));
        assertThrows(ControlStatementException.class, () -> parser.parseStatement("SET Evidence = \"a\" trailing"));
        assertThrows(ControlStatementException.class, () -> parser.parseStatement("UNSET"));
    }

    @Test
    void contextAppliesMutationsAndClearsOnNewCitation() {
        StatementContext context = new StatementContext(true);
        context.apply(mutation("SET Citation = {\"PubMed\", \"12345\"}"), SourceSpan.UNKNOWN);
        context.apply(mutation("SET Evidence = \"text\""), SourceSpan.UNKNOWN);
        context.apply(mutation("SET Disease = {\"cancer\", \"asthma\"}"), SourceSpan.UNKNOWN);
        context.apply(mutation("SET STATEMENT_GROUP = \"Group 1\""), SourceSpan.UNKNOWN);

        var edgeContext = context.edgeContext(7);
        assertEquals(List.of("PubMed", "12345"), edgeContext.citation());
        assertEquals("text", edgeContext.evidence());
        assertEquals(List.of("cancer", "asthma"), edgeContext.annotations().get("Disease"));
        assertEquals("Group 1", context.statementGroup());

        context.apply(mutation("SET Citation = pmid:999"), SourceSpan.UNKNOWN);
        assertNull(context.edgeContext(8).evidence());
        assertTrue(context.annotations().isEmpty());

        assertThrows(ControlStatementException.class, () -> context.apply(mutation("UNSET Disease"), SourceSpan.UNKNOWN));
        context.apply(mutation("UNSET ALL"), SourceSpan.UNKNOWN);
        assertTrue(context.citation().isEmpty());
        assertNull(context.statementGroup());
    }
}
