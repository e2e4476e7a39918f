package com.herzen.bel;

import com.herzen.bel.graph.BelGraphService;
import com.herzen.bel.parser.BelParser;
import com.herzen.bel.parser.ParserDtos.LineWarning;
import com.herzen.bel.parser.ParserDtos.ParseError;
import com.herzen.bel.repository.GraphJdbcRepository;
import com.herzen.bel.service.BelImportService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class BelImportServiceTest {
    private static final String SAMPLE = """
            # AKT signalling
            SET DOCUMENT Name = "AKT sample"
            SET DOCUMENT Version = "1.0.0"
            DEFINE NAMESPACE HGNC AS URL "https://example.org/hgnc.belns"

            SET Citation = {"PubMed", "12345"}
            SET Evidence = "AKT1 phosphorylates GSK3B"
            p(HGNC:AKT1) -> \\
                p(HGNC:GSK3B, pmod(Ph, Ser, 9))
            p(HGNC:GSK3B, pmod(Ph, Ser, 9)) -| act(p(HGNC:GSK3B), ma(kin))
            complex(p(HGNC:A), p(HGNC:B)) -> bp(GO:apoptosis)
            """;

    @Autowired
    private BelImportService service;

    @Autowired
    private BelGraphService graphService;

    @Autowired
    private GraphJdbcRepository repository;

    @Autowired
    private BelParser parser;

    @Test
    void importsDocumentAndPublishesGraph() {
        var result = service.importDocument("akt", SAMPLE, false, null);
        assertTrue(result.valid(), () -> result.errors().toString());
        assertEquals("AKT sample", result.metadata().get("Name"));
        assertEquals("1.0.0", result.metadata().get("Version"));
        assertEquals(5, result.statementCount());
        assertEquals(7, result.nodeCount());
        assertEquals(6, result.edgeCount());

        assertEquals(7, graphService.nodes("akt").size());
        assertEquals(7, repository.loadNodes("akt").size());
        var stored = repository.loadEdges("akt");
        assertEquals(6, stored.size());
        assertTrue(stored.stream().anyMatch(e -> List.of("PubMed", "12345").equals(e.attributes().get("citation"))));
        assertTrue(graphService.graph("akt").isPresent());
    }

    @Test
    void dryRunDoesNotPersist() {
        var result = service.importDocument("dry", SAMPLE, true, null);
        assertTrue(result.dryRun());
        assertEquals(7, result.nodeCount());
        assertTrue(graphService.nodes("dry").isEmpty());
        assertTrue(graphService.graph("dry").isEmpty());
    }

    @Test
    void reportsErrorsAndKeepsWellFormedStatements() {
        String doc = """
                SET Citation = {"PubMed", "1"}
                p(HGNC:A) activates p(HGNC:B)
                p(HGNC:A, pmod(Ph, Ser, 1, 2)) -> p(HGNC:B)
                UNSET Disease
                p(HGNC:A) -> p(HGNC:B)
                """;
        var result = service.importDocument("errors", doc, true, false);
        assertFalse(result.valid());
        assertEquals(List.of("INVALID_RELATION", "INVALID_MODIFIER", "CONTROL_STATEMENT"),
                result.errors().stream().map(ParseError::code).toList());
        assertEquals(List.of(2, 3, 4), result.errors().stream().map(ParseError::line).toList());
        assertEquals("activates", result.errors().get(0).token());
        assertEquals(10, result.errors().get(0).span().start());
        assertEquals(1, result.edgeCount());
    }

    @Test
    void failFastStopsAtFirstError() {
        String doc = """
                p(HGNC:A) -> p(HGNC:B)
                p(HGNC:A) activates p(HGNC:B)
                p(HGNC:A, pmod(Ph, Ser, 1, 2)) -> p(HGNC:B)
                """;
        var result = service.importDocument("fail-fast", doc, false, true);
        assertEquals(1, result.errors().size());
        assertEquals(2, result.errors().get(0).line());
        assertTrue(graphService.nodes("fail-fast").isEmpty());
    }

    @Test
    void collectsWarningsForDeprecatedSyntax() {
        var result = service.importDocument("legacy", "kin(p(HGNC:AKT1)) -> p(HGNC:GSK3B, sub(R, 96, A))", true, null);
        assertTrue(result.valid());
        assertEquals(Set.of("LEGACY_ACTIVITY", "DEPRECATED_SUBSTITUTION"),
                result.warnings().stream().map(LineWarning::code).collect(Collectors.toSet()));
        assertTrue(result.warnings().stream().allMatch(w -> w.line() == 1));
    }

    @Test
    void jdbcSinkIsIdempotent() {
        var sink = repository.sinkFor("sink");
        var term = parser.parseTerm("p(HGNC:AKT1, pmod(Ph, Ser, 473))");
        graphService.addNode(sink, term);
        graphService.addNode(sink, term);
        assertEquals(2, repository.loadNodes("sink").size());
        assertEquals(1, repository.loadEdges("sink").size());
        assertEquals("hasVariant", repository.loadEdges("sink").get(0).relation().belLabel());
    }

    @Test
    void unparseableLinesDoNotAbortTheImport() {
        String deep = "composite(".repeat(20000) + "p(HGNC:A)" + ")".repeat(20000);
        String doc = String.join("\n",
                "p(HGNC:A) -> p(HGNC:B)",
                deep,
                "p(HGNC:APP, frag(\"99999999999999999999_5\")) -> p(HGNC:B)",
                "p(HGNC:B) -| p(HGNC:C)");
        var result = service.importDocument("deep", doc, true, false);
        assertEquals(List.of("MALFORMED_TERM", "INVALID_MODIFIER"),
                result.errors().stream().map(ParseError::code).toList());
        assertEquals(List.of(2, 3), result.errors().stream().map(ParseError::line).toList());
        assertEquals(2, result.edgeCount());
    }
}
