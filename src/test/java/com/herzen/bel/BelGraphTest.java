package com.herzen.bel;

import com.herzen.bel.canonical.CanonicalModels.EdgeContext;
import com.herzen.bel.canonical.Canonicalizer;
import com.herzen.bel.domain.Relation;
import com.herzen.bel.graph.BelGraph;
import com.herzen.bel.graph.BelGraphModels.GraphEdge;
import com.herzen.bel.graph.BelGraphService;
import com.herzen.bel.parser.BelParser;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class BelGraphTest {
    @Autowired
    private BelGraphService graphService;

    @Autowired
    private BelParser parser;

    @Autowired
    private Canonicalizer canonicalizer;

    @Test
    void repeatedStatementsDoNotDuplicateNodesOrEdges() {
        BelGraph graph = new BelGraph("repeat");
        var statement = parser.parseStatement("p(HGNC:AKT1) -> p(HGNC:GSK3B, pmod(Ph, Ser, 9))");
        graphService.insert(graph, statement, EdgeContext.empty(1));
        graphService.insert(graph, statement, EdgeContext.empty(2));

        assertEquals(3, graph.nodeCount());
        assertEquals(2, graph.edgeCount());

        var akt1 = canonicalizer.canonicalize(parser.parseTerm("p(HGNC:AKT1)"));
        var phospho = canonicalizer.canonicalize(parser.parseTerm("p(HGNC:GSK3B, pmod(Ph, Ser, 9))"));
        var gsk3b = canonicalizer.canonicalize(parser.parseTerm("p(HGNC:GSK3B)"));

        assertEquals(1, graph.outEdges(akt1).size());
        assertEquals(Relation.INCREASES, graph.outEdges(akt1).get(0).relation());
        assertTrue(graph.inEdges(akt1).isEmpty());
        assertEquals(2, graph.inEdges(phospho).size());
        assertEquals(Relation.HAS_VARIANT, graph.outEdges(gsk3b).get(0).relation());
        assertEquals(phospho, graph.outEdges(gsk3b).get(0).object());
    }

    @Test
    void looksUpNodesByKey() {
        BelGraph graph = new BelGraph("lookup");
        var term = parser.parseTerm("complex(p(HGNC:A), p(HGNC:B))");
        var key = graphService.addNode(graph, term);

        assertTrue(graph.containsNode(key));
        assertEquals(term, graph.node(key.digest()).orElseThrow().term());
        assertFalse(graph.containsNode(canonicalizer.canonicalize(parser.parseTerm("p(HGNC:C)"))));
        assertTrue(graph.node("missing").isEmpty());
        assertEquals(2, graph.outEdges(key).stream().map(GraphEdge::relation).filter(Relation.HAS_COMPONENT::equals).count());
    }

    @Test
    void identicalEdgesAreStoredOnce() {
        BelGraph graph = new BelGraph("edges");
        var a = canonicalizer.canonicalize(parser.parseTerm("p(HGNC:A)"));
        var b = canonicalizer.canonicalize(parser.parseTerm("p(HGNC:B)"));
        graph.addEdge(a, b, Relation.INCREASES, Map.of("evidence", "x"));
        graph.addEdge(a, b, Relation.INCREASES, Map.of("evidence", "x"));
        graph.addEdge(a, b, Relation.INCREASES, Map.of("evidence", "y"));
        graph.addEdge(b, a, Relation.INCREASES, Map.of("evidence", "x"));

        assertEquals(3, graph.edgeCount());
        assertEquals(2, graph.outEdges(a).size());
        assertEquals(1, graph.inEdges(a).size());
    }
}
