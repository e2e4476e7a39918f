package com.herzen.bel.api;

import com.herzen.bel.canonical.CanonicalModels.CanonicalEdge;
import com.herzen.bel.canonical.CanonicalModels.EdgeContext;
import com.herzen.bel.canonical.Canonicalizer;
import com.herzen.bel.domain.Statements.BelStatement;
import com.herzen.bel.domain.Statements.ControlMutation;
import com.herzen.bel.domain.Statements.ControlStatement;
import com.herzen.bel.domain.Statements.ParseWarning;
import com.herzen.bel.graph.BelGraphModels.EdgeView;
import com.herzen.bel.graph.BelGraphModels.NodeView;
import com.herzen.bel.graph.BelGraphService;
import com.herzen.bel.parser.BelParser;
import com.herzen.bel.service.BelImportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/bel")
public class BelController {
    private final BelParser parser;
    private final Canonicalizer canonicalizer;
    private final BelImportService importService;
    private final BelGraphService graphService;

    public BelController(BelParser parser, Canonicalizer canonicalizer,
                         BelImportService importService, BelGraphService graphService) {
        this.parser = parser;
        this.canonicalizer = canonicalizer;
        this.importService = importService;
        this.graphService = graphService;
    }

    @PostMapping("/statements/parse")
    public ResponseEntity<StatementResponse> parse(@RequestBody StatementRequest request) {
        BelStatement statement = parser.parseStatement(request.statement());
        ControlMutation control = statement instanceof ControlStatement c ? c.mutation() : null;
        List<String> nodes = canonicalizer.nodes(statement).stream().map(canonicalizer::canonicalBel).toList();
        List<EdgeResponse> edges = canonicalizer.canonicalizeEdges(statement, EdgeContext.empty(0)).stream()
                .map(EdgeResponse::of)
                .toList();
        return ResponseEntity.ok(new StatementResponse(statement.getClass().getSimpleName(), nodes, edges, control, statement.warnings()));
    }

    @PostMapping("/import")
    public ResponseEntity<BelImportService.ImportResult> importDocument(@RequestBody ImportRequest request) {
        return ResponseEntity.ok(importService.importDocument(request.graphName(), request.content(), request.dryRun(), request.failFast()));
    }

    @GetMapping("/graphs/{name}/nodes")
    public ResponseEntity<List<NodeView>> nodes(@PathVariable String name) {
        return ResponseEntity.ok(graphService.nodes(name));
    }

    @GetMapping("/graphs/{name}/edges")
    public ResponseEntity<List<EdgeView>> edges(@PathVariable String name) {
        return ResponseEntity.ok(graphService.edges(name));
    }

    public record StatementRequest(String statement) {}

    public record ImportRequest(String graphName, String content, boolean dryRun, Boolean failFast) {}

    public record StatementResponse(String type, List<String> nodes, List<EdgeResponse> edges,
                                    ControlMutation control, List<ParseWarning> warnings) {}

    public record EdgeResponse(String subject, String relation, String object, Map<String, Object> attributes) {
        static EdgeResponse of(CanonicalEdge edge) {
            return new EdgeResponse(edge.subject().bel(), edge.relation().belLabel(), edge.object().bel(), edge.attributes());
        }
    }
}
