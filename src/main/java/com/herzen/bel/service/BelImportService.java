package com.herzen.bel.service;

import com.herzen.bel.config.BelParserProperties;
import com.herzen.bel.domain.Statements.BelStatement;
import com.herzen.bel.domain.Statements.ControlMutation;
import com.herzen.bel.domain.Statements.ControlOperation;
import com.herzen.bel.domain.Statements.ControlStatement;
import com.herzen.bel.graph.BelGraph;
import com.herzen.bel.graph.BelGraphService;
import com.herzen.bel.parser.BelDocumentParser;
import com.herzen.bel.parser.ParserDtos.DocumentParseResult;
import com.herzen.bel.parser.ParserDtos.LineWarning;
import com.herzen.bel.parser.ParserDtos.ParseError;
import com.herzen.bel.parser.ParserDtos.ParsedLine;
import com.herzen.bel.parser.error.ControlStatementException;
import com.herzen.bel.validation.BelSemanticValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class BelImportService {
    private static final Logger log = LoggerFactory.getLogger(BelImportService.class);

    private final BelDocumentParser documentParser;
    private final BelSemanticValidator validator;
    private final BelGraphService graphService;
    private final BelParserProperties properties;

    public BelImportService(BelDocumentParser documentParser,
                            BelSemanticValidator validator,
                            BelGraphService graphService,
                            BelParserProperties properties) {
        this.documentParser = documentParser;
        this.validator = validator;
        this.graphService = graphService;
        this.properties = properties;
    }

    /**
     * Parses {@code content} in parallel, then applies control statements and inserts graph content on the
     * calling thread in document order. A statement that fails parsing or validation contributes nothing.
     *
     * @param failFast null falls back to {@code bel.parser.fail-fast}
     */
    public ImportResult importDocument(String graphName, String content, boolean dryRun, Boolean failFast) {
        boolean stopAtFirstError = failFast != null ? failFast : properties.isFailFast();
        DocumentParseResult parsed = documentParser.parse(content, stopAtFirstError);

        List<ParseError> errors = new ArrayList<>(parsed.errors());
        List<LineWarning> warnings = new ArrayList<>();
        BelGraph graph = new BelGraph(graphName);
        StatementContext context = new StatementContext(properties.isCitationClearing());
        int edgeStatements = 0;

        for (ParsedLine line : parsed.statements()) {
            if (stopAtFirstError && !errors.isEmpty()) break;
            BelStatement statement = line.statement();
            statement.warnings().forEach(w -> {
                log.warn("Line {}: {}", line.line(), w.message());
                warnings.add(LineWarning.of(w, line.line()));
            });

            if (statement instanceof ControlStatement control) {
                applyControl(control, line.line(), context, errors);
                continue;
            }
            var edgeContext = context.edgeContext(line.line());
            List<ParseError> semantic = validator.validate(statement, edgeContext, line.line());
            if (!semantic.isEmpty()) {
                log.warn("Line {} rejected: {}", line.line(), semantic.get(0).message());
                errors.addAll(semantic);
                continue;
            }
            if (graphService.insert(graph, statement, edgeContext) > 0) edgeStatements++;
        }
        errors.sort(Comparator.comparingInt(ParseError::line));

        boolean aborted = stopAtFirstError && !errors.isEmpty();
        if (!dryRun && !aborted) {
            graphService.publish(graph);
        }
        log.info("Imported {}: {} statements, {} with edges, {} nodes, {} edges, {} errors, {} warnings{}",
                graphName, parsed.statements().size(), edgeStatements, graph.nodeCount(), graph.edgeCount(),
                errors.size(), warnings.size(), dryRun ? " (dry run)" : "");
        return new ImportResult(graphName, dryRun, errors.isEmpty(), parsed.metadata(), parsed.statements().size(),
                graph.nodeCount(), graph.edgeCount(), errors, warnings);
    }

    private void applyControl(ControlStatement control, int line, StatementContext context, List<ParseError> errors) {
        ControlMutation mutation = control.mutation();
        if (mutation.operation() == ControlOperation.SET) {
            List<ParseError> illegal = validator.validateAnnotation(mutation.key(), mutation.values(), line);
            if (!illegal.isEmpty()) {
                errors.addAll(illegal);
                return;
            }
        }
        try {
            context.apply(mutation, control.span());
        } catch (ControlStatementException e) {
            errors.add(ParseError.from(e, line));
        }
    }

    public record ImportResult(String graphName,
                               boolean dryRun,
                               boolean valid,
                               Map<String, String> metadata,
                               int statementCount,
                               int nodeCount,
                               int edgeCount,
                               List<ParseError> errors,
                               List<LineWarning> warnings) {
    }
}
