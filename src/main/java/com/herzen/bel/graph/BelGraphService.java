package com.herzen.bel.graph;

import com.herzen.bel.canonical.CanonicalModels.CanonicalEdge;
import com.herzen.bel.canonical.CanonicalModels.CanonicalKey;
import com.herzen.bel.canonical.CanonicalModels.EdgeContext;
import com.herzen.bel.canonical.Canonicalizer;
import com.herzen.bel.domain.Relation;
import com.herzen.bel.domain.Statements.BelStatement;
import com.herzen.bel.domain.Terms.*;
import com.herzen.bel.graph.BelGraphModels.EdgeView;
import com.herzen.bel.graph.BelGraphModels.NodeView;
import com.herzen.bel.repository.GraphJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class BelGraphService {
    private static final Logger log = LoggerFactory.getLogger(BelGraphService.class);

    private final Canonicalizer canonicalizer;
    private final GraphJdbcRepository repository;
    private final Map<String, BelGraph> graphCache = new ConcurrentHashMap<>();

    public BelGraphService(Canonicalizer canonicalizer, GraphJdbcRepository repository) {
        this.canonicalizer = canonicalizer;
        this.repository = repository;
    }

    /**
     * Writes the nodes and edges of one fully parsed statement. Callers serialize calls per sink.
     *
     * @return number of statement edges written, structural edges not included
     */
    public int insert(GraphSink sink, BelStatement statement, EdgeContext context) {
        canonicalizer.nodes(statement).forEach(term -> addNode(sink, term));
        List<CanonicalEdge> edges = canonicalizer.canonicalizeEdges(statement, context);
        edges.forEach(e -> sink.addEdge(e.subject(), e.object(), e.relation(), e.attributes()));
        return edges.size();
    }

    public CanonicalKey addNode(GraphSink sink, Term term) {
        CanonicalKey key = canonicalizer.canonicalize(term);
        sink.addNode(key, term);
        if (term instanceof EntityTerm entity && !entity.variants().isEmpty()) {
            CanonicalKey parent = addNode(sink, entity.withoutVariants());
            sink.addEdge(parent, key, Relation.HAS_VARIANT, Map.of());
        } else if (term instanceof ListTerm list) {
            list.members().forEach(member -> sink.addEdge(key, addNode(sink, member), Relation.HAS_COMPONENT, Map.of()));
        } else if (term instanceof ReactionTerm reaction) {
            reaction.reactants().forEach(r -> sink.addEdge(key, addNode(sink, r), Relation.HAS_REACTANT, Map.of()));
            reaction.products().forEach(p -> sink.addEdge(key, addNode(sink, p), Relation.HAS_PRODUCT, Map.of()));
        }
        return key;
    }

    public synchronized void publish(BelGraph graph) {
        repository.replaceGraph(graph.name(), graph);
        graphCache.put(graph.name(), graph);
        log.debug("Published graph {} with {} nodes and {} edges", graph.name(), graph.nodeCount(), graph.edgeCount());
    }

    public Optional<BelGraph> graph(String name) {
        return Optional.ofNullable(graphCache.get(name));
    }

    public List<NodeView> nodes(String name) {
        BelGraph graph = graphCache.get(name);
        if (graph == null) {
            return repository.loadNodes(name).stream()
                    .map(r -> new NodeView(r.nodeKey(), r.bel(), r.functionKind()))
                    .toList();
        }
        return graph.nodes().stream()
                .map(n -> new NodeView(n.key().digest(), n.key().bel(), n.function().name()))
                .sorted(Comparator.comparing(NodeView::bel))
                .toList();
    }

    public List<EdgeView> edges(String name) {
        BelGraph graph = graphCache.get(name);
        if (graph == null) {
            return repository.loadEdges(name).stream()
                    .map(r -> new EdgeView(r.edgeKey(), r.sourceKey(), r.relation().belLabel(), r.targetKey(), r.attributes()))
                    .toList();
        }
        return graph.edges().stream()
                .map(e -> new EdgeView(e.key(), e.subject().digest(), e.relation().belLabel(), e.object().digest(), e.attributes()))
                .sorted(Comparator.comparing(EdgeView::key))
                .toList();
    }
}
