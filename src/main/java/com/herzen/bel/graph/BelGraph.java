package com.herzen.bel.graph;

import com.herzen.bel.canonical.CanonicalModels.CanonicalEdge;
import com.herzen.bel.canonical.CanonicalModels.CanonicalKey;
import com.herzen.bel.domain.Relation;
import com.herzen.bel.domain.Terms.Term;
import com.herzen.bel.graph.BelGraphModels.GraphEdge;
import com.herzen.bel.graph.BelGraphModels.GraphNode;

import java.util.*;

public class BelGraph implements GraphSink {
    private final String name;
    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, GraphEdge> edges = new LinkedHashMap<>();

    public BelGraph(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public synchronized void addNode(CanonicalKey key, Term term) {
        nodes.putIfAbsent(key.digest(), new GraphNode(key, term));
    }

    @Override
    public synchronized void addEdge(CanonicalKey subject, CanonicalKey object, Relation relation, Map<String, Object> attributes) {
        CanonicalEdge edge = new CanonicalEdge(subject, relation, object, new TreeMap<>(attributes));
        edges.putIfAbsent(edge.key(), new GraphEdge(edge.key(), subject, relation, object, edge.attributes()));
    }

    public synchronized boolean containsNode(CanonicalKey key) {
        return nodes.containsKey(key.digest());
    }

    public synchronized Optional<GraphNode> node(String digest) {
        return Optional.ofNullable(nodes.get(digest));
    }

    public synchronized List<GraphNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public synchronized List<GraphEdge> edges() {
        return List.copyOf(edges.values());
    }

    public synchronized List<GraphEdge> outEdges(CanonicalKey key) {
        return edges.values().stream().filter(e -> e.subject().equals(key)).toList();
    }

    public synchronized List<GraphEdge> inEdges(CanonicalKey key) {
        return edges.values().stream().filter(e -> e.object().equals(key)).toList();
    }

    public synchronized int nodeCount() {
        return nodes.size();
    }

    public synchronized int edgeCount() {
        return edges.size();
    }
}
