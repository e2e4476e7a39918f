package com.herzen.bel.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.bel.canonical.CanonicalModels.CanonicalEdge;
import com.herzen.bel.canonical.CanonicalModels.CanonicalKey;
import com.herzen.bel.domain.Relation;
import com.herzen.bel.domain.Terms.Term;
import com.herzen.bel.graph.BelGraph;
import com.herzen.bel.graph.GraphSink;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Repository
public class GraphJdbcRepository {
    private static final TypeReference<Map<String, Object>> ATTRIBUTES = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public GraphJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public GraphSink sinkFor(String graphName) {
        return new GraphSink() {
            @Override
            public void addNode(CanonicalKey key, Term term) {
                jdbcTemplate.update(
                        "MERGE INTO bel_nodes(graph_name, node_key, bel, function_kind) KEY(graph_name, node_key) VALUES (?,?,?,?)",
                        graphName, key.digest(), key.bel(), term.function().name());
            }

            @Override
            public void addEdge(CanonicalKey subject, CanonicalKey object, Relation relation, Map<String, Object> attributes) {
                CanonicalEdge edge = new CanonicalEdge(subject, relation, object, new TreeMap<>(attributes));
                jdbcTemplate.update(
                        "MERGE INTO bel_edges(graph_name, edge_key, source_key, target_key, relation, attributes) KEY(graph_name, edge_key) VALUES (?,?,?,?,?,?)",
                        graphName, edge.key(), subject.digest(), object.digest(), relation.belLabel(), toJson(edge.attributes()));
            }
        };
    }

    public void replaceGraph(String graphName, BelGraph graph) {
        deleteGraph(graphName);
        GraphSink sink = sinkFor(graphName);
        graph.nodes().forEach(n -> sink.addNode(n.key(), n.term()));
        graph.edges().forEach(e -> sink.addEdge(e.subject(), e.object(), e.relation(), e.attributes()));
    }

    public void deleteGraph(String graphName) {
        jdbcTemplate.update("DELETE FROM bel_edges WHERE graph_name = ?", graphName);
        jdbcTemplate.update("DELETE FROM bel_nodes WHERE graph_name = ?", graphName);
    }

    public List<NodeRow> loadNodes(String graphName) {
        return jdbcTemplate.query(
                "SELECT graph_name, node_key, bel, function_kind FROM bel_nodes WHERE graph_name = ? ORDER BY bel",
                (rs, rowNum) -> new NodeRow(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4)),
                graphName);
    }

    public List<EdgeRow> loadEdges(String graphName) {
        return jdbcTemplate.query(
                "SELECT graph_name, edge_key, source_key, target_key, relation, attributes FROM bel_edges WHERE graph_name = ? ORDER BY edge_key",
                (rs, rowNum) -> new EdgeRow(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                        Relation.fromToken(rs.getString(5)).orElseThrow(), fromJson(rs.getString(6))),
                graphName);
    }

    private String toJson(Map<String, Object> attributes) {
        try {
            return objectMapper.writeValueAsString(attributes);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, ATTRIBUTES);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public record NodeRow(String graphName, String nodeKey, String bel, String functionKind) {}

    public record EdgeRow(String graphName, String edgeKey, String sourceKey, String targetKey,
                          Relation relation, Map<String, Object> attributes) {}
}
