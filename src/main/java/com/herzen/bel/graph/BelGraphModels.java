package com.herzen.bel.graph;

import com.herzen.bel.canonical.CanonicalModels.CanonicalKey;
import com.herzen.bel.domain.FunctionKind;
import com.herzen.bel.domain.Relation;
import com.herzen.bel.domain.Terms.Term;

import java.util.Map;

public class BelGraphModels {
    public record GraphNode(CanonicalKey key, Term term) {
        public FunctionKind function() {
            return term.function();
        }
    }

    public record GraphEdge(String key, CanonicalKey subject, Relation relation, CanonicalKey object, Map<String, Object> attributes) {}

    public record NodeView(String key, String bel, String function) {}

    public record EdgeView(String key, String subjectKey, String relation, String objectKey, Map<String, Object> attributes) {}
}
