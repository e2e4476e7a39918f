package com.herzen.bel.graph;

import com.herzen.bel.canonical.CanonicalModels.CanonicalKey;
import com.herzen.bel.domain.Relation;
import com.herzen.bel.domain.Terms.Term;

import java.util.Map;

/** Target of canonical nodes and edges. Repeating an identical call must leave the sink unchanged. */
public interface GraphSink {
    void addNode(CanonicalKey key, Term term);

    void addEdge(CanonicalKey subject, CanonicalKey object, Relation relation, Map<String, Object> attributes);
}
