package com.herzen.bel.canonical;

import com.herzen.bel.domain.Relation;

import java.util.*;

public class CanonicalModels {
    public record CanonicalKey(String digest, String bel) implements Comparable<CanonicalKey> {
        public static CanonicalKey of(String bel) {
            return new CanonicalKey(Digests.sha256(bel), bel);
        }

        @Override
        public int compareTo(CanonicalKey other) {
            return bel.compareTo(other.bel);
        }
    }

    public record CanonicalEdge(CanonicalKey subject, Relation relation, CanonicalKey object,
                                SortedMap<String, Object> attributes) {
        public CanonicalEdge {
            attributes = Collections.unmodifiableSortedMap(new TreeMap<>(attributes));
        }

        /** Identity of the edge: endpoints, relation and attributes other than the source line. */
        public String key() {
            SortedMap<String, Object> identity = new TreeMap<>(attributes);
            identity.remove(Canonicalizer.LINE);
            return Digests.sha256(subject.digest() + "|" + relation.belLabel() + "|" + object.digest() + "|" + identity);
        }
    }

    public record EdgeContext(List<String> citation, String evidence, SortedMap<String, List<String>> annotations, int line) {
        public EdgeContext {
            citation = citation == null ? List.of() : List.copyOf(citation);
            annotations = annotations == null ? new TreeMap<>() : new TreeMap<>(annotations);
        }

        public static EdgeContext empty(int line) {
            return new EdgeContext(List.of(), null, new TreeMap<>(), line);
        }
    }
}
