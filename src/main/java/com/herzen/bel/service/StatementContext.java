package com.herzen.bel.service;

import com.herzen.bel.canonical.CanonicalModels.EdgeContext;
import com.herzen.bel.domain.SourceSpan;
import com.herzen.bel.domain.Statements.ControlMutation;
import com.herzen.bel.parser.error.ControlStatementException;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.herzen.bel.parser.BelLanguage.*;

/**
 * Citation, evidence and annotations in force while a document is read top to bottom. Not thread-safe;
 * one instance per import, driven in document order.
 */
public class StatementContext {
    private final boolean citationClearing;
    private List<String> citation = List.of();
    private String evidence;
    private String statementGroup;
    private final SortedMap<String, List<String>> annotations = new TreeMap<>();

    public StatementContext(boolean citationClearing) {
        this.citationClearing = citationClearing;
    }

    public void apply(ControlMutation mutation, SourceSpan span) {
        switch (mutation.operation()) {
            case SET -> set(mutation, span);
            case UNSET -> mutation.keys().forEach(key -> unset(key, span));
            case UNSET_ALL -> clear();
        }
    }

    private void set(ControlMutation mutation, SourceSpan span) {
        String key = mutation.key();
        switch (key) {
            case CITATION -> {
                citation = mutation.values();
                if (citationClearing) {
                    evidence = null;
                    annotations.clear();
                }
            }
            case EVIDENCE, SUPPORTING_TEXT -> evidence = single(mutation, span);
            case STATEMENT_GROUP -> statementGroup = single(mutation, span);
            default -> annotations.put(key, mutation.values());
        }
    }

    private void unset(String key, SourceSpan span) {
        boolean wasSet = switch (key) {
            case CITATION -> {
                boolean set = !citation.isEmpty();
                citation = List.of();
                yield set;
            }
            case EVIDENCE, SUPPORTING_TEXT -> {
                boolean set = evidence != null;
                evidence = null;
                yield set;
            }
            case STATEMENT_GROUP -> {
                boolean set = statementGroup != null;
                statementGroup = null;
                yield set;
            }
            default -> annotations.remove(key) != null;
        };
        if (!wasSet) {
            throw new ControlStatementException("Cannot unset " + key + ", it is not set", span, key);
        }
    }

    private String single(ControlMutation mutation, SourceSpan span) {
        if (mutation.listValued()) {
            throw new ControlStatementException(mutation.key() + " takes a single value", span, mutation.key());
        }
        return mutation.value();
    }

    private void clear() {
        citation = List.of();
        evidence = null;
        statementGroup = null;
        annotations.clear();
    }

    public EdgeContext edgeContext(int line) {
        return new EdgeContext(citation, evidence, annotations, line);
    }

    public String statementGroup() {
        return statementGroup;
    }

    public List<String> citation() {
        return citation;
    }

    public SortedMap<String, List<String>> annotations() {
        return new TreeMap<>(annotations);
    }
}
