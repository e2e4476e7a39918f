package com.herzen.bel.canonical;

import com.herzen.bel.canonical.CanonicalModels.CanonicalEdge;
import com.herzen.bel.canonical.CanonicalModels.CanonicalKey;
import com.herzen.bel.canonical.CanonicalModels.EdgeContext;
import com.herzen.bel.domain.Concept;
import com.herzen.bel.domain.Modifiers.Modifier;
import com.herzen.bel.domain.Relation;
import com.herzen.bel.domain.Statements.*;
import com.herzen.bel.domain.Terms.*;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class Canonicalizer {
    public static final String CITATION = "citation";
    public static final String EVIDENCE = "evidence";
    public static final String ANNOTATIONS = "annotations";
    public static final String SUBJECT = "subject";
    public static final String OBJECT = "object";
    public static final String LINE = "line";

    public CanonicalKey canonicalize(Term term) {
        return CanonicalKey.of(canonicalBel(term));
    }

    public String canonicalBel(Term term) {
        if (term instanceof EntityTerm entity) {
            StringBuilder sb = new StringBuilder(entity.function().belTag()).append('(').append(entity.concept().toBel());
            entity.variants().stream().map(Modifier::toBel).sorted().forEach(v -> sb.append(", ").append(v));
            return sb.append(')').toString();
        }
        if (term instanceof ListTerm list) {
            return list.function().belTag() + "(" + sortedJoin(list.members()) + ")";
        }
        if (term instanceof ReactionTerm reaction) {
            return reaction.function().belTag() + "(reactants(" + sortedJoin(reaction.reactants())
                    + "), products(" + sortedJoin(reaction.products()) + "))";
        }
        if (term instanceof FusionTerm fusion) {
            return fusion.function().belTag() + "(fus(" + fusion.partner5p().toBel() + ", " + fusion.range5p().toBel()
                    + ", " + fusion.partner3p().toBel() + ", " + fusion.range3p().toBel() + "))";
        }
        throw new IllegalArgumentException("Unsupported term type: " + term.getClass().getName());
    }

    public List<Term> nodes(BelStatement statement) {
        List<Term> terms = new ArrayList<>();
        if (statement instanceof TermStatement single) {
            terms.add(single.term().term());
        } else if (statement instanceof RelationStatement relation) {
            terms.add(relation.subject().term());
            terms.add(relation.object().term());
        } else if (statement instanceof ListStatement list) {
            terms.add(list.subject().term());
            list.objects().forEach(o -> terms.add(o.term()));
        } else if (statement instanceof NestedStatement nested) {
            terms.add(nested.subject().term());
            terms.add(nested.object().subject().term());
            terms.add(nested.object().object().term());
        }
        return terms;
    }

    public CanonicalEdge canonicalizeEdge(Participant subject, Relation relation, Participant object, EdgeContext context) {
        SortedMap<String, Object> attributes = new TreeMap<>();
        if (!context.citation().isEmpty()) attributes.put(CITATION, context.citation());
        if (context.evidence() != null) attributes.put(EVIDENCE, context.evidence());
        if (!context.annotations().isEmpty()) {
            SortedMap<String, Object> annotations = new TreeMap<>();
            context.annotations().forEach((key, values) -> annotations.put(key, values.size() == 1 ? values.get(0) : List.copyOf(values)));
            attributes.put(ANNOTATIONS, annotations);
        }
        SortedMap<String, String> subjectAttributes = participantAttributes(subject);
        if (!subjectAttributes.isEmpty()) attributes.put(SUBJECT, subjectAttributes);
        SortedMap<String, String> objectAttributes = participantAttributes(object);
        if (!objectAttributes.isEmpty()) attributes.put(OBJECT, objectAttributes);
        if (context.line() > 0) attributes.put(LINE, context.line());
        return new CanonicalEdge(canonicalize(subject.term()), relation, canonicalize(object.term()), attributes);
    }

    public List<CanonicalEdge> canonicalizeEdges(BelStatement statement, EdgeContext context) {
        List<CanonicalEdge> edges = new ArrayList<>();
        for (EdgeContext single : expand(context)) {
            if (statement instanceof RelationStatement relation) {
                edges.add(canonicalizeEdge(relation.subject(), relation.relation(), relation.object(), single));
            } else if (statement instanceof ListStatement list) {
                list.objects().forEach(o -> edges.add(canonicalizeEdge(list.subject(), list.relation(), o, single)));
            } else if (statement instanceof NestedStatement nested) {
                RelationStatement inner = nested.object();
                edges.add(canonicalizeEdge(nested.subject(), nested.relation(), inner.subject(), single));
                edges.add(canonicalizeEdge(inner.subject(), inner.relation(), inner.object(), single));
            }
        }
        return edges;
    }

    List<EdgeContext> expand(EdgeContext context) {
        List<SortedMap<String, List<String>>> combinations = new ArrayList<>();
        combinations.add(new TreeMap<>());
        for (Map.Entry<String, List<String>> entry : context.annotations().entrySet()) {
            List<SortedMap<String, List<String>>> next = new ArrayList<>();
            for (SortedMap<String, List<String>> partial : combinations) {
                for (String value : new TreeSet<>(entry.getValue())) {
                    SortedMap<String, List<String>> extended = new TreeMap<>(partial);
                    extended.put(entry.getKey(), List.of(value));
                    next.add(extended);
                }
            }
            combinations = next;
        }
        return combinations.stream()
                .map(annotations -> new EdgeContext(context.citation(), context.evidence(), annotations, context.line()))
                .toList();
    }

    private SortedMap<String, String> participantAttributes(Participant participant) {
        SortedMap<String, String> attributes = new TreeMap<>();
        ProcessModifier modifier = participant.modifier();
        if (modifier != null) {
            attributes.put("modifier", modifier.kind().name().toLowerCase(Locale.ROOT));
            putConcept(attributes, "effect", modifier.effect());
            putConcept(attributes, "fromLoc", modifier.fromLocation());
            putConcept(attributes, "toLoc", modifier.toLocation());
        }
        putConcept(attributes, "location", participant.location());
        return attributes;
    }

    private void putConcept(Map<String, String> attributes, String key, Concept concept) {
        if (concept != null) attributes.put(key, concept.toBel());
    }

    private String sortedJoin(List<Term> terms) {
        return String.join(", ", terms.stream().map(this::canonicalBel).sorted().toList());
    }
}
