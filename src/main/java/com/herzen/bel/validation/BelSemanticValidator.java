package com.herzen.bel.validation;

import com.herzen.bel.canonical.CanonicalModels.EdgeContext;
import com.herzen.bel.config.BelParserProperties;
import com.herzen.bel.domain.Concept;
import com.herzen.bel.domain.Modifiers.GeneModification;
import com.herzen.bel.domain.Modifiers.Modifier;
import com.herzen.bel.domain.Modifiers.ProteinModification;
import com.herzen.bel.domain.Statements.*;
import com.herzen.bel.domain.Terms.*;
import com.herzen.bel.parser.ParserDtos.ParseError;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Component
public class BelSemanticValidator {
    private final Optional<NamespaceValidator> namespaceValidator;
    private final BelParserProperties properties;
    private final Map<String, Set<String>> annotationValues;

    public BelSemanticValidator(Optional<NamespaceValidator> namespaceValidator, BelParserProperties properties) {
        this.namespaceValidator = namespaceValidator;
        this.properties = properties;
        this.annotationValues = properties.getAnnotationValues().entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey,
                        e -> Arrays.stream(e.getValue().split(",")).map(String::strip).filter(v -> !v.isEmpty()).collect(Collectors.toSet())));
    }

    public List<ParseError> validate(BelStatement statement, EdgeContext context, int line) {
        List<ParseError> errors = new ArrayList<>();
        namespaceValidator.ifPresent(validator -> concepts(statement).forEach(concept -> {
            if (!validator.knowsNamespace(concept.namespace())) {
                errors.add(ParseError.semantic("UNDEFINED_NAMESPACE", "Namespace is not defined: " + concept.namespace(), line, concept.toBel()));
            } else if (!validator.accepts(concept)) {
                errors.add(ParseError.semantic("MISSING_NAMESPACE_NAME", concept.label() + " is not in namespace " + concept.namespace(), line, concept.toBel()));
            }
        }));
        boolean producesEdges = statement instanceof RelationStatement || statement instanceof ListStatement || statement instanceof NestedStatement;
        if (properties.isRequireCitation() && producesEdges && (context.citation().isEmpty() || context.evidence() == null)) {
            errors.add(ParseError.semantic("MISSING_CITATION", "Statement needs an active citation and evidence", line, null));
        }
        return errors;
    }

    public List<ParseError> validateAnnotation(String key, List<String> values, int line) {
        Set<String> allowed = annotationValues.get(key);
        if (allowed == null) return List.of();
        return values.stream()
                .filter(v -> !allowed.contains(v))
                .map(v -> ParseError.semantic("ILLEGAL_ANNOTATION_VALUE", "'" + v + "' is not an allowed value of " + key, line, v))
                .toList();
    }

    private List<Concept> concepts(BelStatement statement) {
        List<Concept> concepts = new ArrayList<>();
        if (statement instanceof TermStatement single) {
            collect(single.term(), concepts);
        } else if (statement instanceof RelationStatement relation) {
            collect(relation.subject(), concepts);
            collect(relation.object(), concepts);
        } else if (statement instanceof ListStatement list) {
            collect(list.subject(), concepts);
            list.objects().forEach(o -> collect(o, concepts));
        } else if (statement instanceof NestedStatement nested) {
            collect(nested.subject(), concepts);
            collect(nested.object().subject(), concepts);
            collect(nested.object().object(), concepts);
        }
        return concepts.stream()
                .filter(c -> !c.isDefaultNamespace() && !Concept.DIRTY_NAMESPACE.equals(c.namespace()))
                .distinct()
                .toList();
    }

    private void collect(Participant participant, List<Concept> concepts) {
        collect(participant.term(), concepts);
        ProcessModifier modifier = participant.modifier();
        if (modifier != null) {
            Stream.of(modifier.effect(), modifier.fromLocation(), modifier.toLocation()).filter(Objects::nonNull).forEach(concepts::add);
        }
        if (participant.location() != null) concepts.add(participant.location());
    }

    private void collect(Term term, List<Concept> concepts) {
        if (term instanceof EntityTerm entity) {
            concepts.add(entity.concept());
            for (Modifier modifier : entity.variants()) {
                if (modifier instanceof ProteinModification pmod) concepts.add(pmod.type());
                if (modifier instanceof GeneModification gmod) concepts.add(gmod.type());
            }
        } else if (term instanceof ListTerm list) {
            list.members().forEach(m -> collect(m, concepts));
        } else if (term instanceof ReactionTerm reaction) {
            reaction.reactants().forEach(r -> collect(r, concepts));
            reaction.products().forEach(p -> collect(p, concepts));
        } else if (term instanceof FusionTerm fusion) {
            concepts.add(fusion.partner5p());
            concepts.add(fusion.partner3p());
        }
    }
}
