package com.herzen.bel.validation;

import com.herzen.bel.config.BelParserProperties;
import com.herzen.bel.domain.Concept;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

@Component
@ConditionalOnProperty(prefix = "bel.parser", name = "namespace-validation", havingValue = "true")
public class PatternNamespaceValidator implements NamespaceValidator {
    private final Map<String, Pattern> patterns = new LinkedHashMap<>();

    public PatternNamespaceValidator(BelParserProperties properties) {
        properties.getNamespacePatterns().forEach((namespace, regex) -> patterns.put(namespace, Pattern.compile(regex)));
    }

    @Override
    public boolean knowsNamespace(String namespace) {
        return patterns.containsKey(namespace);
    }

    @Override
    public boolean accepts(Concept concept) {
        Pattern pattern = patterns.get(concept.namespace());
        if (pattern == null) return false;
        if (concept.identifier() != null && pattern.matcher(concept.identifier()).matches()) return true;
        return concept.name() != null && pattern.matcher(concept.name()).matches();
    }
}
