package com.herzen.bel.validation;

import com.herzen.bel.domain.Concept;

public interface NamespaceValidator {
    boolean knowsNamespace(String namespace);

    boolean accepts(Concept concept);
}
