package com.herzen.bel.parser.modifier;

import com.herzen.bel.domain.FunctionKind;
import com.herzen.bel.domain.Modifiers.Modifier;
import com.herzen.bel.parser.BelScanner;

import java.util.Set;

/**
 * One modifier sub-grammar. The scanner is positioned right after the tag; implementations consume the
 * parenthesised argument list including the closing parenthesis.
 */
public interface ModifierGrammar {
    Set<String> tags();

    Modifier parse(BelScanner scanner, FunctionKind function);
}
