package com.herzen.bel.parser.modifier;

import com.herzen.bel.domain.FunctionKind;
import com.herzen.bel.parser.ConceptParser;

import java.util.*;

public class ModifierRegistry {
    private final Map<FunctionKind, Map<String, ModifierGrammar>> grammars;
    private final Set<String> allTags;

    public ModifierRegistry(Map<FunctionKind, List<ModifierGrammar>> byFunction) {
        Map<FunctionKind, Map<String, ModifierGrammar>> table = new EnumMap<>(FunctionKind.class);
        Set<String> tags = new HashSet<>();
        byFunction.forEach((function, list) -> {
            Map<String, ModifierGrammar> byTag = new HashMap<>();
            for (ModifierGrammar grammar : list) {
                for (String tag : grammar.tags()) {
                    byTag.put(tag, grammar);
                    tags.add(tag);
                }
            }
            table.put(function, Map.copyOf(byTag));
        });
        this.grammars = table;
        this.allTags = Set.copyOf(tags);
    }

    public static ModifierRegistry standard(ConceptParser conceptParser) {
        ModifierGrammar pmod = new ProteinModificationGrammar(conceptParser);
        ModifierGrammar gmod = new GeneModificationGrammar(conceptParser);
        ModifierGrammar variant = new VariantGrammar();
        ModifierGrammar fragment = new FragmentGrammar();
        ModifierGrammar substitution = new SubstitutionGrammar();
        ModifierGrammar truncation = new TruncationGrammar();

        Map<FunctionKind, List<ModifierGrammar>> table = new EnumMap<>(FunctionKind.class);
        table.put(FunctionKind.PROTEIN, List.of(pmod, variant, fragment, substitution, truncation));
        table.put(FunctionKind.GENE, List.of(variant, substitution, gmod));
        table.put(FunctionKind.RNA, List.of(variant));
        table.put(FunctionKind.MIRNA, List.of(variant));
        return new ModifierRegistry(table);
    }

    public Optional<ModifierGrammar> find(FunctionKind function, String tag) {
        return Optional.ofNullable(grammars.getOrDefault(function, Map.of()).get(tag));
    }

    public boolean isModifierTag(String tag) {
        return allTags.contains(tag);
    }
}
