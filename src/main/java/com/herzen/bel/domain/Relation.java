package com.herzen.bel.domain;

import java.util.*;

public enum Relation {
    INCREASES("increases", "->", "→"),
    DECREASES("decreases", "-|"),
    DIRECTLY_INCREASES("directlyIncreases", "=>", "⇒"),
    DIRECTLY_DECREASES("directlyDecreases", "=|"),
    CAUSES_NO_CHANGE("causesNoChange", "cnc"),
    REGULATES("regulates", "reg"),
    RATE_LIMITING_STEP_OF("rateLimitingStepOf"),
    POSITIVE_CORRELATION("positiveCorrelation", "pos"),
    NEGATIVE_CORRELATION("negativeCorrelation", "neg"),
    ASSOCIATION("association", "--"),
    ORTHOLOGOUS("orthologous"),
    TRANSCRIBED_TO("transcribedTo", ":>"),
    TRANSLATED_TO("translatedTo", ">>"),
    HAS_MEMBER("hasMember"),
    HAS_MEMBERS("hasMembers"),
    HAS_COMPONENT("hasComponent"),
    HAS_COMPONENTS("hasComponents"),
    HAS_VARIANT("hasVariant"),
    HAS_REACTANT("hasReactant"),
    HAS_PRODUCT("hasProduct"),
    IS_A("isA"),
    SUB_PROCESS_OF("subProcessOf"),
    BIOMARKER_FOR("biomarkerFor"),
    PROGNOSTIC_BIOMARKER_FOR("prognosticBiomarkerFor"),
    ANALOGOUS_TO("analogousTo"),
    EQUIVALENT_TO("equivalentTo", "eq"),
    PART_OF("partOf");

    private static final Map<String, Relation> BY_TOKEN;
    private static final List<String> SYMBOLS;

    static {
        Map<String, Relation> tokens = new HashMap<>();
        List<String> symbols = new ArrayList<>();
        for (Relation relation : values()) {
            tokens.put(relation.belLabel, relation);
            for (String alias : relation.aliases) {
                tokens.put(alias, relation);
                if (!Character.isLetter(alias.charAt(0))) symbols.add(alias);
            }
        }
        symbols.sort(Comparator.comparingInt(String::length).reversed());
        BY_TOKEN = Map.copyOf(tokens);
        SYMBOLS = List.copyOf(symbols);
    }

    private final String belLabel;
    private final List<String> aliases;

    Relation(String belLabel, String... aliases) {
        this.belLabel = belLabel;
        this.aliases = List.of(aliases);
    }

    public String belLabel() {
        return belLabel;
    }

    public boolean isListRelation() {
        return this == HAS_MEMBERS || this == HAS_COMPONENTS;
    }

    public Relation expanded() {
        return switch (this) {
            case HAS_MEMBERS -> HAS_MEMBER;
            case HAS_COMPONENTS -> HAS_COMPONENT;
            default -> this;
        };
    }

    public static Optional<Relation> fromToken(String token) {
        return Optional.ofNullable(BY_TOKEN.get(token));
    }

    /** Non-word relation tokens, longest first. */
    public static List<String> symbols() {
        return SYMBOLS;
    }
}
