package com.herzen.bel.domain;

public enum FunctionKind {
    ABUNDANCE("a"),
    GENE("g"),
    RNA("r"),
    MIRNA("m"),
    PROTEIN("p"),
    COMPLEX("complex"),
    COMPOSITE("composite"),
    BIOLOGICAL_PROCESS("bp"),
    PATHOLOGY("path"),
    POPULATION("pop"),
    REACTION("rxn");

    private final String belTag;

    FunctionKind(String belTag) {
        this.belTag = belTag;
    }

    public String belTag() {
        return belTag;
    }

    public boolean isProcess() {
        return this == BIOLOGICAL_PROCESS || this == PATHOLOGY;
    }
}
