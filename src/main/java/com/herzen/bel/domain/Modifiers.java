package com.herzen.bel.domain;

import java.util.Objects;

public final class Modifiers {
    public enum ModifierKind { PROTEIN_MODIFICATION, GENE_MODIFICATION, VARIANT, FRAGMENT }

    public interface Modifier {
        ModifierKind kind();

        String toBel();
    }

    public record ProteinModification(Concept type, String code, Integer position) implements Modifier {
        public ProteinModification {
            Objects.requireNonNull(type, "type");
            if (position != null && code == null) {
                throw new IllegalArgumentException("pmod position requires an amino acid code");
            }
        }

        public int resolvedFields() {
            return 1 + (code == null ? 0 : 1) + (position == null ? 0 : 1);
        }

        @Override
        public ModifierKind kind() {
            return ModifierKind.PROTEIN_MODIFICATION;
        }

        @Override
        public String toBel() {
            StringBuilder sb = new StringBuilder("pmod(").append(type.toBel());
            if (code != null) sb.append(", ").append(code);
            if (position != null) sb.append(", ").append(position);
            return sb.append(")").toString();
        }
    }

    public record GeneModification(Concept type) implements Modifier {
        public GeneModification {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public ModifierKind kind() {
            return ModifierKind.GENE_MODIFICATION;
        }

        @Override
        public String toBel() {
            return "gmod(" + type.toBel() + ")";
        }
    }

    public record Variant(String hgvs) implements Modifier {
        public Variant {
            Objects.requireNonNull(hgvs, "hgvs");
        }

        @Override
        public ModifierKind kind() {
            return ModifierKind.VARIANT;
        }

        @Override
        public String toBel() {
            return "var(\"" + hgvs + "\")";
        }
    }

    public record Fragment(String start, String stop, String description) implements Modifier {
        public static final String UNKNOWN = "?";

        public boolean isMissing() {
            return start == null;
        }

        @Override
        public ModifierKind kind() {
            return ModifierKind.FRAGMENT;
        }

        @Override
        public String toBel() {
            String range = isMissing() ? UNKNOWN : start + "_" + stop;
            if (description == null) return "frag(\"" + range + "\")";
            return "frag(\"" + range + "\", " + Concept.quote(description) + ")";
        }
    }

    private Modifiers() {}
}
