package com.herzen.bel.domain;

import com.herzen.bel.domain.Modifiers.Modifier;

import java.util.List;
import java.util.Objects;

public final class Terms {
    public interface Term {
        FunctionKind function();
    }

    public record EntityTerm(FunctionKind function, Concept concept, List<Modifier> variants) implements Term {
        public EntityTerm {
            Objects.requireNonNull(function, "function");
            Objects.requireNonNull(concept, "concept");
            variants = variants == null ? List.of() : List.copyOf(variants);
        }

        public static EntityTerm of(FunctionKind function, Concept concept) {
            return new EntityTerm(function, concept, List.of());
        }

        public EntityTerm withoutVariants() {
            return variants.isEmpty() ? this : new EntityTerm(function, concept, List.of());
        }
    }

    public record ListTerm(FunctionKind function, List<Term> members) implements Term {
        public ListTerm {
            if (function != FunctionKind.COMPLEX && function != FunctionKind.COMPOSITE) {
                throw new IllegalArgumentException("Only complex and composite take member lists: " + function);
            }
            if (members == null || members.isEmpty()) {
                throw new IllegalArgumentException(function + " member list is empty");
            }
            members = List.copyOf(members);
        }
    }

    public record ReactionTerm(List<Term> reactants, List<Term> products) implements Term {
        public ReactionTerm {
            reactants = List.copyOf(reactants);
            products = List.copyOf(products);
        }

        @Override
        public FunctionKind function() {
            return FunctionKind.REACTION;
        }
    }

    public record FusionTerm(FunctionKind function,
                             Concept partner5p, FusionRange range5p,
                             Concept partner3p, FusionRange range3p) implements Term {
        public FusionTerm {
            Objects.requireNonNull(partner5p, "partner5p");
            Objects.requireNonNull(partner3p, "partner3p");
            range5p = range5p == null ? FusionRange.missing() : range5p;
            range3p = range3p == null ? FusionRange.missing() : range3p;
        }
    }

    public record FusionRange(String reference, String start, String stop) {
        public static FusionRange missing() {
            return new FusionRange(null, null, null);
        }

        public boolean isMissing() {
            return reference == null;
        }

        public String toBel() {
            return isMissing() ? "?" : "\"" + reference + "." + start + "_" + stop + "\"";
        }
    }

    private Terms() {}
}
