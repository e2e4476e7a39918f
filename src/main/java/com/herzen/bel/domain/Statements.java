package com.herzen.bel.domain;

import com.herzen.bel.domain.Terms.Term;

import java.util.List;
import java.util.Objects;

public final class Statements {
    public enum ProcessKind { ACTIVITY, DEGRADATION, TRANSLOCATION, CELL_SECRETION, CELL_SURFACE_EXPRESSION }

    public enum ControlOperation { SET, UNSET, UNSET_ALL }

    public record ProcessModifier(ProcessKind kind, Concept effect, Concept fromLocation, Concept toLocation) {
        public static ProcessModifier activity(Concept effect) {
            return new ProcessModifier(ProcessKind.ACTIVITY, effect, null, null);
        }

        public static ProcessModifier of(ProcessKind kind) {
            return new ProcessModifier(kind, null, null, null);
        }
    }

    public record Participant(Term term, ProcessModifier modifier, Concept location) {
        public Participant {
            Objects.requireNonNull(term, "term");
        }
    }

    public record ParseWarning(String code, String message, SourceSpan span) {}

    public interface BelStatement {
        SourceSpan span();

        List<ParseWarning> warnings();
    }

    public record RelationStatement(Participant subject, Relation relation, Participant object,
                                    SourceSpan span, List<ParseWarning> warnings) implements BelStatement {
        public RelationStatement {
            Objects.requireNonNull(subject, "subject");
            Objects.requireNonNull(relation, "relation");
            Objects.requireNonNull(object, "object");
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }
    }

    public record TermStatement(Participant term, SourceSpan span, List<ParseWarning> warnings) implements BelStatement {
        public TermStatement {
            Objects.requireNonNull(term, "term");
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }
    }

    public record ListStatement(Participant subject, Relation relation, List<Participant> objects,
                                SourceSpan span, List<ParseWarning> warnings) implements BelStatement {
        public ListStatement {
            objects = List.copyOf(objects);
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }
    }

    public record NestedStatement(Participant subject, Relation relation, RelationStatement object,
                                  SourceSpan span, List<ParseWarning> warnings) implements BelStatement {
        public NestedStatement {
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }
    }

    public record ControlStatement(ControlMutation mutation, SourceSpan span, List<ParseWarning> warnings) implements BelStatement {
        public ControlStatement {
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }
    }

    public record ControlMutation(ControlOperation operation, List<String> keys, List<String> values, boolean listValued) {
        public ControlMutation {
            keys = List.copyOf(keys);
            values = List.copyOf(values);
        }

        public static ControlMutation set(String key, String value) {
            return new ControlMutation(ControlOperation.SET, List.of(key), List.of(value), false);
        }

        public static ControlMutation setList(String key, List<String> values) {
            return new ControlMutation(ControlOperation.SET, List.of(key), values, true);
        }

        public static ControlMutation unset(List<String> keys) {
            return new ControlMutation(ControlOperation.UNSET, keys, List.of(), false);
        }

        public static ControlMutation unsetAll() {
            return new ControlMutation(ControlOperation.UNSET_ALL, List.of(), List.of(), false);
        }

        public String key() {
            return keys.isEmpty() ? null : keys.get(0);
        }

        public String value() {
            return values.isEmpty() ? null : values.get(0);
        }
    }

    private Statements() {}
}
