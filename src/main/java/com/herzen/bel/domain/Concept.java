package com.herzen.bel.domain;

import java.util.Objects;
import java.util.regex.Pattern;

public record Concept(String namespace, String name, String identifier) {
    public static final String DEFAULT_NAMESPACE = "bel";
    public static final String DIRTY_NAMESPACE = "dirty";

    private static final Pattern PLAIN = Pattern.compile("[A-Za-z0-9_]+");

    public Concept {
        Objects.requireNonNull(namespace, "namespace");
        if (isBlank(name) && isBlank(identifier)) {
            throw new IllegalArgumentException("Concept in namespace " + namespace + " needs a name or an identifier");
        }
        name = isBlank(name) ? null : name;
        identifier = isBlank(identifier) ? null : identifier;
    }

    public static Concept of(String namespace, String name) {
        return new Concept(namespace, name, null);
    }

    public static Concept belDefault(String name) {
        return new Concept(DEFAULT_NAMESPACE, name, null);
    }

    public boolean isDefaultNamespace() {
        return DEFAULT_NAMESPACE.equals(namespace);
    }

    public String label() {
        return name != null ? name : identifier;
    }

    public String toBel() {
        if (isDefaultNamespace()) return quote(label());
        if (identifier != null && name != null) return namespace + ":" + quote(identifier) + "!" + quote(name);
        return namespace + ":" + quote(label());
    }

    public static String quote(String value) {
        if (PLAIN.matcher(value).matches()) return value;
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
