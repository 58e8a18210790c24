package irmigrator.rule;

import irmigrator.graph.Node;

import java.util.Objects;

/**
 * Addresses a value slot of a node: a named attribute, the inline
 * {@code repr_str}, or the legacy {@code global_key}.
 *
 * @param kind which slot
 * @param key attribute name for {@link Kind#ATTRIBUTE}, null otherwise
 */
public record NodeField(Kind kind, String key) {

    public enum Kind { ATTRIBUTE, REPR_STR, GLOBAL_KEY }

    public static final NodeField REPR_STR = new NodeField(Kind.REPR_STR, null);
    public static final NodeField GLOBAL_KEY = new NodeField(Kind.GLOBAL_KEY, null);

    public NodeField {
        Objects.requireNonNull(kind, "kind");
        if ((kind == Kind.ATTRIBUTE) != (key != null)) {
            throw new IllegalArgumentException("Attribute fields need a key, other fields must not have one");
        }
    }

    public static NodeField attribute(String key) {
        return new NodeField(Kind.ATTRIBUTE, Objects.requireNonNull(key, "key"));
    }

    String read(Node node) {
        return switch (kind) {
            case ATTRIBUTE -> node.attr(key);
            case REPR_STR -> node.reprStr();
            case GLOBAL_KEY -> node.globalKey();
        };
    }

    void write(Node node, String value) {
        switch (kind) {
            case ATTRIBUTE -> node.attr(key, value);
            case REPR_STR -> node.reprStr(value);
            case GLOBAL_KEY -> node.globalKey(value);
        }
    }

    void clear(Node node) {
        switch (kind) {
            case ATTRIBUTE -> node.removeAttr(key);
            case REPR_STR -> node.reprStr(null);
            case GLOBAL_KEY -> node.globalKey(null);
        }
    }

    @Override
    public String toString() {
        return kind == Kind.ATTRIBUTE ? "attrs." + key : kind.name().toLowerCase();
    }
}
