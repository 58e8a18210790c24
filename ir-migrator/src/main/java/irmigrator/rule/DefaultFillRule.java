package irmigrator.rule;

import irmigrator.exceptions.MalformedNodeException;
import irmigrator.graph.Node;
import irmigrator.graph.NodeTable;

import java.util.Objects;

/**
 * Inserts an attribute with a default scalar value when it is missing.
 * An existing value is left untouched.
 *
 * <p>When {@code expectedTypeKey} is set, visiting a node of any other type
 * fails, which catches a rule registered under the wrong tag.
 *
 * @param expectedTypeKey the only type key this rule may see, or null for any
 * @param key the attribute to fill
 * @param value the default value
 */
public record DefaultFillRule(String expectedTypeKey, String key, String value) implements RewriteRule {

    public DefaultFillRule {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public Node apply(Node node, NodeTable table) throws MalformedNodeException {
        if (expectedTypeKey != null && !expectedTypeKey.equals(node.typeKey())) {
            throw new MalformedNodeException(
                    "Default for '" + key + "' only applies to " + expectedTypeKey, node.typeKey());
        }
        if (!node.hasAttr(key)) {
            node.attr(key, value);
        }
        return node;
    }
}
