package irmigrator.rule;

import irmigrator.codec.EncodedFragment;
import irmigrator.codec.ValueEncoder;
import irmigrator.exceptions.MalformedNodeException;
import irmigrator.graph.Node;
import irmigrator.graph.NodeTable;

import java.util.Objects;

/**
 * Replaces an inline attribute value with a reference to a new node holding
 * that value in the current format.
 *
 * <p>The value is encoded by the {@link ValueEncoder}; the root node of the
 * resulting fragment is appended to the table and the attribute is set to its
 * index. The appended node must not refer to other fragment nodes, since
 * fragment indices mean nothing in the target table.
 *
 * <p>An attribute that already holds a reference written by a promotion
 * earlier in the same migration is left as is.
 *
 * @param key the attribute to promote
 * @param encoder the value-encoding service
 */
public record PromoteToNodeRule(String key, ValueEncoder encoder) implements RewriteRule {

    public PromoteToNodeRule {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(encoder, "encoder");
    }

    @Override
    public Node apply(Node node, NodeTable table) throws MalformedNodeException {
        String value = node.attr(key);
        if (value == null) {
            throw new MalformedNodeException("Missing attribute '" + key + "' to promote", node.typeKey());
        }
        if (node.isReferenceAttr(key)) {
            return node;
        }

        EncodedFragment fragment = encoder.encode(value);
        Node promoted = fragment.rootNode();
        if (promoted.data() != null || !promoted.referenceAttrs().isEmpty()) {
            throw new MalformedNodeException(
                    "Encoded value for '" + key + "' is not a self-contained node", promoted.typeKey());
        }

        int index = table.append(promoted.copy());
        node.referenceAttr(key, index);
        return node;
    }
}
