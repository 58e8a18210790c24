package irmigrator.rule;

import irmigrator.exceptions.MalformedNodeException;
import irmigrator.graph.Node;
import irmigrator.graph.NodeTable;

import java.util.Objects;

/**
 * Inlines a field of a referenced node and retires the referenced node.
 *
 * <p>Reads {@code referenceKey} as a node index, copies the source node's
 * {@code sourceKey} attribute onto the visited node as {@code targetKey},
 * drops {@code referenceKey} and tombstones the source node. The source is
 * read before it is tombstoned.
 *
 * <p>A source that is already tombstoned (shared by several referrers) is
 * still readable, because tombstoning keeps attributes in place.
 *
 * @param referenceKey attribute holding the source node index
 * @param sourceKey attribute of the source node to copy
 * @param targetKey attribute of the visited node receiving the value
 */
public record CrossReferenceRule(String referenceKey, String sourceKey, String targetKey) implements RewriteRule {

    public CrossReferenceRule {
        Objects.requireNonNull(referenceKey, "referenceKey");
        Objects.requireNonNull(sourceKey, "sourceKey");
        Objects.requireNonNull(targetKey, "targetKey");
    }

    @Override
    public Node apply(Node node, NodeTable table) throws MalformedNodeException {
        String raw = node.attr(referenceKey);
        if (raw == null) {
            throw new MalformedNodeException("Missing reference attribute '" + referenceKey + "'", node.typeKey());
        }

        int index;
        try {
            index = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new MalformedNodeException(
                    "Attribute '" + referenceKey + "' is not a node index: " + raw, node.typeKey(), e);
        }
        if (!table.contains(index)) {
            throw new MalformedNodeException(
                    "Attribute '" + referenceKey + "' points outside the table: " + index, node.typeKey());
        }

        Node source = table.get(index);
        if (source == node) {
            throw new MalformedNodeException("Attribute '" + referenceKey + "' refers to the node itself", node.typeKey());
        }
        String value = source.attr(sourceKey);
        if (value == null) {
            throw new MalformedNodeException(
                    "Referenced node " + index + " has no attribute '" + sourceKey + "'", node.typeKey());
        }

        if (source.isReferenceAttr(sourceKey)) {
            node.referenceAttr(targetKey, Integer.parseInt(value));
        } else {
            node.attr(targetKey, value);
        }
        node.removeAttr(referenceKey);
        table.tombstone(index);
        return node;
    }
}
