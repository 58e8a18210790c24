package irmigrator.rule;

import irmigrator.graph.Node;
import irmigrator.graph.NodeTable;

import java.util.Objects;

/**
 * Moves a value from one slot of the visited node to another, for example
 * from the legacy {@code global_key} into {@code repr_str}. Does nothing when
 * the source slot is empty.
 *
 * <p>Moving between two attributes keeps the reference mark of the value.
 *
 * @param source slot to read and clear
 * @param target slot to write
 */
public record KeyMoveRule(NodeField source, NodeField target) implements RewriteRule {

    public KeyMoveRule {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        if (source.equals(target)) {
            throw new IllegalArgumentException("Source and target are the same field: " + source);
        }
    }

    @Override
    public Node apply(Node node, NodeTable table) {
        String value = source.read(node);
        if (value == null) {
            return node;
        }
        boolean reference = source.kind() == NodeField.Kind.ATTRIBUTE && node.isReferenceAttr(source.key());

        source.clear(node);
        if (reference && target.kind() == NodeField.Kind.ATTRIBUTE) {
            node.referenceAttr(target.key(), Integer.parseInt(value));
        } else {
            target.write(node, value);
        }
        return node;
    }
}
