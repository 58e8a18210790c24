package irmigrator.rule;

import irmigrator.graph.Node;
import irmigrator.graph.NodeTable;

import java.util.Objects;

/**
 * Replaces the type key of the visited node and nothing else.
 *
 * @param newTypeKey the type key to set
 */
public record RenameRule(String newTypeKey) implements RewriteRule {

    public RenameRule {
        Objects.requireNonNull(newTypeKey, "newTypeKey");
        if (newTypeKey.isEmpty()) {
            throw new IllegalArgumentException("Renaming to the tombstone type key is not allowed");
        }
    }

    @Override
    public Node apply(Node node, NodeTable table) {
        return node.typeKey(newTypeKey);
    }
}
