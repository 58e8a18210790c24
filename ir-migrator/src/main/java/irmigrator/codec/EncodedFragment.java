package irmigrator.codec;

import irmigrator.graph.Node;

import java.util.List;
import java.util.Objects;

/**
 * A minimal node-table fragment produced by a {@link ValueEncoder}.
 *
 * @param root index of the node representing the encoded value, within {@code nodes}
 * @param nodes the fragment's own node table
 */
public record EncodedFragment(int root, List<Node> nodes) {

    public EncodedFragment {
        Objects.requireNonNull(nodes, "nodes");
        if (root < 0 || root >= nodes.size()) {
            throw new IllegalArgumentException(
                    "Fragment root " + root + " outside fragment of " + nodes.size() + " nodes");
        }
        nodes = List.copyOf(nodes);
    }

    /** Returns the node representing the encoded value. */
    public Node rootNode() {
        return nodes.get(root);
    }
}
