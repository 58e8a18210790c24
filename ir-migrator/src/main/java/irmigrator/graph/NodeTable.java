package irmigrator.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, index-addressed sequence of nodes shared by every rule of a migration.
 *
 * <p>Nodes refer to each other by position, so the table only supports
 * operations that never move an existing entry:
 * <ul>
 *   <li>indexed read and indexed in-place replace</li>
 *   <li>append, which always assigns the next sequential index</li>
 *   <li>tombstoning, the only sanctioned way to remove a node</li>
 * </ul>
 *
 * <p>Not thread-safe. A table is owned by the single migration operating on it.
 */
public final class NodeTable {

    private final List<Node> nodes;
    private int tombstoned;

    public NodeTable() {
        this.nodes = new ArrayList<>();
    }

    public NodeTable(Collection<Node> nodes) {
        this.nodes = new ArrayList<>(nodes.size() + 16);
        nodes.forEach(n -> this.nodes.add(Objects.requireNonNull(n, "node")));
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(int index) {
        return index >= 0 && index < nodes.size();
    }

    /**
     * @throws IndexOutOfBoundsException if the index is outside the table
     */
    public Node get(int index) {
        return nodes.get(index);
    }

    /**
     * Replaces the node stored at an existing index.
     *
     * @throws IndexOutOfBoundsException if the index is outside the table
     */
    public void set(int index, Node node) {
        nodes.set(index, Objects.requireNonNull(node, "node"));
    }

    /**
     * Appends a node.
     *
     * @return the index assigned to the node, equal to the table size before the call
     */
    public int append(Node node) {
        int index = nodes.size();
        nodes.add(Objects.requireNonNull(node, "node"));
        return index;
    }

    /**
     * Marks the node at {@code index} as logically deleted. Its position and
     * remaining fields are left in place.
     *
     * @throws IndexOutOfBoundsException if the index is outside the table
     */
    public void tombstone(int index) {
        Node node = nodes.get(index);
        if (!node.isTombstone()) {
            node.typeKey(Node.TOMBSTONE);
            tombstoned++;
        }
    }

    public boolean isTombstoned(int index) {
        return nodes.get(index).isTombstone();
    }

    /** Number of nodes tombstoned through {@link #tombstone(int)} on this table. */
    public int tombstonedCount() {
        return tombstoned;
    }

    /** Read-only view of the nodes. */
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }
}
