package irmigrator.engine;

import irmigrator.exceptions.DanglingReferenceException;
import irmigrator.graph.Node;
import irmigrator.graph.NodeTable;

import java.util.List;

/**
 * Checks reference integrity of a node table at a version-step boundary.
 *
 * <p>Checked, for every node that is not tombstoned:
 * <ul>
 *   <li>attributes marked as references resolve to an existing, non-tombstoned node</li>
 *   <li>{@code data} entries point inside the table; they may name a tombstone,
 *       which container nodes use as their null element</li>
 * </ul>
 * The root index must point inside the table. A root that was live when the
 * migration started must still be live.
 */
public final class ReferenceValidator {

    /**
     * Validates a table whose root may name the null node.
     *
     * @param table the table to check
     * @param root the snapshot root index
     * @throws DanglingReferenceException on the first broken reference
     */
    public void validate(NodeTable table, int root) throws DanglingReferenceException {
        validate(table, root, false);
    }

    /**
     * @param table the table to check
     * @param root the snapshot root index
     * @param liveRoot whether the root must not be tombstoned
     * @throws DanglingReferenceException on the first broken reference
     */
    public void validate(NodeTable table, int root, boolean liveRoot) throws DanglingReferenceException {
        if (!table.contains(root)) {
            throw new DanglingReferenceException(
                    "Root index " + root + " outside table of " + table.size() + " nodes", null, root);
        }
        if (liveRoot && table.isTombstoned(root)) {
            throw new DanglingReferenceException("Root node " + root + " was tombstoned", null, root);
        }

        List<Node> nodes = table.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            if (node.isTombstone()) continue;

            for (String key : node.referenceAttrs()) {
                int target = Integer.parseInt(node.attr(key));
                if (!table.contains(target)) {
                    throw new DanglingReferenceException(
                            "Node " + i + " attribute '" + key + "' points outside the table: " + target,
                            node.typeKey(), target);
                }
                if (table.isTombstoned(target)) {
                    throw new DanglingReferenceException(
                            "Node " + i + " attribute '" + key + "' points at tombstoned node " + target,
                            node.typeKey(), target);
                }
            }

            if (node.data() != null) {
                for (int target : node.data()) {
                    if (!table.contains(target)) {
                        throw new DanglingReferenceException(
                                "Node " + i + " data entry points outside the table: " + target,
                                node.typeKey(), target);
                    }
                }
            }
        }
    }
}
