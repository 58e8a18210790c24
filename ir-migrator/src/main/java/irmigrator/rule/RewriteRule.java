package irmigrator.rule;

import irmigrator.codec.ValueEncoder;
import irmigrator.exceptions.MigrateException;
import irmigrator.graph.Node;
import irmigrator.graph.NodeTable;

/**
 * A single rewrite step applied to one node during a version step.
 *
 * <p>A rule receives the node being visited and the shared node table. It
 * returns the node to store back at the visited index, and may as a side
 * effect append nodes to the table or tombstone other nodes. It must never
 * move or physically remove an entry.
 *
 * <p>The supported rule shapes are the records in this package:
 * <ul>
 *   <li>{@link RenameRule} - replace the type key</li>
 *   <li>{@link DefaultFillRule} - insert a missing attribute</li>
 *   <li>{@link PromoteToNodeRule} - turn an inline value into an appended node</li>
 *   <li>{@link CrossReferenceRule} - pull a field from a referenced node and tombstone it</li>
 *   <li>{@link KeyMoveRule} - relocate a value between keys or representations</li>
 * </ul>
 *
 * <h2>Example:</h2>
 * <pre>
 * VersionRuleSet.builder("0.6", "0.7")
 *     .on("Variable", RewriteRule.rename("tir.Var"), RewriteRule.promote("name", encoder))
 *     .build();
 * </pre>
 *
 * @see irmigrator.plan.VersionRuleSet
 * @see irmigrator.engine.RuleApplicator
 */
public interface RewriteRule {

    /**
     * Rewrites a node.
     *
     * @param node the node being visited (output of the previous rule in the chain)
     * @param table the node table being migrated
     * @return the rewritten node (must not be null)
     * @throws MigrateException if the node does not have the expected shape
     */
    Node apply(Node node, NodeTable table) throws MigrateException;

    // ===== factories =====

    static RewriteRule rename(String newTypeKey) {
        return new RenameRule(newTypeKey);
    }

    static RewriteRule defaultFill(String key, String value) {
        return new DefaultFillRule(null, key, value);
    }

    static RewriteRule defaultFill(String expectedTypeKey, String key, String value) {
        return new DefaultFillRule(expectedTypeKey, key, value);
    }

    static RewriteRule promote(String key, ValueEncoder encoder) {
        return new PromoteToNodeRule(key, encoder);
    }

    static RewriteRule crossReference(String referenceKey, String sourceKey, String targetKey) {
        return new CrossReferenceRule(referenceKey, sourceKey, targetKey);
    }

    static RewriteRule move(NodeField source, NodeField target) {
        return new KeyMoveRule(source, target);
    }
}
