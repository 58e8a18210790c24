package irmigrator.engine;

import irmigrator.exceptions.MalformedNodeException;
import irmigrator.exceptions.MigrateException;
import irmigrator.graph.Node;
import irmigrator.graph.NodeTable;
import irmigrator.plan.VersionRuleSet;
import irmigrator.rule.RewriteRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Applies one {@link VersionRuleSet} to a node table in a single linear pass.
 *
 * <p>The pass visits indices {@code 0 .. N-1}, where {@code N} is the table
 * length when the pass starts. Nodes appended by rules during the pass are
 * not visited; they are input to the next version step. For each visited
 * node the rule chain of its current type key runs in registration order and
 * the result is stored back at the same index.
 *
 * <p>Any rule failure aborts the pass. The table is then partially rewritten
 * and must be discarded.
 *
 * <p>Stateless; one instance may serve any number of migrations.
 */
public final class RuleApplicator {

    private static final Logger log = LoggerFactory.getLogger(RuleApplicator.class);

    /**
     * Runs one version step over the table.
     *
     * @param ruleSet the step to apply
     * @param table the table to rewrite in place
     * @return node counts of the pass
     * @throws MigrateException if any rule fails
     */
    public PassResult apply(VersionRuleSet ruleSet, NodeTable table) throws MigrateException {
        final int length = table.size();
        final int tombstonedBefore = table.tombstonedCount();
        int rewritten = 0;

        for (int i = 0; i < length; i++) {
            Node node = table.get(i);
            List<RewriteRule> chain = ruleSet.rulesFor(node.typeKey());
            if (chain.isEmpty()) continue;

            table.set(i, applyChain(chain, node, table, ruleSet, i));
            rewritten++;
        }

        PassResult result = new PassResult(
                length, rewritten, table.size() - length, table.tombstonedCount() - tombstonedBefore);
        log.debug("Applied {}: {}", ruleSet.label(), result);
        return result;
    }

    private static Node applyChain(
            List<RewriteRule> chain,
            Node node,
            NodeTable table,
            VersionRuleSet ruleSet,
            int index
    ) throws MigrateException {
        String originalType = node.typeKey();
        Node current = node;
        for (RewriteRule rule : chain) {
            try {
                current = rule.apply(current, table);
            } catch (MigrateException e) {
                throw e.atNode(ruleSet.label(), index);
            } catch (RuntimeException e) {
                throw new MalformedNodeException("Rule " + rule + " failed: " + e, originalType, e)
                        .atNode(ruleSet.label(), index);
            }
            if (current == null) {
                throw new MalformedNodeException("Rule " + rule + " returned no node", originalType)
                        .atNode(ruleSet.label(), index);
            }
        }
        return current;
    }
}
