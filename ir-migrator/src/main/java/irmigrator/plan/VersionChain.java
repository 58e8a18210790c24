package irmigrator.plan;

import irmigrator.exceptions.UnknownSourceVersionException;

import java.util.*;

/**
 * Immutable, totally ordered chain of version steps {@code V0 -> V1 -> ... -> Vn}.
 *
 * <p>The chain decides which steps a snapshot needs:
 * <ul>
 *   <li>the source state is the known version that is a prefix of the
 *       declared version, so {@code 0.6.1} and {@code 0.6.dev0} start at {@code 0.6}</li>
 *   <li>every step from the source to the target runs, in order</li>
 *   <li>{@code Vn} is the terminal state; a snapshot already there needs no step</li>
 *   <li>an unmatched version is rejected, never guessed</li>
 * </ul>
 *
 * <p>Chains are built with {@link #build(List)}, which validates that:
 * <ul>
 *   <li>each version is left by at most one step and reached by at most one step</li>
 *   <li>there are no cycles</li>
 *   <li>the steps form a single connected path</li>
 * </ul>
 *
 * @see VersionRuleSet
 * @see irmigrator.engine.SnapshotMigrator
 */
public final class VersionChain {

    private final List<VersionRuleSet> steps;
    private final List<String> versions;

    private VersionChain(List<VersionRuleSet> steps, List<String> versions) {
        this.steps = steps;
        this.versions = versions;
    }

    // ===== public API =====

    /** Steps in application order. */
    public List<VersionRuleSet> steps() {
        return steps;
    }

    /** Known versions {@code V0 .. Vn} in increasing order. */
    public List<String> versions() {
        return versions;
    }

    /** The current format version, {@code Vn}. */
    public String terminalVersion() {
        return versions.get(versions.size() - 1);
    }

    /**
     * Whether a declared version is already at the terminal state.
     *
     * @param declared version string from a snapshot
     */
    public boolean isTerminal(String declared) {
        return matches(terminalVersion(), declared);
    }

    /**
     * Resolves the steps needed to bring a snapshot to the terminal version.
     *
     * @param declared version string from a snapshot
     * @return the steps in application order, empty if already terminal
     * @throws UnknownSourceVersionException if no known version matches
     */
    public List<VersionRuleSet> stepsFrom(String declared) throws UnknownSourceVersionException {
        return stepsBetween(declared, terminalVersion());
    }

    /**
     * Resolves the steps needed to bring a snapshot to a known target version.
     *
     * @param declared version string from a snapshot
     * @param target a known version at or after the source
     * @return the steps in application order, empty if already at the target
     * @throws UnknownSourceVersionException if no known version matches {@code declared}
     * @throws IllegalArgumentException if the target is unknown or lies before the source
     */
    public List<VersionRuleSet> stepsBetween(String declared, String target)
            throws UnknownSourceVersionException {
        Objects.requireNonNull(declared, "declared");
        int targetPos = versions.indexOf(target);
        if (targetPos < 0) {
            throw new IllegalArgumentException("Unknown target version " + target + ", known: " + versions);
        }

        int sourcePos = sourcePosition(declared);
        if (sourcePos < 0) {
            throw new UnknownSourceVersionException(declared);
        }
        if (sourcePos > targetPos) {
            throw new IllegalArgumentException(
                    "Cannot downgrade from version " + declared + " to " + target);
        }
        return steps.subList(sourcePos, targetPos);
    }

    /**
     * Checks whether a known version matches a declared version.
     *
     * <p>The known version must be a prefix of the declared one, ending at a
     * component boundary: {@code 0.6} matches {@code 0.6}, {@code 0.6.1} and
     * {@code 0.6.dev0}, but not {@code 0.60}.
     */
    public static boolean matches(String known, String declared) {
        if (!declared.startsWith(known)) return false;
        if (declared.length() == known.length()) return true;
        return !Character.isDigit(declared.charAt(known.length()));
    }

    private int sourcePosition(String declared) {
        // longest matching prefix wins when known versions nest (0.6 and 0.6.1)
        int best = -1;
        for (int i = 0; i < versions.size(); i++) {
            String known = versions.get(i);
            if (matches(known, declared) && (best < 0 || known.length() > versions.get(best).length())) {
                best = i;
            }
        }
        return best;
    }

    @Override
    public String toString() {
        return "VersionChain" + versions;
    }

    // ===== factory =====

    /**
     * Builds a chain from version steps given in any order.
     *
     * @param ruleSets one rule set per version step
     * @return the validated chain
     * @throws IllegalArgumentException if the steps do not form a single path
     */
    public static VersionChain build(List<VersionRuleSet> ruleSets) {
        Objects.requireNonNull(ruleSets, "ruleSets");
        if (ruleSets.isEmpty()) {
            throw new IllegalArgumentException("A version chain needs at least one step");
        }

        Map<String, VersionRuleSet> byFrom = new LinkedHashMap<>();
        Map<String, String> nextVersion = new HashMap<>();
        Set<String> targets = new HashSet<>();

        for (VersionRuleSet rs : ruleSets) {
            if (byFrom.containsKey(rs.from())) {
                throw new IllegalArgumentException("Duplicate step from version " + rs.from());
            }
            if (!targets.add(rs.to())) {
                throw new IllegalArgumentException("Multiple steps reach version " + rs.to());
            }
            byFrom.put(rs.from(), rs);
            nextVersion.put(rs.from(), rs.to());
        }

        detectCycles(nextVersion);

        List<String> starts = byFrom.keySet().stream().filter(v -> !targets.contains(v)).toList();
        if (starts.size() != 1) {
            throw new IllegalArgumentException("Version steps do not form a single chain, starts: " + starts);
        }

        List<VersionRuleSet> ordered = new ArrayList<>();
        List<String> versions = new ArrayList<>();
        String current = starts.get(0);
        versions.add(current);
        while (byFrom.containsKey(current)) {
            VersionRuleSet rs = byFrom.get(current);
            ordered.add(rs);
            current = rs.to();
            versions.add(current);
        }

        if (ordered.size() != ruleSets.size()) {
            throw new IllegalArgumentException("Version steps do not form a single chain: " + versions);
        }

        return new VersionChain(List.copyOf(ordered), List.copyOf(versions));
    }

    private static void detectCycles(Map<String, String> edges) {
        Set<String> visited = new HashSet<>();
        Set<String> stack = new HashSet<>();

        for (String node : edges.keySet()) {
            if (dfsCycle(node, edges, visited, stack)) {
                throw new IllegalArgumentException("Version cycle detected starting at " + node);
            }
        }
    }

    private static boolean dfsCycle(
            String node,
            Map<String, String> edges,
            Set<String> visited,
            Set<String> stack
    ) {
        if (stack.contains(node)) return true;
        if (!visited.add(node)) return false;

        stack.add(node);
        String next = edges.get(node);
        if (next != null && dfsCycle(next, edges, visited, stack)) {
            return true;
        }
        stack.remove(node);
        return false;
    }
}
