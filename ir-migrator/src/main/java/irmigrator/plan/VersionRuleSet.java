package irmigrator.plan;

import irmigrator.rule.RewriteRule;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable set of rewrite rules for exactly one version step {@code from -> to}.
 *
 * <p>Rules are keyed by node type key. A type key may carry several rules;
 * they run in the order they were registered, each receiving the output of
 * the previous one.
 *
 * <h2>Example:</h2>
 * <pre>
 * VersionRuleSet step = VersionRuleSet.builder("0.7", "0.8")
 *     .on("IRModule", RewriteRule.defaultFill("IRModule", "attrs", "0"))
 *     .build();
 * </pre>
 *
 * @see VersionChain
 */
public final class VersionRuleSet {

    private final String from;
    private final String to;
    private final Map<String, List<RewriteRule>> rules;

    private VersionRuleSet(String from, String to, Map<String, List<RewriteRule>> rules) {
        this.from = from;
        this.to = to;
        this.rules = rules;
    }

    /** Version prefix this step accepts. */
    public String from() {
        return from;
    }

    /** Version stamped after this step. */
    public String to() {
        return to;
    }

    /**
     * Gets the rule chain registered for a type key.
     *
     * @param typeKey the node type key
     * @return the rules in application order, empty if none are registered
     */
    public List<RewriteRule> rulesFor(String typeKey) {
        return rules.getOrDefault(typeKey, List.of());
    }

    /** Type keys with at least one rule, in registration order. */
    public Set<String> typeKeys() {
        return rules.keySet();
    }

    /** Human-readable step label, e.g. {@code 0.6 -> 0.7}. */
    public String label() {
        return from + " -> " + to;
    }

    @Override
    public String toString() {
        return "VersionRuleSet{" + label() + ", typeKeys=" + rules.size() + '}';
    }

    // ===== factory =====

    /**
     * Creates a builder for the step {@code from -> to}.
     *
     * @param from version prefix accepted by the step
     * @param to version stamped after the step
     * @return a new builder
     */
    public static Builder builder(String from, String to) {
        return new Builder(from, to);
    }

    /**
     * Builder for {@link VersionRuleSet}.
     */
    public static final class Builder {
        private final String from;
        private final String to;
        private final Map<String, List<RewriteRule>> rules = new LinkedHashMap<>();

        private Builder(String from, String to) {
            this.from = requireVersion(from, "from");
            this.to = requireVersion(to, "to");
            if (this.from.equals(this.to)) {
                throw new IllegalArgumentException("Version step must change the version: " + from);
            }
        }

        /**
         * Registers the rule chain for one type key.
         *
         * @param typeKey the node type key
         * @param chain the rules, in application order
         * @return this builder
         * @throws IllegalArgumentException if the chain is empty or the type key is already registered
         */
        public Builder on(String typeKey, RewriteRule... chain) {
            Objects.requireNonNull(typeKey, "typeKey");
            if (typeKey.isEmpty()) {
                throw new IllegalArgumentException("Rules cannot be registered for tombstoned nodes");
            }
            if (chain.length == 0) {
                throw new IllegalArgumentException("Empty rule chain for " + typeKey);
            }
            if (rules.containsKey(typeKey)) {
                throw new IllegalArgumentException(
                        "Duplicate rule chain for " + typeKey + " in step " + from + " -> " + to);
            }
            Arrays.stream(chain).forEach(r -> Objects.requireNonNull(r, "rule"));
            rules.put(typeKey, List.of(chain));
            return this;
        }

        public VersionRuleSet build() {
            return new VersionRuleSet(from, to, Collections.unmodifiableMap(new LinkedHashMap<>(rules)));
        }

        private static String requireVersion(String v, String name) {
            Objects.requireNonNull(v, name);
            if (v.isBlank()) {
                throw new IllegalArgumentException("Blank version: " + name);
            }
            return v;
        }
    }
}
