package irmigrator.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Decoded snapshot envelope: declared version, root index and node table.
 *
 * <p>The version lives in the envelope {@code attrs} under a configurable key
 * ({@code tvm_version} by default). Other envelope attributes and unrecognized
 * top-level fields are kept as raw JSON text so that re-encoding preserves them.
 */
public final class Snapshot {

    private final String versionKey;
    private String version;
    private final Map<String, String> extraAttrs = new LinkedHashMap<>();
    private final NodeTable nodes;
    private final Map<String, String> extraFields = new LinkedHashMap<>();
    private int root;

    public Snapshot(String versionKey, String version, int root, NodeTable nodes) {
        this.versionKey = Objects.requireNonNull(versionKey, "versionKey");
        this.version = Objects.requireNonNull(version, "version");
        this.root = root;
        this.nodes = Objects.requireNonNull(nodes, "nodes");
    }

    public String versionKey() {
        return versionKey;
    }

    public String version() {
        return version;
    }

    public void version(String version) {
        this.version = Objects.requireNonNull(version, "version");
    }

    public int root() {
        return root;
    }

    public void root(int root) {
        this.root = root;
    }

    public NodeTable nodes() {
        return nodes;
    }

    /** Envelope attributes other than the version, as raw JSON text. */
    public Map<String, String> extraAttrs() {
        return Collections.unmodifiableMap(extraAttrs);
    }

    public void extraAttr(String key, String rawJson) {
        if (key.equals(versionKey)) {
            throw new IllegalArgumentException("The version is set through version(String)");
        }
        extraAttrs.put(key, Objects.requireNonNull(rawJson, "rawJson"));
    }

    /** Unrecognized top-level fields as raw JSON text, in document order. */
    public Map<String, String> extraFields() {
        return Collections.unmodifiableMap(extraFields);
    }

    public void extraField(String name, String rawJson) {
        extraFields.put(name, rawJson);
    }

    @Override
    public String toString() {
        return "Snapshot{" + versionKey + "=" + version() + ", root=" + root + ", nodes=" + nodes.size() + '}';
    }
}
