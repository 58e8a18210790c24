package irmigrator.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A generic, mutable node record of a snapshot's node table.
 *
 * <p>A node consists of:
 * <ul>
 *   <li>a type key, used as the rewrite dispatch key</li>
 *   <li>string-valued attributes; node indices are rendered as decimal strings</li>
 *   <li>optional legacy inline representations ({@code repr_str}, {@code global_key})</li>
 *   <li>optional {@code data} (child indices of container nodes) and
 *       {@code keys} (string keys of string-keyed maps)</li>
 *   <li>unrecognized record fields, kept verbatim as JSON text</li>
 * </ul>
 *
 * <p>Attributes written by a promotion rule are additionally marked as
 * references, so reference integrity can be checked without knowing the
 * schema of every node kind. The mark is not part of the wire format.
 *
 * <p>A node whose type key is {@link #TOMBSTONE} is logically absent.
 */
public final class Node {

    /** Type key of a tombstoned (logically deleted) or null node. */
    public static final String TOMBSTONE = "";

    private String typeKey;
    private final Map<String, String> attrs = new LinkedHashMap<>();
    private final Set<String> referenceAttrs = new LinkedHashSet<>();
    private boolean attrsRecord;
    private String reprStr;
    private String globalKey;
    private List<Integer> data;
    private List<String> keys;
    private final Map<String, String> extraFields = new LinkedHashMap<>();

    public Node(String typeKey) {
        this.typeKey = Objects.requireNonNull(typeKey, "typeKey");
    }

    public Node(String typeKey, Map<String, String> attrs) {
        this(typeKey);
        this.attrs.putAll(attrs);
    }

    /** Creates a node with the tombstone type key and no attributes. */
    public static Node tombstone() {
        return new Node(TOMBSTONE);
    }

    // ===== type key =====

    public String typeKey() {
        return typeKey;
    }

    public Node typeKey(String typeKey) {
        this.typeKey = Objects.requireNonNull(typeKey, "typeKey");
        return this;
    }

    public boolean isTombstone() {
        return TOMBSTONE.equals(typeKey);
    }

    // ===== attributes =====

    public boolean hasAttr(String key) {
        return attrs.containsKey(key);
    }

    /**
     * @return the attribute value, or null if absent
     */
    public String attr(String key) {
        return attrs.get(key);
    }

    /**
     * Sets a plain (non-reference) attribute value, clearing any reference mark.
     */
    public Node attr(String key, String value) {
        attrs.put(key, Objects.requireNonNull(value, "value"));
        referenceAttrs.remove(key);
        return this;
    }

    /**
     * Sets an attribute holding the index of another node in the same table.
     */
    public Node referenceAttr(String key, int index) {
        attrs.put(key, Integer.toString(index));
        referenceAttrs.add(key);
        return this;
    }

    /**
     * Removes an attribute and its reference mark.
     *
     * @return the previous value, or null if absent
     */
    public String removeAttr(String key) {
        referenceAttrs.remove(key);
        return attrs.remove(key);
    }

    public boolean isReferenceAttr(String key) {
        return referenceAttrs.contains(key);
    }

    /** Read-only view of the attributes, in insertion order. */
    public Map<String, String> attrs() {
        return Collections.unmodifiableMap(attrs);
    }

    /**
     * Whether the record carries an {@code attrs} object even when it is empty.
     * Setting any attribute implies one.
     */
    public boolean hasAttrsRecord() {
        return attrsRecord || !attrs.isEmpty();
    }

    public Node attrsRecord(boolean present) {
        this.attrsRecord = present;
        return this;
    }

    /** Read-only view of the attribute keys marked as node references. */
    public Set<String> referenceAttrs() {
        return Collections.unmodifiableSet(referenceAttrs);
    }

    // ===== legacy inline fields =====

    public String reprStr() {
        return reprStr;
    }

    public Node reprStr(String reprStr) {
        this.reprStr = reprStr;
        return this;
    }

    public String globalKey() {
        return globalKey;
    }

    public Node globalKey(String globalKey) {
        this.globalKey = globalKey;
        return this;
    }

    // ===== container payload =====

    /**
     * @return read-only child indices of a container node, or null if the record has no {@code data}
     */
    public List<Integer> data() {
        return data == null ? null : Collections.unmodifiableList(data);
    }

    public Node data(List<Integer> data) {
        this.data = data == null ? null : new ArrayList<>(data);
        return this;
    }

    /**
     * @return read-only string keys of a string-keyed map node, or null if the record has no {@code keys}
     */
    public List<String> keys() {
        return keys == null ? null : Collections.unmodifiableList(keys);
    }

    public Node keys(List<String> keys) {
        this.keys = keys == null ? null : new ArrayList<>(keys);
        return this;
    }

    // ===== unknown record fields =====

    /** Unrecognized record fields as raw JSON text, in document order. */
    public Map<String, String> extraFields() {
        return Collections.unmodifiableMap(extraFields);
    }

    public Node extraField(String name, String rawJson) {
        extraFields.put(name, rawJson);
        return this;
    }

    // ===== copying =====

    /** Returns a deep copy of this node, reference marks included. */
    public Node copy() {
        Node n = new Node(typeKey);
        n.attrs.putAll(attrs);
        n.referenceAttrs.addAll(referenceAttrs);
        n.attrsRecord = attrsRecord;
        n.reprStr = reprStr;
        n.globalKey = globalKey;
        n.data(data);
        n.keys(keys);
        n.extraFields.putAll(extraFields);
        return n;
    }

    /**
     * Structural equality over the wire-visible content. Reference marks are
     * not compared.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node other)) return false;
        return typeKey.equals(other.typeKey)
                && attrs.equals(other.attrs)
                && Objects.equals(reprStr, other.reprStr)
                && Objects.equals(globalKey, other.globalKey)
                && Objects.equals(data, other.data)
                && Objects.equals(keys, other.keys)
                && extraFields.equals(other.extraFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeKey, attrs, reprStr, globalKey, data, keys, extraFields);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Node{type_key='").append(typeKey).append('\'');
        if (!attrs.isEmpty()) sb.append(", attrs=").append(attrs);
        if (reprStr != null) sb.append(", repr_str='").append(reprStr).append('\'');
        if (globalKey != null) sb.append(", global_key='").append(globalKey).append('\'');
        if (data != null) sb.append(", data=").append(data);
        if (keys != null) sb.append(", keys=").append(keys);
        return sb.append('}').toString();
    }
}
