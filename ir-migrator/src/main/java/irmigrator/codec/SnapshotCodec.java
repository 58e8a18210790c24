package irmigrator.codec;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import irmigrator.exceptions.SnapshotFormatException;
import irmigrator.graph.Node;
import irmigrator.graph.NodeTable;
import irmigrator.graph.Snapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes and encodes the JSON snapshot envelope.
 *
 * <h2>Envelope:</h2>
 * <pre>
 * {
 *   "root": 1,
 *   "nodes": [ {"type_key": ""}, {"type_key": "Variable", "attrs": {"name": "x"}} ],
 *   "b64ndarrays": [],
 *   "attrs": {"tvm_version": "0.6.0"}
 * }
 * </pre>
 *
 * <p>Node records carry {@code type_key}, {@code attrs} (string values),
 * and optionally {@code repr_str}, {@code global_key}, {@code data} and
 * {@code keys}. Unknown top-level and node fields are preserved verbatim.
 */
public final class SnapshotCodec {

    public static final String DEFAULT_VERSION_KEY = "tvm_version";

    private static final String ROOT = "root";
    private static final String NODES = "nodes";
    private static final String ATTRS = "attrs";
    private static final String TYPE_KEY = "type_key";
    private static final String REPR_STR = "repr_str";
    private static final String GLOBAL_KEY = "global_key";
    private static final String DATA = "data";
    private static final String KEYS = "keys";

    private static final Gson COMPACT = new GsonBuilder().disableHtmlEscaping().create();

    private final String versionKey;
    private final Gson gson;

    public SnapshotCodec() {
        this(DEFAULT_VERSION_KEY, true);
    }

    /**
     * @param versionKey envelope attribute holding the format version
     * @param prettyPrint whether {@link #encode(Snapshot)} indents its output
     */
    public SnapshotCodec(String versionKey, boolean prettyPrint) {
        this.versionKey = Objects.requireNonNull(versionKey, "versionKey");
        GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
        if (prettyPrint) builder.setPrettyPrinting();
        this.gson = builder.create();
    }

    public String versionKey() {
        return versionKey;
    }

    // ===== decoding =====

    /**
     * Parses snapshot text.
     *
     * @param text the serialized envelope
     * @return the decoded snapshot
     * @throws SnapshotFormatException if the text is not a valid envelope
     */
    public Snapshot decode(String text) throws SnapshotFormatException {
        Objects.requireNonNull(text, "text");
        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            throw new SnapshotFormatException("Snapshot is not valid JSON: " + e.getMessage(), e);
        }
        if (!parsed.isJsonObject()) {
            throw new SnapshotFormatException("Snapshot envelope must be a JSON object");
        }
        JsonObject envelope = parsed.getAsJsonObject();

        JsonObject attrs = requireObject(envelope, ATTRS, "envelope");
        String version = requireString(attrs, versionKey, "envelope attrs");
        int root = requireInt(envelope, ROOT, "envelope");

        JsonArray records = requireArray(envelope, NODES, "envelope");
        List<Node> nodes = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            JsonElement record = records.get(i);
            if (!record.isJsonObject()) {
                throw new SnapshotFormatException("Node record " + i + " is not a JSON object");
            }
            nodes.add(decodeNode(record.getAsJsonObject(), i));
        }

        Snapshot snapshot = new Snapshot(versionKey, version, root, new NodeTable(nodes));
        for (Map.Entry<String, JsonElement> e : attrs.entrySet()) {
            if (!e.getKey().equals(versionKey)) {
                snapshot.extraAttr(e.getKey(), COMPACT.toJson(e.getValue()));
            }
        }
        for (Map.Entry<String, JsonElement> e : envelope.entrySet()) {
            String name = e.getKey();
            if (!name.equals(ROOT) && !name.equals(NODES) && !name.equals(ATTRS)) {
                snapshot.extraField(name, COMPACT.toJson(e.getValue()));
            }
        }
        return snapshot;
    }

    private Node decodeNode(JsonObject record, int index) throws SnapshotFormatException {
        String where = "node " + index;
        Node node = new Node(requireString(record, TYPE_KEY, where));

        for (Map.Entry<String, JsonElement> e : record.entrySet()) {
            String name = e.getKey();
            JsonElement value = e.getValue();
            switch (name) {
                case TYPE_KEY -> { }
                case ATTRS -> {
                    if (!value.isJsonObject()) {
                        throw new SnapshotFormatException(where + ": 'attrs' must be an object");
                    }
                    node.attrsRecord(true);
                    for (Map.Entry<String, JsonElement> attr : value.getAsJsonObject().entrySet()) {
                        node.attr(attr.getKey(), scalar(attr.getValue(), where + " attr '" + attr.getKey() + "'"));
                    }
                }
                case REPR_STR -> node.reprStr(scalar(value, where + " repr_str"));
                case GLOBAL_KEY -> node.globalKey(scalar(value, where + " global_key"));
                case DATA -> node.data(indexList(value, where));
                case KEYS -> node.keys(stringList(value, where));
                default -> node.extraField(name, COMPACT.toJson(value));
            }
        }
        return node;
    }

    // ===== encoding =====

    /**
     * Serializes a snapshot.
     *
     * @param snapshot the snapshot to encode
     * @return the JSON envelope text
     */
    public String encode(Snapshot snapshot) {
        JsonObject envelope = new JsonObject();
        envelope.addProperty(ROOT, snapshot.root());

        JsonArray nodes = new JsonArray();
        for (Node node : snapshot.nodes().nodes()) {
            nodes.add(encodeNode(node));
        }
        envelope.add(NODES, nodes);

        snapshot.extraFields().forEach((name, raw) -> envelope.add(name, JsonParser.parseString(raw)));

        JsonObject attrs = new JsonObject();
        attrs.addProperty(snapshot.versionKey(), snapshot.version());
        snapshot.extraAttrs().forEach((name, raw) -> attrs.add(name, JsonParser.parseString(raw)));
        envelope.add(ATTRS, attrs);

        return gson.toJson(envelope);
    }

    private static JsonObject encodeNode(Node node) {
        JsonObject record = new JsonObject();
        record.addProperty(TYPE_KEY, node.typeKey());
        if (node.reprStr() != null) record.addProperty(REPR_STR, node.reprStr());
        if (node.globalKey() != null) record.addProperty(GLOBAL_KEY, node.globalKey());
        if (node.hasAttrsRecord()) {
            JsonObject attrs = new JsonObject();
            node.attrs().forEach(attrs::addProperty);
            record.add(ATTRS, attrs);
        }
        if (node.data() != null) {
            JsonArray data = new JsonArray();
            node.data().forEach(data::add);
            record.add(DATA, data);
        }
        if (node.keys() != null) {
            JsonArray keys = new JsonArray();
            node.keys().forEach(keys::add);
            record.add(KEYS, keys);
        }
        node.extraFields().forEach((name, raw) -> record.add(name, JsonParser.parseString(raw)));
        return record;
    }

    // ===== helpers =====

    private static JsonObject requireObject(JsonObject parent, String name, String where)
            throws SnapshotFormatException {
        JsonElement e = parent.get(name);
        if (e == null || !e.isJsonObject()) {
            throw new SnapshotFormatException(where + ": missing object '" + name + "'");
        }
        return e.getAsJsonObject();
    }

    private static JsonArray requireArray(JsonObject parent, String name, String where)
            throws SnapshotFormatException {
        JsonElement e = parent.get(name);
        if (e == null || !e.isJsonArray()) {
            throw new SnapshotFormatException(where + ": missing array '" + name + "'");
        }
        return e.getAsJsonArray();
    }

    private static String requireString(JsonObject parent, String name, String where)
            throws SnapshotFormatException {
        JsonElement e = parent.get(name);
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString()) {
            throw new SnapshotFormatException(where + ": missing string '" + name + "'");
        }
        return e.getAsString();
    }

    private static int requireInt(JsonObject parent, String name, String where)
            throws SnapshotFormatException {
        JsonElement e = parent.get(name);
        if (e == null || !e.isJsonPrimitive()) {
            throw new SnapshotFormatException(where + ": missing integer '" + name + "'");
        }
        return parseIndex(e.getAsJsonPrimitive(), where + " " + name);
    }

    private static String scalar(JsonElement value, String where) throws SnapshotFormatException {
        if (value == null || !value.isJsonPrimitive()) {
            throw new SnapshotFormatException(where + " must be a string or scalar");
        }
        return value.getAsString();
    }

    private static List<Integer> indexList(JsonElement value, String where) throws SnapshotFormatException {
        if (!value.isJsonArray()) {
            throw new SnapshotFormatException(where + ": 'data' must be an array");
        }
        List<Integer> out = new ArrayList<>();
        for (JsonElement e : value.getAsJsonArray()) {
            if (!e.isJsonPrimitive()) {
                throw new SnapshotFormatException(where + ": 'data' entries must be integers");
            }
            out.add(parseIndex(e.getAsJsonPrimitive(), where + " data"));
        }
        return out;
    }

    private static List<String> stringList(JsonElement value, String where) throws SnapshotFormatException {
        if (!value.isJsonArray()) {
            throw new SnapshotFormatException(where + ": 'keys' must be an array");
        }
        List<String> out = new ArrayList<>();
        for (JsonElement e : value.getAsJsonArray()) {
            out.add(scalar(e, where + " keys entry"));
        }
        return out;
    }

    private static int parseIndex(JsonPrimitive p, String where) throws SnapshotFormatException {
        try {
            return Integer.parseInt(p.getAsString().trim());
        } catch (NumberFormatException e) {
            throw new SnapshotFormatException(where + " is not an integer: " + p.getAsString(), e);
        }
    }
}
