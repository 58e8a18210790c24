package irmigrator.codec;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import irmigrator.exceptions.SnapshotFormatException;
import irmigrator.graph.Node;
import irmigrator.graph.NodeTable;
import irmigrator.graph.Snapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SnapshotCodec")
class SnapshotCodecTest {

    private final SnapshotCodec codec = new SnapshotCodec(SnapshotCodec.DEFAULT_VERSION_KEY, false);

    private static final String ENVELOPE = """
            {
              "root": 3,
              "nodes": [
                {"type_key": ""},
                {"type_key": "relay.Op", "global_key": "nn.relu"},
                {"type_key": "StrMap", "keys": ["a", "b"], "data": [1, 0]},
                {"type_key": "relay.Module", "attrs": {"functions": "2", "count": 7}, "span_info": {"line": 4}}
              ],
              "b64ndarrays": ["AAAA"],
              "attrs": {"tvm_version": "0.6.0", "producer": "unit"}
            }
            """;

    @Nested
    @DisplayName("decode")
    class Decode {

        @Test
        @DisplayName("should read envelope and node fields")
        void shouldReadFields() throws SnapshotFormatException {
            Snapshot snapshot = codec.decode(ENVELOPE);

            assertThat(snapshot.version()).isEqualTo("0.6.0");
            assertThat(snapshot.root()).isEqualTo(3);
            assertThat(snapshot.nodes().size()).isEqualTo(4);
            assertThat(snapshot.nodes().get(0).isTombstone()).isTrue();
            assertThat(snapshot.nodes().get(1).globalKey()).isEqualTo("nn.relu");
            assertThat(snapshot.nodes().get(2).keys()).containsExactly("a", "b");
            assertThat(snapshot.nodes().get(2).data()).containsExactly(1, 0);
            assertThat(snapshot.nodes().get(3).attr("count")).isEqualTo("7");
            assertThat(snapshot.extraAttrs()).containsEntry("producer", "\"unit\"");
        }

        @Test
        @DisplayName("should not mark decoded attributes as references")
        void shouldNotMarkReferences() throws SnapshotFormatException {
            Node module = codec.decode(ENVELOPE).nodes().get(3);

            assertThat(module.referenceAttrs()).isEmpty();
        }

        @Test
        @DisplayName("should reject invalid JSON")
        void shouldRejectInvalidJson() {
            assertThatThrownBy(() -> codec.decode("{\"root\": "))
                    .isInstanceOf(SnapshotFormatException.class)
                    .hasMessageContaining("not valid JSON");
        }

        @Test
        @DisplayName("should reject an envelope without version")
        void shouldRejectMissingVersion() {
            assertThatThrownBy(() -> codec.decode("{\"root\": 0, \"nodes\": [], \"attrs\": {}}"))
                    .isInstanceOf(SnapshotFormatException.class)
                    .hasMessageContaining("tvm_version");
        }

        @Test
        @DisplayName("should reject a node without type key")
        void shouldRejectMissingTypeKey() {
            String text = "{\"root\": 0, \"nodes\": [{\"attrs\": {}}], \"attrs\": {\"tvm_version\": \"0.6\"}}";

            assertThatThrownBy(() -> codec.decode(text))
                    .isInstanceOf(SnapshotFormatException.class)
                    .hasMessageContaining("node 0");
        }

        @Test
        @DisplayName("should reject non-integer data entries")
        void shouldRejectBadData() {
            String text = "{\"root\": 0, \"nodes\": [{\"type_key\": \"Array\", \"data\": [\"x\"]}],"
                    + " \"attrs\": {\"tvm_version\": \"0.6\"}}";

            assertThatThrownBy(() -> codec.decode(text))
                    .isInstanceOf(SnapshotFormatException.class)
                    .hasMessageContaining("not an integer");
        }

        @Test
        @DisplayName("should reject nested attribute values")
        void shouldRejectNestedAttribute() {
            String text = "{\"root\": 0, \"nodes\": [{\"type_key\": \"T\", \"attrs\": {\"a\": [1]}}],"
                    + " \"attrs\": {\"tvm_version\": \"0.6\"}}";

            assertThatThrownBy(() -> codec.decode(text))
                    .isInstanceOf(SnapshotFormatException.class);
        }
    }

    @Nested
    @DisplayName("encode")
    class Encode {

        @Test
        @DisplayName("should preserve unknown envelope and node fields")
        void shouldPreserveUnknownFields() throws SnapshotFormatException {
            JsonObject out = JsonParser.parseString(codec.encode(codec.decode(ENVELOPE))).getAsJsonObject();

            assertThat(out.get("b64ndarrays")).isEqualTo(JsonParser.parseString("[\"AAAA\"]"));
            JsonObject module = out.getAsJsonArray("nodes").get(3).getAsJsonObject();
            assertThat(module.get("span_info")).isEqualTo(JsonParser.parseString("{\"line\": 4}"));
            assertThat(out.getAsJsonObject("attrs").get("producer").getAsString()).isEqualTo("unit");
        }

        @Test
        @DisplayName("should keep envelope attribute types and empty node attrs")
        void shouldRoundTripExactly() throws SnapshotFormatException {
            String text = """
                    {"root": 1,
                     "nodes": [{"type_key": ""}, {"type_key": "IRModule", "attrs": {}}],
                     "attrs": {"tvm_version": "0.9", "flag": true, "meta": {"n": 2}}}
                    """;

            String out = codec.encode(codec.decode(text));

            assertThat(JsonParser.parseString(out)).isEqualTo(JsonParser.parseString(text));
        }

        @Test
        @DisplayName("should write attribute values as strings")
        void shouldWriteStrings() throws SnapshotFormatException {
            JsonObject out = JsonParser.parseString(codec.encode(codec.decode(ENVELOPE))).getAsJsonObject();

            JsonObject attrs = out.getAsJsonArray("nodes").get(3).getAsJsonObject().getAsJsonObject("attrs");
            assertThat(attrs.get("count").getAsJsonPrimitive().isString()).isTrue();
        }

        @Test
        @DisplayName("should write the updated version under the configured key")
        void shouldWriteVersion() throws SnapshotFormatException {
            SnapshotCodec custom = new SnapshotCodec("ir_version", false);
            Snapshot snapshot = custom.decode("{\"root\": 0, \"nodes\": [{\"type_key\": \"\"}],"
                    + " \"attrs\": {\"ir_version\": \"0.8\"}}");
            snapshot.version("0.9");

            JsonObject out = JsonParser.parseString(custom.encode(snapshot)).getAsJsonObject();

            assertThat(out.getAsJsonObject("attrs").get("ir_version").getAsString()).isEqualTo("0.9");
        }

        @Test
        @DisplayName("should omit empty node fields and not escape HTML")
        void shouldWriteCompactNodes() {
            Snapshot snapshot = new Snapshot(SnapshotCodec.DEFAULT_VERSION_KEY, "0.9", 1,
                    new NodeTable(List.of(Node.tombstone(), new Node("runtime.String").reprStr("a<b"))));

            String out = codec.encode(snapshot);

            assertThat(out).contains("{\"type_key\":\"\"}");
            assertThat(out).contains("\"repr_str\":\"a<b\"");
            assertThat(out).doesNotContain("\n");
        }

        @Test
        @DisplayName("should indent when pretty printing")
        void shouldPrettyPrint() throws SnapshotFormatException {
            String out = new SnapshotCodec().encode(codec.decode(ENVELOPE));

            assertThat(out).contains("\n  \"nodes\"");
        }
    }

    @Test
    @DisplayName("runtime string encoder should produce a single string node fragment")
    void runtimeStringEncoderShouldProduceStringNode() {
        EncodedFragment fragment = new RuntimeStringEncoder().encode("data");

        assertThat(fragment.rootNode().typeKey()).isEqualTo(RuntimeStringEncoder.TYPE_KEY);
        assertThat(fragment.rootNode().reprStr()).isEqualTo("data");
        assertThat(fragment.rootNode().attrs()).isEmpty();
    }
}
