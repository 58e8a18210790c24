package irmigrator.tvm;

import irmigrator.codec.RuntimeStringEncoder;
import irmigrator.engine.RuleApplicator;
import irmigrator.exceptions.MigrateException;
import irmigrator.graph.Node;
import irmigrator.graph.NodeTable;
import irmigrator.plan.VersionChain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TvmRuleSets")
class TvmRuleSetsTest {

    private final RuleApplicator applicator = new RuleApplicator();
    private final RuntimeStringEncoder encoder = new RuntimeStringEncoder();

    @Test
    @DisplayName("should chain 0.6 through 0.9")
    void shouldBuildDefaultChain() {
        VersionChain chain = TvmRuleSets.defaultChain(encoder);

        assertThat(chain.versions()).containsExactly("0.6", "0.7", "0.8", "0.9");
        assertThat(chain.terminalVersion()).isEqualTo(TvmRuleSets.V0_9);
    }

    @Nested
    @DisplayName("0.6 -> 0.7")
    class Updater06To07 {

        private NodeTable run(Node... nodes) throws MigrateException {
            NodeTable table = new NodeTable(List.of(nodes));
            applicator.apply(TvmRuleSets.updater06To07(encoder), table);
            return table;
        }

        @Test
        @DisplayName("should inline the name of a variable visited later")
        void shouldInlineForwardVariable() throws MigrateException {
            NodeTable table = run(
                    Node.tombstone(),
                    new Node("relay.TypeVar", Map.of("kind", "0", "var", "2")),
                    new Node("Variable", Map.of("dtype", "int32", "name", "t")));

            Node typeVar = table.get(1);
            assertThat(typeVar.typeKey()).isEqualTo("TypeVar");
            assertThat(typeVar.attr("name_hint")).isEqualTo("3");
            assertThat(typeVar.hasAttr("var")).isFalse();
            assertThat(table.isTombstoned(2)).isTrue();
            assertThat(table.get(3).reprStr()).isEqualTo("t");
            assertThat(table.size()).isEqualTo(4);
        }

        @Test
        @DisplayName("should reuse the promoted name of a variable visited earlier")
        void shouldInlineBackwardVariable() throws MigrateException {
            NodeTable table = run(
                    Node.tombstone(),
                    new Node("Variable", Map.of("dtype", "int32", "name", "t")),
                    new Node("relay.TypeVar", Map.of("kind", "0", "var", "1")));

            Node typeVar = table.get(2);
            assertThat(typeVar.attr("name_hint")).isEqualTo("3");
            assertThat(typeVar.isReferenceAttr("name_hint")).isTrue();
            assertThat(table.get(3).reprStr()).isEqualTo("t");
            assertThat(table.size()).isEqualTo(4);
        }

        @Test
        @DisplayName("should move an operator's global key into repr_str")
        void shouldRetireGlobalKey() throws MigrateException {
            NodeTable table = run(new Node("relay.Op").globalKey("nn.conv2d"));

            assertThat(table.get(0).typeKey()).isEqualTo("Op");
            assertThat(table.get(0).reprStr()).isEqualTo("nn.conv2d");
            assertThat(table.get(0).globalKey()).isNull();
        }

        @Test
        @DisplayName("should promote both buffer strings")
        void shouldPromoteBufferStrings() throws MigrateException {
            NodeTable table = run(new Node("Buffer", Map.of("name", "A", "scope", "global")));

            Node buffer = table.get(0);
            assertThat(buffer.typeKey()).isEqualTo("tir.Buffer");
            assertThat(table.get(Integer.parseInt(buffer.attr("name"))).reprStr()).isEqualTo("A");
            assertThat(table.get(Integer.parseInt(buffer.attr("scope"))).reprStr()).isEqualTo("global");
        }

        @Test
        @DisplayName("should keep an existing type annotation")
        void shouldKeepTypeAnnotation() throws MigrateException {
            NodeTable table = run(
                    new Node("PrimType"),
                    new Node("SizeVar", Map.of("name", "n", "type_annotation", "0")));

            assertThat(table.get(1).typeKey()).isEqualTo("tir.SizeVar");
            assertThat(table.get(1).attr("type_annotation")).isEqualTo("0");
        }

        @Test
        @DisplayName("should move relay types and passes to their namespaces")
        void shouldRenameNamespaces() throws MigrateException {
            NodeTable table = run(
                    new Node("relay.FuncType"),
                    new Node("relay.PassContext"),
                    new Node("FloorDiv"),
                    new Node("StrMap").keys(List.of("k")).data(List.of(0)),
                    new Node("relay.Module"));

            assertThat(table.nodes()).extracting(Node::typeKey)
                    .containsExactly("FuncType", "transform.PassContext", "tir.FloorDiv", "Map", "IRModule");
        }
    }

    @Test
    @DisplayName("0.7 -> 0.8 should give modules an attrs slot")
    void shouldFillModuleAttrs() throws MigrateException {
        NodeTable table = new NodeTable(List.of(
                new Node("IRModule", Map.of("functions", "0")),
                new Node("IRModule", Map.of("attrs", "5"))));

        applicator.apply(TvmRuleSets.updater07To08(), table);

        assertThat(table.get(0).attr("attrs")).isEqualTo("0");
        assertThat(table.get(1).attr("attrs")).isEqualTo("5");
    }

    @Test
    @DisplayName("0.8 -> 0.9 should give relay expressions a virtual device")
    void shouldFillVirtualDevice() throws MigrateException {
        NodeTable table = new NodeTable(List.of(
                new Node("relay.Function"),
                new Node("GlobalVar", Map.of("name_hint", "1")),
                new Node("relay.Type")));

        applicator.apply(TvmRuleSets.updater08To09(), table);

        assertThat(table.get(0).attr("virtual_device_")).isEqualTo("0");
        assertThat(table.get(1).attr("virtual_device_")).isEqualTo("0");
        assertThat(table.get(2).hasAttr("virtual_device_")).isFalse();
    }
}
