package irmigrator.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("NodeTable")
class NodeTableTest {

    private NodeTable table;

    @BeforeEach
    void setUp() {
        table = new NodeTable(List.of(
                Node.tombstone(),
                new Node("tir.Var", Map.of("name", "x")),
                new Node("tir.Add")));
    }

    @Nested
    @DisplayName("append")
    class Append {

        @Test
        @DisplayName("should assign the table length before the append")
        void shouldAssignNextSequentialIndex() {
            int first = table.append(new Node("runtime.String"));
            int second = table.append(new Node("runtime.String"));

            assertThat(first).isEqualTo(3);
            assertThat(second).isEqualTo(4);
            assertThat(table.size()).isEqualTo(5);
        }

        @Test
        @DisplayName("should leave earlier indices unchanged")
        void shouldLeaveEarlierIndicesUnchanged() {
            Node var = table.get(1);

            table.append(new Node("runtime.String"));

            assertThat(table.get(1)).isSameAs(var);
        }

        @Test
        @DisplayName("should reject null nodes")
        void shouldRejectNull() {
            assertThatThrownBy(() -> table.append(null)).isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("set")
    class Replace {

        @Test
        @DisplayName("should replace in place")
        void shouldReplaceInPlace() {
            Node replacement = new Node("tir.Sub");

            table.set(2, replacement);

            assertThat(table.get(2)).isSameAs(replacement);
            assertThat(table.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("should not grow the table")
        void shouldNotGrowTable() {
            assertThatThrownBy(() -> table.set(3, new Node("tir.Sub")))
                    .isInstanceOf(IndexOutOfBoundsException.class);
        }
    }

    @Nested
    @DisplayName("tombstone")
    class Tombstone {

        @Test
        @DisplayName("should clear the type key but keep the entry and its attributes")
        void shouldKeepEntry() {
            table.tombstone(1);

            assertThat(table.size()).isEqualTo(3);
            assertThat(table.isTombstoned(1)).isTrue();
            assertThat(table.get(1).attr("name")).isEqualTo("x");
        }

        @Test
        @DisplayName("should count each node once")
        void shouldCountOnce() {
            table.tombstone(1);
            table.tombstone(1);
            table.tombstone(0);

            assertThat(table.tombstonedCount()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("contains should check bounds")
    void containsShouldCheckBounds() {
        assertThat(table.contains(0)).isTrue();
        assertThat(table.contains(2)).isTrue();
        assertThat(table.contains(3)).isFalse();
        assertThat(table.contains(-1)).isFalse();
    }

    @Test
    @DisplayName("nodes view should be read-only")
    void nodesViewShouldBeReadOnly() {
        assertThatThrownBy(() -> table.nodes().add(new Node("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
