package irmigrator.plan;

import irmigrator.exceptions.UnknownSourceVersionException;
import irmigrator.rule.RewriteRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("VersionChain")
class VersionChainTest {

    private static VersionRuleSet step(String from, String to) {
        return VersionRuleSet.builder(from, to)
                .on("Marker", RewriteRule.defaultFill("seen", from))
                .build();
    }

    private static final VersionRuleSet S67 = step("0.6", "0.7");
    private static final VersionRuleSet S78 = step("0.7", "0.8");
    private static final VersionRuleSet S89 = step("0.8", "0.9");

    @Nested
    @DisplayName("build")
    class Build {

        @Test
        @DisplayName("should order steps given in any order")
        void shouldOrderSteps() {
            VersionChain chain = VersionChain.build(List.of(S89, S67, S78));

            assertThat(chain.steps()).containsExactly(S67, S78, S89);
            assertThat(chain.versions()).containsExactly("0.6", "0.7", "0.8", "0.9");
            assertThat(chain.terminalVersion()).isEqualTo("0.9");
        }

        @Test
        @DisplayName("should reject an empty step list")
        void shouldRejectEmpty() {
            assertThatThrownBy(() -> VersionChain.build(List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject two steps from the same version")
        void shouldRejectDuplicateSource() {
            assertThatThrownBy(() -> VersionChain.build(List.of(S67, step("0.6", "0.8"))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Duplicate step from version 0.6");
        }

        @Test
        @DisplayName("should reject two steps reaching the same version")
        void shouldRejectMergingSteps() {
            assertThatThrownBy(() -> VersionChain.build(List.of(S78, step("0.5", "0.8"))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Multiple steps reach version 0.8");
        }

        @Test
        @DisplayName("should reject a cycle")
        void shouldRejectCycle() {
            assertThatThrownBy(() -> VersionChain.build(List.of(S67, step("0.7", "0.6"))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("cycle");
        }

        @Test
        @DisplayName("should reject a gap between steps")
        void shouldRejectGap() {
            assertThatThrownBy(() -> VersionChain.build(List.of(S67, S89)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("single chain");
        }
    }

    @Nested
    @DisplayName("matches")
    class Matches {

        @Test
        @DisplayName("should accept patch and build suffixes")
        void shouldAcceptSuffixes() {
            assertThat(VersionChain.matches("0.6", "0.6")).isTrue();
            assertThat(VersionChain.matches("0.6", "0.6.1")).isTrue();
            assertThat(VersionChain.matches("0.6", "0.6.dev0")).isTrue();
        }

        @Test
        @DisplayName("should stop at a component boundary")
        void shouldRespectBoundary() {
            assertThat(VersionChain.matches("0.6", "0.60")).isFalse();
            assertThat(VersionChain.matches("0.6", "0.5.9")).isFalse();
            assertThat(VersionChain.matches("0.6", "0")).isFalse();
        }
    }

    @Nested
    @DisplayName("step resolution")
    class Resolution {

        private final VersionChain chain = VersionChain.build(List.of(S67, S78, S89));

        @Test
        @DisplayName("should return every remaining step in order")
        void shouldReturnRemainingSteps() throws Exception {
            assertThat(chain.stepsFrom("0.6.1")).containsExactly(S67, S78, S89);
            assertThat(chain.stepsFrom("0.8")).containsExactly(S89);
        }

        @Test
        @DisplayName("should return no steps for the terminal version")
        void shouldReturnNothingForTerminal() throws Exception {
            assertThat(chain.stepsFrom("0.9.dev0")).isEmpty();
            assertThat(chain.isTerminal("0.9.dev0")).isTrue();
            assertThat(chain.isTerminal("0.8")).isFalse();
        }

        @Test
        @DisplayName("should stop at an intermediate target")
        void shouldStopAtTarget() throws Exception {
            assertThat(chain.stepsBetween("0.6", "0.7")).containsExactly(S67);
            assertThat(chain.stepsBetween("0.7.2", "0.9")).containsExactly(S78, S89);
            assertThat(chain.stepsBetween("0.7", "0.7")).isEmpty();
        }

        @Test
        @DisplayName("should reject an unknown source version")
        void shouldRejectUnknownSource() {
            assertThatThrownBy(() -> chain.stepsFrom("0.3"))
                    .isInstanceOf(UnknownSourceVersionException.class)
                    .hasMessageContaining("Cannot update from version 0.3");
        }

        @Test
        @DisplayName("should reject a downgrade")
        void shouldRejectDowngrade() {
            assertThatThrownBy(() -> chain.stepsBetween("0.8", "0.7"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("downgrade");
        }

        @Test
        @DisplayName("should reject an unknown target")
        void shouldRejectUnknownTarget() {
            assertThatThrownBy(() -> chain.stepsBetween("0.6", "1.0"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should prefer the longest known prefix")
        void shouldPreferLongestPrefix() throws Exception {
            VersionRuleSet patch = step("0.6", "0.6.1");
            VersionRuleSet minor = step("0.6.1", "0.7");
            VersionChain nested = VersionChain.build(List.of(patch, minor));

            assertThat(nested.stepsFrom("0.6.1")).containsExactly(minor);
            assertThat(nested.stepsFrom("0.6.0")).containsExactly(patch, minor);
        }
    }
}
