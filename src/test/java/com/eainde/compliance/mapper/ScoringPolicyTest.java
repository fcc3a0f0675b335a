package com.eainde.compliance.mapper;

import com.eainde.compliance.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoringPolicyTest {

    private final ScoringPolicy policy = ScoringPolicy.defaults();

    // =========================================================================
    //  Score
    // =========================================================================

    @Nested
    @DisplayName("Compliance score")
    class Score {

        @Test
        @DisplayName("no issues scores 100")
        void clean() {
            assertThat(policy.score(Map.of())).isEqualTo(100);
        }

        @Test
        @DisplayName("penalties are summed per severity")
        void summed() {
            assertThat(policy.score(Map.of(Severity.CRITICAL, 1, Severity.HIGH, 1))).isEqualTo(50);
            assertThat(policy.score(Map.of(Severity.MEDIUM, 2, Severity.LOW, 3))).isEqualTo(65);
        }

        @Test
        @DisplayName("each added issue lowers the score until it reaches 0, then it stays at 0")
        void monotonicAndClamped() {
            Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
            int previous = policy.score(counts);
            for (int i = 0; i < 12; i++) {
                counts.merge(Severity.values()[i % 4], 1, Integer::sum);
                int next = policy.score(counts);
                if (previous > 0) {
                    assertThat(next).isLessThan(previous);
                } else {
                    assertThat(next).isZero();
                }
                assertThat(next).isBetween(0, 100);
                previous = next;
            }
        }

        @Test
        @DisplayName("huge counts do not overflow")
        void noOverflow() {
            assertThat(policy.score(Map.of(Severity.CRITICAL, Integer.MAX_VALUE))).isZero();
        }
    }

    // =========================================================================
    //  Bands
    // =========================================================================

    @Nested
    @DisplayName("Priority bands")
    class Bands {

        @Test
        @DisplayName("priorities are assigned consecutively and saturate at the band limit")
        void assigner() {
            PriorityAssigner assigner = new PriorityAssigner(policy);

            assertThat(assigner.next(Severity.CRITICAL)).isEqualTo(1);
            assertThat(assigner.next(Severity.CRITICAL)).isEqualTo(1);
            assertThat(assigner.next(Severity.HIGH)).isEqualTo(2);
            assertThat(assigner.next(Severity.HIGH)).isEqualTo(3);
            assertThat(assigner.next(Severity.HIGH)).isEqualTo(4);
            assertThat(assigner.next(Severity.HIGH)).isEqualTo(4);
            assertThat(assigner.next(Severity.MEDIUM)).isEqualTo(5);
            assertThat(assigner.next(Severity.LOW)).isEqualTo(8);
            assertThat(assigner.next(Severity.LOW)).isEqualTo(9);
        }

        @Test
        @DisplayName("bandOf inverts the bands")
        void bandOf() {
            assertThat(policy.bandOf(1)).isEqualTo(Severity.CRITICAL);
            assertThat(policy.bandOf(4)).isEqualTo(Severity.HIGH);
            assertThat(policy.bandOf(7)).isEqualTo(Severity.MEDIUM);
            assertThat(policy.bandOf(8)).isEqualTo(Severity.LOW);
        }

        @Test
        @DisplayName("custom bands shift every later band")
        void customBands() {
            ScoringPolicy wide = ScoringPolicy.builder()
                    .criticalMaxPriority(3)
                    .highMaxPriority(6)
                    .mediumMaxPriority(9)
                    .build();

            assertThat(wide.firstPriority(Severity.HIGH)).isEqualTo(4);
            assertThat(wide.firstPriority(Severity.LOW)).isEqualTo(10);
        }
    }

    // =========================================================================
    //  Validation
    // =========================================================================

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("negative penalty is rejected")
        void negativePenalty() {
            assertThatThrownBy(() -> ScoringPolicy.builder().penalty(Severity.LOW, -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("non-increasing bands are rejected")
        void overlappingBands() {
            assertThatThrownBy(() -> ScoringPolicy.builder().highMaxPriority(1).build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("1 <= critical < high < medium");
            assertThatThrownBy(() -> ScoringPolicy.builder().criticalMaxPriority(0).build())
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
