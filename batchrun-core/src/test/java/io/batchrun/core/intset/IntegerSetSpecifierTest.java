package io.batchrun.core.intset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.batchrun.core.exception.BatchrunException;
import io.batchrun.core.exception.ErrorCode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.PrimitiveIterator;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("IntegerSetSpecifier")
class IntegerSetSpecifierTest {

    private static List<Integer> values(String spec, int min, int max) {
        List<Integer> result = new ArrayList<>();
        new IntegerSetSpecifier(spec, min, max).forEach(result::add);
        return result;
    }

    @Nested
    @DisplayName("parsing")
    class Parsing {

        @ParameterizedTest
        @ValueSource(strings = {"*", "1-2", "2-3", "1-9", "1", "2", "1,2,3", "1-1", "1-9/3", "*/42"})
        void shouldAcceptValidSpecs(String spec) {
            assertThat(new IntegerSetSpecifier(spec, 1, 9).spec()).isEqualTo(spec);
        }

        @ParameterizedTest
        @ValueSource(
                strings = {
                    "", "abc", " ", "**", " 1-2", "1-2 ", " *", "* ", "1-*", "*1", "1*", "*,", "-1",
                    "1-", "1,", ",1", "0.0", "1.5", "1-9/-2", "5/5", "*/0"
                })
        void shouldRejectMalformedSpecs(String spec) {
            assertThatThrownBy(() -> new IntegerSetSpecifier(spec, 1, 9))
                    .isInstanceOf(BatchrunException.class)
                    .extracting(e -> ((BatchrunException) e).getCode())
                    .isEqualTo(ErrorCode.INVALID_SYNTAX);
        }

        @ParameterizedTest
        @ValueSource(strings = {"2-1", "9-3", "9-3/2"})
        void shouldRejectInvertedRanges(String spec) {
            assertThatThrownBy(() -> new IntegerSetSpecifier(spec, 1, 9))
                    .isInstanceOf(BatchrunException.class)
                    .extracting(e -> ((BatchrunException) e).getCode())
                    .isEqualTo(ErrorCode.INVALID_RANGE);
        }

        @ParameterizedTest
        @ValueSource(strings = {"1-10", "0-3", "10-11", "0-9/3", "99999999999999"})
        void shouldRejectValuesOutsideRange(String spec) {
            assertThatThrownBy(() -> new IntegerSetSpecifier(spec, 1, 9))
                    .isInstanceOf(BatchrunException.class)
                    .extracting(e -> ((BatchrunException) e).getCode())
                    .isEqualTo(ErrorCode.OUT_OF_RANGE);
        }

        @Test
        void shouldReadZeroPaddedNumbersByValue() {
            assertThat(values("000000000005", 1, 9)).containsExactly(5);
            assertThat(values("0000000000002-00000000004", 1, 9)).containsExactly(2, 3, 4);
            assertThat(values("1-9/00000000000004", 1, 9)).containsExactly(1, 5, 9);
        }

        @Test
        void shouldAcceptSingleValueRange() {
            assertThat(values("*", 42, 42)).containsExactly(42);
        }

        @Test
        void shouldRejectInvertedValueRange() {
            assertThatThrownBy(() -> new IntegerSetSpecifier("*", 2, 1))
                    .isInstanceOf(BatchrunException.class)
                    .hasMessageContaining("should not be smaller");
        }

        @Test
        void shouldExposeParameters() {
            IntegerSetSpecifier spec = new IntegerSetSpecifier("5-30/3", 2, 42);

            assertThat(spec.spec()).isEqualTo("5-30/3");
            assertThat(spec.minValue()).isEqualTo(2);
            assertThat(spec.maxValue()).isEqualTo(42);
            assertThat(spec).hasToString("5-30/3");
        }
    }

    @Nested
    @DisplayName("iteration")
    class Iteration {

        static Stream<Arguments> expectedValues() {
            return Stream.of(
                    Arguments.of("1-10", 0, 100, List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10)),
                    Arguments.of("*", 1, 7, List.of(1, 2, 3, 4, 5, 6, 7)),
                    Arguments.of("2-8/2,3-9/3", 0, 10, List.of(2, 3, 4, 6, 8, 9)),
                    Arguments.of("0-10/2", 0, 10, List.of(0, 2, 4, 6, 8, 10)),
                    Arguments.of("1-10/2", 0, 10, List.of(1, 3, 5, 7, 9)),
                    Arguments.of("*/2", 0, 10, List.of(0, 2, 4, 6, 8, 10)),
                    Arguments.of("*/2", 1, 10, List.of(2, 4, 6, 8, 10)),
                    Arguments.of("*/2", 2, 10, List.of(2, 4, 6, 8, 10)),
                    Arguments.of("*/2,*/3", 0, 10, List.of(0, 2, 3, 4, 6, 8, 9, 10)),
                    Arguments.of("*/42", 1, 9, List.of()),
                    Arguments.of("*/42", 80, 200, List.of(84, 126, 168)),
                    Arguments.of("2-20/5", 0, 20, List.of(2, 7, 12, 17)),
                    Arguments.of(
                            "10-15/2,1-5/2,3-15/3", 0, 1 << 28, List.of(1, 3, 5, 6, 9, 10, 12, 14, 15)),
                    Arguments.of("1-5/2,10-12", 0, 20, List.of(1, 3, 5, 10, 11, 12)));
        }

        @ParameterizedTest(name = "{0} over [{1}, {2}]")
        @MethodSource("expectedValues")
        void shouldYieldMembersInAscendingOrder(
                String spec, int min, int max, List<Integer> expected) {
            assertThat(values(spec, min, max)).isEqualTo(expected);
        }

        @ParameterizedTest
        @ValueSource(strings = {"*/3,4-20/4,7", "1-2,3-4,6-8/2,5-20/2,5-30/3", "0-50/7,3-45/5"})
        void shouldAgreeWithContainsAndSize(String text) {
            IntegerSetSpecifier spec = new IntegerSetSpecifier(text, 0, 60);
            List<Integer> members = values(text, 0, 60);

            assertThat(members).isSorted().doesNotHaveDuplicates();
            assertThat((long) members.size()).isEqualTo(spec.size());
            for (int v = 0; v <= 60; v++) {
                assertThat(spec.contains(v)).as("contains(%d)", v).isEqualTo(members.contains(v));
            }
        }

        @Test
        @DisplayName("first elements of a huge range are produced without scanning it")
        void shouldReachFirstElementsOfLargeRangeQuickly() {
            long startNanos = System.nanoTime();
            IntegerSetSpecifier spec = new IntegerSetSpecifier("42-100000000/3", 0, 100_000_000);
            PrimitiveIterator.OfInt it = spec.intIterator();
            int first = it.nextInt();
            int second = it.nextInt();
            long elapsedMillis = (System.nanoTime() - startNanos) / 1_000_000;

            assertThat(first).isEqualTo(42);
            assertThat(second).isEqualTo(45);
            assertThat(elapsedMillis).isLessThan(100);
        }

        @Test
        void shouldRestartOnEveryIterator() {
            IntegerSetSpecifier spec = new IntegerSetSpecifier("1-3", 0, 5);

            assertThat(spec.stream().boxed().collect(Collectors.toList())).containsExactly(1, 2, 3);
            assertThat(spec.stream().sum()).isEqualTo(6);
        }
    }

    @Nested
    @DisplayName("contains and size")
    class ContainsAndSize {

        @Test
        void shouldHonourStepInContains() {
            assertThat(new IntegerSetSpecifier("30-50", 0, 100).contains(42)).isTrue();
            assertThat(new IntegerSetSpecifier("43-100", 0, 100).contains(42)).isFalse();
            assertThat(new IntegerSetSpecifier("*", 1, 123_456_789).contains(1_234_567)).isTrue();
            assertThat(new IntegerSetSpecifier("0-20/5", 0, 20).contains(12)).isFalse();
        }

        @ParameterizedTest
        @CsvSource({
            "'1-10,31-35,50', 0, 100, 16",
            "*, 1, 123456789, 123456789",
            "'2-10/2,3-10/3', 1, 1000000000, 7",
            "*/42, 1, 9, 0"
        })
        void shouldCountMembers(String spec, int min, int max, long expected) {
            assertThat(new IntegerSetSpecifier(spec, min, max).size()).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("isTotal")
    class IsTotal {

        @ParameterizedTest(name = "{0} over [{1}, {2}] -> {3}")
        @CsvSource({
            "*, 0, 9, true",
            "0-9, 0, 9, true",
            "1-9, 0, 9, false",
            "0-8, 0, 9, false",
            "'1-5,5-9', 1, 9, true",
            "'1-5,6-9', 1, 9, true",
            "'1-5,7-9', 1, 9, false",
            "'1-5,6-8', 1, 9, false",
            "'2-5,6-9', 1, 9, false",
            "'1-5,6-6,7-9', 1, 9, true",
            "'1-5,6-6/6,7-9', 1, 9, true",
            "1-999999999, 1, 999999999, true",
            "2-999999999, 1, 999999999, false",
            "1-999999998, 1, 999999999, false",
            "'1-999,*/2', 0, 999, true"
        })
        void shouldDetectFullCoverage(String spec, int min, int max, boolean expected) {
            assertThat(new IntegerSetSpecifier(spec, min, max).isTotal()).isEqualTo(expected);
        }

        @Test
        void shouldStopAtFirstMissingValue() {
            String spec =
                    Arrays.stream(new int[] {2, 3, 5, 7, 11, 13, 17, 19, 23})
                            .mapToObj(p -> "*/" + p)
                            .collect(Collectors.joining(","));

            assertThat(new IntegerSetSpecifier(spec, 1, 999_999_999).isTotal()).isFalse();
        }
    }

    @Nested
    @DisplayName("simplify")
    class Simplify {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(
                delimiter = '|',
                value = {
                    "*|*",
                    "1,2,3,4,5|1-5",
                    "1-5,6-8,9-12|1-12",
                    "5-10,8-15|5-15",
                    "5-13,10-12|5-13",
                    "1-20/2,21-30/2|1-30/2",
                    "1-20/2,17-30/2|1-30/2",
                    "1-20/2,20-30/2|1-20/2,20-30/2",
                    "1-20/2,16-30/2|1-20/2,16-30/2",
                    "1-2,3-4,6-8/2,6-20/2,5-30/3|1-4,6-20/2,5-30/3",
                    "1-2,3-4,6-8/2,5-20/2,5-30/3|1-4,5-20/2,6-8/2,5-30/3",
                    "0-100|*"
                })
        void shouldMergeRanges(String original, String simplified) {
            assertThat(new IntegerSetSpecifier(original, 0, 100).simplify().spec())
                    .isEqualTo(simplified);
        }

        @ParameterizedTest
        @ValueSource(strings = {"1-2,3-4,6-8/2,5-20/2,5-30/3", "*/7,3,50-60/4", "9,8,7,1-3"})
        void shouldPreserveMembership(String text) {
            IntegerSetSpecifier original = new IntegerSetSpecifier(text, 0, 100);
            IntegerSetSpecifier simplified = original.simplify();

            assertThat(IntStream.rangeClosed(0, 100).filter(simplified::contains).toArray())
                    .isEqualTo(IntStream.rangeClosed(0, 100).filter(original::contains).toArray());
        }
    }

    @Nested
    @DisplayName("equality")
    class Equality {

        @Test
        void shouldCompareSpecAndRange() {
            assertThat(new IntegerSetSpecifier("1-10", 0, 100))
                    .isEqualTo(new IntegerSetSpecifier("1-10", 0, 100))
                    .hasSameHashCodeAs(new IntegerSetSpecifier("1-10", 0, 100))
                    .isNotEqualTo(new IntegerSetSpecifier("1-10", 0, 101))
                    .isNotEqualTo(new IntegerSetSpecifier("1,2,3,4,5,6,7,8,9,10", 0, 100));
        }
    }
}
