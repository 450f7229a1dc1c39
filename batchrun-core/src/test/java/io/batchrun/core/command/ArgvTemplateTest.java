package io.batchrun.core.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.batchrun.core.exception.BatchrunException;
import io.batchrun.core.exception.ErrorCode;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ArgvTemplate")
class ArgvTemplateTest {

    @Nested
    @DisplayName("split")
    class Split {

        @Test
        @DisplayName("splits on whitespace runs")
        void shouldSplitOnWhitespace() {
            assertThat(ArgvTemplate.split("  --a 1\t--b  2 ")).containsExactly("--a", "1", "--b", "2");
        }

        @Test
        @DisplayName("keeps quoted whitespace")
        void shouldKeepQuotedWhitespace() {
            assertThat(ArgvTemplate.split("--label 'two words' \"and three more\""))
                    .containsExactly("--label", "two words", "and three more");
        }

        @Test
        @DisplayName("honours backslash escapes")
        void shouldHonourEscapes() {
            assertThat(ArgvTemplate.split("a\\ b \"q\\\"uote\" 'lit\\eral'"))
                    .containsExactly("a b", "q\"uote", "lit\\eral");
        }

        @Test
        @DisplayName("joins adjacent quoted parts into one token")
        void shouldJoinAdjacentParts() {
            assertThat(ArgvTemplate.split("--x='a b'c")).containsExactly("--x=a bc");
        }

        @Test
        @DisplayName("returns nothing for an empty template")
        void shouldReturnNothingForEmpty() {
            assertThat(ArgvTemplate.split("")).isEmpty();
        }

        @Test
        @DisplayName("rejects an unclosed quote")
        void shouldRejectUnclosedQuote() {
            assertThatThrownBy(() -> ArgvTemplate.split("--a 'oops"))
                    .isInstanceOf(BatchrunException.class)
                    .extracting(e -> ((BatchrunException) e).getCode())
                    .isEqualTo(ErrorCode.INVALID_ARGUMENTS);
        }
    }

    @Nested
    @DisplayName("render")
    class Render {

        @Test
        @DisplayName("substitutes placeholders inside tokens")
        void shouldSubstitutePlaceholders() {
            assertThat(
                            ArgvTemplate.render(
                                    "--rent-id {rent_id} --out=/tmp/{name}.csv",
                                    Map.of("rent_id", 123, "name", "report")))
                    .containsExactly("--rent-id", "123", "--out=/tmp/report.csv");
        }

        @Test
        @DisplayName("keeps a substituted value with spaces as one token")
        void shouldNotResplitValues() {
            assertThat(ArgvTemplate.render("-c {script}", Map.of("script", "echo hello world")))
                    .containsExactly("-c", "echo hello world");
        }

        @Test
        @DisplayName("renders doubled braces literally")
        void shouldRenderDoubledBraces() {
            assertThat(ArgvTemplate.render("{{x}}", Map.of())).containsExactly("{x}");
        }

        @Test
        @DisplayName("rejects a placeholder without an argument")
        void shouldRejectMissingArgument() {
            assertThatThrownBy(() -> ArgvTemplate.render("--id {id}", Map.of()))
                    .isInstanceOf(BatchrunException.class)
                    .hasMessageContaining("{id}");
        }

        @Test
        @DisplayName("rejects a lone closing brace")
        void shouldRejectLoneClosingBrace() {
            assertThatThrownBy(() -> ArgvTemplate.render("a}b", Map.of()))
                    .isInstanceOf(BatchrunException.class);
        }
    }
}
