package io.symdiff.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link CliArguments#parse}. */
class CliArgumentsTest {

    private static CliArguments parse(String... args) {
        return CliArguments.parse(args);
    }

    @Test
    void evalWithBindings() {
        CliArguments args = parse("--eval", "y + 4", "y=6");

        assertThat(args.operation()).isEqualTo(CliArguments.Operation.EVAL);
        assertThat(args.expression()).isEqualTo("y + 4");
        assertThat(args.bindings()).containsExactly("y=6");
        assertThat(args.domain()).isNull();
        assertThat(args.format()).isNull();
        assertThat(args.help()).isFalse();
    }

    @Test
    void diffWithOrderAndOptions() {
        CliArguments args = parse(
                "--config", "my.yaml", "--domain", "COMPLEX", "--format", "json",
                "--diff", "x^3", "--by", "x", "--order", "2", "x=1+i");

        assertThat(args.operation()).isEqualTo(CliArguments.Operation.DIFF);
        assertThat(args.configPath()).isEqualTo("my.yaml");
        assertThat(args.domain()).isEqualTo("complex");
        assertThat(args.format()).isEqualTo("json");
        assertThat(args.variable()).isEqualTo("x");
        assertThat(args.order()).isEqualTo(2);
        assertThat(args.domainEvidence()).containsExactly("x^3", "x=1+i");
    }

    @Test
    void orderDefaultsToOne() {
        assertThat(parse("--diff", "x", "--by", "x").order()).isEqualTo(1);
    }

    @Test
    void expressionMayStartWithMinus() {
        assertThat(parse("--eval", "-x^2", "x=3").expression()).isEqualTo("-x^2");
    }

    @Test
    void helpNeedsNoOperation() {
        assertThat(parse("--help").help()).isTrue();
        assertThat(parse("-h", "x=1").help()).isTrue();
        assertThat(parse("-h").operation()).isNull();
    }

    @Test
    void bindingsAreCopied() {
        CliArguments args = parse("--eval", "x", "x=1");

        assertThatThrownBy(() -> args.bindings().add("y=2")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void diffRequiresVariable() {
        assertThatThrownBy(() -> parse("--diff", "x^2"))
                .isInstanceOf(ArgumentException.class)
                .hasMessageContaining("--by");
    }

    @Test
    void evalRejectsDiffOptions() {
        assertThatThrownBy(() -> parse("--eval", "x", "--by", "x"))
                .isInstanceOf(ArgumentException.class)
                .hasMessageContaining("--diff");
    }

    @Test
    void onlyOneOperation() {
        assertThatThrownBy(() -> parse("--eval", "x", "--diff", "x", "--by", "x"))
                .isInstanceOf(ArgumentException.class)
                .hasMessageContaining("Only one");
    }

    @Test
    void operationIsRequired() {
        assertThatThrownBy(() -> parse("x=1")).isInstanceOf(ArgumentException.class);
        assertThatThrownBy(() -> parse()).isInstanceOf(ArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"--eval", "--config", "--domain", "--by"})
    void optionValueIsRequired(String option) {
        assertThatThrownBy(() -> parse(option))
                .isInstanceOf(ArgumentException.class)
                .hasMessageContaining("requires a value");
    }

    @Test
    void invalidChoicesAndUnknownOptions() {
        assertThatThrownBy(() -> parse("--domain", "quaternion", "--eval", "1"))
                .isInstanceOf(ArgumentException.class)
                .hasMessageContaining("quaternion");
        assertThatThrownBy(() -> parse("--format", "xml", "--eval", "1"))
                .isInstanceOf(ArgumentException.class);
        assertThatThrownBy(() -> parse("--verbose", "--eval", "1"))
                .isInstanceOf(ArgumentException.class)
                .hasMessageContaining("Unknown option");
        assertThatThrownBy(() -> parse("--format", "json", "--format", "text", "--eval", "1"))
                .isInstanceOf(ArgumentException.class)
                .hasMessageContaining("only once");
    }

    @ParameterizedTest
    @ValueSource(strings = {"-1", "two", "1.5"})
    void orderMustBeNonNegativeInteger(String order) {
        assertThatThrownBy(() -> parse("--diff", "x", "--by", "x", "--order", order))
                .isInstanceOf(ArgumentException.class)
                .hasMessageContaining("--order");
    }
}
