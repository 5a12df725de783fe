package tech.yump.awsengine.secrets.aws.naming.template;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateFunctionsTest {

    private static final long NOW = 1_700_000_000L;

    private TemplateFunctions functions;

    @BeforeEach
    void setUp() {
        Clock fixed = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
        functions = new TemplateFunctions(fixed, new Random(42));
    }

    @Test
    @DisplayName("Registry: exposes exactly the supported function names")
    void registry_names() {
        assertThat(functions.names()).containsExactlyInAnyOrder(
                "unix_time", "random", "eq", "ne", "not", "and", "or", "printf",
                "truncate", "truncate_sha256", "uppercase", "lowercase", "replace", "sha256");
        assertThat(functions.isDefined("env")).isFalse();
        assertThat(functions.lookup("env")).isEmpty();
    }

    @Test
    @DisplayName("call: undefined function fails")
    void call_undefined_throws() {
        assertThatThrownBy(() -> functions.call("env", List.of("HOME")))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessage("function \"env\" not defined");
    }

    @Test
    @DisplayName("unix_time: returns epoch seconds of the clock as a string")
    void unixTime_usesClock() {
        assertThat(functions.call("unix_time", List.of())).isEqualTo(Long.toString(NOW));
    }

    @Test
    @DisplayName("random: returns alphanumeric text of the requested length")
    void random_lengthAndAlphabet() {
        Object value = functions.call("random", List.of(20L));
        assertThat(value).isInstanceOf(String.class);
        assertThat((String) value).hasSize(20).matches("[A-Za-z0-9]+");
    }

    @Test
    @DisplayName("random: rejects a length below 1 and a non-integer argument")
    void random_invalidArguments() {
        assertThatThrownBy(() -> functions.call("random", List.of(0L)))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessageContaining("length must be at least 1");
        assertThatThrownBy(() -> functions.call("random", List.of("20")))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessageContaining("expected integer argument");
    }

    @Test
    @DisplayName("eq/ne: compare values of the same type")
    void eqAndNe() {
        assertThat(functions.call("eq", List.of("STS", "STS"))).isEqualTo(true);
        assertThat(functions.call("eq", List.of("IAM", "STS"))).isEqualTo(false);
        assertThat(functions.call("eq", List.of("IAM", "STS", "IAM"))).isEqualTo(true);
        assertThat(functions.call("eq", List.of(3L, 3))).isEqualTo(true);
        assertThat(functions.call("ne", List.of("IAM", "STS"))).isEqualTo(true);
    }

    @Test
    @DisplayName("eq: rejects comparing values of different types")
    void eq_incompatibleTypes_throws() {
        assertThatThrownBy(() -> functions.call("eq", List.of("1", 1L)))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessage("eq: incompatible types for comparison");
    }

    @Test
    @DisplayName("not/and/or: follow template truthiness")
    void logic() {
        assertThat(functions.call("not", List.of(""))).isEqualTo(true);
        assertThat(functions.call("not", List.of(0L))).isEqualTo(true);
        assertThat(functions.call("not", List.of("x"))).isEqualTo(false);
        assertThat(functions.call("and", List.of("a", "", "c"))).isEqualTo("");
        assertThat(functions.call("and", List.of("a", "b"))).isEqualTo("b");
        assertThat(functions.call("or", List.of("", "b"))).isEqualTo("b");
        assertThat(functions.call("or", Arrays.asList(null, false))).isEqualTo(false);
    }

    @Test
    @DisplayName("printf: formats %s, %v, %d, %q and %%")
    void printf_verbs() {
        assertThat(functions.call("printf", List.of("vault-%s-%s", "a", "b"))).isEqualTo("vault-a-b");
        assertThat(functions.call("printf", List.of("%v|%d|%q|100%%", true, 7L, "x\"y"))).isEqualTo("true|7|\"x\\\"y\"|100%");
    }

    @Test
    @DisplayName("printf: argument count must match the verbs")
    void printf_argumentMismatch_throws() {
        assertThatThrownBy(() -> functions.call("printf", List.of("%s-%s", "a")))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessageContaining("missing argument for verb %s");
        assertThatThrownBy(() -> functions.call("printf", List.of("%s", "a", "b")))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessageContaining("extra argument");
        assertThatThrownBy(() -> functions.call("printf", List.of("%x", "a")))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessageContaining("unsupported verb %x");
        assertThatThrownBy(() -> functions.call("printf", List.of("50%")))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessageContaining("dangling '%'");
    }

    @Test
    @DisplayName("truncate: keeps the first n characters")
    void truncate() {
        assertThat(functions.call("truncate", List.of(5L, "abcdefgh"))).isEqualTo("abcde");
        assertThat(functions.call("truncate", List.of(50L, "abc"))).isEqualTo("abc");
        assertThatThrownBy(() -> functions.call("truncate", List.of(0L, "abc")))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessage("truncate: max length must be > 0");
    }

    @Test
    @DisplayName("truncate_sha256: replaces the tail with a hash prefix when too long")
    void truncateSha256() {
        String value = "abcdefghijklmnopqrstuvwxyz";
        String expected = "ab" + TemplateFunctions.sha256Hex(value.substring(2)).substring(0, 8);

        assertThat(functions.call("truncate_sha256", List.of(10L, value))).isEqualTo(expected);
        assertThat(functions.call("truncate_sha256", List.of(30L, value))).isEqualTo(value);
        assertThatThrownBy(() -> functions.call("truncate_sha256", List.of(8L, value)))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessage("truncate_sha256: max length must be > 8");
    }

    @Test
    @DisplayName("String helpers: uppercase, lowercase, replace and sha256")
    void stringHelpers() {
        assertThat(functions.call("uppercase", List.of("abc"))).isEqualTo("ABC");
        assertThat(functions.call("lowercase", List.of("ABC"))).isEqualTo("abc");
        assertThat(functions.call("replace", List.of("-", "_", "a-b-c"))).isEqualTo("a_b_c");
        assertThat(functions.call("sha256", List.of("abc")))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    @DisplayName("Arity: functions reject the wrong number of arguments")
    void wrongArity_throws() {
        assertThatThrownBy(() -> functions.call("uppercase", List.of("a", "b")))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessage("uppercase: wrong number of args: want 1 got 2");
        assertThatThrownBy(() -> functions.call("unix_time", List.of(1L)))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessage("unix_time: wrong number of args: want 0 got 1");
    }
}
