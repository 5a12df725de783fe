package tech.yump.awsengine.secrets.aws.naming;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class DisplayNameNormalizerTest {

    @Test
    @DisplayName("normalize: replaces every disallowed character, including newlines, with '_'")
    void normalize_replacesDisallowedCharacters() {
        assertThat(DisplayNameNormalizer.normalize("^#$test name\nshould be normalized)(*"))
                .isEqualTo("___test_name_should_be_normalized___");
        assertThat(DisplayNameNormalizer.normalize("^#$test name1 should be normalized)(*"))
                .isEqualTo("___test_name1_should_be_normalized___");
    }

    @Test
    @DisplayName("normalize: does not collapse runs of disallowed characters")
    void normalize_doesNotCollapseRuns() {
        assertThat(DisplayNameNormalizer.normalize("^#$test name  should be normalized)(*"))
                .isEqualTo("___test_name__should_be_normalized___");
        assertThat(DisplayNameNormalizer.normalize("^#$test name__should be normalized)(*"))
                .isEqualTo("___test_name__should_be_normalized___");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "test_name_should_normalize_to_itself@example.com",
            "test1_name_should_normalize_to_itself@example.com",
            "UPPERlower0123456789-_,.@example.com"
    })
    @DisplayName("normalize: leaves already valid names unchanged")
    void normalize_validNames_areUnchanged(String name) {
        assertThat(DisplayNameNormalizer.normalize(name)).isEqualTo(name);
    }

    @ParameterizedTest
    @CsvSource({
            "'a b c', 'a_b_c'",
            "'user/role:admin', 'user_role_admin'",
            "'', ''"
    })
    @DisplayName("normalize: output length always equals input length")
    void normalize_preservesLength(String input, String expected) {
        String normalized = DisplayNameNormalizer.normalize(input);
        assertThat(normalized).isEqualTo(expected);
        assertThat(normalized).hasSameSizeAs(input);
    }

    @Test
    @DisplayName("normalize: every char maps to itself if allowed, otherwise to '_'")
    void normalize_everyChar() {
        for (int c = Character.MIN_VALUE; c <= Character.MAX_VALUE; c++) {
            String input = String.valueOf((char) c);
            String normalized = DisplayNameNormalizer.normalize(input);
            assertThat(normalized).hasSize(1);
            assertThat(normalized).matches("[A-Za-z0-9\\-_,.@]");
            if (DisplayNameNormalizer.isAllowed((char) c)) {
                assertThat(normalized).isEqualTo(input);
            }
        }
    }

    @Test
    @DisplayName("normalize: random strings keep their length and land in the allowed alphabet")
    void normalize_randomStrings() {
        Random random = new Random(42);
        for (int i = 0; i < 500; i++) {
            char[] chars = new char[random.nextInt(80)];
            for (int j = 0; j < chars.length; j++) {
                chars[j] = (char) random.nextInt(Character.MAX_VALUE + 1);
            }
            String input = new String(chars);
            String normalized = DisplayNameNormalizer.normalize(input);
            assertThat(normalized).hasSameSizeAs(input);
            assertThat(normalized).matches("[A-Za-z0-9\\-_,.@]*");
        }
    }

    @Test
    @DisplayName("normalize: null becomes the empty string")
    void normalize_null_returnsEmpty() {
        assertThat(DisplayNameNormalizer.normalize(null)).isEmpty();
    }

    @Test
    @DisplayName("normalize: non-ASCII letters are not in the allowed set")
    void normalize_nonAsciiLetters_areReplaced() {
        assertThat(DisplayNameNormalizer.normalize("josé")).isEqualTo("jos_");
    }
}
