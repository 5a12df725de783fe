package tech.yump.awsengine.secrets.aws.naming;

/**
 * Maps caller-supplied display and policy names onto the characters AWS accepts in principal
 * names: {@code [A-Za-z0-9-_,.@]}.
 */
public final class DisplayNameNormalizer {

    private DisplayNameNormalizer() {
    }

    /**
     * Replaces every character outside the allowed set with a single {@code '_'}.
     * Runs of disallowed characters are not collapsed, so the result always has the same length
     * as the input. Returns the empty string for {@code null}.
     */
    public static String normalize(String input) {
        if (input == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(input.length());
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            sb.append(isAllowed(c) ? c : '_');
        }
        return sb.toString();
    }

    static boolean isAllowed(char c) {
        return (c >= 'A' && c <= 'Z')
                || (c >= 'a' && c <= 'z')
                || (c >= '0' && c <= '9')
                || c == '-' || c == '_' || c == ',' || c == '.' || c == '@';
    }
}
