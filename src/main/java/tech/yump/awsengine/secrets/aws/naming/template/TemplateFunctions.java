package tech.yump.awsengine.secrets.aws.naming.template;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * The fixed registry of functions callable from a username template.
 *
 * <p>{@code unix_time} and {@code random} are the only time-dependent or random primitives;
 * everything else is a pure string/boolean helper. No function touches files, the network or
 * the process environment.
 */
public final class TemplateFunctions {

    static final String RANDOM_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final Clock clock;
    private final Random random;
    private final Map<String, TemplateFunction> registry;

    public TemplateFunctions(Clock clock, Random random) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");

        Map<String, TemplateFunction> functions = new LinkedHashMap<>();
        // nondeterministic
        functions.put("unix_time", this::unixTime);
        functions.put("random", this::random);
        // comparison and logic
        functions.put("eq", TemplateFunctions::eq);
        functions.put("ne", TemplateFunctions::ne);
        functions.put("not", args -> !isTruthy(single("not", args)));
        functions.put("and", TemplateFunctions::and);
        functions.put("or", TemplateFunctions::or);
        // strings
        functions.put("printf", TemplateFunctions::printf);
        functions.put("truncate", TemplateFunctions::truncate);
        functions.put("truncate_sha256", TemplateFunctions::truncateSha256);
        functions.put("uppercase", args -> asString("uppercase", single("uppercase", args)).toUpperCase(Locale.ROOT));
        functions.put("lowercase", args -> asString("lowercase", single("lowercase", args)).toLowerCase(Locale.ROOT));
        functions.put("replace", TemplateFunctions::replace);
        functions.put("sha256", args -> sha256Hex(asString("sha256", single("sha256", args))));
        this.registry = Collections.unmodifiableMap(functions);
    }

    public boolean isDefined(String name) {
        return registry.containsKey(name);
    }

    Set<String> names() {
        return registry.keySet();
    }

    Optional<TemplateFunction> lookup(String name) {
        return Optional.ofNullable(registry.get(name));
    }

    public Object call(String name, List<Object> args) {
        TemplateFunction function = lookup(name)
                .orElseThrow(() -> new TemplateRenderException("function \"" + name + "\" not defined"));
        return function.apply(args);
    }

    // --- nondeterministic primitives ---

    private Object unixTime(List<Object> args) {
        expectArity("unix_time", args, 0);
        return Long.toString(clock.instant().getEpochSecond());
    }

    private Object random(List<Object> args) {
        expectArity("random", args, 1);
        int length = asInt("random", args.get(0));
        if (length < 1) {
            throw new TemplateRenderException("random: length must be at least 1, got " + length);
        }
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(RANDOM_CHARS.charAt(random.nextInt(RANDOM_CHARS.length())));
        }
        return sb.toString();
    }

    // --- comparison and logic ---

    private static Object eq(List<Object> args) {
        if (args.size() < 2) {
            throw new TemplateRenderException("eq: missing argument for comparison");
        }
        Object first = normalize(args.get(0));
        for (Object other : args.subList(1, args.size())) {
            Object right = normalize(other);
            checkComparable(first, right, "eq");
            if (first.equals(right)) {
                return true;
            }
        }
        return false;
    }

    private static Object ne(List<Object> args) {
        expectArity("ne", args, 2);
        Object left = normalize(args.get(0));
        Object right = normalize(args.get(1));
        checkComparable(left, right, "ne");
        return !left.equals(right);
    }

    private static Object and(List<Object> args) {
        if (args.isEmpty()) {
            throw new TemplateRenderException("and: wrong number of args: want at least 1 got 0");
        }
        for (Object arg : args) {
            if (!isTruthy(arg)) {
                return arg;
            }
        }
        return args.get(args.size() - 1);
    }

    private static Object or(List<Object> args) {
        if (args.isEmpty()) {
            throw new TemplateRenderException("or: wrong number of args: want at least 1 got 0");
        }
        for (Object arg : args) {
            if (isTruthy(arg)) {
                return arg;
            }
        }
        return args.get(args.size() - 1);
    }

    // --- strings ---

    private static Object printf(List<Object> args) {
        if (args.isEmpty()) {
            throw new TemplateRenderException("printf: wrong number of args: want at least 1 got 0");
        }
        String format = asString("printf", args.get(0));
        List<Object> values = args.subList(1, args.size());
        StringBuilder out = new StringBuilder();
        int next = 0;
        for (int i = 0; i < format.length(); i++) {
            char c = format.charAt(i);
            if (c != '%') {
                out.append(c);
                continue;
            }
            if (i + 1 >= format.length()) {
                throw new TemplateRenderException("printf: format ends with a dangling '%'");
            }
            char verb = format.charAt(++i);
            if (verb == '%') {
                out.append('%');
                continue;
            }
            if (next >= values.size()) {
                throw new TemplateRenderException("printf: missing argument for verb %" + verb);
            }
            Object value = values.get(next++);
            switch (verb) {
                case 's', 'v' -> out.append(display(value));
                case 'd' -> out.append(asLong("printf", value));
                case 'q' -> out.append('"').append(display(value).replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
                default -> throw new TemplateRenderException("printf: unsupported verb %" + verb);
            }
        }
        if (next < values.size()) {
            throw new TemplateRenderException("printf: " + (values.size() - next) + " extra argument(s) for format \"" + format + "\"");
        }
        return out.toString();
    }

    private static Object truncate(List<Object> args) {
        expectArity("truncate", args, 2);
        int maxLength = asInt("truncate", args.get(0));
        String value = asString("truncate", args.get(1));
        if (maxLength <= 0) {
            throw new TemplateRenderException("truncate: max length must be > 0");
        }
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }

    private static Object truncateSha256(List<Object> args) {
        expectArity("truncate_sha256", args, 2);
        int maxLength = asInt("truncate_sha256", args.get(0));
        String value = asString("truncate_sha256", args.get(1));
        if (maxLength <= 8) {
            throw new TemplateRenderException("truncate_sha256: max length must be > 8");
        }
        if (value.length() <= maxLength) {
            return value;
        }
        int cut = maxLength - 8;
        return value.substring(0, cut) + sha256Hex(value.substring(cut)).substring(0, 8);
    }

    private static Object replace(List<Object> args) {
        expectArity("replace", args, 3);
        String target = asString("replace", args.get(0));
        String replacement = asString("replace", args.get(1));
        return asString("replace", args.get(2)).replace(target, replacement);
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // --- value helpers shared with the renderer ---

    /**
     * Truthiness as in Go templates: false, zero, the empty string and null are false.
     */
    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.longValue() != 0;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return true;
    }

    static String display(Object value) {
        return value == null ? "<no value>" : value.toString();
    }

    private static Object normalize(Object value) {
        return value instanceof Number n ? (Object) n.longValue() : value;
    }

    private static void checkComparable(Object left, Object right, String function) {
        if (left == null || right == null || left.getClass() != right.getClass()) {
            throw new TemplateRenderException(function + ": incompatible types for comparison");
        }
    }

    private static Object single(String function, List<Object> args) {
        expectArity(function, args, 1);
        return args.get(0);
    }

    private static void expectArity(String function, List<Object> args, int expected) {
        if (args.size() != expected) {
            throw new TemplateRenderException(
                    function + ": wrong number of args: want " + expected + " got " + args.size());
        }
    }

    private static String asString(String function, Object value) {
        if (value instanceof String s) {
            return s;
        }
        throw new TemplateRenderException(function + ": expected string argument, got " + describe(value));
    }

    private static long asLong(String function, Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        throw new TemplateRenderException(function + ": expected integer argument, got " + describe(value));
    }

    private static int asInt(String function, Object value) {
        long result = asLong(function, value);
        if (result > Integer.MAX_VALUE || result < Integer.MIN_VALUE) {
            throw new TemplateRenderException(function + ": integer argument out of range: " + result);
        }
        return (int) result;
    }

    private static String describe(Object value) {
        return value == null ? "nil" : value.getClass().getSimpleName() + " " + value;
    }
}
