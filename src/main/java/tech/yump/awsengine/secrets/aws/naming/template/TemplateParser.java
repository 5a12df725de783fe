package tech.yump.awsengine.secrets.aws.naming.template;

import tech.yump.awsengine.secrets.aws.naming.template.TemplateNodes.Branch;
import tech.yump.awsengine.secrets.aws.naming.template.TemplateNodes.Command;
import tech.yump.awsengine.secrets.aws.naming.template.TemplateNodes.Expression;
import tech.yump.awsengine.secrets.aws.naming.template.TemplateNodes.Field;
import tech.yump.awsengine.secrets.aws.naming.template.TemplateNodes.If;
import tech.yump.awsengine.secrets.aws.naming.template.TemplateNodes.Literal;
import tech.yump.awsengine.secrets.aws.naming.template.TemplateNodes.Node;
import tech.yump.awsengine.secrets.aws.naming.template.TemplateNodes.Pipeline;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the Go text/template subset accepted for username templates into a node tree.
 *
 * <p>Supported: text, {@code {{ pipeline }}} actions, {@code {{- -}}} trim markers, comments,
 * fields ({@code .Name}), string/raw-string/integer/boolean literals, function calls,
 * parenthesized pipelines, {@code |} pipelines and {@code if / else if / else / end}.
 * Function names are checked against the registry here, so an undefined function fails before
 * anything is rendered.
 */
final class TemplateParser {

    private static final String LEFT_DELIM = "{{";
    private static final String RIGHT_DELIM = "}}";

    /**
     * Cap on nested {@code if} blocks plus parenthesized pipelines.
     */
    static final int MAX_DEPTH = 100;

    private enum TokenKind { FIELD, IDENTIFIER, STRING, NUMBER, LEFT_PAREN, RIGHT_PAREN, PIPE }

    private record Token(TokenKind kind, String text, Object value, int offset) {}

    /**
     * Either a run of text (tokens == null) or the tokens of one action.
     */
    private record Item(String text, List<Token> tokens, int offset) {
        boolean isText() {
            return tokens == null;
        }
    }

    private final String source;
    private final TemplateFunctions functions;
    private final List<Item> items = new ArrayList<>();
    private int position;
    private int depth;

    TemplateParser(String source, TemplateFunctions functions) {
        this.source = source;
        this.functions = functions;
    }

    List<Node> parse() {
        lex();
        List<Node> nodes = parseList();
        if (position < items.size()) {
            Item stray = items.get(position);
            throw error(stray.offset(), "unexpected {{" + keywordOf(stray) + "}}");
        }
        return List.copyOf(nodes);
    }

    // --- lexing ---

    private void lex() {
        int length = source.length();
        int pos = 0;
        boolean trimNextText = false;
        while (pos < length) {
            int open = source.indexOf(LEFT_DELIM, pos);
            String text = source.substring(pos, open < 0 ? length : open);
            if (trimNextText) {
                text = stripLeadingSpace(text);
            }
            if (open < 0) {
                addText(text, pos);
                break;
            }

            int cursor = open + LEFT_DELIM.length();
            if (cursor + 1 < length && source.charAt(cursor) == '-' && isSpace(source.charAt(cursor + 1))) {
                text = stripTrailingSpace(text);
                cursor += 2;
            }
            addText(text, pos);

            if (source.startsWith("/*", cursor)) {
                int close = source.indexOf("*/", cursor + 2);
                if (close < 0) {
                    throw error(open, "unclosed comment");
                }
                cursor = close + 2;
                if (source.startsWith(" -" + RIGHT_DELIM, cursor)) {
                    trimNextText = true;
                    pos = cursor + 4;
                } else if (source.startsWith(RIGHT_DELIM, cursor)) {
                    trimNextText = false;
                    pos = cursor + 2;
                } else {
                    throw error(close, "comment ends before closing delimiter");
                }
                continue;
            }

            List<Token> tokens = new ArrayList<>();
            boolean closed = false;
            trimNextText = false;
            while (cursor < length) {
                char c = source.charAt(cursor);
                if (isSpace(c)) {
                    if (source.startsWith("-" + RIGHT_DELIM, cursor + 1)) {
                        trimNextText = true;
                        cursor += 4;
                        closed = true;
                        break;
                    }
                    cursor++;
                } else if (source.startsWith(RIGHT_DELIM, cursor)) {
                    cursor += 2;
                    closed = true;
                    break;
                } else {
                    cursor = lexToken(cursor, tokens);
                }
            }
            if (!closed) {
                throw error(open, "unclosed action");
            }
            items.add(new Item(null, tokens, open));
            pos = cursor;
        }
    }

    private int lexToken(int start, List<Token> tokens) {
        char c = source.charAt(start);
        switch (c) {
            case '(' -> {
                tokens.add(new Token(TokenKind.LEFT_PAREN, "(", null, start));
                return start + 1;
            }
            case ')' -> {
                tokens.add(new Token(TokenKind.RIGHT_PAREN, ")", null, start));
                return start + 1;
            }
            case '|' -> {
                tokens.add(new Token(TokenKind.PIPE, "|", null, start));
                return start + 1;
            }
            case '"' -> {
                return lexQuoted(start, tokens);
            }
            case '`' -> {
                int close = source.indexOf('`', start + 1);
                if (close < 0) {
                    throw error(start, "unterminated raw quoted string");
                }
                String raw = source.substring(start + 1, close);
                tokens.add(new Token(TokenKind.STRING, raw, raw, start));
                return close + 1;
            }
            default -> {
                // fall through to the multi-character cases below
            }
        }

        if (c == '.') {
            int end = scanWord(start + 1);
            if (end == start + 1) {
                throw error(start, "bare '.' is not supported; reference a field such as .DisplayName");
            }
            String name = source.substring(start + 1, end);
            tokens.add(new Token(TokenKind.FIELD, name, name, start));
            return end;
        }
        if (Character.isDigit(c) || (c == '-' && start + 1 < source.length() && Character.isDigit(source.charAt(start + 1)))) {
            int end = start + 1;
            while (end < source.length() && Character.isDigit(source.charAt(end))) {
                end++;
            }
            String digits = source.substring(start, end);
            try {
                tokens.add(new Token(TokenKind.NUMBER, digits, Long.parseLong(digits), start));
            } catch (NumberFormatException e) {
                throw error(start, "integer literal out of range: " + digits);
            }
            return end;
        }
        if (Character.isLetter(c) || c == '_') {
            int end = scanWord(start);
            String word = source.substring(start, end);
            tokens.add(new Token(TokenKind.IDENTIFIER, word, word, start));
            return end;
        }
        throw error(start, "unexpected character '" + c + "' in action");
    }

    private int lexQuoted(int start, List<Token> tokens) {
        StringBuilder value = new StringBuilder();
        int i = start + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '"') {
                tokens.add(new Token(TokenKind.STRING, source.substring(start, i + 1), value.toString(), start));
                return i + 1;
            }
            if (c == '\n') {
                break;
            }
            if (c == '\\') {
                if (i + 1 >= source.length()) {
                    break;
                }
                char escaped = source.charAt(++i);
                switch (escaped) {
                    case '"' -> value.append('"');
                    case '\\' -> value.append('\\');
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    default -> throw error(i - 1, "unknown escape sequence \\" + escaped);
                }
            } else {
                value.append(c);
            }
            i++;
        }
        throw error(start, "unterminated quoted string");
    }

    private int scanWord(int start) {
        int end = start;
        while (end < source.length()
                && (Character.isLetterOrDigit(source.charAt(end)) || source.charAt(end) == '_')) {
            end++;
        }
        return end;
    }

    private void addText(String text, int offset) {
        if (!text.isEmpty()) {
            items.add(new Item(text, null, offset));
        }
    }

    // --- parsing ---

    private List<Node> parseList() {
        List<Node> nodes = new ArrayList<>();
        while (position < items.size()) {
            Item item = items.get(position);
            if (item.isText()) {
                nodes.add(new TemplateNodes.Text(item.text()));
                position++;
                continue;
            }
            String keyword = keywordOf(item);
            if ("end".equals(keyword) || "else".equals(keyword)) {
                return nodes;
            }
            position++;
            if ("if".equals(keyword)) {
                nodes.add(parseIf(item));
            } else {
                nodes.add(new TemplateNodes.Action(parsePipeline(item.tokens(), item.offset())));
            }
        }
        return nodes;
    }

    private Node parseIf(Item opening) {
        enter(opening.offset());
        try {
            return parseIfBody(opening);
        } finally {
            depth--;
        }
    }

    private Node parseIfBody(Item opening) {
        List<Branch> branches = new ArrayList<>();
        List<Token> conditionTokens = opening.tokens().subList(1, opening.tokens().size());
        Expression condition = parsePipeline(conditionTokens, opening.offset());
        while (true) {
            List<Node> body = parseList();
            Item terminator = next(opening);
            branches.add(new Branch(condition, List.copyOf(body)));
            List<Token> rest = terminator.tokens().subList(1, terminator.tokens().size());

            if ("end".equals(keywordOf(terminator))) {
                requireEmpty(rest, "end");
                return new If(List.copyOf(branches), List.of());
            }
            if (!rest.isEmpty() && isIdentifier(rest.get(0), "if")) {
                condition = parsePipeline(rest.subList(1, rest.size()), terminator.offset());
                continue;
            }
            requireEmpty(rest, "else");
            List<Node> otherwise = parseList();
            Item end = next(opening);
            if (!"end".equals(keywordOf(end))) {
                throw error(end.offset(), "expected {{end}}, found {{" + keywordOf(end) + "}}");
            }
            requireEmpty(end.tokens().subList(1, end.tokens().size()), "end");
            return new If(List.copyOf(branches), List.copyOf(otherwise));
        }
    }

    private Item next(Item opening) {
        if (position >= items.size()) {
            throw error(opening.offset(), "unexpected EOF: missing {{end}} for {{if}}");
        }
        return items.get(position++);
    }

    private Expression parsePipeline(List<Token> tokens, int offset) {
        enter(offset);
        try {
            return parsePipelineBody(tokens, offset);
        } finally {
            depth--;
        }
    }

    private Expression parsePipelineBody(List<Token> tokens, int offset) {
        if (tokens.isEmpty()) {
            throw error(offset, "missing value for command");
        }
        List<Command> commands = new ArrayList<>();
        int depth = 0;
        int segmentStart = 0;
        for (int i = 0; i < tokens.size(); i++) {
            TokenKind kind = tokens.get(i).kind();
            if (kind == TokenKind.LEFT_PAREN) {
                depth++;
            } else if (kind == TokenKind.RIGHT_PAREN) {
                depth--;
            } else if (kind == TokenKind.PIPE && depth == 0) {
                commands.add(parseCommand(tokens.subList(segmentStart, i), tokens.get(i).offset()));
                segmentStart = i + 1;
            }
        }
        commands.add(parseCommand(tokens.subList(segmentStart, tokens.size()), offset));
        return commands.size() == 1 ? commands.get(0) : new Pipeline(List.copyOf(commands));
    }

    private Command parseCommand(List<Token> tokens, int offset) {
        if (tokens.isEmpty()) {
            throw error(offset, "missing command in pipeline");
        }
        String function = null;
        List<Expression> arguments = new ArrayList<>();
        int i = 0;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            switch (token.kind()) {
                case LEFT_PAREN -> {
                    int close = matchingParen(tokens, i);
                    arguments.add(parsePipeline(tokens.subList(i + 1, close), token.offset()));
                    i = close + 1;
                    continue;
                }
                case RIGHT_PAREN -> throw error(token.offset(), "unexpected right paren");
                case PIPE -> throw error(token.offset(), "unexpected '|'");
                case FIELD -> arguments.add(new Field(token.text()));
                case STRING, NUMBER -> arguments.add(new Literal(token.value()));
                case IDENTIFIER -> {
                    Expression operand = identifier(token);
                    if (i == 0 && operand instanceof Command call) {
                        function = call.function();
                    } else {
                        arguments.add(operand);
                    }
                }
            }
            i++;
        }
        if (function == null && arguments.size() > 1) {
            throw error(tokens.get(1).offset(), "can't give argument to non-function");
        }
        return new Command(function, List.copyOf(arguments));
    }

    /**
     * An identifier is a boolean literal or a function; a function in argument position is
     * called with no arguments.
     */
    private Expression identifier(Token token) {
        String name = token.text();
        switch (name) {
            case "true":
                return new Literal(Boolean.TRUE);
            case "false":
                return new Literal(Boolean.FALSE);
            case "if":
            case "else":
            case "end":
                throw error(token.offset(), "unexpected keyword \"" + name + "\" in command");
            default:
                if (!functions.isDefined(name)) {
                    throw error(token.offset(), "function \"" + name + "\" not defined");
                }
                return new Command(name, List.of());
        }
    }

    private void enter(int offset) {
        if (++depth > MAX_DEPTH) {
            throw error(offset, "max expression depth exceeded");
        }
    }

    private int matchingParen(List<Token> tokens, int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            TokenKind kind = tokens.get(i).kind();
            if (kind == TokenKind.LEFT_PAREN) {
                depth++;
            } else if (kind == TokenKind.RIGHT_PAREN && --depth == 0) {
                return i;
            }
        }
        throw error(tokens.get(open).offset(), "unclosed left paren");
    }

    private void requireEmpty(List<Token> rest, String keyword) {
        if (!rest.isEmpty()) {
            throw error(rest.get(0).offset(), "unexpected \"" + rest.get(0).text() + "\" in {{" + keyword + "}}");
        }
    }

    private static String keywordOf(Item item) {
        if (item.isText() || item.tokens().isEmpty()) {
            return null;
        }
        Token first = item.tokens().get(0);
        if (first.kind() == TokenKind.IDENTIFIER
                && ("if".equals(first.text()) || "else".equals(first.text()) || "end".equals(first.text()))) {
            return first.text();
        }
        return null;
    }

    private static boolean isIdentifier(Token token, String text) {
        return token.kind() == TokenKind.IDENTIFIER && text.equals(token.text());
    }

    private static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    private static String stripLeadingSpace(String text) {
        int i = 0;
        while (i < text.length() && isSpace(text.charAt(i))) {
            i++;
        }
        return text.substring(i);
    }

    private static String stripTrailingSpace(String text) {
        int i = text.length();
        while (i > 0 && isSpace(text.charAt(i - 1))) {
            i--;
        }
        return text.substring(0, i);
    }

    private TemplateRenderException error(int offset, String message) {
        int line = 1;
        int column = 1;
        for (int i = 0; i < offset && i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new TemplateRenderException(
                "unable to parse username template at line " + line + ", column " + column + ": " + message);
    }
}
