// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.lexer;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import texweave.diagnostic.DiagnosticCondition;
import texweave.diagnostic.DiagnosticKind;
import texweave.source.SourceText;
import texweave.util.annotation.Nullable;
import texweave.util.condition.UnhandledErrorError;

/**
 * The lexer: the primary means of turning flattened LaTeX source into a stream of {@link Token}s.
 * <p>
 * The lexer makes a single forward pass and cannot be restarted. Open braces and environments are tracked on an
 * explicit stack, so nesting depth costs no call stack.
 * <p>
 * On error, a fatal diagnostic is signaled:
 * <ul>
 * <li>{@code UnmatchedBrace} for a closing brace without an opening one, or an opening brace never closed, including
 * inside captured arguments and math;
 * <li>{@code UnmatchedEnvironment} for an {@code \end} not matching the innermost open environment, or an
 * environment never closed;
 * <li>{@code UnterminatedMath} for a math region missing its closing delimiter;
 * <li>{@code NestingTooDeep} when more than {@link #maxDepth} groups and environments are open at once.
 * </ul>
 */
public final class Lexer {
    /**
     * Creates a lexer over the whole flattened text.
     */
    public Lexer(final SourceText source) {
        this(source, 0, source.length());
    }

    /**
     * Creates a lexer over the flattened offsets {@code [start, end)}.
     */
    public Lexer(final SourceText source, final int start, final int end) {
        this.source = source;
        text = source.text();
        position = start;
        this.end = end;
    }

    /**
     * Lexes the given range completely.
     */
    public static List<Token> tokenize(final SourceText source, final int start, final int end) {
        final var lexer = new Lexer(source, start, end);
        final var tokens = new ArrayList<Token>();
        for (@Nullable Token token; (token = lexer.nextToken()) != null; ) {
            tokens.add(token);
        }
        return tokens;
    }

    public SourceText source() {
        return source;
    }

    /**
     * Returns the next token, or {@code null} once the input is exhausted and every group and environment was closed.
     */
    public @Nullable Token nextToken() {
        while (position < end) {
            final var ch = text.charAt(position);
            final Token token = switch (ch) {
                case '%' -> {
                    skipComment();
                    yield null;
                }
                case '\\' -> lexBackslash();
                case '{' -> {
                    pushScope(ScopeKind.GROUP, "{", position);
                    position += 1;
                    yield new Token.BeginGroup(position - 1, position);
                }
                case '}' -> {
                    popGroup(position);
                    position += 1;
                    yield new Token.EndGroup(position - 1, position);
                }
                case '$' -> lexDollarMath();
                case '&' -> {
                    position += 1;
                    yield new Token.AlignmentTab(position - 1, position);
                }
                default -> (ch == '\n' && endsBlankLine(position)) ? lexParagraphBreak() : lexText();
            };
            if (token != null) {
                return token;
            }
        }
        if (!scopes.isEmpty()) {
            final var innermost = scopes.get(scopes.size() - 1);
            if (innermost.kind == ScopeKind.GROUP) {
                throw signal(DiagnosticKind.UNMATCHED_BRACE, "Opening brace is never closed", innermost.offset);
            }
            throw signal(
                DiagnosticKind.UNMATCHED_ENVIRONMENT,
                "\\begin{" + innermost.name + "} is never closed",
                innermost.offset
            );
        }
        return null;
    }

    private Token lexText() {
        final var start = position;
        while (position < end) {
            final var ch = text.charAt(position);
            if (ch == '\\' || ch == '{' || ch == '}' || ch == '$' || ch == '%' || ch == '&') {
                break;
            }
            if (ch == '\n' && position > start && endsBlankLine(position)) {
                break;
            }
            position += 1;
        }
        return new Token.Text(text.substring(start, position), start, position);
    }

    private Token lexParagraphBreak() {
        final var start = position;
        while (position < end && Character.isWhitespace(text.charAt(position))) {
            position += 1;
        }
        return new Token.ParagraphBreak(start, position);
    }

    private void skipComment() {
        // The comment swallows its line break and the next line's indentation.
        final var newline = text.indexOf('\n', position);
        position = (newline < 0 || newline >= end) ? end : (newline + 1);
        while (position < end && (text.charAt(position) == ' ' || text.charAt(position) == '\t')) {
            position += 1;
        }
    }

    private @Nullable Token lexBackslash() {
        final var start = position;
        if (position + 1 >= end) {
            position += 1;
            return new Token.Text("\\", start, position);
        }
        final var next = text.charAt(position + 1);
        if (!isLetter(next)) {
            return lexControlSymbol(start, next);
        }
        position += 1;
        while (position < end && isLetter(text.charAt(position))) {
            position += 1;
        }
        final var name = text.substring(start + 1, position);
        switch (name) {
            case "begin":
                return lexBegin(start);
            case "end":
                return lexEnd(start);
            case "verb":
                return lexInlineVerbatim(start, name);
            case "lstinline":
                return lexListingInline(start);
            default:
                break;
        }
        final var signature = CommandSignature.ofCommand(name);
        var starred = false;
        if (signature.starrable() && position < end && text.charAt(position) == '*') {
            starred = true;
            position += 1;
        }
        if (signature.arguments().isEmpty()) {
            skipSpaces();
            return new Token.Command(name, starred, List.of(), start, position);
        }
        final var arguments = captureArguments(signature);
        if (signature.contentArgumentCount() > 0) {
            final var brace = skipWhitespace(position, true);
            if (brace < end && text.charAt(brace) == '{') {
                position = brace;
            }
        }
        return new Token.Command(name, starred, arguments, start, position);
    }

    private Token lexControlSymbol(final int start, final char symbol) {
        switch (symbol) {
            case '[':
                return lexMath(start, start + 2, "\\]", true);
            case '(':
                return lexMath(start, start + 2, "\\)", false);
            case '\\': {
                position += 2;
                var starred = false;
                if (position < end && text.charAt(position) == '*') {
                    starred = true;
                    position += 1;
                }
                final var arguments = captureArguments(CommandSignature.ofCommand("\\"));
                return new Token.Command("\\", starred, arguments, start, position);
            }
            case '\'', '`', '^', '"', '~', '=', '.': {
                final var accented = lexAccent(start, symbol);
                if (accented != null) {
                    return accented;
                }
                break;
            }
            default:
                break;
        }
        position += 2;
        return new Token.Command(String.valueOf(symbol), false, List.of(), start, position);
    }

    private @Nullable Token lexAccent(final int start, final char accent) {
        var i = start + 2;
        final char base;
        if (i < end && text.charAt(i) == '{') {
            final var close = text.indexOf('}', i);
            if (close < 0 || close >= end) {
                return null;
            }
            final var inner = text.substring(i + 1, close).strip();
            if (inner.equals("\\i")) {
                base = 'i';
            } else if (inner.length() == 1) {
                base = inner.charAt(0);
            } else {
                return null;
            }
            i = close + 1;
        } else if (i < end && isLetter(text.charAt(i))) {
            base = text.charAt(i);
            i += 1;
        } else {
            return null;
        }
        final var combining = switch (accent) {
            case '\'' -> '\u0301';
            case '`' -> '\u0300';
            case '^' -> '\u0302';
            case '"' -> '\u0308';
            case '~' -> '\u0303';
            case '=' -> '\u0304';
            default -> '\u0307';
        };
        position = i;
        final var composed = Normalizer.normalize(String.valueOf(base) + combining, Normalizer.Form.NFC);
        return new Token.Text(composed, start, position);
    }

    private @Nullable Token lexBegin(final int start) {
        final var name = readEnvironmentName(start, "\\begin");
        if (VerbatimEnvironments.isVerbatim(name)) {
            return lexVerbatimEnvironment(start, name);
        }
        if (MathEnvironments.isMath(name)) {
            captureArguments(CommandSignature.ofEnvironment(name));
            return lexMath(start, position, "\\end{" + name + "}", !name.equals("math"), name);
        }
        final var arguments = captureArguments(CommandSignature.ofEnvironment(name));
        pushScope(ScopeKind.ENVIRONMENT, name, start);
        return new Token.BeginEnvironment(name, arguments, start, position);
    }

    private Token lexEnd(final int start) {
        final var name = readEnvironmentName(start, "\\end");
        if (scopes.isEmpty()) {
            throw signal(DiagnosticKind.UNMATCHED_ENVIRONMENT, "\\end{" + name + "} without a matching \\begin", start);
        }
        final var innermost = scopes.get(scopes.size() - 1);
        if (innermost.kind == ScopeKind.GROUP) {
            throw signal(
                DiagnosticKind.UNMATCHED_BRACE,
                "Opening brace is not closed before \\end{" + name + "}",
                innermost.offset
            );
        }
        if (!innermost.name.equals(name)) {
            throw signal(
                DiagnosticKind.UNMATCHED_ENVIRONMENT,
                "\\end{" + name + "} does not match \\begin{" + innermost.name + "} at "
                    + source.originAt(innermost.offset),
                start
            );
        }
        scopes.remove(scopes.size() - 1);
        return new Token.EndEnvironment(name, start, position);
    }

    private String readEnvironmentName(final int start, final String command) {
        final var brace = skipWhitespace(position, true);
        if (brace >= end || text.charAt(brace) != '{') {
            throw signal(DiagnosticKind.UNMATCHED_ENVIRONMENT, command + " without an environment name", start);
        }
        final var close = text.indexOf('}', brace);
        if (close < 0 || close >= end) {
            throw signal(DiagnosticKind.UNMATCHED_BRACE, "Environment name is never closed", brace);
        }
        position = close + 1;
        return text.substring(brace + 1, close).strip();
    }

    private @Nullable Token lexVerbatimEnvironment(final int start, final String name) {
        final var arguments = captureArguments(CommandSignature.ofEnvironment(name));
        var bodyStart = position;
        final var lineEnd = text.indexOf('\n', position);
        if (lineEnd >= 0 && lineEnd < end && text.substring(position, lineEnd).isBlank()) {
            bodyStart = lineEnd + 1;
        }
        final var terminator = "\\end{" + name + "}";
        final var terminatorStart = text.indexOf(terminator, position);
        if (terminatorStart < 0 || terminatorStart + terminator.length() > end) {
            throw signal(DiagnosticKind.UNMATCHED_ENVIRONMENT, "\\begin{" + name + "} is never closed", start);
        }
        position = terminatorStart + terminator.length();
        if (VerbatimEnvironments.isDiscarded(name)) {
            return null;
        }
        var bodyEnd = Math.max(bodyStart, terminatorStart);
        if (bodyEnd > bodyStart && text.charAt(bodyEnd - 1) == '\n') {
            bodyEnd -= 1;
        }
        return new Token.Verbatim(
            name,
            arguments,
            text.substring(bodyStart, bodyEnd),
            bodyStart,
            text.substring(start, position),
            false,
            start,
            position
        );
    }

    private Token lexInlineVerbatim(final int start, final String name) {
        if (position < end && text.charAt(position) == '*') {
            position += 1;
        }
        return lexDelimitedVerbatim(start, name, List.of());
    }

    private Token lexListingInline(final int start) {
        final var arguments = captureArguments(CommandSignature.ofEnvironment("lstlisting"));
        if (position < end && text.charAt(position) == '{') {
            final var close = findClosingBrace(position);
            final var bodyStart = position + 1;
            final var body = text.substring(bodyStart, close);
            position = close + 1;
            return new Token.Verbatim("lstinline", arguments, body, bodyStart, text.substring(start, position), true,
                start, position);
        }
        return lexDelimitedVerbatim(start, "lstinline", arguments);
    }

    private Token lexDelimitedVerbatim(final int start, final String name, final List<Argument> arguments) {
        if (position >= end) {
            return new Token.Verbatim(name, arguments, "", position, text.substring(start, position), true, start,
                position);
        }
        final var delimiter = text.charAt(position);
        final var lineEnd = endOfLine(position);
        var close = text.indexOf(delimiter, position + 1);
        if (close < 0 || close > lineEnd) {
            close = lineEnd;
        }
        final var bodyStart = position + 1;
        final var body = text.substring(bodyStart, close);
        position = Math.min(end, close + 1);
        return new Token.Verbatim(name, arguments, body, bodyStart, text.substring(start, position), true, start,
            position);
    }

    private Token lexDollarMath() {
        final var start = position;
        if (position + 1 < end && text.charAt(position + 1) == '$') {
            return lexMath(start, start + 2, "$$", true);
        }
        return lexMath(start, start + 1, "$", false);
    }

    private Token lexMath(final int start, final int bodyStart, final String terminator, final boolean display) {
        return lexMath(start, bodyStart, terminator, display, null);
    }

    private Token lexMath(
        final int start,
        final int bodyStart,
        final String terminator,
        final boolean display,
        final @Nullable String environment
    ) {
        final var body = new StringBuilder();
        final var labels = new ArrayList<Token.LabelOccurrence>();
        var depth = 0;
        var i = bodyStart;
        while (i < end) {
            if (text.startsWith(terminator, i) && (depth == 0 || !terminator.equals("$"))) {
                if (depth != 0) {
                    throw signal(DiagnosticKind.UNMATCHED_BRACE, "Unbalanced braces in math", start);
                }
                position = i + terminator.length();
                return new Token.Math(environment, body.toString().strip(), labels, display, start, position);
            }
            final var ch = text.charAt(i);
            if (ch == '\\' && isLabelCommand(i)) {
                final var brace = skipWhitespace(i + "\\label".length(), false);
                if (brace < end && text.charAt(brace) == '{') {
                    final var close = findClosingBrace(brace);
                    labels.add(new Token.LabelOccurrence(text.substring(brace + 1, close).strip(), i));
                    i = close + 1;
                    continue;
                }
            }
            if (ch == '\\' && i + 1 < end) {
                body.append(ch).append(text.charAt(i + 1));
                i += 2;
                continue;
            }
            if (ch == '%') {
                final var newline = text.indexOf('\n', i);
                i = (newline < 0 || newline >= end) ? end : (newline + 1);
                continue;
            }
            if (ch == '{') {
                depth += 1;
            } else if (ch == '}') {
                depth -= 1;
                if (depth < 0) {
                    throw signal(DiagnosticKind.UNMATCHED_BRACE, "Closing brace without an opening one in math", i);
                }
            } else if (ch == '\n' && environment == null && endsBlankLine(i)) {
                break;
            }
            body.append(ch);
            i += 1;
        }
        if (environment != null) {
            throw signal(DiagnosticKind.UNMATCHED_ENVIRONMENT, "\\begin{" + environment + "} is never closed", start);
        }
        throw signal(DiagnosticKind.UNTERMINATED_MATH, "Math opened with " + text.substring(start, bodyStart)
            + " is not closed with " + terminator, start);
    }

    private boolean isLabelCommand(final int offset) {
        final var after = offset + "\\label".length();
        return text.startsWith("\\label", offset) && (after >= end || !isLetter(text.charAt(after)));
    }

    private List<Argument> captureArguments(final CommandSignature signature) {
        final var arguments = new ArrayList<Argument>();
        for (final var spec : signature.arguments()) {
            switch (spec) {
                case OPTIONAL -> arguments.add(captureOptional());
                case RAW -> arguments.add(captureRaw());
                case CONTENT -> {
                    return arguments;
                }
            }
        }
        return arguments;
    }

    private Argument captureOptional() {
        final var open = skipWhitespace(position, false);
        if (open >= end || text.charAt(open) != '[') {
            return Argument.absent(position);
        }
        var depth = 0;
        for (int i = open + 1; i < end; i += 1) {
            final var ch = text.charAt(i);
            if (ch == '\\') {
                i += 1;
            } else if (ch == '{') {
                depth += 1;
            } else if (ch == '}') {
                depth -= 1;
            } else if (ch == ']' && depth == 0) {
                position = i + 1;
                return new Argument(ArgumentSpec.OPTIONAL, text.substring(open + 1, i), open + 1, i, true);
            } else if (ch == '\n' && endsBlankLine(i)) {
                break;
            }
        }
        // An unclosed bracket is ordinary text.
        return Argument.absent(position);
    }

    private Argument captureRaw() {
        final var start = skipWhitespace(position, true);
        if (start >= end) {
            return new Argument(ArgumentSpec.RAW, "", position, position, false);
        }
        final var ch = text.charAt(start);
        if (ch == '{') {
            final var close = findClosingBrace(start);
            position = close + 1;
            return new Argument(ArgumentSpec.RAW, text.substring(start + 1, close), start + 1, close, true);
        }
        if (ch == '}') {
            return new Argument(ArgumentSpec.RAW, "", position, position, false);
        }
        var argumentEnd = start + 1;
        if (ch == '\\' && argumentEnd < end) {
            if (isLetter(text.charAt(argumentEnd))) {
                while (argumentEnd < end && isLetter(text.charAt(argumentEnd))) {
                    argumentEnd += 1;
                }
            } else {
                argumentEnd += 1;
            }
        }
        position = argumentEnd;
        return new Argument(ArgumentSpec.RAW, text.substring(start, argumentEnd), start, argumentEnd, true);
    }

    private int findClosingBrace(final int open) {
        var depth = 0;
        for (int i = open; i < end; i += 1) {
            final var ch = text.charAt(i);
            if (ch == '\\') {
                i += 1;
            } else if (ch == '{') {
                depth += 1;
            } else if (ch == '}') {
                depth -= 1;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw signal(DiagnosticKind.UNMATCHED_BRACE, "Argument brace is never closed", open);
    }

    private void pushScope(final ScopeKind kind, final String name, final int offset) {
        if (scopes.size() >= maxDepth) {
            throw signal(
                DiagnosticKind.NESTING_TOO_DEEP,
                "More than " + maxDepth + " groups and environments are open at once",
                offset
            );
        }
        scopes.add(new Scope(kind, name, offset));
    }

    private void popGroup(final int offset) {
        if (scopes.isEmpty()) {
            throw signal(DiagnosticKind.UNMATCHED_BRACE, "Closing brace without an opening one", offset);
        }
        final var innermost = scopes.get(scopes.size() - 1);
        if (innermost.kind != ScopeKind.GROUP) {
            throw signal(
                DiagnosticKind.UNMATCHED_BRACE,
                "Closing brace inside \\begin{" + innermost.name + "} without an opening one",
                offset
            );
        }
        scopes.remove(scopes.size() - 1);
    }

    // True iff the line ending at the newline at offset is blank.
    private boolean endsBlankLine(final int newlineOffset) {
        var i = newlineOffset - 1;
        while (i >= 0 && (text.charAt(i) == ' ' || text.charAt(i) == '\t' || text.charAt(i) == '\r')) {
            i -= 1;
        }
        return i < 0 || text.charAt(i) == '\n';
    }

    private void skipSpaces() {
        while (position < end && (text.charAt(position) == ' ' || text.charAt(position) == '\t')) {
            position += 1;
        }
    }

    private int skipWhitespace(final int from, final boolean allowLineBreak) {
        var i = from;
        var sawLineBreak = false;
        while (i < end) {
            final var ch = text.charAt(i);
            if (ch == ' ' || ch == '\t' || ch == '\r') {
                i += 1;
            } else if (ch == '\n' && allowLineBreak && !sawLineBreak) {
                sawLineBreak = true;
                i += 1;
            } else {
                break;
            }
        }
        return i;
    }

    private int endOfLine(final int from) {
        final var newline = text.indexOf('\n', from);
        return (newline < 0 || newline > end) ? end : newline;
    }

    private UnhandledErrorError signal(final DiagnosticKind kind, final String message, final int offset) {
        throw DiagnosticCondition.fatal(kind, message, source.originAt(Math.min(offset, source.length())));
    }

    private static boolean isLetter(final char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }

    /**
     * The maximum number of simultaneously open groups and environments.
     */
    public static final int maxDepth = 256;

    private final SourceText source;
    private final String text;
    private final int end;
    private int position;
    private final List<Scope> scopes = new ArrayList<>();

    private enum ScopeKind {
        GROUP,
        ENVIRONMENT,
    }

    private record Scope(ScopeKind kind, String name, int offset) {
    }
}
