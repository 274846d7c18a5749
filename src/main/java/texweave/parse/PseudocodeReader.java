// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.parse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import texweave.document.PseudocodeLine;
import texweave.util.annotation.Nullable;

/**
 * Reads the bodies of pseudocode environments into indented lines.
 * <p>
 * {@code algorithmic} bodies use the algpseudocode commands, {@code \State}, {@code \If} ... {@code \EndIf} and so
 * on, or their upper-case spellings from the older algorithmic package. {@code algorithm2e} bodies use braced
 * blocks and {@code \;} as the statement terminator. Statement text and conditions are kept as TeX source.
 */
public final class PseudocodeReader {
    private PseudocodeReader(final String text) {
        this.text = withoutComments(text);
    }

    public static List<PseudocodeLine> readAlgorithmic(final String body) {
        final var reader = new PseudocodeReader(body);
        reader.algorithmic();
        return List.copyOf(reader.lines);
    }

    public static List<PseudocodeLine> readAlgorithm2e(final String body) {
        final var reader = new PseudocodeReader(body);
        reader.algorithm2e();
        return List.copyOf(reader.lines);
    }

    private void algorithmic() {
        var start = skipSpace(0);
        if (start < text.length() && text.charAt(start) == '[') {
            final var close = text.indexOf(']', start);
            start = (close < 0) ? start : close + 1;
        }
        var i = nextAlgorithmicCommand(start);
        final var leading = text.substring(start, i).strip();
        if (!leading.isEmpty()) {
            statement("", leading);
        }
        while (i < text.length()) {
            final var nameEnd = endOfName(i + 1);
            final var command = algorithmicCommands.get(text.substring(i + 1, nameEnd));
            final var next = nextAlgorithmicCommand(nameEnd);
            assert command != null : "Statement search returned a non-statement command";
            algorithmicStatement(command, nameEnd, next);
            i = next;
        }
    }

    private void algorithmicStatement(final String command, final int from, final int to) {
        switch (command) {
            case "State" -> {
                // \State \Return x is one line.
                if (!text.substring(from, to).isBlank()) {
                    statement("", text.substring(from, to));
                }
            }
            case "Statex" -> statement("", text.substring(from, to));
            case "Require" -> statement("Require:", text.substring(from, to));
            case "Ensure" -> statement("Ensure:", text.substring(from, to));
            case "Return" -> statement("return", text.substring(from, to));
            case "If" -> opener("if", true, from, to, "then");
            case "ElsIf" -> {
                dedent();
                opener("else if", true, from, to, "then");
            }
            case "Else" -> {
                dedent();
                opener("else", false, from, to, "");
            }
            case "While" -> opener("while", true, from, to, "do");
            case "For" -> opener("for", true, from, to, "do");
            case "ForAll" -> opener("for all", true, from, to, "do");
            case "Repeat" -> opener("repeat", false, from, to, "");
            case "Loop" -> opener("loop", false, from, to, "");
            case "Until" -> {
                dedent();
                final var condition = group(skipSpace(from), to);
                lines.add(new PseudocodeLine(depth, "until", contentOf(condition), "", commentIn(from, to)));
            }
            case "Function", "Procedure" -> {
                final var name = group(skipSpace(from), to);
                final var nameEnd = (name == null) ? from : name.end;
                final var parameters = group(skipSpace(nameEnd), to);
                final var signature = contentOf(name) + "(" + contentOf(parameters) + ")";
                final var keyword = command.toLowerCase(Locale.ROOT);
                lines.add(new PseudocodeLine(depth, keyword, signature, "", commentIn(from, to)));
                depth += 1;
            }
            case "Comment" -> {
                final var comment = group(skipSpace(from), to);
                lines.add(new PseudocodeLine(depth, "", "", "", contentOf(comment).strip()));
            }
            default -> {
                // EndIf, EndWhile and the other block ends.
                dedent();
                final var block = command.substring(3).toLowerCase(Locale.ROOT);
                lines.add(new PseudocodeLine(depth, "end " + block, "", "", commentIn(from, to)));
            }
        }
    }

    private void opener(
        final String keyword,
        final boolean hasCondition,
        final int from,
        final int to,
        final String trailer
    ) {
        var condition = "";
        var rest = from;
        if (hasCondition) {
            final var group = group(skipSpace(from), to);
            condition = contentOf(group);
            rest = (group == null) ? from : group.end;
        }
        lines.add(new PseudocodeLine(depth, keyword, condition, trailer, commentIn(rest, to)));
        depth += 1;
    }

    private void statement(final String keyword, final String raw) {
        var body = raw;
        @Nullable String comment = null;
        final var commentStart = findCommand(body, "Comment", "COMMENT");
        if (commentStart >= 0) {
            final var reader = new PseudocodeReader(body);
            final var group = reader.group(reader.skipSpace(endOfName(body, commentStart + 1)), body.length());
            if (group != null) {
                comment = group.content.strip();
                body = body.substring(0, commentStart) + body.substring(group.end);
            }
        }
        lines.add(new PseudocodeLine(depth, keyword, callsToText(body).strip(), "", comment));
    }

    private @Nullable String commentIn(final int from, final int to) {
        final var segment = text.substring(from, to);
        final var start = findCommand(segment, "Comment", "COMMENT");
        if (start < 0) {
            return null;
        }
        final var reader = new PseudocodeReader(segment);
        final var group = reader.group(reader.skipSpace(endOfName(segment, start + 1)), segment.length());
        return (group == null) ? null : group.content.strip();
    }

    private void algorithm2e() {
        final var blocks = new ArrayDeque<Block>();
        var i = 0;
        while (i < text.length()) {
            final var ch = text.charAt(i);
            if (ch == '\n') {
                flushStatement();
                sameLine = false;
                i += 1;
            } else if (ch == '}') {
                flushStatement();
                i = closeBlock(blocks, i + 1);
            } else if (ch == '{') {
                final var group = group(i, text.length());
                final var end = (group == null) ? text.length() : group.end;
                statement.append(text, i, end);
                i = end;
            } else if (ch == '\\') {
                i = algorithm2eCommand(blocks, i);
            } else {
                statement.append(ch);
                i += 1;
            }
        }
        flushStatement();
    }

    private int algorithm2eCommand(final ArrayDeque<Block> blocks, final int start) {
        if (start + 1 < text.length() && text.charAt(start + 1) == ';') {
            flushStatement();
            sameLine = true;
            return start + 2;
        }
        final var nameEnd = endOfName(start + 1);
        final var name = text.substring(start + 1, nameEnd);
        if (name.isEmpty()) {
            statement.append(text, start, Math.min(start + 2, text.length()));
            return Math.min(start + 2, text.length());
        }
        switch (name) {
            case "KwIn", "KwOut", "KwData", "KwResult" -> {
                flushStatement();
                final var group = group(skipSpace(nameEnd), text.length());
                lines.add(PseudocodeLine.of(depth, kwLabels.get(name), contentOf(group).strip()));
                return (group == null) ? nameEnd : group.end;
            }
            case "If", "uIf", "eIf" -> {
                return blockOpener(blocks, nameEnd, "if", true, "then", name.equals("eIf"), null);
            }
            case "ElseIf", "uElseIf" -> {
                return blockOpener(blocks, nameEnd, "else if", true, "then", false, null);
            }
            case "Else", "uElse" -> {
                return blockOpener(blocks, nameEnd, "else", false, "", false, null);
            }
            case "While" -> {
                return blockOpener(blocks, nameEnd, "while", true, "do", false, null);
            }
            case "For" -> {
                return blockOpener(blocks, nameEnd, "for", true, "do", false, null);
            }
            case "ForEach" -> {
                return blockOpener(blocks, nameEnd, "for each", true, "do", false, null);
            }
            case "ForAll" -> {
                return blockOpener(blocks, nameEnd, "for all", true, "do", false, null);
            }
            case "Repeat" -> {
                final var condition = group(skipSpace(nameEnd), text.length());
                final var until = PseudocodeLine.of(0, "until", contentOf(condition));
                final var after = (condition == null) ? nameEnd : condition.end;
                return blockOpener(blocks, after, "repeat", false, "", false, until);
            }
            case "lIf", "lElseIf", "lElse", "lWhile", "lFor", "lForEach", "lForAll" -> {
                return oneLineBlock(name.substring(1), nameEnd);
            }
            case "tcp", "tcc" -> {
                return comment(nameEnd);
            }
            case "KwRet", "Return" -> {
                flushStatement();
                statementKeyword = "return";
                final var group = (nameEnd < text.length() && text.charAt(nameEnd) == '{')
                    ? group(nameEnd, text.length())
                    : null;
                if (group != null) {
                    statement.append(group.content);
                    return group.end;
                }
                return nameEnd;
            }
            case "KwTo" -> {
                statement.append("to");
                return nameEnd;
            }
            default -> {
                if (isAlgorithm2eSetting(name)) {
                    return skipGroups(nameEnd);
                }
                statement.append(text, start, nameEnd);
                return nameEnd;
            }
        }
    }

    private int blockOpener(
        final ArrayDeque<Block> blocks,
        final int from,
        final String keyword,
        final boolean hasCondition,
        final String trailer,
        final boolean elseFollows,
        final @Nullable PseudocodeLine closing
    ) {
        flushStatement();
        var position = from;
        var condition = "";
        if (hasCondition) {
            final var group = group(skipSpace(position), text.length());
            condition = contentOf(group);
            position = (group == null) ? position : group.end;
        }
        lines.add(new PseudocodeLine(depth, keyword, condition.replace("\\KwTo", "to").strip(), trailer, null));
        final var brace = skipSpace(position);
        if (brace >= text.length() || text.charAt(brace) != '{') {
            return position;
        }
        blocks.push(new Block(closing, elseFollows));
        depth += 1;
        return brace + 1;
    }

    private int closeBlock(final ArrayDeque<Block> blocks, final int after) {
        dedent();
        final var block = blocks.poll();
        if (block == null) {
            return after;
        }
        if (block.closing != null) {
            lines.add(new PseudocodeLine(depth, block.closing.keyword(), block.closing.text(), "", null));
        }
        if (!block.elseFollows) {
            return after;
        }
        lines.add(PseudocodeLine.of(depth, "else", ""));
        final var brace = skipSpace(after);
        if (brace >= text.length() || text.charAt(brace) != '{') {
            return after;
        }
        blocks.push(new Block(null, false));
        depth += 1;
        return brace + 1;
    }

    private int oneLineBlock(final String kind, final int from) {
        flushStatement();
        var position = from;
        var condition = "";
        if (!kind.equals("Else")) {
            final var group = group(skipSpace(position), text.length());
            condition = contentOf(group).strip();
            position = (group == null) ? position : group.end;
        }
        final var body = group(skipSpace(position), text.length());
        final var keyword = switch (kind) {
            case "If" -> "if";
            case "ElseIf" -> "else if";
            case "Else" -> "else";
            case "While" -> "while";
            case "For" -> "for";
            case "ForEach" -> "for each";
            default -> "for all";
        };
        final var trailer = switch (kind) {
            case "If", "ElseIf" -> "then";
            case "Else" -> "";
            default -> "do";
        };
        lines.add(new PseudocodeLine(depth, keyword, condition, trailer, null));
        final var statementText = contentOf(body).replace("\\;", "").strip();
        if (!statementText.isEmpty()) {
            lines.add(PseudocodeLine.of(depth + 1, "", statementText));
        }
        return (body == null) ? position : body.end;
    }

    private int comment(final int from) {
        var position = from;
        if (position < text.length() && text.charAt(position) == '*') {
            position += 1;
        }
        if (position < text.length() && text.charAt(position) == '[') {
            final var close = text.indexOf(']', position);
            position = (close < 0) ? position : close + 1;
        }
        final var group = group(skipSpace(position), text.length());
        final var comment = contentOf(group).strip();
        final var end = (group == null) ? position : group.end;
        if (!statement.toString().isBlank() || !statementKeyword.isEmpty()) {
            pendingComment = comment;
        } else if (sameLine && !lines.isEmpty() && lines.get(lines.size() - 1).comment() == null) {
            lines.set(lines.size() - 1, lines.get(lines.size() - 1).withComment(comment));
        } else {
            lines.add(new PseudocodeLine(depth, "", "", "", comment));
        }
        return end;
    }

    private void flushStatement() {
        final var body = statement.toString().strip();
        if (!body.isEmpty() || !statementKeyword.isEmpty()) {
            lines.add(new PseudocodeLine(depth, statementKeyword, body, "", pendingComment));
        } else if (pendingComment != null) {
            lines.add(new PseudocodeLine(depth, "", "", "", pendingComment));
        }
        statement.setLength(0);
        statementKeyword = "";
        pendingComment = null;
    }

    private int skipGroups(final int from) {
        var position = from;
        while (true) {
            final var next = skipSpace(position);
            if (next >= text.length() || text.charAt(next) != '{') {
                return position;
            }
            final var group = group(next, text.length());
            if (group == null) {
                return text.length();
            }
            position = group.end;
        }
    }

    private void dedent() {
        depth = Math.max(0, depth - 1);
    }

    // A \Comment only starts a statement of its own at the beginning of a line.
    private int nextAlgorithmicCommand(final int from) {
        var i = text.indexOf('\\', from);
        while (i >= 0) {
            final var nameEnd = endOfName(i + 1);
            final var command = algorithmicCommands.get(text.substring(i + 1, nameEnd));
            if (command != null && (!command.equals("Comment") || startsLine(i))) {
                return i;
            }
            i = text.indexOf('\\', Math.max(nameEnd, i + 2));
        }
        return text.length();
    }

    // The balanced brace group opening at start, if there is one before limit.
    private @Nullable Group group(final int start, final int limit) {
        if (start >= limit || text.charAt(start) != '{') {
            return null;
        }
        var level = 0;
        for (int i = start; i < limit; i += 1) {
            final var ch = text.charAt(i);
            if (ch == '\\') {
                i += 1;
            } else if (ch == '{') {
                level += 1;
            } else if (ch == '}') {
                level -= 1;
                if (level == 0) {
                    return new Group(text.substring(start + 1, i), i + 1);
                }
            }
        }
        return new Group(text.substring(start + 1, limit), limit);
    }

    private static String contentOf(final @Nullable Group group) {
        return (group == null) ? "" : group.content;
    }

    private boolean startsLine(final int offset) {
        var i = offset - 1;
        while (i >= 0 && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i -= 1;
        }
        return i < 0 || text.charAt(i) == '\n';
    }

    private int skipSpace(final int from) {
        var i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i += 1;
        }
        return i;
    }

    private int endOfName(final int from) {
        return endOfName(text, from);
    }

    private static int endOfName(final String text, final int from) {
        var i = from;
        while (i < text.length() && Character.isLetter(text.charAt(i))) {
            i += 1;
        }
        return i;
    }

    private static int findCommand(final String text, final String... names) {
        var i = text.indexOf('\\');
        while (i >= 0) {
            final var nameEnd = endOfName(text, i + 1);
            final var name = text.substring(i + 1, nameEnd);
            for (final var candidate : names) {
                if (candidate.equals(name)) {
                    return i;
                }
            }
            i = text.indexOf('\\', Math.max(nameEnd, i + 2));
        }
        return -1;
    }

    // \Call{Name}{arguments} reads as Name(arguments).
    private static String callsToText(final String text) {
        var result = text;
        var start = findCommand(result, "Call", "CALL");
        while (start >= 0) {
            final var reader = new PseudocodeReader(result);
            final var name = reader.group(reader.skipSpace(endOfName(result, start + 1)), result.length());
            if (name == null) {
                break;
            }
            final var arguments = reader.group(reader.skipSpace(name.end), result.length());
            final var end = (arguments == null) ? name.end : arguments.end;
            final var call = name.content + "(" + ((arguments == null) ? "" : arguments.content) + ")";
            result = result.substring(0, start) + call + result.substring(end);
            start = findCommand(result, "Call", "CALL");
        }
        return result;
    }

    private static boolean isAlgorithm2eSetting(final String name) {
        return name.startsWith("Set") || name.startsWith("Dont") || name.equals("LinesNumbered")
            || name.equals("LinesNotNumbered") || name.equals("ResetInOut") || name.equals("caption")
            || name.equals("label") || name.equals("Indp") || name.equals("Indm");
    }

    private static String withoutComments(final String text) {
        final var result = new StringBuilder(text.length());
        var i = 0;
        while (i < text.length()) {
            final var ch = text.charAt(i);
            if (ch == '\\' && i + 1 < text.length()) {
                result.append(text, i, i + 2);
                i += 2;
            } else if (ch == '%') {
                final var newline = text.indexOf('\n', i);
                i = (newline < 0) ? text.length() : newline;
            } else {
                result.append(ch);
                i += 1;
            }
        }
        return result.toString();
    }

    private static Map<String, String> commandTable() {
        final var names = List.of(
            "State", "Statex", "If", "ElsIf", "Else", "EndIf", "While", "EndWhile", "For", "ForAll", "EndFor",
            "Repeat", "Until", "Loop", "EndLoop", "Return", "Require", "Ensure", "Function", "EndFunction",
            "Procedure", "EndProcedure", "Comment"
        );
        final var result = new HashMap<String, String>();
        for (final var name : names) {
            result.put(name, name);
        }
        // The algorithmic package spells the same commands in upper case.
        for (final var name : List.of(
            "State", "If", "ElsIf", "Else", "EndIf", "While", "EndWhile", "For", "ForAll", "EndFor", "Repeat",
            "Until", "Loop", "EndLoop", "Return", "Require", "Ensure", "Comment"
        )) {
            result.put(name.toUpperCase(Locale.ROOT), name);
        }
        return Map.copyOf(result);
    }

    private record Group(String content, int end) {
    }

    // What closing a braced algorithm2e block adds: a line such as "until ...", or an "else" block to open.
    private record Block(@Nullable PseudocodeLine closing, boolean elseFollows) {
    }

    private static final Map<String, String> algorithmicCommands = commandTable();
    private static final Map<String, String> kwLabels = Map.of(
        "KwIn", "Input:",
        "KwOut", "Output:",
        "KwData", "Data:",
        "KwResult", "Result:"
    );

    private final String text;
    private final List<PseudocodeLine> lines = new ArrayList<>();
    private final StringBuilder statement = new StringBuilder();
    private String statementKeyword = "";
    private @Nullable String pendingComment = null;
    private boolean sameLine = false;
    private int depth = 0;
}
