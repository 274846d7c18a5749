// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.parse;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Map;
import texweave.document.Node;
import texweave.util.annotation.Nullable;

/**
 * Turns LaTeX running text into display text.
 */
public final class TextNormalizer {
    private TextNormalizer() {
    }

    /**
     * Applies the LaTeX ligatures ({@code ---}, {@code --}, {@code ``}, {@code ''}), turns {@code ~} into a no-break
     * space and collapses every run of whitespace, line breaks included, into a single space.
     */
    public static String normalize(final String raw) {
        final var builder = new StringBuilder(raw.length());
        var pendingSpace = false;
        for (int i = 0; i < raw.length(); i += 1) {
            final var ch = raw.charAt(i);
            if (Character.isWhitespace(ch)) {
                pendingSpace = true;
                continue;
            }
            if (pendingSpace) {
                builder.append(' ');
                pendingSpace = false;
            }
            if (ch == '-' && raw.startsWith("---", i)) {
                builder.append('—');
                i += 2;
            } else if (ch == '-' && raw.startsWith("--", i)) {
                builder.append('–');
                i += 1;
            } else if (ch == '`' && raw.startsWith("``", i)) {
                builder.append('“');
                i += 1;
            } else if (ch == '\'' && raw.startsWith("''", i)) {
                builder.append('”');
                i += 1;
            } else if (ch == '`') {
                builder.append('‘');
            } else if (ch == '~') {
                builder.append(' ');
            } else {
                builder.append(ch);
            }
        }
        if (pendingSpace) {
            builder.append(' ');
        }
        return builder.toString();
    }

    /**
     * Returns the text produced by the text-symbol command {@code name}, such as {@code "…"} for
     * {@code \ldots} or {@code "&"} for {@code \&}, or {@code null} if it is not one.
     */
    public static @Nullable String symbol(final String name) {
        return symbols.get(name);
    }

    /**
     * Returns the plain text of an inline node sequence: text, code and link displays, in order, without markup.
     */
    public static String toPlainText(final List<Node> nodes) {
        final var builder = new StringBuilder();
        final var pending = new ArrayDeque<Node>();
        for (int i = nodes.size() - 1; i >= 0; i -= 1) {
            pending.push(nodes.get(i));
        }
        while (!pending.isEmpty()) {
            final var node = pending.pop();
            if (node instanceof final Node.Text text) {
                builder.append(text.text());
            } else if (node instanceof final Node.CodeBlock code) {
                builder.append(code.text());
            } else if (node instanceof final Node.MathBlock math) {
                builder.append('$').append(math.source()).append('$');
            } else if (node instanceof final Node.ResolvedLink link) {
                builder.append(link.display());
            } else if (node instanceof Node.LineBreak) {
                builder.append(' ');
            } else if (!(node instanceof Node.Footnote)) {
                final var children = node.children();
                for (int i = children.size() - 1; i >= 0; i -= 1) {
                    pending.push(children.get(i));
                }
            }
        }
        return builder.toString().strip();
    }

    private static final Map<String, String> symbols = Map.ofEntries(
        Map.entry("&", "&"),
        Map.entry("%", "%"),
        Map.entry("$", "$"),
        Map.entry("#", "#"),
        Map.entry("_", "_"),
        Map.entry("{", "{"),
        Map.entry("}", "}"),
        Map.entry(" ", " "),
        Map.entry("\n", " "),
        Map.entry(",", " "),
        Map.entry(";", " "),
        Map.entry("-", ""),
        Map.entry("/", ""),
        Map.entry("@", ""),
        Map.entry("ldots", "…"),
        Map.entry("dots", "…"),
        Map.entry("textellipsis", "…"),
        Map.entry("LaTeX", "LaTeX"),
        Map.entry("LaTeXe", "LaTeX2ε"),
        Map.entry("TeX", "TeX"),
        Map.entry("textbackslash", "\\"),
        Map.entry("textasciitilde", "~"),
        Map.entry("textasciicircum", "^"),
        Map.entry("textbar", "|"),
        Map.entry("textless", "<"),
        Map.entry("textgreater", ">"),
        Map.entry("textendash", "–"),
        Map.entry("textemdash", "—"),
        Map.entry("textquoteleft", "‘"),
        Map.entry("textquoteright", "’"),
        Map.entry("textquotedblleft", "“"),
        Map.entry("textquotedblright", "”"),
        Map.entry("textbullet", "•"),
        Map.entry("textdegree", "°"),
        Map.entry("copyright", "©"),
        Map.entry("textcopyright", "©"),
        Map.entry("textregistered", "®"),
        Map.entry("texttrademark", "™"),
        Map.entry("S", "§"),
        Map.entry("P", "¶"),
        Map.entry("dag", "†"),
        Map.entry("ddag", "‡"),
        Map.entry("ss", "ß"),
        Map.entry("ae", "æ"),
        Map.entry("AE", "Æ"),
        Map.entry("oe", "œ"),
        Map.entry("OE", "Œ"),
        Map.entry("o", "ø"),
        Map.entry("O", "Ø"),
        Map.entry("aa", "å"),
        Map.entry("AA", "Å"),
        Map.entry("l", "ł"),
        Map.entry("L", "Ł"),
        Map.entry("i", "ı"),
        Map.entry("checkmark", "✓"),
        Map.entry("colon", ":"),
        Map.entry("quad", " "),
        Map.entry("qquad", "  "),
        Map.entry("enspace", " "),
        Map.entry("thinspace", " ")
    );
}
