// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.bibliography;

import java.text.Normalizer;
import texweave.parse.TextNormalizer;

/**
 * Cleans a bibliography field value for display: braces go, {@code $...$} math stays as written, the markup commands
 * {@code \textit}, {@code \emph}, {@code \textbf} and {@code \textsc} are unwrapped, hyphenation hints are removed,
 * accents are composed and dashes and quotes become their typographic forms.
 */
final class FieldCleaner {
    private FieldCleaner() {
    }

    static String clean(final String value) {
        final var result = new StringBuilder();
        final var plain = new StringBuilder();
        var inMath = false;
        for (int i = 0; i < value.length(); i += 1) {
            final var ch = value.charAt(i);
            if (ch == '$') {
                if (inMath) {
                    result.append(plain).append('$');
                } else {
                    result.append(TextNormalizer.normalize(plain.toString())).append('$');
                }
                plain.setLength(0);
                inMath = !inMath;
            } else if (inMath) {
                plain.append(ch);
            } else if (ch == '{' || ch == '}') {
                continue;
            } else if (ch == '\\' && i + 1 < value.length()) {
                i = command(value, i, plain);
            } else {
                plain.append(ch);
            }
        }
        if (inMath) {
            result.append(plain);
        } else {
            result.append(TextNormalizer.normalize(plain.toString()));
        }
        return result.toString().strip();
    }

    // Handles the command at offset start and returns the offset of its last character.
    private static int command(final String value, final int start, final StringBuilder into) {
        final var next = value.charAt(start + 1);
        if (!Character.isLetter(next)) {
            final var combining = combiningMark(next);
            if (combining != '\0') {
                var base = start + 2;
                while (base < value.length() && value.charAt(base) == '{') {
                    base += 1;
                }
                if (base < value.length() && Character.isLetter(value.charAt(base))) {
                    into.append(Normalizer.normalize(value.charAt(base) + String.valueOf(combining),
                        Normalizer.Form.NFC));
                    return base;
                }
            }
            if (next != '-') {
                into.append(next);
            }
            return start + 1;
        }
        var end = start + 1;
        while (end < value.length() && Character.isLetter(value.charAt(end))) {
            end += 1;
        }
        final var name = value.substring(start + 1, end);
        final var symbol = TextNormalizer.symbol(name);
        if (symbol != null) {
            into.append(symbol);
        }
        // Markup commands vanish and leave their braced argument behind, which loses its braces like any other group.
        while (end < value.length() && value.charAt(end) == ' ') {
            end += 1;
        }
        return end - 1;
    }

    private static char combiningMark(final char accent) {
        return switch (accent) {
            case '\'' -> '\u0301';
            case '`' -> '\u0300';
            case '^' -> '\u0302';
            case '"' -> '\u0308';
            case '~' -> '\u0303';
            case '=' -> '\u0304';
            case '.' -> '\u0307';
            default -> '\0';
        };
    }
}
