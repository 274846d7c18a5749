// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.bibliography;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import texweave.diagnostic.DiagnosticCondition;
import texweave.diagnostic.DiagnosticKind;
import texweave.source.SourceFile;
import texweave.util.Trace;
import texweave.util.annotation.Nullable;
import texweave.util.condition.UnhandledErrorError;

/**
 * The bibliography parser: turns BibTeX databases into a {@link CitationRegistry}.
 * <p>
 * Entries have the form {@code @type{key, field = value, ...}}, with parentheses allowed in place of the outer braces.
 * Entry and value extents are found by balanced-brace scanning, so commas and quotes inside braced values never split
 * them. Values are braced, quoted, bare numbers or names of {@code @string} macros, joined with {@code #}.
 * {@code @comment} and {@code @preamble} entries are skipped.
 * <p>
 * On error:
 * <ul>
 * <li>a fatal {@code UnmatchedBrace} diagnostic is signaled for an entry that is never closed;
 * <li>a {@code MalformedBibliographyEntry} warning is signaled for an entry without a key or with a field that cannot
 * be read; the entry is skipped, or keeps the fields read before the problem;
 * <li>a {@code DuplicateCitationKey} warning is signaled when a key is defined again, and the later entry wins.
 * </ul>
 */
public final class BibliographyParser {
    private BibliographyParser(final SourceFile file, final Map<String, String> strings) {
        this.file = file;
        text = file.text();
        this.strings = strings;
    }

    /**
     * Parses every database in order into one registry.
     */
    public static CitationRegistry parse(final List<SourceFile> files) {
        final var entries = new LinkedHashMap<String, BibEntry>();
        final var strings = new HashMap<>(monthStrings);
        for (final var file : files) {
            try (final var trace = new Trace(() -> "Parsing the bibliography " + file.displayName())) {
                trace.use();
                for (final var entry : new BibliographyParser(file, strings).entries()) {
                    final var previous = entries.put(entry.key(), entry);
                    if (previous != null) {
                        DiagnosticCondition.warn(
                            DiagnosticKind.DUPLICATE_CITATION_KEY,
                            "Citation key " + entry.key() + " is already defined at " + previous.origin()
                                + "; the later entry wins",
                            entry.origin()
                        );
                    }
                }
            }
        }
        logger.info("Parsed {} bibliography entr{} from {} file(s)",
            entries.size(), (entries.size() == 1) ? "y" : "ies", files.size());
        return new CitationRegistry(entries);
    }

    private List<BibEntry> entries() {
        final var result = new ArrayList<BibEntry>();
        var position = 0;
        while (true) {
            final var at = text.indexOf('@', position);
            if (at < 0) {
                return result;
            }
            var i = at + 1;
            while (i < text.length() && Character.isLetter(text.charAt(i))) {
                i += 1;
            }
            final var type = text.substring(at + 1, i).toLowerCase(Locale.ROOT);
            i = skipWhitespace(i);
            if (type.isEmpty() || i >= text.length() || (text.charAt(i) != '{' && text.charAt(i) != '(')) {
                // A stray @ outside any entry is commentary.
                position = at + 1;
                continue;
            }
            final var close = findClose(at, i);
            position = close + 1;
            switch (type) {
                case "comment", "preamble" -> {
                }
                case "string" -> readFields(at, i + 1, close, strings);
                default -> {
                    final var entry = readEntry(type, at, i + 1, close);
                    if (entry != null) {
                        result.add(entry);
                    }
                }
            }
        }
    }

    private @Nullable BibEntry readEntry(final String type, final int at, final int bodyStart, final int bodyEnd) {
        var comma = bodyStart;
        while (comma < bodyEnd && text.charAt(comma) != ',') {
            comma += 1;
        }
        final var key = text.substring(bodyStart, comma).strip();
        if (key.isEmpty() || key.chars().anyMatch(ch -> Character.isWhitespace(ch) || ch == '=' || ch == '{')) {
            DiagnosticCondition.warn(
                DiagnosticKind.MALFORMED_BIBLIOGRAPHY_ENTRY,
                "@" + type + " entry has no citation key",
                file.originAt(at)
            );
            return null;
        }
        final var rawFields = new LinkedHashMap<String, String>();
        if (comma < bodyEnd) {
            readFields(at, comma + 1, bodyEnd, rawFields);
        }
        final var fields = new LinkedHashMap<String, String>();
        rawFields.forEach((name, value) -> fields.put(name, FieldCleaner.clean(value)));
        return new BibEntry(key, type, fields, text.substring(at, bodyEnd + 1), file.originAt(at));
    }

    // Reads "name = value, ..." pairs from [start, end) into the map, warning about and stopping at a malformed one.
    private void readFields(final int at, final int start, final int end, final Map<String, String> into) {
        var i = start;
        while (true) {
            i = skipWhitespace(i);
            while (i < end && text.charAt(i) == ',') {
                i = skipWhitespace(i + 1);
            }
            if (i >= end) {
                return;
            }
            var nameEnd = i;
            while (nameEnd < end && isNameCharacter(text.charAt(nameEnd))) {
                nameEnd += 1;
            }
            final var name = text.substring(i, nameEnd).toLowerCase(Locale.ROOT);
            final var equals = skipWhitespace(nameEnd);
            if (name.isEmpty() || equals >= end || text.charAt(equals) != '=') {
                malformed(at, "expected a field name followed by =");
                return;
            }
            final var value = new StringBuilder();
            i = skipWhitespace(equals + 1);
            while (true) {
                if (i >= end) {
                    malformed(at, "field " + name + " has no value");
                    return;
                }
                i = readValuePart(at, name, i, end, value);
                if (i < 0) {
                    return;
                }
                i = skipWhitespace(i);
                if (i < end && text.charAt(i) == '#') {
                    i = skipWhitespace(i + 1);
                    continue;
                }
                break;
            }
            into.put(name, value.toString());
        }
    }

    // Appends one value part to into and returns the offset after it, or -1 if the value is malformed.
    private int readValuePart(
        final int at,
        final String name,
        final int start,
        final int end,
        final StringBuilder into
    ) {
        final var ch = text.charAt(start);
        if (ch == '{') {
            final var close = matchingBrace(start, end);
            if (close < 0) {
                malformed(at, "field " + name + " has unbalanced braces");
                return -1;
            }
            into.append(text, start + 1, close);
            return close + 1;
        }
        if (ch == '"') {
            var depth = 0;
            for (int i = start + 1; i < end; i += 1) {
                final var current = text.charAt(i);
                if (current == '{') {
                    depth += 1;
                } else if (current == '}') {
                    depth -= 1;
                } else if (current == '"' && depth == 0) {
                    into.append(text, start + 1, i);
                    return i + 1;
                }
            }
            malformed(at, "field " + name + " has an unterminated quoted value");
            return -1;
        }
        var i = start;
        while (i < end && isNameCharacter(text.charAt(i))) {
            i += 1;
        }
        if (i == start) {
            malformed(at, "field " + name + " has no value");
            return -1;
        }
        final var word = text.substring(start, i);
        if (Character.isDigit(word.charAt(0))) {
            into.append(word);
        } else {
            into.append(strings.getOrDefault(word.toLowerCase(Locale.ROOT), word));
        }
        return i;
    }

    // Finds the delimiter closing the entry whose opening delimiter is at open.
    private int findClose(final int at, final int open) {
        if (text.charAt(open) == '{') {
            final var close = matchingBrace(open, text.length());
            if (close < 0) {
                throw signalUnmatched(at);
            }
            return close;
        }
        var depth = 0;
        for (int i = open + 1; i < text.length(); i += 1) {
            final var ch = text.charAt(i);
            if (ch == '{') {
                depth += 1;
            } else if (ch == '}') {
                depth -= 1;
            } else if (ch == ')' && depth == 0) {
                return i;
            }
        }
        throw signalUnmatched(at);
    }

    private int matchingBrace(final int open, final int end) {
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
        return -1;
    }

    private int skipWhitespace(final int from) {
        var i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i += 1;
        }
        return i;
    }

    private static boolean isNameCharacter(final char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '-' || ch == ':' || ch == '.' || ch == '+';
    }

    private void malformed(final int at, final String message) {
        DiagnosticCondition.warn(DiagnosticKind.MALFORMED_BIBLIOGRAPHY_ENTRY, message, file.originAt(at));
    }

    private UnhandledErrorError signalUnmatched(final int at) {
        throw DiagnosticCondition.fatal(
            DiagnosticKind.UNMATCHED_BIBLIOGRAPHY_BRACE,
            "Bibliography entry is never closed",
            file.originAt(at)
        );
    }

    private static final Logger logger = LoggerFactory.getLogger(BibliographyParser.class);

    private static final Map<String, String> monthStrings = Map.ofEntries(
        Map.entry("jan", "January"),
        Map.entry("feb", "February"),
        Map.entry("mar", "March"),
        Map.entry("apr", "April"),
        Map.entry("may", "May"),
        Map.entry("jun", "June"),
        Map.entry("jul", "July"),
        Map.entry("aug", "August"),
        Map.entry("sep", "September"),
        Map.entry("oct", "October"),
        Map.entry("nov", "November"),
        Map.entry("dec", "December")
    );

    private final SourceFile file;
    private final String text;
    private final Map<String, String> strings;
}
