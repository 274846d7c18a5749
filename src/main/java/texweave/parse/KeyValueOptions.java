// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.parse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses {@code key=value} option lists such as {@code language=Java, caption={A, B}, numbers=left}.
 * <p>
 * Commas and equal signs inside braces do not split. Values lose one level of enclosing braces. A key without a value
 * maps to {@code "true"}.
 */
public final class KeyValueOptions {
    private KeyValueOptions() {
    }

    public static Map<String, String> parse(final String options) {
        final var result = new LinkedHashMap<String, String>();
        var depth = 0;
        var itemStart = 0;
        for (int i = 0; i <= options.length(); i += 1) {
            final var ch = (i < options.length()) ? options.charAt(i) : ',';
            if (ch == '\\') {
                i += 1;
            } else if (ch == '{') {
                depth += 1;
            } else if (ch == '}') {
                depth = Math.max(0, depth - 1);
            } else if (ch == ',' && depth == 0) {
                addItem(options.substring(itemStart, Math.min(i, options.length())), result);
                itemStart = i + 1;
            }
        }
        return Collections.unmodifiableMap(result);
    }

    private static void addItem(final String item, final Map<String, String> into) {
        final var equals = topLevelEquals(item);
        if (equals < 0) {
            final var key = item.strip();
            if (!key.isEmpty()) {
                into.put(key, "true");
            }
            return;
        }
        final var key = item.substring(0, equals).strip();
        if (!key.isEmpty()) {
            into.put(key, unbrace(item.substring(equals + 1).strip()));
        }
    }

    private static int topLevelEquals(final String item) {
        var depth = 0;
        for (int i = 0; i < item.length(); i += 1) {
            final var ch = item.charAt(i);
            if (ch == '{') {
                depth += 1;
            } else if (ch == '}') {
                depth -= 1;
            } else if (ch == '=' && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    static String unbrace(final String value) {
        if (value.length() >= 2 && value.charAt(0) == '{' && value.charAt(value.length() - 1) == '}') {
            return value.substring(1, value.length() - 1).strip();
        }
        return value;
    }
}
