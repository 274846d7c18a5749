// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.document;

import java.util.Map;
import texweave.util.annotation.Nullable;

/**
 * Inline markup styles, each produced by a text command such as {@code \textbf} or a font declaration such as
 * {@code \bfseries} inside a group.
 */
public enum FormattingStyle {
    BOLD,
    ITALIC,
    EMPHASIS,
    MONOSPACE,
    SMALL_CAPS,
    UNDERLINE,
    SANS_SERIF,
    SLANTED,
    UPRIGHT,
    COLORED,
    BOXED;

    /**
     * Returns the style of a text command taking its content as an argument.
     */
    public static @Nullable FormattingStyle ofCommand(final String name) {
        return commands.get(name);
    }

    /**
     * Returns the style switched on by a font declaration.
     */
    public static @Nullable FormattingStyle ofDeclaration(final String name) {
        return declarations.get(name);
    }

    private static final Map<String, FormattingStyle> commands = Map.ofEntries(
        Map.entry("textbf", BOLD),
        Map.entry("textit", ITALIC),
        Map.entry("emph", EMPHASIS),
        Map.entry("texttt", MONOSPACE),
        Map.entry("textsc", SMALL_CAPS),
        Map.entry("underline", UNDERLINE),
        Map.entry("textsf", SANS_SERIF),
        Map.entry("textsl", SLANTED),
        Map.entry("textrm", UPRIGHT),
        Map.entry("textup", UPRIGHT),
        Map.entry("textmd", UPRIGHT),
        Map.entry("textnormal", UPRIGHT),
        Map.entry("mbox", UPRIGHT),
        Map.entry("text", UPRIGHT),
        Map.entry("textcolor", COLORED),
        Map.entry("colorbox", BOXED),
        Map.entry("fbox", BOXED)
    );

    private static final Map<String, FormattingStyle> declarations = Map.ofEntries(
        Map.entry("bf", BOLD),
        Map.entry("bfseries", BOLD),
        Map.entry("it", ITALIC),
        Map.entry("itshape", ITALIC),
        Map.entry("em", EMPHASIS),
        Map.entry("tt", MONOSPACE),
        Map.entry("ttfamily", MONOSPACE),
        Map.entry("sc", SMALL_CAPS),
        Map.entry("scshape", SMALL_CAPS),
        Map.entry("sf", SANS_SERIF),
        Map.entry("sffamily", SANS_SERIF),
        Map.entry("sl", SLANTED),
        Map.entry("slshape", SLANTED),
        Map.entry("rm", UPRIGHT),
        Map.entry("rmfamily", UPRIGHT),
        Map.entry("upshape", UPRIGHT),
        Map.entry("normalfont", UPRIGHT)
    );
}
