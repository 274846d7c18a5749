// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.document;

import texweave.util.annotation.Nullable;

/**
 * Sectioning levels, outermost first.
 */
public enum DivisionLevel {
    PART("part"),
    CHAPTER("chapter"),
    SECTION("section"),
    SUBSECTION("subsection"),
    SUBSUBSECTION("subsubsection");

    DivisionLevel(final String commandName) {
        this.commandName = commandName;
    }

    public String commandName() {
        return commandName;
    }

    /**
     * Returns the level introduced by the sectioning command {@code name}, or {@code null} if it is not one.
     */
    public static @Nullable DivisionLevel ofCommand(final String name) {
        for (final var level : values()) {
            if (level.commandName.equals(name)) {
                return level;
            }
        }
        return null;
    }

    /**
     * Returns whether this level is nested deeper than {@code other}.
     */
    public boolean isDeeperThan(final DivisionLevel other) {
        return ordinal() > other.ordinal();
    }

    private final String commandName;
}
