// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.config;

/**
 * The numbering rule of one counter.
 */
public record CounterRule(NumberingScheme scheme, ResetScope reset) {
    public static final CounterRule perChapter = new CounterRule(NumberingScheme.HIERARCHICAL, ResetScope.PER_CHAPTER);
    public static final CounterRule global = new CounterRule(NumberingScheme.SEQUENTIAL, ResetScope.GLOBAL);
    public static final CounterRule unnumbered = new CounterRule(NumberingScheme.NONE, ResetScope.GLOBAL);
}
