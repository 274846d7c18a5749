// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.numbering;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import texweave.config.CounterRule;
import texweave.config.NumberingScheme;
import texweave.config.ResetScope;
import texweave.document.DivisionLevel;
import texweave.document.Node;
import texweave.lexer.MathEnvironments;
import texweave.util.Trace;
import texweave.util.annotation.Nullable;

/**
 * The numbering engine: a single depth-first walk assigning a number to every numbered node.
 * <p>
 * Numbered nodes are numbered divisions, environments whose descriptor is numbered, numbered math environments,
 * captioned figures, tables and listings, and footnotes. A node is numbered before its children, so a theorem comes
 * before the footnotes in its body.
 * <p>
 * Divisions are numbered the book way: parts with Roman numerals, top-level divisions with Arabic numerals or, in the
 * appendix, with letters, deeper divisions by appending to the number of their parent. Every other counter is stepped
 * per its {@link CounterRule}. A hierarchical counter is prefixed with the number of the division it resets at, or
 * falls back to its bare value where there is no such numbered division. Entering any division resets the counters
 * resetting at its level or deeper ones.
 * <p>
 * The walk is a pure function of the tree and the plan; the counters live only as long as one call to
 * {@link #number(Node.DocumentRoot, NumberingPlan)}.
 */
public final class NumberingEngine {
    private NumberingEngine(final NumberingPlan plan) {
        this.plan = plan;
    }

    /**
     * Returns a copy of {@code root} with numbers assigned.
     */
    public static Node.DocumentRoot number(final Node.DocumentRoot root, final NumberingPlan plan) {
        try (final var trace = new Trace("Numbering the document")) {
            trace.use();
            final var engine = new NumberingEngine(plan);
            final var result = root.withChildren(engine.numberAll(root.children()));
            logger.info("Numbered {} node(s)", engine.numberedCount);
            return result;
        }
    }

    private List<Node> numberAll(final List<Node> nodes) {
        final var result = new ArrayList<Node>(nodes.size());
        for (final var node : nodes) {
            result.add(numberNode(node));
        }
        return result;
    }

    private Node numberNode(final Node node) {
        final var number = (node instanceof final Node.Division division) ? enterDivision(division) : stepFor(node);
        var result = node;
        if (number != null) {
            numberedCount += 1;
            result = result.withNumber(number);
        }
        if (!result.children().isEmpty()) {
            result = result.withChildren(numberAll(result.children()));
        }
        return result;
    }

    private @Nullable String enterDivision(final Node.Division division) {
        final var level = division.level();
        divisionNumbers.keySet().removeIf(other -> !level.isDeeperThan(other));
        resetCounters(level);
        if (!division.numbered()) {
            return null;
        }
        if (division.appendix() && !inAppendix && level == plan.topLevel()) {
            inAppendix = true;
            divisionCounts.remove(level);
        }
        final int count = divisionCounts.merge(level, 1, Integer::sum);
        if (level != DivisionLevel.PART) {
            divisionCounts.keySet().removeIf(other -> other.isDeeperThan(level));
        }
        final String number;
        if (level == DivisionLevel.PART) {
            number = toRoman(count);
        } else if (level == plan.topLevel()) {
            number = inAppendix ? toLetters(count) : Integer.toString(count);
        } else {
            final var prefix = divisionNumbers.get(DivisionLevel.values()[level.ordinal() - 1]);
            number = (prefix != null) ? (prefix + "." + count) : Integer.toString(count);
        }
        divisionNumbers.put(level, number);
        return number;
    }

    private void resetCounters(final DivisionLevel level) {
        for (final var entry : rulesInUse.entrySet()) {
            final var resetLevel = entry.getValue().reset().level();
            if (resetLevel != null && !level.isDeeperThan(resetLevel)) {
                counts.remove(entry.getKey());
            }
        }
    }

    private @Nullable String stepFor(final Node node) {
        if (node instanceof final Node.Environment environment) {
            final var style = plan.environments().lookup(environment.name());
            if (!style.isNumbered()) {
                return null;
            }
            return step(style.counter(), plan.ruleFor(style.counter(), style.counterRule()));
        } else if (node instanceof final Node.MathBlock math) {
            final var name = math.environment();
            if (!math.display() || name == null || !MathEnvironments.isNumbered(name)) {
                return null;
            }
            final var tag = explicitTag(math.source());
            if (tag != null) {
                return tag;
            }
            if (isSuppressed(math.source())) {
                return null;
            }
            return stepBuiltIn("equation");
        } else if (node instanceof final Node.Figure figure) {
            return hasCaption(figure.children()) ? stepBuiltIn("figure") : null;
        } else if (node instanceof final Node.Table table) {
            return hasCaption(table.children()) ? stepBuiltIn("table") : null;
        } else if (node instanceof Node.Algorithm) {
            return stepBuiltIn("algorithm");
        } else if (node instanceof final Node.CodeBlock code) {
            if (code.inline() || code.caption() == null) {
                return null;
            }
            return stepBuiltIn("listing");
        } else if (node instanceof Node.Footnote) {
            return step("footnote", plan.ruleFor("footnote", footnoteDefault));
        }
        return null;
    }

    private @Nullable String stepBuiltIn(final String counter) {
        return step(counter, plan.ruleFor(counter, CounterRule.perChapter));
    }

    private @Nullable String step(final String counter, final CounterRule rule) {
        if (rule.scheme() == NumberingScheme.NONE) {
            return null;
        }
        rulesInUse.putIfAbsent(counter, rule);
        final int value = counts.merge(counter, 1, Integer::sum);
        final var resetLevel = rule.reset().level();
        if (rule.scheme() == NumberingScheme.HIERARCHICAL && resetLevel != null) {
            final var prefix = divisionNumbers.get(resetLevel);
            if (prefix != null) {
                return prefix + "." + value;
            }
        }
        return Integer.toString(value);
    }

    private static boolean hasCaption(final List<Node> children) {
        return children.stream().anyMatch(child -> child instanceof Node.Caption);
    }

    // A multi-line block stays numbered unless every line opts out.
    private static boolean isSuppressed(final String source) {
        for (final var line : source.split("\\\\\\\\", -1)) {
            if (!line.contains("\\notag") && !line.contains("\\nonumber")) {
                return false;
            }
        }
        return true;
    }

    private static @Nullable String explicitTag(final String source) {
        final var start = source.indexOf("\\tag{");
        if (start < 0) {
            return null;
        }
        final var end = source.indexOf('}', start);
        return (end < 0) ? null : source.substring(start + 5, end).strip();
    }

    private static String toRoman(final int value) {
        final var result = new StringBuilder();
        var remaining = value;
        for (int i = 0; i < romanValues.length; i += 1) {
            while (remaining >= romanValues[i]) {
                result.append(romanDigits[i]);
                remaining -= romanValues[i];
            }
        }
        return result.toString();
    }

    // A, B, ..., Z, AA, AB, ...
    private static String toLetters(final int value) {
        final var result = new StringBuilder();
        var remaining = value;
        while (remaining > 0) {
            remaining -= 1;
            result.append((char) ('A' + remaining % 26));
            remaining /= 26;
        }
        return result.reverse().toString();
    }

    private static final Logger logger = LoggerFactory.getLogger(NumberingEngine.class);

    private static final CounterRule footnoteDefault =
        new CounterRule(NumberingScheme.SEQUENTIAL, ResetScope.PER_CHAPTER);
    private static final int[] romanValues = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
    private static final String[] romanDigits = {"M", "CM", "D", "CD", "C", "XC", "L", "XL", "X", "IX", "V", "IV", "I"};

    private final NumberingPlan plan;
    private final Map<DivisionLevel, Integer> divisionCounts = new EnumMap<>(DivisionLevel.class);
    private final Map<DivisionLevel, String> divisionNumbers = new EnumMap<>(DivisionLevel.class);
    private final Map<String, Integer> counts = new HashMap<>();
    private final Map<String, CounterRule> rulesInUse = new LinkedHashMap<>();
    private boolean inAppendix = false;
    private int numberedCount = 0;
}
