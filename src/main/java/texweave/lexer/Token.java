// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.lexer;

import java.util.List;
import texweave.util.annotation.Nullable;

/**
 * A lexical unit produced by the {@link Lexer}.
 * <p>
 * Every token knows the range of flattened source offsets it was lexed from.
 */
public sealed interface Token {
    /**
     * Offset of the first character of the token in the flattened source.
     */
    int start();

    /**
     * Offset just past the last character of the token.
     */
    int end();

    /**
     * A control sequence with its captured non-content arguments. Control symbols, such as {@code \\} or {@code \&},
     * use the symbol as their name.
     */
    record Command(String name, boolean starred, List<Argument> arguments, int start, int end) implements Token {
        public Command {
            arguments = List.copyOf(arguments);
        }

        /**
         * Returns the raw text of the {@code index}th captured argument, or {@code null} if it is an absent optional
         * argument or was never captured.
         */
        public @Nullable String argument(final int index) {
            if (index >= arguments.size()) {
                return null;
            }
            final var argument = arguments.get(index);
            return argument.present() ? argument.text() : null;
        }
    }

    /**
     * An opening brace that is not part of a captured argument.
     */
    record BeginGroup(int start, int end) implements Token {
    }

    /**
     * The closing brace matching a {@link BeginGroup}.
     */
    record EndGroup(int start, int end) implements Token {
    }

    /**
     * {@code \begin{name}} with the environment's captured arguments.
     */
    record BeginEnvironment(String name, List<Argument> arguments, int start, int end) implements Token {
        public BeginEnvironment {
            arguments = List.copyOf(arguments);
        }

        public @Nullable String argument(final int index) {
            if (index >= arguments.size()) {
                return null;
            }
            final var argument = arguments.get(index);
            return argument.present() ? argument.text() : null;
        }
    }

    /**
     * {@code \end{name}}, already checked to match the innermost open environment.
     */
    record EndEnvironment(String name, int start, int end) implements Token {
    }

    /**
     * A complete math region, copied as opaque source.
     *
     * @param environment The math environment name, or {@code null} for delimiter-based math.
     * @param source      The math source between the delimiters, with {@code \label} commands removed.
     * @param labels      The labels declared inside the region, in order.
     * @param display     Whether the math is displayed rather than inline.
     */
    record Math(
        @Nullable String environment,
        String source,
        List<LabelOccurrence> labels,
        boolean display,
        int start,
        int end
    ) implements Token {
        public Math {
            labels = List.copyOf(labels);
        }
    }

    /**
     * A verbatim region copied byte for byte: a verbatim-class environment or an inline {@code \verb}.
     *
     * @param environment The environment name, or the command name for inline verbatim.
     * @param arguments   Arguments given after {@code \begin{environment}}, such as listing options.
     * @param text        The region's contents.
     * @param textStart   The offset of the contents in the source.
     * @param fullSource  The complete source of the region, delimiters included.
     * @param inline      Whether the region came from an inline command.
     */
    record Verbatim(
        String environment,
        List<Argument> arguments,
        String text,
        int textStart,
        String fullSource,
        boolean inline,
        int start,
        int end
    ) implements Token {
        public Verbatim {
            arguments = List.copyOf(arguments);
        }

        public @Nullable String argument(final int index) {
            if (index >= arguments.size()) {
                return null;
            }
            final var argument = arguments.get(index);
            return argument.present() ? argument.text() : null;
        }
    }

    /**
     * A run of ordinary characters, whitespace included. A single line break is part of the text.
     */
    record Text(String text, int start, int end) implements Token {
    }

    /**
     * One or more blank lines.
     */
    record ParagraphBreak(int start, int end) implements Token {
    }

    /**
     * An unescaped {@code &}.
     */
    record AlignmentTab(int start, int end) implements Token {
    }

    /**
     * A {@code \label} found inside math.
     *
     * @param key    The label key.
     * @param offset The offset of the {@code \label} command.
     */
    record LabelOccurrence(String key, int offset) {
    }
}
