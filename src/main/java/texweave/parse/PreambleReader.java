// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import texweave.config.CounterRule;
import texweave.config.EnvironmentStyle;
import texweave.config.EnvironmentTable;
import texweave.config.Metadata;
import texweave.config.NumberingScheme;
import texweave.config.ResetScope;
import texweave.document.EnvironmentKind;
import texweave.lexer.Argument;
import texweave.lexer.Lexer;
import texweave.lexer.Token;
import texweave.source.SourceText;
import texweave.util.Trace;
import texweave.util.annotation.Nullable;

/**
 * Reads the declarations of a preamble into a {@link Preamble}.
 * <p>
 * A {@code \newtheorem} with a {@code within} argument is numbered hierarchically and reset by that division, one
 * without it sequentially through the whole document, and a {@code \newtheorem} sharing another environment's counter
 * uses that environment's rule. {@code \newtcolorbox} defines an unnumbered box, labeled by its {@code title} option.
 */
public final class PreambleReader {
    private PreambleReader(final SourceText source) {
        this.source = source;
    }

    /**
     * Reads the preamble occupying the flattened offsets {@code [start, end)}.
     */
    public static Preamble read(final SourceText source, final int start, final int end) {
        try (final var trace = new Trace("Reading the preamble")) {
            trace.use();
            final var reader = new PreambleReader(source);
            final var lexer = new Lexer(source, start, end);
            for (@Nullable Token token; (token = lexer.nextToken()) != null; ) {
                if (token instanceof final Token.Command command) {
                    reader.command(command);
                }
            }
            final var preamble = reader.build();
            logger.debug(
                "Preamble: class {}, {} environment(s), {} math macro(s), {} diagram declaration(s)",
                preamble.documentClass(),
                preamble.environments().size(),
                preamble.mathMacros().size(),
                preamble.diagramSetup().size()
            );
            return preamble;
        }
    }

    private void command(final Token.Command command) {
        switch (command.name()) {
            case "documentclass" -> {
                final var name = command.argument(1);
                if (name != null) {
                    documentClass = name.strip();
                }
            }
            case "title" -> title = plainText(command, 1);
            case "author" -> author = plainText(command, 1);
            case "subtitle" -> subtitle = plainText(command, 0);
            case "date" -> date = plainText(command, 0);
            case "newtheorem" -> newTheorem(command);
            case "newtcolorbox" -> newTcolorbox(command);
            case "DeclareMathOperator" -> {
                final var name = command.argument(0);
                final var body = command.argument(1);
                if (name != null && body != null) {
                    final var expansion = command.starred()
                        ? "\\operatorname*{" + body.strip() + "}"
                        : "\\operatorname{" + body.strip() + "}";
                    mathMacros.put(name.strip(), expansion);
                }
            }
            case "newcommand", "renewcommand", "providecommand" -> macro(command.argument(0), command.argument(3));
            case "def" -> macro(command.argument(0), command.argument(1));
            case "graphicspath" -> {
                final var paths = command.argument(0);
                if (paths != null) {
                    for (final var path : paths.split("[{}]")) {
                        if (!path.isBlank()) {
                            graphicsPaths.add(path.strip());
                        }
                    }
                }
            }
            case "usetikzlibrary", "tikzset", "pgfplotsset" -> diagramSetup.add(source.text().substring(
                command.start(),
                command.end()
            ).strip());
            case "usepackage" -> {
                final var packages = command.argument(1);
                if (packages != null && loadsDiagramPackage(packages)) {
                    diagramSetup.add(source.text().substring(command.start(), command.end()).strip());
                }
            }
            case "numberwithin" -> {
                final var counter = command.argument(0);
                final var within = command.argument(1);
                final var reset = (within == null) ? null : ResetScope.ofDivisionName(within);
                if (counter != null && reset != null) {
                    counterRules.put(counter.strip(), new CounterRule(NumberingScheme.HIERARCHICAL, reset));
                }
            }
            default -> {
            }
        }
    }

    private void newTheorem(final Token.Command command) {
        final var name = command.argument(0);
        final var label = plainText(command, 2);
        if (name == null || label == null) {
            return;
        }
        final var environment = name.strip();
        if (command.starred()) {
            environments.put(
                environment,
                EnvironmentStyle.unnumbered(environment, EnvironmentKind.THEOREM_LIKE, "env-theorem", label)
            );
            return;
        }
        final var shared = command.argument(1);
        final var within = command.argument(3);
        final EnvironmentStyle style;
        if (shared != null) {
            final var sharedName = shared.strip();
            final var sharedStyle = environments.containsKey(sharedName)
                ? environments.get(sharedName)
                : EnvironmentTable.defaults("en").lookup(sharedName);
            final var counter = sharedStyle.isNumbered() ? sharedStyle.counter() : sharedName;
            final var rule = sharedStyle.isNumbered() ? sharedStyle.counterRule() : CounterRule.perChapter;
            style = new EnvironmentStyle(
                EnvironmentKind.THEOREM_LIKE,
                "env-theorem",
                label,
                counter,
                rule.scheme(),
                rule.reset()
            );
        } else {
            final var reset = (within == null) ? null : ResetScope.ofDivisionName(within);
            style = new EnvironmentStyle(
                EnvironmentKind.THEOREM_LIKE,
                "env-theorem",
                label,
                environment,
                (reset == null) ? NumberingScheme.SEQUENTIAL : NumberingScheme.HIERARCHICAL,
                (reset == null) ? ResetScope.GLOBAL : reset
            );
        }
        environments.put(environment, style);
    }

    private void newTcolorbox(final Token.Command command) {
        final var name = command.argument(0);
        if (name == null) {
            return;
        }
        final var environment = name.strip();
        final var options = command.argument(3);
        var label = (options == null) ? null : KeyValueOptions.parse(options).get("title");
        if (label == null || label.isBlank()) {
            label = environment.isEmpty()
                ? environment
                : Character.toUpperCase(environment.charAt(0)) + environment.substring(1);
        }
        environments.put(
            environment,
            EnvironmentStyle.unnumbered(environment, EnvironmentKind.CUSTOM, "box-green", label.strip())
        );
    }

    private static boolean loadsDiagramPackage(final String packages) {
        for (final var name : packages.split(",")) {
            final var trimmed = name.strip();
            if (trimmed.startsWith("tikz") || trimmed.startsWith("pgfplots")) {
                return true;
            }
        }
        return false;
    }

    private void macro(final @Nullable String name, final @Nullable String body) {
        if (name == null || body == null) {
            return;
        }
        final var command = name.strip();
        if (command.startsWith("\\") && command.length() > 1) {
            mathMacros.put(command, body.strip());
        }
    }

    private @Nullable String plainText(final Token.Command command, final int index) {
        if (index >= command.arguments().size()) {
            return null;
        }
        final var argument = command.arguments().get(index);
        return argument.present() ? plainText(argument) : null;
    }

    private String plainText(final Argument argument) {
        final var builder = new StringBuilder();
        final var lexer = new Lexer(source, argument.contentStart(), argument.contentEnd());
        for (@Nullable Token token; (token = lexer.nextToken()) != null; ) {
            if (token instanceof final Token.Text text) {
                builder.append(text.text());
            } else if (token instanceof final Token.Math math) {
                builder.append('$').append(math.source()).append('$');
            } else if (token instanceof final Token.Command command) {
                if (command.name().equals("\\") || command.name().equals("newline")) {
                    builder.append(' ');
                } else if (command.name().equals("and")) {
                    while (!builder.isEmpty() && Character.isWhitespace(builder.charAt(builder.length() - 1))) {
                        builder.setLength(builder.length() - 1);
                    }
                    builder.append(", ");
                } else {
                    final var symbol = TextNormalizer.symbol(command.name());
                    if (symbol != null) {
                        builder.append(symbol);
                    }
                }
            }
        }
        return TextNormalizer.normalize(builder.toString()).strip();
    }

    private Preamble build() {
        return new Preamble(
            documentClass,
            new Metadata(title, subtitle, author, null, date, null),
            environments,
            counterRules,
            mathMacros,
            graphicsPaths,
            diagramSetup
        );
    }

    private static final Logger logger = LoggerFactory.getLogger(PreambleReader.class);

    private final SourceText source;
    private String documentClass = "book";
    private @Nullable String title = null;
    private @Nullable String subtitle = null;
    private @Nullable String author = null;
    private @Nullable String date = null;
    private final Map<String, EnvironmentStyle> environments = new LinkedHashMap<>();
    private final Map<String, CounterRule> counterRules = new LinkedHashMap<>();
    private final Map<String, String> mathMacros = new LinkedHashMap<>();
    private final List<String> graphicsPaths = new ArrayList<>();
    private final List<String> diagramSetup = new ArrayList<>();
}
