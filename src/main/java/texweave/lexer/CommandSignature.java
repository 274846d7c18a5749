// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.lexer;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The argument layout of a known command or environment.
 * <p>
 * The vocabulary is fixed: commands missing from the table take no arguments, so their braced arguments stay in the
 * token stream as ordinary groups. Environments missing from the table take one optional argument.
 *
 * @param arguments The argument specifications, in order.
 * @param starrable Whether a {@code *} directly after the name belongs to the command.
 */
public record CommandSignature(List<ArgumentSpec> arguments, boolean starrable) {
    public CommandSignature {
        arguments = List.copyOf(arguments);
        assert contentArgumentsTrail(arguments) : "Content arguments must come last";
    }

    /**
     * Returns the number of content arguments, all of which trail the captured ones.
     */
    public int contentArgumentCount() {
        return (int) arguments.stream().filter(spec -> spec == ArgumentSpec.CONTENT).count();
    }

    /**
     * Returns the signature of command {@code name}.
     */
    public static CommandSignature ofCommand(final String name) {
        return commands.getOrDefault(name, noArguments);
    }

    /**
     * Returns the signature of the arguments following {@code \begin{name}}.
     */
    public static CommandSignature ofEnvironment(final String name) {
        return environments.getOrDefault(name, optionalOnly);
    }

    private static boolean contentArgumentsTrail(final List<ArgumentSpec> arguments) {
        var seenContent = false;
        for (final var spec : arguments) {
            if (spec == ArgumentSpec.CONTENT) {
                seenContent = true;
            } else if (seenContent) {
                return false;
            }
        }
        return true;
    }

    private static CommandSignature of(final boolean starrable, final ArgumentSpec... arguments) {
        return new CommandSignature(List.of(arguments), starrable);
    }

    private static final ArgumentSpec O = ArgumentSpec.OPTIONAL;
    private static final ArgumentSpec R = ArgumentSpec.RAW;
    private static final ArgumentSpec C = ArgumentSpec.CONTENT;

    private static final CommandSignature noArguments = of(false);
    private static final CommandSignature optionalOnly = of(false, O);

    private static final Map<String, CommandSignature> commands = new HashMap<>();
    private static final Map<String, CommandSignature> environments = new HashMap<>();

    static {
        for (final var name : List.of("part", "chapter", "section", "subsection", "subsubsection", "paragraph")) {
            commands.put(name, of(true, O, C));
        }
        for (final var name : List.of(
            "textbf", "textit", "emph", "texttt", "textsc", "underline", "textsf", "textrm", "textsl", "textup",
            "textmd", "textnormal", "mbox", "text"
        )) {
            commands.put(name, of(false, C));
        }
        commands.put("footnote", of(false, O, C));
        commands.put("caption", of(true, O, C));
        commands.put("item", of(false, O));
        commands.put("label", of(false, R));
        for (final var name : List.of("ref", "pageref", "eqref", "cref", "Cref", "autoref", "nameref", "vref")) {
            commands.put(name, of(true, R));
        }
        for (final var name : List.of(
            "cite", "citep", "citet", "citealt", "citealp", "parencite", "textcite", "autocite", "footcite"
        )) {
            commands.put(name, of(true, O, O, R));
        }
        commands.put("url", of(false, R));
        commands.put("href", of(false, R, C));
        commands.put("includegraphics", of(true, O, R));
        commands.put("multicolumn", of(false, R, R, C));
        commands.put("multirow", of(false, R, R, C));
        commands.put("textcolor", of(false, R, C));
        commands.put("colorbox", of(false, R, C));
        commands.put("fbox", of(false, C));

        for (final var name : List.of("vspace", "hspace", "addvspace")) {
            commands.put(name, of(true, R));
        }
        for (final var name : List.of(
            "color", "cline", "index", "graphicspath", "bibliographystyle", "bibliography", "theoremstyle", "lstset",
            "hypersetup", "pagestyle", "thispagestyle", "pagenumbering", "geometry", "usetikzlibrary", "tikzset",
            "pgfplotsset", "date", "subtitle", "linespread", "footnotetext"
        )) {
            commands.put(name, of(false, R));
        }
        commands.put("documentclass", of(false, O, R));
        commands.put("usepackage", of(false, O, R));
        commands.put("RequirePackage", of(false, O, R));
        commands.put("title", of(false, O, R));
        commands.put("author", of(false, O, R));
        commands.put("addbibresource", of(false, O, R));
        commands.put("printbibliography", of(false, O));
        commands.put("cmidrule", of(false, O, R));
        commands.put("setlength", of(false, R, R));
        commands.put("setcounter", of(false, R, R));
        commands.put("addtocounter", of(false, R, R));
        commands.put("numberwithin", of(false, R, R));
        commands.put("addcontentsline", of(false, R, R, R));
        commands.put("newtheorem", of(true, R, O, R, O));
        commands.put("newtcolorbox", of(false, R, O, O, R));
        commands.put("DeclareMathOperator", of(true, R, R));
        for (final var name : List.of("newcommand", "renewcommand", "providecommand")) {
            commands.put(name, of(true, R, O, O, R));
        }
        commands.put("def", of(false, R, R));
        commands.put("newenvironment", of(true, R, O, O, R, R));
        commands.put("renewenvironment", of(true, R, O, O, R, R));
        commands.put("linebreak", of(false, O));
        commands.put("footnotemark", of(false, O));
        commands.put("\\", of(true, O));

        environments.put("tabular", of(false, O, R));
        environments.put("tabular*", of(false, R, O, R));
        environments.put("tabularx", of(false, R, O, R));
        environments.put("longtable", of(false, O, R));
        environments.put("array", of(false, O, R));
        environments.put("wrapfigure", of(false, O, R, O, R));
        environments.put("minipage", of(false, O, O, O, R));
        environments.put("minted", of(false, O, R));
        environments.put("alignat", of(false, R));
        environments.put("alignat*", of(false, R));
        environments.put("multicols", of(false, R));
    }
}
