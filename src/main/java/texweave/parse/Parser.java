// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.parse;

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import texweave.config.EnvironmentStyle;
import texweave.config.EnvironmentTable;
import texweave.diagnostic.DiagnosticCondition;
import texweave.diagnostic.DiagnosticKind;
import texweave.document.DiagramRendering;
import texweave.document.DivisionLevel;
import texweave.document.EnvironmentKind;
import texweave.document.FormattingStyle;
import texweave.document.Node;
import texweave.document.NodeId;
import texweave.document.NodeIdGenerator;
import texweave.document.ReferenceKind;
import texweave.lexer.Argument;
import texweave.lexer.ArgumentSpec;
import texweave.lexer.Lexer;
import texweave.lexer.Token;
import texweave.lexer.VerbatimEnvironments;
import texweave.source.SourceSpan;
import texweave.source.SourceText;
import texweave.util.Trace;
import texweave.util.UnreachableCodeReachedError;
import texweave.util.condition.UnhandledErrorError;

/**
 * The structural parser: the primary means of turning the token stream of a document body into a document tree.
 * <p>
 * Every node under construction is an entry on an explicit stack of open frames, so nesting costs no call stack and a
 * document opening more than {@link #maxDepth} nodes at once fails with a fatal {@code NestingTooDeep} diagnostic.
 * Paragraphs, list items, table rows and cells are opened implicitly by the content that needs them and closed by
 * whatever closes their container.
 * <p>
 * A sectioning command closes every open paragraph and every open division of equal or deeper level, then opens its
 * own division. It is a fatal {@code UnexpectedSectioningAtDepth} error for a sectioning command to appear inside an
 * environment, group or argument, or to skip a level, such as a {@code \subsection} directly inside a
 * {@code \chapter}.
 * <p>
 * A {@code \label} names the nearest enclosing numbered node: a float, a numbered environment or a numbered division.
 * Without one, it names the nearest enclosing structural node, or the document root. Labels found inside math and
 * listing options name the math block or the listing itself.
 */
public final class Parser {
    private Parser(
        final SourceText source,
        final Lexer lexer,
        final EnvironmentTable environments,
        final DivisionLevel topLevel,
        final NodeIdGenerator ids
    ) {
        this.source = source;
        this.lexer = lexer;
        this.environments = environments;
        this.topLevel = topLevel;
        this.ids = ids;
    }

    /**
     * Parses the document body occupying the flattened offsets {@code [start, end)}. If the range starts with
     * {@code \begin{document}}, parsing stops at the matching {@code \end{document}}.
     *
     * @param topLevel The outermost sectioning level below {@code \part}.
     */
    public static Node.DocumentRoot parse(
        final SourceText source,
        final int start,
        final int end,
        final EnvironmentTable environments,
        final DivisionLevel topLevel,
        final NodeIdGenerator ids
    ) {
        try (final var trace = new Trace(() -> "Parsing the body of " + source.rootFile().displayName())) {
            trace.use();
            final var parser = new Parser(source, new Lexer(source, start, end), environments, topLevel, ids);
            final var root = new RootFrame(ids.next(), start);
            parser.frames.add(root);
            final var stop = parser.run();
            final var rootEnd = (stop >= 0) ? stop : end;
            while (parser.frames.size() > 1) {
                parser.pop(rootEnd);
            }
            final var result = new Node.DocumentRoot(root.id(), parser.span(start, rootEnd), root.children);
            logger.debug("Parsed {} top-level node(s)", result.children().size());
            return result;
        }
    }

    // Returns the offset of \end{document}, or -1 if the token stream ended without one.
    private int run() {
        for (@Nullable Token token; (token = next()) != null; ) {
            if (token instanceof final Token.Text text) {
                text(text);
            } else if (token instanceof final Token.Command command) {
                command(command);
            } else if (token instanceof final Token.BeginGroup group) {
                ensureInline(group.start());
                push(new GroupFrame(group.start()));
            } else if (token instanceof final Token.EndGroup group) {
                endGroup(group);
            } else if (token instanceof final Token.BeginEnvironment environment) {
                beginEnvironment(environment);
            } else if (token instanceof final Token.EndEnvironment environment) {
                if (environment.name().equals("document")) {
                    return environment.start();
                }
                endEnvironment(environment);
            } else if (token instanceof final Token.Math math) {
                math(math);
            } else if (token instanceof final Token.Verbatim verbatim) {
                verbatim(verbatim);
            } else if (token instanceof final Token.ParagraphBreak paragraphBreak) {
                paragraphBreak(paragraphBreak);
            } else if (token instanceof final Token.AlignmentTab tab) {
                alignmentTab(tab);
            } else {
                throw new UnreachableCodeReachedError("Unknown token " + token);
            }
        }
        return -1;
    }

    private void text(final Token.Text token) {
        addText(TextNormalizer.normalize(token.text()), token.start(), token.end());
    }

    private void addText(final String text, final int start, final int end) {
        if (text.isEmpty() || (text.isBlank() && !top().isInline())) {
            return;
        }
        ensureInline(start);
        if (!mergeText(text, span(start, end))) {
            top().children.add(new Node.Text(ids.next(), span(start, end), text));
        }
    }

    // Appends text to a text node ending the children of the top frame, if there is one.
    private boolean mergeText(final String text, final SourceSpan span) {
        final var children = top().children;
        if (children.isEmpty() || !(children.get(children.size() - 1) instanceof final Node.Text previous)) {
            return false;
        }
        final var joined = (previous.text().endsWith(" ") && text.startsWith(" "))
            ? previous.text() + text.substring(1)
            : previous.text() + text;
        children.set(children.size() - 1, new Node.Text(previous.id(), previous.span().to(span), joined));
        return true;
    }

    private void command(final Token.Command command) {
        final var name = command.name();
        final var level = DivisionLevel.ofCommand(name);
        if (level != null) {
            sectioning(command, level);
            return;
        }
        final var style = FormattingStyle.ofCommand(name);
        if (style != null) {
            ensureInline(command.start());
            final var id = ids.next();
            contentArgument(command, (content, end) ->
                append(new Node.Formatting(id, span(command.start(), end), style, content)));
            return;
        }
        final var declaration = FormattingStyle.ofDeclaration(name);
        if (declaration != null) {
            ensureInline(command.start());
            push(new DeclarationFrame(ids.next(), command.start(), declaration));
            return;
        }
        final var reference = ReferenceKind.ofCommand(name);
        if (reference != null) {
            reference(command, reference);
            return;
        }
        final var symbol = TextNormalizer.symbol(name);
        if (symbol != null) {
            addText(symbol, command.start(), command.end());
            return;
        }
        switch (name) {
            case "appendix" -> appendix = true;
            case "frontmatter", "backmatter" -> mainMatter = false;
            case "mainmatter" -> mainMatter = true;
            case "paragraph" -> runInHeading(command);
            case "footnote" -> {
                ensureInline(command.start());
                final var id = ids.next();
                contentArgument(command, (content, end) ->
                    append(new Node.Footnote(id, span(command.start(), end), null, trimmed(content))));
            }
            case "caption" -> {
                ensureBlock(command.start());
                final var id = ids.next();
                contentArgument(command, (content, end) ->
                    append(new Node.Caption(id, span(command.start(), end), trimmed(content))));
            }
            case "item" -> item(command);
            case "label" -> {
                final var key = command.argument(0);
                if (key != null && !key.isBlank()) {
                    if (!top().isBlock() && !top().isInline()) {
                        ensureInline(command.start());
                    }
                    final var span = span(command.start(), command.end());
                    append(new Node.Label(ids.next(), span, key.strip(), labelTarget()));
                }
            }
            case "url" -> {
                final var url = command.argument(0);
                if (url != null) {
                    ensureInline(command.start());
                    final var span = span(command.start(), command.end());
                    final var id = ids.next();
                    final var text = new Node.Text(ids.next(), span, url.strip());
                    append(new Node.Hyperlink(id, span, url.strip(), List.of(text)));
                }
            }
            case "href" -> {
                ensureInline(command.start());
                final var id = ids.next();
                final var url = command.argument(0);
                contentArgument(command, (content, end) -> append(new Node.Hyperlink(
                    id,
                    span(command.start(), end),
                    (url == null) ? "" : url.strip(),
                    content
                )));
            }
            case "includegraphics" -> {
                final var path = command.argument(1);
                if (path != null) {
                    if (!top().isBlock() && !top().isInline()) {
                        ensureInline(command.start());
                    }
                    final var options = command.argument(0);
                    append(new Node.Image(
                        ids.next(),
                        span(command.start(), command.end()),
                        path.strip(),
                        (options == null) ? "" : options.strip()
                    ));
                }
            }
            case "multicolumn" -> {
                ensureInline(command.start());
                if (top() instanceof final CellFrame cell) {
                    cell.columnSpan = parseSpan(command.argument(0));
                }
                contentArgument(command, (content, end) -> content.forEach(this::append));
            }
            case "multirow" -> {
                ensureInline(command.start());
                contentArgument(command, (content, end) -> content.forEach(this::append));
            }
            case "\\", "newline", "linebreak" -> lineBreak(command);
            default -> {
                // Everything else is layout or unknown, and dropped. Braced arguments it did not capture remain as
                // ordinary groups.
            }
        }
    }

    private void sectioning(final Token.Command command, final DivisionLevel level) {
        endParagraph(command.start());
        for (final var frame : frames) {
            if (!(frame instanceof RootFrame) && !(frame instanceof DivisionFrame)) {
                throw signal(
                    DiagnosticKind.UNEXPECTED_SECTIONING_AT_DEPTH,
                    "\\" + level.commandName() + " inside " + frame.describe(),
                    command.start()
                );
            }
        }
        while (top() instanceof final DivisionFrame division && !level.isDeeperThan(division.level)) {
            pop(command.start());
        }
        final boolean valid;
        final String where;
        if (top() instanceof final DivisionFrame parent) {
            valid = level.ordinal() == parent.level.ordinal() + 1
                || (parent.level == DivisionLevel.PART && level == topLevel);
            where = "directly inside a \\" + parent.level.commandName();
        } else {
            valid = level == DivisionLevel.PART || level == topLevel;
            where = "before any \\" + topLevel.commandName();
        }
        if (!valid) {
            throw signal(
                DiagnosticKind.UNEXPECTED_SECTIONING_AT_DEPTH,
                "\\" + level.commandName() + " cannot appear " + where,
                command.start()
            );
        }
        final var id = ids.next();
        final var numbered = !command.starred() && mainMatter;
        final var inAppendix = appendix;
        // A \label inside the title belongs to the division the title starts.
        contentArgument(command, id, numbered, (title, end) ->
            push(new DivisionFrame(id, command.start(), level, numbered, inAppendix, trimmed(title))));
    }

    private void runInHeading(final Token.Command command) {
        endParagraph(command.start());
        ensureInline(command.start());
        final var id = ids.next();
        contentArgument(command, (content, end) -> append(
            new Node.Formatting(id, span(command.start(), end), FormattingStyle.BOLD, trimmed(content))));
    }

    private void reference(final Token.Command command, final ReferenceKind kind) {
        final var raw = command.argument(kind.isCitation() ? 2 : 0);
        if (raw == null) {
            return;
        }
        ensureInline(command.start());
        final var span = span(command.start(), command.end());
        final var keys = (kind == ReferenceKind.CITE || kind == ReferenceKind.CREF)
            ? List.of(raw.split(","))
            : List.of(raw);
        for (final var key : keys) {
            final var stripped = key.strip();
            if (!stripped.isEmpty()) {
                append(new Node.CrossRef(ids.next(), span, stripped, kind));
            }
        }
    }

    private void item(final Token.Command command) {
        endParagraph(command.start());
        if (top() instanceof ItemFrame) {
            pop(command.start());
        }
        if (!(top() instanceof ListFrame)) {
            return;
        }
        final var id = ids.next();
        final var labelArgument = command.arguments().isEmpty() ? null : command.arguments().get(0);
        final List<Node> label = (labelArgument != null && labelArgument.present())
            ? parseInline(labelArgument, id)
            : List.of();
        push(new ItemFrame(id, command.start(), label));
    }

    private void lineBreak(final Token.Command command) {
        if (isInTabular()) {
            endRow(command.start());
        } else if (top().isInline()) {
            append(new Node.LineBreak(ids.next(), span(command.start(), command.end())));
        }
    }

    private void alignmentTab(final Token.AlignmentTab tab) {
        if (!isInTabular()) {
            return;
        }
        while (top() instanceof DeclarationFrame) {
            pop(tab.start());
        }
        ensureInline(tab.start());
        pop(tab.start());
        push(new CellFrame(ids.next(), tab.end()));
    }

    private void endRow(final int offset) {
        while (top() instanceof DeclarationFrame) {
            pop(offset);
        }
        ensureInline(offset);
        if (top() instanceof CellFrame) {
            pop(offset);
        }
        if (top() instanceof RowFrame) {
            pop(offset);
        }
    }

    private boolean isInTabular() {
        var index = frames.size() - 1;
        while (frames.get(index) instanceof DeclarationFrame) {
            index -= 1;
        }
        final var frame = frames.get(index);
        return frame instanceof CellFrame || frame instanceof RowFrame || frame instanceof TabularFrame;
    }

    private void endGroup(final Token.EndGroup token) {
        while (top().isImplicit()) {
            pop(token.start());
        }
        if (!(top() instanceof GroupFrame) && !(top() instanceof ArgumentFrame)) {
            throw signal(DiagnosticKind.UNMATCHED_BRACE, "Closing brace inside " + top().describe(), token.start());
        }
        pop(token.end());
    }

    private void beginEnvironment(final Token.BeginEnvironment token) {
        final var name = token.name();
        if (name.equals("document")) {
            return;
        }
        ensureBlock(token.start());
        final var id = ids.next();
        switch (name) {
            case "figure", "figure*", "wrapfigure", "SCfigure" -> push(new FigureFrame(id, token.start(), name));
            case "table", "table*" -> push(new TableFrame(id, token.start(), name));
            case "algorithm", "algorithm*" -> push(new AlgorithmFrame(id, token.start(), name));
            case "tabular", "longtable" -> push(new TabularFrame(id, token.start(), name, argumentText(token, 1)));
            case "tabular*", "tabularx" -> push(new TabularFrame(id, token.start(), name, argumentText(token, 2)));
            default -> {
                final var style = environments.lookup(name);
                if (style.kind() == EnvironmentKind.LIST) {
                    push(new ListFrame(id, token.start(), name));
                    return;
                }
                final var arguments = token.arguments();
                final List<Node> title = (arguments.size() == 1
                    && arguments.get(0).spec() == ArgumentSpec.OPTIONAL
                    && arguments.get(0).present())
                    ? parseInline(arguments.get(0), id)
                    : List.of();
                push(new EnvironmentFrame(id, token.start(), name, style, title));
            }
        }
    }

    private void endEnvironment(final Token.EndEnvironment token) {
        while (top().isImplicit()) {
            pop(token.start());
        }
        if (!token.name().equals(top().environmentName())) {
            throw signal(
                DiagnosticKind.UNMATCHED_ENVIRONMENT,
                "\\end{" + token.name() + "} closes " + top().describe(),
                token.start()
            );
        }
        pop(token.end());
    }

    private void math(final Token.Math token) {
        if (token.display()) {
            ensureBlock(token.start());
        } else {
            ensureInline(token.start());
        }
        final var id = ids.next();
        append(new Node.MathBlock(
            id,
            span(token.start(), token.end()),
            token.display(),
            token.environment(),
            token.source(),
            null
        ));
        for (final var label : token.labels()) {
            append(new Node.Label(ids.next(), span(label.offset(), label.offset()), label.key(), id));
        }
    }

    private void verbatim(final Token.Verbatim token) {
        final var environment = token.environment();
        final var span = span(token.start(), token.end());
        if (VerbatimEnvironments.isDiagram(environment)) {
            ensureBlock(token.start());
            append(new Node.DiagramBlock(
                ids.next(),
                span,
                environment,
                token.fullSource(),
                new DiagramRendering.Pending()
            ));
            return;
        }
        if (VerbatimEnvironments.isPseudocode(environment)) {
            pseudocode(token);
            return;
        }
        final var options = KeyValueOptions.parse(argumentText(token.argument(0)));
        if (token.inline()) {
            ensureInline(token.start());
            append(new Node.CodeBlock(
                ids.next(),
                span,
                environment,
                options.get("language"),
                token.text(),
                false,
                true,
                null,
                null
            ));
            return;
        }
        ensureBlock(token.start());
        @Nullable String language = null;
        @Nullable String caption = null;
        @Nullable String label = null;
        var lineNumbers = false;
        if (environment.equals("lstlisting")) {
            language = options.get("language");
            final var rawCaption = options.get("caption");
            caption = (rawCaption == null) ? null : TextNormalizer.normalize(rawCaption).strip();
            label = options.get("label");
            final var numbers = options.get("numbers");
            lineNumbers = numbers != null && !numbers.equals("none");
        } else if (environment.equals("minted")) {
            language = token.argument(1);
            lineNumbers = options.containsKey("linenos");
        }
        final var id = ids.next();
        append(new Node.CodeBlock(id, span, environment, language, token.text(), lineNumbers, false, caption, null));
        if (label != null && !label.isBlank()) {
            append(new Node.Label(ids.next(), span, label.strip(), id));
        }
    }

    private void pseudocode(final Token.Verbatim token) {
        ensureBlock(token.start());
        final var environment = token.environment();
        final var span = span(token.start(), token.end());
        if (environment.equals("algorithmic")) {
            final var pseudocode = new Node.Pseudocode(
                ids.next(),
                span,
                environment,
                PseudocodeReader.readAlgorithmic(token.text())
            );
            if (top() instanceof AlgorithmFrame) {
                append(pseudocode);
            } else {
                append(new Node.Algorithm(ids.next(), span, environment, null, List.of(pseudocode)));
            }
            return;
        }
        // algorithm2e is a float of its own, with the caption and labels inside the body.
        final var id = ids.next();
        final var children = new ArrayList<Node>();
        final var body = token.text();
        for (final var caption : commandArguments(body, "caption")) {
            final var captionId = ids.next();
            final var argument = new Argument(
                ArgumentSpec.CONTENT,
                body.substring(caption[0], caption[1]),
                token.textStart() + caption[0],
                token.textStart() + caption[1],
                true
            );
            children.add(new Node.Caption(captionId, span, parseInline(argument, captionId)));
        }
        for (final var label : commandArguments(body, "label")) {
            final var key = body.substring(label[0], label[1]).strip();
            if (!key.isEmpty()) {
                final var offset = token.textStart() + label[0];
                children.add(new Node.Label(ids.next(), span(offset, offset), key, id));
            }
        }
        children.add(new Node.Pseudocode(ids.next(), span, environment, PseudocodeReader.readAlgorithm2e(body)));
        append(new Node.Algorithm(id, span, environment, null, children));
    }

    private void paragraphBreak(final Token.ParagraphBreak token) {
        if (!endParagraph(token.start()) && top().isInline()) {
            addText(" ", token.start(), token.end());
        }
    }

    // Closes the paragraph on top of the stack, with any font declarations inside it. Returns whether there was one.
    private boolean endParagraph(final int offset) {
        var index = frames.size() - 1;
        while (frames.get(index) instanceof DeclarationFrame) {
            index -= 1;
        }
        if (!(frames.get(index) instanceof ParagraphFrame)) {
            return false;
        }
        while (frames.size() > index) {
            pop(offset);
        }
        return true;
    }

    // Makes the top of the stack accept inline content.
    private void ensureInline(final int offset) {
        final var frame = top();
        if (frame instanceof TabularFrame) {
            push(new RowFrame(ids.next(), offset));
            push(new CellFrame(ids.next(), offset));
        } else if (frame instanceof RowFrame) {
            push(new CellFrame(ids.next(), offset));
        } else if (frame instanceof ListFrame) {
            push(new ItemFrame(ids.next(), offset, List.of()));
            push(new ParagraphFrame(ids.next(), offset));
        } else if (frame.isBlock()) {
            push(new ParagraphFrame(ids.next(), offset));
        }
    }

    // Makes the top of the stack accept block content, closing the current paragraph.
    private void ensureBlock(final int offset) {
        endParagraph(offset);
        final var frame = top();
        if (frame instanceof TabularFrame || frame instanceof RowFrame) {
            ensureInline(offset);
        } else if (frame instanceof ListFrame) {
            push(new ItemFrame(ids.next(), offset, List.of()));
        }
    }

    private void contentArgument(final Token.Command command, final ArgumentSink sink) {
        contentArgument(command, null, false, sink);
    }

    private void contentArgument(
        final Token.Command command,
        final @Nullable NodeId labelOwner,
        final boolean ownerNumbered,
        final ArgumentSink sink
    ) {
        final var next = peek();
        if (next instanceof final Token.BeginGroup group) {
            next();
            push(new ArgumentFrame(group.start(), labelOwner, ownerNumbered, sink));
        } else {
            sink.accept(List.of(), command.end());
        }
    }

    private List<Node> parseInline(final Argument argument, final NodeId owner) {
        final var parser = new Parser(
            source,
            new Lexer(source, argument.contentStart(), argument.contentEnd()),
            environments,
            topLevel,
            ids
        );
        final var root = new InlineRootFrame(owner, argument.contentStart());
        parser.frames.add(root);
        parser.run();
        while (parser.frames.size() > 1) {
            parser.pop(argument.contentEnd());
        }
        return trimmed(root.children);
    }

    private NodeId labelTarget() {
        for (int i = frames.size() - 1; i >= 0; i -= 1) {
            final var frame = frames.get(i);
            if (frame instanceof final ArgumentFrame argument && argument.labelOwner != null) {
                if (argument.ownerNumbered) {
                    return argument.labelOwner;
                }
            } else if (frame.isNumberedTarget()) {
                return frame.id();
            }
        }
        for (int i = frames.size() - 1; i >= 0; i -= 1) {
            final var frame = frames.get(i);
            if (frame instanceof final ArgumentFrame argument && argument.labelOwner != null) {
                return argument.labelOwner;
            } else if (frame.isStructural()) {
                return frame.id();
            }
        }
        throw new UnreachableCodeReachedError("The root frame is structural");
    }

    private void append(final Node node) {
        if (node instanceof final Node.Text text && mergeText(text.text(), text.span())) {
            return;
        }
        top().children.add(node);
    }

    private Frame top() {
        return frames.get(frames.size() - 1);
    }

    private void push(final Frame frame) {
        if (frames.size() >= maxDepth) {
            throw signal(
                DiagnosticKind.NESTING_TOO_DEEP,
                "More than " + maxDepth + " document nodes are open at once",
                frame.start
            );
        }
        frames.add(frame);
    }

    private void pop(final int end) {
        final var frame = frames.remove(frames.size() - 1);
        final var node = frame.build(this, end);
        if (node != null) {
            top().children.add(node);
        }
    }

    private @Nullable Token next() {
        final var token = lookahead;
        if (token != null) {
            lookahead = null;
            return token;
        }
        return lexer.nextToken();
    }

    private @Nullable Token peek() {
        if (lookahead == null) {
            lookahead = lexer.nextToken();
        }
        return lookahead;
    }

    private SourceSpan span(final int start, final int end) {
        return source.spanOf(start, end);
    }

    private UnhandledErrorError signal(final DiagnosticKind kind, final String message, final int offset) {
        throw DiagnosticCondition.fatal(kind, message, source.originAt(offset));
    }

    private static String argumentText(final Token.BeginEnvironment token, final int index) {
        return argumentText(token.argument(index));
    }

    private static String argumentText(final @Nullable String argument) {
        return (argument == null) ? "" : argument.strip();
    }

    private static int parseSpan(final @Nullable String text) {
        if (text == null) {
            return 1;
        }
        try {
            return Math.max(1, Integer.parseInt(text.strip()));
        } catch (final NumberFormatException e) {
            return 1;
        }
    }

    /**
     * Returns {@code nodes} without leading whitespace in the first text node and trailing whitespace in the last.
     */
    static List<Node> trimmed(final List<Node> nodes) {
        final var result = new ArrayList<>(nodes);
        if (!result.isEmpty() && result.get(0) instanceof final Node.Text first) {
            final var stripped = first.text().stripLeading();
            if (stripped.isEmpty()) {
                result.remove(0);
            } else {
                result.set(0, new Node.Text(first.id(), first.span(), stripped));
            }
        }
        if (!result.isEmpty() && result.get(result.size() - 1) instanceof final Node.Text last) {
            final var stripped = last.text().stripTrailing();
            if (stripped.isEmpty()) {
                result.remove(result.size() - 1);
            } else {
                result.set(result.size() - 1, new Node.Text(last.id(), last.span(), stripped));
            }
        }
        return result;
    }

    /**
     * The maximum number of simultaneously open document nodes.
     */
    public static final int maxDepth = Lexer.maxDepth;

    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private final SourceText source;
    private final Lexer lexer;
    private final EnvironmentTable environments;
    private final DivisionLevel topLevel;
    private final NodeIdGenerator ids;
    private final List<Frame> frames = new ArrayList<>();
    private @Nullable Token lookahead = null;
    private boolean appendix = false;
    private boolean mainMatter = true;

    @FunctionalInterface
    private interface ArgumentSink {
        void accept(List<Node> content, int end);
    }

    /**
     * A node under construction.
     */
    // The content offsets of the braced argument of every \\name in text.
    private static List<int[]> commandArguments(final String text, final String name) {
        final var result = new ArrayList<int[]>();
        final var command = "\\" + name;
        var i = text.indexOf(command);
        while (i >= 0) {
            var position = i + command.length();
            if (position < text.length() && Character.isLetter(text.charAt(position))) {
                i = text.indexOf(command, position);
                continue;
            }
            while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
                position += 1;
            }
            if (position < text.length() && text.charAt(position) == '[') {
                final var close = text.indexOf(']', position);
                position = (close < 0) ? text.length() : close + 1;
            }
            if (position < text.length() && text.charAt(position) == '{') {
                var depth = 0;
                for (int j = position; j < text.length(); j += 1) {
                    final var ch = text.charAt(j);
                    if (ch == '\\') {
                        j += 1;
                    } else if (ch == '{') {
                        depth += 1;
                    } else if (ch == '}') {
                        depth -= 1;
                        if (depth == 0) {
                            result.add(new int[] {position + 1, j});
                            break;
                        }
                    }
                }
            }
            i = text.indexOf(command, position);
        }
        return result;
    }

    private abstract static class Frame {
        Frame(final @Nullable NodeId id, final int start) {
            this.id = id;
            this.start = start;
        }

        /**
         * Builds the finished node, or returns {@code null} if the frame delivers its content some other way.
         */
        abstract @Nullable Node build(Parser parser, int end);

        final NodeId id() {
            final var result = id;
            assert result != null : getClass().getSimpleName() + " has no node identifier";
            return result;
        }

        // Inline content arriving at a block frame opens a paragraph.
        boolean isBlock() {
            return false;
        }

        boolean isInline() {
            return false;
        }

        // Implicit frames are closed by whatever closes their container.
        boolean isImplicit() {
            return false;
        }

        boolean isNumberedTarget() {
            return false;
        }

        boolean isStructural() {
            return false;
        }

        @Nullable String environmentName() {
            return null;
        }

        String describe() {
            final var name = environmentName();
            return (name != null) ? ("\\begin{" + name + "}") : "a brace group";
        }

        final @Nullable NodeId id;
        final int start;
        final List<Node> children = new ArrayList<>();
    }

    private static final class RootFrame extends Frame {
        RootFrame(final NodeId id, final int start) {
            super(id, start);
        }

        @Override
        @Nullable Node build(final Parser parser, final int end) {
            throw new UnreachableCodeReachedError("The root frame is never popped");
        }

        @Override
        boolean isBlock() {
            return true;
        }

        @Override
        boolean isStructural() {
            return true;
        }

        @Override
        String describe() {
            return "the document body";
        }
    }

    // The root of a nested parse of an inline argument, such as a theorem title.
    private static final class InlineRootFrame extends Frame {
        InlineRootFrame(final NodeId owner, final int start) {
            super(owner, start);
        }

        @Override
        @Nullable Node build(final Parser parser, final int end) {
            throw new UnreachableCodeReachedError("The root frame is never popped");
        }

        @Override
        boolean isInline() {
            return true;
        }

        @Override
        boolean isStructural() {
            return true;
        }

        @Override
        String describe() {
            return "an argument";
        }
    }

    private static final class DivisionFrame extends Frame {
        DivisionFrame(
            final NodeId id,
            final int start,
            final DivisionLevel level,
            final boolean numbered,
            final boolean appendix,
            final List<Node> title
        ) {
            super(id, start);
            this.level = level;
            this.numbered = numbered;
            this.appendix = appendix;
            this.title = title;
        }

        @Override
        Node build(final Parser parser, final int end) {
            return new Node.Division(id(), parser.span(start, end), level, numbered, appendix, title, null, children);
        }

        @Override
        boolean isBlock() {
            return true;
        }

        @Override
        boolean isNumberedTarget() {
            return numbered;
        }

        @Override
        boolean isStructural() {
            return true;
        }

        @Override
        String describe() {
            return "\\" + level.commandName();
        }

        final DivisionLevel level;
        final boolean numbered;
        final boolean appendix;
        final List<Node> title;
    }

    private static final class ParagraphFrame extends Frame {
        ParagraphFrame(final NodeId id, final int start) {
            super(id, start);
        }

        @Override
        @Nullable Node build(final Parser parser, final int end) {
            final var content = trimmed(children);
            return content.isEmpty() ? null : new Node.Paragraph(id(), parser.span(start, end), content);
        }

        @Override
        boolean isInline() {
            return true;
        }

        @Override
        boolean isImplicit() {
            return true;
        }

        @Override
        String describe() {
            return "a paragraph";
        }
    }

    // A brace group not belonging to a command. Its content is spliced into the enclosing node.
    private static final class GroupFrame extends Frame {
        GroupFrame(final int start) {
            super(null, start);
        }

        @Override
        @Nullable Node build(final Parser parser, final int end) {
            children.forEach(parser::append);
            return null;
        }

        @Override
        boolean isInline() {
            return true;
        }
    }

    private static final class ArgumentFrame extends Frame {
        ArgumentFrame(
            final int start,
            final @Nullable NodeId labelOwner,
            final boolean ownerNumbered,
            final ArgumentSink sink
        ) {
            super(null, start);
            this.labelOwner = labelOwner;
            this.ownerNumbered = ownerNumbered;
            this.sink = sink;
        }

        @Override
        @Nullable Node build(final Parser parser, final int end) {
            sink.accept(List.copyOf(children), end);
            return null;
        }

        @Override
        boolean isInline() {
            return true;
        }

        @Override
        String describe() {
            return "a command argument";
        }

        final @Nullable NodeId labelOwner;
        final boolean ownerNumbered;
        private final ArgumentSink sink;
    }

    // A font declaration such as \bfseries, in effect until its group or paragraph ends.
    private static final class DeclarationFrame extends Frame {
        DeclarationFrame(final NodeId id, final int start, final FormattingStyle style) {
            super(id, start);
            this.style = style;
        }

        @Override
        @Nullable Node build(final Parser parser, final int end) {
            return children.isEmpty() ? null : new Node.Formatting(id(), parser.span(start, end), style, children);
        }

        @Override
        boolean isInline() {
            return true;
        }

        @Override
        boolean isImplicit() {
            return true;
        }

        @Override
        String describe() {
            return "a font declaration";
        }

        private final FormattingStyle style;
    }

    private static final class EnvironmentFrame extends Frame {
        EnvironmentFrame(
            final NodeId id,
            final int start,
            final String name,
            final EnvironmentStyle style,
            final List<Node> title
        ) {
            super(id, start);
            this.name = name;
            this.style = style;
            this.title = title;
        }

        @Override
        Node build(final Parser parser, final int end) {
            return new Node.Environment(id(), parser.span(start, end), name, style.kind(), title, null, children);
        }

        @Override
        boolean isBlock() {
            return true;
        }

        @Override
        boolean isNumberedTarget() {
            return style.isNumbered();
        }

        @Override
        boolean isStructural() {
            return true;
        }

        @Override
        String environmentName() {
            return name;
        }

        private final String name;
        private final EnvironmentStyle style;
        private final List<Node> title;
    }

    private static final class ListFrame extends Frame {
        ListFrame(final NodeId id, final int start, final String name) {
            super(id, start);
            this.name = name;
        }

        @Override
        Node build(final Parser parser, final int end) {
            return new Node.Environment(
                id(),
                parser.span(start, end),
                name,
                EnvironmentKind.LIST,
                List.of(),
                null,
                children
            );
        }

        @Override
        boolean isStructural() {
            return true;
        }

        @Override
        String environmentName() {
            return name;
        }

        private final String name;
    }

    private static final class ItemFrame extends Frame {
        ItemFrame(final NodeId id, final int start, final List<Node> label) {
            super(id, start);
            this.label = label;
        }

        @Override
        Node build(final Parser parser, final int end) {
            return new Node.ListItem(id(), parser.span(start, end), label, children);
        }

        @Override
        boolean isBlock() {
            return true;
        }

        @Override
        boolean isImplicit() {
            return true;
        }

        @Override
        boolean isStructural() {
            return true;
        }

        @Override
        String describe() {
            return "an \\item";
        }

        private final List<Node> label;
    }

    private static final class FigureFrame extends Frame {
        FigureFrame(final NodeId id, final int start, final String name) {
            super(id, start);
            this.name = name;
        }

        @Override
        Node build(final Parser parser, final int end) {
            return new Node.Figure(id(), parser.span(start, end), name, null, children);
        }

        @Override
        boolean isBlock() {
            return true;
        }

        @Override
        boolean isNumberedTarget() {
            return true;
        }

        @Override
        boolean isStructural() {
            return true;
        }

        @Override
        String environmentName() {
            return name;
        }

        private final String name;
    }

    private static final class AlgorithmFrame extends Frame {
        AlgorithmFrame(final NodeId id, final int start, final String name) {
            super(id, start);
            this.name = name;
        }

        @Override
        Node build(final Parser parser, final int end) {
            return new Node.Algorithm(id(), parser.span(start, end), name, null, children);
        }

        @Override
        boolean isBlock() {
            return true;
        }

        @Override
        boolean isNumberedTarget() {
            return true;
        }

        @Override
        boolean isStructural() {
            return true;
        }

        @Override
        String environmentName() {
            return name;
        }

        private final String name;
    }

    private static final class TableFrame extends Frame {
        TableFrame(final NodeId id, final int start, final String name) {
            super(id, start);
            this.name = name;
        }

        @Override
        Node build(final Parser parser, final int end) {
            return new Node.Table(id(), parser.span(start, end), true, null, children);
        }

        @Override
        boolean isBlock() {
            return true;
        }

        @Override
        boolean isNumberedTarget() {
            return true;
        }

        @Override
        boolean isStructural() {
            return true;
        }

        @Override
        String environmentName() {
            return name;
        }

        private final String name;
    }

    private static final class TabularFrame extends Frame {
        TabularFrame(final NodeId id, final int start, final String name, final String columnSpec) {
            super(id, start);
            this.name = name;
            this.columnSpec = columnSpec;
        }

        @Override
        Node build(final Parser parser, final int end) {
            return new Node.Tabular(id(), parser.span(start, end), name, columnSpec, children);
        }

        @Override
        boolean isStructural() {
            return true;
        }

        @Override
        String environmentName() {
            return name;
        }

        private final String name;
        private final String columnSpec;
    }

    private static final class RowFrame extends Frame {
        RowFrame(final NodeId id, final int start) {
            super(id, start);
        }

        @Override
        Node build(final Parser parser, final int end) {
            return new Node.TableRow(id(), parser.span(start, end), children);
        }

        @Override
        boolean isImplicit() {
            return true;
        }

        @Override
        String describe() {
            return "a table row";
        }
    }

    private static final class CellFrame extends Frame {
        CellFrame(final NodeId id, final int start) {
            super(id, start);
        }

        @Override
        Node build(final Parser parser, final int end) {
            return new Node.TableCell(id(), parser.span(start, end), columnSpan, trimmed(children));
        }

        @Override
        boolean isInline() {
            return true;
        }

        @Override
        boolean isImplicit() {
            return true;
        }

        @Override
        String describe() {
            return "a table cell";
        }

        private int columnSpan = 1;
    }
}
