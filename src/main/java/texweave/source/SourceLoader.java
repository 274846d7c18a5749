// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import texweave.diagnostic.DiagnosticCondition;
import texweave.diagnostic.DiagnosticKind;
import texweave.lexer.VerbatimEnvironments;
import texweave.util.Trace;
import texweave.util.annotation.Nullable;
import texweave.util.condition.UnhandledErrorError;

/**
 * The source loader: the primary means of turning a root {@code .tex} file into a flattened {@link SourceText}.
 * <p>
 * The inclusion commands {@code \input{f}}, {@code \include{f}}, {@code \import{dir}{f}} and
 * {@code \subimport{dir}{f}} are replaced by the contents of the named file, recursively. A name is looked up relative
 * to the including file (joined with {@code dir} for the import commands), then relative to the project root, then
 * relative to every search path entry, each time as given and with {@code .tex} appended.
 * <p>
 * Commands inside comments and inside verbatim-class environments are left alone. The same file may be included
 * several times, but never by itself, directly or indirectly.
 * <p>
 * On error:
 * <ul>
 * <li>a fatal {@code CyclicInclude} diagnostic naming the whole inclusion chain is signaled for a cycle;
 * <li>a fatal {@code NestingTooDeep} diagnostic is signaled when inclusions nest too deep;
 * <li>a fatal {@code UnreadableSource} diagnostic is signaled when a file exists but cannot be read;
 * <li>a {@code MissingSource} warning is signaled for an inclusion or bibliography that cannot be found, and the
 * command is dropped.
 * </ul>
 */
public final class SourceLoader {
    private SourceLoader(final SourceReader reader, final Path rootDirectory, final List<Path> searchPath) {
        this.reader = reader;
        this.rootDirectory = rootDirectory;
        this.searchPath = searchPath.stream().map(rootDirectory::resolve).map(Path::normalize).toList();
        builder = new SourceText.Builder(rootDirectory);
    }

    /**
     * Loads the project whose main file is {@code rootFile}.
     */
    public static SourceText load(final SourceReader reader, final Path rootFile, final List<Path> searchPath) {
        return load(reader, rootFile, searchPath, List.of());
    }

    /**
     * Loads the project whose main file is {@code rootFile}, also reading the bibliography databases named in
     * {@code extraBibliographies} as if the document named them with {@code \addbibresource}.
     */
    public static SourceText load(
        final SourceReader reader,
        final Path rootFile,
        final List<Path> searchPath,
        final List<String> extraBibliographies
    ) {
        final var absoluteRoot = rootFile.toAbsolutePath().normalize();
        final var parent = absoluteRoot.getParent();
        final var loader = new SourceLoader(reader, (parent == null) ? absoluteRoot : parent, searchPath);
        try (final var trace = new Trace(() -> "Loading the project rooted at " + rootFile)) {
            trace.use();
            return loader.loadImpl(absoluteRoot, extraBibliographies);
        }
    }

    private SourceText loadImpl(final Path rootPath, final List<String> extraBibliographies) {
        if (!reader.isFile(rootPath)) {
            throw DiagnosticCondition.fatal(
                DiagnosticKind.UNREADABLE_SOURCE,
                "The main file " + rootPath + " does not exist or is not readable",
                null
            );
        }
        final var rootFile = readFile(rootPath, null);
        expand(rootFile);
        for (final var name : extraBibliographies) {
            addBibliography(name, rootDirectory, null);
        }
        final var text = builder.build(
            rootFile,
            new ArrayList<>(filesByPath.values()),
            new ArrayList<>(bibliographiesByPath.values())
        );
        logger.info(
            "Loaded {} source file(s), {} characters, {} bibliography file(s)",
            filesByPath.size(),
            text.length(),
            bibliographiesByPath.size()
        );
        return text;
    }

    private void expand(final SourceFile file) {
        includeStack.add(file.path());
        try (final var trace = new Trace(() -> "Expanding inclusions in " + file.displayName())) {
            trace.use();
            expandImpl(file);
        } finally {
            includeStack.remove(includeStack.size() - 1);
        }
    }

    private void expandImpl(final SourceFile file) {
        final var text = file.text();
        final var length = text.length();
        final var directory = parentOf(file.path());
        var copiedUpTo = 0;
        var copyEnd = length;
        var i = 0;
        while (i < length) {
            final var ch = text.charAt(i);
            if (ch == '%') {
                final var commentStart = i;
                i = endOfLine(text, i);
                if (i == length) {
                    // A comment on the unterminated last line would swallow whatever follows the inclusion.
                    copyEnd = commentStart;
                }
                continue;
            }
            if (ch != '\\' || i + 1 >= length) {
                i += 1;
                continue;
            }
            if (!isLetter(text.charAt(i + 1))) {
                // Escaped character, \% in particular.
                i += 2;
                continue;
            }
            final var nameEnd = endOfCommandName(text, i + 1);
            final var commandStart = i;
            switch (text.substring(i + 1, nameEnd)) {
                case "begin" -> i = skipVerbatimEnvironment(text, nameEnd);
                case "verb" -> i = skipInlineVerbatim(text, nameEnd);
                case "input", "include" -> {
                    final var arguments = readArguments(text, nameEnd, 1);
                    if (arguments == null) {
                        i = nameEnd;
                    } else {
                        builder.append(file, copiedUpTo, commandStart);
                        include(file, commandStart, directory, arguments.get(0));
                        copiedUpTo = arguments.end();
                        i = arguments.end();
                    }
                }
                case "import", "subimport" -> {
                    final var arguments = readArguments(text, nameEnd, 2);
                    if (arguments == null) {
                        i = nameEnd;
                    } else {
                        builder.append(file, copiedUpTo, commandStart);
                        final var subdirectory = arguments.get(0);
                        final var base = subdirectory.isEmpty() ? directory : directory.resolve(subdirectory);
                        include(file, commandStart, base, arguments.get(1));
                        copiedUpTo = arguments.end();
                        i = arguments.end();
                    }
                }
                case "bibliography" -> {
                    final var arguments = readArguments(text, nameEnd, 1);
                    i = (arguments == null) ? nameEnd : arguments.end();
                    if (arguments != null) {
                        for (final var name : arguments.get(0).split(",")) {
                            if (!name.isBlank()) {
                                addBibliography(name.strip(), directory, file.originAt(commandStart));
                            }
                        }
                    }
                }
                case "addbibresource" -> {
                    final var arguments = readArguments(text, skipOptionalArgument(text, nameEnd), 1);
                    i = (arguments == null) ? nameEnd : arguments.end();
                    if (arguments != null) {
                        addBibliography(arguments.get(0), directory, file.originAt(commandStart));
                    }
                }
                default -> i = nameEnd;
            }
        }
        builder.append(file, copiedUpTo, copyEnd);
    }

    private void include(
        final SourceFile includingFile,
        final int commandOffset,
        final Path baseDirectory,
        final String name
    ) {
        final var origin = includingFile.originAt(commandOffset);
        final var path = resolve(name, baseDirectory, ".tex");
        if (path == null) {
            DiagnosticCondition.warn(
                DiagnosticKind.MISSING_SOURCE,
                "Included file '" + name + "' not found, the inclusion is ignored",
                origin
            );
            return;
        }
        if (includeStack.contains(path)) {
            throw signalCycle(path, origin);
        }
        if (includeStack.size() >= maxIncludeDepth) {
            throw DiagnosticCondition.fatal(
                DiagnosticKind.NESTING_TOO_DEEP,
                "Inclusions nested more than " + maxIncludeDepth + " levels deep at '" + name + "'",
                origin
            );
        }
        expand(readFile(path, origin));
    }

    private void addBibliography(final String name, final Path baseDirectory, final @Nullable SourceOrigin origin) {
        final var path = resolve(name, baseDirectory, ".bib");
        if (path == null) {
            DiagnosticCondition.warn(
                DiagnosticKind.MISSING_SOURCE,
                "Bibliography database '" + name + "' not found",
                origin
            );
            return;
        }
        if (!bibliographiesByPath.containsKey(path)) {
            bibliographiesByPath.put(path, readText(path, origin));
        }
    }

    private SourceFile readFile(final Path path, final @Nullable SourceOrigin origin) {
        final var cached = filesByPath.get(path);
        if (cached != null) {
            return cached;
        }
        final var file = readText(path, origin);
        filesByPath.put(path, file);
        logger.debug("Read {}", file.displayName());
        return file;
    }

    private SourceFile readText(final Path path, final @Nullable SourceOrigin origin) {
        try {
            return new SourceFile(path, displayNameOf(path), reader.read(path));
        } catch (final IOException e) {
            throw DiagnosticCondition.fatal(
                DiagnosticKind.UNREADABLE_SOURCE,
                "Cannot read " + displayNameOf(path) + ": " + e.getMessage(),
                origin
            );
        }
    }

    private @Nullable Path resolve(final String name, final Path baseDirectory, final String extension) {
        final var bases = new LinkedHashSet<Path>();
        bases.add(baseDirectory);
        bases.add(rootDirectory);
        bases.addAll(searchPath);
        for (final var base : bases) {
            final var candidate = base.resolve(name).normalize();
            if (reader.isFile(candidate)) {
                return candidate;
            }
            if (!name.endsWith(extension)) {
                final var withExtension = base.resolve(name + extension).normalize();
                if (reader.isFile(withExtension)) {
                    return withExtension;
                }
            }
        }
        return null;
    }

    private UnhandledErrorError signalCycle(final Path path, final SourceOrigin origin) {
        final var chain = includeStack.subList(includeStack.indexOf(path), includeStack.size())
            .stream()
            .map(this::displayNameOf)
            .collect(Collectors.joining(" -> "));
        throw DiagnosticCondition.fatal(
            DiagnosticKind.CYCLIC_INCLUDE,
            "Cyclic inclusion: " + chain + " -> " + displayNameOf(path),
            origin
        );
    }

    private String displayNameOf(final Path path) {
        final var name = path.startsWith(rootDirectory) ? rootDirectory.relativize(path).toString() : path.toString();
        return name.replace('\\', '/');
    }

    private static Path parentOf(final Path path) {
        final var parent = path.getParent();
        return (parent == null) ? path : parent;
    }

    private static int skipVerbatimEnvironment(final String text, final int afterBegin) {
        final var arguments = readArguments(text, afterBegin, 1);
        if (arguments == null) {
            return afterBegin;
        }
        final var name = arguments.get(0);
        if (!VerbatimEnvironments.isVerbatim(name)) {
            return arguments.end();
        }
        final var terminator = "\\end{" + name + "}";
        final var end = text.indexOf(terminator, arguments.end());
        return (end < 0) ? text.length() : (end + terminator.length());
    }

    private static int skipInlineVerbatim(final String text, final int afterVerb) {
        var i = afterVerb;
        if (i < text.length() && text.charAt(i) == '*') {
            i += 1;
        }
        if (i >= text.length()) {
            return i;
        }
        final var delimiter = text.charAt(i);
        final var end = text.indexOf(delimiter, i + 1);
        final var lineEnd = endOfLine(text, i);
        return (end < 0 || end > lineEnd) ? lineEnd : (end + 1);
    }

    private static int skipOptionalArgument(final String text, final int from) {
        final var i = skipSpaces(text, from);
        if (i < text.length() && text.charAt(i) == '[') {
            final var close = text.indexOf(']', i);
            return (close < 0) ? from : (close + 1);
        }
        return from;
    }

    private static @Nullable Arguments readArguments(final String text, final int from, final int count) {
        final var values = new ArrayList<String>(count);
        var i = from;
        for (int n = 0; n < count; n += 1) {
            i = skipSpaces(text, i);
            if (i >= text.length() || text.charAt(i) != '{') {
                return null;
            }
            var depth = 1;
            var j = i + 1;
            while (j < text.length() && depth > 0) {
                final var ch = text.charAt(j);
                if (ch == '{') {
                    depth += 1;
                } else if (ch == '}') {
                    depth -= 1;
                } else if (ch == '\n' && j + 1 < text.length() && text.charAt(j + 1) == '\n') {
                    // A file name never spans a paragraph break.
                    return null;
                }
                j += 1;
            }
            if (depth != 0) {
                return null;
            }
            values.add(text.substring(i + 1, j - 1).strip());
            i = j;
        }
        return new Arguments(values, i);
    }

    private static int skipSpaces(final String text, final int from) {
        var i = from;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i += 1;
        }
        return i;
    }

    private static int endOfLine(final String text, final int from) {
        final var newline = text.indexOf('\n', from);
        return (newline < 0) ? text.length() : newline;
    }

    private static int endOfCommandName(final String text, final int from) {
        var i = from;
        while (i < text.length() && isLetter(text.charAt(i))) {
            i += 1;
        }
        return i;
    }

    private static boolean isLetter(final char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }

    private static final Logger logger = LoggerFactory.getLogger(SourceLoader.class);
    private static final int maxIncludeDepth = 32;

    private final SourceReader reader;
    private final Path rootDirectory;
    private final List<Path> searchPath;
    private final SourceText.Builder builder;
    private final List<Path> includeStack = new ArrayList<>();
    private final Map<Path, SourceFile> filesByPath = new LinkedHashMap<>();
    private final Map<Path, SourceFile> bibliographiesByPath = new LinkedHashMap<>();

    private record Arguments(List<String> values, int end) {
        String get(final int index) {
            return values.get(index);
        }
    }
}
