// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.diagnostic;

/**
 * Every problem the converter knows how to report.
 * <p>
 * Structural and referential problems are fatal because the document tree or its links cannot be trusted afterwards.
 * Everything else degrades a single node or entry and is reported as a warning.
 */
public enum DiagnosticKind {
    CYCLIC_INCLUDE("CyclicInclude", Severity.FATAL, Phase.LOADING),
    UNREADABLE_SOURCE("UnreadableSource", Severity.FATAL, Phase.LOADING),
    MISSING_SOURCE("MissingSource", Severity.WARNING, Phase.LOADING),
    UNMATCHED_BRACE("UnmatchedBrace", Severity.FATAL, Phase.PARSING),
    UNMATCHED_ENVIRONMENT("UnmatchedEnvironment", Severity.FATAL, Phase.PARSING),
    UNTERMINATED_MATH("UnterminatedMath", Severity.FATAL, Phase.PARSING),
    UNEXPECTED_SECTIONING_AT_DEPTH("UnexpectedSectioningAtDepth", Severity.FATAL, Phase.PARSING),
    NESTING_TOO_DEEP("NestingTooDeep", Severity.FATAL, Phase.PARSING),
    UNMATCHED_BIBLIOGRAPHY_BRACE("UnmatchedBrace", Severity.FATAL, Phase.BIBLIOGRAPHY),
    DUPLICATE_CITATION_KEY("DuplicateCitationKey", Severity.WARNING, Phase.BIBLIOGRAPHY),
    MALFORMED_BIBLIOGRAPHY_ENTRY("MalformedBibliographyEntry", Severity.WARNING, Phase.BIBLIOGRAPHY),
    DUPLICATE_LABEL("DuplicateLabel", Severity.FATAL, Phase.RESOLUTION),
    UNRESOLVED_REFERENCE("UnresolvedReference", Severity.WARNING, Phase.RESOLUTION),
    DIAGRAM_NOT_RENDERED("DiagramNotRendered", Severity.WARNING, Phase.RENDERING);

    DiagnosticKind(final String displayName, final Severity severity, final Phase phase) {
        this.displayName = displayName;
        this.severity = severity;
        this.phase = phase;
    }

    /**
     * Returns the name shown to users and written to the IR, for example {@code "UnresolvedReference"}.
     */
    public String displayName() {
        return displayName;
    }

    public Severity severity() {
        return severity;
    }

    public Phase phase() {
        return phase;
    }

    private final String displayName;
    private final Severity severity;
    private final Phase phase;
}
