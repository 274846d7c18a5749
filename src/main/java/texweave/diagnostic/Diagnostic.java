// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.diagnostic;

import java.util.Comparator;
import java.util.Locale;
import texweave.source.SourceOrigin;
import texweave.util.annotation.Nullable;

/**
 * A single diagnostic record.
 *
 * @param severity Whether the diagnostic aborted the conversion.
 * @param kind     What went wrong.
 * @param message  A user-readable description naming the offending construct.
 * @param origin   Where in the original sources the problem is, if that is known.
 */
public record Diagnostic(Severity severity, DiagnosticKind kind, String message, @Nullable SourceOrigin origin) {
    /**
     * Creates a diagnostic with the default severity of {@code kind}.
     */
    public static Diagnostic of(final DiagnosticKind kind, final String message, final @Nullable SourceOrigin origin) {
        return new Diagnostic(kind.severity(), kind, message, origin);
    }

    public boolean isFatal() {
        return severity == Severity.FATAL;
    }

    /**
     * Returns the ordering used when reporting diagnostics: pipeline phase, then source position, then kind and
     * message. Diagnostics without an origin sort after those with one.
     */
    public static Comparator<Diagnostic> reportingOrder() {
        return reportingOrder;
    }

    @Override
    public String toString() {
        final var prefix = (origin == null) ? "" : (origin + ": ");
        return prefix + severity.name().toLowerCase(Locale.ROOT) + ": " + kind.displayName() + ": " + message;
    }

    private static final Comparator<Diagnostic> reportingOrder = Comparator
        .comparing((Diagnostic diagnostic) -> diagnostic.kind().phase())
        .thenComparing(Diagnostic::origin, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(Diagnostic::kind)
        .thenComparing(Diagnostic::message);
}
