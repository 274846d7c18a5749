// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.diagnostic;

import texweave.source.SourceOrigin;
import texweave.util.annotation.Nullable;
import texweave.util.condition.Condition;
import texweave.util.condition.ConditionContext;
import texweave.util.condition.UnhandledErrorError;

/**
 * A condition carrying a {@link Diagnostic}.
 * <p>
 * Fatal diagnostics are signaled with {@link ConditionContext#error(Condition)}, warnings with
 * {@link ConditionContext#signal(Condition)}, so a stage reporting a warning simply carries on.
 */
public final class DiagnosticCondition extends Condition {
    public DiagnosticCondition(final Diagnostic diagnostic) {
        super(diagnostic.message());
        this.diagnostic = diagnostic;
    }

    public Diagnostic diagnostic() {
        return diagnostic;
    }

    /**
     * Signals a warning of the given kind and returns normally unless a handler unwinds.
     */
    public static void warn(final DiagnosticKind kind, final String message, final @Nullable SourceOrigin origin) {
        assert kind.severity() == Severity.WARNING : kind + " is not a warning";
        ConditionContext.signal(new DiagnosticCondition(Diagnostic.of(kind, message, origin)));
    }

    /**
     * Signals a fatal diagnostic of the given kind. Never returns.
     */
    public static UnhandledErrorError fatal(
        final DiagnosticKind kind,
        final String message,
        final @Nullable SourceOrigin origin
    ) {
        assert kind.severity() == Severity.FATAL : kind + " is not fatal";
        throw ConditionContext.error(new DiagnosticCondition(Diagnostic.of(kind, message, origin)));
    }

    @Override
    public String detailedMessage() {
        return diagnostic.toString();
    }

    private final Diagnostic diagnostic;
}
