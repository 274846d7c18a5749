// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.convert;

import java.util.List;
import texweave.diagnostic.Diagnostic;
import texweave.ir.DocumentIr;

/**
 * The outcome of a conversion: either a document IR with its warnings, or the diagnostics that prevented one.
 */
public sealed interface ConversionResult {
    /**
     * Returns every diagnostic of the conversion, in reporting order.
     */
    List<Diagnostic> diagnostics();

    /**
     * The conversion completed. Warnings, if any, are carried by the IR.
     */
    record Success(DocumentIr ir) implements ConversionResult {
        @Override
        public List<Diagnostic> diagnostics() {
            return ir.warnings();
        }
    }

    /**
     * A fatal diagnostic aborted the conversion; no IR exists.
     *
     * @param diagnostics Every diagnostic signaled before the abort, the fatal one included.
     */
    record Failure(List<Diagnostic> diagnostics) implements ConversionResult {
        public Failure {
            diagnostics = List.copyOf(diagnostics);
        }

        public List<Diagnostic> fatalDiagnostics() {
            return diagnostics.stream().filter(Diagnostic::isFatal).toList();
        }
    }
}
