// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.diagnostic;

public enum Severity {
    /**
     * Aborts the conversion; no document IR is produced.
     */
    FATAL,
    /**
     * Recorded and reported next to the document IR.
     */
    WARNING,
}
