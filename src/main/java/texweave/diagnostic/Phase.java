// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.diagnostic;

/**
 * The pipeline stage a diagnostic originates from, in pipeline order. Used to order reported diagnostics.
 */
public enum Phase {
    LOADING,
    PARSING,
    BIBLIOGRAPHY,
    NUMBERING,
    RESOLUTION,
    RENDERING,
}
