// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Diagram rendering, the one best-effort stage: a diagram that cannot be rendered keeps its raw source.
 */
@NonNullByDefault
package texweave.diagram;

import texweave.util.annotation.NonNullByDefault;
