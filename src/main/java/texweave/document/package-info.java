// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The document tree: immutable nodes produced by the structural parser and rewritten by later stages.
 */
@NonNullByDefault
package texweave.document;

import texweave.util.annotation.NonNullByDefault;
