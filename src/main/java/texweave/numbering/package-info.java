// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The numbering engine: assigns numbers to divisions, numbered environments, equations, floats, listings and
 * footnotes.
 */
@NonNullByDefault
package texweave.numbering;

import texweave.util.annotation.NonNullByDefault;
