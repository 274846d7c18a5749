// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The bibliography parser and the citation registry it produces.
 */
@NonNullByDefault
package texweave.bibliography;

import texweave.util.annotation.NonNullByDefault;
