// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The source loader: expands file inclusion commands into one flattened text while remembering where every character
 * came from.
 */
@NonNullByDefault
package texweave.source;

import texweave.util.annotation.NonNullByDefault;
