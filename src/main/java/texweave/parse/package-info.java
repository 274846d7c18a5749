// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The structural parser, turning the token stream into the document tree, and the preamble reader.
 */
@NonNullByDefault
package texweave.parse;

import texweave.util.annotation.NonNullByDefault;
