// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The lexer, splitting expanded source text into commands, groups, math and text with their origins.
 */
@NonNullByDefault
package texweave.lexer;

import texweave.util.annotation.NonNullByDefault;
