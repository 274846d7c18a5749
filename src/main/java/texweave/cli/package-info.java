// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Implementation of the command line interface of the program.
 */
@NonNullByDefault
package texweave.cli;

import texweave.util.annotation.NonNullByDefault;
