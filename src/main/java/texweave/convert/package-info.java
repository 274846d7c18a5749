// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The conversion pipeline, from a main file to a document IR.
 */
@NonNullByDefault
package texweave.convert;

import texweave.util.annotation.NonNullByDefault;
