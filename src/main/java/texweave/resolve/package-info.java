// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The label and reference resolver.
 */
@NonNullByDefault
package texweave.resolve;

import texweave.util.annotation.NonNullByDefault;
