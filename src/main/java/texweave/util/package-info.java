// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small general-purpose utilities shared by every stage of the conversion pipeline.
 */
@NonNullByDefault
package texweave.util;

import texweave.util.annotation.NonNullByDefault;
