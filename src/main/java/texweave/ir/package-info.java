// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The frozen document IR handed to the renderer, and its JSON form.
 */
@NonNullByDefault
package texweave.ir;

import texweave.util.annotation.NonNullByDefault;
