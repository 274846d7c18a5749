// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The diagnostics channel: what can go wrong during a conversion, and the handler that collects it.
 */
@NonNullByDefault
package texweave.diagnostic;

import texweave.util.annotation.NonNullByDefault;
