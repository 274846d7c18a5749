// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A condition and restart system: signaling code reports problems, handlers installed further up the stack decide
 * whether to continue or to unwind to a named restart point.
 */
@NonNullByDefault
package texweave.util.condition;

import texweave.util.annotation.NonNullByDefault;
