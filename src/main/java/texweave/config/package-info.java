// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Conversion configuration: metadata overrides, navigation tabs, the environment table, counter rules and the
 * math-macro table.
 */
@NonNullByDefault
package texweave.config;

import texweave.util.annotation.NonNullByDefault;
