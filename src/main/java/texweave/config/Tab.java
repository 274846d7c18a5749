// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.config;

/**
 * A navigation tab of the rendered document.
 */
public record Tab(String id, String label) {
}
