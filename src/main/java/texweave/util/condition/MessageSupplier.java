// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.util.condition;

/**
 * A lazily computed user-readable message.
 */
@FunctionalInterface
public interface MessageSupplier {
    String get();
}
