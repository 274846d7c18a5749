// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.util.condition;

/**
 * The throwable carrying a non-local transfer of control to a {@link Restart}.
 * <p>
 * It extends {@link Throwable} directly so that neither {@code catch (Exception)} nor {@code catch (Error)} swallows
 * it. Code should only catch it to carry it across a thread boundary.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart target) {
        super("Unwinding to restart " + target.name(), null, false, false);
        this.target = target;
    }

    Restart target() {
        return target;
    }

    private final transient Restart target;
}
