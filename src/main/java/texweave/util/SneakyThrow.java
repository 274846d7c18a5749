// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.util;

/**
 * Escape hatch from checked exception declarations.
 * <p>
 * Only meant for throwables that every method could throw anyway, mainly {@link InterruptedException} and
 * {@link texweave.util.condition.Unwind}.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws {@code throwable} without the compiler requiring it to be declared.
     * <p>
     * Never returns; the declared return type exists so call sites can write {@code throw SneakyThrow.doThrow(e)}.
     */
    public static UnreachableCodeReachedError doThrow(final Throwable throwable) {
        throw SneakyThrow.<RuntimeException>doThrowImpl(throwable);
    }

    /**
     * Declares {@code E} as thrown without doing anything, so that a sneakily thrown {@code E} can be caught.
     */
    @SuppressWarnings({"RedundantThrows", "EmptyMethod"})
    public static <E extends Throwable> void pretendThrows() throws E {
    }

    // E erases to Throwable, so the cast is a no-op at runtime.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> UnreachableCodeReachedError doThrowImpl(final Throwable throwable) throws E {
        throw (E) throwable;
    }
}
