// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.util;

import org.jetbrains.annotations.NotNull;

/**
 * Throwing checked throwables without declaring them.
 * <p>
 * Only used for {@link arbor.util.condition.Unwind}, which is checked so that it shows up in signatures, but which
 * would be pure noise in every functional interface it has to pass through.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws {@code throwable} as if it were unchecked. Never returns; the declared return type exists only so that
     * call sites can write {@code throw SneakyThrow.doThrow(t)}.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        throw SneakyThrow.<RuntimeException>rethrow(throwable);
    }

    // The cast is erased, so nothing checks it at run time.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull UnreachableCodeReachedError rethrow(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
