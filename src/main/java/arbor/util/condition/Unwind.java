// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The throwable carrying control from {@link Restart#unwindTo()} to the restart's {@code withRestart} frame.
 * <p>
 * Not an {@link Exception}, so that {@code catch (Exception e)} blocks don't intercept it, and not an {@link Error},
 * since nothing went wrong. Public only so that methods can declare it; don't catch it.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to restart " + target.name(), null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    // Unwinds are never serialized; transient keeps static analysis quiet about the non-serializable field.
    private final transient @NotNull Restart target;
}
