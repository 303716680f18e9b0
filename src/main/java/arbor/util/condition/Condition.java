// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Base type of everything that can be signaled through {@link ConditionContext}.
 * <p>
 * A condition is a plain object describing an occurrence, not a throwable. Handlers see it while the signaling frame
 * is still on the stack; only a handler's decision to unwind to a {@link Restart} actually leaves that frame.
 */
public abstract class Condition {
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * Returns the one-line, user-readable summary of this condition.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * Returns the full user-readable description, which may span several lines. Defaults to {@link #message()}.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getName() + ": " + message;
    }

    private final @NotNull String message;
}
