// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.util.condition;

import arbor.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A named point a handler can transfer control to. Created only by {@link ConditionContext#withRestart}.
 */
public final class Restart {
    Restart(final @NotNull String name) {
        final var context = ConditionContext.localContext();
        this.name = name;
        owner = context;
        next = context.newestRestart;
        context.newestRestart = this;
    }

    public @NotNull String name() {
        return name;
    }

    /**
     * Leaves the current frame and every frame up to the {@code withRestart} call that created this restart, which
     * then returns {@code null}. Never returns.
     */
    public void unwindTo() {
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    void unlink() {
        assert owner == ConditionContext.localContext() : "Restart unlinked by a thread other than its owner";
        assert owner.newestRestart == this : "Restarts unlinked out of order";
        owner.newestRestart = next;
    }

    final @Nullable Restart next;
    private final @NotNull String name;
    private final @NotNull ConditionContext owner;
}
