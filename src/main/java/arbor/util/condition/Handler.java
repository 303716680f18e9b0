// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.util.condition;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An installed condition handler, active from construction until {@link #close()}; meant for try-with-resources.
 * <p>
 * Handlers are consulted newest first.
 */
public final class Handler implements AutoCloseable {
    public Handler(final @NotNull HandlerProcedure procedure) {
        final var context = ConditionContext.localContext();
        this.procedure = procedure;
        owner = context;
        next = context.newestHandler;
        context.newestHandler = this;
    }

    /**
     * Does nothing; referencing the resource silences "unused resource" warnings.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert owner == ConditionContext.localContext() : "Handler closed by a thread other than its owner";
        assert owner.newestHandler == this : "Handlers closed out of order";
        owner.newestHandler = next;
    }

    void handle(final @NotNull SignaledCondition condition) throws Unwind {
        procedure.handle(condition);
    }

    final @Nullable Handler next;
    private final @NotNull HandlerProcedure procedure;
    private final @NotNull ConditionContext owner;
}
