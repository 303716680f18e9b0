// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.cli;

import java.io.PrintStream;
import arbor.util.Trace;
import arbor.util.condition.ConditionContext;
import arbor.util.condition.HandlerProcedure;
import arbor.util.condition.Restart;
import arbor.util.condition.SignaledCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The outermost handler of the command line program: reports fatal conditions on the error stream, along with the
 * operation trace, then unwinds to the oldest restart, abandoning the whole operation. Non-fatal conditions are
 * declined.
 */
final class FallbackHandler implements HandlerProcedure {
    FallbackHandler(final PrintStream err) {
        this.err = err;
    }

    @Override
    public void handle(final SignaledCondition signaled) {
        if (!signaled.isFatal()) {
            return;
        }
        final var condition = signaled.condition();
        err.println("A fatal condition of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
        final var restart = oldestRestart();
        if (restart == null) {
            return;
        }
        err.println("Invoking restart " + restart.name());
        restart.unwindTo();
    }

    private static @Nullable Restart oldestRestart() {
        @Nullable Restart oldest = null;
        for (final var restart : ConditionContext.restarts()) {
            oldest = restart;
        }
        return oldest;
    }

    private final PrintStream err;
}
