// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.util.condition;

import java.util.Iterator;
import java.util.NoSuchElementException;
import arbor.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Per-thread registry of installed {@link Handler}s and established {@link Restart}s, accessed through static
 * methods acting on the calling thread's registry.
 * <p>
 * Signaling runs handlers before anything unwinds, so the code deciding how to recover sees the full context of the
 * failure, including {@link arbor.util.Trace} messages, while the code detecting the failure doesn't need to know
 * how recovery happens.
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Offers {@code condition} to the installed handlers, newest first. Returns normally if all of them decline.
     * <p>
     * Nothing in arbor itself signals non-fatal conditions, since every parse error is fatal. This is the hook for
     * callers that want to report recoverable occurrences of their own through the same handlers, which is why
     * {@link SignaledCondition#isFatal()} exists and why handlers such as the command line's fallback handler decline
     * non-fatal conditions.
     */
    public static void signal(final @NotNull Condition condition) throws Unwind {
        localContext().runHandlers(new SignaledCondition(condition, false));
    }

    /**
     * Offers {@code condition} to the installed handlers as a fatal error. Never returns: if all handlers decline,
     * {@link UnhandledErrorError} is thrown.
     * <p>
     * The declared return type lets call sites write {@code throw ConditionContext.error(...)}, which keeps the
     * compiler's flow analysis accurate.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        try {
            localContext().runHandlers(new SignaledCondition(condition, true));
        } catch (final Unwind unwind) {
            throw SneakyThrow.doThrow(unwind);
        }
        throw new UnhandledErrorError(condition);
    }

    /**
     * Calls {@code callback} with a fresh restart named {@code restartName} established around it.
     *
     * @return Whatever {@code callback} returned, or {@code null} if control was transferred to the restart.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartCallback<? extends T> callback
    ) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the calling thread's established restarts, newest first.
     */
    public static @NotNull Iterable<@NotNull Restart> restarts() {
        final var context = localContext();
        return () -> new RestartIterator(context.newestRestart);
    }

    static @NotNull ConditionContext localContext() {
        return contexts.get();
    }

    private void runHandlers(final @NotNull SignaledCondition condition) throws Unwind {
        // A condition signaled from inside a handler only goes to handlers older than that one.
        final var saved = runningHandler;
        var handler = (saved == null) ? newestHandler : saved.next;
        try {
            for (; handler != null; handler = handler.next) {
                runningHandler = handler;
                handler.handle(condition);
            }
        } finally {
            runningHandler = saved;
        }
    }

    @Nullable Handler newestHandler = null;
    @Nullable Restart newestRestart = null;
    private @Nullable Handler runningHandler = null;

    private static final ThreadLocal<@NotNull ConditionContext> contexts =
        ThreadLocal.withInitial(ConditionContext::new);

    /**
     * The body run by {@link #withRestart(String, RestartCallback)}.
     */
    @FunctionalInterface
    public interface RestartCallback<T> {
        T call(@NotNull Restart restart) throws Unwind;
    }

    private static final class RestartIterator implements Iterator<@NotNull Restart> {
        private RestartIterator(final @Nullable Restart newest) {
            current = newest;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public @NotNull Restart next() {
            final var restart = current;
            if (restart == null) {
                throw new NoSuchElementException("No more restarts");
            }
            current = restart.next;
            return restart;
        }

        private @Nullable Restart current;
    }
}
