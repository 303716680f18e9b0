// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.util.condition;

import java.io.IOException;
import java.util.ArrayList;
import arbor.util.condition.exception.IOExceptionCondition;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import org.junit.jupiter.api.Test;

final class ConditionContextTest {
    @Test
    void declinedSignalReturnsNormally() throws Unwind {
        final var seen = new ArrayList<SignaledCondition>();
        final var condition = new TestCondition("note");
        try (final var handler = new Handler(seen::add)) {
            handler.use();
            ConditionContext.signal(condition);
        }
        assertThat(seen).containsExactly(new SignaledCondition(condition, false));
    }

    @Test
    void unhandledErrorIsThrown() {
        final var condition = new TestCondition("broken");
        final var thrown = catchThrowableOfType(() -> ConditionContext.error(condition), UnhandledErrorError.class);
        assertThat(thrown).isNotNull();
        assertThat(thrown.condition()).isSameAs(condition);
        assertThat(thrown).hasMessageContaining(TestCondition.class.getName() + ": broken");
    }

    @Test
    void errorDeclinedByEveryHandlerIsThrown() {
        final var seen = new ArrayList<SignaledCondition>();
        try (final var handler = new Handler(seen::add)) {
            handler.use();
            assertThatExceptionOfType(UnhandledErrorError.class)
                .isThrownBy(() -> ConditionContext.error(new TestCondition("broken")));
        }
        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).isFatal()).isTrue();
    }

    @Test
    void withRestartReturnsCallbackResult() {
        final Integer result = ConditionContext.withRestart("unused", restart -> 42);
        assertThat(result).isEqualTo(42);
    }

    @Test
    void unwindingToRestartAbandonsCallback() {
        final var reachedAfterError = new ArrayList<Boolean>();
        final var result = ConditionContext.withRestart("abort", restart -> {
            try (final var handler = new Handler(condition -> restart.unwindTo())) {
                handler.use();
                throw ConditionContext.error(new TestCondition("broken"));
            } finally {
                reachedAfterError.add(true);
            }
        });
        assertThat(result).isNull();
        assertThat(reachedAfterError).containsExactly(true);
        assertThat(ConditionContext.restarts()).isEmpty();
        assertThatExceptionOfType(UnhandledErrorError.class)
            .isThrownBy(() -> ConditionContext.error(new TestCondition("no handlers left")));
    }

    @Test
    void unwindingPassesThroughInnerRestarts() {
        final var innerResults = new ArrayList<String>();
        final var result = ConditionContext.withRestart("outer", outer -> {
            innerResults.add(ConditionContext.withRestart("inner", inner -> {
                outer.unwindTo();
                return "inner finished";
            }));
            return "outer finished";
        });
        assertThat(result).isNull();
        assertThat(innerResults).isEmpty();
    }

    @Test
    void restartsAreListedNewestFirst() {
        final var names = new ArrayList<String>();
        ConditionContext.withRestart("outer", outer ->
            ConditionContext.withRestart("inner", inner -> {
                for (final var restart : ConditionContext.restarts()) {
                    names.add(restart.name());
                }
                return null;
            })
        );
        assertThat(names).containsExactly("inner", "outer");
    }

    @Test
    void handlersRunNewestFirst() throws Unwind {
        final var order = new ArrayList<String>();
        try (final var older = new Handler(condition -> order.add("older"))) {
            older.use();
            try (final var newer = new Handler(condition -> order.add("newer"))) {
                newer.use();
                ConditionContext.signal(new TestCondition("x"));
            }
        }
        assertThat(order).containsExactly("newer", "older");
    }

    @Test
    void handlerUnwindingStopsOlderHandlers() {
        final var order = new ArrayList<String>();
        ConditionContext.withRestart("abort", restart -> {
            try (final var older = new Handler(condition -> order.add("older"))) {
                older.use();
                try (final var newer = new Handler(condition -> {
                    order.add("newer");
                    restart.unwindTo();
                })) {
                    newer.use();
                    ConditionContext.signal(new TestCondition("x"));
                    order.add("signal returned");
                }
            }
            return null;
        });
        assertThat(order).containsExactly("newer");
    }

    @Test
    void conditionSignaledFromHandlerGoesToOlderHandlersOnly() throws Unwind {
        final var seen = new ArrayList<String>();
        try (final var older = new Handler(condition -> seen.add("older: " + condition.condition().message()))) {
            older.use();
            try (final var newer = new Handler(condition -> {
                seen.add("newer: " + condition.condition().message());
                if (condition.condition().message().equals("outer")) {
                    ConditionContext.signal(new TestCondition("nested"));
                }
            })) {
                newer.use();
                ConditionContext.signal(new TestCondition("outer"));
            }
        }
        assertThat(seen).containsExactly("newer: outer", "older: nested", "older: outer");
    }

    @Test
    void exceptionConditionDescribesException() {
        final var exception = new IOException("disk on fire");
        final var condition = new IOExceptionCondition(exception);
        assertThat(condition.message()).isEqualTo("disk on fire");
        assertThat(condition.exception()).isSameAs(exception);
        assertThat(condition.detailedMessage()).startsWith("java.io.IOException: disk on fire");
        assertThat(condition).asString().isEqualTo(IOExceptionCondition.class.getName() + ": " + exception);
    }

    private static final class TestCondition extends Condition {
        private TestCondition(final String message) {
            super(message);
        }
    }
}
