// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * What a {@link HandlerProcedure} receives: the condition itself, and whether it was signaled as an error.
 *
 * @param condition The condition being signaled.
 * @param isFatal   {@code true} iff signaled through {@link ConditionContext#error(Condition)}, meaning the signaling
 *                  code cannot continue if every handler declines.
 */
public record SignaledCondition(@NotNull Condition condition, boolean isFatal) {
}
