// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.util.condition;

/**
 * A condition as seen by handlers.
 *
 * @param condition The condition being signaled.
 * @param isFatal   Whether it was signaled with {@link ConditionContext#error(Condition)}, in which case returning
 *                  from every handler is a programming error.
 */
public record SignaledCondition(Condition condition, boolean isFatal) {
}
