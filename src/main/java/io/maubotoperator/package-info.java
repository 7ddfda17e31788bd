/**
 * Maubot operator source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.maubotoperator.Main} bootstraps the CLI process, one hook or action per invocation.</li>
 *   <li>{@code io.maubotoperator.runtime.EventDispatcher} maps hook and action names to handlers.</li>
 *   <li>{@code io.maubotoperator.runtime.Reconciler} derives and applies the workload configuration.</li>
 *   <li>{@code io.maubotoperator.action.AccountActionHandler} runs the account actions against the maubot API.</li>
 * </ul>
 */
package io.maubotoperator;
