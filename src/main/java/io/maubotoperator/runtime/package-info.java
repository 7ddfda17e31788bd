/**
 * Reconciliation runtime.
 *
 * <p>{@link io.maubotoperator.runtime.EventDispatcher} maps hook and action names to handlers.
 * {@link io.maubotoperator.runtime.Reconciler} re-derives the workload configuration from the current relation
 * data on every hook and applies it to the container only when it differs from what is already there.
 */
package io.maubotoperator.runtime;
