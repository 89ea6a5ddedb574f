package com.questrail.socket.context;

/**
 * Cancellable
 * =============================================================================
 * Minimal handle for undoing a registration or a scheduled action.
 *
 * <p>Returned by {@link ExecutionContext#onCancel(Runnable)} so a caller that no
 * longer cares about cancellation (a connection that closed on its own, a
 * child context that finished) can detach its listener instead of keeping it
 * alive until the parent is cancelled.</p>
 */
@FunctionalInterface
public interface Cancellable
{
    /**
     * Attempt to cancel.
     *
     * @return {@code true} if the action was withdrawn; {@code false} if it had
     *         already run or was cancelled before
     */
    boolean cancel();
}
