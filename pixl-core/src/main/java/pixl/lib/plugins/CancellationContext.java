/*-
 * #%L
 * This file is part of Pixl.
 * %%
 * Copyright (C) 2026 Pixl developers
 * %%
 * Pixl is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * Pixl is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with Pixl.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package pixl.lib.plugins;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation shared between a caller and a running algorithm.
 * <p>
 * Algorithms poll {@link #isCancelled()} at fixed points and stop early when it returns true. 
 * Cancellation is never reported by throwing: operations return {@code false} or {@code null}, 
 * and in-place operations may leave their input partially modified.
 */
public class CancellationContext {
	
	private static final CancellationContext NONE = new CancellationContext(Long.MAX_VALUE) {
		@Override
		public void cancel() {
			throw new UnsupportedOperationException("The shared non-cancellable context cannot be cancelled");
		}
	};
	
	private final AtomicBoolean cancelled = new AtomicBoolean(false);
	private final long deadlineNanos;
	private final boolean hasDeadline;
	
	/**
	 * Create a new context without a deadline.
	 */
	public CancellationContext() {
		this.deadlineNanos = 0L;
		this.hasDeadline = false;
	}
	
	private CancellationContext(long deadlineNanos) {
		this.deadlineNanos = deadlineNanos;
		this.hasDeadline = deadlineNanos != Long.MAX_VALUE;
	}
	
	/**
	 * Create a context that reports cancellation once the specified time has elapsed, 
	 * or when {@link #cancel()} is called (whichever comes first).
	 * @param timeout
	 * @return
	 */
	public static CancellationContext withDeadline(Duration timeout) {
		Objects.requireNonNull(timeout, "Timeout must not be null");
		long now = System.nanoTime();
		long nanos = timeout.toNanos();
		long deadline = nanos >= Long.MAX_VALUE - now ? Long.MAX_VALUE - 1 : now + nanos;
		return new CancellationContext(deadline);
	}
	
	/**
	 * Get a shared context that is never cancelled.
	 * @return
	 */
	public static CancellationContext none() {
		return NONE;
	}
	
	/**
	 * Request cancellation.
	 */
	public void cancel() {
		cancelled.set(true);
	}
	
	/**
	 * Returns true if cancellation has been requested, or the deadline has passed.
	 * @return
	 */
	public boolean isCancelled() {
		if (cancelled.get())
			return true;
		if (hasDeadline && System.nanoTime() - deadlineNanos >= 0) {
			cancelled.set(true);
			return true;
		}
		return false;
	}

}
