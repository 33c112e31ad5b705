package io.dikernel.di;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * Carries cancellation, an optional deadline and request-scoped values along a chain of calls.
 * Derived contexts see the cancellation and deadline of their parent.
 */
public interface ExecutionContext {
	@Nullable
	Instant getDeadline();

	boolean isCancelled();

	@Nullable
	Object getValue(@NotNull Object key);

	/**
	 * Cancelled, or past the deadline.
	 */
	default boolean isDone() {
		if (isCancelled()) {
			return true;
		}
		Instant deadline = getDeadline();
		return deadline != null && !Instant.now().isBefore(deadline);
	}

	@NotNull
	static ExecutionContext background() {
		return DerivedExecutionContext.BACKGROUND;
	}

	@NotNull
	static ExecutionContext withValue(@NotNull ExecutionContext parent, @NotNull Object key, @Nullable Object value) {
		return new DerivedExecutionContext(parent, key, value, null);
	}

	/**
	 * The effective deadline is the earlier of {@code deadline} and the parent's.
	 */
	@NotNull
	static ExecutionContext withDeadline(@NotNull ExecutionContext parent, @NotNull Instant deadline) {
		return new DerivedExecutionContext(parent, null, null, deadline);
	}

	@NotNull
	static CancellableExecutionContext withCancellation(@NotNull ExecutionContext parent) {
		return new CancellableExecutionContext(parent);
	}
}
