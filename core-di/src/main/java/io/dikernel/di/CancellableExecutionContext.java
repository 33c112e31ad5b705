package io.dikernel.di;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

public final class CancellableExecutionContext implements ExecutionContext {
	@NotNull
	private final ExecutionContext parent;
	private volatile boolean cancelled;

	CancellableExecutionContext(@NotNull ExecutionContext parent) {
		this.parent = parent;
	}

	public void cancel() {
		cancelled = true;
	}

	@Nullable
	@Override
	public Instant getDeadline() {
		return parent.getDeadline();
	}

	@Override
	public boolean isCancelled() {
		return cancelled || parent.isCancelled();
	}

	@Nullable
	@Override
	public Object getValue(@NotNull Object key) {
		return parent.getValue(key);
	}
}
