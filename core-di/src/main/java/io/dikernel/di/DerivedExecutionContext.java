package io.dikernel.di;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

final class DerivedExecutionContext implements ExecutionContext {
	static final ExecutionContext BACKGROUND = new DerivedExecutionContext(null, null, null, null);

	@Nullable
	private final ExecutionContext parent;
	@Nullable
	private final Object key;
	@Nullable
	private final Object value;
	@Nullable
	private final Instant deadline;

	DerivedExecutionContext(@Nullable ExecutionContext parent, @Nullable Object key, @Nullable Object value, @Nullable Instant deadline) {
		this.parent = parent;
		this.key = key;
		this.value = value;
		this.deadline = deadline;
	}

	@Nullable
	@Override
	public Instant getDeadline() {
		Instant parentDeadline = parent != null ? parent.getDeadline() : null;
		if (deadline == null) return parentDeadline;
		if (parentDeadline == null) return deadline;
		return deadline.isBefore(parentDeadline) ? deadline : parentDeadline;
	}

	@Override
	public boolean isCancelled() {
		return parent != null && parent.isCancelled();
	}

	@Nullable
	@Override
	public Object getValue(@NotNull Object key) {
		if (key.equals(this.key)) {
			return value;
		}
		return parent != null ? parent.getValue(key) : null;
	}

	@Override
	public String toString() {
		return parent == null && key == null && deadline == null ? "background" : "ExecutionContext{key=" + key + ", deadline=" + deadline + '}';
	}
}
