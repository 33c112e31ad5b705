package io.dikernel.util;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Mutable single-value holder.
 * <p>
 * The DI layer treats {@code Ref<T>} as an indirection over {@code T}:
 * a value registered as {@code Ref<T>} may be requested as {@code T} and vice versa.
 */
public final class Ref<T> {
	@Nullable
	private T value;

	public Ref() {
	}

	public Ref(@Nullable T value) {
		this.value = value;
	}

	public static <T> Ref<T> of(@Nullable T value) {
		return new Ref<>(value);
	}

	@Nullable
	public T get() {
		return value;
	}

	public void set(@Nullable T value) {
		this.value = value;
	}

	public boolean isEmpty() {
		return value == null;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Objects.equals(value, ((Ref<?>) o).value);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(value);
	}

	@Override
	public String toString() {
		return "Ref{" + value + '}';
	}
}
