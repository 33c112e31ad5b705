package io.dikernel.di;

import io.dikernel.di.error.TypeMismatchException;
import io.dikernel.util.Ref;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Narrows created values to the requested type, converting between {@code X} and {@code Ref<X>}.
 * No other conversion is attempted.
 */
public final class Coercions {
	private Coercions() {
	}

	/**
	 * @throws TypeMismatchException if {@code value} is {@code null} or fits neither {@code key} nor its {@code Ref} counterpart
	 */
	@NotNull
	public static <T> T coerce(@Nullable Object value, @NotNull Key<T> key) {
		T result = tryCoerce(value, key);
		if (result == null) {
			throw new TypeMismatchException(key.getType().getTypeName(), value);
		}
		return result;
	}

	/**
	 * Same as {@link #coerce}, returning {@code null} instead of throwing.
	 */
	@SuppressWarnings("unchecked")
	@Nullable
	public static <T> T tryCoerce(@Nullable Object value, @NotNull Key<T> key) {
		if (value == null) {
			return null;
		}
		Class<T> rawType = key.getRawType();
		Key<?> referent = key.getReferent();

		if (rawType.isInstance(value)) {
			if (referent != null) {
				Object inner = ((Ref<?>) value).get();
				if (inner != null && !referent.getRawType().isInstance(inner)) {
					return null;
				}
			}
			return (T) value;
		}

		// X requested as Ref<X>
		if (referent != null && referent.getRawType().isInstance(value)) {
			return (T) Ref.of(value);
		}

		// Ref<X> requested as X
		if (value instanceof Ref) {
			Object inner = ((Ref<?>) value).get();
			if (rawType.isInstance(inner)) {
				return (T) inner;
			}
		}
		return null;
	}
}
