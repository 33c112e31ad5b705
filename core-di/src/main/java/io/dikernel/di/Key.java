package io.dikernel.di;

import io.dikernel.util.Ref;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.HashMap;
import java.util.Map;

/**
 * Type literal for lookups, e.g. {@code new Key<List<String>>() {}}.
 * <p>
 * {@code Ref<X>} and {@code X} share the same {@linkplain #getTypeName() type name},
 * so both resolve to one binding and the value is converted on the way out.
 */
public abstract class Key<T> {
	private static final Map<Class<?>, Class<?>> PRIMITIVE_WRAPPERS = new HashMap<>();

	static {
		PRIMITIVE_WRAPPERS.put(boolean.class, Boolean.class);
		PRIMITIVE_WRAPPERS.put(byte.class, Byte.class);
		PRIMITIVE_WRAPPERS.put(char.class, Character.class);
		PRIMITIVE_WRAPPERS.put(short.class, Short.class);
		PRIMITIVE_WRAPPERS.put(int.class, Integer.class);
		PRIMITIVE_WRAPPERS.put(long.class, Long.class);
		PRIMITIVE_WRAPPERS.put(float.class, Float.class);
		PRIMITIVE_WRAPPERS.put(double.class, Double.class);
	}

	@NotNull
	private final Type type;

	public Key() {
		this.type = getSuperclassTypeParameter(getClass());
	}

	private Key(@NotNull Type type) {
		this.type = type;
	}

	// so that we have one reusable non-abstract impl
	private static <T> Key<T> create(Type type) {
		return new Key<T>(type) {};
	}

	@NotNull
	public static <T> Key<T> of(@NotNull Class<T> type) {
		return create(PRIMITIVE_WRAPPERS.getOrDefault(type, type));
	}

	@NotNull
	public static <T> Key<T> ofType(@NotNull Type type) {
		return create(type instanceof Class ? PRIMITIVE_WRAPPERS.getOrDefault(type, (Class<?>) type) : type);
	}

	@NotNull
	private static Type getSuperclassTypeParameter(@NotNull Class<?> subclass) {
		Type superclass = subclass.getGenericSuperclass();
		if (superclass instanceof ParameterizedType) {
			Type type = ((ParameterizedType) superclass).getActualTypeArguments()[0];
			return type instanceof Class ? PRIMITIVE_WRAPPERS.getOrDefault(type, (Class<?>) type) : type;
		}
		throw new IllegalArgumentException("Unsupported type: " + superclass);
	}

	@NotNull
	public Type getType() {
		return type;
	}

	@SuppressWarnings("unchecked")
	@NotNull
	public Class<T> getRawType() {
		if (type instanceof Class) {
			return (Class<T>) type;
		} else if (type instanceof ParameterizedType) {
			return (Class<T>) ((ParameterizedType) type).getRawType();
		} else {
			throw new IllegalArgumentException(type.getTypeName());
		}
	}

	public Type[] getTypeParams() {
		if (type instanceof ParameterizedType) {
			return ((ParameterizedType) type).getActualTypeArguments();
		}
		return new Type[0];
	}

	public boolean isRef() {
		return getRawType() == Ref.class;
	}

	/**
	 * Key of {@code X} for a {@code Ref<X>} key, {@code null} for anything else
	 * (including a raw {@code Ref}).
	 */
	@Nullable
	public Key<?> getReferent() {
		if (!isRef()) {
			return null;
		}
		Type[] params = getTypeParams();
		return params.length == 1 ? ofType(params[0]) : null;
	}

	/**
	 * Name used to derive registry keys: the type's canonical name with one level of {@code Ref} removed.
	 */
	@NotNull
	public String getTypeName() {
		Key<?> referent = getReferent();
		return referent != null ? referent.type.getTypeName() : type.getTypeName();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Key)) return false;
		return type.equals(((Key<?>) o).type);
	}

	@Override
	public int hashCode() {
		return type.hashCode();
	}

	@Override
	public String toString() {
		return type.getTypeName();
	}
}
