package io.dikernel.di.config;

import com.google.gson.annotations.SerializedName;
import io.dikernel.di.InjectionToken;
import io.dikernel.di.error.ConfigurationLookupException;
import io.dikernel.util.Ref;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.util.Collection;
import java.util.Map;
import java.util.regex.Pattern;

import static io.dikernel.di.error.ConfigurationLookupException.Reason.*;

/**
 * Reflective dot-path navigation over configuration objects.
 * <p>
 * Every segment but the last must lead to a map or a plain object; {@link Ref}s on the way are
 * dereferenced. Object segments match a field name first, then a {@code @SerializedName} value
 * or alternate. The last node is returned as is.
 */
public final class ConfigurationNodes {
	private static final Pattern SEPARATOR = Pattern.compile(Pattern.quote(InjectionToken.SEPARATOR));

	private ConfigurationNodes() {
	}

	@Nullable
	public static Object lookup(@Nullable Object root, @NotNull String path) throws ConfigurationLookupException {
		if (path.isEmpty()) {
			return root;
		}

		Object current = root;
		for (String segment : SEPARATOR.split(path, -1)) {
			if (current instanceof Ref) {
				current = ((Ref<?>) current).get();
			}
			if (current == null) {
				throw new ConfigurationLookupException(NIL_IN_PATH, path,
						"null encountered in path '" + path + "' before '" + segment + "'");
			}
			current = child(current, segment, path);
		}
		return current;
	}

	@Nullable
	private static Object child(@NotNull Object node, @NotNull String segment, @NotNull String path) throws ConfigurationLookupException {
		if (node instanceof Map) {
			Map<?, ?> map = (Map<?, ?>) node;
			if (!map.containsKey(segment)) {
				throw new ConfigurationLookupException(FIELD_NOT_FOUND, path,
						"field '" + segment + "' not found in path '" + path + "'");
			}
			return map.get(segment);
		}

		if (!isNavigable(node)) {
			throw new ConfigurationLookupException(NOT_NAVIGABLE, path,
					"cannot access field '" + segment + "' on " + node.getClass().getName());
		}

		Field field = findField(node.getClass(), segment);
		if (field == null) {
			throw new ConfigurationLookupException(FIELD_NOT_FOUND, path,
					"field '" + segment + "' not found in " + node.getClass().getName());
		}

		try {
			field.setAccessible(true);
			return field.get(node);
		} catch (IllegalAccessException | InaccessibleObjectException e) {
			throw new ConfigurationLookupException(NOT_NAVIGABLE, path,
					"cannot access field '" + segment + "' on " + node.getClass().getName(), e);
		}
	}

	private static boolean isNavigable(Object node) {
		Class<?> cls = node.getClass();
		return !(cls.isArray() ||
				node instanceof CharSequence ||
				node instanceof Number ||
				node instanceof Boolean ||
				node instanceof Character ||
				node instanceof Enum ||
				node instanceof Collection ||
				cls.getName().startsWith("java."));
	}

	@Nullable
	private static Field findField(Class<?> cls, String name) {
		for (Class<?> c = cls; c != null && c != Object.class; c = c.getSuperclass()) {
			for (Field field : c.getDeclaredFields()) {
				if (isInstanceField(field) && field.getName().equals(name)) {
					return field;
				}
			}
		}
		for (Class<?> c = cls; c != null && c != Object.class; c = c.getSuperclass()) {
			for (Field field : c.getDeclaredFields()) {
				if (isInstanceField(field) && matchesSerializedName(field, name)) {
					return field;
				}
			}
		}
		return null;
	}

	private static boolean isInstanceField(Field field) {
		return !Modifier.isStatic(field.getModifiers()) && !field.isSynthetic();
	}

	private static boolean matchesSerializedName(Field field, String name) {
		SerializedName serializedName = field.getAnnotation(SerializedName.class);
		if (serializedName == null) {
			return false;
		}
		if (serializedName.value().equals(name)) {
			return true;
		}
		for (String alternate : serializedName.alternate()) {
			if (alternate.equals(name)) {
				return true;
			}
		}
		return false;
	}
}
