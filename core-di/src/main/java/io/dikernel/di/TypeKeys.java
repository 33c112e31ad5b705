package io.dikernel.di;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Registry keys: {@code TypeName}, {@code token:TypeName}, and pairs {@code first;second}.
 */
public final class TypeKeys {
	public static final String TOKEN_SEPARATOR = ":";
	public static final String PAIR_SEPARATOR = ";";

	private TypeKeys() {
	}

	@NotNull
	public static String of(@NotNull Key<?> key) {
		return key.getTypeName();
	}

	@NotNull
	public static String of(@NotNull Key<?> key, @Nullable InjectionToken token) {
		return of(key.getTypeName(), token);
	}

	@NotNull
	public static String of(@NotNull String typeName, @Nullable InjectionToken token) {
		return token != null ? token.value() + TOKEN_SEPARATOR + typeName : typeName;
	}

	/**
	 * Order matters: the configuration side of a pair is keyed {@code config;instance},
	 * the instance side {@code instance;config}.
	 */
	@NotNull
	public static String pair(@NotNull String first, @NotNull String second) {
		return first + PAIR_SEPARATOR + second;
	}
}
