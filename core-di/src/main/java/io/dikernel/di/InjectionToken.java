package io.dikernel.di;

import io.dikernel.di.error.InvalidTokenException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static io.dikernel.di.error.InvalidTokenException.Reason.*;

/**
 * Dot-separated name that tells apart several bindings of the same type.
 * <p>
 * Tokens are registered once per process and never released. The token
 * also serves as the leading part of the configuration path a binding reads from.
 */
public final class InjectionToken {
	private static final Logger logger = LoggerFactory.getLogger(InjectionToken.class);

	public static final String SEPARATOR = ".";

	private static final Set<String> registered = ConcurrentHashMap.newKeySet();

	@NotNull
	private final String value;

	private InjectionToken(@NotNull String value) {
		this.value = value;
	}

	/**
	 * @throws InvalidTokenException if the token is empty, starts or ends with a dot,
	 *                               contains consecutive dots or was registered before
	 */
	@NotNull
	public static InjectionToken register(@Nullable String token) {
		if (token == null || token.isEmpty()) {
			throw new InvalidTokenException(token, EMPTY, "injection token cannot be empty");
		}
		if (token.startsWith(SEPARATOR)) {
			throw new InvalidTokenException(token, LEADING_DOT,
					"injection token " + token + " cannot start or end with a dot");
		}
		if (token.endsWith(SEPARATOR)) {
			throw new InvalidTokenException(token, TRAILING_DOT,
					"injection token " + token + " cannot start or end with a dot");
		}
		if (token.contains(SEPARATOR + SEPARATOR)) {
			throw new InvalidTokenException(token, CONSECUTIVE_DOTS,
					"injection token " + token + " cannot contain consecutive dots");
		}
		if (!registered.add(token)) {
			throw new InvalidTokenException(token, ALREADY_REGISTERED,
					"injection token " + token + " already registered");
		}
		logger.debug("Registered injection token {}", token);
		return new InjectionToken(token);
	}

	public static boolean isRegistered(String token) {
		return registered.contains(token);
	}

	@NotNull
	public String value() {
		return value;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return value.equals(((InjectionToken) o).value);
	}

	@Override
	public int hashCode() {
		return value.hashCode();
	}

	@Override
	public String toString() {
		return value;
	}
}
