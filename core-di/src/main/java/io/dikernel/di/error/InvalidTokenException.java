package io.dikernel.di.error;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public final class InvalidTokenException extends IllegalArgumentException {
	public enum Reason {
		EMPTY,
		LEADING_DOT,
		TRAILING_DOT,
		CONSECUTIVE_DOTS,
		ALREADY_REGISTERED
	}

	@Nullable
	private final String token;
	@NotNull
	private final Reason reason;

	public InvalidTokenException(@Nullable String token, @NotNull Reason reason, String message) {
		super(message);
		this.token = token;
		this.reason = reason;
	}

	@Nullable
	public String getToken() {
		return token;
	}

	@NotNull
	public Reason getReason() {
		return reason;
	}
}
