package io.dikernel.di.error;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public final class ConfigurationLookupException extends DIException {
	public enum Reason {
		NO_CONTEXT,
		NO_CONFIGURATION,
		EMPTY_PATH,
		NIL_IN_PATH,
		NOT_NAVIGABLE,
		FIELD_NOT_FOUND,
		NODE_NOT_FOUND,
		INVALID_TYPE
	}

	@NotNull
	private final Reason reason;
	@Nullable
	private final String path;

	public ConfigurationLookupException(@NotNull Reason reason, @Nullable String path, String message) {
		super(message);
		this.reason = reason;
		this.path = path;
	}

	public ConfigurationLookupException(@NotNull Reason reason, @Nullable String path, String message, Throwable cause) {
		super(message, cause);
		this.reason = reason;
		this.path = path;
	}

	@NotNull
	public Reason getReason() {
		return reason;
	}

	@Nullable
	public String getPath() {
		return path;
	}
}
