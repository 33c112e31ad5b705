package io.dikernel.di.error;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A created or configured value does not fit the requested type.
 * This is a wiring bug, so it is unchecked and not meant to be caught by client code.
 */
public final class TypeMismatchException extends ClassCastException {
	@NotNull
	private final String expectedType;
	@Nullable
	private final String actualType;

	public TypeMismatchException(@NotNull String expectedType, @Nullable Object actual) {
		super("failed to cast dependency to expected type " + expectedType + ", got " +
				(actual != null ? actual.getClass().getName() : "null"));
		this.expectedType = expectedType;
		this.actualType = actual != null ? actual.getClass().getName() : null;
	}

	@NotNull
	public String getExpectedType() {
		return expectedType;
	}

	@Nullable
	public String getActualType() {
		return actualType;
	}
}
