package io.dikernel.di.error;

import io.dikernel.di.InjectionToken;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static java.util.Collections.unmodifiableList;

public final class DependencyCreationException extends DIException {
	@NotNull
	private final String typeName;
	@Nullable
	private final InjectionToken token;
	@NotNull
	private final List<String> breadcrumbs;

	public DependencyCreationException(String message, @NotNull String typeName, @Nullable InjectionToken token,
			@NotNull List<String> breadcrumbs, @NotNull DIException cause) {
		super(message + " " + typeName + " [token=" + (token != null ? token : "") + ", breadcrumbs=" + breadcrumbs + "]: " +
				cause.getMessage(), cause);
		this.typeName = typeName;
		this.token = token;
		this.breadcrumbs = unmodifiableList(new ArrayList<>(breadcrumbs));
	}

	@NotNull
	public String getTypeName() {
		return typeName;
	}

	@Nullable
	public InjectionToken getToken() {
		return token;
	}

	@NotNull
	public List<String> getBreadcrumbs() {
		return breadcrumbs;
	}

	/**
	 * Whether the innermost failure is a missing binding.
	 */
	public boolean isNotRegistered() {
		Throwable cause = getCause();
		while (cause instanceof DependencyCreationException) {
			cause = cause.getCause();
		}
		return cause instanceof NotRegisteredException;
	}
}
