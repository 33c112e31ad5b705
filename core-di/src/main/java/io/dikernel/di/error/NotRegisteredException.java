package io.dikernel.di.error;

import org.jetbrains.annotations.NotNull;

public final class NotRegisteredException extends DIException {
	public enum Namespace {
		INSTANCE("dependency"),
		CONFIGURATION("configuration dependency"),
		HOT_INSTANCE("hot instance");

		private final String displayName;

		Namespace(String displayName) {
			this.displayName = displayName;
		}
	}

	@NotNull
	private final String typeKey;
	@NotNull
	private final Namespace namespace;

	public NotRegisteredException(@NotNull String typeKey, @NotNull Namespace namespace) {
		super(namespace.displayName + " not registered: " + typeKey);
		this.typeKey = typeKey;
		this.namespace = namespace;
	}

	@NotNull
	public String getTypeKey() {
		return typeKey;
	}

	@NotNull
	public Namespace getNamespace() {
		return namespace;
	}
}
