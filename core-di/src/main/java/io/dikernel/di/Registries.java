package io.dikernel.di;

import org.jetbrains.annotations.NotNull;

import static io.dikernel.util.Preconditions.checkNotNull;

public final class Registries {
	private static volatile Registry defaultRegistry = new DefaultRegistry();

	private Registries() {
	}

	/**
	 * Process-wide registry used when no registry option is given.
	 */
	@NotNull
	public static Registry getDefault() {
		return defaultRegistry;
	}

	/**
	 * Replaces the process-wide registry, typically to start a test from a clean state.
	 */
	public static void setDefault(@NotNull Registry registry) {
		defaultRegistry = checkNotNull(registry, "Default registry cannot be null");
	}

	/**
	 * Isolated registry, sharing nothing with the process-wide one.
	 */
	@NotNull
	public static Registry create() {
		return new DefaultRegistry();
	}
}
