package io.dikernel.di;

import org.jetbrains.annotations.NotNull;

public final class ConfigurationRegistration {
	@NotNull
	private final ConfigurationFactory factory;
	@NotNull
	private final RegistryOpts opts;

	public ConfigurationRegistration(@NotNull ConfigurationFactory factory, @NotNull RegistryOpts opts) {
		this.factory = factory;
		this.opts = opts.copy();
	}

	@NotNull
	public ConfigurationFactory getFactory() {
		return factory;
	}

	@NotNull
	public RegistryOpts getOpts() {
		return opts.copy();
	}

	@Override
	public String toString() {
		return "ConfigurationRegistration{" + opts + '}';
	}
}
