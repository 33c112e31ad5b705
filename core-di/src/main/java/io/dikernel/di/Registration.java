package io.dikernel.di;

import org.jetbrains.annotations.NotNull;

public final class Registration {
	@NotNull
	private final InstanceFactory factory;
	@NotNull
	private final RegistryOpts opts;

	public Registration(@NotNull InstanceFactory factory, @NotNull RegistryOpts opts) {
		this.factory = factory;
		this.opts = opts.copy();
	}

	@NotNull
	public InstanceFactory getFactory() {
		return factory;
	}

	/**
	 * Options in effect when the factory was registered.
	 */
	@NotNull
	public RegistryOpts getOpts() {
		return opts.copy();
	}

	@Override
	public String toString() {
		return "Registration{" + opts + '}';
	}
}
