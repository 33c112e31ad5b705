package io.dikernel.di;

import io.dikernel.di.error.DIException;
import io.dikernel.di.error.NotRegisteredException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Type-keyed store of instance factories, configuration factories and hot (already built) instances.
 * <p>
 * Registration belongs to a single-threaded wiring phase and must not run concurrently with anything else.
 * Once wiring is over, creation calls may run from any number of threads.
 */
public interface Registry {
	@FunctionalInterface
	interface HotInstanceFactory {
		Object create() throws DIException;
	}

	/**
	 * Stores {@code factory} under {@code typeKey}. An existing registration is silently replaced.
	 */
	void register(@NotNull String typeKey, @NotNull InstanceFactory factory, @NotNull RegistryOpts opts);

	/**
	 * Same as {@link #register}, in a separate namespace for configuration factories.
	 */
	void registerConfiguration(@NotNull String typeKey, @NotNull ConfigurationFactory factory, @NotNull RegistryOpts opts);

	/**
	 * Invokes the factory stored under {@code typeKey}; its exceptions pass through untouched.
	 *
	 * @throws NotRegisteredException if nothing is stored under {@code typeKey}
	 */
	Object create(@NotNull DIContext ctx, @NotNull String typeKey, @Nullable Object configuration,
			@NotNull RegistryOpts opts) throws DIException;

	Object createConfiguration(@NotNull DIContext ctx, @NotNull String typeKey, @NotNull RegistryOpts opts) throws DIException;

	/**
	 * @throws NotRegisteredException on a cache miss
	 */
	@NotNull
	Object getHotInstance(@NotNull DIContext ctx, @Nullable RegistryOpts opts, @NotNull String typeKey) throws NotRegisteredException;

	void setHotInstance(@NotNull DIContext ctx, @Nullable RegistryOpts opts, @NotNull String typeKey, @NotNull Object instance);

	/**
	 * Returns the cached instance or builds it with {@code factory}. Concurrent callers for the same
	 * key wait for the first construction, so {@code factory} runs at most once per key.
	 */
	Object getOrCreateHotInstance(@NotNull DIContext ctx, @Nullable RegistryOpts opts, @NotNull String typeKey,
			@NotNull HotInstanceFactory factory) throws DIException;

	@Nullable
	Registration getRegistration(@NotNull String typeKey);

	@Nullable
	ConfigurationRegistration getConfigurationRegistration(@NotNull String typeKey);

	/**
	 * Cache key of a hot instance: the type key, qualified by the token of {@code opts} if there is one.
	 */
	@NotNull
	static String hotInstanceKey(@Nullable RegistryOpts opts, @NotNull String typeKey) {
		return TypeKeys.of(typeKey, opts != null ? opts.getInjectionToken() : null);
	}
}
