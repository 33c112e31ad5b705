package io.dikernel.di;

import io.dikernel.di.RegistryOpts.Option;
import io.dikernel.di.error.DIException;
import io.dikernel.di.error.DependencyCreationException;
import io.dikernel.di.error.NotRegisteredException;
import io.dikernel.di.error.TypeMismatchException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.dikernel.util.Preconditions.checkArgument;
import static io.dikernel.util.Preconditions.checkNotNull;

/**
 * Typed entry points for registering and creating dependencies.
 * <p>
 * Every registered factory is a singleton: the first successful creation is cached in the registry
 * and returned to every later caller. A creation with a token first looks for a binding under that token
 * and falls back to the binding without token if there is none.
 * <pre>
 * Injector.register(Clock.class, (ctx, opts) -> new SystemClock());
 * Injector.registerPair(Cache.class, CacheConfig.class,
 * 		(ctx, opts, config) -> new Cache(config),
 * 		(ctx, opts) -> ConfigurationLookup.lookup(ctx, opts, CacheConfig.class),
 * 		withToken(SESSIONS));
 *
 * Cache cache = Injector.createPair(ctx, Cache.class, CacheConfig.class, withToken(SESSIONS), withConfigNode("cache"));
 * </pre>
 * Creation failures are reported as {@link DependencyCreationException}. A created value that does not
 * fit the requested type is a wiring bug and fails with the unchecked {@link TypeMismatchException}.
 */
public final class Injector {
	private static final Logger logger = LoggerFactory.getLogger(Injector.class);

	@FunctionalInterface
	private interface Attempt {
		Object create(String typeKey) throws DIException;
	}

	private Injector() {
	}

	public static <T> void register(@NotNull Class<T> type, @NotNull Factory<T> factory, Option... options) {
		register(Key.of(type), factory, options);
	}

	public static <T> void register(@NotNull Key<T> key, @NotNull Factory<T> factory, Option... options) {
		checkNotNull(factory, "Factory cannot be null");
		RegistryOpts opts = RegistryOpts.create(options);
		Registry registry = opts.getRegistry();
		String typeKey = TypeKeys.of(key, opts.getInjectionToken());
		registry.register(typeKey,
				(ctx, createOpts, configuration) ->
						registry.getOrCreateHotInstance(ctx, createOpts, typeKey, () -> factory.create(ctx, createOpts)),
				opts);
	}

	public static <C> void registerConfiguration(@NotNull Class<C> type, @NotNull Factory<C> factory, Option... options) {
		registerConfiguration(Key.of(type), factory, options);
	}

	public static <C> void registerConfiguration(@NotNull Key<C> key, @NotNull Factory<C> factory, Option... options) {
		checkNotNull(factory, "Factory cannot be null");
		RegistryOpts opts = RegistryOpts.create(options);
		Registry registry = opts.getRegistry();
		String typeKey = TypeKeys.of(key, opts.getInjectionToken());
		registry.registerConfiguration(typeKey,
				(ctx, createOpts) ->
						registry.getOrCreateHotInstance(ctx, createOpts, typeKey, () -> factory.create(ctx, createOpts)),
				opts);
	}

	public static <T, C> void registerPair(@NotNull Class<T> type, @NotNull Class<C> configurationType,
			@NotNull PairFactory<T, C> factory, @Nullable Factory<C> configurationFactory, Option... options) {
		registerPair(Key.of(type), Key.of(configurationType), factory, configurationFactory, options);
	}

	/**
	 * Registers the instance side under {@code T;C} and, unless {@code configurationFactory} is {@code null},
	 * the configuration side under {@code C;T}.
	 */
	public static <T, C> void registerPair(@NotNull Key<T> key, @NotNull Key<C> configurationKey,
			@NotNull PairFactory<T, C> factory, @Nullable Factory<C> configurationFactory, Option... options) {
		checkNotNull(factory, "Factory cannot be null");
		checkArgument(configurationFactory == null || !NoConfig.isNoConfig(configurationKey),
				"Pair with %s takes no configuration factory", configurationKey);
		RegistryOpts opts = RegistryOpts.create(options);
		Registry registry = opts.getRegistry();
		String instanceKey = TypeKeys.of(key, opts.getInjectionToken());
		String configKey = TypeKeys.of(configurationKey, opts.getInjectionToken());

		if (configurationFactory != null) {
			String configPairKey = TypeKeys.pair(configKey, instanceKey);
			registry.registerConfiguration(configPairKey,
					(ctx, createOpts) ->
							registry.getOrCreateHotInstance(ctx, createOpts, configPairKey, () -> configurationFactory.create(ctx, createOpts)),
					opts);
		}

		String instancePairKey = TypeKeys.pair(instanceKey, configKey);
		registry.register(instancePairKey,
				(ctx, createOpts, configuration) ->
						registry.getOrCreateHotInstance(ctx, createOpts, instancePairKey, () ->
								factory.create(ctx, createOpts, configuration != null ? Coercions.coerce(configuration, configurationKey) : null)),
				opts);
	}

	public static <T> T create(@Nullable DIContext ctx, @NotNull Class<T> type, Option... options) throws DependencyCreationException {
		return create(ctx, Key.of(type), options);
	}

	@NotNull
	public static <T> T create(@Nullable DIContext ctx, @NotNull Key<T> key, Option... options) throws DependencyCreationException {
		RegistryOpts opts = RegistryOpts.create(options);
		DIContext context = prepare(ctx, opts);
		Registry registry = opts.getRegistry();
		String typeName = key.getTypeName();

		Object instance = createWithFallback(context, opts, typeName,
				TypeKeys.of(typeName, opts.getInjectionToken()), typeName,
				typeKey -> registry.create(context, typeKey, null, opts),
				"failed to create dependency");
		return Coercions.coerce(instance, key);
	}

	public static <C> C createConfiguration(@Nullable DIContext ctx, @NotNull Class<C> type, Option... options) throws DependencyCreationException {
		return createConfiguration(ctx, Key.of(type), options);
	}

	/**
	 * A configuration supplied through {@link RegistryOpts#withConfiguration} is returned without invoking any factory.
	 */
	@NotNull
	public static <C> C createConfiguration(@Nullable DIContext ctx, @NotNull Key<C> key, Option... options) throws DependencyCreationException {
		RegistryOpts opts = RegistryOpts.create(options);
		if (opts.getConfiguration() != null) {
			return Coercions.coerce(opts.getConfiguration(), key);
		}
		DIContext context = prepare(ctx, opts);
		Registry registry = opts.getRegistry();
		String typeName = key.getTypeName();

		Object configuration = createWithFallback(context, opts, typeName,
				TypeKeys.of(typeName, opts.getInjectionToken()), typeName,
				typeKey -> registry.createConfiguration(context, typeKey, opts),
				"failed to create configuration dependency");
		return Coercions.coerce(configuration, key);
	}

	public static <T, C> T createPair(@Nullable DIContext ctx, @NotNull Class<T> type, @NotNull Class<C> configurationType,
			Option... options) throws DependencyCreationException {
		return createPair(ctx, Key.of(type), Key.of(configurationType), options);
	}

	/**
	 * Creates the configuration side first, then the instance with that configuration.
	 * With {@link NoConfig} as configuration type, the configuration side is skipped.
	 */
	@NotNull
	public static <T, C> T createPair(@Nullable DIContext ctx, @NotNull Key<T> key, @NotNull Key<C> configurationKey,
			Option... options) throws DependencyCreationException {
		RegistryOpts opts = RegistryOpts.create(options);
		DIContext context = prepare(ctx, opts);
		Registry registry = opts.getRegistry();
		InjectionToken token = opts.getInjectionToken();
		String typeName = key.getTypeName();
		String configTypeName = configurationKey.getTypeName();

		C configuration;
		if (NoConfig.isNoConfig(configurationKey)) {
			configuration = Coercions.coerce(NoConfig.INSTANCE, configurationKey);
		} else if (opts.getConfiguration() != null) {
			configuration = Coercions.coerce(opts.getConfiguration(), configurationKey);
		} else {
			Object created = createWithFallback(context, opts, configTypeName,
					TypeKeys.pair(TypeKeys.of(configTypeName, token), TypeKeys.of(typeName, token)),
					TypeKeys.pair(configTypeName, typeName),
					typeKey -> registry.createConfiguration(context, typeKey, opts),
					"failed to create configuration dependency for");
			configuration = Coercions.coerce(created, configurationKey);
		}

		Object instance = createWithFallback(context, opts, typeName,
				TypeKeys.pair(TypeKeys.of(typeName, token), TypeKeys.of(configTypeName, token)),
				TypeKeys.pair(typeName, configTypeName),
				typeKey -> registry.create(context, typeKey, configuration, opts),
				"failed to create dependency");
		return Coercions.coerce(instance, key);
	}

	private static DIContext prepare(@Nullable DIContext ctx, RegistryOpts opts) {
		DIContext context = ctx != null ? ctx.copy() : DIContext.create();
		context.appendBreadcrumb(opts.getInjectionToken());
		return context;
	}

	private static Object createWithFallback(DIContext ctx, RegistryOpts opts, String typeName,
			String typeKey, String fallbackTypeKey, Attempt attempt, String message) throws DependencyCreationException {
		InjectionToken token = opts.getInjectionToken();
		try {
			return attempt.create(typeKey);
		} catch (NotRegisteredException e) {
			if (token == null || !e.getTypeKey().equals(typeKey)) {
				throw new DependencyCreationException(message, typeName, token, ctx.getBreadcrumbs(), e);
			}
			logger.debug("No binding for {}, falling back to {}", typeKey, fallbackTypeKey);
		} catch (DIException e) {
			throw new DependencyCreationException(message, typeName, token, ctx.getBreadcrumbs(), e);
		}

		try {
			return attempt.create(fallbackTypeKey);
		} catch (DIException e) {
			throw new DependencyCreationException(message, typeName, token, ctx.getBreadcrumbs(), e);
		}
	}
}
