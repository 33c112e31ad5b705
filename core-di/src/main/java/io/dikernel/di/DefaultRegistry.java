package io.dikernel.di;

import io.dikernel.di.error.DIException;
import io.dikernel.di.error.NotRegisteredException;
import io.dikernel.util.ApplicationSettings;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static io.dikernel.di.Registry.hotInstanceKey;
import static io.dikernel.di.error.NotRegisteredException.Namespace.*;
import static io.dikernel.util.Preconditions.checkNotNull;

public final class DefaultRegistry implements Registry {
	private static final Logger logger = LoggerFactory.getLogger(DefaultRegistry.class);

	private static final boolean WARN_ON_OVERRIDE = ApplicationSettings.getBoolean(DefaultRegistry.class, "warnOnOverride", false);

	// written during wiring only
	private final Map<String, Registration> registrations = new HashMap<>();
	private final Map<String, ConfigurationRegistration> configurationRegistrations = new HashMap<>();

	private final Map<String, Object> hotInstances = new ConcurrentHashMap<>();
	private final Map<String, Object> constructionLocks = new ConcurrentHashMap<>();

	@Override
	public void register(@NotNull String typeKey, @NotNull InstanceFactory factory, @NotNull RegistryOpts opts) {
		Registration previous = registrations.put(typeKey, new Registration(factory, opts));
		logRegistration("dependency", typeKey, previous != null);
	}

	@Override
	public void registerConfiguration(@NotNull String typeKey, @NotNull ConfigurationFactory factory, @NotNull RegistryOpts opts) {
		ConfigurationRegistration previous = configurationRegistrations.put(typeKey, new ConfigurationRegistration(factory, opts));
		logRegistration("configuration", typeKey, previous != null);
	}

	@Override
	public Object create(@NotNull DIContext ctx, @NotNull String typeKey, @Nullable Object configuration,
			@NotNull RegistryOpts opts) throws DIException {
		Registration registration = registrations.get(typeKey);
		if (registration == null) {
			throw new NotRegisteredException(typeKey, INSTANCE);
		}
		return registration.getFactory().create(ctx, opts, configuration);
	}

	@Override
	public Object createConfiguration(@NotNull DIContext ctx, @NotNull String typeKey, @NotNull RegistryOpts opts) throws DIException {
		ConfigurationRegistration registration = configurationRegistrations.get(typeKey);
		if (registration == null) {
			throw new NotRegisteredException(typeKey, CONFIGURATION);
		}
		return registration.getFactory().create(ctx, opts);
	}

	@NotNull
	@Override
	public Object getHotInstance(@NotNull DIContext ctx, @Nullable RegistryOpts opts, @NotNull String typeKey) throws NotRegisteredException {
		String key = hotInstanceKey(opts, typeKey);
		Object instance = hotInstances.get(key);
		if (instance == null) {
			throw new NotRegisteredException(key, HOT_INSTANCE);
		}
		return instance;
	}

	@Override
	public void setHotInstance(@NotNull DIContext ctx, @Nullable RegistryOpts opts, @NotNull String typeKey, @NotNull Object instance) {
		hotInstances.put(hotInstanceKey(opts, typeKey), checkNotNull(instance, "Hot instance of %s cannot be null", typeKey));
	}

	@Override
	public Object getOrCreateHotInstance(@NotNull DIContext ctx, @Nullable RegistryOpts opts, @NotNull String typeKey,
			@NotNull HotInstanceFactory factory) throws DIException {
		String key = hotInstanceKey(opts, typeKey);
		Object instance = hotInstances.get(key);
		if (instance != null) {
			logger.trace("Hot instance hit for {}", key);
			return instance;
		}
		synchronized (constructionLocks.computeIfAbsent(key, $ -> new Object())) {
			instance = hotInstances.get(key);
			if (instance != null) {
				return instance;
			}
			instance = factory.create();
			// a null result is not cached and fails coercion in the caller
			if (instance != null) {
				hotInstances.put(key, instance);
				constructionLocks.remove(key);
				logger.trace("Constructed hot instance for {}", key);
			}
			return instance;
		}
	}

	int pendingConstructionLocks() {
		return constructionLocks.size();
	}

	@Nullable
	@Override
	public Registration getRegistration(@NotNull String typeKey) {
		return registrations.get(typeKey);
	}

	@Nullable
	@Override
	public ConfigurationRegistration getConfigurationRegistration(@NotNull String typeKey) {
		return configurationRegistrations.get(typeKey);
	}

	private static void logRegistration(String kind, String typeKey, boolean overridden) {
		if (!overridden) {
			logger.debug("Registered {} {}", kind, typeKey);
		} else if (WARN_ON_OVERRIDE) {
			logger.warn("Overriding {} registration {}", kind, typeKey);
		} else {
			logger.debug("Overriding {} registration {}", kind, typeKey);
		}
	}

	@Override
	public String toString() {
		return "DefaultRegistry{registrations=" + registrations.size() +
				", configurationRegistrations=" + configurationRegistrations.size() +
				", hotInstances=" + hotInstances.size() + '}';
	}
}
