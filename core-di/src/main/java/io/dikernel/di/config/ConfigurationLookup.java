package io.dikernel.di.config;

import io.dikernel.di.Coercions;
import io.dikernel.di.DIContext;
import io.dikernel.di.Key;
import io.dikernel.di.RegistryOpts;
import io.dikernel.di.error.ConfigurationLookupException;
import io.dikernel.json.DecodeException;
import io.dikernel.json.StructDecoder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static io.dikernel.di.error.ConfigurationLookupException.Reason.*;

/**
 * Resolves the configuration of a creation call from the context's {@link Configuration}.
 * Meant to be called from configuration factories:
 * <pre>
 * Injector.registerConfiguration(DatabaseConfig.class,
 * 		(ctx, opts) -> ConfigurationLookup.lookup(ctx, opts, DatabaseConfig.class));
 * </pre>
 */
public final class ConfigurationLookup {
	private static final Logger logger = LoggerFactory.getLogger(ConfigurationLookup.class);

	private ConfigurationLookup() {
	}

	public static <C> C lookup(@Nullable DIContext ctx, @NotNull RegistryOpts opts, @NotNull Class<C> type) throws ConfigurationLookupException {
		return lookup(ctx, opts, Key.of(type));
	}

	/**
	 * A configuration supplied through {@link RegistryOpts#withConfiguration} is returned without lookup.
	 * A map node is decoded into {@code key}'s type when it is not already an instance of it.
	 */
	@NotNull
	public static <C> C lookup(@Nullable DIContext ctx, @NotNull RegistryOpts opts, @NotNull Key<C> key) throws ConfigurationLookupException {
		Object preResolved = opts.getConfiguration();
		if (preResolved != null) {
			return narrow(preResolved, key, null);
		}

		if (ctx == null) {
			throw new ConfigurationLookupException(NO_CONTEXT, null, "context cannot be null");
		}
		Configuration configuration = ctx.getConfiguration();
		if (configuration == null) {
			throw new ConfigurationLookupException(NO_CONFIGURATION, null, "context has no configuration");
		}

		String path = ConfigurationPaths.assemble(opts);
		Object node = configuration.lookupNode(path);
		if (node == null) {
			throw new ConfigurationLookupException(NODE_NOT_FOUND, path, "no configuration node at '" + path + "'");
		}
		logger.trace("Configuration node {} found for {}", path, key);
		return narrow(node, key, path);
	}

	private static <C> C narrow(Object node, Key<C> key, @Nullable String path) throws ConfigurationLookupException {
		C typed = Coercions.tryCoerce(node, key);
		if (typed != null) {
			return typed;
		}
		if (node instanceof Map) {
			try {
				typed = StructDecoder.decode(node, key.getType());
			} catch (DecodeException e) {
				throw new ConfigurationLookupException(INVALID_TYPE, path,
						"configuration node at '" + path + "' cannot be decoded into " + key, e);
			}
			if (typed != null) {
				return typed;
			}
		}
		throw new ConfigurationLookupException(INVALID_TYPE, path,
				"configuration node at '" + path + "' has type " + node.getClass().getName() + ", expected " + key);
	}
}
