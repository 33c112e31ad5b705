package io.dikernel.di;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static io.dikernel.util.Preconditions.checkArgument;

/**
 * Options of a registration or creation call, built from {@link Option} mutators:
 * <pre>
 * Injector.create(ctx, Cache.class, withRegistry(registry), withToken(PAYMENTS), withConfigNode("cache"));
 * </pre>
 */
public final class RegistryOpts {
	@FunctionalInterface
	public interface Option {
		void apply(RegistryOpts opts);
	}

	@Nullable
	private Registry registry;
	@Nullable
	private InjectionToken injectionToken;
	@NotNull
	private String configNode = "";
	@Nullable
	private Object configuration;

	private RegistryOpts() {
	}

	/**
	 * Defaults (process-wide registry, no token) with {@code options} applied in order; {@code null} options are skipped.
	 */
	public static RegistryOpts create(Option... options) {
		RegistryOpts opts = new RegistryOpts();
		opts.registry = Registries.getDefault();
		for (Option option : options) {
			if (option != null) {
				option.apply(opts);
			}
		}
		return opts;
	}

	public static Option withOpts(@NotNull RegistryOpts other) {
		return opts -> {
			opts.registry = other.registry;
			opts.injectionToken = other.injectionToken;
			opts.configNode = other.configNode;
			opts.configuration = other.configuration;
		};
	}

	public static Option withRegistry(@Nullable Registry registry) {
		return opts -> opts.registry = registry;
	}

	public static Option withToken(@Nullable InjectionToken token) {
		return opts -> opts.injectionToken = token;
	}

	/**
	 * Appends {@code path} to the configuration node path, joining with a dot.
	 */
	public static Option withConfigNode(@NotNull String path) {
		checkArgument(!path.isEmpty(), "Config node path cannot be empty");
		return opts -> opts.configNode = opts.configNode.isEmpty() ? path : opts.configNode + InjectionToken.SEPARATOR + path;
	}

	/**
	 * Supplies the configuration up front, bypassing lookup and the configuration side of a pair.
	 */
	public static Option withConfiguration(@Nullable Object configuration) {
		return opts -> opts.configuration = configuration;
	}

	public RegistryOpts copy() {
		RegistryOpts copy = new RegistryOpts();
		withOpts(this).apply(copy);
		return copy;
	}

	@NotNull
	public Registry getRegistry() {
		return registry != null ? registry : Registries.getDefault();
	}

	@Nullable
	public InjectionToken getInjectionToken() {
		return injectionToken;
	}

	public boolean hasInjectionToken() {
		return injectionToken != null;
	}

	@NotNull
	public String getConfigNode() {
		return configNode;
	}

	@Nullable
	public Object getConfiguration() {
		return configuration;
	}

	@Override
	public String toString() {
		return "RegistryOpts{" +
				"injectionToken=" + injectionToken +
				", configNode='" + configNode + '\'' +
				", configuration=" + (configuration != null ? configuration.getClass().getSimpleName() : null) +
				'}';
	}
}
