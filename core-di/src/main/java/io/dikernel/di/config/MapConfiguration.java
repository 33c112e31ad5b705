package io.dikernel.di.config;

import io.dikernel.di.error.ConfigurationLookupException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

import static io.dikernel.util.Preconditions.checkNotNull;

/**
 * {@link Configuration} over an already parsed tree of nested maps.
 */
public final class MapConfiguration implements Configuration {
	@NotNull
	private final Map<String, Object> tree;

	public MapConfiguration(@NotNull Map<String, Object> tree) {
		this.tree = checkNotNull(tree, "Configuration tree cannot be null");
	}

	@Nullable
	@Override
	public Object lookupNode(@NotNull String path) throws ConfigurationLookupException {
		return ConfigurationNodes.lookup(tree, path);
	}

	@NotNull
	@Override
	public Map<String, Object> toRawConfiguration() {
		return tree;
	}

	@Override
	public String toString() {
		return "MapConfiguration" + tree;
	}
}
