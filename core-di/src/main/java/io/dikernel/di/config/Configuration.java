package io.dikernel.di.config;

import io.dikernel.di.error.ConfigurationLookupException;
import io.dikernel.json.DecodeException;
import io.dikernel.json.StructDecoder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Typed configuration source of a {@link io.dikernel.di.DIContext}.
 * <p>
 * Implementations are usually plain Gson-mappable classes; node lookup walks their fields
 * by name or {@code @SerializedName}.
 */
public interface Configuration {
	/**
	 * Node at the dot-separated {@code path}, or this configuration itself for an empty path.
	 */
	@Nullable
	default Object lookupNode(@NotNull String path) throws ConfigurationLookupException {
		return ConfigurationNodes.lookup(this, path);
	}

	/**
	 * Generic nested-map form of this configuration.
	 */
	@NotNull
	default Map<String, Object> toRawConfiguration() throws DecodeException {
		return StructDecoder.toTree(this);
	}
}
