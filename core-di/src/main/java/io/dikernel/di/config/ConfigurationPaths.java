package io.dikernel.di.config;

import io.dikernel.di.InjectionToken;
import io.dikernel.di.RegistryOpts;
import io.dikernel.di.error.ConfigurationLookupException;
import org.jetbrains.annotations.NotNull;

import static io.dikernel.di.error.ConfigurationLookupException.Reason.EMPTY_PATH;

public final class ConfigurationPaths {
	private ConfigurationPaths() {
	}

	/**
	 * Lookup path of a creation call: {@code token.configNode}, or the config node alone when there is no token.
	 * A token with no config node gives {@code token.}.
	 */
	@NotNull
	public static String assemble(@NotNull RegistryOpts opts) throws ConfigurationLookupException {
		InjectionToken token = opts.getInjectionToken();
		String configNode = opts.getConfigNode();
		if (token == null && configNode.isEmpty()) {
			throw new ConfigurationLookupException(EMPTY_PATH, null,
					"injection token and config node path cannot be both empty");
		}
		return token != null ? token.value() + InjectionToken.SEPARATOR + configNode : configNode;
	}
}
