package io.dikernel.di;

/**
 * Configuration type of a pair whose instance needs no configuration.
 */
public final class NoConfig {
	public static final NoConfig INSTANCE = new NoConfig();

	private NoConfig() {
	}

	public static boolean isNoConfig(Key<?> key) {
		Key<?> referent = key.getReferent();
		return (referent != null ? referent : key).getRawType() == NoConfig.class;
	}

	@Override
	public String toString() {
		return "NoConfig";
	}
}
