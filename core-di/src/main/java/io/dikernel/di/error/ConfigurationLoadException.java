package io.dikernel.di.error;

public final class ConfigurationLoadException extends DIException {
	public ConfigurationLoadException(String message, Throwable cause) {
		super(message, cause);
	}
}
