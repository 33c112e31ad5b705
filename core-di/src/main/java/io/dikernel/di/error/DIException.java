package io.dikernel.di.error;

/**
 * Base of the recoverable failures of the container: missing bindings, configuration
 * that cannot be found, factories that fail.
 */
public class DIException extends Exception {
	public DIException(String message) {
		super(message);
	}

	public DIException(String message, Throwable cause) {
		super(message, cause);
	}
}
