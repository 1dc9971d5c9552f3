package dev.ornamental.syncstore;

/**
 * Signals that a value could not be converted to its stored representation.
 */
public class ValueEncodingException extends StorageException {

	public ValueEncodingException(String message, Throwable cause) {
		super(message, cause);
	}
}
