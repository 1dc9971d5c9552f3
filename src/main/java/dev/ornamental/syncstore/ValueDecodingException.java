package dev.ornamental.syncstore;

/**
 * Signals that stored contents are not a valid encoding of the expected value type
 * (malformed text, unexpected structure, trailing data).
 */
public class ValueDecodingException extends StorageException {

	public ValueDecodingException(String message) {
		super(message);
	}

	public ValueDecodingException(String message, Throwable cause) {
		super(message, cause);
	}
}
