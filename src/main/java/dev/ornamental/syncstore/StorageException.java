package dev.ornamental.syncstore;

import java.io.IOException;

/**
 * The base class for the (checked) exceptions occurring while a store loads or persists its value.
 */
public class StorageException extends IOException {

	public StorageException() { }

	public StorageException(String message) {
		super(message);
	}

	public StorageException(String message, Throwable cause) {
		super(message, cause);
	}

	public StorageException(Throwable cause) {
		super(cause);
	}
}
