package dev.ornamental.syncstore;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Signals that the backing file could not be opened, created, read, written or replaced.
 */
public class FileAccessException extends StorageException {

	private final Path path;

	public FileAccessException(Path path, String message, IOException cause) {
		super(message + " (" + path + ")", cause);
		this.path = path;
	}

	/**
	 * Returns the path of the file the failed operation was performed on.
	 * @return the path of the backing file
	 */
	public Path getPath() {
		return path;
	}
}
