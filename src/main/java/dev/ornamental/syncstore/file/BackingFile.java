package dev.ornamental.syncstore.file;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;

import dev.ornamental.syncstore.FileAccessException;
import dev.ornamental.syncstore.StorageException;
import dev.ornamental.syncstore.StoreOptions;
import dev.ornamental.syncstore.codec.ValueCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Represents the single file holding the stored representation of a value.<br>
 * The instances are immutable but do not synchronize file access: the callers must make sure
 * no two writes to the same file overlap.
 * @param <T> the type of the stored value
 */
public final class BackingFile<T> {

	private static final Logger log = LoggerFactory.getLogger(BackingFile.class);

	private final Path path;

	private final ValueCodec<T> codec;

	private final boolean atomicReplace;

	private final boolean force;

	/**
	 * Creates a backing file descriptor. No file system access is performed.
	 * @param path the location of the file
	 * @param codec the converter between values and file contents
	 * @param options the write options
	 */
	public BackingFile(Path path, ValueCodec<T> codec, StoreOptions options) {
		if (path == null || codec == null || options == null) {
			throw new NullPointerException("The path, the codec and the options must be set.");
		}
		this.path = path;
		this.codec = codec;
		this.atomicReplace = options.isAtomicReplace();
		this.force = options.isForce();
	}

	public Path getPath() {
		return path;
	}

	/**
	 * Reads and decodes the file contents.
	 * @return the value stored in the file
	 * @throws FileAccessException if the file cannot be opened or read
	 * @throws dev.ornamental.syncstore.ValueDecodingException if the contents do not represent a value
	 */
	public T read() throws StorageException {
		byte[] contents;
		try {
			contents = Files.readAllBytes(path);
		} catch (IOException e) {
			throw new FileAccessException(path, "Could not read the backing file.", e);
		}

		T value = codec.decode(contents);
		log.debug("Read {} bytes from {}", contents.length, path);
		return value;
	}

	/**
	 * Encodes the value and replaces the file contents with the result, creating the file if needed.
	 * The value is encoded before the file is opened, so an encoding failure leaves the file intact.
	 * @param value the value to store
	 * @throws FileAccessException if the file cannot be opened, written or replaced
	 * @throws dev.ornamental.syncstore.ValueEncodingException if the value cannot be encoded
	 */
	public void write(T value) throws StorageException {
		byte[] contents = codec.encode(value);
		try {
			if (atomicReplace) {
				replace(contents);
			} else {
				overwrite(path, contents);
			}
		} catch (IOException e) {
			throw new FileAccessException(path, "Could not write the backing file.", e);
		}
		log.debug("Wrote {} bytes to {}", contents.length, path);
	}

	private void overwrite(Path file, byte[] contents) throws IOException {
		try (FileChannel channel = FileChannel.open(file,
				StandardOpenOption.WRITE, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {

			ByteBuffer buffer = ByteBuffer.wrap(contents);
			while (buffer.hasRemaining()) {
				channel.write(buffer);
			}
			if (force) {
				channel.force(false);
			}
		}
	}

	private void replace(byte[] contents) throws IOException {
		Path directory = path.toAbsolutePath().getParent();
		Path temporary = Files.createTempFile(directory, path.getFileName().toString() + ".", ".tmp");
		try {
			overwrite(temporary, contents);
			copyPermissions(temporary);
			Files.move(temporary, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (IOException e) {
			try {
				Files.deleteIfExists(temporary);
			} catch (IOException suppressed) {
				e.addSuppressed(suppressed);
			}
			throw e;
		}
	}

	/**
	 * Temporary files are created owner-only; the replacement keeps the mode of the existing file.
	 */
	private void copyPermissions(Path temporary) throws IOException {
		PosixFileAttributeView view = Files.getFileAttributeView(temporary, PosixFileAttributeView.class);
		if (view != null && Files.exists(path)) {
			view.setPermissions(Files.getPosixFilePermissions(path));
		}
	}

	@Override
	public String toString() {
		return path.toString();
	}
}
