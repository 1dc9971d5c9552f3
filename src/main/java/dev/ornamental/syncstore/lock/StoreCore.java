package dev.ornamental.syncstore.lock;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

import dev.ornamental.syncstore.StorageException;
import dev.ornamental.syncstore.file.BackingFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The state shared by all store variants: the value and its backing file.<br>
 * This class does not synchronize anything itself. The value may only be accessed while holding
 * the lock of the owning store; the lock acquisition provides the visibility of the value.
 * @param <T> the type of the stored value
 */
final class StoreCore<T> {

	private static final Logger log = LoggerFactory.getLogger(StoreCore.class);

	private final BackingFile<T> file;

	private T value;

	private StoreCore(BackingFile<T> file, T value) {
		this.file = file;
		this.value = value;
	}

	/**
	 * Creates the state from the current contents of the backing file. The file is not written.
	 */
	static <T> StoreCore<T> load(BackingFile<T> file) throws StorageException {
		T value = file.read();
		log.debug("Loaded the stored value from {}", file);
		return new StoreCore<>(file, value);
	}

	/**
	 * Writes the initial value to the backing file and only then creates the state.
	 */
	static <T> StoreCore<T> create(T initial, BackingFile<T> file) throws StorageException {
		file.write(initial);
		log.debug("Created the backing file {}", file);
		return new StoreCore<>(file, initial);
	}

	Path getPath() {
		return file.getPath();
	}

	T get() {
		return value;
	}

	void set(T value) {
		this.value = value;
	}

	/**
	 * Writes the current value. The caller must hold exclusive access.
	 */
	void persist() throws StorageException {
		file.write(value);
	}

	/**
	 * Acquires the exclusive lock, writes the current value and releases the lock.
	 * The lock is held for the whole encode-and-write sequence.
	 */
	void persistUnder(Lock exclusive) throws StorageException {
		exclusive.lock();
		try {
			persist();
		} finally {
			exclusive.unlock();
		}
	}

	boolean tryPersistUnder(Lock exclusive) throws StorageException {
		if (!exclusive.tryLock()) {
			return false;
		}
		try {
			persist();
			return true;
		} finally {
			exclusive.unlock();
		}
	}

	boolean tryPersistUnder(Lock exclusive, long timeout, TimeUnit unit)
		throws StorageException, InterruptedException {

		if (!exclusive.tryLock(timeout, unit)) {
			return false;
		}
		try {
			persist();
			return true;
		} finally {
			exclusive.unlock();
		}
	}
}
