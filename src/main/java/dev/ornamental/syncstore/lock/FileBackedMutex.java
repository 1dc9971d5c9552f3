package dev.ornamental.syncstore.lock;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import dev.ornamental.syncstore.StorageException;
import dev.ornamental.syncstore.StoreOptions;
import dev.ornamental.syncstore.codec.ValueCodec;
import dev.ornamental.syncstore.file.BackingFile;

/**
 * A file-backed store guarded by an exclusive, non-reentrant lock: only one thread at a time may
 * read or modify the value.<br>
 * The mutex cannot be acquired again by the thread holding it; instead of deadlocking, such an
 * attempt fails with {@link IllegalStateException}. The same applies to {@link #save()}: a thread
 * holding a guard persists the value with {@link MutexGuard#save()}.
 * @param <T> the type of the stored value
 */
public final class FileBackedMutex<T> implements FileBackedStore<T> {

	private final StoreCore<T> core;

	private final ReentrantLock lock;

	private FileBackedMutex(StoreCore<T> core, StoreOptions options) {
		this.core = core;
		this.lock = new ReentrantLock(options.isFair());
	}

	/**
	 * Creates a store holding the value read from an existing file. The file is not modified.
	 * @param path the location of the backing file
	 * @param codec the converter between values and file contents
	 * @param <T> the type of the stored value
	 * @return the store
	 * @throws dev.ornamental.syncstore.FileAccessException if the file cannot be read
	 * @throws dev.ornamental.syncstore.ValueDecodingException if the contents do not represent a value
	 */
	public static <T> FileBackedMutex<T> init(Path path, ValueCodec<T> codec) throws StorageException {
		return init(path, codec, StoreOptions.defaults());
	}

	/**
	 * Creates a store holding the value read from an existing file. The file is not modified.
	 * @param path the location of the backing file
	 * @param codec the converter between values and file contents
	 * @param options the store options
	 * @param <T> the type of the stored value
	 * @return the store
	 * @throws dev.ornamental.syncstore.FileAccessException if the file cannot be read
	 * @throws dev.ornamental.syncstore.ValueDecodingException if the contents do not represent a value
	 */
	public static <T> FileBackedMutex<T> init(Path path, ValueCodec<T> codec, StoreOptions options)
		throws StorageException {

		return new FileBackedMutex<>(StoreCore.load(new BackingFile<>(path, codec, options)), options);
	}

	/**
	 * Creates a store holding the given value and immediately writes the value to the file,
	 * creating or truncating it.
	 * @param initial the initial value
	 * @param path the location of the backing file
	 * @param codec the converter between values and file contents
	 * @param <T> the type of the stored value
	 * @return the store
	 * @throws dev.ornamental.syncstore.FileAccessException if the file cannot be written
	 * @throws dev.ornamental.syncstore.ValueEncodingException if the value cannot be encoded
	 */
	public static <T> FileBackedMutex<T> initWith(T initial, Path path, ValueCodec<T> codec)
		throws StorageException {

		return initWith(initial, path, codec, StoreOptions.defaults());
	}

	/**
	 * Creates a store holding the given value and immediately writes the value to the file,
	 * creating or truncating it.
	 * @param initial the initial value
	 * @param path the location of the backing file
	 * @param codec the converter between values and file contents
	 * @param options the store options
	 * @param <T> the type of the stored value
	 * @return the store
	 * @throws dev.ornamental.syncstore.FileAccessException if the file cannot be written
	 * @throws dev.ornamental.syncstore.ValueEncodingException if the value cannot be encoded
	 */
	public static <T> FileBackedMutex<T> initWith(T initial, Path path, ValueCodec<T> codec, StoreOptions options)
		throws StorageException {

		return new FileBackedMutex<>(StoreCore.create(initial, new BackingFile<>(path, codec, options)), options);
	}

	/**
	 * Acquires the mutex, waiting as long as necessary. The waiting is not interruptible.
	 * @return the guard holding the mutex
	 * @throws IllegalStateException if the current thread already holds the mutex
	 */
	public MutexGuard<T> lock() {
		checkNotHeld();
		lock.lock();
		return new MutexGuard<>(this, core, lock);
	}

	/**
	 * Acquires the mutex if it is available immediately.
	 * @return the guard holding the mutex, or empty if the mutex is held by any thread
	 * (the current one included)
	 */
	public Optional<MutexGuard<T>> tryLock() {
		if (lock.isHeldByCurrentThread() || !lock.tryLock()) {
			return Optional.empty();
		}
		return Optional.of(new MutexGuard<>(this, core, lock));
	}

	/**
	 * Acquires the mutex if it becomes available within the given waiting time.
	 * @param timeout the maximum time to wait
	 * @param unit the unit of the timeout
	 * @return the guard holding the mutex, or empty if the waiting time elapsed or the
	 * current thread already holds the mutex
	 * @throws InterruptedException if the thread is interrupted while waiting
	 */
	public Optional<MutexGuard<T>> tryLock(long timeout, TimeUnit unit) throws InterruptedException {
		if (lock.isHeldByCurrentThread() || !lock.tryLock(timeout, unit)) {
			return Optional.empty();
		}
		return Optional.of(new MutexGuard<>(this, core, lock));
	}

	/**
	 * {@inheritDoc}
	 * @throws IllegalStateException if the current thread holds the mutex
	 */
	@Override
	public void save() throws StorageException {
		checkNotHeld();
		core.persistUnder(lock);
	}

	@Override
	public boolean trySave() throws StorageException {
		return !lock.isHeldByCurrentThread() && core.tryPersistUnder(lock);
	}

	@Override
	public boolean trySave(long timeout, TimeUnit unit) throws StorageException, InterruptedException {
		return !lock.isHeldByCurrentThread() && core.tryPersistUnder(lock, timeout, unit);
	}

	@Override
	public Path getPath() {
		return core.getPath();
	}

	@Override
	public boolean isLocked() {
		return lock.isLocked();
	}

	public boolean isHeldByCurrentThread() {
		return lock.isHeldByCurrentThread();
	}

	@Override
	public String toString() {
		return "FileBackedMutex[" + getPath() + "]";
	}

	private void checkNotHeld() {
		if (lock.isHeldByCurrentThread()) {
			throw new IllegalStateException("The mutex is already held by the current thread.");
		}
	}
}
