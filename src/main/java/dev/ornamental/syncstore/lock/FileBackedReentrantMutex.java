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
 * A file-backed store guarded by an exclusive reentrant lock. The thread holding the lock may
 * acquire it again without blocking, getting another guard; the lock is released when all the
 * guards of the thread are closed. {@link #save()} may also be called by the owner thread.
 * @param <T> the type of the stored value
 */
public final class FileBackedReentrantMutex<T> implements FileBackedStore<T> {

	private final StoreCore<T> core;

	private final ReentrantLock lock;

	private FileBackedReentrantMutex(StoreCore<T> core, StoreOptions options) {
		this.core = core;
		this.lock = new ReentrantLock(options.isFair());
	}

	/**
	 * Creates a store holding the value read from an existing file. The file is not modified.
	 * @see FileBackedMutex#init(Path, ValueCodec)
	 */
	public static <T> FileBackedReentrantMutex<T> init(Path path, ValueCodec<T> codec) throws StorageException {
		return init(path, codec, StoreOptions.defaults());
	}

	public static <T> FileBackedReentrantMutex<T> init(Path path, ValueCodec<T> codec, StoreOptions options)
		throws StorageException {

		return new FileBackedReentrantMutex<>(StoreCore.load(new BackingFile<>(path, codec, options)), options);
	}

	/**
	 * Creates a store holding the given value and immediately writes the value to the file.
	 * @see FileBackedMutex#initWith(Object, Path, ValueCodec)
	 */
	public static <T> FileBackedReentrantMutex<T> initWith(T initial, Path path, ValueCodec<T> codec)
		throws StorageException {

		return initWith(initial, path, codec, StoreOptions.defaults());
	}

	public static <T> FileBackedReentrantMutex<T> initWith(
		T initial, Path path, ValueCodec<T> codec, StoreOptions options) throws StorageException {

		return new FileBackedReentrantMutex<>(
			StoreCore.create(initial, new BackingFile<>(path, codec, options)), options);
	}

	/**
	 * Acquires the lock, waiting as long as necessary unless the current thread already holds it.
	 * @return a new guard for the current recursion level
	 */
	public ReentrantMutexGuard<T> lock() {
		lock.lock();
		return new ReentrantMutexGuard<>(this, core, lock);
	}

	public Optional<ReentrantMutexGuard<T>> tryLock() {
		if (!lock.tryLock()) {
			return Optional.empty();
		}
		return Optional.of(new ReentrantMutexGuard<>(this, core, lock));
	}

	public Optional<ReentrantMutexGuard<T>> tryLock(long timeout, TimeUnit unit) throws InterruptedException {
		if (!lock.tryLock(timeout, unit)) {
			return Optional.empty();
		}
		return Optional.of(new ReentrantMutexGuard<>(this, core, lock));
	}

	@Override
	public void save() throws StorageException {
		core.persistUnder(lock);
	}

	@Override
	public boolean trySave() throws StorageException {
		return core.tryPersistUnder(lock);
	}

	@Override
	public boolean trySave(long timeout, TimeUnit unit) throws StorageException, InterruptedException {
		return core.tryPersistUnder(lock, timeout, unit);
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

	/**
	 * Returns the recursion depth of the lock for the current thread.
	 * @return the number of open guards of the current thread, 0 if it does not hold the lock
	 */
	public int getHoldCount() {
		return lock.getHoldCount();
	}

	@Override
	public String toString() {
		return "FileBackedReentrantMutex[" + getPath() + "]";
	}
}
