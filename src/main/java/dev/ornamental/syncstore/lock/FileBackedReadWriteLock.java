package dev.ornamental.syncstore.lock;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import dev.ornamental.syncstore.StorageException;
import dev.ornamental.syncstore.StoreOptions;
import dev.ornamental.syncstore.codec.ValueCodec;
import dev.ornamental.syncstore.file.BackingFile;

/**
 * A file-backed store allowing any number of concurrent readers or, alternatively, a single writer.
 * <br>
 * The write lock is not reentrant, and a read lock cannot be upgraded: acquiring the write lock
 * (by {@link #write()} or {@link #save()}) while the current thread holds the write lock or a read
 * lock fails with {@link IllegalStateException}. Read locks may be acquired recursively and
 * by the thread holding the write lock.<br>
 * {@link #save()} takes the write lock even though it only reads the value, so that no
 * writer is active while the value is encoded.
 * @param <T> the type of the stored value
 */
public final class FileBackedReadWriteLock<T> implements FileBackedStore<T> {

	private final StoreCore<T> core;

	private final ReentrantReadWriteLock lock;

	private FileBackedReadWriteLock(StoreCore<T> core, StoreOptions options) {
		this.core = core;
		this.lock = new ReentrantReadWriteLock(options.isFair());
	}

	/**
	 * Creates a store holding the value read from an existing file. The file is not modified.
	 * @see FileBackedMutex#init(Path, ValueCodec)
	 */
	public static <T> FileBackedReadWriteLock<T> init(Path path, ValueCodec<T> codec) throws StorageException {
		return init(path, codec, StoreOptions.defaults());
	}

	public static <T> FileBackedReadWriteLock<T> init(Path path, ValueCodec<T> codec, StoreOptions options)
		throws StorageException {

		return new FileBackedReadWriteLock<>(StoreCore.load(new BackingFile<>(path, codec, options)), options);
	}

	/**
	 * Creates a store holding the given value and immediately writes the value to the file.
	 * @see FileBackedMutex#initWith(Object, Path, ValueCodec)
	 */
	public static <T> FileBackedReadWriteLock<T> initWith(T initial, Path path, ValueCodec<T> codec)
		throws StorageException {

		return initWith(initial, path, codec, StoreOptions.defaults());
	}

	public static <T> FileBackedReadWriteLock<T> initWith(
		T initial, Path path, ValueCodec<T> codec, StoreOptions options) throws StorageException {

		return new FileBackedReadWriteLock<>(
			StoreCore.create(initial, new BackingFile<>(path, codec, options)), options);
	}

	/**
	 * Acquires shared access, waiting while a writer holds the lock.
	 * @return the read guard
	 */
	public ReadLockGuard<T> read() {
		lock.readLock().lock();
		return newReadGuard();
	}

	public Optional<ReadLockGuard<T>> tryRead() {
		if (!lock.readLock().tryLock()) {
			return Optional.empty();
		}
		return Optional.of(newReadGuard());
	}

	public Optional<ReadLockGuard<T>> tryRead(long timeout, TimeUnit unit) throws InterruptedException {
		if (!lock.readLock().tryLock(timeout, unit)) {
			return Optional.empty();
		}
		return Optional.of(newReadGuard());
	}

	/**
	 * Acquires exclusive access, waiting while any reader or writer holds the lock.
	 * The waiting is not interruptible.
	 * @return the write guard
	 * @throws IllegalStateException if the current thread holds the write lock or a read lock
	 */
	public WriteLockGuard<T> write() {
		checkCanWrite();
		lock.writeLock().lock();
		return newWriteGuard();
	}

	/**
	 * Acquires exclusive access if it is available immediately.
	 * @return the write guard, or empty if the lock is held by any thread (the current one included)
	 */
	public Optional<WriteLockGuard<T>> tryWrite() {
		if (!canWrite() || !lock.writeLock().tryLock()) {
			return Optional.empty();
		}
		return Optional.of(newWriteGuard());
	}

	public Optional<WriteLockGuard<T>> tryWrite(long timeout, TimeUnit unit) throws InterruptedException {
		if (!canWrite() || !lock.writeLock().tryLock(timeout, unit)) {
			return Optional.empty();
		}
		return Optional.of(newWriteGuard());
	}

	/**
	 * {@inheritDoc}
	 * @throws IllegalStateException if the current thread holds the write lock or a read lock
	 */
	@Override
	public void save() throws StorageException {
		checkCanWrite();
		core.persistUnder(lock.writeLock());
	}

	@Override
	public boolean trySave() throws StorageException {
		return canWrite() && core.tryPersistUnder(lock.writeLock());
	}

	@Override
	public boolean trySave(long timeout, TimeUnit unit) throws StorageException, InterruptedException {
		return canWrite() && core.tryPersistUnder(lock.writeLock(), timeout, unit);
	}

	@Override
	public Path getPath() {
		return core.getPath();
	}

	@Override
	public boolean isLocked() {
		return lock.isWriteLocked() || lock.getReadLockCount() > 0;
	}

	/**
	 * Shows if a writer currently holds the lock.
	 * @return true if the write lock is held
	 */
	public boolean isLockedExclusive() {
		return lock.isWriteLocked();
	}

	@Override
	public String toString() {
		return "FileBackedReadWriteLock[" + getPath() + "]";
	}

	private ReadLockGuard<T> newReadGuard() {
		return new ReadLockGuard<>(this, core, lock.readLock());
	}

	private WriteLockGuard<T> newWriteGuard() {
		return new WriteLockGuard<>(this, core, lock.readLock(), lock.writeLock());
	}

	private boolean canWrite() {
		return !lock.isWriteLockedByCurrentThread() && lock.getReadHoldCount() == 0;
	}

	private void checkCanWrite() {
		if (lock.isWriteLockedByCurrentThread()) {
			throw new IllegalStateException("The write lock is already held by the current thread.");
		}
		if (lock.getReadHoldCount() > 0) {
			throw new IllegalStateException("The current thread holds a read lock which cannot be upgraded.");
		}
	}
}
