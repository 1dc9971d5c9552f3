package dev.ornamental.syncstore.lock;

import java.util.concurrent.locks.Lock;

/**
 * The exclusive write guard of a {@link FileBackedReadWriteLock}.
 * @param <T> the type of the stored value
 */
public final class WriteLockGuard<T> extends AbstractWriteGuard<T> {

	private final FileBackedReadWriteLock<T> rwLock;

	private final Lock readLock;

	private final Lock writeLock;

	WriteLockGuard(FileBackedReadWriteLock<T> rwLock, StoreCore<T> core, Lock readLock, Lock writeLock) {
		super(core);
		this.rwLock = rwLock;
		this.readLock = readLock;
		this.writeLock = writeLock;
	}

	@Override
	public FileBackedReadWriteLock<T> getStore() {
		return rwLock;
	}

	/**
	 * Atomically turns the exclusive access into shared access: no writer can acquire the lock
	 * in between. This guard is released and the returned guard takes over.
	 * @return the read guard holding the shared access
	 */
	public ReadLockGuard<T> downgrade() {
		checkAcquired();
		readLock.lock();
		detach();
		writeLock.unlock();
		return new ReadLockGuard<>(rwLock, core, readLock);
	}

	@Override
	protected void release() {
		writeLock.unlock();
	}
}
