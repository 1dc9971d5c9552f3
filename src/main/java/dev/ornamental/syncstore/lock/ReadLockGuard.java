package dev.ornamental.syncstore.lock;

import java.util.concurrent.locks.Lock;

/**
 * The shared read guard of a {@link FileBackedReadWriteLock}. Any number of read guards may
 * be open at once, but none of them together with a write guard.
 * @param <T> the type of the stored value
 */
public final class ReadLockGuard<T> extends AbstractGuard<T> {

	private final FileBackedReadWriteLock<T> rwLock;

	private final Lock readLock;

	ReadLockGuard(FileBackedReadWriteLock<T> rwLock, StoreCore<T> core, Lock readLock) {
		super(core);
		this.rwLock = rwLock;
		this.readLock = readLock;
	}

	@Override
	public FileBackedReadWriteLock<T> getStore() {
		return rwLock;
	}

	@Override
	protected void release() {
		readLock.unlock();
	}
}
