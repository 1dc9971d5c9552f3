package dev.ornamental.syncstore.lock;

import java.util.concurrent.locks.Lock;

/**
 * The write guard of a {@link FileBackedMutex}.
 * @param <T> the type of the stored value
 */
public final class MutexGuard<T> extends AbstractWriteGuard<T> {

	private final FileBackedMutex<T> mutex;

	private final Lock lock;

	MutexGuard(FileBackedMutex<T> mutex, StoreCore<T> core, Lock lock) {
		super(core);
		this.mutex = mutex;
		this.lock = lock;
	}

	@Override
	public FileBackedMutex<T> getStore() {
		return mutex;
	}

	@Override
	protected void release() {
		lock.unlock();
	}
}
