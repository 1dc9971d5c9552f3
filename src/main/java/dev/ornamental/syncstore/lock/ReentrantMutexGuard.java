package dev.ornamental.syncstore.lock;

import java.util.concurrent.locks.ReentrantLock;

/**
 * The write guard of a {@link FileBackedReentrantMutex}. Each guard stands for one level of
 * the lock recursion; the lock is released when the last guard of the owner thread is closed.
 * @param <T> the type of the stored value
 */
public final class ReentrantMutexGuard<T> extends AbstractWriteGuard<T> {

	private final FileBackedReentrantMutex<T> mutex;

	private final ReentrantLock lock;

	ReentrantMutexGuard(FileBackedReentrantMutex<T> mutex, StoreCore<T> core, ReentrantLock lock) {
		super(core);
		this.mutex = mutex;
		this.lock = lock;
	}

	@Override
	public FileBackedReentrantMutex<T> getStore() {
		return mutex;
	}

	/**
	 * Returns the number of open guards the owner thread holds on the store, including this one.
	 * @return the recursion depth of the lock
	 */
	public int getHoldCount() {
		checkAcquired();
		return lock.getHoldCount();
	}

	@Override
	protected void release() {
		lock.unlock();
	}
}
