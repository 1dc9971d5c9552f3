package dev.ornamental.syncstore.lock;

/**
 * Skeleton implementation of a guard. Tracks the owner thread and the single transition
 * from the acquired to the released state.
 */
abstract class AbstractGuard<T> implements ReadGuard<T> {

	protected final StoreCore<T> core;

	private final Thread owner;

	private boolean released;

	/**
	 * Must only be invoked after the access has been granted to the current thread.
	 */
	protected AbstractGuard(StoreCore<T> core) {
		this.core = core;
		this.owner = Thread.currentThread();
	}

	@Override
	public T get() {
		checkAcquired();
		return core.get();
	}

	@Override
	public final void close() {
		checkOwner();
		if (!released) {
			released = true;
			release();
		}
	}

	/**
	 * Releases the access held by this guard. Invoked at most once per guard.
	 */
	protected abstract void release();

	/**
	 * Moves the guard to the released state without releasing the access, which is
	 * then the responsibility of the caller.
	 */
	protected final void detach() {
		checkAcquired();
		released = true;
	}

	protected final void checkAcquired() {
		checkOwner();
		if (released) {
			throw new IllegalStateException("The guard has already been released.");
		}
	}

	private void checkOwner() {
		if (Thread.currentThread() != owner) {
			throw new IllegalMonitorStateException("The guard belongs to the thread " + owner.getName() + ".");
		}
	}
}
