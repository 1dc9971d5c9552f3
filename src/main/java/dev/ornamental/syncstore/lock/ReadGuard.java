package dev.ornamental.syncstore.lock;

/**
 * A scoped handle granting read access to the value of a store. The access lasts until the guard
 * is closed; a guard is meant to be used in a {@code try}-with-resources statement.<br>
 * The value must not be modified through a read guard.<br>
 * A guard belongs to the thread which has acquired it: using or closing it from another thread
 * fails with {@link IllegalMonitorStateException}. Closing a guard more than once has no effect;
 * any other use of a closed guard fails with {@link IllegalStateException}.
 * @param <T> the type of the stored value
 */
public interface ReadGuard<T> extends AutoCloseable {

	/**
	 * Returns the stored value.
	 * @return the stored value
	 */
	T get();

	/**
	 * Returns the store this guard grants access to.
	 * @return the store of the guard
	 */
	FileBackedStore<T> getStore();

	/**
	 * Releases the access granted by the guard.
	 */
	@Override
	void close();
}
