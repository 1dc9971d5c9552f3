package dev.ornamental.syncstore.lock;

import java.util.function.UnaryOperator;

import dev.ornamental.syncstore.StorageException;

/**
 * A scoped handle granting exclusive read-write access to the value of a store.
 * The value may be mutated in place through the reference returned by {@link #get()}
 * or replaced altogether.
 * @param <T> the type of the stored value
 */
public interface WriteGuard<T> extends ReadGuard<T> {

	/**
	 * Replaces the stored value.
	 * @param value the new value
	 */
	void set(T value);

	/**
	 * Replaces the stored value with the result of a function applied to it.
	 * @param function the function computing the new value from the current one
	 * @return the new value
	 */
	default T update(UnaryOperator<T> function) {
		T value = function.apply(get());
		set(value);
		return value;
	}

	/**
	 * Writes the current value to the backing file without releasing the guard.
	 * @throws StorageException if the value cannot be encoded or the file cannot be written
	 * @see FileBackedStore#save()
	 */
	void save() throws StorageException;
}
