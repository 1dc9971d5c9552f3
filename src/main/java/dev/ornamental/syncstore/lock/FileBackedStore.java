package dev.ornamental.syncstore.lock;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import dev.ornamental.syncstore.StorageException;

/**
 * The contract shared by all the lock-guarded stores persisting a single value to a single file.<br>
 * The value lives in memory and is reachable only through the guards produced by the
 * acquisition methods of the implementations. Changes become durable only when the value
 * is saved explicitly; releasing a guard never writes the file.<br>
 * No two stores should be created over the same file at the same time: the stores do not
 * coordinate with each other.
 * @param <T> the type of the stored value
 */
public interface FileBackedStore<T> {

	/**
	 * Returns the location of the backing file. It never changes during the lifetime of the store.
	 * @return the path of the backing file
	 */
	Path getPath();

	/**
	 * Writes the current value to the backing file, replacing its contents.
	 * The exclusive lock of the store is held during the whole operation, so the written value is
	 * neither older than a completed mutation nor a partially mutated one.<br>
	 * If the operation fails, the value in memory is not affected and the operation may be retried.
	 * Unless the store uses atomic replacement, the file may be left truncated.
	 * @throws StorageException if the value cannot be encoded or the file cannot be written
	 */
	void save() throws StorageException;

	/**
	 * Saves the value if the exclusive lock is available immediately.
	 * @return true if the value has been saved, false if the lock was not available
	 * @throws StorageException if the value cannot be encoded or the file cannot be written
	 */
	boolean trySave() throws StorageException;

	/**
	 * Saves the value if the exclusive lock becomes available within the given waiting time.
	 * @param timeout the maximum time to wait for the lock
	 * @param unit the unit of the timeout
	 * @return true if the value has been saved, false if the waiting time elapsed
	 * @throws StorageException if the value cannot be encoded or the file cannot be written
	 * @throws InterruptedException if the thread is interrupted while waiting for the lock
	 */
	boolean trySave(long timeout, TimeUnit unit) throws StorageException, InterruptedException;

	/**
	 * Shows if any thread currently holds any kind of access to the value.
	 * @return true if the store is locked
	 */
	boolean isLocked();
}
