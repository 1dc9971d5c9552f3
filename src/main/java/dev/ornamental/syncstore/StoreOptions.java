package dev.ornamental.syncstore;

/**
 * Configuration class for the file-backed stores. The default options describe
 * non-fair locking and in-place truncating writes without a forced sync.
 */
public final class StoreOptions {

	/**
	 * Whether the lock of the store grants access in arrival order
	 */
	private boolean fair = false;

	/**
	 * Whether each write goes to a temporary sibling file which then replaces the backing file
	 */
	private boolean atomicReplace = false;

	/**
	 * Whether written data is forced to the storage device before the write is reported complete
	 */
	private boolean force = false;

	/**
	 * Creates an options instance holding the default values.
	 * @return new options with default values
	 */
	public static StoreOptions defaults() {
		return new StoreOptions();
	}

	/**
	 * Shows if the store lock uses a fair ordering policy.
	 * @return true if and only if the lock is fair
	 */
	public boolean isFair() {
		return fair;
	}

	/**
	 * Shows if the backing file is replaced atomically on writes.
	 * @return true if writes go through a temporary file and an atomic move
	 */
	public boolean isAtomicReplace() {
		return atomicReplace;
	}

	/**
	 * Shows if the written data is forced to the storage device.
	 * @return true if every write ends with a forced sync
	 */
	public boolean isForce() {
		return force;
	}

	/**
	 * Sets the ordering policy of the store lock. A fair lock grants access to the longest
	 * waiting thread; a non-fair one gives better throughput under contention.
	 * @param fair true to use a fair lock
	 * @return these options
	 */
	public StoreOptions withFair(boolean fair) {
		this.fair = fair;
		return this;
	}

	/**
	 * Sets the backing file replacement mode. When set, the encoded value is written to a temporary
	 * file in the same directory which is then atomically moved over the backing file,
	 * so an interrupted write never leaves a truncated backing file. When unset, the backing file
	 * is truncated and rewritten in place.<br>
	 * On POSIX file systems the replacement takes over the permissions of the existing file;
	 * a file created by the first write is readable and writable by its owner only.
	 * @param atomicReplace true to replace the file atomically
	 * @return these options
	 */
	public StoreOptions withAtomicReplace(boolean atomicReplace) {
		this.atomicReplace = atomicReplace;
		return this;
	}

	/**
	 * Sets whether each write is forced to the storage device before completing.
	 * @param force true to force written data to the device
	 * @return these options
	 */
	public StoreOptions withForce(boolean force) {
		this.force = force;
		return this;
	}
}
