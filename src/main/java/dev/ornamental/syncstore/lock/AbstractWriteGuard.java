package dev.ornamental.syncstore.lock;

import dev.ornamental.syncstore.StorageException;

abstract class AbstractWriteGuard<T> extends AbstractGuard<T> implements WriteGuard<T> {

	protected AbstractWriteGuard(StoreCore<T> core) {
		super(core);
	}

	@Override
	public void set(T value) {
		checkAcquired();
		core.set(value);
	}

	@Override
	public void save() throws StorageException {
		checkAcquired();
		core.persist();
	}
}
