package dev.ornamental.syncstore;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;

/**
 * Runs test actions on a separate daemon thread and waits for their outcome.
 */
public final class OtherThread {

	private OtherThread() { }

	public static <R> R call(Callable<R> action) throws Exception {
		FutureTask<R> task = new FutureTask<>(action);
		Thread thread = new Thread(task, "other-thread");
		thread.setDaemon(true);
		thread.start();
		try {
			return task.get(10, TimeUnit.SECONDS);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof Exception) {
				throw (Exception) cause;
			}
			throw new AssertionError(cause);
		}
	}
}
