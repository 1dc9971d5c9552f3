package dev.ornamental.syncstore.lock;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.ornamental.syncstore.FileAccessException;
import dev.ornamental.syncstore.OtherThread;
import dev.ornamental.syncstore.codec.JsonCodec;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class FileBackedReentrantMutexTest {

	private static final JsonCodec<Map<String, Integer>> CODEC =
		JsonCodec.forType(new TypeReference<Map<String, Integer>>() { });

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Path path;

	private FileBackedReentrantMutex<Map<String, Integer>> store;

	@Before
	public void setup() throws Exception {
		path = folder.newFolder("store").toPath().resolve("data.json");
		store = FileBackedReentrantMutex.initWith(new HashMap<>(), path, CODEC);
	}

	@Test
	public void testSaveAndReopen() throws Exception {
		try (ReentrantMutexGuard<Map<String, Integer>> guard = store.lock()) {
			guard.get().put("foo", 114514);
		}
		store.save();

		try (ReentrantMutexGuard<Map<String, Integer>> guard = FileBackedReentrantMutex.init(path, CODEC).lock()) {
			Assert.assertEquals(Integer.valueOf(114514), guard.get().get("foo"));
			Assert.assertEquals(1, guard.get().size());
		}
	}

	@Test(timeout = 10_000L)
	public void testNestedAcquisition() throws Exception {
		try (ReentrantMutexGuard<Map<String, Integer>> outer = store.lock()) {
			outer.get().put("depth", 1);

			ReentrantMutexGuard<Map<String, Integer>> inner = store.lock();
			Assert.assertEquals(2, inner.getHoldCount());
			Assert.assertEquals(2, store.getHoldCount());
			inner.get().put("depth", 2);
			Assert.assertTrue(store.tryLock().map(g -> {
				g.close();
				return true;
			}).orElse(false));
			inner.close();

			Assert.assertEquals(1, outer.getHoldCount());
			Assert.assertEquals(Integer.valueOf(2), outer.get().get("depth"));
			Assert.assertTrue(store.isLocked());
			Assert.assertTrue(store.isHeldByCurrentThread());
			Assert.assertFalse(OtherThread.call(() -> store.tryLock().isPresent()));
			Assert.assertFalse(OtherThread.call(() -> store.trySave()));
		}

		Assert.assertFalse(store.isLocked());
		Assert.assertEquals(0, store.getHoldCount());
		Assert.assertTrue(OtherThread.call(() -> {
			try (ReentrantMutexGuard<Map<String, Integer>> guard = store.tryLock(1, TimeUnit.SECONDS)
					.orElseThrow(AssertionError::new)) {
				return guard.get().get("depth") == 2;
			}
		}));
	}

	@Test
	public void testSaveByOwnerThread() throws Exception {
		try (ReentrantMutexGuard<Map<String, Integer>> guard = store.lock()) {
			guard.get().put("foo", 1);
			store.save();
			Assert.assertTrue(store.trySave());
			Assert.assertEquals(1, guard.getHoldCount());
		}
		Assert.assertEquals(Integer.valueOf(1), CODEC.decode(Files.readAllBytes(path)).get("foo"));
	}

	@Test(timeout = 20_000L)
	public void testConcurrentWritersAndSaves() throws Throwable {
		int threadCount = 3;
		int iterations = 500;
		CountDownLatch start = new CountDownLatch(1);
		List<Throwable> errors = new ArrayList<>();
		Thread[] threads = new Thread[threadCount + 1];
		for (int i = 0; i < threadCount; i++) {
			threads[i] = new Thread(() -> {
				try {
					start.await();
					for (int j = 0; j < iterations; j++) {
						try (ReentrantMutexGuard<Map<String, Integer>> guard = store.lock()) {
							// both entries always change together
							guard.get().merge("a", 1, Integer::sum);
							try (ReentrantMutexGuard<Map<String, Integer>> nested = store.lock()) {
								nested.get().merge("b", 1, Integer::sum);
							}
						}
					}
				} catch (Throwable e) {
					synchronized (errors) {
						errors.add(e);
					}
				}
			});
		}
		threads[threadCount] = new Thread(() -> {
			try {
				start.await();
				for (int j = 0; j < 50; j++) {
					store.save();
					Map<String, Integer> persisted = CODEC.decode(Files.readAllBytes(path));
					Assert.assertEquals(persisted.get("a"), persisted.get("b"));
				}
			} catch (Throwable e) {
				synchronized (errors) {
					errors.add(e);
				}
			}
		});
		for (Thread thread : threads) {
			thread.setDaemon(true);
			thread.start();
		}
		start.countDown();
		for (Thread thread : threads) {
			thread.join();
		}

		if (!errors.isEmpty()) {
			throw errors.get(0);
		}
		store.save();
		Map<String, Integer> persisted = CODEC.decode(Files.readAllBytes(path));
		Assert.assertEquals(Integer.valueOf(threadCount * iterations), persisted.get("a"));
		Assert.assertEquals(Integer.valueOf(threadCount * iterations), persisted.get("b"));
	}

	@Test
	public void testFailedSaveKeepsLockUsable() throws Exception {
		try (ReentrantMutexGuard<Map<String, Integer>> guard = store.lock()) {
			guard.get().put("foo", 3);
		}
		Files.delete(path);
		Files.createDirectory(path);

		try (ReentrantMutexGuard<Map<String, Integer>> guard = store.lock()) {
			try {
				guard.save();
				Assert.fail("A directory must not be writable as a file.");
			} catch (FileAccessException expected) {
				// expected
			}
			Assert.assertEquals(Integer.valueOf(3), guard.get().get("foo"));
		}
		Assert.assertFalse(store.isLocked());
	}
}
