package dev.ornamental.syncstore.file;

import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import dev.ornamental.syncstore.FileAccessException;
import dev.ornamental.syncstore.StoreOptions;
import dev.ornamental.syncstore.ValueDecodingException;
import dev.ornamental.syncstore.ValueEncodingException;
import dev.ornamental.syncstore.codec.JsonCodec;
import org.junit.Assert;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class BackingFileTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Path directory;

	@Before
	public void setup() throws Exception {
		directory = folder.newFolder("files").toPath();
	}

	@Test
	public void testWriteCreatesFile() throws Exception {
		Path path = directory.resolve("value.json");
		BackingFile<String> file = new BackingFile<>(path, JsonCodec.forClass(String.class), StoreOptions.defaults());

		file.write("hello");

		Assert.assertEquals("\"hello\"", read(path));
		Assert.assertEquals("hello", file.read());
	}

	@Test
	public void testWriteTruncatesLongerContents() throws Exception {
		Path path = directory.resolve("list.json");
		BackingFile<Object> file = new BackingFile<>(path, JsonCodec.forClass(Object.class), StoreOptions.defaults());

		file.write(Arrays.asList("a long entry", "another long entry", "and one more"));
		file.write(Collections.singletonList("x"));

		Assert.assertEquals("[\"x\"]", read(path));
		Assert.assertEquals(Collections.singletonList("x"), file.read());
	}

	@Test
	public void testReadMissingFile() throws Exception {
		Path path = directory.resolve("missing.json");
		BackingFile<String> file = new BackingFile<>(path, JsonCodec.forClass(String.class), StoreOptions.defaults());

		try {
			file.read();
			Assert.fail("A missing file must not be readable.");
		} catch (FileAccessException e) {
			Assert.assertEquals(path, e.getPath());
		}
	}

	@Test(expected = ValueDecodingException.class)
	public void testReadMalformedFile() throws Exception {
		Path path = directory.resolve("malformed.json");
		Files.write(path, "[1, 2".getBytes(StandardCharsets.UTF_8));

		new BackingFile<>(path, JsonCodec.forClass(Object.class), StoreOptions.defaults()).read();
	}

	@Test(expected = FileAccessException.class)
	public void testWriteUnderRegularFile() throws Exception {
		Path notADirectory = directory.resolve("plain");
		Files.write(notADirectory, new byte[] { 1 });

		new BackingFile<>(notADirectory.resolve("value.json"), JsonCodec.forClass(String.class), StoreOptions.defaults())
			.write("value");
	}

	@Test
	public void testEncodingFailureKeepsFile() throws Exception {
		Path path = directory.resolve("kept.json");
		BackingFile<Object> file = new BackingFile<>(path, JsonCodec.forClass(Object.class), StoreOptions.defaults());
		file.write("before");

		try {
			file.write(new Object());
			Assert.fail("An empty bean must not be encodable.");
		} catch (ValueEncodingException expected) {
			// expected
		}

		Assert.assertEquals("\"before\"", read(path));
	}

	@Test
	public void testAtomicReplaceLeavesNoTemporaryFiles() throws Exception {
		Path path = directory.resolve("atomic.json");
		StoreOptions options = StoreOptions.defaults().withAtomicReplace(true).withForce(true);
		BackingFile<String> file = new BackingFile<>(path, JsonCodec.forClass(String.class), options);

		file.write("first");
		file.write("second");

		Assert.assertEquals("second", file.read());
		Assert.assertEquals(Collections.singletonList("atomic.json"), list(directory));
	}

	@Test
	public void testAtomicReplaceKeepsPermissions() throws Exception {
		Assume.assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
		Path path = directory.resolve("shared.json");
		BackingFile<String> file = new BackingFile<>(
			path, JsonCodec.forClass(String.class), StoreOptions.defaults().withAtomicReplace(true));
		file.write("first");
		Set<PosixFilePermission> shared = PosixFilePermissions.fromString("rw-r--r--");
		Files.setPosixFilePermissions(path, shared);

		file.write("second");

		Assert.assertEquals("second", file.read());
		Assert.assertEquals(shared, Files.getPosixFilePermissions(path));
	}

	@Test
	public void testFailedAtomicReplaceRemovesTemporaryFile() throws Exception {
		Path path = directory.resolve("occupied");
		Files.createDirectory(path);
		Files.write(path.resolve("inner"), new byte[] { 1 });
		BackingFile<String> file = new BackingFile<>(
			path, JsonCodec.forClass(String.class), StoreOptions.defaults().withAtomicReplace(true));

		try {
			file.write("value");
			Assert.fail("A non-empty directory must not be replaced.");
		} catch (FileAccessException expected) {
			// expected
		}

		Assert.assertEquals(Collections.singletonList("occupied"), list(directory));
	}

	private static String read(Path path) throws Exception {
		return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
	}

	private static List<String> list(Path directory) throws Exception {
		try (Stream<Path> files = Files.list(directory)) {
			return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
		}
	}
}
