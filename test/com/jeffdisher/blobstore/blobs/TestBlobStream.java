package com.jeffdisher.blobstore.blobs;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.eclipsesource.json.JsonObject;
import com.jeffdisher.blobstore.testutils.MemoryBackingStore;
import com.jeffdisher.blobstore.types.BackingStoreException;
import com.jeffdisher.blobstore.types.Blob;
import com.jeffdisher.blobstore.types.BlobConflictException;
import com.jeffdisher.blobstore.types.StreamFailedException;
import com.jeffdisher.blobstore.types.Where;


public class TestBlobStream
{
	private static final int SEGMENT_LENGTH = 4;
	private static final byte[] VIDEO = new byte[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};

	@Test
	public void testRoundTripSizes() throws Throwable
	{
		MemoryBackingStore backing = new MemoryBackingStore();
		StoreHarness writer = new StoreHarness(backing, SEGMENT_LENGTH);
		int[] sizes = new int[] {0, 1, SEGMENT_LENGTH - 1, SEGMENT_LENGTH, SEGMENT_LENGTH + 1, (3 * SEGMENT_LENGTH) + 7};
		for (int size : sizes)
		{
			byte[] data = _pattern(size);
			BlobStream stream = writer.blobStore.createStream("blob" + size);
			stream.write(data);
			stream.close();
			Blob blob = stream.getBlob();
			Assert.assertEquals(size, blob.getLength());
			Assert.assertEquals((size + SEGMENT_LENGTH - 1) / SEGMENT_LENGTH, blob.getSegmentCount());

			// Read back through the caches of the writer.
			Assert.assertArrayEquals(data, _readAll(writer.blobStore.openStream("blob" + size)));
		}

		// Read back everything from the backing store, through fresh caches.
		writer.expireAll();
		StoreHarness reader = new StoreHarness(backing, SEGMENT_LENGTH);
		for (int size : sizes)
		{
			Assert.assertArrayEquals(_pattern(size), _readAll(reader.blobStore.openStream("blob" + size)));
		}
		Assert.assertFalse(writer.logger.didErrorOccur());
		Assert.assertFalse(reader.logger.didErrorOccur());
	}

	@Test
	public void testVideoScenario() throws Throwable
	{
		MemoryBackingStore backing = new MemoryBackingStore();
		StoreHarness harness = new StoreHarness(backing, 1024);
		BlobStream stream = harness.blobStore.createStream("video", 1, SEGMENT_LENGTH);
		Assert.assertTrue(stream.isAlive());
		stream.write(VIDEO, 0, 3);
		stream.write(VIDEO, 3, 7);
		stream.close();
		Assert.assertFalse(stream.isAlive());

		Blob blob = harness.blobStore.getBlob("video", 1);
		Assert.assertEquals(10L, blob.getLength());
		Assert.assertEquals(3, blob.getSegmentCount());
		Assert.assertEquals(SEGMENT_LENGTH, blob.getSegmentLength());
		Assert.assertEquals(32, blob.getBlobId().length());

		// Only the metadata was written so far:  segments wait for the cache to expire them.
		Assert.assertEquals(1, backing.getUpsertCount());
		harness.expireAll();
		Assert.assertEquals(4, backing.getUpsertCount());
		byte[] last = backing.peek(StoreHarness.SEGMENT_SCHEMA, List.of(
				new Where(SegmentStore.COLUMN_BLOB_ID, blob.getBlobId()),
				new Where(SegmentStore.COLUMN_SEGMENT_INDEX, 2)
		)).getBytes(SegmentStore.COLUMN_BUFFER);
		Assert.assertArrayEquals(new byte[] {9, 10}, last);

		Assert.assertArrayEquals(VIDEO, _readAll(harness.blobStore.openStream("video", 1)));
	}

	@Test
	public void testSeek() throws Throwable
	{
		MemoryBackingStore backing = new MemoryBackingStore();
		StoreHarness writer = new StoreHarness(backing, SEGMENT_LENGTH);
		BlobStream stream = writer.blobStore.createStream("video", 1);
		stream.write(VIDEO);
		stream.close();
		writer.expireAll();

		StoreHarness reader = new StoreHarness(backing, SEGMENT_LENGTH);
		BlobStream seeking = reader.blobStore.openStream("video", 1);
		Assert.assertFalse(seeking.seek(10L));
		Assert.assertFalse(seeking.seek(-1L));
		Assert.assertTrue(seeking.seek(6L));
		Assert.assertArrayEquals(new byte[] {7, 8, 9, 10}, _readAll(seeking));

		BlobStream last = reader.blobStore.openStream("video");
		Assert.assertTrue(last.seek(9L));
		Assert.assertArrayEquals(new byte[] {10}, _readAll(last));
	}

	@Test
	public void testReadsStopAtSegmentBoundaries() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), SEGMENT_LENGTH);
		BlobStream stream = harness.blobStore.createStream("video");
		stream.write(VIDEO);
		stream.close();

		BlobStream reading = harness.blobStore.openStream("video");
		byte[] buffer = new byte[100];
		Assert.assertEquals(4, reading.read(buffer, 0, buffer.length));
		Assert.assertEquals(4, reading.read(buffer, 4, buffer.length - 4));
		Assert.assertEquals(2, reading.read(buffer, 8, buffer.length - 8));
		Assert.assertEquals(-1, reading.read(buffer, 10, buffer.length - 10));
		Assert.assertFalse(reading.isAlive());
		reading.close();
	}

	@Test
	public void testThrottle() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), SEGMENT_LENGTH);
		BlobStream stream = harness.blobStore.createStream("slow");
		stream.write(new byte[] {1, 2, 3, 4, 5});
		stream.close();

		BlobStream reading = harness.blobStore.openStream("slow");
		reading.setBytesPerSecond(3);
		byte[] buffer = new byte[10];
		long start = System.currentTimeMillis();
		Assert.assertEquals(3, reading.read(buffer, 0, buffer.length));
		Assert.assertEquals(1, reading.read(buffer, 3, buffer.length - 3));
		long elapsed = System.currentTimeMillis() - start;
		Assert.assertTrue(elapsed >= 900L);
		Assert.assertEquals(1, reading.read(buffer, 4, buffer.length - 4));
		Assert.assertEquals(-1, reading.read(buffer, 5, buffer.length - 5));
		Assert.assertArrayEquals(new byte[] {1, 2, 3, 4, 5}, Arrays.copyOf(buffer, 5));
	}

	@Test
	public void testCloseCancelsThrottle() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), SEGMENT_LENGTH);
		BlobStream stream = harness.blobStore.createStream("slow");
		stream.write(VIDEO);
		stream.close();

		BlobStream reading = harness.blobStore.openStream("slow");
		reading.setBytesPerSecond(2);
		byte[] buffer = new byte[10];
		Assert.assertEquals(2, reading.read(buffer, 0, buffer.length));
		Thread closer = new Thread(() -> {
			try
			{
				Thread.sleep(100L);
				reading.close();
			}
			catch (Exception e)
			{
				throw new AssertionError(e);
			}
		});
		long start = System.currentTimeMillis();
		closer.start();
		Assert.assertEquals(-1, reading.read(buffer, 2, buffer.length - 2));
		long elapsed = System.currentTimeMillis() - start;
		closer.join();
		Assert.assertTrue(elapsed < BlobStream.THROTTLE_DELAY_MILLIS);
	}

	@Test
	public void testFetchFailure() throws Throwable
	{
		MemoryBackingStore backing = new MemoryBackingStore();
		StoreHarness writer = new StoreHarness(backing, SEGMENT_LENGTH);
		BlobStream stream = writer.blobStore.createStream("video");
		stream.write(VIDEO);
		stream.close();
		writer.expireAll();

		StoreHarness reader = new StoreHarness(backing, SEGMENT_LENGTH);
		BlobStream reading = reader.blobStore.openStream("video");
		List<StreamFailedException> reported = new ArrayList<>();
		reading.setErrorListener((BlobStream failed, StreamFailedException error) -> {
			Assert.assertSame(reading, failed);
			reported.add(error);
		});
		backing.setFailReads(true);
		byte[] buffer = new byte[10];
		try
		{
			reading.read(buffer, 0, buffer.length);
			Assert.fail();
		}
		catch (StreamFailedException e)
		{
			Assert.assertTrue(e.getCause() instanceof BackingStoreException);
		}
		Assert.assertFalse(reading.isAlive());
		Assert.assertNotNull(reading.getError());
		Assert.assertEquals(1, reported.size());
		Assert.assertTrue(reader.logger.didErrorOccur());

		// The stream stays failed, even once the store recovers, and the listener isn't called again.
		backing.setFailReads(false);
		try
		{
			reading.read(buffer, 0, buffer.length);
			Assert.fail();
		}
		catch (StreamFailedException e)
		{
			Assert.assertSame(reading.getError(), e.getCause());
		}
		Assert.assertEquals(1, reported.size());

		// Other streams are unaffected.
		Assert.assertArrayEquals(VIDEO, _readAll(reader.blobStore.openStream("video")));
	}

	@Test
	public void testFinalizeFailure() throws Throwable
	{
		MemoryBackingStore backing = new MemoryBackingStore();
		StoreHarness harness = new StoreHarness(backing, SEGMENT_LENGTH);
		BlobStream stream = harness.blobStore.createStream("video", 1);
		List<StreamFailedException> reported = new ArrayList<>();
		stream.setErrorListener((BlobStream failed, StreamFailedException error) -> reported.add(error));
		stream.write(VIDEO);
		backing.setFailWrites(true);
		try
		{
			stream.close();
			Assert.fail();
		}
		catch (StreamFailedException e)
		{
			Assert.assertTrue(e.getCause() instanceof BackingStoreException);
		}
		Assert.assertFalse(stream.isAlive());
		Assert.assertSame(stream.getError(), reported.get(0));
		Assert.assertEquals(1, reported.size());
		Assert.assertEquals(0, backing.rowCount(StoreHarness.METADATA_SCHEMA));

		// Closing again does nothing.
		stream.close();
		Assert.assertEquals(1, reported.size());
	}

	@Test
	public void testOverwriteFetchFailure() throws Throwable
	{
		MemoryBackingStore backing = new MemoryBackingStore();
		StoreHarness writer = new StoreHarness(backing, SEGMENT_LENGTH);
		BlobStream stream = writer.blobStore.createStream("video", 1);
		stream.write(VIDEO);
		stream.close();
		writer.expireAll();

		StoreHarness other = new StoreHarness(backing, SEGMENT_LENGTH);
		BlobStream overwrite = other.blobStore.openStream("video", 1);
		List<StreamFailedException> reported = new ArrayList<>();
		overwrite.setErrorListener((BlobStream failed, StreamFailedException error) -> reported.add(error));
		backing.setFailReads(true);
		try
		{
			overwrite.write(new byte[] {-1, -2});
			Assert.fail();
		}
		catch (StreamFailedException e)
		{
			Assert.assertTrue(e.getCause() instanceof BackingStoreException);
		}
		Assert.assertFalse(overwrite.isAlive());
		Assert.assertEquals(1, reported.size());
		Assert.assertTrue(other.logger.didErrorOccur());

		// Later writes are refused and closing writes nothing.
		backing.setFailReads(false);
		try
		{
			overwrite.write(new byte[] {-3});
			Assert.fail();
		}
		catch (StreamFailedException e)
		{
			Assert.assertSame(overwrite.getError(), e.getCause());
		}
		int upserts = backing.getUpsertCount();
		overwrite.close();
		other.expireAll();
		Assert.assertEquals(upserts, backing.getUpsertCount());
		Assert.assertEquals(1, reported.size());
		Assert.assertArrayEquals(VIDEO, _readAll(other.blobStore.openStream("video", 1)));
	}

	@Test
	public void testMissingSegment() throws Throwable
	{
		MemoryBackingStore backing = new MemoryBackingStore();
		StoreHarness writer = new StoreHarness(backing, SEGMENT_LENGTH);
		BlobStream stream = writer.blobStore.createStream("video", 1);
		stream.write(VIDEO);
		stream.close();
		writer.expireAll();
		backing.delete(StoreHarness.SEGMENT_SCHEMA, List.of(
				new Where(SegmentStore.COLUMN_BLOB_ID, stream.getBlob().getBlobId()),
				new Where(SegmentStore.COLUMN_SEGMENT_INDEX, 1)
		));

		StoreHarness reader = new StoreHarness(backing, SEGMENT_LENGTH);
		BlobStream reading = reader.blobStore.openStream("video", 1);
		byte[] buffer = new byte[10];
		Assert.assertEquals(4, reading.read(buffer, 0, buffer.length));
		try
		{
			reading.read(buffer, 4, buffer.length - 4);
			Assert.fail();
		}
		catch (StreamFailedException e)
		{
			Assert.assertEquals("Unexpected end of stream segments in 'video v1'", e.getMessage());
		}
		Assert.assertFalse(reading.isAlive());
	}

	@Test
	public void testConflict() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), SEGMENT_LENGTH);
		BlobStream stream = harness.blobStore.createStream("video", 1);
		stream.write(VIDEO);
		stream.close();
		try
		{
			harness.blobStore.createStream("video", 1);
			Assert.fail();
		}
		catch (BlobConflictException e)
		{
			Assert.assertEquals("video", e.name);
			Assert.assertEquals(1, e.version);
		}
	}

	@Test
	public void testAutoIncrement() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), SEGMENT_LENGTH);
		BlobStream first = harness.blobStore.createStream("video");
		Assert.assertEquals(1, first.getBlob().getVersion());
		first.write("first");
		first.close();
		BlobStream explicit = harness.blobStore.createStream("video", 5);
		explicit.write("fifth");
		explicit.close();
		BlobStream next = harness.blobStore.createStreamWithSegmentLength("video", 2);
		Assert.assertEquals(6, next.getBlob().getVersion());
		Assert.assertEquals(2, next.getBlob().getSegmentLength());
		next.write("sixth");
		next.close();

		Assert.assertEquals(3, harness.blobStore.getBlobs("video").size());
		Assert.assertEquals("sixth", new String(_readAll(harness.blobStore.openStream("video")), StandardCharsets.UTF_8));
		Assert.assertEquals("first", new String(_readAll(harness.blobStore.openStream("video", 1)), StandardCharsets.UTF_8));
	}

	@Test
	public void testEmptyBlob() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), SEGMENT_LENGTH);
		harness.blobStore.createStream("empty").close();
		Blob blob = harness.blobStore.getBlob("empty");
		Assert.assertEquals(0L, blob.getLength());
		Assert.assertEquals(0, blob.getSegmentCount());
		BlobStream reading = harness.blobStore.openStream("empty");
		Assert.assertFalse(reading.seek(0L));
		Assert.assertEquals(-1, reading.read(new byte[4], 0, 4));
	}

	@Test
	public void testOpenMissing() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), SEGMENT_LENGTH);
		Assert.assertNull(harness.blobStore.openStream("nothing"));
		Assert.assertNull(harness.blobStore.openStream("nothing", 3));
		// A created stream which was never closed doesn't exist yet.
		harness.blobStore.createStream("pending").write(VIDEO);
		Assert.assertNull(harness.blobStore.openStream("pending"));
	}

	@Test
	public void testWriteAfterClose() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), SEGMENT_LENGTH);
		BlobStream stream = harness.blobStore.createStream("video");
		stream.write(VIDEO);
		stream.close();
		Assert.assertFalse(harness.logger.didErrorOccur());
		stream.write(VIDEO);
		stream.close();
		Assert.assertTrue(harness.logger.didErrorOccur());
		Assert.assertEquals(10L, harness.blobStore.getBlob("video").getLength());
	}

	@Test(expected = IllegalStateException.class)
	public void testMixedDirections() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), SEGMENT_LENGTH);
		BlobStream stream = harness.blobStore.createStream("video");
		stream.write(VIDEO);
		stream.read(new byte[4], 0, 4);
	}

	@Test
	public void testOverwriteExistingVersion() throws Throwable
	{
		MemoryBackingStore backing = new MemoryBackingStore();
		StoreHarness harness = new StoreHarness(backing, SEGMENT_LENGTH);
		BlobStream stream = harness.blobStore.createStream("video", 1);
		stream.write(VIDEO);
		stream.close();
		harness.expireAll();

		BlobStream overwrite = harness.blobStore.openStream("video", 1);
		overwrite.write(new byte[] {-1, -2, -3, -4, -5});
		overwrite.close();
		Blob blob = harness.blobStore.getBlob("video", 1);
		Assert.assertEquals(10L, blob.getLength());
		Assert.assertEquals(3, blob.getSegmentCount());
		Assert.assertArrayEquals(new byte[] {-1, -2, -3, -4, -5, 6, 7, 8, 9, 10}, _readAll(harness.blobStore.openStream("video", 1)));
	}

	@Test
	public void testJavaStreamAdapters() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), SEGMENT_LENGTH);
		byte[] data = _pattern(37);
		try (OutputStream output = harness.blobStore.createStream("adapted").asOutputStream())
		{
			output.write(data, 0, 20);
			output.write(data[20]);
			output.write(data, 21, 16);
		}
		try (InputStream input = harness.blobStore.openStream("adapted").asInputStream())
		{
			Assert.assertEquals(Byte.toUnsignedInt(data[0]), input.read());
			byte[] rest = input.readAllBytes();
			Assert.assertArrayEquals(Arrays.copyOfRange(data, 1, data.length), rest);
			Assert.assertEquals(-1, input.read());
		}
	}

	@Test
	public void testPipeTo() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), SEGMENT_LENGTH);
		BlobStream stream = harness.blobStore.createStream("piped");
		stream.write("Some text which spans several segments");
		stream.close();
		ByteArrayOutputStream output = new ByteArrayOutputStream();
		BlobStream reading = harness.blobStore.openStream("piped");
		Assert.assertEquals(38L, reading.pipeTo(output));
		Assert.assertEquals("Some text which spans several segments", output.toString(StandardCharsets.UTF_8));
		Assert.assertFalse(reading.isAlive());
	}

	@Test
	public void testMetadataPersisted() throws Throwable
	{
		MemoryBackingStore backing = new MemoryBackingStore();
		StoreHarness writer = new StoreHarness(backing, SEGMENT_LENGTH);
		JsonObject metadata = new JsonObject().add("type", "video/mp4").add("width", 640);
		BlobStream stream = writer.blobStore.createStream("video", null, SEGMENT_LENGTH, metadata);
		stream.write(VIDEO);
		stream.close();
		long createdSeconds = writer.now.get() / 1000L;
		writer.expireAll();

		StoreHarness reader = new StoreHarness(backing, SEGMENT_LENGTH);
		Blob blob = reader.blobStore.getBlob("video");
		Assert.assertEquals("video/mp4", blob.getMetadata().getString("type", null));
		Assert.assertEquals(640, blob.getMetadata().getInt("width", 0));
		Assert.assertEquals(createdSeconds, blob.getTimeCreated());
	}

	@Test
	public void testRemoveBlob() throws Throwable
	{
		MemoryBackingStore backing = new MemoryBackingStore();
		StoreHarness harness = new StoreHarness(backing, SEGMENT_LENGTH);
		BlobStream first = harness.blobStore.createStream("video");
		first.write(VIDEO);
		first.close();
		harness.expireAll();
		BlobStream second = harness.blobStore.createStream("video");
		second.write(VIDEO);
		second.close();
		Assert.assertEquals(3, backing.rowCount(StoreHarness.SEGMENT_SCHEMA));

		List<Blob> removed = harness.blobStore.removeBlob("video");
		Assert.assertEquals(2, removed.size());
		// The cached segments of the second version must not be written back later.
		harness.expireAll();
		Assert.assertEquals(0, backing.rowCount(StoreHarness.SEGMENT_SCHEMA));
		Assert.assertEquals(0, backing.rowCount(StoreHarness.METADATA_SCHEMA));
		Assert.assertNull(harness.blobStore.openStream("video"));
	}

	@Test
	public void testRemoveVersion() throws Throwable
	{
		MemoryBackingStore backing = new MemoryBackingStore();
		StoreHarness harness = new StoreHarness(backing, SEGMENT_LENGTH);
		for (int i = 0; i < 2; ++i)
		{
			BlobStream stream = harness.blobStore.createStream("video");
			stream.write(VIDEO);
			stream.close();
		}
		harness.expireAll();
		Assert.assertEquals(6, backing.rowCount(StoreHarness.SEGMENT_SCHEMA));
		Assert.assertEquals(2, harness.blobStore.removeBlob("video", 2).getVersion());
		Assert.assertNull(harness.blobStore.removeBlob("video", 2));
		Assert.assertEquals(3, backing.rowCount(StoreHarness.SEGMENT_SCHEMA));
		Assert.assertArrayEquals(VIDEO, _readAll(harness.blobStore.openStream("video")));
	}


	private static byte[] _pattern(int size)
	{
		byte[] data = new byte[size];
		for (int i = 0; i < size; ++i)
		{
			data[i] = (byte) (i * 7 + 3);
		}
		return data;
	}

	private static byte[] _readAll(BlobStream stream) throws Throwable
	{
		ByteArrayOutputStream output = new ByteArrayOutputStream();
		stream.pipeTo(output);
		return output.toByteArray();
	}
}
