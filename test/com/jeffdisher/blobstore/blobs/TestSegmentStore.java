package com.jeffdisher.blobstore.blobs;

import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.blobstore.testutils.MemoryBackingStore;
import com.jeffdisher.blobstore.types.BackingStoreException;
import com.jeffdisher.blobstore.types.Row;
import com.jeffdisher.blobstore.types.Segment;
import com.jeffdisher.blobstore.types.Where;


public class TestSegmentStore
{
	private static final String BLOB_ID = "0123456789abcdef0123456789abcdef";

	@Test
	public void testMissing() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), 4);
		Assert.assertNull(harness.segments.getSegment(BLOB_ID, 0));
	}

	@Test
	public void testWrittenOnlyOnExpiry() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), 4);
		Segment segment = new Segment(BLOB_ID, 0, new byte[] {1, 2, 3}, false);
		harness.segments.setSegment(segment);
		Assert.assertTrue(segment.isDirty());
		Assert.assertEquals(0, harness.backing.getUpsertCount());
		Assert.assertSame(segment, harness.segments.getSegment(BLOB_ID, 0));

		harness.now.addAndGet(StoreHarness.SEGMENT_TTL_MILLIS);
		Assert.assertEquals(1, harness.registry.sweepAll());
		Assert.assertEquals(1, harness.backing.getUpsertCount());
		Assert.assertFalse(segment.isDirty());
		Row row = harness.backing.peek(StoreHarness.SEGMENT_SCHEMA, _key(0));
		Assert.assertArrayEquals(new byte[] {1, 2, 3}, row.getBytes(SegmentStore.COLUMN_BUFFER));
	}

	@Test
	public void testReadOnlySegmentNotWritten() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), 4);
		harness.backing.upsert(StoreHarness.SEGMENT_SCHEMA, Map.of(SegmentStore.COLUMN_BUFFER, new byte[] {9, 9}), _key(0));
		int upserts = harness.backing.getUpsertCount();

		Segment segment = harness.segments.getSegment(BLOB_ID, 0);
		Assert.assertFalse(segment.isDirty());
		Assert.assertEquals(2, segment.length());
		// A second read is a cache hit.
		int selects = harness.backing.getSelectCount();
		Assert.assertSame(segment, harness.segments.getSegment(BLOB_ID, 0));
		Assert.assertEquals(selects, harness.backing.getSelectCount());

		harness.expireAll();
		Assert.assertEquals(upserts, harness.backing.getUpsertCount());
	}

	@Test
	public void testFailedWriteRearmed() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), 4);
		harness.registry.start();
		harness.backing.setFailWrites(true);
		Segment segment = new Segment(BLOB_ID, 1, new byte[] {5, 6}, false);
		harness.segments.setSegment(segment);
		harness.now.addAndGet(StoreHarness.SEGMENT_TTL_MILLIS);
		Assert.assertEquals(1, harness.registry.sweepAll());
		Assert.assertTrue(harness.logger.didErrorOccur());
		Assert.assertTrue(segment.isDirty());
		int selects = harness.backing.getSelectCount();
		Assert.assertSame(segment, harness.segments.getSegment(BLOB_ID, 1));
		Assert.assertEquals(selects, harness.backing.getSelectCount());

		harness.backing.setFailWrites(false);
		harness.now.addAndGet(StoreHarness.SEGMENT_TTL_MILLIS);
		Assert.assertEquals(1, harness.registry.sweepAll());
		Assert.assertNotNull(harness.backing.peek(StoreHarness.SEGMENT_SCHEMA, _key(1)));
		Assert.assertFalse(segment.isDirty());
		harness.registry.stop();
	}

	@Test
	public void testFailureDuringStopIsLost() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), 4);
		harness.registry.start();
		harness.segments.setSegment(new Segment(BLOB_ID, 0, new byte[] {1}, false));
		harness.backing.setFailWrites(true);
		harness.registry.stop();
		Assert.assertTrue(harness.logger.didErrorOccur());
		Assert.assertEquals(0, harness.backing.rowCount(StoreHarness.SEGMENT_SCHEMA));
	}

	@Test
	public void testStopFlushes() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), 4);
		harness.registry.start();
		for (int i = 0; i < 3; ++i)
		{
			harness.segments.setSegment(new Segment(BLOB_ID, i, new byte[] {(byte) i}, false));
		}
		harness.registry.stop();
		Assert.assertEquals(3, harness.backing.rowCount(StoreHarness.SEGMENT_SCHEMA));
		Assert.assertFalse(harness.logger.didErrorOccur());
	}

	@Test
	public void testRemoveDiscardsCached() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), 4);
		harness.backing.upsert(StoreHarness.SEGMENT_SCHEMA, Map.of(SegmentStore.COLUMN_BUFFER, new byte[] {1}), _key(0));
		Segment segment = harness.segments.getSegment(BLOB_ID, 0);
		segment.write(0, new byte[] {2}, 0, 1);
		harness.segments.setSegment(segment);
		harness.segments.remove(BLOB_ID, 0);
		harness.expireAll();
		Assert.assertEquals(0, harness.backing.rowCount(StoreHarness.SEGMENT_SCHEMA));
		Assert.assertNull(harness.segments.getSegment(BLOB_ID, 0));
	}

	@Test
	public void testLoadFailure() throws Throwable
	{
		StoreHarness harness = new StoreHarness(new MemoryBackingStore(), 4);
		harness.backing.failNextReads(1);
		try
		{
			harness.segments.getSegment(BLOB_ID, 0);
			Assert.fail();
		}
		catch (BackingStoreException e)
		{
			// Expected.
		}
		Assert.assertNull(harness.segments.getSegment(BLOB_ID, 0));
	}


	private static List<Where> _key(int index)
	{
		return List.of(new Where(SegmentStore.COLUMN_BLOB_ID, BLOB_ID), new Where(SegmentStore.COLUMN_SEGMENT_INDEX, index));
	}
}
