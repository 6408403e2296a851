package com.jeffdisher.blobstore.blobs;

import java.util.List;

import com.jeffdisher.blobstore.caches.CacheRegistry;
import com.jeffdisher.blobstore.caches.TtlCache;
import com.jeffdisher.blobstore.scheduler.FutureRead;
import com.jeffdisher.blobstore.store.Table;
import com.jeffdisher.blobstore.store.TableWriter;
import com.jeffdisher.blobstore.types.BackingStoreException;
import com.jeffdisher.blobstore.types.Column;
import com.jeffdisher.blobstore.types.ColumnType;
import com.jeffdisher.blobstore.types.CorruptRowException;
import com.jeffdisher.blobstore.types.ILogger;
import com.jeffdisher.blobstore.types.Segment;
import com.jeffdisher.blobstore.types.TableSchema;
import com.jeffdisher.blobstore.types.Where;


/**
 * Blob segments by (blobId, index), backed by the "BlobSegmentById" table and fronted by the "blob_segments" cache.
 * setSegment() only touches the cache:  segments reach the table exclusively through SegmentWriteBack, when the cache
 * evicts or flushes them.
 */
public class SegmentStore
{
	public static final String CACHE_NAME = "blob_segments";
	public static final String TABLE_NAME = "BlobSegmentById";

	public static final String COLUMN_BLOB_ID = "blobid";
	public static final String COLUMN_SEGMENT_INDEX = "segmentindex";
	public static final String COLUMN_BUFFER = "buffer";

	/**
	 * Describes the segment table:  the partition key is (blobid, segmentindex).
	 * 
	 * @param keyspace The keyspace.
	 * @param tablePrefix Prepended to the table name (can be empty).
	 * @return The schema.
	 */
	public static TableSchema createSchema(String keyspace, String tablePrefix)
	{
		return new TableSchema(keyspace, tablePrefix + TABLE_NAME, List.of(
				new Column(COLUMN_BLOB_ID, "ascii", ColumnType.PARTITION_KEY),
				new Column(COLUMN_SEGMENT_INDEX, "int", ColumnType.PARTITION_KEY),
				new Column(COLUMN_BUFFER, "blob", ColumnType.DATA_COLUMN)
		));
	}


	private final Table _table;
	private final TtlCache<Segment> _cache;

	public SegmentStore(CacheRegistry registry, Table table, TableWriter writer, ILogger logger, long ttlMillis, long sweepIntervalMillis)
	{
		_table = table;
		_cache = registry.createCache(CACHE_NAME, ttlMillis, sweepIntervalMillis, new SegmentWriteBack(writer, logger));
	}

	/**
	 * Starts loading a segment.  A cached segment is returned in an already-completed future.  Otherwise, the row is
	 * read on a scheduler thread and the decoded segment is inserted with setOrGet(), so concurrent loads of the same
	 * segment converge on one cached instance.
	 * 
	 * @param blobId The blob id.
	 * @param index The segment index.
	 * @return The future segment (resolves to null if there is no such row).
	 */
	public FutureRead<Segment> loadSegment(String blobId, int index)
	{
		String key = Segment.cacheKey(blobId, index);
		Segment cached = _cache.get(key);
		FutureRead<Segment> future;
		if (null != cached)
		{
			future = FutureRead.completed(cached);
		}
		else
		{
			String tableName = _table.getSchema().name();
			future = _table.selectOne(List.of(COLUMN_BUFFER), _key(blobId, index), (row) -> {
				Segment segment = null;
				if (null != row)
				{
					byte[] buffer = row.getBytes(COLUMN_BUFFER);
					if (null == buffer)
					{
						throw new CorruptRowException(tableName, "segment " + key + " has no buffer", null);
					}
					segment = _cache.setOrGet(key, new Segment(blobId, index, buffer, false));
				}
				return segment;
			});
		}
		return future;
	}

	/**
	 * Reads a segment, blocking until it is available.
	 * 
	 * @param blobId The blob id.
	 * @param index The segment index.
	 * @return The segment or null, if it doesn't exist.
	 * @throws BackingStoreException The segment couldn't be read.
	 */
	public Segment getSegment(String blobId, int index) throws BackingStoreException
	{
		return loadSegment(blobId, index).get();
	}

	/**
	 * Marks the segment dirty and puts it in the cache (replacing whatever was there).  Nothing is written to the
	 * backing store here.
	 * 
	 * @param segment The segment.
	 */
	public void setSegment(Segment segment)
	{
		segment.markDirty();
		_cache.set(segment.getCacheKey(), segment);
	}

	/**
	 * Removes a segment:  any cached copy is discarded without write-back and the row is deleted.
	 * This assumes nothing is still writing the blob.
	 * 
	 * @param blobId The blob id.
	 * @param index The segment index.
	 * @throws BackingStoreException The row couldn't be deleted.
	 */
	public void remove(String blobId, int index) throws BackingStoreException
	{
		_cache.delete(Segment.cacheKey(blobId, index));
		_table.delete(_key(blobId, index)).get();
	}


	private static List<Where> _key(String blobId, int index)
	{
		return List.of(new Where(COLUMN_BLOB_ID, blobId), new Where(COLUMN_SEGMENT_INDEX, index));
	}
}
