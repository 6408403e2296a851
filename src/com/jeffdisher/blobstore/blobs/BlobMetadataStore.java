package com.jeffdisher.blobstore.blobs;

import java.util.ArrayList;
import java.util.List;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.ParseException;
import com.jeffdisher.blobstore.caches.CacheRegistry;
import com.jeffdisher.blobstore.caches.TtlCache;
import com.jeffdisher.blobstore.scheduler.IRowDecoder;
import com.jeffdisher.blobstore.store.Table;
import com.jeffdisher.blobstore.store.TableWriter;
import com.jeffdisher.blobstore.types.BackingStoreException;
import com.jeffdisher.blobstore.types.Blob;
import com.jeffdisher.blobstore.types.Column;
import com.jeffdisher.blobstore.types.ColumnType;
import com.jeffdisher.blobstore.types.CorruptRowException;
import com.jeffdisher.blobstore.types.ILogger;
import com.jeffdisher.blobstore.types.Row;
import com.jeffdisher.blobstore.types.TableSchema;
import com.jeffdisher.blobstore.types.Where;


/**
 * Blob descriptors by (name, version), backed by the "BlobByName" table and fronted by the "blob_by_name" cache.
 * The cache holds one VersionList per name.  Reads are cache-first; writes update the cached list and are persisted
 * through the cache's write-back listener (immediately, for setBlob, and again on expiry if that failed).
 * Not-found is always reported as null.  Failures of the backing store propagate to the caller.
 */
public class BlobMetadataStore
{
	public static final String CACHE_NAME = "blob_by_name";
	public static final String TABLE_NAME = "BlobByName";

	public static final String COLUMN_NAME = "name";
	public static final String COLUMN_VERSION = "version";
	public static final String COLUMN_BLOB_ID = "blobid";
	public static final String COLUMN_LENGTH = "length";
	public static final String COLUMN_SEGMENT_COUNT = "segmentcount";
	public static final String COLUMN_SEGMENT_LENGTH = "segmentlength";
	public static final String COLUMN_TIME_CREATED = "timecreated";
	public static final String COLUMN_METADATA = "metadata";

	private static final List<String> READ_COLUMNS = List.of(COLUMN_NAME
			, COLUMN_VERSION
			, COLUMN_BLOB_ID
			, COLUMN_LENGTH
			, COLUMN_SEGMENT_COUNT
			, COLUMN_SEGMENT_LENGTH
			, COLUMN_TIME_CREATED
			, COLUMN_METADATA
	);

	/**
	 * Describes the metadata table:  partition key = name, cluster key = version.
	 *
	 * @param keyspace The keyspace.
	 * @param tablePrefix Prepended to the table name (can be empty).
	 * @return The schema.
	 */
	public static TableSchema createSchema(String keyspace, String tablePrefix)
	{
		return new TableSchema(keyspace, tablePrefix + TABLE_NAME, List.of(
				new Column(COLUMN_NAME, "ascii", ColumnType.PARTITION_KEY),
				new Column(COLUMN_VERSION, "int", ColumnType.CLUSTER_KEY),
				new Column(COLUMN_BLOB_ID, "ascii", ColumnType.DATA_COLUMN),
				new Column(COLUMN_LENGTH, "bigint", ColumnType.DATA_COLUMN),
				new Column(COLUMN_SEGMENT_COUNT, "int", ColumnType.DATA_COLUMN),
				new Column(COLUMN_SEGMENT_LENGTH, "int", ColumnType.DATA_COLUMN),
				new Column(COLUMN_TIME_CREATED, "bigint", ColumnType.DATA_COLUMN),
				new Column(COLUMN_METADATA, "text", ColumnType.DATA_COLUMN)
		));
	}


	private final Table _table;
	private final ILogger _logger;
	private final BlobWriteBack _writeBack;
	private final TtlCache<VersionList> _cache;
	private final IRowDecoder<Blob> _decoder;

	/**
	 * Creates the store and registers its cache.
	 *
	 * @param registry The registry where the "blob_by_name" cache is created.
	 * @param table The metadata table (reads and deletes).
	 * @param writer The metadata table writer (only used by the write-back listener).
	 * @param logger The logger.
	 * @param ttlMillis The TTL of cached version lists.
	 * @param sweepIntervalMillis The sweep interval of the cache.
	 */
	public BlobMetadataStore(CacheRegistry registry, Table table, TableWriter writer, ILogger logger, long ttlMillis, long sweepIntervalMillis)
	{
		_table = table;
		_logger = logger;
		_writeBack = new BlobWriteBack(writer, logger);
		_cache = registry.createCache(CACHE_NAME, ttlMillis, sweepIntervalMillis, _writeBack);
		String tableName = table.getSchema().name();
		_decoder = (row) -> _decodeRow(tableName, row);
	}

	/**
	 * Finds the latest version of a blob:  the numerically greatest version on record.
	 *
	 * @param name The blob name.
	 * @return A copy of the latest version or null, if there are no versions.
	 * @throws BackingStoreException The backing store couldn't be read.
	 */
	public Blob getBlob(String name) throws BackingStoreException
	{
		return _getCompleteList(name).latest();
	}

	/**
	 * Finds an exact version of a blob.
	 *
	 * @param name The blob name.
	 * @param version The version.
	 * @return A copy of the version or null, if it doesn't exist.
	 * @throws BackingStoreException The backing store couldn't be read.
	 */
	public Blob getBlob(String name, int version) throws BackingStoreException
	{
		Blob blob = null;
		VersionList list = _cache.get(name);
		if (null != list)
		{
			blob = list.get(version);
		}
		if ((null == blob) && ((null == list) || !list.isComplete()))
		{
			Blob stored = _table.selectOne(READ_COLUMNS, List.of(
					new Where(COLUMN_NAME, name),
					new Where(COLUMN_VERSION, version)
			), _decoder).get();
			if (null != stored)
			{
				list = _cache.setOrGet(name, new VersionList(name));
				list.mergeFromStore(List.of(stored), false);
				blob = list.get(version);
			}
		}
		return blob;
	}

	/**
	 * @param name The blob name.
	 * @return Copies of every version of the blob, in ascending version order (never null).
	 * @throws BackingStoreException The backing store couldn't be read.
	 */
	public List<Blob> getBlobs(String name) throws BackingStoreException
	{
		return _getCompleteList(name).all();
	}

	/**
	 * Adds or replaces a version in the cache and persists it.
	 * Calling this twice with the same blob leaves exactly one entry for (name, version) in both the cache and the
	 * table.  If persisting fails, the version stays dirty in the cache (so a later sweep retries) and the failure is
	 * thrown to the caller.
	 *
	 * @param blob The version to store (copied).
	 * @throws BackingStoreException The version couldn't be persisted now.
	 */
	public void setBlob(Blob blob) throws BackingStoreException
	{
		Blob copy = blob.copy();
		VersionList list = _cache.setOrGet(copy.getName(), new VersionList(copy.getName()));
		list.putLocal(copy);
		try
		{
			_writeBack.persist(copy);
			list.markPersisted(copy);
		}
		catch (BackingStoreException e)
		{
			_logger.logError("Error updating blob " + copy + " in the backing store: " + e.getLocalizedMessage());
			_writeBack.rearm(_cache, list, List.of(copy));
			throw e;
		}
	}

	/**
	 * Removes every version of a blob from the cache and the table.
	 * The cached list is discarded without write-back, then each row is deleted individually.
	 *
	 * @param name The blob name.
	 * @return The versions which were removed (so their segments can be removed).
	 * @throws BackingStoreException The backing store couldn't be read or modified.
	 */
	public List<Blob> removeBlob(String name) throws BackingStoreException
	{
		List<Blob> removed = new ArrayList<>();
		List<Blob> stored = _readAll(name);
		VersionList cached = _cache.get(name);
		_cache.delete(name);
		VersionList merged = new VersionList(name);
		if (null != cached)
		{
			merged.mergeFromStore(cached.all(), false);
		}
		merged.mergeFromStore(stored, true);
		for (Blob blob : merged.all())
		{
			_table.delete(List.of(
					new Where(COLUMN_NAME, name),
					new Where(COLUMN_VERSION, blob.getVersion())
			)).get();
			removed.add(blob);
		}
		return removed;
	}

	/**
	 * Removes one version of a blob from the cache and the table.
	 *
	 * @param name The blob name.
	 * @param version The version.
	 * @return The version which was removed or null, if it didn't exist.
	 * @throws BackingStoreException The backing store couldn't be read or modified.
	 */
	public Blob removeBlob(String name, int version) throws BackingStoreException
	{
		Blob existing = getBlob(name, version);
		VersionList list = _cache.get(name);
		if (null != list)
		{
			list.remove(version);
		}
		_table.delete(List.of(
				new Where(COLUMN_NAME, name),
				new Where(COLUMN_VERSION, version)
		)).get();
		return existing;
	}


	private VersionList _getCompleteList(String name) throws BackingStoreException
	{
		VersionList list = _cache.get(name);
		if ((null == list) || !list.isComplete())
		{
			List<Blob> stored = _readAll(name);
			list = _cache.setOrGet(name, new VersionList(name));
			list.mergeFromStore(stored, true);
		}
		return list;
	}

	private List<Blob> _readAll(String name) throws BackingStoreException
	{
		return _table.select(READ_COLUMNS, List.of(new Where(COLUMN_NAME, name)), _decoder).get();
	}

	private static Blob _decodeRow(String tableName, Row row) throws CorruptRowException
	{
		Blob blob = null;
		if (null != row)
		{
			String metadataText = row.getString(COLUMN_METADATA);
			JsonObject metadata;
			try
			{
				metadata = (null != metadataText)
						? Json.parse(metadataText).asObject()
						: new JsonObject()
				;
			}
			catch (ParseException | UnsupportedOperationException e)
			{
				throw new CorruptRowException(tableName, "metadata of " + row.getString(COLUMN_NAME) + " is not a JSON object", e);
			}
			int segmentLength = row.getInt(COLUMN_SEGMENT_LENGTH);
			if (null == row.getString(COLUMN_NAME))
			{
				throw new CorruptRowException(tableName, "missing name", null);
			}
			if (null == row.getString(COLUMN_BLOB_ID))
			{
				throw new CorruptRowException(tableName, "missing blob id", null);
			}
			if (segmentLength <= 0)
			{
				throw new CorruptRowException(tableName, "invalid segment length " + segmentLength, null);
			}
			blob = new Blob(row.getString(COLUMN_NAME)
					, row.getInt(COLUMN_VERSION)
					, row.getString(COLUMN_BLOB_ID)
					, row.getLong(COLUMN_LENGTH)
					, row.getInt(COLUMN_SEGMENT_COUNT)
					, segmentLength
					, row.getLong(COLUMN_TIME_CREATED)
					, metadata
			);
		}
		return blob;
	}
}
