package com.jeffdisher.blobstore.blobs;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.jeffdisher.blobstore.caches.ICacheListener;
import com.jeffdisher.blobstore.caches.TtlCache;
import com.jeffdisher.blobstore.store.TableWriter;
import com.jeffdisher.blobstore.types.BackingStoreException;
import com.jeffdisher.blobstore.types.Blob;
import com.jeffdisher.blobstore.types.ILogger;
import com.jeffdisher.blobstore.types.Where;


/**
 * The write-back path of the "blob_by_name" cache:  the only code which writes blob metadata rows.
 * On expiry, every dirty version of the evicted list is upserted.  Versions which fail to write are restored as dirty
 * and the list is re-armed in the cache so the next sweep retries them (as long as the registry is still running).
 */
public class BlobWriteBack implements ICacheListener<VersionList>
{
	private final TableWriter _writer;
	private final ILogger _logger;

	public BlobWriteBack(TableWriter writer, ILogger logger)
	{
		_writer = writer;
		_logger = logger;
	}

	@Override
	public void valueExpired(TtlCache<VersionList> cache, String key, VersionList list, long expiresAt)
	{
		List<Blob> failed = new ArrayList<>();
		for (Blob blob : list.takeDirty())
		{
			try
			{
				persist(blob);
			}
			catch (BackingStoreException e)
			{
				_logger.logError("Error updating blob " + blob + " in the backing store: " + e.getLocalizedMessage());
				failed.add(blob);
			}
		}
		if (!failed.isEmpty())
		{
			rearm(cache, list, failed);
		}
	}

	/**
	 * Writes one version's row (an idempotent upsert keyed by name and version).
	 * 
	 * @param blob The version to write.
	 * @throws BackingStoreException The write failed.
	 */
	public void persist(Blob blob) throws BackingStoreException
	{
		Map<String, Object> values = new HashMap<>();
		values.put(BlobMetadataStore.COLUMN_BLOB_ID, blob.getBlobId());
		values.put(BlobMetadataStore.COLUMN_LENGTH, blob.getLength());
		values.put(BlobMetadataStore.COLUMN_SEGMENT_COUNT, blob.getSegmentCount());
		values.put(BlobMetadataStore.COLUMN_SEGMENT_LENGTH, blob.getSegmentLength());
		values.put(BlobMetadataStore.COLUMN_TIME_CREATED, blob.getTimeCreated());
		values.put(BlobMetadataStore.COLUMN_METADATA, blob.getMetadata().toString());
		_writer.upsert(values, List.of(
				new Where(BlobMetadataStore.COLUMN_NAME, blob.getName()),
				new Where(BlobMetadataStore.COLUMN_VERSION, blob.getVersion())
		)).get();
	}

	/**
	 * Puts failed versions back into the cache as dirty so they are retried on a later sweep.
	 * 
	 * @param cache The metadata cache.
	 * @param list The list the versions came from (possibly no longer in the cache).
	 * @param failed The versions which failed to persist.
	 */
	public void rearm(TtlCache<VersionList> cache, VersionList list, List<Blob> failed)
	{
		list.restoreDirty(failed);
		if (cache.isOwnerRunning())
		{
			VersionList current = cache.setOrGet(list.getName(), list);
			if (current != list)
			{
				current.restoreDirty(failed);
			}
		}
		else
		{
			_logger.logError("Cache is stopping:  " + failed.size() + " version(s) of " + list.getName() + " were not persisted");
		}
	}
}
