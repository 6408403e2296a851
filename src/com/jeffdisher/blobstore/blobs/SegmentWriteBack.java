package com.jeffdisher.blobstore.blobs;

import java.util.List;
import java.util.Map;

import com.jeffdisher.blobstore.caches.ICacheListener;
import com.jeffdisher.blobstore.caches.TtlCache;
import com.jeffdisher.blobstore.store.TableWriter;
import com.jeffdisher.blobstore.types.BackingStoreException;
import com.jeffdisher.blobstore.types.ILogger;
import com.jeffdisher.blobstore.types.Segment;
import com.jeffdisher.blobstore.types.Where;


/**
 * The write-back path of the "blob_segments" cache:  the only code which writes segment rows.
 * A segment which isn't dirty (it was only fetched for reading) is never written.  A failed write marks the segment
 * dirty again and re-arms it in the cache, unless the registry is stopping, in which case the data is lost and logged.
 */
public class SegmentWriteBack implements ICacheListener<Segment>
{
	private final TableWriter _writer;
	private final ILogger _logger;

	public SegmentWriteBack(TableWriter writer, ILogger logger)
	{
		_writer = writer;
		_logger = logger;
	}

	@Override
	public void valueExpired(TtlCache<Segment> cache, String key, Segment segment, long expiresAt)
	{
		byte[] buffer = segment.takeDirtyBuffer();
		if (null != buffer)
		{
			try
			{
				_writer.upsert(Map.of(SegmentStore.COLUMN_BUFFER, buffer), List.of(
						new Where(SegmentStore.COLUMN_BLOB_ID, segment.getBlobId()),
						new Where(SegmentStore.COLUMN_SEGMENT_INDEX, segment.getIndex())
				)).get();
				_logger.logVerbose("Wrote segment " + key + " (" + buffer.length + " bytes)");
			}
			catch (BackingStoreException e)
			{
				segment.markDirty();
				if (cache.isOwnerRunning())
				{
					_logger.logError("Error updating segment " + key + " in the backing store (will retry): " + e.getLocalizedMessage());
					cache.setOrGet(key, segment);
				}
				else
				{
					_logger.logError("Error updating segment " + key + " in the backing store during shutdown (data lost): " + e.getLocalizedMessage());
				}
			}
		}
	}
}
