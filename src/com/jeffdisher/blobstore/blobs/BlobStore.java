package com.jeffdisher.blobstore.blobs;

import java.util.List;
import java.util.UUID;
import java.util.function.LongSupplier;

import com.eclipsesource.json.JsonObject;
import com.jeffdisher.blobstore.types.BackingStoreException;
import com.jeffdisher.blobstore.types.Blob;
import com.jeffdisher.blobstore.types.BlobConflictException;
import com.jeffdisher.blobstore.types.ILogger;
import com.jeffdisher.blobstore.utils.Assert;


/**
 * The entry-point for callers:  opens and creates BlobStreams and exposes the blob metadata operations.
 * Removing a blob removes its segments, too.
 */
public class BlobStore
{
	public static final int DEFAULT_SEGMENT_LENGTH = 1024 * 1024;

	private final BlobMetadataStore _metadata;
	private final SegmentStore _segments;
	private final ILogger _logger;
	private final LongSupplier _clock;
	private final int _defaultSegmentLength;

	public BlobStore(BlobMetadataStore metadata, SegmentStore segments, ILogger logger, LongSupplier clock, int defaultSegmentLength)
	{
		Assert.assertTrue(defaultSegmentLength > 0);
		_metadata = metadata;
		_segments = segments;
		_logger = logger;
		_clock = clock;
		_defaultSegmentLength = defaultSegmentLength;
	}

	public Blob getBlob(String name) throws BackingStoreException
	{
		return _metadata.getBlob(name);
	}

	public Blob getBlob(String name, int version) throws BackingStoreException
	{
		return _metadata.getBlob(name, version);
	}

	public List<Blob> getBlobs(String name) throws BackingStoreException
	{
		return _metadata.getBlobs(name);
	}

	/**
	 * Removes every version of the blob, with all their segments.
	 *
	 * @param name The blob name.
	 * @return The versions removed (empty if there were none).
	 * @throws BackingStoreException The backing store couldn't be read or modified.
	 */
	public List<Blob> removeBlob(String name) throws BackingStoreException
	{
		List<Blob> removed = _metadata.removeBlob(name);
		for (Blob blob : removed)
		{
			_removeSegments(blob);
		}
		return removed;
	}

	/**
	 * Removes one version of the blob, with its segments.
	 *
	 * @param name The blob name.
	 * @param version The version.
	 * @return The version removed or null, if it didn't exist.
	 * @throws BackingStoreException The backing store couldn't be read or modified.
	 */
	public Blob removeBlob(String name, int version) throws BackingStoreException
	{
		Blob removed = _metadata.removeBlob(name, version);
		if (null != removed)
		{
			_removeSegments(removed);
		}
		return removed;
	}

	/**
	 * Opens the latest version of a blob.
	 *
	 * @param name The blob name.
	 * @return The stream or null, if the blob doesn't exist.
	 * @throws BackingStoreException The metadata couldn't be read.
	 */
	public BlobStream openStream(String name) throws BackingStoreException
	{
		return _open(_metadata.getBlob(name));
	}

	/**
	 * Opens an exact version of a blob.
	 *
	 * @param name The blob name.
	 * @param version The version.
	 * @return The stream or null, if that version doesn't exist.
	 * @throws BackingStoreException The metadata couldn't be read.
	 */
	public BlobStream openStream(String name, int version) throws BackingStoreException
	{
		return _open(_metadata.getBlob(name, version));
	}

	/**
	 * Creates the next version of a blob (1 if there are no versions yet), with the default segment length.
	 */
	public BlobStream createStream(String name) throws BackingStoreException, BlobConflictException
	{
		return createStream(name, null, _defaultSegmentLength, null);
	}

	public BlobStream createStream(String name, int version) throws BackingStoreException, BlobConflictException
	{
		return createStream(name, version, _defaultSegmentLength, null);
	}

	public BlobStream createStream(String name, int version, int segmentLength) throws BackingStoreException, BlobConflictException
	{
		return createStream(name, version, segmentLength, null);
	}

	public BlobStream createStreamWithSegmentLength(String name, int segmentLength) throws BackingStoreException, BlobConflictException
	{
		return createStream(name, null, segmentLength, null);
	}

	/**
	 * Creates a new blob version and returns a stream to write it.  The metadata is only persisted when the stream is
	 * closed (even if nothing was written).
	 *
	 * @param name The blob name.
	 * @param version The exact version to create, or null to use the version after the latest.
	 * @param segmentLength The segment length of this version.
	 * @param metadata The opaque metadata to store with the version (null for none).
	 * @return The stream.
	 * @throws BackingStoreException The existing versions couldn't be read.
	 * @throws BlobConflictException The requested version already exists.
	 */
	public BlobStream createStream(String name, Integer version, int segmentLength, JsonObject metadata) throws BackingStoreException, BlobConflictException
	{
		Assert.assertTrue(segmentLength > 0);
		int resolved;
		if (null != version)
		{
			if (null != _metadata.getBlob(name, version))
			{
				throw new BlobConflictException(name, version);
			}
			resolved = version;
		}
		else
		{
			Blob latest = _metadata.getBlob(name);
			resolved = (null != latest)
					? (latest.getVersion() + 1)
					: 1
			;
		}
		String blobId = UUID.randomUUID().toString().replace("-", "");
		long timeCreated = _clock.getAsLong() / 1000L;
		Blob blob = new Blob(name, resolved, blobId, 0L, 0, segmentLength, timeCreated, (null != metadata) ? new JsonObject(metadata) : null);
		_logger.logVerbose("Creating " + blob);
		return new BlobStream(_metadata, _segments, _logger, blob, true);
	}


	private BlobStream _open(Blob blob)
	{
		return (null != blob)
				? new BlobStream(_metadata, _segments, _logger, blob, false)
				: null
		;
	}

	private void _removeSegments(Blob blob) throws BackingStoreException
	{
		for (int i = 0; i < blob.getSegmentCount(); ++i)
		{
			_segments.remove(blob.getBlobId(), i);
		}
		_logger.logVerbose("Removed " + blob);
	}
}
