package com.jeffdisher.blobstore.types;

import com.eclipsesource.json.JsonObject;
import com.jeffdisher.blobstore.utils.Assert;


/**
 * The descriptor of one version of a logical blob, keyed by (name, version).
 * Each version has its own freshly-generated blobId so the segment key space never overlaps between versions.
 * The length is only exact once the stream which produced this version has been closed.
 * Instances handed out by the stores are always copies:  a stream mutates its own copy (length, segment count) and
 * only publishes it back through BlobMetadataStore.setBlob().
 */
public class Blob
{
	private final String _name;
	private final int _version;
	private final String _blobId;
	private long _length;
	private int _segmentCount;
	private final int _segmentLength;
	private final long _timeCreated;
	private final JsonObject _metadata;

	public Blob(String name, int version, String blobId, long length, int segmentCount, int segmentLength, long timeCreated, JsonObject metadata)
	{
		Assert.assertTrue(null != name);
		Assert.assertTrue(null != blobId);
		Assert.assertTrue(segmentLength > 0, "segment length of " + name + " is positive");
		_name = name;
		_version = version;
		_blobId = blobId;
		_length = length;
		_segmentCount = segmentCount;
		_segmentLength = segmentLength;
		_timeCreated = timeCreated;
		_metadata = (null != metadata)
				? metadata
				: new JsonObject()
		;
	}

	public String getName()
	{
		return _name;
	}

	public int getVersion()
	{
		return _version;
	}

	public String getBlobId()
	{
		return _blobId;
	}

	public long getLength()
	{
		return _length;
	}

	public void setLength(long length)
	{
		_length = length;
	}

	public int getSegmentCount()
	{
		return _segmentCount;
	}

	public void setSegmentCount(int segmentCount)
	{
		_segmentCount = segmentCount;
	}

	public int getSegmentLength()
	{
		return _segmentLength;
	}

	/**
	 * @return The creation time, in seconds since the epoch.
	 */
	public long getTimeCreated()
	{
		return _timeCreated;
	}

	/**
	 * The metadata is an opaque JSON document:  the blob store never looks inside it, only stores it.
	 * 
	 * @return The mutable metadata document of this copy.
	 */
	public JsonObject getMetadata()
	{
		return _metadata;
	}

	/**
	 * @return A copy of this descriptor which shares nothing mutable with the receiver.
	 */
	public Blob copy()
	{
		return new Blob(_name, _version, _blobId, _length, _segmentCount, _segmentLength, _timeCreated, new JsonObject(_metadata));
	}

	@Override
	public boolean equals(Object obj)
	{
		boolean isEqual = (this == obj);
		if (!isEqual && (obj instanceof Blob))
		{
			Blob other = (Blob) obj;
			isEqual = _name.equals(other._name)
					&& (_version == other._version)
					&& _blobId.equals(other._blobId)
					&& (_length == other._length)
					&& (_segmentCount == other._segmentCount)
					&& (_segmentLength == other._segmentLength)
					&& (_timeCreated == other._timeCreated)
					&& _metadata.equals(other._metadata)
			;
		}
		return isEqual;
	}

	@Override
	public int hashCode()
	{
		return _blobId.hashCode();
	}

	@Override
	public String toString()
	{
		return "Blob(" + _name + " v" + _version + ", " + _blobId + ", " + _length + " bytes in " + _segmentCount + " x " + _segmentLength + ")";
	}
}
