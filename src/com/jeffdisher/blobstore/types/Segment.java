package com.jeffdisher.blobstore.types;

import java.util.Arrays;

import com.jeffdisher.blobstore.utils.Assert;


/**
 * A fixed-capacity chunk of a blob's bytes, addressed by (blobId, index).
 * Instances are shared through the segment cache so all access to the buffer and dirty flag is synchronized.  The
 * dirty flag is only set when the buffer was mutated in this process since it was last persisted:  the write-back path
 * never persists a segment which was only fetched for reading.
 */
public class Segment
{
	/**
	 * Builds the composite cache key of a segment.
	 * 
	 * @param blobId The id of the blob version owning the segment.
	 * @param index The 0-based index of the segment.
	 * @return The key "{blobId}|{index}".
	 */
	public static String cacheKey(String blobId, int index)
	{
		return blobId + "|" + index;
	}


	private final String _blobId;
	private final int _index;
	private byte[] _buffer;
	private boolean _dirty;

	public Segment(String blobId, int index, byte[] buffer, boolean dirty)
	{
		Assert.assertTrue(null != blobId);
		Assert.assertTrue(index >= 0, "segment index is non-negative");
		Assert.assertTrue(null != buffer);
		_blobId = blobId;
		_index = index;
		_buffer = buffer;
		_dirty = dirty;
	}

	public String getBlobId()
	{
		return _blobId;
	}

	public int getIndex()
	{
		return _index;
	}

	public String getCacheKey()
	{
		return cacheKey(_blobId, _index);
	}

	public synchronized int length()
	{
		return _buffer.length;
	}

	public synchronized boolean isDirty()
	{
		return _dirty;
	}

	public synchronized void markDirty()
	{
		_dirty = true;
	}

	/**
	 * Grows the buffer to the given capacity, keeping the existing bytes.  Used when a previously-stored short (final)
	 * segment is written again.
	 * 
	 * @param capacity The minimum buffer length.
	 */
	public synchronized void ensureCapacity(int capacity)
	{
		if (_buffer.length < capacity)
		{
			_buffer = Arrays.copyOf(_buffer, capacity);
		}
	}

	/**
	 * Cuts the buffer down to the given length.
	 * 
	 * @param length The new length (must not exceed the current length).
	 */
	public synchronized void truncate(int length)
	{
		Assert.assertTrue(length <= _buffer.length, "segment " + cacheKey(_blobId, _index) + " truncated to " + length + " but only has " + _buffer.length + " bytes");
		if (length < _buffer.length)
		{
			_buffer = Arrays.copyOf(_buffer, length);
		}
	}

	/**
	 * Copies bytes into the segment's buffer.
	 */
	public synchronized void write(int segmentOffset, byte[] source, int sourceOffset, int length)
	{
		System.arraycopy(source, sourceOffset, _buffer, segmentOffset, length);
	}

	/**
	 * Copies bytes out of the segment's buffer.
	 */
	public synchronized void read(int segmentOffset, byte[] destination, int destinationOffset, int length)
	{
		System.arraycopy(_buffer, segmentOffset, destination, destinationOffset, length);
	}

	/**
	 * Atomically captures the buffer to persist and clears the dirty flag.  If the persist fails, the caller must call
	 * markDirty() so the segment is written again later.
	 * 
	 * @return A copy of the buffer, or null if the segment isn't dirty.
	 */
	public synchronized byte[] takeDirtyBuffer()
	{
		byte[] copy = null;
		if (_dirty)
		{
			copy = _buffer.clone();
			_dirty = false;
		}
		return copy;
	}
}
