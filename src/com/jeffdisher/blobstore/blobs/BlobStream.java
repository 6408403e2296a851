package com.jeffdisher.blobstore.blobs;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import com.jeffdisher.blobstore.scheduler.FutureRead;
import com.jeffdisher.blobstore.types.BackingStoreException;
import com.jeffdisher.blobstore.types.Blob;
import com.jeffdisher.blobstore.types.ILogger;
import com.jeffdisher.blobstore.types.Segment;
import com.jeffdisher.blobstore.types.StreamFailedException;
import com.jeffdisher.blobstore.utils.Assert;


/**
 * A sequential byte stream over one (name, version) of a blob, walking its segments in order.
 * A stream is used either to write (write() calls, then close() to finalize the metadata) or to read (read() until it
 * returns -1, optionally after seek()).  Mixing the two on one instance is rejected with IllegalStateException.
 * Any failure of the backing store puts the stream into a terminal error state:  the failure is thrown to the caller,
 * kept as getError(), and reported to the error listener once.  The stream never retries.
 * All methods are synchronized on the stream so a single instance can be shared between threads, although
 * concurrent writers to the same blob version (through different streams) are not detected.
 */
public class BlobStream
{
	public static final long THROTTLE_DELAY_MILLIS = 1000L;

	private enum State
	{
		FRESH,
		WRITING,
		READING,
		FINALIZED,
		DRAINED,
		ERRORED,
	}

	private final BlobMetadataStore _metadata;
	private final SegmentStore _segments;
	private final ILogger _logger;
	private final Blob _blob;
	private final int _segmentLength;
	private final String _label;

	private State _state;
	private boolean _isClosed;
	// Set for streams created through create:  they persist metadata on close even if nothing was written.
	private boolean _isWritten;
	private StreamFailedException _error;
	private IStreamErrorListener _errorListener;

	// Cursor.
	private int _segmentIndex;
	private int _segmentOffset;
	private Segment _current;

	// Read-ahead:  at most one segment fetch in flight.
	private FutureRead<Segment> _pendingFetch;
	private int _pendingFetchIndex;

	private int _bytesPerSecond;
	private long _nextEmissionMillis;

	BlobStream(BlobMetadataStore metadata, SegmentStore segments, ILogger logger, Blob blob, boolean isCreate)
	{
		_metadata = metadata;
		_segments = segments;
		_logger = logger;
		_blob = blob;
		_segmentLength = blob.getSegmentLength();
		_label = "'" + blob.getName() + " v" + blob.getVersion() + "'";
		_state = State.FRESH;
		_isWritten = isCreate;
	}

	/**
	 * @return A copy of the blob descriptor as currently known to this stream (length and segment count are only final
	 * once the stream has been closed).
	 */
	public synchronized Blob getBlob()
	{
		return _blob.copy();
	}

	/**
	 * @return True while the stream can still be read or written (not closed, drained or failed).
	 */
	public synchronized boolean isAlive()
	{
		return (State.FRESH == _state) || (State.WRITING == _state) || (State.READING == _state);
	}

	/**
	 * @return The terminal error of the stream or null, if it hasn't failed.
	 */
	public synchronized StreamFailedException getError()
	{
		return _error;
	}

	public synchronized void setErrorListener(IStreamErrorListener listener)
	{
		_errorListener = listener;
	}

	/**
	 * Limits reads to emitting at most this many bytes per second (0 means unlimited).  After each throttled
	 * emission, the next one is delayed by THROTTLE_DELAY_MILLIS.  Closing the stream cancels a pending delay.
	 *
	 * @param bytesPerSecond The limit, or 0 to disable throttling.
	 */
	public synchronized void setBytesPerSecond(int bytesPerSecond)
	{
		Assert.assertTrue(bytesPerSecond >= 0);
		_bytesPerSecond = bytesPerSecond;
	}

	public void write(byte[] data) throws IOException
	{
		write(data, 0, data.length);
	}

	/**
	 * Writes the string as UTF-8.
	 *
	 * @param text The text to write.
	 * @throws IOException The stream failed.
	 */
	public void write(String text) throws IOException
	{
		write(text.getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * Appends bytes at the cursor, filling the current segment and rolling over to the next one when it is full.
	 * Each touched segment is handed to the segment store as dirty; nothing is written to the backing store until the
	 * segment cache evicts or flushes it.  Writes after close() are ignored (with a logged warning).
	 *
	 * @param data The source buffer.
	 * @param offset The offset into data.
	 * @param length The number of bytes to write.
	 * @throws IOException An existing segment couldn't be fetched, or the stream had already failed.
	 */
	public synchronized void write(byte[] data, int offset, int length) throws IOException
	{
		if (_isClosed)
		{
			_logger.logError("Stream " + _label + " already closed, cannot write " + length + " more bytes");
			return;
		}
		_checkNotFailed();
		if (State.READING == _state)
		{
			throw new IllegalStateException("Cannot write to stream " + _label + " after reading from it");
		}
		_state = State.WRITING;
		_isWritten = true;

		int sourceOffset = offset;
		int remaining = length;
		while (remaining > 0)
		{
			if (null == _current)
			{
				_current = _acquireForWrite(_segmentIndex);
			}
			else if (_segmentLength == _segmentOffset)
			{
				_segmentIndex += 1;
				_segmentOffset = 0;
				_current = _acquireForWrite(_segmentIndex);
			}
			int toCopy = Math.min(remaining, _segmentLength - _segmentOffset);
			_current.write(_segmentOffset, data, sourceOffset, toCopy);
			_segmentOffset += toCopy;
			sourceOffset += toCopy;
			remaining -= toCopy;
			_segments.setSegment(_current);

			long position = ((long) _segmentIndex * _segmentLength) + _segmentOffset;
			if (position > _blob.getLength())
			{
				_blob.setLength(position);
			}
		}
	}

	/**
	 * Reads bytes from the cursor, fetching segments as needed (the following segment is fetched ahead, in the
	 * background).  If a byte rate is set, at most that many bytes are returned and the next call waits for the
	 * throttle delay first.
	 *
	 * @param destination The buffer to fill.
	 * @param offset The offset into destination.
	 * @param length The maximum number of bytes to read.
	 * @return The number of bytes read, or -1 at the end of the blob (or if the stream was closed).
	 * @throws IOException A segment couldn't be fetched or was missing, or the stream had already failed.
	 */
	public synchronized int read(byte[] destination, int offset, int length) throws IOException
	{
		_checkNotFailed();
		if (State.WRITING == _state)
		{
			throw new IllegalStateException("Cannot read from stream " + _label + " while writing it");
		}
		if (_isClosed || (State.DRAINED == _state))
		{
			return -1;
		}
		_state = State.READING;
		if (0 == length)
		{
			return 0;
		}

		int result = -1;
		while (-1 == result)
		{
			long segmentStart = (long) _segmentIndex * _segmentLength;
			if ((_segmentIndex >= _blob.getSegmentCount()) || ((segmentStart + _segmentOffset) >= _blob.getLength()))
			{
				_state = State.DRAINED;
				break;
			}
			if (null == _current)
			{
				_current = _fetchForRead(_segmentIndex);
			}
			long segmentEnd = Math.min(_blob.getLength(), segmentStart + _current.length());
			int available = (int) (segmentEnd - segmentStart) - _segmentOffset;
			if (available <= 0)
			{
				_segmentIndex += 1;
				_segmentOffset = 0;
				_current = null;
				continue;
			}
			int toCopy = Math.min(length, available);
			if (_bytesPerSecond > 0)
			{
				if (!_waitForThrottle())
				{
					break;
				}
				toCopy = Math.min(toCopy, _bytesPerSecond);
				_nextEmissionMillis = System.currentTimeMillis() + THROTTLE_DELAY_MILLIS;
			}
			_current.read(_segmentOffset, destination, offset, toCopy);
			_segmentOffset += toCopy;
			result = toCopy;
		}
		return result;
	}

	/**
	 * Moves the read cursor to the given byte offset.
	 *
	 * @param byteOffset The offset from the start of the blob.
	 * @return False if the offset is not within the blob (the cursor is unchanged).
	 */
	public synchronized boolean seek(long byteOffset)
	{
		if (State.WRITING == _state)
		{
			throw new IllegalStateException("Cannot seek stream " + _label + " while writing it");
		}
		boolean didSeek = false;
		if (!_isClosed && (State.ERRORED != _state) && (byteOffset >= 0L) && (byteOffset < _blob.getLength()))
		{
			_segmentIndex = (int) (byteOffset / _segmentLength);
			_segmentOffset = (int) (byteOffset % _segmentLength);
			_current = null;
			_state = State.READING;
			didSeek = true;
		}
		return didSeek;
	}

	/**
	 * Copies the rest of the stream into the given output and closes this stream (the output is left open).
	 *
	 * @param output The destination.
	 * @return The number of bytes copied.
	 * @throws IOException Reading this stream or writing the output failed.
	 */
	public long pipeTo(OutputStream output) throws IOException
	{
		byte[] buffer = new byte[Math.min(_segmentLength, 64 * 1024)];
		long total = 0L;
		int count = read(buffer, 0, buffer.length);
		while (-1 != count)
		{
			output.write(buffer, 0, count);
			total += count;
			count = read(buffer, 0, buffer.length);
		}
		close();
		return total;
	}

	public InputStream asInputStream()
	{
		return new BlobInputStream(this);
	}

	public OutputStream asOutputStream()
	{
		return new BlobOutputStream(this);
	}

	/**
	 * Closes the stream.  If it was written (or created), the final segment is truncated to the bytes actually in the
	 * blob and handed back to the segment store, then the blob metadata is persisted.  Any pending throttle delay is
	 * cancelled.  Calling this more than once has no further effect.
	 *
	 * @throws IOException The metadata couldn't be persisted.
	 */
	public synchronized void close() throws IOException
	{
		if (_isClosed)
		{
			return;
		}
		_isClosed = true;
		this.notifyAll();
		if ((State.ERRORED != _state) && _isWritten)
		{
			if ((null != _current) && (_current.getIndex() == (_blob.getSegmentCount() - 1)))
			{
				long segmentStart = (long) _current.getIndex() * _segmentLength;
				int finalLength = (int) Math.min(_segmentLength, _blob.getLength() - segmentStart);
				_current.truncate(finalLength);
				_segments.setSegment(_current);
			}
			try
			{
				_metadata.setBlob(_blob);
			}
			catch (BackingStoreException e)
			{
				throw _fail("Failed to persist metadata of " + _label, e);
			}
			_state = State.FINALIZED;
			_logger.logVerbose("Finalized " + _blob);
		}
		else if (State.ERRORED != _state)
		{
			_state = State.DRAINED;
		}
		_current = null;
		_pendingFetch = null;
	}


	private void _checkNotFailed() throws StreamFailedException
	{
		if (null != _error)
		{
			throw new StreamFailedException("Stream " + _label + " previously failed: " + _error.getMessage(), _error);
		}
	}

	private Segment _acquireForWrite(int index) throws StreamFailedException
	{
		Segment segment;
		if (index < _blob.getSegmentCount())
		{
			segment = _fetch(_segments.loadSegment(_blob.getBlobId(), index), index);
			segment.ensureCapacity(_segmentLength);
		}
		else
		{
			segment = new Segment(_blob.getBlobId(), index, new byte[_segmentLength], true);
			_blob.setSegmentCount(index + 1);
		}
		return segment;
	}

	private Segment _fetchForRead(int index) throws StreamFailedException
	{
		FutureRead<Segment> future = ((null != _pendingFetch) && (index == _pendingFetchIndex))
				? _pendingFetch
				: _segments.loadSegment(_blob.getBlobId(), index)
		;
		_pendingFetch = null;
		Segment segment = _fetch(future, index);
		int next = index + 1;
		if (next < _blob.getSegmentCount())
		{
			_pendingFetch = _segments.loadSegment(_blob.getBlobId(), next);
			_pendingFetchIndex = next;
		}
		return segment;
	}

	private Segment _fetch(FutureRead<Segment> future, int index) throws StreamFailedException
	{
		Segment segment;
		try
		{
			segment = future.get();
		}
		catch (BackingStoreException e)
		{
			throw _fail("Failed to fetch segment " + index + " of " + _label, e);
		}
		if (null == segment)
		{
			throw _fail("Unexpected end of stream segments in " + _label, null);
		}
		return segment;
	}

	private boolean _waitForThrottle()
	{
		long remaining = _nextEmissionMillis - System.currentTimeMillis();
		while (!_isClosed && (remaining > 0L))
		{
			try
			{
				this.wait(remaining);
			}
			catch (InterruptedException e)
			{
				// We don't use interruption.
				throw Assert.unexpected(e);
			}
			remaining = _nextEmissionMillis - System.currentTimeMillis();
		}
		return !_isClosed;
	}

	private StreamFailedException _fail(String message, Exception cause)
	{
		StreamFailedException error = new StreamFailedException(message, cause);
		_error = error;
		_state = State.ERRORED;
		_pendingFetch = null;
		_logger.logError(message + ((null != cause) ? (": " + cause.getLocalizedMessage()) : ""));
		IStreamErrorListener listener = _errorListener;
		_errorListener = null;
		if (null != listener)
		{
			listener.streamFailed(this, error);
		}
		return error;
	}
}
