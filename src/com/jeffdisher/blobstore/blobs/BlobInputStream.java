package com.jeffdisher.blobstore.blobs;

import java.io.IOException;
import java.io.InputStream;


/**
 * Presents the read side of a BlobStream as an InputStream.
 */
class BlobInputStream extends InputStream
{
	private final BlobStream _stream;

	BlobInputStream(BlobStream stream)
	{
		_stream = stream;
	}

	@Override
	public int read() throws IOException
	{
		byte[] single = new byte[1];
		int count = _stream.read(single, 0, 1);
		return (1 == count)
				? Byte.toUnsignedInt(single[0])
				: -1
		;
	}

	@Override
	public int read(byte[] b, int off, int len) throws IOException
	{
		return _stream.read(b, off, len);
	}

	@Override
	public void close() throws IOException
	{
		_stream.close();
	}
}
