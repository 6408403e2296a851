package com.jeffdisher.blobstore.blobs;

import java.io.IOException;
import java.io.OutputStream;


/**
 * Presents the write side of a BlobStream as an OutputStream.  Closing it finalizes the blob.
 */
class BlobOutputStream extends OutputStream
{
	private final BlobStream _stream;

	BlobOutputStream(BlobStream stream)
	{
		_stream = stream;
	}

	@Override
	public void write(int b) throws IOException
	{
		_stream.write(new byte[] { (byte) b }, 0, 1);
	}

	@Override
	public void write(byte[] b, int off, int len) throws IOException
	{
		_stream.write(b, off, len);
	}

	@Override
	public void close() throws IOException
	{
		_stream.close();
	}
}
