package com.jeffdisher.blobstore.types;

import java.io.IOException;


/**
 * The terminal error of a BlobStream.  Once a stream has failed, every further read or write reports this same
 * failure.
 * The cause is either the BackingStoreException which interrupted the stream or null, if the stream discovered that
 * the segments don't match the blob's metadata.
 */
public class StreamFailedException extends IOException
{
	private static final long serialVersionUID = 1L;

	public StreamFailedException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
