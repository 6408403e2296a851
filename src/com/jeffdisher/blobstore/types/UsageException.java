package com.jeffdisher.blobstore.types;


/**
 * An exception thrown when configuration given to the blob store can't be interpreted.
 */
public class UsageException extends BlobStoreException
{
	private static final long serialVersionUID = 1L;

	public UsageException(String message)
	{
		super(message);
	}
}
