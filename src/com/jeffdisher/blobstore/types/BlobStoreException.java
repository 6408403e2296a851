package com.jeffdisher.blobstore.types;


/**
 * Superclass of all the blob store's internal exceptions.
 */
public class BlobStoreException extends Exception
{
	private static final long serialVersionUID = 1L;

	public BlobStoreException(String message)
	{
		super(message);
	}

	public BlobStoreException(String message, Exception exception)
	{
		super(message, exception);
	}
}
