package com.jeffdisher.blobstore.types;


/**
 * This exception is used when an operation against the backing store fails.
 * The backing store is a quorum-based wide-column store so most of these failures are transient (timeouts, lost
 * quorum, dropped connections) and the operation can be re-attempted later.  The write-back caches rely on this:  a
 * failed persist is re-armed in the cache and retried on the next sweep.
 */
public class BackingStoreException extends BlobStoreException
{
	private static final long serialVersionUID = 1L;

	public BackingStoreException(String message, Exception underlyingException)
	{
		super(message, underlyingException);
	}
}
