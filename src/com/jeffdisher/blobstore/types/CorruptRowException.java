package com.jeffdisher.blobstore.types;


/**
 * Thrown when a row was found in the backing store but couldn't be decoded into the expected type.
 */
public class CorruptRowException extends BackingStoreException
{
	private static final long serialVersionUID = 1L;

	public CorruptRowException(String table, String reason, Exception cause)
	{
		super("Corrupt row in " + table + ": " + reason, cause);
	}
}
