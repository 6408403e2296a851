package com.jeffdisher.blobstore.types;


/**
 * Thrown when a stream is created for an exact (name, version) pair which already exists.
 */
public class BlobConflictException extends BlobStoreException
{
	private static final long serialVersionUID = 1L;

	public final String name;
	public final int version;

	public BlobConflictException(String name, int version)
	{
		super("A blob stream with name and version '" + name + " v" + version + "' already exists");
		this.name = name;
		this.version = version;
	}
}
