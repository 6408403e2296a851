package com.jeffdisher.blobstore.blobs;

import com.jeffdisher.blobstore.types.StreamFailedException;


/**
 * Notified when a BlobStream fails.  Called at most once per stream, on the thread which observed the failure.
 */
public interface IStreamErrorListener
{
	void streamFailed(BlobStream stream, StreamFailedException error);
}
