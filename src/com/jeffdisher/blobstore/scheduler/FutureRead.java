package com.jeffdisher.blobstore.scheduler;

import com.jeffdisher.blobstore.types.BackingStoreException;
import com.jeffdisher.blobstore.utils.Assert;


/**
 * The asynchronously-returned result of a backing store read.
 * Note that null is a valid result (a row which doesn't exist) so completion is tracked separately from the data.
 * 
 * @param <D> The data type returned from the read.
 */
public class FutureRead<D>
{
	/**
	 * Creates a future which is already complete, for the cases where the data was found in a cache.
	 * 
	 * @param <D> The data type.
	 * @param data The data (can be null).
	 * @return A completed future.
	 */
	public static <D> FutureRead<D> completed(D data)
	{
		FutureRead<D> future = new FutureRead<>();
		future.success(data);
		return future;
	}


	private boolean _isComplete;
	private D _data;
	private BackingStoreException _exception;

	/**
	 * Blocks for the asynchronous operation to complete.
	 * 
	 * @return The successful result of the request (can be null if the read found nothing).
	 * @throws BackingStoreException The exception which caused the read to fail.
	 */
	public synchronized D get() throws BackingStoreException
	{
		while (!_isComplete)
		{
			try
			{
				this.wait();
			}
			catch (InterruptedException e)
			{
				// We don't use interruption in this system.
				throw Assert.unexpected(e);
			}
		}
		if (null != _exception)
		{
			throw _exception;
		}
		return _data;
	}

	/**
	 * @return True if the read has completed (successfully or not), meaning get() won't block.
	 */
	public synchronized boolean isDone()
	{
		return _isComplete;
	}

	/**
	 * Called to set the data read on success.
	 * 
	 * @param data The data result to return (can be null).
	 */
	public synchronized void success(D data)
	{
		Assert.assertTrue(!_isComplete);
		_data = data;
		_isComplete = true;
		this.notifyAll();
	}

	/**
	 * Called to set the exception which caused the failure.
	 * 
	 * @param exception The exception to throw.
	 */
	public synchronized void failure(BackingStoreException exception)
	{
		Assert.assertTrue(!_isComplete);
		Assert.assertTrue(null != exception);
		_exception = exception;
		_isComplete = true;
		this.notifyAll();
	}
}
