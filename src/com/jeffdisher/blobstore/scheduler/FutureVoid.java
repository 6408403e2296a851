package com.jeffdisher.blobstore.scheduler;

import com.jeffdisher.blobstore.types.BackingStoreException;
import com.jeffdisher.blobstore.utils.Assert;


/**
 * The asynchronously-returned result of a backing store call which returns no data (upsert, delete, provision).
 * Completes exactly once.
 */
public class FutureVoid
{
	private boolean _isComplete;
	private BackingStoreException _exception;

	/**
	 * Blocks until the call completes.
	 * 
	 * @throws BackingStoreException The reason the call failed.
	 */
	public synchronized void get() throws BackingStoreException
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
	}

	public synchronized boolean isDone()
	{
		return _isComplete;
	}

	public synchronized void success()
	{
		Assert.assertTrue(!_isComplete, "future completed once");
		_isComplete = true;
		this.notifyAll();
	}

	public synchronized void failure(BackingStoreException exception)
	{
		Assert.assertTrue(!_isComplete, "future completed once");
		Assert.assertTrue(null != exception);
		_exception = exception;
		_isComplete = true;
		this.notifyAll();
	}
}
