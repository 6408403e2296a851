package com.jeffdisher.blobstore.utils;

import java.util.LinkedList;
import java.util.Queue;

import com.jeffdisher.blobstore.types.BackingStoreException;


/**
 * A blocking queue of Runnable objects for use by the multi-threaded backing store scheduler.
 */
public class WorkQueue
{
	private final Queue<Runnable> _queue = new LinkedList<>();
	private boolean _running = true;

	/**
	 * Polls for the next runnable, blocking until one exists or the queue is shut down.
	 * Note that this will only return null if both the queue is empty and the queue has been shut down.
	 * 
	 * @return The next Runnable or null, if the queue is shut down and drained of work.
	 */
	public synchronized Runnable pollForNext()
	{
		while (_running && _queue.isEmpty())
		{
			try
			{
				this.wait();
			}
			catch (InterruptedException e)
			{
				// We don't use interruption.
				throw Assert.unexpected(e);
			}
		}
		return !_queue.isEmpty()
				? _queue.remove()
				: null;
	}

	/**
	 * Enqueues the next runnable task.
	 * 
	 * @param r The runnable task.
	 * @return True if this was enqueued, false if the receiver has been shut down.
	 */
	public synchronized boolean enqueue(Runnable r)
	{
		if (_running)
		{
			_queue.add(r);
			this.notify();
		}
		return _running;
	}

	/**
	 * Shuts down the queue.  Future calls to enqueue() will fail but anything already queued will still be returned by
	 * pollForNext() before it starts returning null.
	 */
	public synchronized void shutdown()
	{
		_running = false;
		this.notifyAll();
	}


	/**
	 * Operations which couldn't be enqueued because of shutdown are resolved with this synthesized error, since a
	 * backing store failure is already something every caller must handle.
	 * 
	 * @return A faked backing store exception.
	 */
	public static BackingStoreException createShutdownError()
	{
		return new BackingStoreException("Backing store scheduler is shut down", null);
	}
}
