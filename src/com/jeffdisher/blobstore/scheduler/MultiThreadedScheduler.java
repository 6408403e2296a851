package com.jeffdisher.blobstore.scheduler;

import java.util.List;
import java.util.Map;

import com.jeffdisher.blobstore.store.IBackingStore;
import com.jeffdisher.blobstore.types.TableSchema;
import com.jeffdisher.blobstore.types.Where;
import com.jeffdisher.blobstore.utils.Assert;
import com.jeffdisher.blobstore.utils.MiscHelpers;
import com.jeffdisher.blobstore.utils.WorkQueue;


/**
 * An implementation of IStoreScheduler which runs all calls on a set of background threads, via a work queue.
 * It relies on being explicitly shut down in order to stop running.  Anything scheduled after shutdown fails with a
 * synthesized BackingStoreException.
 */
public class MultiThreadedScheduler implements IStoreScheduler
{
	private final IBackingStore _store;
	private final WorkQueue _queue;
	private final Thread[] _threads;

	public MultiThreadedScheduler(IBackingStore store, int threadCount)
	{
		Assert.assertTrue(threadCount > 0);
		_store = store;
		_queue = new WorkQueue();
		_threads = new Thread[threadCount];
		for (int i = 0; i < threadCount; ++i)
		{
			_threads[i] = MiscHelpers.createThread(() -> {
				boolean keepRunning = true;
				while (keepRunning)
				{
					Runnable run = _queue.pollForNext();
					if (null != run)
					{
						run.run();
					}
					else
					{
						keepRunning = false;
					}
				}
			}, "Store scheduler thread #" + i);
			_threads[i].start();
		}
	}

	@Override
	public FutureVoid provision(TableSchema schema)
	{
		FutureVoid future = new FutureVoid();
		boolean didEnqueue = _queue.enqueue(() -> StoreOperations.provision(_store, future, schema));
		if (!didEnqueue)
		{
			future.failure(WorkQueue.createShutdownError());
		}
		return future;
	}

	@Override
	public <R> FutureRead<List<R>> select(TableSchema schema, List<String> columns, List<Where> where, IRowDecoder<R> decoder)
	{
		FutureRead<List<R>> future = new FutureRead<>();
		boolean didEnqueue = _queue.enqueue(() -> StoreOperations.select(_store, future, schema, columns, where, decoder));
		if (!didEnqueue)
		{
			future.failure(WorkQueue.createShutdownError());
		}
		return future;
	}

	@Override
	public <R> FutureRead<R> selectOne(TableSchema schema, List<String> columns, List<Where> where, IRowDecoder<R> decoder)
	{
		FutureRead<R> future = new FutureRead<>();
		boolean didEnqueue = _queue.enqueue(() -> StoreOperations.selectOne(_store, future, schema, columns, where, decoder));
		if (!didEnqueue)
		{
			future.failure(WorkQueue.createShutdownError());
		}
		return future;
	}

	@Override
	public FutureVoid upsert(TableSchema schema, Map<String, Object> values, List<Where> where)
	{
		FutureVoid future = new FutureVoid();
		boolean didEnqueue = _queue.enqueue(() -> StoreOperations.upsert(_store, future, schema, values, where));
		if (!didEnqueue)
		{
			future.failure(WorkQueue.createShutdownError());
		}
		return future;
	}

	@Override
	public FutureVoid delete(TableSchema schema, List<Where> where)
	{
		FutureVoid future = new FutureVoid();
		boolean didEnqueue = _queue.enqueue(() -> StoreOperations.delete(_store, future, schema, where));
		if (!didEnqueue)
		{
			future.failure(WorkQueue.createShutdownError());
		}
		return future;
	}

	/**
	 * Stops accepting new work, lets the threads drain what is already queued, and waits for them to exit.
	 */
	public void shutdown()
	{
		_queue.shutdown();
		for (Thread thread : _threads)
		{
			try
			{
				thread.join();
			}
			catch (InterruptedException e)
			{
				// We don't use interruption.
				throw Assert.unexpected(e);
			}
		}
	}
}
