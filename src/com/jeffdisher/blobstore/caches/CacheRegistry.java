package com.jeffdisher.blobstore.caches;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;

import com.jeffdisher.blobstore.types.ILogger;
import com.jeffdisher.blobstore.utils.Assert;
import com.jeffdisher.blobstore.utils.MiscHelpers;


/**
 * Owns all the named TtlCache instances of a process and the threads which sweep them.
 * Caches with the same sweep interval share one sweep thread so the number of threads is bounded by the number of
 * distinct intervals, not the number of caches.
 * Lifecycle:  construct, start(), stop().  stop() clears every cache, which passes every entry to its listener, so all
 * write-back state is persisted (or logged as lost) before it returns.
 * Caches may be created before start() (their sweep thread starts with the registry) or after it (their group's thread
 * starts immediately).
 */
public class CacheRegistry
{
	private final ILogger _logger;
	private final LongSupplier _clock;
	private final Map<String, TtlCache<?>> _caches;
	private final Map<Long, SweepGroup> _groups;
	private boolean _started;
	private boolean _stopped;
	// Read by listeners on sweep threads, without the registry lock.
	private volatile boolean _running;

	/**
	 * Creates the registry but doesn't start any sweep threads.
	 *
	 * @param logger The logger for cache lifecycle events and swallowed listener failures.
	 * @param clock The source of current time, in milliseconds (System::currentTimeMillis outside of tests).
	 */
	public CacheRegistry(ILogger logger, LongSupplier clock)
	{
		_logger = logger;
		_clock = clock;
		_caches = new HashMap<>();
		_groups = new HashMap<>();
	}

	/**
	 * Starts the sweep threads for all groups created so far.
	 */
	public synchronized void start()
	{
		Assert.assertTrue(!_started, "cache registry started once");
		_started = true;
		_running = true;
		for (SweepGroup group : _groups.values())
		{
			group.startThread();
		}
	}

	/**
	 * Registers a new named cache.
	 *
	 * @param <V> The value type.
	 * @param name The unique name of the cache.
	 * @param ttlMillis The default time-to-live of entries.
	 * @param sweepIntervalMillis How often the cache is swept for expired entries.
	 * @param listener The listener for added/expired entries (can be null).
	 * @return The new cache.
	 * @throws IllegalArgumentException If a cache with this name already exists.
	 * @throws IllegalStateException If the registry has been stopped.
	 */
	public synchronized <V> TtlCache<V> createCache(String name, long ttlMillis, long sweepIntervalMillis, ICacheListener<V> listener)
	{
		if (_stopped)
		{
			throw new IllegalStateException("Cache registry is stopped");
		}
		if (_caches.containsKey(name))
		{
			throw new IllegalArgumentException("Cache already exists: " + name);
		}
		TtlCache<V> cache = new TtlCache<>(this, name, ttlMillis, sweepIntervalMillis, _clock, listener, _logger);
		_caches.put(name, cache);
		SweepGroup group = _groups.get(sweepIntervalMillis);
		if (null == group)
		{
			group = new SweepGroup(sweepIntervalMillis);
			_groups.put(sweepIntervalMillis, group);
			if (_running)
			{
				group.startThread();
			}
		}
		group.caches.add(cache);
		_logger.logVerbose("Created cache " + name + " (TTL " + ttlMillis + " ms, sweep " + sweepIntervalMillis + " ms)");
		return cache;
	}

	/**
	 * Unregisters a cache, flushing it first (every entry is passed to its listener as expired).
	 * If it was the last cache of its sweep interval, that group's thread is stopped.
	 *
	 * @param name The name of the cache.
	 * @return True if the cache existed.
	 */
	public boolean deleteCache(String name)
	{
		TtlCache<?> cache;
		SweepGroup emptiedGroup = null;
		synchronized (this)
		{
			cache = _caches.remove(name);
			if (null != cache)
			{
				SweepGroup group = _groups.get(cache.getSweepIntervalMillis());
				group.caches.remove(cache);
				if (group.caches.isEmpty())
				{
					_groups.remove(cache.getSweepIntervalMillis());
					emptiedGroup = group;
				}
			}
		}
		if (null != emptiedGroup)
		{
			emptiedGroup.stopThread();
		}
		if (null != cache)
		{
			cache.clear();
			_logger.logVerbose("Deleted cache " + name);
		}
		return (null != cache);
	}

	/**
	 * Runs one sweep of every cache, synchronously on the calling thread.
	 *
	 * @return The total number of entries expired.
	 */
	public int sweepAll()
	{
		List<TtlCache<?>> caches;
		synchronized (this)
		{
			caches = new ArrayList<>(_caches.values());
		}
		int expired = 0;
		for (TtlCache<?> cache : caches)
		{
			expired += cache.sweep();
		}
		return expired;
	}

	/**
	 * @return The number of sweep timers (one per distinct sweep interval in use).
	 */
	public synchronized int getTimerCount()
	{
		return _groups.size();
	}

	public synchronized int getCacheCount()
	{
		return _caches.size();
	}

	/**
	 * @return True between start() and stop().
	 */
	public boolean isRunning()
	{
		return _running;
	}

	/**
	 * Stops every sweep thread and then clears every cache, in each group, so everything is written back.
	 * Since the registry is no longer running, a write-back which fails during this final flush is not re-armed.
	 */
	public void stop()
	{
		List<SweepGroup> groups;
		synchronized (this)
		{
			if (_stopped)
			{
				return;
			}
			_stopped = true;
			_running = false;
			groups = new ArrayList<>(_groups.values());
			_groups.clear();
			_caches.clear();
		}
		ILogger log = _logger.logStart("Flushing " + groups.size() + " cache group(s)");
		for (SweepGroup group : groups)
		{
			group.stopThread();
			for (TtlCache<?> cache : group.caches)
			{
				int size = cache.size();
				cache.clear();
				log.logOperation("Flushed " + size + " entries from " + cache.getName());
			}
		}
		log.logFinish("Cache flush complete");
	}


	/**
	 * The caches sharing a sweep interval and the single thread sweeping them.
	 */
	private class SweepGroup
	{
		public final long intervalMillis;
		public final List<TtlCache<?>> caches;
		private Thread _thread;
		private boolean _keepRunning;

		public SweepGroup(long intervalMillis)
		{
			this.intervalMillis = intervalMillis;
			this.caches = new CopyOnWriteArrayList<>();
		}

		public synchronized void startThread()
		{
			Assert.assertTrue(null == _thread);
			_keepRunning = true;
			_thread = MiscHelpers.createThread(this::_run, "Cache sweep (" + intervalMillis + " ms)");
			_thread.start();
		}

		public void stopThread()
		{
			Thread thread;
			synchronized (this)
			{
				_keepRunning = false;
				this.notifyAll();
				thread = _thread;
			}
			if ((null != thread) && (Thread.currentThread() != thread))
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

		private void _run()
		{
			while (_waitForNextTick())
			{
				for (TtlCache<?> cache : caches)
				{
					cache.sweep();
				}
			}
		}

		private synchronized boolean _waitForNextTick()
		{
			long wakeAt = System.currentTimeMillis() + intervalMillis;
			long remaining = intervalMillis;
			while (_keepRunning && (remaining > 0L))
			{
				try
				{
					this.wait(remaining);
				}
				catch (InterruptedException e)
				{
					// We don't use interruption.
					throw Assert.unexpected(e);
				}
				remaining = wakeAt - System.currentTimeMillis();
			}
			return _keepRunning;
		}
	}
}
