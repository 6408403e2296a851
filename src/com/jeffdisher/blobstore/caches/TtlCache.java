package com.jeffdisher.blobstore.caches;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

import com.jeffdisher.blobstore.types.ILogger;
import com.jeffdisher.blobstore.utils.Assert;


/**
 * A single named collection of key->value entries, each with an expiry time.
 * All map access is synchronized on the cache, so setOrGet() really is atomic:  concurrent callers with the same key
 * all observe the value of whichever one inserted first.  Listener callbacks are invoked after the lock is released.
 * An entry stays readable until a sweep (or clear) removes it, even if its expiry time has passed, since the entry may
 * still be holding data which hasn't been written back.
 * Instances are only created by the CacheRegistry.
 * 
 * @param <V> The value type.
 */
public class TtlCache<V>
{
	private final CacheRegistry _owner;
	private final String _name;
	private final long _defaultTtlMillis;
	private final long _sweepIntervalMillis;
	private final LongSupplier _clock;
	private final ICacheListener<V> _listener;
	private final ILogger _logger;
	private final Map<String, Entry<V>> _entries;

	TtlCache(CacheRegistry owner, String name, long defaultTtlMillis, long sweepIntervalMillis, LongSupplier clock, ICacheListener<V> listener, ILogger logger)
	{
		Assert.assertTrue(defaultTtlMillis > 0L);
		Assert.assertTrue(sweepIntervalMillis > 0L);
		_owner = owner;
		_name = name;
		_defaultTtlMillis = defaultTtlMillis;
		_sweepIntervalMillis = sweepIntervalMillis;
		_clock = clock;
		_listener = listener;
		_logger = logger;
		_entries = new HashMap<>();
	}

	public String getName()
	{
		return _name;
	}

	public long getSweepIntervalMillis()
	{
		return _sweepIntervalMillis;
	}

	/**
	 * Write-back listeners use this to decide whether a failed write should be re-armed:  once the registry is
	 * stopping, nothing will sweep the cache again.
	 * 
	 * @return True if the registry owning this cache is still running.
	 */
	public boolean isOwnerRunning()
	{
		return _owner.isRunning();
	}

	/**
	 * @param key The key.
	 * @return The value or null, if there isn't one.
	 */
	public synchronized V get(String key)
	{
		Entry<V> entry = _entries.get(key);
		return (null != entry)
				? entry.value
				: null
		;
	}

	/**
	 * Reads a value, pushing out its expiry to now + refreshTtlMillis.
	 * 
	 * @param key The key.
	 * @param refreshTtlMillis The new time-to-live of the entry, if found.
	 * @return The value or null, if there isn't one.
	 */
	public synchronized V get(String key, long refreshTtlMillis)
	{
		Entry<V> entry = _entries.get(key);
		V value = null;
		if (null != entry)
		{
			entry.expiresAt = _clock.getAsLong() + refreshTtlMillis;
			value = entry.value;
		}
		return value;
	}

	/**
	 * Returns the existing value for key, if there is one, otherwise inserts the given value and returns it.
	 * 
	 * @param key The key.
	 * @param value The value to insert if the key is missing (cannot be null).
	 * @return The value now associated with the key.
	 */
	public V setOrGet(String key, V value)
	{
		return setOrGet(key, value, _defaultTtlMillis);
	}

	/**
	 * Returns the existing value for key, if there is one, otherwise inserts the given value with the given TTL and
	 * returns it.
	 * 
	 * @param key The key.
	 * @param value The value to insert if the key is missing (cannot be null).
	 * @param ttlMillis The time-to-live, if inserted.
	 * @return The value now associated with the key.
	 */
	public V setOrGet(String key, V value, long ttlMillis)
	{
		_checkValue(value);
		V result;
		long expiresAt = 0L;
		boolean didInsert = false;
		synchronized (this)
		{
			Entry<V> existing = _entries.get(key);
			if (null != existing)
			{
				result = existing.value;
			}
			else
			{
				expiresAt = _clock.getAsLong() + ttlMillis;
				_entries.put(key, new Entry<>(value, expiresAt));
				result = value;
				didInsert = true;
			}
		}
		if (didInsert)
		{
			_notifyAdded(key, value, expiresAt);
		}
		return result;
	}

	/**
	 * Inserts or replaces the value for key, using the default TTL.
	 * 
	 * @param key The key.
	 * @param value The value (cannot be null).
	 */
	public void set(String key, V value)
	{
		set(key, value, _defaultTtlMillis);
	}

	/**
	 * Inserts or replaces the value for key.  Note that a replaced value is not passed to valueExpired.
	 * 
	 * @param key The key.
	 * @param value The value (cannot be null).
	 * @param ttlMillis The time-to-live of the entry.
	 */
	public void set(String key, V value, long ttlMillis)
	{
		_checkValue(value);
		long expiresAt;
		synchronized (this)
		{
			expiresAt = _clock.getAsLong() + ttlMillis;
			_entries.put(key, new Entry<>(value, expiresAt));
		}
		_notifyAdded(key, value, expiresAt);
	}

	/**
	 * Discards the entry without notifying the listener (so nothing is written back).
	 * 
	 * @param key The key.
	 * @return True if there was an entry to remove.
	 */
	public synchronized boolean delete(String key)
	{
		return (null != _entries.remove(key));
	}

	/**
	 * Removes every entry, passing each one to the listener as expired.  This is how a cache is flushed.
	 */
	public void clear()
	{
		List<Map.Entry<String, Entry<V>>> removed;
		synchronized (this)
		{
			removed = new ArrayList<>(_entries.entrySet());
			_entries.clear();
		}
		for (Map.Entry<String, Entry<V>> elt : removed)
		{
			_notifyExpired(elt.getKey(), elt.getValue());
		}
	}

	/**
	 * Removes every entry whose expiry time has passed, passing each one to the listener.
	 * Since the removal happens under the lock, each entry is expired exactly once even if sweeps overlap.
	 * 
	 * @return The number of entries expired.
	 */
	public int sweep()
	{
		List<Map.Entry<String, Entry<V>>> expired = new ArrayList<>();
		synchronized (this)
		{
			long now = _clock.getAsLong();
			Iterator<Map.Entry<String, Entry<V>>> iterator = _entries.entrySet().iterator();
			while (iterator.hasNext())
			{
				Map.Entry<String, Entry<V>> elt = iterator.next();
				if (elt.getValue().expiresAt <= now)
				{
					expired.add(Map.entry(elt.getKey(), elt.getValue()));
					iterator.remove();
				}
			}
		}
		for (Map.Entry<String, Entry<V>> elt : expired)
		{
			_notifyExpired(elt.getKey(), elt.getValue());
		}
		return expired.size();
	}

	/**
	 * @return A snapshot of all the values currently in the cache.
	 */
	public synchronized List<V> getAll()
	{
		List<V> values = new ArrayList<>();
		for (Entry<V> entry : _entries.values())
		{
			values.add(entry.value);
		}
		return values;
	}

	public synchronized int size()
	{
		return _entries.size();
	}


	private void _checkValue(V value)
	{
		if (null == value)
		{
			throw new IllegalArgumentException("Cannot set cached value to null in cache " + _name);
		}
	}

	private void _notifyAdded(String key, V value, long expiresAt)
	{
		if (null != _listener)
		{
			try
			{
				_listener.valueAdded(this, key, value, expiresAt);
			}
			catch (RuntimeException e)
			{
				_logger.logError("Cache " + _name + " listener failed on add of " + key + ": " + e);
			}
		}
	}

	private void _notifyExpired(String key, Entry<V> entry)
	{
		if (null != _listener)
		{
			try
			{
				_listener.valueExpired(this, key, entry.value, entry.expiresAt);
			}
			catch (RuntimeException e)
			{
				_logger.logError("Cache " + _name + " listener failed on expiry of " + key + ": " + e);
			}
		}
	}


	private static final class Entry<V>
	{
		public final V value;
		public long expiresAt;

		public Entry(V value, long expiresAt)
		{
			this.value = value;
			this.expiresAt = expiresAt;
		}
	}
}
