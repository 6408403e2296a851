package com.jeffdisher.blobstore.caches;


/**
 * Receives the lifecycle events of entries in a TtlCache.
 * For a write-back cache, valueExpired() is the only place where values are persisted:  it is called when the sweep
 * evicts an entry and when the cache is cleared (which is how the registry flushes everything on shutdown).
 * Both callbacks are invoked outside the cache's lock so they may perform blocking I/O and call back into the cache
 * (to re-arm a value whose write failed, for example).  A RuntimeException thrown from a callback is logged and
 * otherwise ignored.
 * 
 * @param <V> The value type of the cache.
 */
public interface ICacheListener<V>
{
	/**
	 * Called after a value was inserted by set() or by setOrGet() (only when it actually inserted).
	 * 
	 * @param cache The cache which changed.
	 * @param key The key.
	 * @param value The new value.
	 * @param expiresAt The time when the value will be eligible for expiry, in clock milliseconds.
	 */
	default void valueAdded(TtlCache<V> cache, String key, V value, long expiresAt)
	{
	}

	/**
	 * Called after a value was removed from the cache by expiry or by clear() (but not by delete()).
	 * 
	 * @param cache The cache which evicted the value.
	 * @param key The key.
	 * @param value The evicted value.
	 * @param expiresAt The expiry time the entry had, in clock milliseconds.
	 */
	void valueExpired(TtlCache<V> cache, String key, V value, long expiresAt);
}
