package com.jeffdisher.blobstore.blobs;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.jeffdisher.blobstore.types.Blob;


/**
 * The value type of the "blob_by_name" cache:  every known version of one blob name.
 * The list is "complete" once it has been merged with a full read of the name's partition, meaning a version missing
 * from it doesn't exist (and the highest version in it is the latest).  Versions written locally but not yet persisted
 * are tracked as dirty, for the write-back listener.
 * Everything handed out is a copy.
 */
public class VersionList
{
	private final String _name;
	private final TreeMap<Integer, Blob> _versions;
	private final Set<Integer> _dirty;
	private boolean _isComplete;

	public VersionList(String name)
	{
		_name = name;
		_versions = new TreeMap<>();
		_dirty = new HashSet<>();
		_isComplete = false;
	}

	public String getName()
	{
		return _name;
	}

	public synchronized boolean isComplete()
	{
		return _isComplete;
	}

	/**
	 * @param version The version.
	 * @return A copy of the version or null, if it isn't in the list.
	 */
	public synchronized Blob get(int version)
	{
		Blob blob = _versions.get(version);
		return (null != blob)
				? blob.copy()
				: null
		;
	}

	/**
	 * @return A copy of the numerically greatest version in the list or null, if the list is empty.
	 */
	public synchronized Blob latest()
	{
		Map.Entry<Integer, Blob> last = _versions.lastEntry();
		return (null != last)
				? last.getValue().copy()
				: null
		;
	}

	/**
	 * @return Copies of every version in the list, in ascending version order.
	 */
	public synchronized List<Blob> all()
	{
		List<Blob> copies = new ArrayList<>();
		for (Blob blob : _versions.values())
		{
			copies.add(blob.copy());
		}
		return copies;
	}

	/**
	 * Merges versions read from the backing store.  A version already in the list wins, since it may have been
	 * written locally more recently than what the store returned.
	 * 
	 * @param stored The versions read from the store.
	 * @param isFullRead True if stored is everything the store has for this name.
	 */
	public synchronized void mergeFromStore(List<Blob> stored, boolean isFullRead)
	{
		for (Blob blob : stored)
		{
			_versions.putIfAbsent(blob.getVersion(), blob.copy());
		}
		if (isFullRead)
		{
			_isComplete = true;
		}
	}

	/**
	 * Adds or replaces a version written locally, marking it dirty.
	 * 
	 * @param blob The version (copied).
	 */
	public synchronized void putLocal(Blob blob)
	{
		_versions.put(blob.getVersion(), blob.copy());
		_dirty.add(blob.getVersion());
	}

	/**
	 * Clears the dirty state of a version, but only if the list still holds exactly what was persisted.
	 * 
	 * @param persisted The version which was written to the store.
	 */
	public synchronized void markPersisted(Blob persisted)
	{
		Blob current = _versions.get(persisted.getVersion());
		if (persisted.equals(current))
		{
			_dirty.remove(persisted.getVersion());
		}
	}

	/**
	 * Captures and clears all dirty versions, for writing back.
	 * 
	 * @return Copies of the dirty versions.
	 */
	public synchronized List<Blob> takeDirty()
	{
		List<Blob> dirty = new ArrayList<>();
		for (Integer version : _dirty)
		{
			dirty.add(_versions.get(version).copy());
		}
		_dirty.clear();
		return dirty;
	}

	/**
	 * Restores versions whose write-back failed, so they will be written again.  A version which was replaced by a
	 * different blob id in the meantime is left alone.
	 * 
	 * @param failed The versions to restore.
	 */
	public synchronized void restoreDirty(List<Blob> failed)
	{
		for (Blob blob : failed)
		{
			Blob current = _versions.get(blob.getVersion());
			if ((null == current) || current.getBlobId().equals(blob.getBlobId()))
			{
				if (null == current)
				{
					_versions.put(blob.getVersion(), blob.copy());
				}
				_dirty.add(blob.getVersion());
			}
		}
	}

	/**
	 * @param version The version to drop.
	 * @return True if it was in the list.
	 */
	public synchronized boolean remove(int version)
	{
		_dirty.remove(version);
		return (null != _versions.remove(version));
	}

	public synchronized int size()
	{
		return _versions.size();
	}
}
