package com.jeffdisher.blobstore.store;

import java.util.List;
import java.util.Map;

import com.jeffdisher.blobstore.scheduler.FutureVoid;
import com.jeffdisher.blobstore.scheduler.IStoreScheduler;
import com.jeffdisher.blobstore.types.TableSchema;
import com.jeffdisher.blobstore.types.Where;


/**
 * The write side of one backing store table.  Only handed to cache write-back listeners.
 */
public class TableWriter
{
	private final IStoreScheduler _scheduler;
	private final TableSchema _schema;

	public TableWriter(IStoreScheduler scheduler, TableSchema schema)
	{
		_scheduler = scheduler;
		_schema = schema;
	}

	/**
	 * Writes the data columns of the row addressed by the key (idempotent).
	 * 
	 * @param values The data column values.
	 * @param key The full primary key of the row.
	 * @return The asynchronously-completed future.
	 */
	public FutureVoid upsert(Map<String, Object> values, List<Where> key)
	{
		return _scheduler.upsert(_schema, values, key);
	}
}
