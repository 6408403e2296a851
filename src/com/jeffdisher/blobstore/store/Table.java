package com.jeffdisher.blobstore.store;

import java.util.List;

import com.jeffdisher.blobstore.scheduler.FutureRead;
import com.jeffdisher.blobstore.scheduler.FutureVoid;
import com.jeffdisher.blobstore.scheduler.IRowDecoder;
import com.jeffdisher.blobstore.scheduler.IStoreScheduler;
import com.jeffdisher.blobstore.types.TableSchema;
import com.jeffdisher.blobstore.types.Where;


/**
 * The read/delete side of one backing store table.
 * Rows are never written through here:  writes go through a TableWriter, which only the cache write-back listeners
 * hold.
 */
public class Table
{
	private final IStoreScheduler _scheduler;
	private final TableSchema _schema;

	public Table(IStoreScheduler scheduler, TableSchema schema)
	{
		_scheduler = scheduler;
		_schema = schema;
	}

	public TableSchema getSchema()
	{
		return _schema;
	}

	/**
	 * Requests that the backing store create the table, if it doesn't exist.
	 * 
	 * @return The asynchronously-completed future.
	 */
	public FutureVoid provision()
	{
		return _scheduler.provision(_schema);
	}

	public <R> FutureRead<List<R>> select(List<String> columns, List<Where> where, IRowDecoder<R> decoder)
	{
		return _scheduler.select(_schema, columns, where, decoder);
	}

	public <R> FutureRead<R> selectOne(List<String> columns, List<Where> where, IRowDecoder<R> decoder)
	{
		return _scheduler.selectOne(_schema, columns, where, decoder);
	}

	public FutureVoid delete(List<Where> where)
	{
		return _scheduler.delete(_schema, where);
	}
}
