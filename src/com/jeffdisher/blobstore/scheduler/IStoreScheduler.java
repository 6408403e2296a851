package com.jeffdisher.blobstore.scheduler;

import java.util.List;
import java.util.Map;

import com.jeffdisher.blobstore.types.TableSchema;
import com.jeffdisher.blobstore.types.Where;


/**
 * The interface for scheduling backing store operations.
 * The design behind this is to allow asynchronous operation scheduling, returning futures instead of blocking.
 * An implementation may be inline or run on a pool of background threads.
 */
public interface IStoreScheduler
{
	/**
	 * Provisions a table.
	 * 
	 * @param schema The table to create if missing.
	 * @return The asynchronously-completed future.
	 */
	FutureVoid provision(TableSchema schema);

	/**
	 * Reads all matching rows, decoding each of them.
	 * 
	 * @param <R> The decoded type.
	 * @param schema The table.
	 * @param columns The columns to read.
	 * @param where The equality restrictions.
	 * @param decoder Run on each row (never given null).
	 * @return The asynchronously-completed future of decoded rows, in backing store order.
	 */
	<R> FutureRead<List<R>> select(TableSchema schema, List<String> columns, List<Where> where, IRowDecoder<R> decoder);

	/**
	 * Reads a single row, decoding it.
	 * 
	 * @param <R> The decoded type.
	 * @param schema The table.
	 * @param columns The columns to read.
	 * @param where The full primary key.
	 * @param decoder Run on the row, or on null if the row doesn't exist.
	 * @return The asynchronously-completed future.
	 */
	<R> FutureRead<R> selectOne(TableSchema schema, List<String> columns, List<Where> where, IRowDecoder<R> decoder);

	/**
	 * Writes a row.
	 * 
	 * @param schema The table.
	 * @param values The data columns to write.
	 * @param where The full primary key.
	 * @return The asynchronously-completed future.
	 */
	FutureVoid upsert(TableSchema schema, Map<String, Object> values, List<Where> where);

	/**
	 * Deletes matching rows.
	 * 
	 * @param schema The table.
	 * @param where The equality restrictions.
	 * @return The asynchronously-completed future.
	 */
	FutureVoid delete(TableSchema schema, List<Where> where);
}
