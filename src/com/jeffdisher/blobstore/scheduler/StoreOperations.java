package com.jeffdisher.blobstore.scheduler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.jeffdisher.blobstore.store.IBackingStore;
import com.jeffdisher.blobstore.types.BackingStoreException;
import com.jeffdisher.blobstore.types.CorruptRowException;
import com.jeffdisher.blobstore.types.Row;
import com.jeffdisher.blobstore.types.TableSchema;
import com.jeffdisher.blobstore.types.Where;


/**
 * The bodies of the scheduled operations, shared by the scheduler implementations:  each one runs the blocking
 * backing store call and resolves the future with its result or failure.
 * Unchecked failures from the store or a decoder are also turned into failures of the future so the worker thread
 * survives and the caller is never left waiting.
 */
class StoreOperations
{
	static void provision(IBackingStore store, FutureVoid future, TableSchema schema)
	{
		try
		{
			store.provisionTable(schema);
			future.success();
		}
		catch (BackingStoreException e)
		{
			future.failure(e);
		}
		catch (RuntimeException e)
		{
			future.failure(_storeFault(schema, e));
		}
	}

	static <R> void select(IBackingStore store, FutureRead<List<R>> future, TableSchema schema, List<String> columns, List<Where> where, IRowDecoder<R> decoder)
	{
		try
		{
			List<Row> rows = store.select(schema, columns, where);
			List<R> decoded = new ArrayList<>();
			for (Row row : rows)
			{
				decoded.add(_decode(schema, decoder, row));
			}
			future.success(decoded);
		}
		catch (BackingStoreException e)
		{
			future.failure(e);
		}
		catch (RuntimeException e)
		{
			future.failure(_storeFault(schema, e));
		}
	}

	static <R> void selectOne(IBackingStore store, FutureRead<R> future, TableSchema schema, List<String> columns, List<Where> where, IRowDecoder<R> decoder)
	{
		try
		{
			Row row = store.selectOne(schema, columns, where);
			future.success(_decode(schema, decoder, row));
		}
		catch (BackingStoreException e)
		{
			future.failure(e);
		}
		catch (RuntimeException e)
		{
			future.failure(_storeFault(schema, e));
		}
	}

	static void upsert(IBackingStore store, FutureVoid future, TableSchema schema, Map<String, Object> values, List<Where> where)
	{
		try
		{
			store.upsert(schema, values, where);
			future.success();
		}
		catch (BackingStoreException e)
		{
			future.failure(e);
		}
		catch (RuntimeException e)
		{
			future.failure(_storeFault(schema, e));
		}
	}

	static void delete(IBackingStore store, FutureVoid future, TableSchema schema, List<Where> where)
	{
		try
		{
			store.delete(schema, where);
			future.success();
		}
		catch (BackingStoreException e)
		{
			future.failure(e);
		}
		catch (RuntimeException e)
		{
			future.failure(_storeFault(schema, e));
		}
	}


	private static <R> R _decode(TableSchema schema, IRowDecoder<R> decoder, Row row) throws CorruptRowException
	{
		try
		{
			return decoder.decode(row);
		}
		catch (RuntimeException e)
		{
			// Mistyped or missing columns surface here as ClassCastException and the like.
			throw new CorruptRowException(schema.qualifiedName(), e.toString(), e);
		}
	}

	private static BackingStoreException _storeFault(TableSchema schema, RuntimeException e)
	{
		return new BackingStoreException("Unexpected failure on " + schema.qualifiedName() + ": " + e, e);
	}
}
