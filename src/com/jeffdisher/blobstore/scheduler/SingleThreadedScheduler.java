package com.jeffdisher.blobstore.scheduler;

import java.util.List;
import java.util.Map;

import com.jeffdisher.blobstore.store.IBackingStore;
import com.jeffdisher.blobstore.types.TableSchema;
import com.jeffdisher.blobstore.types.Where;


/**
 * An implementation of IStoreScheduler which runs all calls inline, before returning the future.
 * This is mostly meant for tests, where deterministic ordering matters more than throughput.
 */
public class SingleThreadedScheduler implements IStoreScheduler
{
	private final IBackingStore _store;

	public SingleThreadedScheduler(IBackingStore store)
	{
		_store = store;
	}

	@Override
	public FutureVoid provision(TableSchema schema)
	{
		FutureVoid future = new FutureVoid();
		StoreOperations.provision(_store, future, schema);
		return future;
	}

	@Override
	public <R> FutureRead<List<R>> select(TableSchema schema, List<String> columns, List<Where> where, IRowDecoder<R> decoder)
	{
		FutureRead<List<R>> future = new FutureRead<>();
		StoreOperations.select(_store, future, schema, columns, where, decoder);
		return future;
	}

	@Override
	public <R> FutureRead<R> selectOne(TableSchema schema, List<String> columns, List<Where> where, IRowDecoder<R> decoder)
	{
		FutureRead<R> future = new FutureRead<>();
		StoreOperations.selectOne(_store, future, schema, columns, where, decoder);
		return future;
	}

	@Override
	public FutureVoid upsert(TableSchema schema, Map<String, Object> values, List<Where> where)
	{
		FutureVoid future = new FutureVoid();
		StoreOperations.upsert(_store, future, schema, values, where);
		return future;
	}

	@Override
	public FutureVoid delete(TableSchema schema, List<Where> where)
	{
		FutureVoid future = new FutureVoid();
		StoreOperations.delete(_store, future, schema, where);
		return future;
	}
}
