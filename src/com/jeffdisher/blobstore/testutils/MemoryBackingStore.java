package com.jeffdisher.blobstore.testutils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.jeffdisher.blobstore.store.IBackingStore;
import com.jeffdisher.blobstore.types.BackingStoreException;
import com.jeffdisher.blobstore.types.Column;
import com.jeffdisher.blobstore.types.Row;
import com.jeffdisher.blobstore.types.TableSchema;
import com.jeffdisher.blobstore.types.Where;


/**
 * An in-memory IBackingStore for tests.
 * Tables must be provisioned before use.  Rows are keyed by their key columns, in schema order, and byte[] values are
 * copied in and out so callers can't alias stored data.  Counts the calls made and can be told to fail reads or writes.
 */
public class MemoryBackingStore implements IBackingStore
{
	private final Map<String, Map<List<Object>, Map<String, Object>>> _tables = new HashMap<>();
	private int _selectCount;
	private int _upsertCount;
	private int _deleteCount;
	private boolean _failReads;
	private int _failNextReads;
	private boolean _failWrites;

	@Override
	public synchronized void provisionTable(TableSchema schema) throws BackingStoreException
	{
		if (schema.keyColumns().isEmpty())
		{
			throw new BackingStoreException("Table " + schema.qualifiedName() + " has no key", null);
		}
		_tables.putIfAbsent(schema.qualifiedName(), new LinkedHashMap<>());
	}

	@Override
	public synchronized List<Row> select(TableSchema schema, List<String> columns, List<Where> where) throws BackingStoreException
	{
		_selectCount += 1;
		_checkRead(schema);
		List<Row> rows = new ArrayList<>();
		for (Map<String, Object> row : _getTable(schema).values())
		{
			if (_matches(row, where))
			{
				rows.add(_project(row, columns));
			}
		}
		return rows;
	}

	@Override
	public synchronized Row selectOne(TableSchema schema, List<String> columns, List<Where> where) throws BackingStoreException
	{
		_selectCount += 1;
		_checkRead(schema);
		Row match = null;
		for (Map<String, Object> row : _getTable(schema).values())
		{
			if (_matches(row, where))
			{
				match = _project(row, columns);
				break;
			}
		}
		return match;
	}

	@Override
	public synchronized void upsert(TableSchema schema, Map<String, Object> values, List<Where> where) throws BackingStoreException
	{
		_upsertCount += 1;
		Map<List<Object>, Map<String, Object>> table = _getTable(schema);
		if (_failWrites)
		{
			throw new BackingStoreException("Injected write failure on " + schema.qualifiedName(), null);
		}
		Map<String, Object> keyValues = new HashMap<>();
		for (Where clause : where)
		{
			keyValues.put(clause.column(), clause.value());
		}
		List<Object> key = new ArrayList<>();
		for (Column column : schema.keyColumns())
		{
			if (!keyValues.containsKey(column.name()))
			{
				throw new BackingStoreException("Upsert on " + schema.qualifiedName() + " missing key column " + column.name(), null);
			}
			key.add(keyValues.get(column.name()));
		}
		Map<String, Object> row = table.get(key);
		if (null == row)
		{
			row = new HashMap<>(keyValues);
			table.put(key, row);
		}
		for (Map.Entry<String, Object> elt : values.entrySet())
		{
			if (null == schema.getColumn(elt.getKey()))
			{
				throw new BackingStoreException("Unknown column " + elt.getKey() + " in " + schema.qualifiedName(), null);
			}
			row.put(elt.getKey(), _copy(elt.getValue()));
		}
	}

	@Override
	public synchronized void delete(TableSchema schema, List<Where> where) throws BackingStoreException
	{
		_deleteCount += 1;
		Map<List<Object>, Map<String, Object>> table = _getTable(schema);
		if (_failWrites)
		{
			throw new BackingStoreException("Injected delete failure on " + schema.qualifiedName(), null);
		}
		table.values().removeIf((Map<String, Object> row) -> _matches(row, where));
	}

	public synchronized int getSelectCount()
	{
		return _selectCount;
	}

	public synchronized int getUpsertCount()
	{
		return _upsertCount;
	}

	public synchronized int getDeleteCount()
	{
		return _deleteCount;
	}

	public synchronized void setFailReads(boolean fail)
	{
		_failReads = fail;
	}

	/**
	 * Makes the next count reads fail, after which reads succeed again.
	 */
	public synchronized void failNextReads(int count)
	{
		_failNextReads = count;
	}

	/**
	 * Makes upserts and deletes fail (they are still counted).
	 */
	public synchronized void setFailWrites(boolean fail)
	{
		_failWrites = fail;
	}

	public synchronized int rowCount(TableSchema schema)
	{
		Map<List<Object>, Map<String, Object>> table = _tables.get(schema.qualifiedName());
		return (null != table)
				? table.size()
				: 0
		;
	}

	/**
	 * Reads a row without counting or failing (for test assertions).
	 */
	public synchronized Row peek(TableSchema schema, List<Where> where)
	{
		Row match = null;
		Map<List<Object>, Map<String, Object>> table = _tables.get(schema.qualifiedName());
		if (null != table)
		{
			for (Map<String, Object> row : table.values())
			{
				if (_matches(row, where))
				{
					match = _project(row, null);
					break;
				}
			}
		}
		return match;
	}


	private Map<List<Object>, Map<String, Object>> _getTable(TableSchema schema) throws BackingStoreException
	{
		Map<List<Object>, Map<String, Object>> table = _tables.get(schema.qualifiedName());
		if (null == table)
		{
			throw new BackingStoreException("Table not provisioned: " + schema.qualifiedName(), null);
		}
		return table;
	}

	private void _checkRead(TableSchema schema) throws BackingStoreException
	{
		if (_failReads)
		{
			throw new BackingStoreException("Injected read failure on " + schema.qualifiedName(), null);
		}
		if (_failNextReads > 0)
		{
			_failNextReads -= 1;
			throw new BackingStoreException("Injected read failure on " + schema.qualifiedName(), null);
		}
	}

	private static boolean _matches(Map<String, Object> row, List<Where> where)
	{
		boolean matches = true;
		for (Where clause : where)
		{
			if (!clause.value().equals(row.get(clause.column())))
			{
				matches = false;
				break;
			}
		}
		return matches;
	}

	private static Row _project(Map<String, Object> row, List<String> columns)
	{
		Map<String, Object> projected = new HashMap<>();
		for (Map.Entry<String, Object> elt : row.entrySet())
		{
			if ((null == columns) || columns.contains(elt.getKey()))
			{
				projected.put(elt.getKey(), _copy(elt.getValue()));
			}
		}
		return new Row(projected);
	}

	private static Object _copy(Object value)
	{
		return (value instanceof byte[])
				? ((byte[]) value).clone()
				: value
		;
	}
}
