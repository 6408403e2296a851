package com.jeffdisher.blobstore.types;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;


/**
 * A single row returned from the backing store, as a map of column name to value.
 * Values are the Java representation of the column type:  String for ascii/text, Integer for int, Long for bigint,
 * byte[] for blob.
 */
public class Row
{
	private final Map<String, Object> _values;

	public Row(Map<String, Object> values)
	{
		_values = Collections.unmodifiableMap(new HashMap<>(values));
	}

	public Object get(String column)
	{
		return _values.get(column);
	}

	public String getString(String column)
	{
		return (String) _values.get(column);
	}

	public int getInt(String column)
	{
		Number value = (Number) _values.get(column);
		return (null != value)
				? value.intValue()
				: 0
		;
	}

	public long getLong(String column)
	{
		Number value = (Number) _values.get(column);
		return (null != value)
				? value.longValue()
				: 0L
		;
	}

	public byte[] getBytes(String column)
	{
		return (byte[]) _values.get(column);
	}

	public Map<String, Object> values()
	{
		return _values;
	}
}
