package com.jeffdisher.blobstore.types;

import java.util.List;


/**
 * The declared shape of a table in the backing store.  The backing store uses this to provision the keyspace and
 * table, if they don't already exist.
 * 
 * @param keyspace The keyspace containing the table.
 * @param name The table name (including any prefix).
 * @param columns The columns, in declaration order.
 */
public record TableSchema(String keyspace, String name, List<Column> columns)
{
	public TableSchema
	{
		columns = List.copyOf(columns);
	}

	/**
	 * @return The fully-qualified name of the table ("keyspace.name").
	 */
	public String qualifiedName()
	{
		return keyspace + "." + name;
	}

	/**
	 * @return The columns forming the primary key (partition keys followed by cluster keys), in declaration order.
	 */
	public List<Column> keyColumns()
	{
		return columns.stream()
				.filter((Column column) -> (ColumnType.DATA_COLUMN != column.type()))
				.toList()
		;
	}

	/**
	 * @param columnName A column name.
	 * @return The column with this name, or null if there isn't one.
	 */
	public Column getColumn(String columnName)
	{
		Column match = null;
		for (Column column : columns)
		{
			if (column.name().equals(columnName))
			{
				match = column;
				break;
			}
		}
		return match;
	}
}
