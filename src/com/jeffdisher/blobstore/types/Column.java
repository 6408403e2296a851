package com.jeffdisher.blobstore.types;


/**
 * A single column declaration in a TableSchema.
 * 
 * @param name The column name, as known to the backing store.
 * @param dataType The backing store's data type name (ascii, int, bigint, text, blob).
 * @param type The role of the column in the key.
 */
public record Column(String name, String dataType, ColumnType type)
{
}
