package com.jeffdisher.blobstore.types;


/**
 * An equality restriction on a single column, used to address rows in the backing store.
 * 
 * @param column The column name.
 * @param value The value the column must equal.
 */
public record Where(String column, Object value)
{
}
