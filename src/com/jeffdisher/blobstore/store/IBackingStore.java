package com.jeffdisher.blobstore.store;

import java.util.List;
import java.util.Map;

import com.jeffdisher.blobstore.types.BackingStoreException;
import com.jeffdisher.blobstore.types.Row;
import com.jeffdisher.blobstore.types.TableSchema;
import com.jeffdisher.blobstore.types.Where;


/**
 * The abstract interface sitting on top of the wide-column database, allowing for local testing.
 * Statement building, connection management, retries and request throttling are all the implementation's concern:  the
 * blob store only sees these blocking calls, which it runs on its scheduler threads.
 * Implementations must be safe to call from multiple threads.
 */
public interface IBackingStore
{
	/**
	 * Creates the keyspace and table described by the schema, if they don't already exist.
	 * 
	 * @param schema The table to provision.
	 * @throws BackingStoreException If the store couldn't be contacted or refused the schema.
	 */
	void provisionTable(TableSchema schema) throws BackingStoreException;

	/**
	 * Reads all rows matching every restriction.
	 * 
	 * @param schema The table to read.
	 * @param columns The columns to return.
	 * @param where The equality restrictions (at least the partition key).
	 * @return The matching rows, ordered by cluster key (never null).
	 * @throws BackingStoreException If the store couldn't be contacted.
	 */
	List<Row> select(TableSchema schema, List<String> columns, List<Where> where) throws BackingStoreException;

	/**
	 * Reads the single row matching every restriction.
	 * 
	 * @param schema The table to read.
	 * @param columns The columns to return.
	 * @param where The equality restrictions (the full primary key).
	 * @return The row or null, if there isn't one.
	 * @throws BackingStoreException If the store couldn't be contacted.
	 */
	Row selectOne(TableSchema schema, List<String> columns, List<Where> where) throws BackingStoreException;

	/**
	 * Writes the given data columns into the row addressed by the restrictions, creating it if needed.
	 * 
	 * @param schema The table to write.
	 * @param values The data column values to set.
	 * @param where The full primary key of the row.
	 * @throws BackingStoreException If the store couldn't be contacted or the write failed.
	 */
	void upsert(TableSchema schema, Map<String, Object> values, List<Where> where) throws BackingStoreException;

	/**
	 * Deletes all rows matching every restriction.
	 * 
	 * @param schema The table to modify.
	 * @param where The equality restrictions (at least the partition key).
	 * @throws BackingStoreException If the store couldn't be contacted or the delete failed.
	 */
	void delete(TableSchema schema, List<Where> where) throws BackingStoreException;
}
