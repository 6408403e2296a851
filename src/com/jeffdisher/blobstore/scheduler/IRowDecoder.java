package com.jeffdisher.blobstore.scheduler;

import com.jeffdisher.blobstore.types.CorruptRowException;
import com.jeffdisher.blobstore.types.Row;


/**
 * Converts a row read from the backing store into a higher-level type.  Decoders run on the scheduler thread which
 * performed the read so they must not block on other scheduler operations.
 * 
 * @param <R> The decoded type.
 */
public interface IRowDecoder<R>
{
	/**
	 * @param row The row (null if the row doesn't exist, when used with selectOne).
	 * @return The decoded value (can be null).
	 * @throws CorruptRowException If the row data couldn't be interpreted.
	 */
	R decode(Row row) throws CorruptRowException;
}
