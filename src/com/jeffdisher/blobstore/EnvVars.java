package com.jeffdisher.blobstore;


/**
 * Just contains the environment variables the system checks.
 */
public class EnvVars
{
	/**
	 * The keyspace holding the blob tables.  Defaults to "global" if not set.
	 */
	public static final String ENV_VAR_BLOBSTORE_KEYSPACE = "BLOBSTORE_KEYSPACE";

	/**
	 * Prepended to the table names, so that several blob stores can share one keyspace.  Defaults to no prefix.
	 */
	public static final String ENV_VAR_BLOBSTORE_TABLE_PREFIX = "BLOBSTORE_TABLE_PREFIX";

	/**
	 * The segment length, in bytes, of newly-created blobs which don't request their own.  Defaults to 1 MiB.
	 */
	public static final String ENV_VAR_BLOBSTORE_SEGMENT_LENGTH = "BLOBSTORE_SEGMENT_LENGTH";

	public static final String ENV_VAR_BLOBSTORE_SEGMENT_TTL_MILLIS = "BLOBSTORE_SEGMENT_TTL_MILLIS";
	public static final String ENV_VAR_BLOBSTORE_SEGMENT_SWEEP_MILLIS = "BLOBSTORE_SEGMENT_SWEEP_MILLIS";
	public static final String ENV_VAR_BLOBSTORE_METADATA_TTL_MILLIS = "BLOBSTORE_METADATA_TTL_MILLIS";
	public static final String ENV_VAR_BLOBSTORE_METADATA_SWEEP_MILLIS = "BLOBSTORE_METADATA_SWEEP_MILLIS";

	/**
	 * The number of threads used to call the backing store.  Defaults to 4.
	 */
	public static final String ENV_VAR_BLOBSTORE_SCHEDULER_THREADS = "BLOBSTORE_SCHEDULER_THREADS";

	/**
	 * Enables verbose console logging.  If not set, verbose logs will not be written to the console.
	 */
	public static final String ENV_VAR_BLOBSTORE_VERBOSE = "BLOBSTORE_VERBOSE";
}
