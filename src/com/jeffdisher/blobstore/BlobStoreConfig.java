package com.jeffdisher.blobstore;

import java.util.Map;

import com.jeffdisher.blobstore.blobs.BlobStore;
import com.jeffdisher.blobstore.types.UsageException;


/**
 * The tunables of a BlobStoreRuntime.
 */
public record BlobStoreConfig(String keyspace
		, String tablePrefix
		, int defaultSegmentLength
		, long segmentTtlMillis
		, long segmentSweepMillis
		, long metadataTtlMillis
		, long metadataSweepMillis
		, int schedulerThreads
		, boolean verbose
)
{
	public static final String DEFAULT_KEYSPACE = "global";
	public static final long DEFAULT_SEGMENT_TTL_MILLIS = 100_000L;
	public static final long DEFAULT_SEGMENT_SWEEP_MILLIS = 50_000L;
	public static final long DEFAULT_METADATA_TTL_MILLIS = 200_000L;
	public static final long DEFAULT_METADATA_SWEEP_MILLIS = 100_000L;
	public static final int DEFAULT_SCHEDULER_THREADS = 4;

	public static BlobStoreConfig defaults()
	{
		return new BlobStoreConfig(DEFAULT_KEYSPACE
				, ""
				, BlobStore.DEFAULT_SEGMENT_LENGTH
				, DEFAULT_SEGMENT_TTL_MILLIS
				, DEFAULT_SEGMENT_SWEEP_MILLIS
				, DEFAULT_METADATA_TTL_MILLIS
				, DEFAULT_METADATA_SWEEP_MILLIS
				, DEFAULT_SCHEDULER_THREADS
				, false
		);
	}

	/**
	 * Builds a config from the defaults, overridden by whichever EnvVars are set in the given map (normally
	 * System.getenv()).
	 * 
	 * @param environment The environment variables.
	 * @return The config.
	 * @throws UsageException A numeric variable wasn't a positive number.
	 */
	public static BlobStoreConfig fromEnvironment(Map<String, String> environment) throws UsageException
	{
		BlobStoreConfig defaults = defaults();
		String keyspace = environment.getOrDefault(EnvVars.ENV_VAR_BLOBSTORE_KEYSPACE, defaults.keyspace);
		if (keyspace.isEmpty())
		{
			throw new UsageException(EnvVars.ENV_VAR_BLOBSTORE_KEYSPACE + " cannot be empty");
		}
		return new BlobStoreConfig(keyspace
				, environment.getOrDefault(EnvVars.ENV_VAR_BLOBSTORE_TABLE_PREFIX, defaults.tablePrefix)
				, (int) _readPositive(environment, EnvVars.ENV_VAR_BLOBSTORE_SEGMENT_LENGTH, defaults.defaultSegmentLength, Integer.MAX_VALUE)
				, _readPositive(environment, EnvVars.ENV_VAR_BLOBSTORE_SEGMENT_TTL_MILLIS, defaults.segmentTtlMillis, Long.MAX_VALUE)
				, _readPositive(environment, EnvVars.ENV_VAR_BLOBSTORE_SEGMENT_SWEEP_MILLIS, defaults.segmentSweepMillis, Long.MAX_VALUE)
				, _readPositive(environment, EnvVars.ENV_VAR_BLOBSTORE_METADATA_TTL_MILLIS, defaults.metadataTtlMillis, Long.MAX_VALUE)
				, _readPositive(environment, EnvVars.ENV_VAR_BLOBSTORE_METADATA_SWEEP_MILLIS, defaults.metadataSweepMillis, Long.MAX_VALUE)
				, (int) _readPositive(environment, EnvVars.ENV_VAR_BLOBSTORE_SCHEDULER_THREADS, defaults.schedulerThreads, Integer.MAX_VALUE)
				, (null != environment.get(EnvVars.ENV_VAR_BLOBSTORE_VERBOSE))
		);
	}


	private static long _readPositive(Map<String, String> environment, String name, long defaultValue, long max) throws UsageException
	{
		String raw = environment.get(name);
		long value = defaultValue;
		if (null != raw)
		{
			try
			{
				value = Long.parseLong(raw.trim());
			}
			catch (NumberFormatException e)
			{
				throw new UsageException(name + " must be a number: \"" + raw + "\"");
			}
			if ((value <= 0L) || (value > max))
			{
				throw new UsageException(name + " must be a positive number no larger than " + max + ": " + value);
			}
		}
		return value;
	}
}
