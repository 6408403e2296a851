package com.jeffdisher.blobstore;

import java.util.function.LongSupplier;

import com.jeffdisher.blobstore.blobs.BlobMetadataStore;
import com.jeffdisher.blobstore.blobs.BlobStore;
import com.jeffdisher.blobstore.blobs.SegmentStore;
import com.jeffdisher.blobstore.caches.CacheRegistry;
import com.jeffdisher.blobstore.scheduler.MultiThreadedScheduler;
import com.jeffdisher.blobstore.store.IBackingStore;
import com.jeffdisher.blobstore.store.Table;
import com.jeffdisher.blobstore.store.TableWriter;
import com.jeffdisher.blobstore.types.BackingStoreException;
import com.jeffdisher.blobstore.types.ILogger;
import com.jeffdisher.blobstore.types.TableSchema;
import com.jeffdisher.blobstore.types.UsageException;
import com.jeffdisher.blobstore.utils.Assert;
import com.jeffdisher.blobstore.utils.MiscHelpers;
import com.jeffdisher.blobstore.utils.StandardLogger;


/**
 * Wires the blob store together over a backing store and owns its lifecycle.
 * start() provisions the tables and starts the cache sweeps.  stop() flushes every cache through its write-back
 * path and then shuts down the store scheduler, so nothing buffered is lost on an orderly shutdown (a write-back
 * which fails during that flush is only logged).
 * Each instance can only be started and stopped once.
 */
public class BlobStoreRuntime
{
	/**
	 * Creates a runtime configured from the process environment (see EnvVars), logging to the console.
	 * 
	 * @param backingStore The backing store.
	 * @return The runtime (not yet started).
	 * @throws UsageException An environment variable had an invalid value.
	 */
	public static BlobStoreRuntime fromEnvironment(IBackingStore backingStore) throws UsageException
	{
		BlobStoreConfig config = BlobStoreConfig.fromEnvironment(System.getenv());
		ILogger logger = StandardLogger.topLogger(System.out, config.verbose());
		return new BlobStoreRuntime(backingStore, config, logger, System::currentTimeMillis);
	}


	private final IBackingStore _backingStore;
	private final BlobStoreConfig _config;
	private final ILogger _logger;
	private final LongSupplier _clock;

	private MultiThreadedScheduler _scheduler;
	private CacheRegistry _registry;
	private BlobStore _blobStore;
	private boolean _wasStarted;

	public BlobStoreRuntime(IBackingStore backingStore, BlobStoreConfig config, ILogger logger, LongSupplier clock)
	{
		_backingStore = backingStore;
		_config = config;
		_logger = logger;
		_clock = clock;
	}

	/**
	 * Starts the store.
	 * 
	 * @throws BackingStoreException The tables couldn't be provisioned (the runtime is left stopped).
	 */
	public synchronized void start() throws BackingStoreException
	{
		Assert.assertTrue(!_wasStarted, "runtime started once");
		_wasStarted = true;
		ILogger log = _logger.logStart("Starting blob store in keyspace \"" + _config.keyspace() + "\"");
		MultiThreadedScheduler scheduler = new MultiThreadedScheduler(_backingStore, _config.schedulerThreads());
		TableSchema metadataSchema = BlobMetadataStore.createSchema(_config.keyspace(), _config.tablePrefix());
		TableSchema segmentSchema = SegmentStore.createSchema(_config.keyspace(), _config.tablePrefix());
		Table metadataTable = new Table(scheduler, metadataSchema);
		Table segmentTable = new Table(scheduler, segmentSchema);
		try
		{
			metadataTable.provision().get();
			segmentTable.provision().get();
		}
		catch (BackingStoreException e)
		{
			log.logError("Failed to provision tables: " + e.getLocalizedMessage());
			log.logFinish("Start failed");
			scheduler.shutdown();
			throw e;
		}
		log.logOperation("Provisioned " + metadataSchema.qualifiedName() + " and " + segmentSchema.qualifiedName());

		CacheRegistry registry = new CacheRegistry(_logger, _clock);
		BlobMetadataStore metadata = new BlobMetadataStore(registry
				, metadataTable
				, new TableWriter(scheduler, metadataSchema)
				, _logger
				, _config.metadataTtlMillis()
				, _config.metadataSweepMillis()
		);
		SegmentStore segments = new SegmentStore(registry
				, segmentTable
				, new TableWriter(scheduler, segmentSchema)
				, _logger
				, _config.segmentTtlMillis()
				, _config.segmentSweepMillis()
		);
		registry.start();
		_scheduler = scheduler;
		_registry = registry;
		_blobStore = new BlobStore(metadata, segments, _logger, _clock, _config.defaultSegmentLength());
		log.logFinish("Started with default segment length " + MiscHelpers.humanReadableBytes(_config.defaultSegmentLength()));
	}

	public synchronized BlobStore getBlobStore()
	{
		Assert.assertTrue(null != _blobStore, "runtime is running");
		return _blobStore;
	}

	public synchronized CacheRegistry getCacheRegistry()
	{
		Assert.assertTrue(null != _registry, "runtime is running");
		return _registry;
	}

	/**
	 * Flushes and stops the store.  Does nothing if it isn't running.
	 */
	public synchronized void stop()
	{
		if (null != _registry)
		{
			ILogger log = _logger.logStart("Stopping blob store");
			_registry.stop();
			_scheduler.shutdown();
			_registry = null;
			_scheduler = null;
			_blobStore = null;
			log.logFinish("Stopped");
		}
	}
}
