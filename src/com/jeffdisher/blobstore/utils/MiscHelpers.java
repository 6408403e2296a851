package com.jeffdisher.blobstore.utils;


/**
 * Basic utilities for miscellaneous uses.
 */
public class MiscHelpers
{
	private static final long KIB = 1024L;
	private static final long MIB = 1024L * KIB;
	private static final long GIB = 1024L * MIB;

	/**
	 * Describes a byte count in binary units, since segment lengths are normally powers of two.
	 * 
	 * @param bytes The raw number of bytes.
	 * @return A human-readable string, like "1.00 MiB (1048576 bytes)".
	 */
	public static String humanReadableBytes(long bytes)
	{
		String firstPart = null;
		if (bytes >= GIB)
		{
			firstPart = _getMagnitudeString(bytes, GIB, "GiB");
		}
		else if (bytes >= MIB)
		{
			firstPart = _getMagnitudeString(bytes, MIB, "MiB");
		}
		else if (bytes >= KIB)
		{
			firstPart = _getMagnitudeString(bytes, KIB, "KiB");
		}
		return (null != firstPart)
				? (firstPart + " (" + bytes + " bytes)")
				: (bytes + " bytes")
		;
	}

	/**
	 * Creates a daemon thread with the given name.  The scheduler workers and cache sweepers are still expected to be
	 * stopped explicitly.
	 * 
	 * @param runnable The body of the thread.
	 * @param name The name of the thread.
	 * @return The thread (not yet started).
	 */
	public static Thread createThread(Runnable runnable, String name)
	{
		Thread thread = new Thread(runnable, name);
		thread.setDaemon(true);
		return thread;
	}


	private static String _getMagnitudeString(long bytes, long unit, String suffix)
	{
		double direct = (double)bytes / (double)unit;
		return String.format("%.2f %s", direct, suffix);
	}
}
