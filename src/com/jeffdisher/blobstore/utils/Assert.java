package com.jeffdisher.blobstore.utils;


/**
 * Checks for states the blob store believes to be impossible (these can't be disabled, unlike the assert keyword).
 * Failures of the backing store are never reported this way:  they are BackingStoreExceptions.
 */
public class Assert
{
	/**
	 * Called when an exception was not expected, such as an interruption on a thread we never interrupt.
	 * 
	 * @param e The unexpected exception.
	 * @return Does not return - this is only here so the caller can throw this to satisfy the compiler.
	 */
	public static AssertionError unexpected(Exception e)
	{
		throw new AssertionError("Unexpected exception", e);
	}

	public static void assertTrue(boolean flag)
	{
		if (!flag)
		{
			throw new AssertionError("Expected true");
		}
	}

	/**
	 * Like assertTrue(boolean) but describes the broken invariant.
	 * 
	 * @param flag The statement which must be true.
	 * @param invariant What was expected, for the error message.
	 */
	public static void assertTrue(boolean flag, String invariant)
	{
		if (!flag)
		{
			throw new AssertionError("Invariant violated: " + invariant);
		}
	}
}
