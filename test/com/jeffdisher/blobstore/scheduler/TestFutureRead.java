package com.jeffdisher.blobstore.scheduler;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.blobstore.types.BackingStoreException;


public class TestFutureRead
{
	@Test
	public void testCompletedNull() throws Throwable
	{
		FutureRead<String> future = FutureRead.completed(null);
		Assert.assertTrue(future.isDone());
		Assert.assertNull(future.get());
	}

	@Test
	public void testFailure() throws Throwable
	{
		FutureRead<String> future = new FutureRead<>();
		BackingStoreException error = new BackingStoreException("down", null);
		future.failure(error);
		try
		{
			future.get();
			Assert.fail();
		}
		catch (BackingStoreException e)
		{
			Assert.assertSame(error, e);
		}
	}

	@Test
	public void testCrossThread() throws Throwable
	{
		FutureRead<String> future = new FutureRead<>();
		Thread producer = new Thread(() -> {
			try
			{
				Thread.sleep(50L);
			}
			catch (InterruptedException e)
			{
				throw new AssertionError(e);
			}
			future.success("value");
		});
		producer.start();
		Assert.assertEquals("value", future.get());
		producer.join();
	}

	@Test
	public void testVoidFailure() throws Throwable
	{
		FutureVoid future = new FutureVoid();
		future.failure(new BackingStoreException("down", null));
		try
		{
			future.get();
			Assert.fail();
		}
		catch (BackingStoreException e)
		{
			Assert.assertEquals("down", e.getMessage());
		}
	}
}
