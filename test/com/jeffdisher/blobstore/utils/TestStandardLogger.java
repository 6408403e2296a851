package com.jeffdisher.blobstore.utils;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.blobstore.types.ILogger;


public class TestStandardLogger
{
	@Test
	public void testNestedPrefixes() throws Throwable
	{
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream stream = new PrintStream(bytes, true, StandardCharsets.UTF_8);
		StandardLogger top = StandardLogger.topLogger(stream, false);
		ILogger first = top.logStart("first");
		first.logOperation("working");
		ILogger nested = first.logStart("nested");
		nested.logVerbose("hidden");
		nested.logFinish("nested done");
		first.logFinish("first done");
		top.logStart("second").logFinish("second done");
		String expected = ">1> first\n"
				+ "=1= working\n"
				+ ">1.1> nested\n"
				+ "<1.1< nested done\n"
				+ "<1< first done\n"
				+ ">2> second\n"
				+ "<2< second done\n"
		;
		Assert.assertEquals(expected, bytes.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n"));
		Assert.assertFalse(top.didErrorOccur());
	}

	@Test
	public void testErrorPropagatesToParent() throws Throwable
	{
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		StandardLogger top = StandardLogger.topLogger(new PrintStream(bytes, true, StandardCharsets.UTF_8), true);
		ILogger operation = top.logStart("operation");
		operation.logVerbose("shown");
		operation.logError("failed");
		Assert.assertTrue(operation.didErrorOccur());
		Assert.assertFalse(top.didErrorOccur());
		operation.logFinish("done");
		Assert.assertTrue(top.didErrorOccur());
		Assert.assertTrue(bytes.toString(StandardCharsets.UTF_8).contains("*1* shown"));
	}
}
