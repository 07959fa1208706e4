package com.jeffdisher.convoy.config;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.convoy.config.TabListReader.TabListException;


public class TestSimpleTabListCallbacks
{
	@Test
	public void requiredAndOptional() throws Throwable
	{
		SimpleTabListCallbacks<String, String> callbacks = _callbacks();
		SimpleTabListCallbacks.SubRecordCapture<String, Short> numbers = callbacks.captureSubRecord("number", SimpleTabListCallbacks.single(new IValueTransformer.UnsignedShortTransformer("number")), true);
		SimpleTabListCallbacks.SubRecordCapture<String, List<String>> tags = callbacks.captureSubRecord("tags", (String[] parameters) -> List.of(parameters), false);
		_read(callbacks, "first\tFirst\n\tnumber\t1\n\ttags\ta\tb\nsecond\tSecond\n\tnumber\t2\n");
		
		Assert.assertEquals(List.of("first", "second"), callbacks.keyOrder);
		Assert.assertEquals("Second", callbacks.topLevel.get("second"));
		Assert.assertEquals((short)1, numbers.recordData.get("first").shortValue());
		Assert.assertEquals((short)2, numbers.recordData.get("second").shortValue());
		Assert.assertEquals(List.of("a", "b"), tags.recordData.get("first"));
		Assert.assertFalse(tags.recordData.containsKey("second"));
	}

	@Test
	public void missingRequired() throws Throwable
	{
		SimpleTabListCallbacks<String, String> callbacks = _callbacks();
		callbacks.captureSubRecord("number", SimpleTabListCallbacks.single((String value) -> value), true);
		callbacks.captureSubRecord("guid", SimpleTabListCallbacks.single((String value) -> value), true);
		try
		{
			_read(callbacks, "first\tFirst\n");
			Assert.fail();
		}
		catch (TabListException e)
		{
			Assert.assertEquals("Missing sub-records in first: guid number", e.getMessage());
		}
	}

	@Test(expected=TabListException.class)
	public void duplicateSubRecord() throws Throwable
	{
		SimpleTabListCallbacks<String, String> callbacks = _callbacks();
		callbacks.captureSubRecord("number", SimpleTabListCallbacks.single((String value) -> value), true);
		_read(callbacks, "first\tFirst\n\tnumber\t1\n\tnumber\t2\n");
	}

	@Test(expected=TabListException.class)
	public void unknownSubRecord() throws Throwable
	{
		SimpleTabListCallbacks<String, String> callbacks = _callbacks();
		_read(callbacks, "first\tFirst\n\tcolour\tred\n");
	}

	@Test
	public void badValueNamesRecord() throws Throwable
	{
		SimpleTabListCallbacks<String, String> callbacks = _callbacks();
		callbacks.captureSubRecord("number", SimpleTabListCallbacks.single(new IValueTransformer.UnsignedShortTransformer("number")), true);
		try
		{
			_read(callbacks, "first\tFirst\n\tnumber\t-4\n");
			Assert.fail();
		}
		catch (TabListException e)
		{
			Assert.assertEquals("first: number: Values for number must be in 0..65535: \"-4\"", e.getMessage());
		}
	}

	@Test(expected=TabListException.class)
	public void singleRequiresOneParameter() throws Throwable
	{
		SimpleTabListCallbacks<String, String> callbacks = _callbacks();
		callbacks.captureSubRecord("number", SimpleTabListCallbacks.single((String value) -> value), true);
		_read(callbacks, "first\tFirst\n\tnumber\t1\t2\n");
	}


	private static SimpleTabListCallbacks<String, String> _callbacks()
	{
		return new SimpleTabListCallbacks<>((String value) -> value, (String value) -> value);
	}

	private static void _read(SimpleTabListCallbacks<String, String> callbacks, String contents) throws Throwable
	{
		TabListReader.readEntireFile(callbacks, new ByteArrayInputStream(contents.getBytes(StandardCharsets.UTF_8)));
	}
}
