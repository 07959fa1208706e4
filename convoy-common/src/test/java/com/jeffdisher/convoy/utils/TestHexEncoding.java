package com.jeffdisher.convoy.utils;

import org.junit.Assert;
import org.junit.Test;


public class TestHexEncoding
{
	@Test
	public void both() throws Throwable
	{
		byte[] data = HexEncoding.decode("00ff7A");
		Assert.assertArrayEquals(new byte[] { 0, (byte)0xFF, 0x7A }, data);
		Assert.assertEquals("00ff7a", HexEncoding.encode(data));
		Assert.assertEquals(0, HexEncoding.decode("").length);
	}

	@Test(expected=IllegalArgumentException.class)
	public void oddLength() throws Throwable
	{
		HexEncoding.decode("abc");
	}

	@Test(expected=IllegalArgumentException.class)
	public void badDigit() throws Throwable
	{
		HexEncoding.decode("zz");
	}
}
