package com.jeffdisher.convoy.types;

import org.junit.Assert;
import org.junit.Test;


public class TestStateBlob
{
	@Test
	public void copiesOnWrapAndRead() throws Throwable
	{
		byte[] raw = new byte[] { 1, 2, 3 };
		StateBlob blob = StateBlob.wrap(raw);
		raw[0] = 99;
		byte[] out = blob.toByteArray();
		Assert.assertArrayEquals(new byte[] { 1, 2, 3 }, out);
		out[1] = 99;
		Assert.assertArrayEquals(new byte[] { 1, 2, 3 }, blob.toByteArray());
	}

	@Test
	public void contentEquality() throws Throwable
	{
		StateBlob one = StateBlob.wrap(new byte[] { 5, 6 });
		StateBlob two = StateBlob.wrap(new byte[] { 5, 6 });
		Assert.assertEquals(one, two);
		Assert.assertEquals(one.hashCode(), two.hashCode());
		Assert.assertNotEquals(one, StateBlob.wrap(new byte[] { 5 }));
		Assert.assertEquals("StateBlob(0506)", one.toString());
	}

	@Test
	public void empty() throws Throwable
	{
		Assert.assertSame(StateBlob.EMPTY, StateBlob.wrap(new byte[0]));
		Assert.assertTrue(StateBlob.EMPTY.isEmpty());
		Assert.assertEquals(0, StateBlob.EMPTY.length());
	}
}
