package com.jeffdisher.convoy.types;

import org.junit.Assert;
import org.junit.Test;


public class TestPaintColour
{
	@Test
	public void clearIsNotAnOverride() throws Throwable
	{
		Assert.assertNull(PaintColour.normalize(null));
		Assert.assertNull(PaintColour.normalize(PaintColour.fromInts(255, 0, 0, 0)));
		PaintColour red = PaintColour.fromInts(255, 0, 0, 255);
		Assert.assertSame(red, PaintColour.normalize(red));
	}

	@Test
	public void sentinelDistinctFromBlack() throws Throwable
	{
		byte[] none = PaintColour.toSnapshotBytes(null);
		Assert.assertArrayEquals(new byte[] { 0, 0, 0, 0 }, none);
		Assert.assertNull(PaintColour.fromSnapshotBytes(none));
		
		PaintColour black = PaintColour.fromInts(0, 0, 0, 255);
		byte[] blackBytes = PaintColour.toSnapshotBytes(black);
		Assert.assertArrayEquals(new byte[] { 0, 0, 0, (byte)255 }, blackBytes);
		Assert.assertEquals(black, PaintColour.fromSnapshotBytes(blackBytes));
	}

	@Test
	public void unsignedChannels() throws Throwable
	{
		PaintColour colour = PaintColour.fromSnapshotBytes(new byte[] { 10, 20, 30, (byte)255 });
		Assert.assertEquals(PaintColour.fromInts(10, 20, 30, 255), colour);
		Assert.assertEquals(255, Byte.toUnsignedInt(colour.alpha()));
	}

	@Test(expected=IllegalArgumentException.class)
	public void wrongLength() throws Throwable
	{
		PaintColour.fromSnapshotBytes(new byte[] { 1, 2, 3 });
	}
}
