package com.jeffdisher.convoy.types;

import com.jeffdisher.convoy.utils.Assert;


/**
 * An explicit paint override for a vehicle, as 8-bit RGBA.
 * In memory, "no paint override" is always represented as a null PaintColour.  Only at the snapshot boundary is that
 * turned into the 4-byte all-zero sentinel, so that a null can never be confused with an opaque black (0,0,0,255).
 */
public record PaintColour(byte red, byte green, byte blue, byte alpha)
{
	/**
	 * The number of bytes in the snapshot representation.
	 */
	public static final int SNAPSHOT_BYTES = 4;

	/**
	 * Normalizes a paint value read from a live vehicle:  a "clear" value (null) or any colour whose alpha is zero is
	 * not an override.
	 * 
	 * @param live The live paint value (null if the vehicle reports "clear").
	 * @return The override to capture, or null if there isn't one.
	 */
	public static PaintColour normalize(PaintColour live)
	{
		return ((null == live) || (0 == live.alpha))
			? null
			: live
		;
	}

	/**
	 * Produces the 4-byte snapshot form.
	 * 
	 * @param colour The override (null for "no override").
	 * @return RGBA bytes, or the all-zero sentinel for null.
	 */
	public static byte[] toSnapshotBytes(PaintColour colour)
	{
		return (null != colour)
			? new byte[] { colour.red, colour.green, colour.blue, colour.alpha }
			: new byte[SNAPSHOT_BYTES]
		;
	}

	/**
	 * Decodes the 4-byte snapshot form.
	 * 
	 * @param bytes Exactly 4 bytes of RGBA.
	 * @return The override, or null if the bytes are the all-zero sentinel.
	 * @throws IllegalArgumentException The array is not exactly 4 bytes long.
	 */
	public static PaintColour fromSnapshotBytes(byte[] bytes)
	{
		if (SNAPSHOT_BYTES != bytes.length)
		{
			throw new IllegalArgumentException("Paint colour must be " + SNAPSHOT_BYTES + " bytes, found " + bytes.length);
		}
		boolean isSentinel = (0 == bytes[0]) && (0 == bytes[1]) && (0 == bytes[2]) && (0 == bytes[3]);
		PaintColour colour = isSentinel
			? null
			: new PaintColour(bytes[0], bytes[1], bytes[2], bytes[3])
		;
		Assert.assertTrue((null != colour) != isSentinel);
		return colour;
	}

	/**
	 * A convenience for the common case of writing colours as unsigned ints.
	 */
	public static PaintColour fromInts(int red, int green, int blue, int alpha)
	{
		return new PaintColour((byte)red, (byte)green, (byte)blue, (byte)alpha);
	}
}
