package com.jeffdisher.convoy.utils;


/**
 * Helpers for the hex strings used to write opaque state bytes into tablist data files.
 */
public class HexEncoding
{
	private static final char[] DIGITS = "0123456789abcdef".toCharArray();

	/**
	 * Decodes a string of hex digit pairs into bytes.
	 * 
	 * @param hex The string (case-insensitive, must have an even length).
	 * @return The decoded bytes (empty for an empty string).
	 * @throws IllegalArgumentException The string is not well-formed hex.
	 */
	public static byte[] decode(String hex)
	{
		int length = hex.length();
		if (0 != (length % 2))
		{
			throw new IllegalArgumentException("Odd-length hex string: \"" + hex + "\"");
		}
		byte[] data = new byte[length / 2];
		for (int i = 0; i < data.length; ++i)
		{
			int high = Character.digit(hex.charAt(2 * i), 16);
			int low = Character.digit(hex.charAt(2 * i + 1), 16);
			if ((high < 0) || (low < 0))
			{
				throw new IllegalArgumentException("Invalid hex string: \"" + hex + "\"");
			}
			data[i] = (byte)((high << 4) | low);
		}
		return data;
	}

	public static String encode(byte[] data)
	{
		char[] out = new char[2 * data.length];
		for (int i = 0; i < data.length; ++i)
		{
			int value = Byte.toUnsignedInt(data[i]);
			out[2 * i] = DIGITS[value >> 4];
			out[2 * i + 1] = DIGITS[value & 0xF];
		}
		return new String(out);
	}
}
