package com.jeffdisher.convoy.types;

import java.util.Arrays;

import com.jeffdisher.convoy.utils.HexEncoding;


/**
 * An opaque sequence of bytes whose internal structure is owned by the world's item system (turret weapon/ammo state,
 * barricade state, cargo item state).  Nothing in the engine interprets these bytes.
 * The bytes are copied on the way in and out so an instance is immutable and safe to share between snapshots.
 */
public final class StateBlob
{
	public static final StateBlob EMPTY = new StateBlob(new byte[0]);

	/**
	 * Creates a blob from a copy of the given bytes.
	 * 
	 * @param data The bytes (not retained).
	 * @return The blob (EMPTY if data is empty).
	 */
	public static StateBlob wrap(byte[] data)
	{
		return (0 == data.length)
			? EMPTY
			: new StateBlob(data.clone())
		;
	}


	private final byte[] _data;

	private StateBlob(byte[] data)
	{
		_data = data;
	}

	/**
	 * @return A copy of the underlying bytes.
	 */
	public byte[] toByteArray()
	{
		return _data.clone();
	}

	public int length()
	{
		return _data.length;
	}

	public boolean isEmpty()
	{
		return 0 == _data.length;
	}

	@Override
	public boolean equals(Object obj)
	{
		return (obj instanceof StateBlob)
			&& Arrays.equals(_data, ((StateBlob)obj)._data)
		;
	}

	@Override
	public int hashCode()
	{
		return Arrays.hashCode(_data);
	}

	@Override
	public String toString()
	{
		return "StateBlob(" + HexEncoding.encode(_data) + ")";
	}
}
