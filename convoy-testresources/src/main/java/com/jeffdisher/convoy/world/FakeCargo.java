package com.jeffdisher.convoy.world;

import java.util.ArrayList;
import java.util.List;

import com.jeffdisher.convoy.types.CargoEntry;


/**
 * An in-memory cargo grid which stores entries in insertion order.
 */
public class FakeCargo implements ILiveCargo
{
	private final byte _width;
	private final byte _height;
	public final List<CargoEntry> entries;

	public FakeCargo(byte width, byte height)
	{
		_width = width;
		_height = height;
		this.entries = new ArrayList<>();
	}

	@Override
	public byte getWidth()
	{
		return _width;
	}

	@Override
	public byte getHeight()
	{
		return _height;
	}

	@Override
	public List<CargoEntry> getEntries()
	{
		return List.copyOf(this.entries);
	}

	@Override
	public void addItem(CargoEntry entry)
	{
		this.entries.add(entry);
	}
}
