package com.jeffdisher.convoy.types;

import java.util.List;


/**
 * The captured contents of a vehicle's cargo.  A snapshot always has one of these, even when the vehicle had no cargo
 * or no cargo support (in which case it is EMPTY).  Entries are kept in capture order and are restored in that order.
 */
public record CargoSnapshot(byte width
		, byte height
		, List<CargoEntry> entries
) {
	public static final CargoSnapshot EMPTY = new CargoSnapshot((byte)0, (byte)0, List.of());

	public CargoSnapshot
	{
		entries = List.copyOf(entries);
	}

	public boolean isEmpty()
	{
		return this.entries.isEmpty();
	}
}
