package com.jeffdisher.convoy.world;

import java.util.List;

import com.jeffdisher.convoy.types.CargoEntry;


/**
 * The cargo grid of a live vehicle.
 */
public interface ILiveCargo
{
	byte getWidth();
	byte getHeight();
	/**
	 * @return The items currently in the cargo, in the world's storage order.
	 */
	List<CargoEntry> getEntries();
	/**
	 * Creates a fresh live item from the entry's payload and stores it at the entry's cell and rotation.  This never
	 * merges with existing items.
	 * 
	 * @param entry The item and where to put it.
	 */
	void addItem(CargoEntry entry);
}
