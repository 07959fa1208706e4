package com.jeffdisher.convoy.types;

import java.util.List;
import java.util.UUID;


/**
 * The static catalog definition describing a class of vehicle.  A live vehicle is always created from one of these.
 * Note that the turret item list is in mount order:  turretItems.get(i) is the item mounted at turret index i.
 */
public record VehicleType(String id
		, String name
		// The legacy numeric id.  The guid is authoritative.
		, short number
		, UUID guid
		, int tireCount
		, List<Item> turretItems
		, short maxHealth
		, short maxFuel
		, short maxBattery
		// A trunk of 0x0 means the vehicle has no cargo support.
		, byte trunkWidth
		, byte trunkHeight
) {
	public VehicleType
	{
		turretItems = List.copyOf(turretItems);
	}

	public boolean hasTrunk()
	{
		return (this.trunkWidth > 0) && (this.trunkHeight > 0);
	}
}
