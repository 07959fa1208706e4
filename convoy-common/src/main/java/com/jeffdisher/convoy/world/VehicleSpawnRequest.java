package com.jeffdisher.convoy.world;

import com.jeffdisher.convoy.types.PaintColour;
import com.jeffdisher.convoy.types.VehicleType;
import com.jeffdisher.convoy.types.WorldLocation;
import com.jeffdisher.convoy.types.WorldRotation;


/**
 * Everything the world needs to create a vehicle.
 */
public record VehicleSpawnRequest(VehicleType type
		, short skinId
		, short mythicId
		, float roadPosition
		, WorldLocation position
		, WorldRotation rotation
		, short fuel
		, short health
		, short batteryCharge
		, long owner
		, long group
		// Derived from owner != 0.
		, boolean isLocked
		// Null means the world applies its own default paint.
		, PaintColour paintOverride
) {
}
