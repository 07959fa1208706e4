package com.jeffdisher.convoy.world;

import java.util.UUID;

import com.jeffdisher.convoy.types.StateBlob;
import com.jeffdisher.convoy.types.WorldLocation;
import com.jeffdisher.convoy.types.WorldRotation;


/**
 * A barricade planted in a vehicle's attached region.  The frame is reported relative to the anchoring vehicle.
 */
public interface ILiveBarricade
{
	short getDefinitionId();
	UUID getDefinitionGuid();
	short getHealth();
	long getOwner();
	long getGroup();
	StateBlob getState();
	WorldLocation getLocalPosition();
	WorldRotation getLocalRotation();
	boolean isDestroyed();
}
