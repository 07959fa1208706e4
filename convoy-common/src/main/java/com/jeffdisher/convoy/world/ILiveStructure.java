package com.jeffdisher.convoy.world;

import java.util.UUID;

import com.jeffdisher.convoy.types.WorldLocation;
import com.jeffdisher.convoy.types.WorldRotation;


/**
 * A structure built in a vehicle's attached region.  The frame is reported relative to the anchoring vehicle.
 */
public interface ILiveStructure
{
	short getDefinitionId();
	UUID getDefinitionGuid();
	short getHealth();
	long getOwner();
	long getGroup();
	WorldLocation getLocalPosition();
	WorldRotation getLocalRotation();
	boolean isDestroyed();
}
