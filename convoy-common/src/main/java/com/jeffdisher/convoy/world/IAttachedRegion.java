package com.jeffdisher.convoy.world;

import java.util.List;


/**
 * The placement region anchored to a vehicle:  everything planted or built on the vehicle's frame.
 * The lists can contain destroyed objects which haven't been cleaned up yet.
 */
public interface IAttachedRegion
{
	List<ILiveBarricade> getBarricades();
	List<ILiveStructure> getStructures();
}
