package com.jeffdisher.convoy.world;

import java.util.ArrayList;
import java.util.List;


/**
 * The in-memory region anchored to a FakeVehicle.
 */
public class FakeRegion implements IAttachedRegion
{
	public final List<FakeBarricade> barricades = new ArrayList<>();
	public final List<FakeStructure> structures = new ArrayList<>();

	@Override
	public List<ILiveBarricade> getBarricades()
	{
		return List.copyOf(this.barricades);
	}

	@Override
	public List<ILiveStructure> getStructures()
	{
		return List.copyOf(this.structures);
	}
}
