package com.jeffdisher.convoy.logic;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jeffdisher.convoy.types.BarricadeSnapshot;
import com.jeffdisher.convoy.types.StructureSnapshot;
import com.jeffdisher.convoy.world.IAttachedRegion;
import com.jeffdisher.convoy.world.ILiveBarricade;
import com.jeffdisher.convoy.world.ILiveStructure;
import com.jeffdisher.convoy.world.ILiveVehicle;
import com.jeffdisher.convoy.world.IVehicleWorld;
import com.jeffdisher.convoy.world.SpawnFailedException;


/**
 * Capture and placement of the barricades and structures attached to a vehicle.  Each child is captured and placed
 * independently of the others, in stored order.
 */
public class ChildSnapshots
{
	private static final Logger LOG = LoggerFactory.getLogger(ChildSnapshots.class);

	public static BarricadeSnapshot captureBarricade(ILiveBarricade barricade)
	{
		return new BarricadeSnapshot(barricade.getDefinitionId()
				, barricade.getDefinitionGuid()
				, barricade.getHealth()
				, barricade.getOwner()
				, barricade.getGroup()
				, barricade.getState()
				, barricade.getLocalPosition()
				, barricade.getLocalRotation()
		);
	}

	public static StructureSnapshot captureStructure(ILiveStructure structure)
	{
		return new StructureSnapshot(structure.getDefinitionId()
				, structure.getDefinitionGuid()
				, structure.getHealth()
				, structure.getOwner()
				, structure.getGroup()
				, structure.getLocalPosition()
				, structure.getLocalRotation()
		);
	}

	/**
	 * Captures every barricade in the region which hasn't been destroyed.
	 * 
	 * @param region The region anchored to a vehicle.
	 * @return The snapshots, in the region's order.
	 */
	public static List<BarricadeSnapshot> captureLiveBarricades(IAttachedRegion region)
	{
		List<BarricadeSnapshot> list = new ArrayList<>();
		for (ILiveBarricade barricade : region.getBarricades())
		{
			if (!barricade.isDestroyed())
			{
				list.add(captureBarricade(barricade));
			}
		}
		return list;
	}

	/**
	 * Captures every structure in the region which hasn't been destroyed.
	 * 
	 * @param region The region anchored to a vehicle.
	 * @return The snapshots, in the region's order.
	 */
	public static List<StructureSnapshot> captureLiveStructures(IAttachedRegion region)
	{
		List<StructureSnapshot> list = new ArrayList<>();
		for (ILiveStructure structure : region.getStructures())
		{
			if (!structure.isDestroyed())
			{
				list.add(captureStructure(structure));
			}
		}
		return list;
	}

	/**
	 * Plants the given barricades on the anchor vehicle, in order.  Placeholder entries (definition id 0) are skipped.
	 * 
	 * @param world The world.
	 * @param barricades The barricades to place.
	 * @param anchor The vehicle to plant them on.
	 * @param rebindOwnership True if each barricade should take on the anchor's owner and group.
	 * @return The number of barricades placed.
	 * @throws SpawnFailedException The world failed to place one of the barricades (earlier ones stay placed).
	 */
	public static int placeBarricades(IVehicleWorld world, List<BarricadeSnapshot> barricades, ILiveVehicle anchor, boolean rebindOwnership) throws SpawnFailedException
	{
		int placed = 0;
		for (BarricadeSnapshot barricade : barricades)
		{
			if (barricade.isPlaceholder())
			{
				LOG.debug("Skipping placeholder barricade on vehicle {}", anchor.getInstanceId());
				continue;
			}
			BarricadeSnapshot toPlace = rebindOwnership
					? barricade.withOwnership(anchor.getLockedOwner(), anchor.getLockedGroup())
					: barricade
			;
			world.placeBarricade(toPlace, anchor);
			placed += 1;
		}
		return placed;
	}

	/**
	 * Builds the given structures on the anchor vehicle, in order.  Placeholder entries (definition id 0) are skipped.
	 * 
	 * @param world The world.
	 * @param structures The structures to build.
	 * @param anchor The vehicle to build them on.
	 * @param rebindOwnership True if each structure should take on the anchor's owner and group.
	 * @return The number of structures placed.
	 * @throws SpawnFailedException The world failed to place one of the structures (earlier ones stay placed).
	 */
	public static int placeStructures(IVehicleWorld world, List<StructureSnapshot> structures, ILiveVehicle anchor, boolean rebindOwnership) throws SpawnFailedException
	{
		int placed = 0;
		for (StructureSnapshot structure : structures)
		{
			if (structure.isPlaceholder())
			{
				LOG.debug("Skipping placeholder structure on vehicle {}", anchor.getInstanceId());
				continue;
			}
			StructureSnapshot toPlace = rebindOwnership
					? structure.withOwnership(anchor.getLockedOwner(), anchor.getLockedGroup())
					: structure
			;
			world.placeStructure(toPlace, anchor);
			placed += 1;
		}
		return placed;
	}
}
