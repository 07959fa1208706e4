package com.jeffdisher.convoy.world;

import com.jeffdisher.convoy.types.BarricadeSnapshot;
import com.jeffdisher.convoy.types.StructureSnapshot;


/**
 * The narrow interface the engine uses to read from and write to the live world.  The world owns all live objects,
 * their transforms and their physics; the engine only creates, inspects and configures them through this interface.
 * All calls must be made on the world's owning thread.
 */
public interface IVehicleWorld
{
	/**
	 * @return True if the calling thread is the one allowed to mutate world objects.
	 */
	boolean isWorldThread();

	/**
	 * Creates a new live vehicle.  The world clamps the resource gauges to the definition's maximums and applies its
	 * own default paint when the request has no paint override.
	 * 
	 * @param request The creation parameters.
	 * @return The new vehicle (never null).
	 * @throws SpawnFailedException The world refused or failed to create the vehicle.
	 */
	ILiveVehicle spawnVehicle(VehicleSpawnRequest request) throws SpawnFailedException;

	/**
	 * Looks up the placement region anchored to the given vehicle's current frame (where anything planted or built on
	 * the vehicle lives).
	 * 
	 * @param vehicle The anchoring vehicle.
	 * @return The region or null if no region is anchored to this vehicle (which is normal).
	 */
	IAttachedRegion findAttachedRegion(ILiveVehicle vehicle);

	/**
	 * Plants a barricade on the given vehicle, using the snapshot's local frame relative to the vehicle.
	 * 
	 * @param snapshot The barricade to create.
	 * @param anchor The vehicle it is planted on.
	 * @return The new barricade.
	 * @throws SpawnFailedException The world failed to create the barricade.
	 */
	ILiveBarricade placeBarricade(BarricadeSnapshot snapshot, ILiveVehicle anchor) throws SpawnFailedException;

	/**
	 * Builds a structure on the given vehicle, using the snapshot's local frame relative to the vehicle.
	 * 
	 * @param snapshot The structure to create.
	 * @param anchor The vehicle it is built on.
	 * @return The new structure.
	 * @throws SpawnFailedException The world failed to create the structure.
	 */
	ILiveStructure placeStructure(StructureSnapshot snapshot, ILiveVehicle anchor) throws SpawnFailedException;

	/**
	 * Removes a vehicle from the world, along with anything attached to it.
	 * 
	 * @param vehicle The vehicle to destroy.
	 */
	void destroyVehicle(ILiveVehicle vehicle);
}
