package com.jeffdisher.convoy.logic;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jeffdisher.convoy.aspects.IDefinitionResolver;
import com.jeffdisher.convoy.types.CargoEntry;
import com.jeffdisher.convoy.types.CargoSnapshot;
import com.jeffdisher.convoy.types.Item;
import com.jeffdisher.convoy.types.StateBlob;
import com.jeffdisher.convoy.types.VehicleSnapshot;
import com.jeffdisher.convoy.types.VehicleType;
import com.jeffdisher.convoy.world.ILiveCargo;
import com.jeffdisher.convoy.world.ILiveTurret;
import com.jeffdisher.convoy.world.ILiveVehicle;
import com.jeffdisher.convoy.world.IVehicleWorld;
import com.jeffdisher.convoy.world.SpawnFailedException;
import com.jeffdisher.convoy.world.VehicleSpawnRequest;


/**
 * Creates a new live vehicle from a VehicleSnapshot.
 * The snapshot describes the vehicle which was captured, not the one being created:  the current catalog definition
 * may have a different number of tire slots or turret mounts, so every per-slot list is reconciled against the new
 * vehicle's actual slots instead of being applied blindly.
 */
public class VehicleRestore
{
	private static final Logger LOG = LoggerFactory.getLogger(VehicleRestore.class);

	/**
	 * Restores the snapshot into the world as a new vehicle.
	 *
	 * @param world The world to create the vehicle in.
	 * @param resolver The catalog used to resolve definitions and default turret states.
	 * @param snapshot The snapshot (not modified).
	 * @param rebindChildOwnership True if attached children should take on the new vehicle's owner and group.
	 * @param placeChildren True if the snapshot's barricades and structures should be placed on the new vehicle.
	 * @param rollbackOnFailure True if a failure after the vehicle was created should destroy the half-built vehicle.
	 * @return The new vehicle.
	 * @throws DefinitionNotFoundException The snapshot's definition is not in the catalog (nothing was created).
	 * @throws SpawnFailedException The world failed to create the vehicle or one of its children.
	 */
	public static ILiveVehicle restore(IVehicleWorld world
			, IDefinitionResolver resolver
			, VehicleSnapshot snapshot
			, boolean rebindChildOwnership
			, boolean placeChildren
			, boolean rollbackOnFailure
	) throws DefinitionNotFoundException, SpawnFailedException
	{
		VehicleType type = snapshot.resolveDefinition(resolver);
		if (null == type)
		{
			throw new DefinitionNotFoundException(snapshot.definitionGuid(), snapshot.definitionId());
		}

		ILiveVehicle vehicle = world.spawnVehicle(buildSpawnRequest(snapshot, type));
		try
		{
			reconcileTires(vehicle, snapshot.tires());
			restoreCargo(vehicle.getCargo(), snapshot.cargo());
			if (placeChildren)
			{
				ChildSnapshots.placeBarricades(world, snapshot.barricades(), vehicle, rebindChildOwnership);
				ChildSnapshots.placeStructures(world, snapshot.structures(), vehicle, rebindChildOwnership);
			}
			boolean usedSnapshotTurrets = reconcileTurrets(resolver, vehicle, type, snapshot.turrets());
			LOG.debug("Restored vehicle {} ({}) from snapshot of instance {} (turret states {})"
					, vehicle.getInstanceId()
					, type.id()
					, snapshot.instanceId()
					, usedSnapshotTurrets ? "restored" : "reset to defaults"
			);
		}
		catch (Throwable t)
		{
			// Anything thrown once the vehicle exists, including assertion failures, leaves it half-built.
			if (rollbackOnFailure)
			{
				LOG.warn("Restore of {} failed after creating vehicle {}, destroying it", type.id(), vehicle.getInstanceId(), t);
				try
				{
					world.destroyVehicle(vehicle);
				}
				catch (Throwable cleanup)
				{
					t.addSuppressed(cleanup);
				}
			}
			else
			{
				LOG.warn("Restore of {} failed, leaving partially configured vehicle {} in the world", type.id(), vehicle.getInstanceId(), t);
			}
			throw t;
		}
		return vehicle;
	}

	/**
	 * Builds the creation request for the snapshot.  Any non-null paint becomes an explicit override.
	 *
	 * @param snapshot The snapshot.
	 * @param type The resolved definition.
	 * @return The request.
	 */
	public static VehicleSpawnRequest buildSpawnRequest(VehicleSnapshot snapshot, VehicleType type)
	{
		return new VehicleSpawnRequest(type
				, snapshot.skinId()
				, snapshot.mythicId()
				, snapshot.roadPosition()
				, snapshot.position()
				, snapshot.rotation()
				, snapshot.fuel()
				, snapshot.health()
				, snapshot.batteryCharge()
				, snapshot.owner()
				, snapshot.group()
				, 0L != snapshot.owner()
				, snapshot.paint()
		);
	}

	/**
	 * Applies the captured alive flags to the vehicle's tire slots.  Only the first min(captured, actual) slots are
	 * touched:  extra captured flags are dropped and extra slots keep their world default.  The world is notified once,
	 * after all flags are set.
	 *
	 * @param vehicle The new vehicle.
	 * @param tires The captured alive flags.
	 * @return The number of slots which were set.
	 */
	public static int reconcileTires(ILiveVehicle vehicle, List<Boolean> tires)
	{
		int count = Math.min(tires.size(), vehicle.getTireCount());
		for (int i = 0; i < count; ++i)
		{
			vehicle.setTireAlive(i, tires.get(i));
		}
		vehicle.sendTireAliveMaskUpdate();
		return count;
	}

	/**
	 * Inserts every captured cargo entry, in captured order, if the vehicle supports cargo.
	 *
	 * @param cargo The new vehicle's cargo (null if it has no cargo support).
	 * @param snapshot The captured cargo.
	 * @return The number of items inserted.
	 */
	public static int restoreCargo(ILiveCargo cargo, CargoSnapshot snapshot)
	{
		int inserted = 0;
		if ((null != cargo) && !snapshot.isEmpty())
		{
			for (CargoEntry entry : snapshot.entries())
			{
				cargo.addItem(entry);
				inserted += 1;
			}
		}
		else if (!snapshot.isEmpty())
		{
			LOG.warn("Dropping {} cargo items:  vehicle has no cargo support", snapshot.entries().size());
		}
		return inserted;
	}

	/**
	 * Sets the turret states of the new vehicle.
	 * A saved turret state is only meaningful for the exact item it was saved from.  If the captured mount count
	 * matches the vehicle's, the captured states are applied index-by-index.  Otherwise, none of them can be trusted so
	 * every mount is reset to the default state of the item the current definition mounts there.
	 *
	 * @param resolver The catalog, for default item states.
	 * @param vehicle The new vehicle.
	 * @param type The vehicle's current definition.
	 * @param turrets The captured turret states.
	 * @return True if the captured states were applied, false if the mounts were reset to defaults.
	 */
	public static boolean reconcileTurrets(IDefinitionResolver resolver, ILiveVehicle vehicle, VehicleType type, List<StateBlob> turrets)
	{
		int mountCount = vehicle.getTurretCount();
		boolean isMatchingLength = (turrets.size() == mountCount);
		if (isMatchingLength)
		{
			for (int i = 0; i < mountCount; ++i)
			{
				ILiveTurret turret = vehicle.getTurret(i);
				StateBlob state = turrets.get(i);
				if ((null != turret) && (null != state))
				{
					turret.setState(state);
				}
			}
		}
		else
		{
			LOG.warn("Snapshot has {} turret states but {} has {} mounts:  resetting turrets to defaults", turrets.size(), type.id(), mountCount);
			List<Item> mountedItems = type.turretItems();
			for (int i = 0; i < mountCount; ++i)
			{
				ILiveTurret turret = vehicle.getTurret(i);
				if (null != turret)
				{
					if (i < mountedItems.size())
					{
						turret.setState(resolver.defaultStateFor(mountedItems.get(i)));
					}
					else
					{
						LOG.warn("{} has no catalog item for turret mount {}:  leaving world default", type.id(), i);
					}
				}
			}
		}
		return isMatchingLength;
	}
}
