package com.jeffdisher.convoy.logic;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jeffdisher.convoy.types.BarricadeSnapshot;
import com.jeffdisher.convoy.types.CargoEntry;
import com.jeffdisher.convoy.types.CargoSnapshot;
import com.jeffdisher.convoy.types.PaintColour;
import com.jeffdisher.convoy.types.StateBlob;
import com.jeffdisher.convoy.types.StructureSnapshot;
import com.jeffdisher.convoy.types.VehicleSnapshot;
import com.jeffdisher.convoy.types.VehicleType;
import com.jeffdisher.convoy.world.IAttachedRegion;
import com.jeffdisher.convoy.world.ILiveCargo;
import com.jeffdisher.convoy.world.ILiveTurret;
import com.jeffdisher.convoy.world.ILiveVehicle;
import com.jeffdisher.convoy.world.IVehicleWorld;


/**
 * Reads a live vehicle into a VehicleSnapshot.  Capture only reads:  the live vehicle is never modified and the
 * resulting snapshot shares no mutable state with it.
 */
public class VehicleCapture
{
	private static final Logger LOG = LoggerFactory.getLogger(VehicleCapture.class);

	/**
	 * Captures the vehicle and, optionally, everything attached to it.
	 * 
	 * @param world The world (used to find the vehicle's attached region).
	 * @param vehicle The live vehicle.
	 * @param includeChildren True if the barricades and structures on the vehicle should be captured.
	 * @return The snapshot.
	 */
	public static VehicleSnapshot capture(IVehicleWorld world, ILiveVehicle vehicle, boolean includeChildren)
	{
		VehicleType type = vehicle.getType();
		List<Boolean> tires = captureTires(vehicle);
		List<StateBlob> turrets = captureTurrets(vehicle);
		CargoSnapshot cargo = captureCargo(vehicle.getCargo());
		PaintColour paint = PaintColour.normalize(vehicle.getPaintColour());
		
		List<BarricadeSnapshot> barricades = List.of();
		List<StructureSnapshot> structures = List.of();
		if (includeChildren)
		{
			IAttachedRegion region = world.findAttachedRegion(vehicle);
			if (null != region)
			{
				barricades = ChildSnapshots.captureLiveBarricades(region);
				structures = ChildSnapshots.captureLiveStructures(region);
			}
		}
		LOG.debug("Captured vehicle {} ({}): {} tires, {} turrets, {} cargo items, {} barricades, {} structures"
				, vehicle.getInstanceId()
				, type.id()
				, tires.size()
				, turrets.size()
				, cargo.entries().size()
				, barricades.size()
				, structures.size()
		);
		return new VehicleSnapshot(type.number()
				, type.guid()
				, vehicle.getInstanceId()
				, vehicle.getSkinId()
				, vehicle.getMythicId()
				, vehicle.getRoadPosition()
				, vehicle.getHealth()
				, vehicle.getFuel()
				, vehicle.getBatteryCharge()
				, vehicle.getLockedOwner()
				, vehicle.getLockedGroup()
				, tires
				, turrets
				, cargo
				, barricades
				, structures
				, vehicle.getPosition()
				, vehicle.getRotation()
				, paint
		);
	}

	/**
	 * @param vehicle The live vehicle.
	 * @return The alive flag of each tire slot, in slot order (empty if the vehicle has no tires).
	 */
	public static List<Boolean> captureTires(ILiveVehicle vehicle)
	{
		int count = vehicle.getTireCount();
		List<Boolean> tires = new ArrayList<>(count);
		for (int i = 0; i < count; ++i)
		{
			tires.add(vehicle.isTireAlive(i));
		}
		return tires;
	}

	/**
	 * @param vehicle The live vehicle.
	 * @return The state of each turret mount, in mount order.  A mount without a live turret still gets an entry
	 * (EMPTY) so that indices stay aligned with the mount list.
	 */
	public static List<StateBlob> captureTurrets(ILiveVehicle vehicle)
	{
		int count = vehicle.getTurretCount();
		List<StateBlob> turrets = new ArrayList<>(count);
		for (int i = 0; i < count; ++i)
		{
			ILiveTurret turret = vehicle.getTurret(i);
			StateBlob state = (null != turret)
					? turret.getState()
					: null
			;
			turrets.add((null != state) ? state : StateBlob.EMPTY);
		}
		return turrets;
	}

	/**
	 * @param cargo The live cargo (null if the vehicle has no cargo support).
	 * @return The captured cargo (EMPTY, never null, if there is nothing to capture).
	 */
	public static CargoSnapshot captureCargo(ILiveCargo cargo)
	{
		List<CargoEntry> entries = (null != cargo)
				? cargo.getEntries()
				: null
		;
		return ((null != entries) && !entries.isEmpty())
				? new CargoSnapshot(cargo.getWidth(), cargo.getHeight(), entries)
				: CargoSnapshot.EMPTY
		;
	}
}
