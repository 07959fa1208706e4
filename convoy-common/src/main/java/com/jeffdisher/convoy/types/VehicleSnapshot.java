package com.jeffdisher.convoy.types;

import java.util.List;
import java.util.UUID;

import com.jeffdisher.convoy.aspects.IDefinitionResolver;


/**
 * The complete, flat state of a vehicle and everything attached to it, as captured at one instant.
 * Instances are immutable:  restoring never modifies a snapshot and the same snapshot can be restored any number of
 * times, each time producing an independent vehicle.
 * NOTE:  The lengths of tires and turrets describe the vehicle which was captured.  They are NOT guaranteed to match
 * the slot counts of a vehicle later restored from this snapshot (the catalog definition may have changed).
 */
public record VehicleSnapshot(short definitionId
		, UUID definitionGuid
		// Identifies the captured live instance.  It is informational only and is not carried over by a restore.
		, int instanceId
		, short skinId
		, short mythicId
		// The offset along a rail, for rail-bound vehicles (0 otherwise).
		, float roadPosition
		, short health
		, short fuel
		, short batteryCharge
		, long owner
		, long group
		// One alive flag per tire slot, in slot order.
		, List<Boolean> tires
		// One opaque state per turret mount, in mount order (EMPTY where a mount had no live turret).
		, List<StateBlob> turrets
		, CargoSnapshot cargo
		, List<BarricadeSnapshot> barricades
		, List<StructureSnapshot> structures
		, WorldLocation position
		, WorldRotation rotation
		// Null means "no paint override".
		, PaintColour paint
) {
	public VehicleSnapshot
	{
		tires = List.copyOf(tires);
		turrets = List.copyOf(turrets);
		barricades = List.copyOf(barricades);
		structures = List.copyOf(structures);
	}

	/**
	 * Looks up the definition of this vehicle:  the GUID is authoritative while the numeric id is a legacy fallback.
	 * 
	 * @param resolver The catalog.
	 * @return The definition or null if neither key resolves.
	 */
	public VehicleType resolveDefinition(IDefinitionResolver resolver)
	{
		return resolver.resolveVehicle(this.definitionGuid, this.definitionId);
	}

	/**
	 * @return The paint in the 4-byte snapshot form (all-zero when there is no override).
	 */
	public byte[] paintBytes()
	{
		return PaintColour.toSnapshotBytes(this.paint);
	}

	/**
	 * Used when a caller claims a saved vehicle.
	 * 
	 * @param owner The new owner.
	 * @param group The new group.
	 * @return A copy of the receiver with the given ownership (the receiver is unchanged).
	 */
	public VehicleSnapshot withOwnership(long owner, long group)
	{
		return new VehicleSnapshot(this.definitionId
				, this.definitionGuid
				, this.instanceId
				, this.skinId
				, this.mythicId
				, this.roadPosition
				, this.health
				, this.fuel
				, this.batteryCharge
				, owner
				, group
				, this.tires
				, this.turrets
				, this.cargo
				, this.barricades
				, this.structures
				, this.position
				, this.rotation
				, this.paint
		);
	}
}
