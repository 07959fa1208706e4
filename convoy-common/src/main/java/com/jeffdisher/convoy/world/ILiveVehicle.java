package com.jeffdisher.convoy.world;

import com.jeffdisher.convoy.types.PaintColour;
import com.jeffdisher.convoy.types.VehicleType;
import com.jeffdisher.convoy.types.WorldLocation;
import com.jeffdisher.convoy.types.WorldRotation;


/**
 * A handle to a vehicle which currently exists in the world.
 */
public interface ILiveVehicle
{
	VehicleType getType();
	int getInstanceId();
	short getSkinId();
	short getMythicId();
	float getRoadPosition();
	short getHealth();
	short getFuel();
	short getBatteryCharge();
	long getLockedOwner();
	long getLockedGroup();
	WorldLocation getPosition();
	WorldRotation getRotation();

	/**
	 * @return The current paint, or null if the vehicle reports the "clear" colour.
	 */
	PaintColour getPaintColour();

	int getTireCount();
	boolean isTireAlive(int index);
	void setTireAlive(int index, boolean alive);
	/**
	 * Pushes the current tire alive flags out to observers.  Called once after a batch of setTireAlive() calls.
	 */
	void sendTireAliveMaskUpdate();

	int getTurretCount();
	/**
	 * @param index The mount index (must be less than getTurretCount()).
	 * @return The turret at that mount, or null if the mount exists structurally but has no live turret.
	 */
	ILiveTurret getTurret(int index);

	/**
	 * @return The vehicle's cargo, or null if this vehicle has no cargo support.
	 */
	ILiveCargo getCargo();
}
