package com.jeffdisher.convoy.world;

import com.jeffdisher.convoy.types.PaintColour;
import com.jeffdisher.convoy.types.StateBlob;
import com.jeffdisher.convoy.types.VehicleType;
import com.jeffdisher.convoy.types.WorldLocation;
import com.jeffdisher.convoy.types.WorldRotation;


/**
 * An in-memory vehicle.  All of its state is public so that tests can set up unusual cases (dead tires, missing
 * turrets, alpha-0 paint) before capturing it.
 */
public class FakeVehicle implements ILiveVehicle
{
	public final VehicleType type;
	public final int instanceId;
	public short skinId;
	public short mythicId;
	public float roadPosition;
	public short health;
	public short fuel;
	public short batteryCharge;
	public long lockedOwner;
	public long lockedGroup;
	public boolean isLocked;
	public WorldLocation position;
	public WorldRotation rotation;
	public PaintColour paint;
	public boolean[] tires;
	public FakeTurret[] turrets;
	public FakeCargo cargo;
	public int tireMaskUpdates;

	public FakeVehicle(int instanceId, VehicleSpawnRequest request, PaintColour defaultPaint, StateBlob defaultTurretState)
	{
		this.type = request.type();
		this.instanceId = instanceId;
		this.skinId = request.skinId();
		this.mythicId = request.mythicId();
		this.roadPosition = request.roadPosition();
		this.health = _clamp(request.health(), this.type.maxHealth());
		this.fuel = _clamp(request.fuel(), this.type.maxFuel());
		this.batteryCharge = _clamp(request.batteryCharge(), this.type.maxBattery());
		this.lockedOwner = request.owner();
		this.lockedGroup = request.group();
		this.isLocked = request.isLocked();
		this.position = request.position();
		this.rotation = request.rotation();
		this.paint = (null != request.paintOverride())
				? request.paintOverride()
				: defaultPaint
		;
		this.tires = new boolean[this.type.tireCount()];
		for (int i = 0; i < this.tires.length; ++i)
		{
			this.tires[i] = true;
		}
		this.turrets = new FakeTurret[this.type.turretItems().size()];
		for (int i = 0; i < this.turrets.length; ++i)
		{
			this.turrets[i] = new FakeTurret(defaultTurretState);
		}
		this.cargo = this.type.hasTrunk()
				? new FakeCargo(this.type.trunkWidth(), this.type.trunkHeight())
				: null
		;
	}

	@Override
	public VehicleType getType()
	{
		return this.type;
	}
	@Override
	public int getInstanceId()
	{
		return this.instanceId;
	}
	@Override
	public short getSkinId()
	{
		return this.skinId;
	}
	@Override
	public short getMythicId()
	{
		return this.mythicId;
	}
	@Override
	public float getRoadPosition()
	{
		return this.roadPosition;
	}
	@Override
	public short getHealth()
	{
		return this.health;
	}
	@Override
	public short getFuel()
	{
		return this.fuel;
	}
	@Override
	public short getBatteryCharge()
	{
		return this.batteryCharge;
	}
	@Override
	public long getLockedOwner()
	{
		return this.lockedOwner;
	}
	@Override
	public long getLockedGroup()
	{
		return this.lockedGroup;
	}
	@Override
	public WorldLocation getPosition()
	{
		return this.position;
	}
	@Override
	public WorldRotation getRotation()
	{
		return this.rotation;
	}
	@Override
	public PaintColour getPaintColour()
	{
		return this.paint;
	}

	@Override
	public int getTireCount()
	{
		return this.tires.length;
	}
	@Override
	public boolean isTireAlive(int index)
	{
		return this.tires[index];
	}
	@Override
	public void setTireAlive(int index, boolean alive)
	{
		this.tires[index] = alive;
	}
	@Override
	public void sendTireAliveMaskUpdate()
	{
		this.tireMaskUpdates += 1;
	}

	@Override
	public int getTurretCount()
	{
		return this.turrets.length;
	}
	@Override
	public ILiveTurret getTurret(int index)
	{
		return this.turrets[index];
	}

	@Override
	public ILiveCargo getCargo()
	{
		return this.cargo;
	}


	private static short _clamp(short value, short max)
	{
		// Gauges are unsigned 16-bit.
		int unsigned = Math.min(Short.toUnsignedInt(value), Short.toUnsignedInt(max));
		return (short)unsigned;
	}
}
