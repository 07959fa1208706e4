package com.jeffdisher.convoy.world;

import com.jeffdisher.convoy.types.StateBlob;


/**
 * A turret mounted on a live vehicle.  Its state is the weapon/ammo state of the mounted item, opaque to the engine.
 */
public interface ILiveTurret
{
	StateBlob getState();
	void setState(StateBlob state);
}
