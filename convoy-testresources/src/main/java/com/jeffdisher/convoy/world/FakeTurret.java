package com.jeffdisher.convoy.world;

import com.jeffdisher.convoy.types.StateBlob;


/**
 * An in-memory turret which counts how often its state is written.
 */
public class FakeTurret implements ILiveTurret
{
	public StateBlob state;
	public int writeCount;

	public FakeTurret(StateBlob state)
	{
		this.state = state;
	}

	@Override
	public StateBlob getState()
	{
		return this.state;
	}

	@Override
	public void setState(StateBlob state)
	{
		this.state = state;
		this.writeCount += 1;
	}
}
