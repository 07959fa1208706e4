package com.jeffdisher.convoy.world;

import java.util.UUID;

import com.jeffdisher.convoy.types.StructureSnapshot;
import com.jeffdisher.convoy.types.WorldLocation;
import com.jeffdisher.convoy.types.WorldRotation;


/**
 * An in-memory structure, built from the snapshot it was placed from.
 */
public class FakeStructure implements ILiveStructure
{
	public final StructureSnapshot source;
	public boolean isDestroyed;

	public FakeStructure(StructureSnapshot source)
	{
		this.source = source;
	}

	@Override
	public short getDefinitionId()
	{
		return this.source.definitionId();
	}
	@Override
	public UUID getDefinitionGuid()
	{
		return this.source.definitionGuid();
	}
	@Override
	public short getHealth()
	{
		return this.source.health();
	}
	@Override
	public long getOwner()
	{
		return this.source.owner();
	}
	@Override
	public long getGroup()
	{
		return this.source.group();
	}
	@Override
	public WorldLocation getLocalPosition()
	{
		return this.source.localPosition();
	}
	@Override
	public WorldRotation getLocalRotation()
	{
		return this.source.localRotation();
	}
	@Override
	public boolean isDestroyed()
	{
		return this.isDestroyed;
	}
}
