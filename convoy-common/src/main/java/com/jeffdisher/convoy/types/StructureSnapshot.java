package com.jeffdisher.convoy.types;

import java.util.UUID;


/**
 * A captured structure (floor, wall, pillar, etc) which was built on a vehicle.  Like BarricadeSnapshot, the frame is
 * local to the owning vehicle and a definitionId of 0 marks a placeholder.
 */
public record StructureSnapshot(short definitionId
		, UUID definitionGuid
		, short health
		, long owner
		, long group
		, WorldLocation localPosition
		, WorldRotation localRotation
) {
	public boolean isPlaceholder()
	{
		return 0 == this.definitionId;
	}

	public StructureSnapshot withOwnership(long owner, long group)
	{
		return new StructureSnapshot(this.definitionId
				, this.definitionGuid
				, this.health
				, owner
				, group
				, this.localPosition
				, this.localRotation
		);
	}
}
