package com.jeffdisher.convoy.types;

import java.util.UUID;


/**
 * A captured barricade which was planted on a vehicle.  The position and rotation are local to the vehicle's frame so
 * the barricade can be re-planted on whatever vehicle is restored from the owning snapshot.
 * A definitionId of 0 marks an empty placeholder slot which is never placed.
 */
public record BarricadeSnapshot(short definitionId
		, UUID definitionGuid
		, short health
		, long owner
		, long group
		, StateBlob state
		, WorldLocation localPosition
		, WorldRotation localRotation
) {
	public boolean isPlaceholder()
	{
		return 0 == this.definitionId;
	}

	/**
	 * @param owner The new owner.
	 * @param group The new group.
	 * @return A copy of the receiver with the given ownership (the receiver is unchanged).
	 */
	public BarricadeSnapshot withOwnership(long owner, long group)
	{
		return new BarricadeSnapshot(this.definitionId
				, this.definitionGuid
				, this.health
				, owner
				, group
				, this.state
				, this.localPosition
				, this.localRotation
		);
	}
}
