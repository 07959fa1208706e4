package com.jeffdisher.convoy.types;


/**
 * A rotation, stored as the raw quaternion components the world uses.
 */
public record WorldRotation(float x, float y, float z, float w)
{
	public static final WorldRotation IDENTITY = new WorldRotation(0.0f, 0.0f, 0.0f, 1.0f);
}
