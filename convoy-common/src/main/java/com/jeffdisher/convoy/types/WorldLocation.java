package com.jeffdisher.convoy.types;


/**
 * A position in world space (or local to an anchoring vehicle, for attached children).
 * Unlike the rounded locations used for entity movement, these are stored exactly as captured since a restored
 * vehicle must land precisely where it was saved.
 */
public record WorldLocation(float x, float y, float z)
{
	public static final WorldLocation ORIGIN = new WorldLocation(0.0f, 0.0f, 0.0f);
}
