package com.jeffdisher.convoy.world;


/**
 * Thrown by a world implementation when it fails to create a live object.  The engine propagates this unchanged and
 * never retries since every attempt creates a new object.
 */
public class SpawnFailedException extends Exception
{
	private static final long serialVersionUID = 1L;

	public SpawnFailedException(String message)
	{
		super(message);
	}

	public SpawnFailedException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
