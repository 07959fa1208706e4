package com.jeffdisher.convoy.utils;


/**
 * Invariant checks used throughout the engine.  These are for conditions which can only fail due to a bug (or a world
 * implementation violating its contract), so they throw AssertionError instead of a checked exception.
 */
public class Assert
{
	public static void assertTrue(boolean flag)
	{
		if (!flag)
		{
			throw new AssertionError("Condition expected to be true");
		}
	}

	public static void assertTrue(boolean flag, String description)
	{
		if (!flag)
		{
			throw new AssertionError("Condition expected to be true: " + description);
		}
	}

}
