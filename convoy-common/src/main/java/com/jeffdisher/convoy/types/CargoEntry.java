package com.jeffdisher.convoy.types;


/**
 * An item placed in a cargo grid at a specific cell and rotation.
 */
public record CargoEntry(byte x
		, byte y
		, byte rotation
		, ItemInstance item
) {
}
