package com.jeffdisher.convoy.types;


/**
 * The payload of one item stored in a vehicle's cargo.  The world builds a fresh live item from this on restore.
 */
public record ItemInstance(short itemId
		, byte amount
		, byte quality
		, StateBlob state
) {
}
