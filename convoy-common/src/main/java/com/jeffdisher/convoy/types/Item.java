package com.jeffdisher.convoy.types;

import java.util.UUID;


/**
 * A catalog item definition (a turret weapon, for example).  There is one instance for each type in the catalog.
 * The defaultState is what a freshly created instance of the item carries, which is what a turret mount is reset to
 * when a saved state can't be trusted.
 */
public record Item(String id
		, String name
		, short number
		, UUID guid
		, StateBlob defaultState
) {
}
