package com.jeffdisher.convoy.aspects;

import java.util.UUID;

import com.jeffdisher.convoy.types.Item;
import com.jeffdisher.convoy.types.StateBlob;
import com.jeffdisher.convoy.types.VehicleType;


/**
 * The read-only view of the asset catalog used when restoring vehicles.  This is an interface so that the engine never
 * reaches for a global registry and tests can inject a fake catalog.
 */
public interface IDefinitionResolver
{
	/**
	 * Resolves a vehicle definition.  The GUID is authoritative; the legacy numeric id is only consulted if the GUID is
	 * null or not known.
	 * 
	 * @param guid The stable identifier (can be null).
	 * @param legacyId The legacy numeric id (0 means "none").
	 * @return The definition or null if neither key resolves.
	 */
	VehicleType resolveVehicle(UUID guid, short legacyId);

	/**
	 * @param item An item definition.
	 * @return The state a freshly created instance of this item carries (never null).
	 */
	StateBlob defaultStateFor(Item item);
}
