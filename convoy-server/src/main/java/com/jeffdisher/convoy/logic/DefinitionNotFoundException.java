package com.jeffdisher.convoy.logic;

import java.util.UUID;


/**
 * Thrown when a snapshot names a vehicle definition which the catalog can't resolve by either its GUID or its legacy
 * numeric id.  Nothing is created in the world when this is thrown.
 */
public class DefinitionNotFoundException extends Exception
{
	private static final long serialVersionUID = 1L;

	public final UUID guid;
	public final short legacyId;

	public DefinitionNotFoundException(UUID guid, short legacyId)
	{
		super("No vehicle definition for GUID " + guid + " or legacy id " + Short.toUnsignedInt(legacyId));
		this.guid = guid;
		this.legacyId = legacyId;
	}
}
