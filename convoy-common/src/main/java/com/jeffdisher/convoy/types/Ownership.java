package com.jeffdisher.convoy.types;


/**
 * The access-control identities a caller claims a restored vehicle with.  Zero means "nobody".
 */
public record Ownership(long owner, long group)
{
}
