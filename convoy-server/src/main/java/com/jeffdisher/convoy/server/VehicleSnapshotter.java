package com.jeffdisher.convoy.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jeffdisher.convoy.aspects.IDefinitionResolver;
import com.jeffdisher.convoy.logic.DefinitionNotFoundException;
import com.jeffdisher.convoy.logic.VehicleCapture;
import com.jeffdisher.convoy.logic.VehicleRestore;
import com.jeffdisher.convoy.types.Ownership;
import com.jeffdisher.convoy.types.VehicleSnapshot;
import com.jeffdisher.convoy.utils.Assert;
import com.jeffdisher.convoy.world.ILiveVehicle;
import com.jeffdisher.convoy.world.IVehicleWorld;
import com.jeffdisher.convoy.world.SpawnFailedException;


/**
 * The entry-point for saving and re-creating vehicles:  ties a world, a catalog and a config together.
 * Both operations are synchronous and must be called on the world's owning thread since they read and write live
 * objects without any locking.  Callers on other threads need to marshal the call onto the world thread.
 */
public class VehicleSnapshotter
{
	private static final Logger LOG = LoggerFactory.getLogger(VehicleSnapshotter.class);

	private final IVehicleWorld _world;
	private final IDefinitionResolver _resolver;
	private final SnapshotConfig _config;

	public VehicleSnapshotter(IVehicleWorld world, IDefinitionResolver resolver, SnapshotConfig config)
	{
		_world = world;
		_resolver = resolver;
		_config = config;
	}

	/**
	 * Captures the complete state of the given vehicle.
	 * 
	 * @param vehicle The live vehicle.
	 * @return The snapshot (independent of any later change to the vehicle).
	 */
	public VehicleSnapshot capture(ILiveVehicle vehicle)
	{
		Assert.assertTrue(_world.isWorldThread(), "capture must run on the world thread");
		return VehicleCapture.capture(_world, vehicle, _config.captureAttachedChildren);
	}

	/**
	 * Creates a new vehicle from the given snapshot.
	 * 
	 * @param snapshot The snapshot (not modified).
	 * @param callerIdentity If non-null, the new vehicle is owned by this identity instead of the snapshot's owner.
	 * @param rebindChildOwnership True if the attached children should take on the new vehicle's ownership.
	 * @return The new vehicle.
	 * @throws DefinitionNotFoundException The snapshot names a vehicle the catalog doesn't have.
	 * @throws SpawnFailedException The world failed to create the vehicle or one of its children.
	 */
	public ILiveVehicle restore(VehicleSnapshot snapshot, Ownership callerIdentity, boolean rebindChildOwnership) throws DefinitionNotFoundException, SpawnFailedException
	{
		Assert.assertTrue(_world.isWorldThread(), "restore must run on the world thread");
		VehicleSnapshot toRestore = snapshot;
		if (null != callerIdentity)
		{
			LOG.debug("Vehicle snapshot of instance {} claimed by {}", snapshot.instanceId(), callerIdentity.owner());
			toRestore = snapshot.withOwnership(callerIdentity.owner(), callerIdentity.group());
		}
		return VehicleRestore.restore(_world
				, _resolver
				, toRestore
				, rebindChildOwnership
				, _config.restoreAttachedChildren
				, _config.rollbackPartialRestore
		);
	}
}
