package com.jeffdisher.convoy.world;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.jeffdisher.convoy.types.BarricadeSnapshot;
import com.jeffdisher.convoy.types.PaintColour;
import com.jeffdisher.convoy.types.StateBlob;
import com.jeffdisher.convoy.types.StructureSnapshot;
import com.jeffdisher.convoy.utils.Assert;


/**
 * A single-threaded, in-memory world used to drive capture and restore in tests.
 * The thread which creates the instance is treated as the world thread.  Failures can be injected into vehicle creation
 * and child placement to exercise the partial-restore paths.
 */
public class FakeVehicleWorld implements IVehicleWorld
{
	/**
	 * The paint the world applies when a creation request has no override.
	 */
	public static final PaintColour DEFAULT_PAINT = PaintColour.fromInts(200, 200, 200, 255);
	/**
	 * The state every turret mount starts with, before anything is written to it.
	 */
	public static final StateBlob DEFAULT_TURRET_STATE = StateBlob.wrap(new byte[] { (byte)0xEE });

	private final Thread _owningThread;
	private int _nextInstanceId;
	private final Map<Integer, FakeRegion> _regions;

	public final List<FakeVehicle> vehicles;
	public final List<FakeVehicle> destroyed;
	public final List<VehicleSpawnRequest> spawnRequests;
	// When true, spawnVehicle() fails.
	public boolean failSpawns;
	// When non-negative, the placement at this 0-based index (barricades and structures counted together) fails.
	public int failPlacementAt;
	// When true, destroyVehicle() fails without removing anything.
	public boolean failDestroy;
	private int _placementAttempts;

	public FakeVehicleWorld()
	{
		_owningThread = Thread.currentThread();
		_nextInstanceId = 1;
		_regions = new HashMap<>();
		this.vehicles = new ArrayList<>();
		this.destroyed = new ArrayList<>();
		this.spawnRequests = new ArrayList<>();
		this.failPlacementAt = -1;
	}

	@Override
	public boolean isWorldThread()
	{
		return Thread.currentThread() == _owningThread;
	}

	@Override
	public FakeVehicle spawnVehicle(VehicleSpawnRequest request) throws SpawnFailedException
	{
		Assert.assertTrue(isWorldThread());
		this.spawnRequests.add(request);
		if (this.failSpawns)
		{
			throw new SpawnFailedException("Injected spawn failure for " + request.type().id());
		}
		FakeVehicle vehicle = new FakeVehicle(_nextInstanceId, request, DEFAULT_PAINT, DEFAULT_TURRET_STATE);
		_nextInstanceId += 1;
		this.vehicles.add(vehicle);
		return vehicle;
	}

	@Override
	public FakeRegion findAttachedRegion(ILiveVehicle vehicle)
	{
		return _regions.get(vehicle.getInstanceId());
	}

	@Override
	public FakeBarricade placeBarricade(BarricadeSnapshot snapshot, ILiveVehicle anchor) throws SpawnFailedException
	{
		_checkPlacement(anchor);
		FakeBarricade barricade = new FakeBarricade(snapshot);
		_regionFor(anchor).barricades.add(barricade);
		return barricade;
	}

	@Override
	public FakeStructure placeStructure(StructureSnapshot snapshot, ILiveVehicle anchor) throws SpawnFailedException
	{
		_checkPlacement(anchor);
		FakeStructure structure = new FakeStructure(snapshot);
		_regionFor(anchor).structures.add(structure);
		return structure;
	}

	@Override
	public void destroyVehicle(ILiveVehicle vehicle)
	{
		Assert.assertTrue(isWorldThread());
		if (this.failDestroy)
		{
			throw new IllegalStateException("Injected destroy failure for vehicle " + vehicle.getInstanceId());
		}
		boolean didRemove = this.vehicles.remove(vehicle);
		Assert.assertTrue(didRemove);
		_regions.remove(vehicle.getInstanceId());
		this.destroyed.add((FakeVehicle)vehicle);
	}

	/**
	 * @param vehicle A vehicle.
	 * @return The region anchored to the vehicle, creating it if it doesn't yet exist.
	 */
	public FakeRegion regionFor(ILiveVehicle vehicle)
	{
		return _regionFor(vehicle);
	}


	private void _checkPlacement(ILiveVehicle anchor) throws SpawnFailedException
	{
		Assert.assertTrue(isWorldThread());
		Assert.assertTrue(this.vehicles.contains(anchor));
		int attempt = _placementAttempts;
		_placementAttempts += 1;
		if (attempt == this.failPlacementAt)
		{
			throw new SpawnFailedException("Injected placement failure at " + attempt);
		}
	}

	private FakeRegion _regionFor(ILiveVehicle vehicle)
	{
		return _regions.computeIfAbsent(vehicle.getInstanceId(), (Integer id) -> new FakeRegion());
	}
}
