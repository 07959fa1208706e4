package com.jeffdisher.convoy.logic;

import java.util.List;
import java.util.UUID;

import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

import com.jeffdisher.convoy.aspects.Catalog;
import com.jeffdisher.convoy.types.BarricadeSnapshot;
import com.jeffdisher.convoy.types.CargoEntry;
import com.jeffdisher.convoy.types.CargoSnapshot;
import com.jeffdisher.convoy.types.ItemInstance;
import com.jeffdisher.convoy.types.PaintColour;
import com.jeffdisher.convoy.types.StateBlob;
import com.jeffdisher.convoy.types.StructureSnapshot;
import com.jeffdisher.convoy.types.VehicleSnapshot;
import com.jeffdisher.convoy.types.VehicleType;
import com.jeffdisher.convoy.types.WorldLocation;
import com.jeffdisher.convoy.types.WorldRotation;
import com.jeffdisher.convoy.world.FakeBarricade;
import com.jeffdisher.convoy.world.FakeRegion;
import com.jeffdisher.convoy.world.FakeStructure;
import com.jeffdisher.convoy.world.FakeVehicle;
import com.jeffdisher.convoy.world.FakeVehicleWorld;
import com.jeffdisher.convoy.world.VehicleSpawnRequest;


public class TestVehicleCapture
{
	private static Catalog CATALOG;
	private static VehicleType TECHNICAL;
	private static VehicleType FLATBED;
	private static VehicleType DRAISINE;

	@BeforeClass
	public static void setup() throws Throwable
	{
		CATALOG = Catalog.loadFromClasspath(TestVehicleCapture.class.getClassLoader());
		TECHNICAL = CATALOG.vehicles.getVehicleById("op.technical");
		FLATBED = CATALOG.vehicles.getVehicleById("op.flatbed");
		DRAISINE = CATALOG.vehicles.getVehicleById("op.draisine");
	}

	@Test
	public void scalars() throws Throwable
	{
		FakeVehicleWorld world = new FakeVehicleWorld();
		FakeVehicle vehicle = world.spawnVehicle(_request(TECHNICAL, null));
		vehicle.roadPosition = 3.5f;
		VehicleSnapshot snapshot = VehicleCapture.capture(world, vehicle, true);
		
		Assert.assertEquals(TECHNICAL.number(), snapshot.definitionId());
		Assert.assertEquals(TECHNICAL.guid(), snapshot.definitionGuid());
		Assert.assertEquals(vehicle.instanceId, snapshot.instanceId());
		Assert.assertEquals((short)2, snapshot.skinId());
		Assert.assertEquals((short)3, snapshot.mythicId());
		Assert.assertEquals(3.5f, snapshot.roadPosition(), 0.0f);
		Assert.assertEquals((short)700, snapshot.health());
		Assert.assertEquals((short)600, snapshot.fuel());
		Assert.assertEquals((short)5000, snapshot.batteryCharge());
		Assert.assertEquals(11L, snapshot.owner());
		Assert.assertEquals(12L, snapshot.group());
		Assert.assertEquals(new WorldLocation(1.0f, 2.0f, 3.0f), snapshot.position());
		Assert.assertEquals(WorldRotation.IDENTITY, snapshot.rotation());
		// The world applied its default paint, which is a real override.
		Assert.assertEquals(FakeVehicleWorld.DEFAULT_PAINT, snapshot.paint());
	}

	@Test
	public void tiresInSlotOrder() throws Throwable
	{
		FakeVehicleWorld world = new FakeVehicleWorld();
		FakeVehicle vehicle = world.spawnVehicle(_request(FLATBED, null));
		vehicle.tires[1] = false;
		vehicle.tires[4] = false;
		Assert.assertEquals(List.of(true, false, true, true, false, true), VehicleCapture.captureTires(vehicle));
		
		FakeVehicle draisine = world.spawnVehicle(_request(DRAISINE, null));
		Assert.assertTrue(VehicleCapture.captureTires(draisine).isEmpty());
	}

	@Test
	public void missingTurretKeepsAlignment() throws Throwable
	{
		FakeVehicleWorld world = new FakeVehicleWorld();
		FakeVehicle vehicle = world.spawnVehicle(_request(TECHNICAL, null));
		vehicle.turrets[0] = null;
		vehicle.turrets[1].state = StateBlob.wrap(new byte[] { 0x0B });
		List<StateBlob> turrets = VehicleCapture.captureTurrets(vehicle);
		Assert.assertEquals(List.of(StateBlob.EMPTY, StateBlob.wrap(new byte[] { 0x0B })), turrets);
	}

	@Test
	public void emptyCargo() throws Throwable
	{
		FakeVehicleWorld world = new FakeVehicleWorld();
		// No cargo support.
		FakeVehicle flatbed = world.spawnVehicle(_request(FLATBED, null));
		Assert.assertSame(CargoSnapshot.EMPTY, VehicleCapture.capture(world, flatbed, true).cargo());
		// Cargo support but nothing stored.
		FakeVehicle technical = world.spawnVehicle(_request(TECHNICAL, null));
		Assert.assertSame(CargoSnapshot.EMPTY, VehicleCapture.capture(world, technical, true).cargo());
	}

	@Test
	public void cargoInStoredOrder() throws Throwable
	{
		FakeVehicleWorld world = new FakeVehicleWorld();
		FakeVehicle vehicle = world.spawnVehicle(_request(TECHNICAL, null));
		CargoEntry first = new CargoEntry((byte)3, (byte)1, (byte)0, new ItemInstance((short)2001, (byte)1, (byte)100, StateBlob.wrap(new byte[] { 9 })));
		CargoEntry second = new CargoEntry((byte)0, (byte)0, (byte)1, new ItemInstance((short)2001, (byte)2, (byte)80, StateBlob.EMPTY));
		vehicle.cargo.addItem(first);
		vehicle.cargo.addItem(second);
		CargoSnapshot cargo = VehicleCapture.capture(world, vehicle, true).cargo();
		Assert.assertEquals(TECHNICAL.trunkWidth(), cargo.width());
		Assert.assertEquals(TECHNICAL.trunkHeight(), cargo.height());
		Assert.assertEquals(List.of(first, second), cargo.entries());
	}

	@Test
	public void paintNormalization() throws Throwable
	{
		FakeVehicleWorld world = new FakeVehicleWorld();
		FakeVehicle vehicle = world.spawnVehicle(_request(TECHNICAL, null));
		vehicle.paint = PaintColour.fromInts(200, 10, 10, 0);
		VehicleSnapshot transparent = VehicleCapture.capture(world, vehicle, true);
		Assert.assertNull(transparent.paint());
		Assert.assertArrayEquals(new byte[4], transparent.paintBytes());
		
		vehicle.paint = null;
		Assert.assertNull(VehicleCapture.capture(world, vehicle, true).paint());
		
		vehicle.paint = PaintColour.fromInts(0, 0, 0, 255);
		Assert.assertArrayEquals(new byte[] { 0, 0, 0, (byte)255 }, VehicleCapture.capture(world, vehicle, true).paintBytes());
	}

	@Test
	public void childrenSkipDestroyed() throws Throwable
	{
		FakeVehicleWorld world = new FakeVehicleWorld();
		FakeVehicle vehicle = world.spawnVehicle(_request(FLATBED, null));
		FakeRegion region = world.regionFor(vehicle);
		FakeBarricade live = new FakeBarricade(_barricade((short)7));
		FakeBarricade dead = new FakeBarricade(_barricade((short)8));
		dead.isDestroyed = true;
		region.barricades.add(live);
		region.barricades.add(dead);
		region.structures.add(new FakeStructure(new StructureSnapshot((short)20, null, (short)50, 11L, 12L, WorldLocation.ORIGIN, WorldRotation.IDENTITY)));
		
		VehicleSnapshot snapshot = VehicleCapture.capture(world, vehicle, true);
		Assert.assertEquals(List.of(_barricade((short)7)), snapshot.barricades());
		Assert.assertEquals(1, snapshot.structures().size());
		Assert.assertEquals((short)20, snapshot.structures().get(0).definitionId());
		
		// Children can be left out entirely.
		VehicleSnapshot bare = VehicleCapture.capture(world, vehicle, false);
		Assert.assertTrue(bare.barricades().isEmpty());
		Assert.assertTrue(bare.structures().isEmpty());
	}

	@Test
	public void regionMissIsEmpty() throws Throwable
	{
		FakeVehicleWorld world = new FakeVehicleWorld();
		FakeVehicle vehicle = world.spawnVehicle(_request(FLATBED, null));
		Assert.assertNull(world.findAttachedRegion(vehicle));
		VehicleSnapshot snapshot = VehicleCapture.capture(world, vehicle, true);
		Assert.assertTrue(snapshot.barricades().isEmpty());
		Assert.assertTrue(snapshot.structures().isEmpty());
	}

	@Test
	public void snapshotIndependentOfVehicle() throws Throwable
	{
		FakeVehicleWorld world = new FakeVehicleWorld();
		FakeVehicle vehicle = world.spawnVehicle(_request(TECHNICAL, null));
		VehicleSnapshot snapshot = VehicleCapture.capture(world, vehicle, true);
		vehicle.tires[0] = false;
		vehicle.turrets[0].setState(StateBlob.wrap(new byte[] { 1 }));
		vehicle.health = 1;
		Assert.assertEquals(List.of(true, true, true, true), snapshot.tires());
		Assert.assertEquals(FakeVehicleWorld.DEFAULT_TURRET_STATE, snapshot.turrets().get(0));
		Assert.assertEquals((short)700, snapshot.health());
	}


	private static VehicleSpawnRequest _request(VehicleType type, PaintColour paint)
	{
		return new VehicleSpawnRequest(type
				, (short)2
				, (short)3
				, 0.0f
				, new WorldLocation(1.0f, 2.0f, 3.0f)
				, WorldRotation.IDENTITY
				, (short)600
				, (short)700
				, (short)5000
				, 11L
				, 12L
				, true
				, paint
		);
	}

	private static BarricadeSnapshot _barricade(short id)
	{
		return new BarricadeSnapshot(id, UUID.fromString("0c5e9a3b-1d2f-4e6a-8b7c-9d0e1f2a3b4c"), (short)300, 11L, 12L, StateBlob.wrap(new byte[] { 1, 2 }), new WorldLocation(0.5f, 1.0f, 0.0f), WorldRotation.IDENTITY);
	}
}
