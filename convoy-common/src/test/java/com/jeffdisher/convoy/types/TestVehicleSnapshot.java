package com.jeffdisher.convoy.types;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.convoy.aspects.IDefinitionResolver;


public class TestVehicleSnapshot
{
	@Test
	public void listsAreCopied() throws Throwable
	{
		List<Boolean> tires = new ArrayList<>(List.of(true, false));
		VehicleSnapshot snapshot = _snapshot(tires, null);
		tires.add(true);
		Assert.assertEquals(2, snapshot.tires().size());
	}

	@Test
	public void withOwnershipLeavesOriginal() throws Throwable
	{
		VehicleSnapshot snapshot = _snapshot(List.of(true), PaintColour.fromInts(1, 2, 3, 4));
		VehicleSnapshot claimed = snapshot.withOwnership(99L, 7L);
		Assert.assertEquals(5L, snapshot.owner());
		Assert.assertEquals(99L, claimed.owner());
		Assert.assertEquals(7L, claimed.group());
		Assert.assertEquals(snapshot.paint(), claimed.paint());
		Assert.assertEquals(snapshot.tires(), claimed.tires());
	}

	@Test
	public void paintBytes() throws Throwable
	{
		Assert.assertArrayEquals(new byte[4], _snapshot(List.of(), null).paintBytes());
		Assert.assertArrayEquals(new byte[] { 1, 2, 3, 4 }, _snapshot(List.of(), PaintColour.fromInts(1, 2, 3, 4)).paintBytes());
	}

	@Test
	public void resolvePassesBothKeys() throws Throwable
	{
		VehicleSnapshot snapshot = _snapshot(List.of(), null);
		Object[] seen = new Object[2];
		IDefinitionResolver resolver = new IDefinitionResolver() {
			@Override
			public VehicleType resolveVehicle(UUID guid, short legacyId)
			{
				seen[0] = guid;
				seen[1] = legacyId;
				return null;
			}
			@Override
			public StateBlob defaultStateFor(Item item)
			{
				throw new AssertionError();
			}
		};
		Assert.assertNull(snapshot.resolveDefinition(resolver));
		Assert.assertEquals(snapshot.definitionGuid(), seen[0]);
		Assert.assertEquals((short)42, seen[1]);
	}


	private static VehicleSnapshot _snapshot(List<Boolean> tires, PaintColour paint)
	{
		return new VehicleSnapshot((short)42
				, UUID.fromString("2d0a7c41-58e9-4b6a-a1f3-7e9c0d2b4a01")
				, 12
				, (short)0
				, (short)0
				, 0.0f
				, (short)100
				, (short)100
				, (short)100
				, 5L
				, 6L
				, tires
				, List.of()
				, CargoSnapshot.EMPTY
				, List.of()
				, List.of()
				, WorldLocation.ORIGIN
				, WorldRotation.IDENTITY
				, paint
		);
	}
}
