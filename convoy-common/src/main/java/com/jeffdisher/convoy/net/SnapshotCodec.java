package com.jeffdisher.convoy.net;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.jeffdisher.convoy.types.BarricadeSnapshot;
import com.jeffdisher.convoy.types.CargoEntry;
import com.jeffdisher.convoy.types.CargoSnapshot;
import com.jeffdisher.convoy.types.ItemInstance;
import com.jeffdisher.convoy.types.PaintColour;
import com.jeffdisher.convoy.types.StateBlob;
import com.jeffdisher.convoy.types.StructureSnapshot;
import com.jeffdisher.convoy.types.VehicleSnapshot;
import com.jeffdisher.convoy.types.WorldLocation;
import com.jeffdisher.convoy.types.WorldRotation;
import com.jeffdisher.convoy.utils.Assert;


/**
 * Binary encoding of VehicleSnapshot (and everything it contains) into a ByteBuffer.
 * Every field is preserved exactly, including the all-zero paint sentinel and the index alignment of the tire and
 * turret lists.  Lists and blobs are prefixed by an int count.
 */
public class SnapshotCodec
{
	/**
	 * The version byte written at the start of every encoded snapshot.
	 */
	public static final byte FORMAT_VERSION = 1;
	/**
	 * Used to encode a null in some optional cases.
	 */
	public static final byte NULL_BYTE = 0;
	/**
	 * Used to encode that a non-null value follows in some optional cases.
	 */
	public static final byte NON_NULL_BYTE = 1;

	private static final int UUID_BYTES = Byte.BYTES + (2 * Long.BYTES);
	private static final int LOCATION_BYTES = 3 * Float.BYTES;
	private static final int ROTATION_BYTES = 4 * Float.BYTES;
	// Smallest encodings of list elements (empty state blobs), used to bound counts read from untrusted data.
	private static final int MIN_BLOB_BYTES = Integer.BYTES;
	private static final int MIN_CARGO_ENTRY_BYTES = (3 * Byte.BYTES) + Short.BYTES + (2 * Byte.BYTES) + MIN_BLOB_BYTES;
	private static final int MIN_BARRICADE_BYTES = Short.BYTES + UUID_BYTES + Short.BYTES + (2 * Long.BYTES) + MIN_BLOB_BYTES + LOCATION_BYTES + ROTATION_BYTES;
	private static final int STRUCTURE_BYTES = Short.BYTES + UUID_BYTES + Short.BYTES + (2 * Long.BYTES) + LOCATION_BYTES + ROTATION_BYTES;

	/**
	 * Encodes the snapshot into a new array of exactly the required size.
	 *
	 * @param snapshot The snapshot.
	 * @return The encoded bytes.
	 */
	public static byte[] toBytes(VehicleSnapshot snapshot)
	{
		int size = serializedSize(snapshot);
		ByteBuffer buffer = ByteBuffer.allocate(size);
		writeVehicleSnapshot(buffer, snapshot);
		Assert.assertTrue(!buffer.hasRemaining());
		return buffer.array();
	}

	/**
	 * Decodes a snapshot previously produced by toBytes().
	 *
	 * @param bytes The encoded bytes.
	 * @return The snapshot.
	 * @throws IllegalStateException The data is not a valid snapshot, is truncated, or has trailing bytes.
	 */
	public static VehicleSnapshot fromBytes(byte[] bytes)
	{
		ByteBuffer buffer = ByteBuffer.wrap(bytes);
		VehicleSnapshot snapshot;
		try
		{
			snapshot = readVehicleSnapshot(buffer);
		}
		catch (BufferUnderflowException e)
		{
			throw new IllegalStateException("Truncated snapshot (" + bytes.length + " bytes)", e);
		}
		if (buffer.hasRemaining())
		{
			throw new IllegalStateException(buffer.remaining() + " trailing bytes after snapshot");
		}
		return snapshot;
	}

	/**
	 * @param snapshot A snapshot.
	 * @return The number of bytes writeVehicleSnapshot() will write for it.
	 */
	public static int serializedSize(VehicleSnapshot snapshot)
	{
		int size = Byte.BYTES
				+ Short.BYTES + UUID_BYTES + Integer.BYTES + (2 * Short.BYTES) + Float.BYTES
				+ (3 * Short.BYTES) + (2 * Long.BYTES)
		;
		size += Integer.BYTES + snapshot.tires().size();
		size += Integer.BYTES;
		for (StateBlob turret : snapshot.turrets())
		{
			size += _blobSize(turret);
		}
		size += (2 * Byte.BYTES) + Integer.BYTES;
		for (CargoEntry entry : snapshot.cargo().entries())
		{
			size += (3 * Byte.BYTES) + Short.BYTES + (2 * Byte.BYTES) + _blobSize(entry.item().state());
		}
		size += Integer.BYTES;
		for (BarricadeSnapshot barricade : snapshot.barricades())
		{
			size += Short.BYTES + UUID_BYTES + Short.BYTES + (2 * Long.BYTES) + _blobSize(barricade.state()) + LOCATION_BYTES + ROTATION_BYTES;
		}
		size += Integer.BYTES;
		size += snapshot.structures().size() * STRUCTURE_BYTES;
		size += LOCATION_BYTES + ROTATION_BYTES + PaintColour.SNAPSHOT_BYTES;
		return size;
	}

	public static void writeVehicleSnapshot(ByteBuffer buffer, VehicleSnapshot snapshot)
	{
		buffer.put(FORMAT_VERSION);
		buffer.putShort(snapshot.definitionId());
		_writeNullableUuid(buffer, snapshot.definitionGuid());
		buffer.putInt(snapshot.instanceId());
		buffer.putShort(snapshot.skinId());
		buffer.putShort(snapshot.mythicId());
		buffer.putFloat(snapshot.roadPosition());
		buffer.putShort(snapshot.health());
		buffer.putShort(snapshot.fuel());
		buffer.putShort(snapshot.batteryCharge());
		buffer.putLong(snapshot.owner());
		buffer.putLong(snapshot.group());

		List<Boolean> tires = snapshot.tires();
		buffer.putInt(tires.size());
		for (boolean alive : tires)
		{
			buffer.put(alive ? NON_NULL_BYTE : NULL_BYTE);
		}
		List<StateBlob> turrets = snapshot.turrets();
		buffer.putInt(turrets.size());
		for (StateBlob turret : turrets)
		{
			_writeBlob(buffer, turret);
		}
		_writeCargo(buffer, snapshot.cargo());

		List<BarricadeSnapshot> barricades = snapshot.barricades();
		buffer.putInt(barricades.size());
		for (BarricadeSnapshot barricade : barricades)
		{
			writeBarricadeSnapshot(buffer, barricade);
		}
		List<StructureSnapshot> structures = snapshot.structures();
		buffer.putInt(structures.size());
		for (StructureSnapshot structure : structures)
		{
			writeStructureSnapshot(buffer, structure);
		}

		_writeLocation(buffer, snapshot.position());
		_writeRotation(buffer, snapshot.rotation());
		buffer.put(snapshot.paintBytes());
	}

	public static VehicleSnapshot readVehicleSnapshot(ByteBuffer buffer)
	{
		byte version = buffer.get();
		if (FORMAT_VERSION != version)
		{
			throw new IllegalStateException("Unknown snapshot format version: " + version);
		}
		short definitionId = buffer.getShort();
		UUID definitionGuid = _readNullableUuid(buffer);
		int instanceId = buffer.getInt();
		short skinId = buffer.getShort();
		short mythicId = buffer.getShort();
		float roadPosition = buffer.getFloat();
		short health = buffer.getShort();
		short fuel = buffer.getShort();
		short batteryCharge = buffer.getShort();
		long owner = buffer.getLong();
		long group = buffer.getLong();

		int tireCount = _readCount(buffer, Byte.BYTES);
		List<Boolean> tires = new ArrayList<>();
		for (int i = 0; i < tireCount; ++i)
		{
			tires.add(NULL_BYTE != buffer.get());
		}
		int turretCount = _readCount(buffer, MIN_BLOB_BYTES);
		List<StateBlob> turrets = new ArrayList<>();
		for (int i = 0; i < turretCount; ++i)
		{
			turrets.add(_readBlob(buffer));
		}
		CargoSnapshot cargo = _readCargo(buffer);

		int barricadeCount = _readCount(buffer, MIN_BARRICADE_BYTES);
		List<BarricadeSnapshot> barricades = new ArrayList<>();
		for (int i = 0; i < barricadeCount; ++i)
		{
			barricades.add(readBarricadeSnapshot(buffer));
		}
		int structureCount = _readCount(buffer, STRUCTURE_BYTES);
		List<StructureSnapshot> structures = new ArrayList<>();
		for (int i = 0; i < structureCount; ++i)
		{
			structures.add(readStructureSnapshot(buffer));
		}

		WorldLocation position = _readLocation(buffer);
		WorldRotation rotation = _readRotation(buffer);
		byte[] paintBytes = new byte[PaintColour.SNAPSHOT_BYTES];
		buffer.get(paintBytes);
		PaintColour paint = PaintColour.fromSnapshotBytes(paintBytes);

		return new VehicleSnapshot(definitionId
				, definitionGuid
				, instanceId
				, skinId
				, mythicId
				, roadPosition
				, health
				, fuel
				, batteryCharge
				, owner
				, group
				, tires
				, turrets
				, cargo
				, barricades
				, structures
				, position
				, rotation
				, paint
		);
	}

	public static void writeBarricadeSnapshot(ByteBuffer buffer, BarricadeSnapshot barricade)
	{
		buffer.putShort(barricade.definitionId());
		_writeNullableUuid(buffer, barricade.definitionGuid());
		buffer.putShort(barricade.health());
		buffer.putLong(barricade.owner());
		buffer.putLong(barricade.group());
		_writeBlob(buffer, barricade.state());
		_writeLocation(buffer, barricade.localPosition());
		_writeRotation(buffer, barricade.localRotation());
	}

	public static BarricadeSnapshot readBarricadeSnapshot(ByteBuffer buffer)
	{
		short definitionId = buffer.getShort();
		UUID definitionGuid = _readNullableUuid(buffer);
		short health = buffer.getShort();
		long owner = buffer.getLong();
		long group = buffer.getLong();
		StateBlob state = _readBlob(buffer);
		WorldLocation position = _readLocation(buffer);
		WorldRotation rotation = _readRotation(buffer);
		return new BarricadeSnapshot(definitionId, definitionGuid, health, owner, group, state, position, rotation);
	}

	public static void writeStructureSnapshot(ByteBuffer buffer, StructureSnapshot structure)
	{
		buffer.putShort(structure.definitionId());
		_writeNullableUuid(buffer, structure.definitionGuid());
		buffer.putShort(structure.health());
		buffer.putLong(structure.owner());
		buffer.putLong(structure.group());
		_writeLocation(buffer, structure.localPosition());
		_writeRotation(buffer, structure.localRotation());
	}

	public static StructureSnapshot readStructureSnapshot(ByteBuffer buffer)
	{
		short definitionId = buffer.getShort();
		UUID definitionGuid = _readNullableUuid(buffer);
		short health = buffer.getShort();
		long owner = buffer.getLong();
		long group = buffer.getLong();
		WorldLocation position = _readLocation(buffer);
		WorldRotation rotation = _readRotation(buffer);
		return new StructureSnapshot(definitionId, definitionGuid, health, owner, group, position, rotation);
	}


	private static void _writeCargo(ByteBuffer buffer, CargoSnapshot cargo)
	{
		buffer.put(cargo.width());
		buffer.put(cargo.height());
		buffer.putInt(cargo.entries().size());
		for (CargoEntry entry : cargo.entries())
		{
			buffer.put(entry.x());
			buffer.put(entry.y());
			buffer.put(entry.rotation());
			ItemInstance item = entry.item();
			buffer.putShort(item.itemId());
			buffer.put(item.amount());
			buffer.put(item.quality());
			_writeBlob(buffer, item.state());
		}
	}

	private static CargoSnapshot _readCargo(ByteBuffer buffer)
	{
		byte width = buffer.get();
		byte height = buffer.get();
		int count = _readCount(buffer, MIN_CARGO_ENTRY_BYTES);
		List<CargoEntry> entries = new ArrayList<>();
		for (int i = 0; i < count; ++i)
		{
			byte x = buffer.get();
			byte y = buffer.get();
			byte rotation = buffer.get();
			short itemId = buffer.getShort();
			byte amount = buffer.get();
			byte quality = buffer.get();
			StateBlob state = _readBlob(buffer);
			entries.add(new CargoEntry(x, y, rotation, new ItemInstance(itemId, amount, quality, state)));
		}
		return entries.isEmpty() && (0 == width) && (0 == height)
				? CargoSnapshot.EMPTY
				: new CargoSnapshot(width, height, entries)
		;
	}

	private static int _blobSize(StateBlob blob)
	{
		return Integer.BYTES + blob.length();
	}

	private static void _writeBlob(ByteBuffer buffer, StateBlob blob)
	{
		buffer.putInt(blob.length());
		buffer.put(blob.toByteArray());
	}

	private static StateBlob _readBlob(ByteBuffer buffer)
	{
		int length = _readCount(buffer, Byte.BYTES);
		byte[] data = new byte[length];
		buffer.get(data);
		return StateBlob.wrap(data);
	}

	private static int _readCount(ByteBuffer buffer, int minimumElementSize)
	{
		int count = buffer.getInt();
		// Each element takes at least minimumElementSize bytes so a count larger than that can't be valid.
		if ((count < 0) || (count > (buffer.remaining() / minimumElementSize)))
		{
			throw new IllegalStateException("Invalid element count: " + count);
		}
		return count;
	}

	private static void _writeNullableUuid(ByteBuffer buffer, UUID value)
	{
		if (null != value)
		{
			buffer.put(NON_NULL_BYTE);
			buffer.putLong(value.getMostSignificantBits());
			buffer.putLong(value.getLeastSignificantBits());
		}
		else
		{
			// We still write the longs so that the encoding has a fixed size.
			buffer.put(NULL_BYTE);
			buffer.putLong(0L);
			buffer.putLong(0L);
		}
	}

	private static UUID _readNullableUuid(ByteBuffer buffer)
	{
		byte nullBit = buffer.get();
		long most = buffer.getLong();
		long least = buffer.getLong();
		return (NULL_BYTE == nullBit)
				? null
				: new UUID(most, least)
		;
	}

	private static void _writeLocation(ByteBuffer buffer, WorldLocation location)
	{
		buffer.putFloat(location.x());
		buffer.putFloat(location.y());
		buffer.putFloat(location.z());
	}

	private static WorldLocation _readLocation(ByteBuffer buffer)
	{
		float x = buffer.getFloat();
		float y = buffer.getFloat();
		float z = buffer.getFloat();
		return new WorldLocation(x, y, z);
	}

	private static void _writeRotation(ByteBuffer buffer, WorldRotation rotation)
	{
		buffer.putFloat(rotation.x());
		buffer.putFloat(rotation.y());
		buffer.putFloat(rotation.z());
		buffer.putFloat(rotation.w());
	}

	private static WorldRotation _readRotation(ByteBuffer buffer)
	{
		float x = buffer.getFloat();
		float y = buffer.getFloat();
		float z = buffer.getFloat();
		float w = buffer.getFloat();
		return new WorldRotation(x, y, z, w);
	}
}
