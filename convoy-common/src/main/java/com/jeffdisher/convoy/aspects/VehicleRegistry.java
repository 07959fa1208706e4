package com.jeffdisher.convoy.aspects;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.jeffdisher.convoy.config.IValueTransformer;
import com.jeffdisher.convoy.config.SimpleTabListCallbacks;
import com.jeffdisher.convoy.config.TabListReader;
import com.jeffdisher.convoy.types.Item;
import com.jeffdisher.convoy.types.VehicleType;


/**
 * Contains the description of every vehicle class which can be created in the world.
 */
public class VehicleRegistry
{
	private static final String SUB_NUMBER = "number";
	private static final String SUB_GUID = "guid";
	private static final String SUB_TIRES = "tires";
	private static final String SUB_MAX_HEALTH = "max_health";
	private static final String SUB_MAX_FUEL = "max_fuel";
	private static final String SUB_MAX_BATTERY = "max_battery";
	private static final String SUB_OPT_TURRETS = "turrets";
	private static final String SUB_OPT_TRUNK = "trunk";

	/**
	 * Loads the vehicle registry from the tablist in the given stream, sourcing turret Items from the given registry.
	 * The format is:
	 * ID<TAB>NAME
	 * <TAB>number<TAB>LEGACY_NUMBER
	 * <TAB>guid<TAB>GUID
	 * <TAB>tires<TAB>COUNT
	 * <TAB>max_health<TAB>VALUE
	 * <TAB>max_fuel<TAB>VALUE
	 * <TAB>max_battery<TAB>VALUE (the number and the maximums are unsigned 16-bit)
	 * <TAB>turrets(<TAB>ITEM_ID)* (optional - one item per mount, in mount order)
	 * <TAB>trunk<TAB>WIDTH<TAB>HEIGHT (optional - no cargo if missing)
	 * 
	 * @param items The existing ItemRegistry.
	 * @param stream The stream containing the tablist.
	 * @return The registry (never null).
	 * @throws IOException There was a problem with the stream.
	 * @throws TabListReader.TabListException The tablist was malformed.
	 */
	public static VehicleRegistry loadRegistry(ItemRegistry items, InputStream stream) throws IOException, TabListReader.TabListException
	{
		if (null == stream)
		{
			throw new IOException("Resource missing");
		}
		IValueTransformer.ItemTransformer itemTransformer = new IValueTransformer.ItemTransformer(items);
		IValueTransformer.CountTransformer dimension = new IValueTransformer.CountTransformer(SUB_OPT_TRUNK);
		
		SimpleTabListCallbacks<String, String> callbacks = new SimpleTabListCallbacks<>((String value) -> value, (String value) -> value);
		SimpleTabListCallbacks.SubRecordCapture<String, Short> numbers = callbacks.captureSubRecord(SUB_NUMBER, SimpleTabListCallbacks.single(new IValueTransformer.UnsignedShortTransformer(SUB_NUMBER)), true);
		SimpleTabListCallbacks.SubRecordCapture<String, UUID> guids = callbacks.captureSubRecord(SUB_GUID, SimpleTabListCallbacks.single(new IValueTransformer.UuidTransformer()), true);
		SimpleTabListCallbacks.SubRecordCapture<String, Integer> tires = callbacks.captureSubRecord(SUB_TIRES, SimpleTabListCallbacks.single(new IValueTransformer.CountTransformer(SUB_TIRES)), true);
		SimpleTabListCallbacks.SubRecordCapture<String, Short> maxHealth = callbacks.captureSubRecord(SUB_MAX_HEALTH, SimpleTabListCallbacks.single(new IValueTransformer.UnsignedShortTransformer(SUB_MAX_HEALTH)), true);
		SimpleTabListCallbacks.SubRecordCapture<String, Short> maxFuel = callbacks.captureSubRecord(SUB_MAX_FUEL, SimpleTabListCallbacks.single(new IValueTransformer.UnsignedShortTransformer(SUB_MAX_FUEL)), true);
		SimpleTabListCallbacks.SubRecordCapture<String, Short> maxBattery = callbacks.captureSubRecord(SUB_MAX_BATTERY, SimpleTabListCallbacks.single(new IValueTransformer.UnsignedShortTransformer(SUB_MAX_BATTERY)), true);
		SimpleTabListCallbacks.SubRecordCapture<String, List<Item>> turrets = callbacks.captureSubRecord(SUB_OPT_TURRETS, (String[] parameters) -> {
			// Note that duplicates are expected in this list (the same weapon is often on several mounts).
			List<Item> list = new ArrayList<>();
			for (String parameter : parameters)
			{
				list.add(itemTransformer.transform(parameter));
			}
			return list;
		}, false);
		SimpleTabListCallbacks.SubRecordCapture<String, byte[]> trunks = callbacks.captureSubRecord(SUB_OPT_TRUNK, (String[] parameters) -> {
			if (2 != parameters.length)
			{
				throw new TabListReader.TabListException("Expected WIDTH and HEIGHT");
			}
			int width = dimension.transform(parameters[0]);
			int height = dimension.transform(parameters[1]);
			if ((width > Byte.MAX_VALUE) || (height > Byte.MAX_VALUE))
			{
				throw new TabListReader.TabListException("Trunk dimensions cannot exceed " + Byte.MAX_VALUE);
			}
			return new byte[] { (byte)width, (byte)height };
		}, false);
		TabListReader.readEntireFile(callbacks, stream);
		
		List<VehicleType> vehicles = new ArrayList<>();
		for (String id : callbacks.keyOrder)
		{
			byte[] trunk = trunks.recordData.getOrDefault(id, new byte[2]);
			vehicles.add(new VehicleType(id
					, callbacks.topLevel.get(id)
					, numbers.recordData.get(id)
					, guids.recordData.get(id)
					, tires.recordData.get(id)
					, turrets.recordData.getOrDefault(id, List.of())
					, maxHealth.recordData.get(id)
					, maxFuel.recordData.get(id)
					, maxBattery.recordData.get(id)
					, trunk[0]
					, trunk[1]
			));
		}
		return new VehicleRegistry(vehicles);
	}


	private final List<VehicleType> _vehicles;
	private final Map<String, VehicleType> _idsMap;
	private final Map<UUID, VehicleType> _guidsMap;
	private final Map<Short, VehicleType> _numbersMap;

	private VehicleRegistry(List<VehicleType> vehicles) throws TabListReader.TabListException
	{
		_vehicles = Collections.unmodifiableList(vehicles);
		_idsMap = new HashMap<>();
		_guidsMap = new HashMap<>();
		_numbersMap = new HashMap<>();
		for (VehicleType vehicle : vehicles)
		{
			// 0 is reserved to mean "no legacy id".
			if (0 == vehicle.number())
			{
				throw new TabListReader.TabListException("Vehicle number 0 is reserved: " + vehicle.id());
			}
			_idsMap.put(vehicle.id(), vehicle);
			if (null != _guidsMap.put(vehicle.guid(), vehicle))
			{
				throw new TabListReader.TabListException("Duplicate vehicle GUID: " + vehicle.guid());
			}
			if (null != _numbersMap.put(vehicle.number(), vehicle))
			{
				throw new TabListReader.TabListException("Duplicate vehicle number: " + Short.toUnsignedInt(vehicle.number()));
			}
		}
	}

	public VehicleType getVehicleById(String id)
	{
		return _idsMap.get(id);
	}

	public VehicleType getVehicleByGuid(UUID guid)
	{
		return _guidsMap.get(guid);
	}

	public VehicleType getVehicleByNumber(short number)
	{
		return _numbersMap.get(number);
	}

	public List<VehicleType> allVehicles()
	{
		return _vehicles;
	}
}
