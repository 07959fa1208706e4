package com.jeffdisher.convoy.aspects;

import java.io.IOException;
import java.io.InputStream;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jeffdisher.convoy.config.TabListReader.TabListException;
import com.jeffdisher.convoy.types.Item;
import com.jeffdisher.convoy.types.StateBlob;
import com.jeffdisher.convoy.types.VehicleType;
import com.jeffdisher.convoy.utils.Assert;


/**
 * This is the root anchoring point for all the static definitions the engine needs:  the items and the vehicles built
 * from them.  Unlike a shared global registry, a Catalog is an ordinary object which is created at start-up and passed
 * explicitly to whatever needs it.
 */
public class Catalog implements IDefinitionResolver
{
	public static final String ITEM_REGISTRY_RESOURCE = "item_registry.tablist";
	public static final String VEHICLE_REGISTRY_RESOURCE = "vehicle_registry.tablist";

	private static final Logger LOG = LoggerFactory.getLogger(Catalog.class);

	/**
	 * Loads the catalog from the default resources visible to the given loader.
	 * 
	 * @param loader The class loader to search.
	 * @return The catalog.
	 * @throws IOException A resource was missing or couldn't be read.
	 * @throws TabListException A resource was malformed.
	 */
	public static Catalog loadFromClasspath(ClassLoader loader) throws IOException, TabListException
	{
		return load(loader.getResourceAsStream(ITEM_REGISTRY_RESOURCE)
				, loader.getResourceAsStream(VEHICLE_REGISTRY_RESOURCE)
		);
	}

	/**
	 * Loads the catalog from the given tablist streams (both are closed).
	 * 
	 * @param itemStream The item registry tablist.
	 * @param vehicleStream The vehicle registry tablist.
	 * @return The catalog.
	 * @throws IOException A stream was missing or couldn't be read.
	 * @throws TabListException A stream was malformed.
	 */
	public static Catalog load(InputStream itemStream, InputStream vehicleStream) throws IOException, TabListException
	{
		ItemRegistry items = ItemRegistry.loadRegistry(itemStream);
		VehicleRegistry vehicles = VehicleRegistry.loadRegistry(items, vehicleStream);
		LOG.info("Loaded catalog with {} items and {} vehicles", items.allItems().size(), vehicles.allVehicles().size());
		return new Catalog(items, vehicles);
	}


	public final ItemRegistry items;
	public final VehicleRegistry vehicles;

	private Catalog(ItemRegistry items, VehicleRegistry vehicles)
	{
		this.items = items;
		this.vehicles = vehicles;
	}

	@Override
	public VehicleType resolveVehicle(UUID guid, short legacyId)
	{
		VehicleType type = (null != guid)
				? this.vehicles.getVehicleByGuid(guid)
				: null
		;
		if ((null == type) && (0 != legacyId))
		{
			type = this.vehicles.getVehicleByNumber(legacyId);
			if (null != type)
			{
				LOG.debug("Resolved vehicle {} by legacy id {} (GUID {} not found)", type.id(), Short.toUnsignedInt(legacyId), guid);
			}
		}
		return type;
	}

	@Override
	public StateBlob defaultStateFor(Item item)
	{
		// Only items from this catalog can be asked about.
		Assert.assertTrue(item == this.items.getItemById(item.id()));
		return item.defaultState();
	}
}
