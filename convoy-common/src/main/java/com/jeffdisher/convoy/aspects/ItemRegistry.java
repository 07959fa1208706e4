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
import com.jeffdisher.convoy.types.StateBlob;


/**
 * The items known to the catalog.  Vehicles refer to these for their turret mounts.
 */
public class ItemRegistry
{
	private static final String SUB_NUMBER = "number";
	private static final String SUB_GUID = "guid";
	private static final String SUB_OPT_DEFAULT_STATE = "default_state";

	/**
	 * Loads the registry from the tablist in the given stream.
	 * The format is:
	 * ID<TAB>NAME
	 * <TAB>number<TAB>LEGACY_NUMBER
	 * <TAB>guid<TAB>GUID
	 * <TAB>default_state<TAB>HEX (optional - empty state if missing)
	 * 
	 * @param stream The stream containing the tablist.
	 * @return The registry (never null).
	 * @throws IOException There was a problem with the stream.
	 * @throws TabListReader.TabListException The tablist was malformed.
	 */
	public static ItemRegistry loadRegistry(InputStream stream) throws IOException, TabListReader.TabListException
	{
		if (null == stream)
		{
			throw new IOException("Resource missing");
		}
		SimpleTabListCallbacks<String, String> callbacks = new SimpleTabListCallbacks<>((String value) -> value, (String value) -> value);
		SimpleTabListCallbacks.SubRecordCapture<String, Short> numbers = callbacks.captureSubRecord(SUB_NUMBER, SimpleTabListCallbacks.single(new IValueTransformer.UnsignedShortTransformer(SUB_NUMBER)), true);
		SimpleTabListCallbacks.SubRecordCapture<String, UUID> guids = callbacks.captureSubRecord(SUB_GUID, SimpleTabListCallbacks.single(new IValueTransformer.UuidTransformer()), true);
		SimpleTabListCallbacks.SubRecordCapture<String, StateBlob> states = callbacks.captureSubRecord(SUB_OPT_DEFAULT_STATE, SimpleTabListCallbacks.single(new IValueTransformer.StateBlobTransformer()), false);
		TabListReader.readEntireFile(callbacks, stream);
		
		List<Item> items = new ArrayList<>();
		for (String id : callbacks.keyOrder)
		{
			StateBlob defaultState = states.recordData.getOrDefault(id, StateBlob.EMPTY);
			items.add(new Item(id, callbacks.topLevel.get(id), numbers.recordData.get(id), guids.recordData.get(id), defaultState));
		}
		return new ItemRegistry(items);
	}


	private final List<Item> _items;
	private final Map<String, Item> _idsMap;
	private final Map<UUID, Item> _guidsMap;
	private final Map<Short, Item> _numbersMap;

	private ItemRegistry(List<Item> items) throws TabListReader.TabListException
	{
		_items = Collections.unmodifiableList(items);
		_idsMap = new HashMap<>();
		_guidsMap = new HashMap<>();
		_numbersMap = new HashMap<>();
		for (Item item : items)
		{
			_idsMap.put(item.id(), item);
			if (null != _guidsMap.put(item.guid(), item))
			{
				throw new TabListReader.TabListException("Duplicate item GUID: " + item.guid());
			}
			if (null != _numbersMap.put(item.number(), item))
			{
				throw new TabListReader.TabListException("Duplicate item number: " + Short.toUnsignedInt(item.number()));
			}
		}
	}

	/**
	 * Looks up an item object by its named ID.
	 * 
	 * @param id The ID of an Item.
	 * @return The item or null if not known.
	 */
	public Item getItemById(String id)
	{
		return _idsMap.get(id);
	}

	public Item getItemByGuid(UUID guid)
	{
		return _guidsMap.get(guid);
	}

	public Item getItemByNumber(short number)
	{
		return _numbersMap.get(number);
	}

	/**
	 * @return All items, in the order they were declared.
	 */
	public List<Item> allItems()
	{
		return _items;
	}
}
