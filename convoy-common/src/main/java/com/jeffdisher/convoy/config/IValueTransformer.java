package com.jeffdisher.convoy.config;

import java.util.UUID;

import com.jeffdisher.convoy.aspects.ItemRegistry;
import com.jeffdisher.convoy.config.TabListReader.TabListException;
import com.jeffdisher.convoy.types.Item;
import com.jeffdisher.convoy.types.StateBlob;
import com.jeffdisher.convoy.utils.HexEncoding;


/**
 * Used to transform a string value into a specific type.
 * 
 * @param <T> The output type.
 */
public interface IValueTransformer<T>
{
	T transform(String value) throws TabListReader.TabListException;

	/**
	 * Decodes the given data as an unsigned 16-bit value (catalog numbers and resource maximums), narrowed into a
	 * Short.  Values above Short.MAX_VALUE come back negative so readers must use Short.toUnsignedInt().
	 */
	public static class UnsignedShortTransformer implements IValueTransformer<Short>
	{
		public static final int MAX_VALUE = 0xFFFF;

		private final String _name;
		public UnsignedShortTransformer(String numberName)
		{
			_name = numberName;
		}
		@Override
		public Short transform(String value) throws TabListException
		{
			int parsed;
			try
			{
				parsed = Integer.parseInt(value);
			}
			catch (NumberFormatException e)
			{
				throw new TabListReader.TabListException("Not a valid " + _name + ": \"" + value + "\"");
			}
			if ((parsed < 0) || (parsed > MAX_VALUE))
			{
				throw new TabListReader.TabListException("Values for " + _name + " must be in 0.." + MAX_VALUE + ": \"" + value + "\"");
			}
			return (short)parsed;
		}
	}

	/**
	 * Decodes the given data as a non-negative Integer.
	 */
	public static class CountTransformer implements IValueTransformer<Integer>
	{
		private final String _name;
		public CountTransformer(String numberName)
		{
			_name = numberName;
		}
		@Override
		public Integer transform(String value) throws TabListException
		{
			try
			{
				int parsed = Integer.parseInt(value);
				if (parsed < 0)
				{
					throw new TabListReader.TabListException("Values for " + _name + " must not be negative");
				}
				return parsed;
			}
			catch (NumberFormatException e)
			{
				throw new TabListReader.TabListException("Not a valid " + _name + ": \"" + value + "\"");
			}
		}
	}

	/**
	 * Decodes the given data as a UUID (the stable catalog GUIDs).
	 */
	public static class UuidTransformer implements IValueTransformer<UUID>
	{
		@Override
		public UUID transform(String value) throws TabListException
		{
			try
			{
				return UUID.fromString(value);
			}
			catch (IllegalArgumentException e)
			{
				throw new TabListReader.TabListException("Not a valid GUID: \"" + value + "\"");
			}
		}
	}

	/**
	 * Decodes hex digit pairs as an opaque state blob.
	 */
	public static class StateBlobTransformer implements IValueTransformer<StateBlob>
	{
		@Override
		public StateBlob transform(String value) throws TabListException
		{
			try
			{
				return StateBlob.wrap(HexEncoding.decode(value));
			}
			catch (IllegalArgumentException e)
			{
				throw new TabListReader.TabListException(e.getMessage());
			}
		}
	}

	/**
	 * Decodes the given data as an Item.
	 */
	public static class ItemTransformer implements IValueTransformer<Item>
	{
		private final ItemRegistry _items;
		public ItemTransformer(ItemRegistry items)
		{
			_items = items;
		}
		@Override
		public Item transform(String value) throws TabListException
		{
			Item item = _items.getItemById(value);
			if (null == item)
			{
				throw new TabListReader.TabListException("Unknown item: \"" + value + "\"");
			}
			return item;
		}
	}
}
