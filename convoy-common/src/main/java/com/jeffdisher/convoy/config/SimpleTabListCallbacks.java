package com.jeffdisher.convoy.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.jeffdisher.convoy.utils.Assert;


/**
 * An implementation of the callbacks interface to handle a key-value list where each record has some required or
 * optional sub-records (the catalog registries) or none at all (the engine config).  Top-level records have precisely 1 parameter (the human-readable name)
 * while sub-records are decoded by an IParametersTransformer so that they can have any number of parameters.
 *
 * @param <K> The key type.
 * @param <V> The top-level record value type.
 */
public class SimpleTabListCallbacks<K, V> implements TabListReader.IParseCallbacks
{
	/**
	 * Adapts a single-value transformer into one which requires exactly 1 sub-record parameter.
	 *
	 * @param <W> The output type.
	 * @param transformer The transformer to apply to the single parameter.
	 * @return A parameters transformer.
	 */
	public static <W> IParametersTransformer<W> single(IValueTransformer<W> transformer)
	{
		return (String[] parameters) -> {
			if (1 != parameters.length)
			{
				throw new TabListReader.TabListException("Exactly 1 sub-record parameter expected");
			}
			return transformer.transform(parameters[0]);
		};
	}

	// Overall internal state.
	private final IValueTransformer<K> _keyTransformer;
	private final IValueTransformer<V> _valueTransformer;
	private final Map<String, SubRecordCapture<K, ?>> _requiredSubRecords;
	private final Map<String, SubRecordCapture<K, ?>> _optionalSubRecords;

	// Ephemeral internal state.
	private K _currentRecordKey;
	private Set<String> _pendingSubRecords;
	private Set<String> _seenSubRecords;

	// Public data which can be directly read from the outside once the file is fully read.
	public final List<K> keyOrder;
	public final Map<K, V> topLevel;

	public SimpleTabListCallbacks(IValueTransformer<K> keyTransformer, IValueTransformer<V> valueTransformer)
	{
		_keyTransformer = keyTransformer;
		_valueTransformer = valueTransformer;
		_requiredSubRecords = new HashMap<>();
		_optionalSubRecords = new HashMap<>();
		this.keyOrder = new ArrayList<>();
		this.topLevel = new HashMap<>();
	}

	/**
	 * Install a handler for a sub-record of a given name.  Note that the returned capture object will contain the
	 * corresponding data after the processing is complete.
	 *
	 * @param <W> The type of values to process.
	 * @param name The sub-record name.
	 * @param transformer The transformer for this sub-record's parameter list.
	 * @param required True if this sub-record MUST exist in every record.
	 * @return An object which will capture the parsed values.
	 */
	public <W> SubRecordCapture<K, W> captureSubRecord(String name, IParametersTransformer<W> transformer, boolean required)
	{
		Assert.assertTrue(!_requiredSubRecords.containsKey(name));
		Assert.assertTrue(!_optionalSubRecords.containsKey(name));

		SubRecordCapture<K, W> capture = new SubRecordCapture<>(transformer);
		if (required)
		{
			_requiredSubRecords.put(name, capture);
		}
		else
		{
			_optionalSubRecords.put(name, capture);
		}
		return capture;
	}

	@Override
	public void startNewRecord(String name, String[] parameters) throws TabListReader.TabListException
	{
		K key = _keyTransformer.transform(name);
		if (1 != parameters.length)
		{
			throw new TabListReader.TabListException("Exactly 1 parameter expected for \"" + name + "\"");
		}
		V value = _valueTransformer.transform(parameters[0]);
		if (this.topLevel.containsKey(key))
		{
			throw new TabListReader.TabListException("Duplicate data element: \"" + name + "\"");
		}
		this.keyOrder.add(key);
		this.topLevel.put(key, value);

		_currentRecordKey = key;
		_pendingSubRecords = new HashSet<>(_requiredSubRecords.keySet());
		_seenSubRecords = new HashSet<>();
	}

	@Override
	public void endRecord() throws TabListReader.TabListException
	{
		if (!_pendingSubRecords.isEmpty())
		{
			String list = String.join(" ", _pendingSubRecords.stream().sorted().toList());
			throw new TabListReader.TabListException("Missing sub-records in " + _currentRecordKey + ": " + list);
		}
		_currentRecordKey = null;
	}

	@Override
	public void processSubRecord(String name, String[] parameters) throws TabListReader.TabListException
	{
		SubRecordCapture<K, ?> capture = _requiredSubRecords.get(name);
		if (null == capture)
		{
			capture = _optionalSubRecords.get(name);
		}
		if (null == capture)
		{
			throw new TabListReader.TabListException("Unexpected sub-record \"" + name + "\" in: " + _currentRecordKey);
		}
		if (!_seenSubRecords.add(name))
		{
			throw new TabListReader.TabListException("Duplicate sub-record \"" + name + "\" in: " + _currentRecordKey);
		}
		capture.transformAndStore(_currentRecordKey, name, parameters);
		_pendingSubRecords.remove(name);
	}


	/**
	 * Decodes the full parameter list of a sub-record.
	 *
	 * @param <W> The output type.
	 */
	public interface IParametersTransformer<W>
	{
		W transform(String[] parameters) throws TabListReader.TabListException;
	}

	/**
	 * The object which will capture the per-record data associated with a specific sub-record.  The recordData can be
	 * read directly once the file has been fully processed.
	 */
	public static class SubRecordCapture<K, W>
	{
		private final IParametersTransformer<W> _tranformer;
		public final Map<K, W> recordData;

		public SubRecordCapture(IParametersTransformer<W> transformer)
		{
			_tranformer = transformer;
			this.recordData = new HashMap<>();
		}

		public void transformAndStore(K currentRecordKey, String subRecord, String[] parameters) throws TabListReader.TabListException
		{
			W value;
			try
			{
				value = _tranformer.transform(parameters);
			}
			catch (TabListReader.TabListException e)
			{
				throw new TabListReader.TabListException(currentRecordKey + ": " + subRecord + ": " + e.getMessage());
			}
			this.recordData.put(currentRecordKey, value);
		}
	}
}
