package com.jeffdisher.convoy.server;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

import com.jeffdisher.convoy.config.SimpleTabListCallbacks;
import com.jeffdisher.convoy.config.TabListReader;


/**
 * A container of the configuration options for the snapshot engine.  These are read from a flat tablist of
 * KEY<TAB>VALUE lines, where any key not present keeps its default.
 */
public class SnapshotConfig
{
	/**
	 * True if capture should also record the barricades and structures attached to the vehicle.
	 */
	public static final String KEY_CAPTURE_ATTACHED_CHILDREN = "capture_attached_children";
	public boolean captureAttachedChildren;

	/**
	 * True if restore should place the snapshot's barricades and structures on the new vehicle.
	 */
	public static final String KEY_RESTORE_ATTACHED_CHILDREN = "restore_attached_children";
	public boolean restoreAttachedChildren;

	/**
	 * True if a restore which fails after the vehicle was created should destroy that vehicle before reporting the
	 * failure.  If false, the partially configured vehicle is left in the world.
	 */
	public static final String KEY_ROLLBACK_PARTIAL_RESTORE = "rollback_partial_restore";
	public boolean rollbackPartialRestore;

	/**
	 * Loads a config from the given tablist stream (closed when done), starting from the defaults.
	 * 
	 * @param stream The stream.
	 * @return The config.
	 * @throws IOException There was a problem reading the stream.
	 * @throws TabListReader.TabListException The file was malformed or a value was invalid.
	 */
	public static SnapshotConfig load(InputStream stream) throws IOException, TabListReader.TabListException
	{
		if (null == stream)
		{
			throw new IOException("Resource missing");
		}
		// Options are records with exactly one parameter and no sub-records (none are registered so any is rejected).
		SimpleTabListCallbacks<String, String> callbacks = new SimpleTabListCallbacks<>((String value) -> value, (String value) -> value);
		TabListReader.readEntireFile(callbacks, stream);
		SnapshotConfig config = new SnapshotConfig();
		config.loadOverrides(callbacks.topLevel);
		return config;
	}

	/**
	 * Creates a config with all default options.
	 */
	public SnapshotConfig()
	{
		this.captureAttachedChildren = true;
		this.restoreAttachedChildren = true;
		this.rollbackPartialRestore = true;
	}

	public void loadOverrides(Map<String, String> overrides) throws TabListReader.TabListException
	{
		if (overrides.containsKey(KEY_CAPTURE_ATTACHED_CHILDREN))
		{
			this.captureAttachedChildren = _parseBoolean(KEY_CAPTURE_ATTACHED_CHILDREN, overrides.get(KEY_CAPTURE_ATTACHED_CHILDREN));
		}
		if (overrides.containsKey(KEY_RESTORE_ATTACHED_CHILDREN))
		{
			this.restoreAttachedChildren = _parseBoolean(KEY_RESTORE_ATTACHED_CHILDREN, overrides.get(KEY_RESTORE_ATTACHED_CHILDREN));
		}
		if (overrides.containsKey(KEY_ROLLBACK_PARTIAL_RESTORE))
		{
			this.rollbackPartialRestore = _parseBoolean(KEY_ROLLBACK_PARTIAL_RESTORE, overrides.get(KEY_ROLLBACK_PARTIAL_RESTORE));
		}
	}

	public Map<String, String> getRawOptions()
	{
		return Map.of(
				KEY_CAPTURE_ATTACHED_CHILDREN, Boolean.toString(this.captureAttachedChildren)
				, KEY_RESTORE_ATTACHED_CHILDREN, Boolean.toString(this.restoreAttachedChildren)
				, KEY_ROLLBACK_PARTIAL_RESTORE, Boolean.toString(this.rollbackPartialRestore)
		);
	}


	private static boolean _parseBoolean(String key, String value) throws TabListReader.TabListException
	{
		// Boolean.parseBoolean() treats everything other than "true" as false, which would hide typos.
		boolean result;
		if ("true".equals(value))
		{
			result = true;
		}
		else if ("false".equals(value))
		{
			result = false;
		}
		else
		{
			throw new TabListReader.TabListException("Not a valid boolean for " + key + ": \"" + value + "\"");
		}
		return result;
	}
}
