package com.jeffdisher.convoy.server;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.convoy.config.TabListReader.TabListException;


public class TestSnapshotConfig
{
	@Test
	public void defaults() throws Throwable
	{
		SnapshotConfig config = new SnapshotConfig();
		Assert.assertTrue(config.captureAttachedChildren);
		Assert.assertTrue(config.restoreAttachedChildren);
		Assert.assertTrue(config.rollbackPartialRestore);
	}

	@Test
	public void loadPartial() throws Throwable
	{
		SnapshotConfig config = SnapshotConfig.load(_stream("# Leave children where they are.\nrestore_attached_children\tfalse\nrollback_partial_restore\tfalse\n"));
		Assert.assertTrue(config.captureAttachedChildren);
		Assert.assertFalse(config.restoreAttachedChildren);
		Assert.assertFalse(config.rollbackPartialRestore);
	}

	@Test
	public void rawOptionsReload() throws Throwable
	{
		SnapshotConfig config = new SnapshotConfig();
		config.captureAttachedChildren = false;
		Map<String, String> raw = config.getRawOptions();
		Assert.assertEquals("false", raw.get(SnapshotConfig.KEY_CAPTURE_ATTACHED_CHILDREN));
		Assert.assertEquals("true", raw.get(SnapshotConfig.KEY_ROLLBACK_PARTIAL_RESTORE));
		
		SnapshotConfig copy = new SnapshotConfig();
		copy.loadOverrides(raw);
		Assert.assertFalse(copy.captureAttachedChildren);
		Assert.assertTrue(copy.restoreAttachedChildren);
	}

	@Test
	public void unknownKeysIgnored() throws Throwable
	{
		SnapshotConfig config = SnapshotConfig.load(_stream("some_future_option\t12\n"));
		Assert.assertTrue(config.captureAttachedChildren);
	}

	@Test(expected=TabListException.class)
	public void strictBooleans() throws Throwable
	{
		SnapshotConfig.load(_stream("capture_attached_children\tyes\n"));
	}

	@Test(expected=TabListException.class)
	public void duplicateKey() throws Throwable
	{
		SnapshotConfig.load(_stream("capture_attached_children\ttrue\ncapture_attached_children\tfalse\n"));
	}

	@Test(expected=TabListException.class)
	public void nestedValuesRejected() throws Throwable
	{
		SnapshotConfig.load(_stream("capture_attached_children\ttrue\n\tdepth\t2\n"));
	}

	@Test(expected=TabListException.class)
	public void missingValue() throws Throwable
	{
		SnapshotConfig.load(_stream("capture_attached_children\n"));
	}

	@Test(expected=IOException.class)
	public void missingResource() throws Throwable
	{
		SnapshotConfig.load(null);
	}


	private static ByteArrayInputStream _stream(String contents)
	{
		return new ByteArrayInputStream(contents.getBytes(StandardCharsets.UTF_8));
	}
}
