package com.jeffdisher.convoy.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import com.jeffdisher.convoy.utils.Assert;


/**
 * A utility class for reading the "tab list" data files used to describe the asset catalog and the engine config.
 * This data format is designed to capture the bare minimum, while being human-editable and trivial to parse:
 * -each line is treated as a record where each field is delimited by tabs (since tabs don't appear in the middle of
 * textual statements, meaning no "quote" state machine is required)
 * -a line starting with a tab is a sub-record of the most recent record
 * -empty lines and lines starting with '#' are ignored
 */
public class TabListReader
{
	/**
	 * Parses a full tab list data file from the given stream, sending all parse events to the given callbacks object.
	 * Closes the stream on completion.
	 * 
	 * @param callbacks Will receive the parser events as the parse runs.
	 * @param stream The stream containing the data (will be closed when done).
	 * @throws IOException There was a problem reading the stream.
	 * @throws TabListException The data wasn't well-formed.
	 */
	public static void readEntireFile(IParseCallbacks callbacks, InputStream stream) throws IOException, TabListException
	{
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8)))
		{
			TabListReader parser = new TabListReader(callbacks);
			String line = reader.readLine();
			while (null != line)
			{
				parser.handleLine(line);
				line = reader.readLine();
			}
			parser.finish();
		}
	}


	private final IParseCallbacks _callbacks;
	private boolean _isInRecord;
	private int _lineNumber;

	private TabListReader(IParseCallbacks callbacks)
	{
		_callbacks = callbacks;
	}

	public void handleLine(String line) throws TabListException
	{
		_lineNumber += 1;
		// Skip empty lines or lines which start with '#' (comments).
		if ((line.length() > 0) && ('#' != line.charAt(0)))
		{
			String[] parts = line.split("\t");
			// A line of only tabs splits into nothing.
			if (0 == parts.length)
			{
				throw new TabListException("Line " + _lineNumber + ": Empty sub-record");
			}
			
			// If this starts with a tab, it is a sub-record.
			boolean isSubRecord = (0 == parts[0].length());
			int startIndex = isSubRecord ? 1 : 0;
			if (startIndex >= parts.length)
			{
				throw new TabListException("Line " + _lineNumber + ": Empty sub-record");
			}
			
			// Note that the identifier is not allowed to begin/end in whitespace (just for sanity reasons).
			String identifier = parts[startIndex];
			if (identifier.trim().length() < identifier.length())
			{
				throw new TabListException("Line " + _lineNumber + ": Identifier edges cannot be whitespace");
			}
			String[] parameters = Arrays.copyOfRange(parts, startIndex + 1, parts.length);
			
			if (isSubRecord)
			{
				if (!_isInRecord)
				{
					throw new TabListException("Line " + _lineNumber + ": Sub-record missing outer record");
				}
				_callbacks.processSubRecord(identifier, parameters);
			}
			else
			{
				if (_isInRecord)
				{
					_callbacks.endRecord();
				}
				_callbacks.startNewRecord(identifier, parameters);
				_isInRecord = true;
			}
		}
	}

	public void finish() throws TabListException
	{
		if (_isInRecord)
		{
			_callbacks.endRecord();
			_isInRecord = false;
		}
		Assert.assertTrue(!_isInRecord);
	}


	/**
	 * The interface which receives callbacks from the parse operation.
	 */
	public interface IParseCallbacks
	{
		/**
		 * Called when a new record is encountered.
		 * 
		 * @param name The name of the record.
		 * @param parameters The parameters which followed the name on the same line (can be empty).
		 * @throws TabListException This callback was unexpected at this time or data was invalid.
		 */
		void startNewRecord(String name, String[] parameters) throws TabListException;
		/**
		 * Called when a record ends (either a new record starts or the file ends).
		 * 
		 * @throws TabListException The record was incomplete.
		 */
		void endRecord() throws TabListException;
		/**
		 * Called when a sub-record is encountered within an existing record.
		 * 
		 * @param name The name of the sub-record.
		 * @param parameters The parameters which followed the name on the same line (can be empty).
		 * @throws TabListException This callback was unexpected at this time or data was invalid.
		 */
		void processSubRecord(String name, String[] parameters) throws TabListException;
	}

	/**
	 * Used for logical errors within the tablist file.
	 */
	public static class TabListException extends Exception
	{
		private static final long serialVersionUID = 1L;
		public TabListException(String string)
		{
			super(string);
		}
	}
}
