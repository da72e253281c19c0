package org.janelia.coalignment;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Loads and stores lists of {@link FrameInfo} objects in JSON format.
 * Frames without an explicit index get their position in the list.
 * Acquisition dates must be ISO-8601 local date-times such as {@code 2014-06-03T17:20:54}.
 */
public class FrameInfoJSONProvider
{
	public static FrameInfo[] loadFrames( final Reader reader ) throws IOException
	{
		final FrameInfo[] frames;
		try ( final Reader closeableReader = reader )
		{
			frames = createGson().fromJson( closeableReader, FrameInfo[].class );
		}

		if ( frames == null || frames.length == 0 )
			throw new IOException( "frame list is empty" );

		for ( int i = 0; i < frames.length; ++i )
		{
			if ( frames[ i ].getFilePath() == null || frames[ i ].getDate() == null )
				throw new IOException( "frame " + i + " should define both 'file' and 'date'" );

			try
			{
				LocalDateTime.parse( frames[ i ].getDate() );
			}
			catch ( final DateTimeParseException e )
			{
				throw new IOException( "frame " + i + " has an invalid date '" + frames[ i ].getDate() + "', expected yyyy-MM-ddTHH:mm:ss", e );
			}

			if ( frames[ i ].getIndex() == null )
				frames[ i ].setIndex( i );
		}
		return frames;
	}

	public static void saveFrames( final FrameInfo[] frames, final Writer writer ) throws IOException
	{
		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( createGson().toJson( frames ) );
		}
	}

	private static Gson createGson()
	{
		return new GsonBuilder().setPrettyPrinting().create();
	}
}
