package org.janelia.coalignment;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

/**
 * Provides convenience methods for loading and storing alignment results in JSON format.
 *
 * Supports two kinds of records:
 * 1. Level 0: an {@link AlignmentTrajectory} (center, angles, time offsets, displacements).
 * 2. Level 1: the same fields extended with a {@link WcsMatch} as 'sdo_angle', 'wcsx', 'wcsy'.
 */
public class TrajectoryJSONProvider
{
	public static AlignmentTrajectory loadTrajectory( final Reader reader ) throws IOException
	{
		try ( final Reader closeableReader = reader )
		{
			return createGson().fromJson( closeableReader, AlignmentTrajectory.class );
		}
	}

	public static void saveTrajectory( final AlignmentTrajectory trajectory, final Writer writer ) throws IOException
	{
		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( createGson().toJson( trajectory ) );
		}
	}

	public static void saveTrajectory( final AlignmentTrajectory trajectory, final WcsMatch wcsMatch, final Writer writer ) throws IOException
	{
		final Gson gson = createGson();
		final JsonObject record = gson.toJsonTree( trajectory ).getAsJsonObject();
		record.addProperty( "sdo_angle", wcsMatch.getMatchAngle() );
		record.addProperty( "wcsx", wcsMatch.getWcsX() );
		record.addProperty( "wcsy", wcsMatch.getWcsY() );

		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( gson.toJson( record ) );
		}
	}

	/**
	 * Reads a match result, or the match fields of a level 1 record.
	 */
	public static WcsMatch loadWcsMatch( final Reader reader ) throws IOException
	{
		try ( final Reader closeableReader = reader )
		{
			final JsonObject record = createGson().fromJson( closeableReader, JsonObject.class );
			if ( record == null || !( record.has( "match_angle" ) || record.has( "sdo_angle" ) ) || !record.has( "wcsx" ) || !record.has( "wcsy" ) )
				throw new IOException( "record does not contain WCS match fields" );
			return createGson().fromJson( record, WcsMatch.class );
		}
	}

	public static void saveWcsMatch( final WcsMatch wcsMatch, final Writer writer ) throws IOException
	{
		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( createGson().toJson( wcsMatch ) );
		}
	}

	private static Gson createGson()
	{
		return new GsonBuilder()
				.serializeSpecialFloatingPointValues()
				.setPrettyPrinting()
				.create();
	}
}
