package org.janelia.coalignment;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Stores alignment trajectories as JSON files in a directory.
 *
 * A level 0 record holds the trajectory only and is named {@code <base>_align_lev0.json}.
 * A level 1 record additionally holds the result of the WCS matching step, read from {@code <base>_match_wcs.json};
 * it is named {@code <base>_align_lev1.json}, and the match file is removed once it has been merged.
 */
public class TrajectoryStore
{
	public static final String LEVEL0_SUFFIX = "_align_lev0.json";
	public static final String LEVEL1_SUFFIX = "_align_lev1.json";
	public static final String MATCH_WCS_SUFFIX = "_match_wcs.json";

	private final Path directory;

	public TrajectoryStore( final Path directory )
	{
		this.directory = directory;
	}

	/**
	 * @return the date part (yyyy-MM-dd) of the acquisition date of the first frame
	 */
	public static String getDefaultBaseName( final FrameInfo firstFrame )
	{
		final String date = firstFrame.getDate();
		return date.length() > 10 ? date.substring( 0, 10 ) : date;
	}

	public Path getLevel0Path( final String baseName ) { return directory.resolve( baseName + LEVEL0_SUFFIX ); }
	public Path getLevel1Path( final String baseName ) { return directory.resolve( baseName + LEVEL1_SUFFIX ); }
	public Path getMatchWcsPath( final String baseName ) { return directory.resolve( baseName + MATCH_WCS_SUFFIX ); }

	/**
	 * Saves a level 1 record if {@code mergeWcsMatch} is set, otherwise a level 0 record.
	 *
	 * @return path of the written file
	 */
	public Path save( final String baseName, final AlignmentTrajectory trajectory, final boolean mergeWcsMatch ) throws IOException
	{
		return mergeWcsMatch ? saveLevel1( baseName, trajectory ) : saveLevel0( baseName, trajectory );
	}

	public Path saveLevel0( final String baseName, final AlignmentTrajectory trajectory ) throws IOException
	{
		Files.createDirectories( directory );
		final Path output = getLevel0Path( baseName );
		TrajectoryJSONProvider.saveTrajectory( trajectory, Files.newBufferedWriter( output, StandardCharsets.UTF_8 ) );
		System.out.println( "Saved alignment to " + output );
		return output;
	}

	/**
	 * Merges the WCS match result into the trajectory record and removes the match file.
	 *
	 * @throws java.nio.file.NoSuchFileException if there is no match file for the given base name
	 */
	public Path saveLevel1( final String baseName, final AlignmentTrajectory trajectory ) throws IOException
	{
		final Path matchFile = getMatchWcsPath( baseName );
		final WcsMatch wcsMatch = TrajectoryJSONProvider.loadWcsMatch( Files.newBufferedReader( matchFile, StandardCharsets.UTF_8 ) );

		Files.createDirectories( directory );
		final Path output = getLevel1Path( baseName );
		TrajectoryJSONProvider.saveTrajectory( trajectory, wcsMatch, Files.newBufferedWriter( output, StandardCharsets.UTF_8 ) );
		System.out.println( "Saved alignment to " + output );

		Files.delete( matchFile );
		System.out.println( "Removed " + matchFile );
		return output;
	}

	public AlignmentTrajectory load( final Path path ) throws IOException
	{
		return TrajectoryJSONProvider.loadTrajectory( Files.newBufferedReader( path, StandardCharsets.UTF_8 ) );
	}
}
