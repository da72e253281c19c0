package org.janelia.coalignment;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

public class TrajectoryStoreTest
{
	@Rule
	public TemporaryFolder tempFolder = new TemporaryFolder();

	private TrajectoryStore store;
	private AlignmentTrajectory trajectory;

	@Before
	public void setUp() throws Exception
	{
		store = new TrajectoryStore( tempFolder.getRoot().toPath() );
		trajectory = new AlignmentTrajectory(
				512, 256,
				new double[] { 0, 0.01, 0.02 },
				new double[] { 0, 2.5, 5 },
				new double[] { 0, 1.25, -0.5 },
				new double[] { 0, 0.75, 3 } );
	}

	@Test
	public void testDefaultBaseName()
	{
		Assert.assertEquals( "2014-06-03", TrajectoryStore.getDefaultBaseName( new FrameInfo( "a.tif", "2014-06-03T17:20:54.500" ) ) );
		Assert.assertEquals( "2014-06", TrajectoryStore.getDefaultBaseName( new FrameInfo( "a.tif", "2014-06" ) ) );
	}

	@Test
	public void testLevel0() throws Exception
	{
		final Path output = store.save( "series", trajectory, false );
		Assert.assertEquals( tempFolder.getRoot().toPath().resolve( "series_align_lev0.json" ), output );

		final JsonObject record = readJson( output );
		Assert.assertEquals( 512, record.get( "xc" ).getAsDouble(), 0 );
		Assert.assertEquals( 256, record.get( "yc" ).getAsDouble(), 0 );
		Assert.assertEquals( 3, record.getAsJsonArray( "dx" ).size() );
		Assert.assertFalse( record.has( "sdo_angle" ) );

		final AlignmentTrajectory loaded = store.load( output );
		Assert.assertEquals( trajectory.getCenterX(), loaded.getCenterX(), 0 );
		Assert.assertEquals( trajectory.getCenterY(), loaded.getCenterY(), 0 );
		Assert.assertArrayEquals( trajectory.getAngle(), loaded.getAngle(), 0 );
		Assert.assertArrayEquals( trajectory.getDt(), loaded.getDt(), 0 );
		Assert.assertArrayEquals( trajectory.getDx(), loaded.getDx(), 0 );
		Assert.assertArrayEquals( trajectory.getDy(), loaded.getDy(), 0 );
	}

	@Test
	public void testLevel1MergesAndRemovesMatchFile() throws Exception
	{
		final Path matchFile = store.getMatchWcsPath( "series" );
		TrajectoryJSONProvider.saveWcsMatch( new WcsMatch( 0.3, -120.5, 88.25 ), Files.newBufferedWriter( matchFile, StandardCharsets.UTF_8 ) );

		final Path output = store.save( "series", trajectory, true );
		Assert.assertEquals( store.getLevel1Path( "series" ), output );
		Assert.assertFalse( Files.exists( matchFile ) );
		Assert.assertFalse( Files.exists( store.getLevel0Path( "series" ) ) );

		final JsonObject record = readJson( output );
		Assert.assertEquals( 0.3, record.get( "sdo_angle" ).getAsDouble(), 0 );
		Assert.assertEquals( -120.5, record.get( "wcsx" ).getAsDouble(), 0 );
		Assert.assertEquals( 88.25, record.get( "wcsy" ).getAsDouble(), 0 );

		// the level 1 record is still a valid trajectory and carries the match fields
		Assert.assertArrayEquals( trajectory.getDx(), store.load( output ).getDx(), 0 );
		final WcsMatch match = TrajectoryJSONProvider.loadWcsMatch( Files.newBufferedReader( output, StandardCharsets.UTF_8 ) );
		Assert.assertEquals( 0.3, match.getMatchAngle(), 0 );
	}

	@Test
	public void testLevel1WithoutMatchFile() throws Exception
	{
		try
		{
			store.save( "series", trajectory, true );
			Assert.fail( "missing match file was not reported" );
		}
		catch ( final NoSuchFileException e )
		{
			Assert.assertFalse( Files.exists( store.getLevel1Path( "series" ) ) );
		}
	}

	@Test
	public void testCreatesOutputDirectory() throws Exception
	{
		final TrajectoryStore nestedStore = new TrajectoryStore( tempFolder.getRoot().toPath().resolve( "a" ).resolve( "b" ) );
		Assert.assertTrue( Files.exists( nestedStore.saveLevel0( "series", trajectory ) ) );
	}

	@Test( expected = IOException.class )
	public void testIncompleteMatchRecord() throws Exception
	{
		TrajectoryJSONProvider.loadWcsMatch( new StringReader( "{ \"match_angle\": 0.1, \"wcsx\": 3 }" ) );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInconsistentTrajectory()
	{
		new AlignmentTrajectory( 0, 0, new double[ 2 ], new double[ 2 ], new double[ 3 ], new double[ 2 ] );
	}

	private static JsonObject readJson( final Path path ) throws Exception
	{
		return JsonParser.parseString( new String( Files.readAllBytes( path ), StandardCharsets.UTF_8 ) ).getAsJsonObject();
	}
}
