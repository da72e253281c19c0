package org.janelia.coalignment;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import net.imglib2.type.numeric.real.FloatType;

/**
 * Driver class that aligns a time series of raw frames and saves the resulting trajectory.
 *
 * The first frame is the reference. Raster images are extracted from the central crop of the raw cubes
 * at a fixed wavelength, their rotation angles follow from the acquisition dates, and the cumulative
 * displacements are estimated by a {@link SequentialAligner}.
 */
public class FrameAlignment
{
	public static void main( final String[] args )
	{
		final FrameAlignmentArguments parsedArgs = new FrameAlignmentArguments( args );
		if ( !parsedArgs.parsedSuccessfully() )
			System.exit( 1 );

		try
		{
			new FrameAlignment( parsedArgs, new ImagePlusFrameSource(), new BilinearRotationTransform() ).run();
		}
		catch ( final Exception e )
		{
			System.out.println( "Aborted: " + e.getMessage() );
			e.printStackTrace();
			System.exit( 2 );
		}
	}

	private final FrameAlignmentArguments args;
	private final FrameSource frameSource;
	private final RotationTransform rotationTransform;

	public FrameAlignment( final FrameAlignmentArguments args, final FrameSource frameSource, final RotationTransform rotationTransform )
	{
		this.args = args;
		this.frameSource = frameSource;
		this.rotationTransform = rotationTransform;
	}

	/**
	 * Runs the alignment and saves the result.
	 *
	 * @return the estimated trajectory
	 */
	public AlignmentTrajectory run() throws AlignmentExecutionException, InterruptedException
	{
		final FrameInfo[] frames;
		final long[] cubeDimensions;
		try
		{
			frames = FrameInfoJSONProvider.loadFrames( Files.newBufferedReader( Paths.get( args.inputFrameList() ), StandardCharsets.UTF_8 ) );
			cubeDimensions = frameSource.getCubeDimensions( frames[ 0 ] );
		}
		catch ( final IOException e )
		{
			throw new AlignmentExecutionException( "Cannot read the frames listed in " + args.inputFrameList(), e );
		}
		System.out.println( "Loaded " + frames.length + " frames, raw cube size " + Arrays.toString( cubeDimensions ) );

		if ( args.wavelengthIndex() >= cubeDimensions[ 2 ] )
			throw new AlignmentExecutionException( "Wavelength index " + args.wavelengthIndex() + " is out of bounds [0-" + ( cubeDimensions[ 2 ] - 1 ) + "]" );

		final AlignmentGeometry geometry = new AlignmentGeometry( cubeDimensions[ 0 ], cubeDimensions[ 1 ] );

		final List< String > dates = new ArrayList<>();
		for ( final FrameInfo frame : frames )
			dates.add( frame.getDate() );
		final double[] dt = RotationSchedule.getElapsedMinutes( dates );
		final double[] angles = new RotationSchedule( args.rotationRate() ).getAngles( dt );

		final SequentialAligner aligner = new SequentialAligner(
				new OffsetEstimator(),
				rotationTransform,
				geometry,
				args.fill(),
				args.verbose() );

		final FrameSupplier< FloatType > rasters = i -> frameSource.loadRaster( frames[ i ], args.wavelengthIndex(), geometry.getCropInterval() );
		final AlignmentTrajectory trajectory = aligner.buildTrajectory( rasters, frames.length, angles, dt );
		System.out.println( String.format( "Aligned %d frames, final displacement (%.3f, %.3f)",
				frames.length, trajectory.getDx( frames.length - 1 ), trajectory.getDy( frames.length - 1 ) ) );

		final String baseName = args.baseName() != null ? args.baseName() : TrajectoryStore.getDefaultBaseName( frames[ 0 ] );
		final TrajectoryStore store = new TrajectoryStore( Paths.get( args.outputDirectory() ) );
		try
		{
			final Path output = store.save( baseName, trajectory, args.matchWcs() );
			System.out.println( "The saved file name is " + output );
		}
		catch ( final IOException e )
		{
			throw new AlignmentExecutionException( "Cannot save the alignment to " + args.outputDirectory(), e );
		}

		return trajectory;
	}
}
