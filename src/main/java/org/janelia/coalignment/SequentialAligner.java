package org.janelia.coalignment;

import java.io.IOException;
import java.util.List;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Builds the cumulative displacement trajectory of a rotating time series.
 *
 * Every frame is aligned against the previous one rather than against the first frame,
 * because the observed structures change over time. For each pair of consecutive frames (i, i+1)
 * the passes of {@link AlignmentPass} are run in order and their estimates are summed into the step shift,
 * which is then added to the cumulative offset of frame i to give the cumulative offset of frame i+1.
 *
 * Per-step estimation errors accumulate along the series. This drift is a property of sequential chaining
 * and is not detected or bounded here.
 *
 * The run is fail-fast: an error at any step aborts the whole trajectory.
 * Cancellation is honored only between steps, through thread interruption.
 */
public class SequentialAligner
{
	private final OffsetEstimator estimator;
	private final RotationTransform rotationTransform;
	private final AlignmentGeometry geometry;
	private final double fill;
	private final boolean verbose;

	public SequentialAligner(
			final OffsetEstimator estimator,
			final RotationTransform rotationTransform,
			final AlignmentGeometry geometry )
	{
		this( estimator, rotationTransform, geometry, 0, false );
	}

	/**
	 * @param estimator
	 * @param rotationTransform
	 * @param geometry crop grids and rotation center, the frames are expected to have the size of the crop
	 * @param fill value for pixels rotated in from outside of the frame
	 * @param verbose print progress for every step
	 */
	public SequentialAligner(
			final OffsetEstimator estimator,
			final RotationTransform rotationTransform,
			final AlignmentGeometry geometry,
			final double fill,
			final boolean verbose )
	{
		this.estimator = estimator;
		this.rotationTransform = rotationTransform;
		this.geometry = geometry;
		this.fill = fill;
		this.verbose = verbose;
	}

	public < T extends RealType< T > > AlignmentTrajectory buildTrajectory(
			final List< ? extends RandomAccessibleInterval< T > > frames,
			final double[] angles,
			final double[] dt ) throws AlignmentExecutionException, InterruptedException
	{
		final FrameSupplier< T > frameSupplier = frames::get;
		return buildTrajectory( frameSupplier, frames.size(), angles, dt );
	}

	/**
	 * @param frames supplies the raster frames in acquisition order
	 * @param numFrames number of frames, at least one
	 * @param angles rotation angle of every frame in radians
	 * @param dt time offset of every frame from the first frame
	 * @return trajectory with {@code dx[0] = dy[0] = 0}
	 * @throws AlignmentExecutionException if a frame cannot be loaded or a correlation peak is degenerate
	 * @throws InterruptedException if the current thread was interrupted between two steps
	 */
	public < T extends RealType< T > > AlignmentTrajectory buildTrajectory(
			final FrameSupplier< T > frames,
			final int numFrames,
			final double[] angles,
			final double[] dt ) throws AlignmentExecutionException, InterruptedException
	{
		if ( numFrames <= 0 )
			throw new IllegalArgumentException( "Expected at least one frame, got " + numFrames );
		if ( angles.length != numFrames || dt.length != numFrames )
			throw new IllegalArgumentException( String.format(
					"Expected %d rotation angles and time offsets, got %d and %d", numFrames, angles.length, dt.length ) );

		final double[] dx = new double[ numFrames ];
		final double[] dy = new double[ numFrames ];

		RandomAccessibleInterval< T > reference = loadFrame( frames, 0 );
		for ( int i = 0; i < numFrames - 1; ++i )
		{
			if ( Thread.interrupted() )
				throw new InterruptedException( "Alignment cancelled before step " + i + " of " + ( numFrames - 1 ) );

			final RandomAccessibleInterval< T > moving = loadFrame( frames, i + 1 );
			final Offset step = alignStep( reference, moving, angles[ i ], angles[ i + 1 ], new Offset( dx[ i ], dy[ i ] ), i );

			dx[ i + 1 ] = dx[ i ] + step.getX();
			dy[ i + 1 ] = dy[ i ] + step.getY();
			reference = moving;

			if ( verbose )
				System.out.println( String.format( "Aligned frame %d/%d: step=%s, cumulative=(%.3f, %.3f)", i + 1, numFrames - 1, step, dx[ i + 1 ], dy[ i + 1 ] ) );
		}

		return new AlignmentTrajectory( geometry.getCenterX(), geometry.getCenterY(), angles, dt, dx, dy );
	}

	private < T extends RealType< T > > Offset alignStep(
			final RandomAccessibleInterval< T > reference,
			final RandomAccessibleInterval< T > moving,
			final double referenceAngle,
			final double movingAngle,
			final Offset cumulative,
			final int stepIndex ) throws AlignmentExecutionException
	{
		Offset step = Offset.ZERO;
		for ( final AlignmentPass pass : AlignmentPass.values() )
		{
			final RandomAccessibleInterval< DoubleType > rotatedReference = rotate( reference, referenceAngle, pass.referenceShift( cumulative ) );
			final RandomAccessibleInterval< DoubleType > rotatedMoving = rotate( moving, movingAngle, pass.movingShift( cumulative, step ) );
			try
			{
				step = step.add( estimator.estimateOffset( rotatedMoving, rotatedReference ) );
			}
			catch ( final DegeneratePeakException e )
			{
				throw new AlignmentExecutionException( "Cannot align frame " + ( stepIndex + 1 ) + " to frame " + stepIndex + " in " + pass, e );
			}
		}
		return step;
	}

	private < T extends RealType< T > > RandomAccessibleInterval< DoubleType > rotate(
			final RandomAccessibleInterval< T > frame,
			final double angle,
			final Offset shift )
	{
		return rotationTransform.rotate(
				frame,
				angle,
				geometry.getGridX(),
				geometry.getGridY(),
				geometry.getCenterX(),
				geometry.getCenterY(),
				shift.getX(),
				shift.getY(),
				fill );
	}

	private static < T extends RealType< T > > RandomAccessibleInterval< T > loadFrame( final FrameSupplier< T > frames, final int index ) throws AlignmentExecutionException
	{
		try
		{
			return frames.getFrame( index );
		}
		catch ( final IOException e )
		{
			throw new AlignmentExecutionException( "Cannot load frame " + index, e );
		}
	}
}
