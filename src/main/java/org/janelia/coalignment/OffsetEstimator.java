package org.janelia.coalignment;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;

import org.janelia.util.concurrent.MultithreadedExecutor;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Estimates the translation of an image (or of every plane of a stack) relative to a template
 * by windowed FFT cross-correlation followed by parabolic sub-pixel refinement of the correlation peak.
 *
 * The inputs are never modified: both are copied into double precision working planes,
 * mean-subtracted (the template globally, the image plane by plane) and apodized with an {@link ApodizationWindow}.
 */
public class OffsetEstimator
{
	private final MultithreadedExecutor executor;

	/**
	 * Creates an estimator that processes stack planes sequentially.
	 */
	public OffsetEstimator()
	{
		this( null );
	}

	/**
	 * Creates an estimator that distributes stack planes over the given executor.
	 *
	 * @param executor may be null, in which case planes are processed sequentially
	 */
	public OffsetEstimator( final MultithreadedExecutor executor )
	{
		this.executor = executor;
	}

	/**
	 * Estimates the offset of a 2D image relative to the template.
	 *
	 * @param image 2D image
	 * @param template 2D reference image with the same width and height
	 * @return offset of the image content relative to the template
	 * @throws ImageDimensionalityException if either input is not 2D
	 * @throws ImageShapeMismatchException if the sizes differ
	 * @throws DegeneratePeakException if the correlation peak cannot be refined
	 */
	public < T extends RealType< T >, U extends RealType< U > > Offset estimateOffset(
			final RandomAccessibleInterval< T > image,
			final RandomAccessibleInterval< U > template )
	{
		if ( image.numDimensions() != 2 )
			throw new ImageDimensionalityException( "Expected 2D image, got " + image.numDimensions() + "D, use estimateOffsets() for stacks" );

		return estimateOffsets( image, template )[ 0 ];
	}

	/**
	 * Estimates the offsets of a 2D image or of every plane of a 3D stack (x, y, plane) relative to the template.
	 *
	 * @param image 2D image or 3D stack
	 * @param template 2D reference image with the same width and height
	 * @return one offset per plane, in plane order (a single element for a 2D image)
	 * @throws ImageDimensionalityException if the image is not 2D or 3D, or the template is not 2D
	 * @throws ImageShapeMismatchException if the sizes differ
	 * @throws DegeneratePeakException if the correlation peak of any plane cannot be refined
	 */
	public < T extends RealType< T >, U extends RealType< U > > Offset[] estimateOffsets(
			final RandomAccessibleInterval< T > image,
			final RandomAccessibleInterval< U > template )
	{
		validate( image, template );

		final int width = ( int ) template.dimension( 0 );
		final int height = ( int ) template.dimension( 1 );
		final ApodizationWindow window = new ApodizationWindow( width, height );

		final double[] templatePlane = toPlane( template );
		subtractMean( templatePlane );
		window.apply( templatePlane );

		final int numPlanes = image.numDimensions() == 3 ? ( int ) image.dimension( 2 ) : 1;
		if ( executor == null || numPlanes == 1 )
		{
			final Offset[] offsets = new Offset[ numPlanes ];
			for ( int z = 0; z < numPlanes; ++z )
				offsets[ z ] = estimatePlaneOffset( getPlane( image, z ), templatePlane, window );
			return offsets;
		}

		try
		{
			final List< Offset > offsets = executor.map( z -> estimatePlaneOffset( getPlane( image, z ), templatePlane, window ), numPlanes );
			return offsets.toArray( new Offset[ numPlanes ] );
		}
		catch ( final InterruptedException e )
		{
			Thread.currentThread().interrupt();
			throw new RuntimeException( "Interrupted while estimating offsets for " + numPlanes + " planes", e );
		}
		catch ( final ExecutionException e )
		{
			if ( e.getCause() instanceof RuntimeException )
				throw ( RuntimeException ) e.getCause();
			throw new RuntimeException( e.getCause() );
		}
	}

	private static Offset estimatePlaneOffset( final double[] imagePlane, final double[] templatePlane, final ApodizationWindow window )
	{
		subtractMean( imagePlane );
		window.apply( imagePlane );
		final double[] correlation = CrossCorrelation.correlate( imagePlane, templatePlane, window.getWidth(), window.getHeight() );
		return PeakLocalization.locatePeak( correlation, window.getWidth(), window.getHeight() );
	}

	private static < T extends RealType< T >, U extends RealType< U > > void validate(
			final RandomAccessibleInterval< T > image,
			final RandomAccessibleInterval< U > template )
	{
		if ( image.numDimensions() < 2 || image.numDimensions() > 3 )
			throw new ImageDimensionalityException( "Image must be 2 or 3 dimensional, got " + image.numDimensions() + "D" );

		if ( template.numDimensions() != 2 )
			throw new ImageDimensionalityException( "Template must be 2 dimensional, got " + template.numDimensions() + "D" );

		if ( image.dimension( 0 ) != template.dimension( 0 ) || image.dimension( 1 ) != template.dimension( 1 ) )
			throw new ImageShapeMismatchException(
					Arrays.copyOf( Intervals.dimensionsAsLongArray( image ), 2 ),
					Intervals.dimensionsAsLongArray( template ) );
	}

	private static < T extends RealType< T > > double[] getPlane( final RandomAccessibleInterval< T > image, final int z )
	{
		if ( image.numDimensions() == 2 )
			return toPlane( image );
		return toPlane( Views.hyperSlice( image, 2, image.min( 2 ) + z ) );
	}

	/**
	 * Copies a 2D image into a new row-major double array.
	 */
	static < T extends RealType< T > > double[] toPlane( final RandomAccessibleInterval< T > img )
	{
		final double[] plane = new double[ ( int ) Intervals.numElements( img ) ];
		final Cursor< T > cursor = Views.flatIterable( img ).cursor();
		for ( int i = 0; cursor.hasNext(); ++i )
			plane[ i ] = cursor.next().getRealDouble();
		return plane;
	}

	private static void subtractMean( final double[] plane )
	{
		double mean = 0;
		for ( final double val : plane )
			mean += val;
		mean /= plane.length;

		for ( int i = 0; i < plane.length; ++i )
			plane[ i ] -= mean;
	}
}
