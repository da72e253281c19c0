package org.janelia.coalignment;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.RealRandomAccess;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * {@link RotationTransform} that samples the input with n-linear interpolation.
 */
public class BilinearRotationTransform implements RotationTransform
{
	// tolerance for sample positions that fall on the image border up to rounding errors
	private static final double BORDER_EPSILON = 1e-9;

	private static final double GRID_SPACING_EPSILON = 1e-9;

	@Override
	public < T extends RealType< T > > RandomAccessibleInterval< DoubleType > rotate(
			final RandomAccessibleInterval< T > image,
			final double angle,
			final double[] gridX,
			final double[] gridY,
			final double centerX,
			final double centerY,
			final double shiftX,
			final double shiftY,
			final double fill )
	{
		if ( image.numDimensions() != 2 )
			throw new IllegalArgumentException( "Expected 2D image, got " + image.numDimensions() + "D" );
		if ( gridX.length != image.dimension( 0 ) || gridY.length != image.dimension( 1 ) )
			throw new IllegalArgumentException( "Grid of size " + gridX.length + "x" + gridY.length +
					" does not match image of size " + image.dimension( 0 ) + "x" + image.dimension( 1 ) );
		validateUnitSpacing( gridX, "x" );
		validateUnitSpacing( gridY, "y" );

		final double cos = Math.cos( angle ), sin = Math.sin( angle );
		final double minX = image.min( 0 ), maxX = image.max( 0 );
		final double minY = image.min( 1 ), maxY = image.max( 1 );

		final RealRandomAccess< T > interpolated = Views.interpolate(
				Views.extendBorder( image ),
				new NLinearInterpolatorFactory<>()
			).realRandomAccess();

		final ArrayImg< DoubleType, DoubleArray > rotated = ArrayImgs.doubles( gridX.length, gridY.length );
		final Cursor< DoubleType > cursor = rotated.localizingCursor();
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			final double u = gridX[ cursor.getIntPosition( 0 ) ] - centerX + shiftX;
			final double v = gridY[ cursor.getIntPosition( 1 ) ] - centerY + shiftY;

			// absolute source coordinates converted to the pixel space of the input
			final double sourceX = cos * u - sin * v + centerX - gridX[ 0 ] + minX;
			final double sourceY = sin * u + cos * v + centerY - gridY[ 0 ] + minY;

			if ( sourceX < minX - BORDER_EPSILON || sourceX > maxX + BORDER_EPSILON || sourceY < minY - BORDER_EPSILON || sourceY > maxY + BORDER_EPSILON )
			{
				cursor.get().set( fill );
			}
			else
			{
				interpolated.setPosition( sourceX, 0 );
				interpolated.setPosition( sourceY, 1 );
				cursor.get().set( interpolated.get().getRealDouble() );
			}
		}
		return rotated;
	}

	private static void validateUnitSpacing( final double[] grid, final String axis )
	{
		for ( int i = 1; i < grid.length; ++i )
			if ( Math.abs( grid[ i ] - grid[ i - 1 ] - 1 ) > GRID_SPACING_EPSILON )
				throw new IllegalArgumentException( "Grid along " + axis + " should have unit spacing, got " +
						grid[ i - 1 ] + " followed by " + grid[ i ] + " at index " + i );
	}
}
