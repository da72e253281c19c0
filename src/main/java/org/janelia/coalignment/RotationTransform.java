package org.janelia.coalignment;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Resamples an image rotated around a center and optionally translated.
 *
 * The image pixel (j, i) is located at the absolute coordinates (gridX[j], gridY[i]).
 * Both grids are increasing with unit spacing, so they only place the image in absolute coordinates;
 * implementations reject other grids with an {@link IllegalArgumentException}.
 * The output is sampled on the same grid: the value at the grid point p is taken from the input
 * at {@code R(angle) * (p - center + shift) + center}, where R is the counter-clockwise rotation matrix.
 * A positive shift thus moves the image content towards the negative direction, undoing a displacement of the same amount.
 */
public interface RotationTransform
{
	/**
	 * @param image 2D input image
	 * @param angle rotation angle in radians
	 * @param gridX absolute x coordinate of every image column, unit-spaced
	 * @param gridY absolute y coordinate of every image row, unit-spaced
	 * @param centerX rotation center
	 * @param centerY rotation center
	 * @param shiftX displacement removed from the image along x
	 * @param shiftY displacement removed from the image along y
	 * @param fill value of output pixels mapped outside of the input
	 * @return new image of the same size as the input
	 */
	< T extends RealType< T > > RandomAccessibleInterval< DoubleType > rotate(
			RandomAccessibleInterval< T > image,
			double angle,
			double[] gridX,
			double[] gridY,
			double centerX,
			double centerY,
			double shiftX,
			double shiftY,
			double fill );

	default < T extends RealType< T > > RandomAccessibleInterval< DoubleType > rotate(
			final RandomAccessibleInterval< T > image,
			final double angle,
			final double[] gridX,
			final double[] gridY,
			final double centerX,
			final double centerY )
	{
		return rotate( image, angle, gridX, gridY, centerX, centerY, 0, 0, 0 );
	}
}
