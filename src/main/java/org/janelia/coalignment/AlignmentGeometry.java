package org.janelia.coalignment;

import net.imglib2.FinalInterval;
import net.imglib2.Interval;

/**
 * Central crop of the raw frames that is used for alignment, and the rotation center of the field of view.
 *
 * For a raw cube of size (nx, ny) the rotation center is (nx/2, ny/2) and the crop is the central region
 * of half the size along each axis, rounded down to an even number of pixels.
 */
public class AlignmentGeometry
{
	private final long[] rawDimensions;
	private final long centerX, centerY;
	private final Interval cropInterval;

	public AlignmentGeometry( final long nx, final long ny )
	{
		if ( nx < 4 || ny < 4 )
			throw new IllegalArgumentException( "raw frames are too small to be aligned: " + nx + "x" + ny );

		rawDimensions = new long[] { nx, ny };
		centerX = nx / 2;
		centerY = ny / 2;

		final long cropWidth = ( ( nx / 2 ) / 2 ) * 2;
		final long cropHeight = ( ( ny / 2 ) / 2 ) * 2;
		final long x1 = centerX - cropWidth / 2;
		final long y1 = centerY - cropHeight / 2;
		cropInterval = new FinalInterval(
				new long[] { x1, y1 },
				new long[] { x1 + cropWidth - 1, y1 + cropHeight - 1 } );
	}

	public long[] getRawDimensions() { return rawDimensions.clone(); }

	public long getCenterX() { return centerX; }
	public long getCenterY() { return centerY; }

	/**
	 * @return crop bounds in raw frame pixel coordinates, min and max inclusive
	 */
	public Interval getCropInterval() { return cropInterval; }

	/**
	 * @return absolute x coordinate of every column of the crop
	 */
	public double[] getGridX()
	{
		return grid( cropInterval.min( 0 ), cropInterval.dimension( 0 ) );
	}

	/**
	 * @return absolute y coordinate of every row of the crop
	 */
	public double[] getGridY()
	{
		return grid( cropInterval.min( 1 ), cropInterval.dimension( 1 ) );
	}

	private static double[] grid( final long min, final long size )
	{
		final double[] grid = new double[ ( int ) size ];
		for ( int i = 0; i < grid.length; ++i )
			grid[ i ] = min + i;
		return grid;
	}
}
