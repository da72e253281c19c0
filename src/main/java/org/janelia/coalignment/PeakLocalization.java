package org.janelia.coalignment;

/**
 * Locates the peak of a circular correlation surface with sub-pixel accuracy.
 * Index arithmetic is done with explicit modular helpers so that wraparound is the same on both ends of each axis.
 */
public class PeakLocalization
{
	/**
	 * Maps a circular index to a signed displacement: indices past the middle of the axis become negative.
	 *
	 * @param index in [0, length)
	 * @param length axis length
	 * @return {@code index} if {@code index <= length / 2}, otherwise {@code index - length}
	 */
	public static int wrapIndex( final int index, final int length )
	{
		return 2 * index <= length ? index : index - length;
	}

	/**
	 * @return {@code index} reduced into [0, length), also for negative values
	 */
	public static int circularIndex( final int index, final int length )
	{
		return ( ( index % length ) + length ) % length;
	}

	/**
	 * Position of the vertex of the parabola passing through (-1, left), (0, center), (1, right).
	 *
	 * @throws DegeneratePeakException if the three values do not define a finite vertex
	 */
	public static double parabolicVertex( final double left, final double center, final double right )
	{
		final double denominator = left + right - 2 * center;
		final double vertex = 0.5 * ( left - right ) / denominator;
		if ( denominator == 0 || !Double.isFinite( vertex ) )
			throw new DegeneratePeakException( String.format(
					"flat correlation neighborhood around the peak: left=%s, center=%s, right=%s", left, center, right ) );
		return vertex;
	}

	/**
	 * @return position of the first element with the largest absolute value
	 */
	public static int argMaxAbs( final double[] values )
	{
		int argMax = 0;
		double max = Double.NEGATIVE_INFINITY;
		for ( int i = 0; i < values.length; ++i )
		{
			final double abs = Math.abs( values[ i ] );
			if ( abs > max )
			{
				max = abs;
				argMax = i;
			}
		}
		return argMax;
	}

	/**
	 * Finds the peak of the row-major correlation surface and refines it
	 * by fitting a parabola through the peak and its two circular neighbors along each axis.
	 *
	 * @param surface row-major correlation surface
	 * @param width
	 * @param height
	 * @return integer plus fractional displacement of the peak
	 */
	public static Offset locatePeak( final double[] surface, final int width, final int height )
	{
		final int peakIndex = argMaxAbs( surface );
		final int peakX = peakIndex % width;
		final int peakY = peakIndex / width;

		final double center = surface[ peakIndex ];
		final double left = surface[ peakY * width + circularIndex( peakX - 1, width ) ];
		final double right = surface[ peakY * width + circularIndex( peakX + 1, width ) ];
		final double up = surface[ circularIndex( peakY - 1, height ) * width + peakX ];
		final double down = surface[ circularIndex( peakY + 1, height ) * width + peakX ];

		return new Offset(
				wrapIndex( peakX, width ) + parabolicVertex( left, center, right ),
				wrapIndex( peakY, height ) + parabolicVertex( up, center, down )
			);
	}
}
