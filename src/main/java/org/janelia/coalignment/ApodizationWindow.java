package org.janelia.coalignment;

/**
 * Square root of a 2D gaussian centered in the middle of the image, with sigma equal to one sixth of the extent along each axis.
 * Weights the cross-correlation towards the image center so that fast changes near the edges
 * (granular motion, strong flows) do not produce spurious large displacements.
 */
public class ApodizationWindow
{
	private static final double SIGMA_FRACTION = 1. / 6;

	private final int width, height;
	private final double[] weights;

	public ApodizationWindow( final int width, final int height )
	{
		this.width = width;
		this.height = height;
		this.weights = new double[ width * height ];

		final double sigmaX = width * SIGMA_FRACTION;
		final double sigmaY = height * SIGMA_FRACTION;
		for ( int y = 0; y < height; ++y )
		{
			final double gy = ( y - height / 2. ) / sigmaY;
			for ( int x = 0; x < width; ++x )
			{
				final double gx = ( x - width / 2. ) / sigmaX;
				weights[ y * width + x ] = Math.sqrt( Math.exp( -0.5 * ( gx * gx + gy * gy ) ) );
			}
		}
	}

	public int getWidth() { return width; }
	public int getHeight() { return height; }

	public double getWeight( final int x, final int y )
	{
		return weights[ y * width + x ];
	}

	/**
	 * Multiplies the given row-major plane by the window in place.
	 */
	public void apply( final double[] plane )
	{
		if ( plane.length != weights.length )
			throw new IllegalArgumentException( "plane of size " + plane.length + " does not match window of size " + width + "x" + height );

		for ( int i = 0; i < plane.length; ++i )
			plane[ i ] *= weights[ i ];
	}
}
