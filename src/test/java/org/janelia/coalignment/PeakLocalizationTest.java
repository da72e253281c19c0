package org.janelia.coalignment;

import org.junit.Assert;
import org.junit.Test;

public class PeakLocalizationTest
{
	private static final double EPSILON = 1e-12;

	@Test
	public void testWrapIndexEven()
	{
		Assert.assertEquals( 0, PeakLocalization.wrapIndex( 0, 8 ) );
		Assert.assertEquals( 3, PeakLocalization.wrapIndex( 3, 8 ) );
		Assert.assertEquals( 4, PeakLocalization.wrapIndex( 4, 8 ) );
		Assert.assertEquals( -3, PeakLocalization.wrapIndex( 5, 8 ) );
		Assert.assertEquals( -1, PeakLocalization.wrapIndex( 7, 8 ) );
	}

	@Test
	public void testWrapIndexOdd()
	{
		Assert.assertEquals( 2, PeakLocalization.wrapIndex( 2, 5 ) );
		Assert.assertEquals( -2, PeakLocalization.wrapIndex( 3, 5 ) );
		Assert.assertEquals( -1, PeakLocalization.wrapIndex( 4, 5 ) );
	}

	@Test
	public void testCircularIndex()
	{
		Assert.assertEquals( 7, PeakLocalization.circularIndex( -1, 8 ) );
		Assert.assertEquals( 0, PeakLocalization.circularIndex( 8, 8 ) );
		Assert.assertEquals( 3, PeakLocalization.circularIndex( 3, 8 ) );
		Assert.assertEquals( 6, PeakLocalization.circularIndex( -10, 8 ) );
	}

	@Test
	public void testParabolicVertex()
	{
		// parabola -(x - 0.25)^2 sampled at -1, 0, 1
		final double vertex = PeakLocalization.parabolicVertex( -1.5625, -0.0625, -0.5625 );
		Assert.assertEquals( 0.25, vertex, EPSILON );

		Assert.assertEquals( 0, PeakLocalization.parabolicVertex( 1, 2, 1 ), EPSILON );
	}

	@Test( expected = DegeneratePeakException.class )
	public void testFlatNeighborhood()
	{
		PeakLocalization.parabolicVertex( 3, 3, 3 );
	}

	@Test( expected = DegeneratePeakException.class )
	public void testCollinearNeighborhood()
	{
		PeakLocalization.parabolicVertex( 1, 2, 3 );
	}

	@Test
	public void testArgMaxAbs()
	{
		Assert.assertEquals( 2, PeakLocalization.argMaxAbs( new double[] { 1, -2, -5, 4 } ) );
		Assert.assertEquals( 1, PeakLocalization.argMaxAbs( new double[] { 1, 3, 3 } ) );
	}

	@Test
	public void testPeakAtCornerWrapsAround()
	{
		// peak at x=3 (-1 after wrapping), y=0, neighbors fetched across the borders
		final int width = 4, height = 3;
		final double[] surface = new double[ width * height ];
		surface[ 0 * width + 3 ] = 10;
		surface[ 0 * width + 2 ] = 6;
		surface[ 0 * width + 0 ] = 8;
		surface[ 2 * width + 3 ] = 7;
		surface[ 1 * width + 3 ] = 7;

		final Offset peak = PeakLocalization.locatePeak( surface, width, height );
		Assert.assertEquals( -1 + 0.5 * ( 6 - 8 ) / ( 6 + 8 - 20. ), peak.getX(), EPSILON );
		Assert.assertEquals( 0, peak.getY(), EPSILON );
	}
}
