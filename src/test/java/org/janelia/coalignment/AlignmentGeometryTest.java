package org.janelia.coalignment;

import org.junit.Assert;
import org.junit.Test;

import net.imglib2.Interval;

public class AlignmentGeometryTest
{
	@Test
	public void testEvenSize()
	{
		final AlignmentGeometry geometry = new AlignmentGeometry( 128, 100 );
		Assert.assertEquals( 64, geometry.getCenterX() );
		Assert.assertEquals( 50, geometry.getCenterY() );

		final Interval crop = geometry.getCropInterval();
		Assert.assertEquals( 32, crop.min( 0 ) );
		Assert.assertEquals( 95, crop.max( 0 ) );
		Assert.assertEquals( 25, crop.min( 1 ) );
		Assert.assertEquals( 74, crop.max( 1 ) );

		final double[] gridX = geometry.getGridX();
		Assert.assertEquals( 64, gridX.length );
		Assert.assertEquals( 32, gridX[ 0 ], 0 );
		Assert.assertEquals( 95, gridX[ 63 ], 0 );
		Assert.assertEquals( 50, geometry.getGridY().length );
	}

	@Test
	public void testOddSize()
	{
		// nx=101: center 50, crop width ((101/2)/2)*2 = 50
		final AlignmentGeometry geometry = new AlignmentGeometry( 101, 14 );
		Assert.assertEquals( 50, geometry.getCenterX() );
		Assert.assertEquals( 25, geometry.getCropInterval().min( 0 ) );
		Assert.assertEquals( 50, geometry.getCropInterval().dimension( 0 ) );

		// ny=14: crop height ((14/2)/2)*2 = 6, always even
		Assert.assertEquals( 6, geometry.getCropInterval().dimension( 1 ) );
		Assert.assertEquals( 4, geometry.getCropInterval().min( 1 ) );
	}

	@Test
	public void testCropContainsCenter()
	{
		final AlignmentGeometry geometry = new AlignmentGeometry( 37, 59 );
		final Interval crop = geometry.getCropInterval();
		Assert.assertTrue( crop.min( 0 ) <= geometry.getCenterX() && geometry.getCenterX() <= crop.max( 0 ) );
		Assert.assertTrue( crop.min( 1 ) <= geometry.getCenterY() && geometry.getCenterY() <= crop.max( 1 ) );
		Assert.assertEquals( 0, crop.dimension( 0 ) % 2 );
		Assert.assertEquals( 0, crop.dimension( 1 ) % 2 );
	}

	@Test
	public void testGridsAreCopies()
	{
		final AlignmentGeometry geometry = new AlignmentGeometry( 16, 16 );
		geometry.getGridX()[ 0 ] = -1;
		Assert.assertEquals( 4, geometry.getGridX()[ 0 ], 0 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testTooSmall()
	{
		new AlignmentGeometry( 3, 100 );
	}
}
