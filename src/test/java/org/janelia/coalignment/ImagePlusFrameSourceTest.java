package org.janelia.coalignment;

import java.io.File;
import java.nio.file.NoSuchFileException;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ij.IJ;
import ij.ImagePlus;
import ij.ImageStack;
import ij.process.FloatProcessor;
import net.imglib2.FinalInterval;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;

public class ImagePlusFrameSourceTest
{
	@Rule
	public TemporaryFolder tempFolder = new TemporaryFolder();

	private final FrameSource frameSource = new ImagePlusFrameSource();
	private FrameInfo frame;

	@Before
	public void setUp() throws Exception
	{
		// 3 wavelengths of 20x10 pixels, value = 1000 * wavelength + 100 * y + x
		final ImageStack stack = new ImageStack( 20, 10 );
		for ( int w = 0; w < 3; ++w )
		{
			final FloatProcessor fp = new FloatProcessor( 20, 10 );
			for ( int y = 0; y < 10; ++y )
				for ( int x = 0; x < 20; ++x )
					fp.setf( x, y, 1000 * w + 100 * y + x );
			stack.addSlice( fp );
		}

		final File file = new File( tempFolder.getRoot(), "cube.tif" );
		Assert.assertTrue( IJ.saveAsTiff( new ImagePlus( "cube", stack ), file.getAbsolutePath() ) );
		frame = new FrameInfo( file.getAbsolutePath(), "2014-06-03T17:20:54" );
	}

	@Test
	public void testCubeDimensions() throws Exception
	{
		Assert.assertArrayEquals( new long[] { 20, 10, 3 }, frameSource.getCubeDimensions( frame ) );
	}

	@Test
	public void testLoadRaster() throws Exception
	{
		final RandomAccessibleInterval< FloatType > raster = frameSource.loadRaster( frame, 2, new FinalInterval( new long[] { 5, 2 }, new long[] { 14, 7 } ) );
		Assert.assertEquals( 10, raster.dimension( 0 ) );
		Assert.assertEquals( 6, raster.dimension( 1 ) );
		Assert.assertEquals( 0, raster.min( 0 ) );

		final RandomAccess< FloatType > ra = raster.randomAccess();
		ra.setPosition( new int[] { 0, 0 } );
		Assert.assertEquals( 2205, ra.get().get(), 0 );
		ra.setPosition( new int[] { 9, 5 } );
		Assert.assertEquals( 2714, ra.get().get(), 0 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testWavelengthOutOfBounds() throws Exception
	{
		frameSource.loadRaster( frame, 3, new FinalInterval( 4, 4 ) );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testBoundsOutside() throws Exception
	{
		frameSource.loadRaster( frame, 0, new FinalInterval( new long[] { 10, 0 }, new long[] { 20, 9 } ) );
	}

	@Test( expected = NoSuchFileException.class )
	public void testMissingFile() throws Exception
	{
		frameSource.getCubeDimensions( new FrameInfo( new File( tempFolder.getRoot(), "missing.tif" ).getAbsolutePath(), "2014-06-03T17:20:54" ) );
	}
}
