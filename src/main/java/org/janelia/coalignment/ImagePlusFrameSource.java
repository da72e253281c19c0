package org.janelia.coalignment;

import java.io.IOException;

import org.janelia.util.ImageImporter;

import ij.ImagePlus;
import ij.process.ImageProcessor;
import net.imglib2.Cursor;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Reads raw cubes stored as image stacks with ImageJ, one stack slice per wavelength.
 */
public class ImagePlusFrameSource implements FrameSource
{
	@Override
	public long[] getCubeDimensions( final FrameInfo frame ) throws IOException
	{
		final ImagePlus imp = ImageImporter.openImage( frame.getFilePath() );
		return new long[] { imp.getWidth(), imp.getHeight(), imp.getStackSize() };
	}

	@Override
	public RandomAccessibleInterval< FloatType > loadRaster( final FrameInfo frame, final int wavelengthIndex, final Interval bounds ) throws IOException
	{
		final ImagePlus imp = ImageImporter.openImage( frame.getFilePath() );

		if ( wavelengthIndex < 0 || wavelengthIndex >= imp.getStackSize() )
			throw new IllegalArgumentException( "Wavelength index " + wavelengthIndex + " is out of bounds [0-" + ( imp.getStackSize() - 1 ) + "] for " + ImageImporter.describe( imp ) );

		if ( bounds.numDimensions() != 2 || bounds.min( 0 ) < 0 || bounds.min( 1 ) < 0 || bounds.max( 0 ) >= imp.getWidth() || bounds.max( 1 ) >= imp.getHeight() )
			throw new IllegalArgumentException( "Raster bounds are outside of " + ImageImporter.describe( imp ) );

		final ImageProcessor ip = imp.getStack().getProcessor( wavelengthIndex + 1 );
		final ArrayImg< FloatType, FloatArray > raster = ArrayImgs.floats( bounds.dimension( 0 ), bounds.dimension( 1 ) );
		final Cursor< FloatType > cursor = raster.localizingCursor();
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			final int x = ( int ) bounds.min( 0 ) + cursor.getIntPosition( 0 );
			final int y = ( int ) bounds.min( 1 ) + cursor.getIntPosition( 1 );
			cursor.get().set( ip.getf( x, y ) );
		}
		return raster;
	}
}
