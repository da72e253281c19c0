package org.janelia.coalignment;

import java.io.IOException;

import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Reads raster images out of raw spectral cubes.
 */
public interface FrameSource
{
	/**
	 * @return raw cube size as { nx, ny, number of wavelengths }
	 */
	long[] getCubeDimensions( FrameInfo frame ) throws IOException;

	/**
	 * Extracts the 2D raster at the given wavelength index cropped to the given bounds.
	 *
	 * @param frame
	 * @param wavelengthIndex zero-based wavelength index
	 * @param bounds crop in raw cube pixel coordinates, min and max inclusive
	 * @return zero-min image of the size of the bounds
	 */
	RandomAccessibleInterval< FloatType > loadRaster( FrameInfo frame, int wavelengthIndex, Interval bounds ) throws IOException;
}
