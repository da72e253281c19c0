package org.janelia.coalignment;

import java.io.IOException;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;

/**
 * Provides raster frames of a time series by index. Loading a frame is allowed to block.
 */
@FunctionalInterface
public interface FrameSupplier< T extends RealType< T > >
{
	RandomAccessibleInterval< T > getFrame( int index ) throws IOException;
}
