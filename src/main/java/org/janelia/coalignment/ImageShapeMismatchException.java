package org.janelia.coalignment;

import java.util.Arrays;

/**
 * Thrown when the template does not have the same width and height as the image it is compared against.
 */
public class ImageShapeMismatchException extends IllegalArgumentException
{
	private static final long serialVersionUID = 5870125547735393315L;

	public ImageShapeMismatchException( final long[] imageDimensions, final long[] templateDimensions )
	{
		super( "Image and template are incompatible: image shape = " + Arrays.toString( imageDimensions ) +
				", template shape = " + Arrays.toString( templateDimensions ) );
	}
}
