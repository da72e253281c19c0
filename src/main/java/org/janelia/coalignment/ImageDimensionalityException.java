package org.janelia.coalignment;

public class ImageDimensionalityException extends IllegalArgumentException
{
	private static final long serialVersionUID = -4392287416018539641L;

	public ImageDimensionalityException( final String message )
	{
		super( message );
	}
}
