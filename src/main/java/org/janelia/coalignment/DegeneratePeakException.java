package org.janelia.coalignment;

/**
 * Thrown when the correlation surface is locally flat around its peak,
 * so that the parabolic sub-pixel refinement has no finite solution.
 */
public class DegeneratePeakException extends ArithmeticException
{
	private static final long serialVersionUID = 1629830164458871420L;

	public DegeneratePeakException( final String message )
	{
		super( message );
	}
}
