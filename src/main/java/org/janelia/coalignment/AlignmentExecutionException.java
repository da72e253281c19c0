package org.janelia.coalignment;

public class AlignmentExecutionException extends Exception
{
	private static final long serialVersionUID = -7265840392127794403L;

	public AlignmentExecutionException()
	{
		super();
	}

	public AlignmentExecutionException( final String message )
	{
		super( message );
	}

	public AlignmentExecutionException( final String message, final Throwable cause )
	{
		super( message, cause );
	}

	public AlignmentExecutionException( final Throwable cause )
	{
		super( cause );
	}
}
