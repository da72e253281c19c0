package org.janelia.coalignment;

import java.io.Serializable;

/**
 * Translation of an image relative to its template.
 * Positive values mean that the image content is shifted towards the positive direction of the axis.
 */
public class Offset implements Serializable
{
	private static final long serialVersionUID = 3510957216348401926L;

	public static final Offset ZERO = new Offset( 0, 0 );

	private final double x;
	private final double y;

	public Offset( final double x, final double y )
	{
		this.x = x;
		this.y = y;
	}

	public double getX() { return x; }
	public double getY() { return y; }

	public Offset add( final Offset other )
	{
		return new Offset( x + other.x, y + other.y );
	}

	public double[] toArray()
	{
		return new double[] { x, y };
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( !( obj instanceof Offset ) )
			return false;
		final Offset other = ( Offset ) obj;
		return Double.compare( x, other.x ) == 0 && Double.compare( y, other.y ) == 0;
	}

	@Override
	public int hashCode()
	{
		return 31 * Double.hashCode( x ) + Double.hashCode( y );
	}

	@Override
	public String toString()
	{
		return String.format( "(%.3f, %.3f)", x, y );
	}
}
