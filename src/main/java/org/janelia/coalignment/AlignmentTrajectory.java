package org.janelia.coalignment;

import java.io.Serializable;

import com.google.gson.annotations.SerializedName;

/**
 * Cumulative displacement of every frame of a time series relative to the first frame,
 * together with the rotation angle and the time offset of each frame and the rotation center.
 * Instances are immutable; array accessors return copies.
 */
public class AlignmentTrajectory implements Serializable
{
	private static final long serialVersionUID = -1738405872957017042L;

	@SerializedName( "xc" )
	private final double centerX;
	@SerializedName( "yc" )
	private final double centerY;

	private final double[] angle;
	private final double[] dt;
	private final double[] dx;
	private final double[] dy;

	public AlignmentTrajectory(
			final double centerX,
			final double centerY,
			final double[] angle,
			final double[] dt,
			final double[] dx,
			final double[] dy )
	{
		final int n = angle.length;
		if ( dt.length != n || dx.length != n || dy.length != n )
			throw new IllegalArgumentException( String.format(
					"trajectory arrays should have the same length, got angle=%d, dt=%d, dx=%d, dy=%d", n, dt.length, dx.length, dy.length ) );

		this.centerX = centerX;
		this.centerY = centerY;
		this.angle = angle.clone();
		this.dt = dt.clone();
		this.dx = dx.clone();
		this.dy = dy.clone();
	}

	public int size() { return angle.length; }

	public double getCenterX() { return centerX; }
	public double getCenterY() { return centerY; }

	public double[] getAngle() { return angle.clone(); }
	public double[] getDt() { return dt.clone(); }
	public double[] getDx() { return dx.clone(); }
	public double[] getDy() { return dy.clone(); }

	public double getAngle( final int i ) { return angle[ i ]; }
	public double getDt( final int i ) { return dt[ i ]; }
	public double getDx( final int i ) { return dx[ i ]; }
	public double getDy( final int i ) { return dy[ i ]; }

	public Offset getOffset( final int i )
	{
		return new Offset( dx[ i ], dy[ i ] );
	}
}
