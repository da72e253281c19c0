package org.janelia.coalignment;

import java.io.Serializable;

import com.google.gson.annotations.SerializedName;

/**
 * Result of matching the first frame against a full-disk reference image: the extra rotation angle
 * and the world coordinates of the image center. The values are carried over as they are.
 */
public class WcsMatch implements Serializable
{
	private static final long serialVersionUID = 4286075993315127066L;

	@SerializedName( value = "match_angle", alternate = { "sdo_angle" } )
	private final double matchAngle;
	@SerializedName( "wcsx" )
	private final double wcsX;
	@SerializedName( "wcsy" )
	private final double wcsY;

	public WcsMatch( final double matchAngle, final double wcsX, final double wcsY )
	{
		this.matchAngle = matchAngle;
		this.wcsX = wcsX;
		this.wcsY = wcsY;
	}

	public double getMatchAngle() { return matchAngle; }
	public double getWcsX() { return wcsX; }
	public double getWcsY() { return wcsY; }
}
