package org.janelia.coalignment;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Rotation of the field of view over time: the angle grows linearly with the time elapsed since the first frame.
 */
public class RotationSchedule
{
	public static final double DEFAULT_RATE_DEGREES_PER_MINUTE = 0.25;

	private final double rateDegreesPerMinute;

	public RotationSchedule()
	{
		this( DEFAULT_RATE_DEGREES_PER_MINUTE );
	}

	public RotationSchedule( final double rateDegreesPerMinute )
	{
		this.rateDegreesPerMinute = rateDegreesPerMinute;
	}

	public double getRateDegreesPerMinute() { return rateDegreesPerMinute; }

	/**
	 * @param dates acquisition dates in ISO-8601 local date-time format (e.g. 2014-06-03T17:20:54.500)
	 * @return minutes elapsed since the first date
	 */
	public static double[] getElapsedMinutes( final List< String > dates )
	{
		if ( dates.isEmpty() )
			throw new IllegalArgumentException( "no acquisition dates" );

		final LocalDateTime first = LocalDateTime.parse( dates.get( 0 ) );
		final double[] elapsed = new double[ dates.size() ];
		for ( int i = 0; i < elapsed.length; ++i )
			elapsed[ i ] = Duration.between( first, LocalDateTime.parse( dates.get( i ) ) ).toNanos() / 60e9;
		return elapsed;
	}

	/**
	 * @param elapsedMinutes time offsets from the first frame
	 * @return rotation angles in radians
	 */
	public double[] getAngles( final double[] elapsedMinutes )
	{
		final double[] angles = new double[ elapsedMinutes.length ];
		for ( int i = 0; i < angles.length; ++i )
			angles[ i ] = Math.toRadians( elapsedMinutes[ i ] * rateDegreesPerMinute );
		return angles;
	}
}
