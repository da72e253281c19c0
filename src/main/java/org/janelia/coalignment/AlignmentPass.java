package org.janelia.coalignment;

/**
 * The two estimation passes performed for every pair of consecutive frames.
 * Each pass decides how both frames are translated before being compared,
 * given the cumulative offset of the reference frame and the shift of the moving frame estimated so far in the current step.
 */
public enum AlignmentPass
{
	/**
	 * Both frames are only de-rotated, which captures the raw frame-to-frame shift.
	 */
	LOCAL_PASS
	{
		@Override
		public Offset referenceShift( final Offset cumulative )
		{
			return Offset.ZERO;
		}

		@Override
		public Offset movingShift( final Offset cumulative, final Offset provisionalStep )
		{
			return Offset.ZERO;
		}
	},

	/**
	 * Both frames are additionally moved back to the position of the first frame:
	 * the reference by its cumulative offset, the moving frame by the cumulative offset plus the provisional step.
	 * The estimate is a residual correction of the provisional step.
	 */
	REFERENCE_PASS
	{
		@Override
		public Offset referenceShift( final Offset cumulative )
		{
			return cumulative;
		}

		@Override
		public Offset movingShift( final Offset cumulative, final Offset provisionalStep )
		{
			return cumulative.add( provisionalStep );
		}
	};

	public abstract Offset referenceShift( Offset cumulative );

	public abstract Offset movingShift( Offset cumulative, Offset provisionalStep );
}
