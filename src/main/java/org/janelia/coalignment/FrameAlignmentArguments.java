package org.janelia.coalignment;

import java.io.Serializable;
import java.nio.file.Paths;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * Command line arguments parser for a frame alignment job.
 */
public class FrameAlignmentArguments implements Serializable
{
	private static final long serialVersionUID = 2718034829553019342L;

	@Option(name = "-i", aliases = { "--input" }, required = true,
			usage = "Path to a JSON file listing the frames (file and acquisition date) in acquisition order")
	private String inputFrameList;

	@Option(name = "-w", aliases = { "--wavelength" }, required = false,
			usage = "Index of the wavelength used for making the raster images (indexing starts from 0)")
	private int wavelengthIndex = 0;

	@Option(name = "-o", aliases = { "--outputDir" }, required = false,
			usage = "Directory for saving the alignment. Defaults to the working directory")
	private String outputDirectory = null;

	@Option(name = "-n", aliases = { "--name" }, required = false,
			usage = "Base name of the saved alignment. Defaults to the acquisition date of the first frame")
	private String baseName = null;

	@Option(name = "--rate", required = false,
			usage = "Rotation rate of the field of view in degrees per minute")
	private double rotationRate = RotationSchedule.DEFAULT_RATE_DEGREES_PER_MINUTE;

	@Option(name = "--fill", required = false,
			usage = "Value of the pixels rotated in from outside of the frame")
	private double fill = 0;

	@Option(name = "--matchWcs", required = false,
			usage = "Merge the result of the WCS matching step (<name>_match_wcs.json) into a level 1 record and remove it")
	private boolean matchWcs = false;

	@Option(name = "--verbose", required = false,
			usage = "Print the progress of every alignment step")
	private boolean verbose = false;

	private boolean parsedSuccessfully = false;

	public FrameAlignmentArguments( final String[] args ) throws IllegalArgumentException
	{
		final CmdLineParser parser = new CmdLineParser( this );
		try {
			parser.parseArgument( args );
			parsedSuccessfully = true;
		} catch ( final CmdLineException e ) {
			System.err.println( e.getMessage() );
			parser.printUsage( System.err );
			return;
		}

		if ( wavelengthIndex < 0 )
			throw new IllegalArgumentException( "Wavelength index should be non-negative, got " + wavelengthIndex );

		inputFrameList = Paths.get( inputFrameList ).toAbsolutePath().toString();
		if ( outputDirectory == null )
			outputDirectory = Paths.get( "" ).toAbsolutePath().toString();
	}

	protected FrameAlignmentArguments() { }

	public boolean parsedSuccessfully() { return parsedSuccessfully; }

	public String inputFrameList() { return inputFrameList; }
	public int wavelengthIndex() { return wavelengthIndex; }
	public String outputDirectory() { return outputDirectory; }
	public String baseName() { return baseName; }
	public double rotationRate() { return rotationRate; }
	public double fill() { return fill; }
	public boolean matchWcs() { return matchWcs; }
	public boolean verbose() { return verbose; }
}
