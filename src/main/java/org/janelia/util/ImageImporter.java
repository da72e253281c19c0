package org.janelia.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;
import java.util.Arrays;

import ij.IJ;
import ij.ImagePlus;

public class ImageImporter
{
	/**
	 * Opens an image file with ImageJ.
	 *
	 * @throws NoSuchFileException if the file does not exist
	 * @throws IOException if ImageJ cannot read the file
	 */
	public static ImagePlus openImage( final String path ) throws IOException
	{
		if ( !Files.exists( Paths.get( path ) ) )
			throw new NoSuchFileException( path );

		final ImagePlus imp = IJ.openImage( path );
		if ( imp == null )
			throw new IOException( "Cannot open image " + path );

		return imp;
	}

	public static String describe( final ImagePlus imp )
	{
		return imp.getTitle() + " of size " + Arrays.toString( new int[] { imp.getWidth(), imp.getHeight(), imp.getStackSize() } );
	}
}
