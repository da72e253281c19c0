package org.janelia.coalignment;

import org.jtransforms.fft.DoubleFFT_2D;

/**
 * Circular cross-correlation of two real row-major planes of the same size, computed through the convolution theorem.
 */
public class CrossCorrelation
{
	/**
	 * Computes {@code IFFT( FFT( image ) * conj( FFT( template ) ) )} and returns its real part.
	 * The value at (x, y) measures the similarity between the template and the image displaced by (x, y) with wraparound,
	 * so the peak is found at the displacement of the image content relative to the template.
	 *
	 * @param image row-major image plane
	 * @param template row-major template plane
	 * @param width
	 * @param height
	 * @return row-major correlation surface
	 */
	public static double[] correlate( final double[] image, final double[] template, final int width, final int height )
	{
		final int numPixels = width * height;
		if ( image.length != numPixels || template.length != numPixels )
			throw new IllegalArgumentException( "expected planes of size " + width + "x" + height );

		final DoubleFFT_2D fft = new DoubleFFT_2D( height, width );

		final double[] imageSpectrum = toComplex( image );
		final double[] templateSpectrum = toComplex( template );
		fft.complexForward( imageSpectrum );
		fft.complexForward( templateSpectrum );

		// image spectrum times the complex conjugate of the template spectrum, stored into the image spectrum
		for ( int i = 0; i < numPixels; ++i )
		{
			final double re1 = imageSpectrum[ 2 * i ], im1 = imageSpectrum[ 2 * i + 1 ];
			final double re2 = templateSpectrum[ 2 * i ], im2 = templateSpectrum[ 2 * i + 1 ];
			imageSpectrum[ 2 * i ] = re1 * re2 + im1 * im2;
			imageSpectrum[ 2 * i + 1 ] = im1 * re2 - re1 * im2;
		}

		fft.complexInverse( imageSpectrum, true );

		final double[] surface = new double[ numPixels ];
		for ( int i = 0; i < numPixels; ++i )
			surface[ i ] = imageSpectrum[ 2 * i ];
		return surface;
	}

	private static double[] toComplex( final double[] real )
	{
		final double[] complex = new double[ 2 * real.length ];
		for ( int i = 0; i < real.length; ++i )
			complex[ 2 * i ] = real[ i ];
		return complex;
	}
}
