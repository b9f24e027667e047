/*
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2026 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */
package sc.fiji.nccut.util;

import ij.ImagePlus;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;
import net.imglib2.Cursor;
import net.imglib2.Interval;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.RealRandomAccessible;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Static utilities for handling and manipulation of
 * {@link RandomAccessibleInterval}s
 */
public class ImgUtils
{

    private ImgUtils() {}

    /**
     * Wraps a row-major 2D array as a 2D image. Dimension 0 of the image is the
     * column (x) index, dimension 1 the row (y) index, so that
     * {@code img(x, y) == values[y][x]}.
     *
     * @param values the [y][x] values. All rows must have the same length
     * @return the wrapped image
     */
    public static Img< DoubleType > wrap( final double[][] values )
    {
        final int ny = values.length;
        final int nx = ( ny == 0 ) ? 0 : values[ 0 ].length;
        final double[] flat = new double[ nx * ny ];
        for ( int y = 0; y < ny; y++ )
        {
            if ( values[ y ].length != nx )
                throw new IllegalArgumentException( "Ragged array: row " + y + " has " + values[ y ].length + " columns" );
            System.arraycopy( values[ y ], 0, flat, y * nx, nx );
        }
        return ArrayImgs.doubles( flat, nx, ny );
    }

    /**
     * Converts the active plane of an image to a 2D (grayscale) or 3D (RGB:
     * x, y, channel) image of doubles. Rows are flipped so that y grows upwards
     * from the bottom edge of the image.
     *
     * @param imp the source image
     * @return the converted image
     */
    public static Img< DoubleType > impToRai( final ImagePlus imp )
    {
        final ImageProcessor ip = imp.getProcessor();
        final int w = ip.getWidth();
        final int h = ip.getHeight();
        if ( ip instanceof ColorProcessor )
        {
            final ColorProcessor cp = ( ColorProcessor ) ip;
            final Img< DoubleType > img = ArrayImgs.doubles( w, h, 3 );
            final RandomAccess< DoubleType > ra = img.randomAccess();
            final int[] rgb = new int[ 3 ];
            for ( int y = 0; y < h; y++ )
            {
                for ( int x = 0; x < w; x++ )
                {
                    cp.getPixel( x, h - 1 - y, rgb );
                    for ( int c = 0; c < 3; c++ )
                    {
                        ra.setPosition( new long[] { x, y, c } );
                        ra.get().set( rgb[ c ] );
                    }
                }
            }
            return img;
        }
        final double[] flat = new double[ w * h ];
        for ( int y = 0; y < h; y++ )
            for ( int x = 0; x < w; x++ )
                flat[ y * w + x ] = ip.getf( x, h - 1 - y );
        return ArrayImgs.doubles( flat, w, h );
    }

    /**
     * Gets the 2D window of an image (and all its channels, if any) spanned by a
     * bounding box with asymmetric padding. The window is clamped at the min and
     * max of the image interval. If the padded box does not intersect the image
     * the whole image is returned.
     *
     * @param img       the source image (x, y[, channel])
     * @param lo        the lower corner {x, y} of the bounding box
     * @param hi        the upper corner {x, y} of the bounding box
     * @param padBefore padding (in pixels) subtracted from the lower corner
     * @param padAfter  padding (in pixels) added to the upper corner
     * @param <T>
     * @return the window
     */
    public static < T > RandomAccessibleInterval< T > subInterval( final RandomAccessibleInterval< T > img,
                                                                   final long[] lo, final long[] hi,
                                                                   final long padBefore, final long padAfter )
    {
        final long[] imgMin = Intervals.minAsLongArray( img );
        final long[] imgMax = Intervals.maxAsLongArray( img );
        final long[] min = imgMin.clone();
        final long[] max = imgMax.clone();
        for ( int d = 0; d < 2; ++d )
        {
            min[ d ] = Math.max( imgMin[ d ], lo[ d ] - padBefore );
            max[ d ] = Math.min( imgMax[ d ], hi[ d ] + padAfter );
            if ( min[ d ] > max[ d ] )
                return img;
        }
        return Views.interval( img, Intervals.createMinMax( concat( min, max ) ) );
    }

    /**
     * Averages the channels (dimension 2) of an (x, y, channel) image. The
     * result keeps the x, y offset of the input.
     *
     * @param img the multichannel image
     * @param <T>
     * @return the scalar (x, y) image
     */
    public static < T extends RealType< T > > RandomAccessibleInterval< DoubleType > averageChannels(
            final RandomAccessibleInterval< T > img )
    {
        if ( img.numDimensions() != 3 )
            throw new IllegalArgumentException( "Image must have 3 dimensions (x, y, channel)" );
        final long nChannels = img.dimension( 2 );
        final Img< DoubleType > avg = ArrayImgs.doubles( img.dimension( 0 ), img.dimension( 1 ) );
        final RandomAccess< T > ra = img.randomAccess();
        final Cursor< DoubleType > cursor = avg.localizingCursor();
        final long[] pos = new long[ 3 ];
        while ( cursor.hasNext() )
        {
            cursor.fwd();
            pos[ 0 ] = cursor.getLongPosition( 0 ) + img.min( 0 );
            pos[ 1 ] = cursor.getLongPosition( 1 ) + img.min( 1 );
            double sum = 0;
            for ( long c = img.min( 2 ); c <= img.max( 2 ); c++ )
            {
                pos[ 2 ] = c;
                ra.setPosition( pos );
                sum += ra.get().getRealDouble();
            }
            cursor.get().set( sum / nChannels );
        }
        return Views.translate( avg, img.min( 0 ), img.min( 1 ) );
    }

    /**
     * N-linear interpolant of an image, with out-of-bounds positions clamped to
     * the nearest edge.
     *
     * @param img the source image
     * @param <T>
     * @return the interpolant
     */
    public static < T extends RealType< T > > RealRandomAccessible< T > interpolant(
            final RandomAccessibleInterval< T > img )
    {
        return Views.interpolate( Views.extendBorder( img ), new NLinearInterpolatorFactory<>() );
    }

    /**
     * Checks if pos is outside the bounds given by min and max
     * @param pos the position to check
     * @param min the minimum of the interval
     * @param max the maximum of the interval
     * @return true if pos is out of bounds, false otherwise
     */
    public static boolean outOfBounds( final double[] pos, final double[] min, final double[] max )
    {
        for ( int d = 0; d < pos.length; d++ )
            if ( pos[ d ] < min[ d ] || pos[ d ] > max[ d ] )
                return true;

        return false;
    }

    /** @return the x, y extent of an interval as {width, height} */
    public static long[] extent( final Interval interval )
    {
        return new long[] { interval.dimension( 0 ), interval.dimension( 1 ) };
    }

    private static long[] concat( final long[] a, final long[] b )
    {
        final long[] result = new long[ a.length + b.length ];
        System.arraycopy( a, 0, result, 0, a.length );
        System.arraycopy( b, 0, result, a.length, b.length );
        return result;
    }

}
