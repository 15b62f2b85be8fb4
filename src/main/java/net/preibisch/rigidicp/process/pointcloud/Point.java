/*-
 * #%L
 * Rigid registration of 2d and 3d point sets using the iterative closest point algorithm.
 * %%
 * Copyright (C) 2012 - 2026 Multiview Reconstruction developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.rigidicp.process.pointcloud;

import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

import net.imglib2.RealLocalizable;
import net.imglib2.util.Util;

/**
 * Simple point of arbitrary dimensionality as used by the iterative closest point
 * implementation. A point created with the empty constructor has size zero and has to
 * be sized using {@link #prepare(int)} or {@link #setPoints(double[], int)} before
 * values can be set.
 * 
 * @author Stephan Preibisch (stephan.preibisch@gmx.de)
 *
 */
public class Point implements RealLocalizable
{
	private double[] l;

	/**
	 * Creates an empty point of size 0.
	 */
	public Point()
	{
		this.l = new double[ 0 ];
	}

	/**
	 * Creates a 2d point.
	 * 
	 * @param x - the x coordinate
	 * @param y - the y coordinate
	 */
	public Point( final double x, final double y )
	{
		this.l = new double[] { x, y };
	}

	/**
	 * Creates a 3d point.
	 * 
	 * @param x - the x coordinate
	 * @param y - the y coordinate
	 * @param z - the z coordinate
	 */
	public Point( final double x, final double y, final double z )
	{
		this.l = new double[] { x, y, z };
	}

	protected Point( final double[] l )
	{
		this.l = l;
	}

	/**
	 * Appends size zeros, use it on a point created with the empty constructor
	 * before setting values using {@link #setValue(double, int)}.
	 * 
	 * @param size - the number of coordinates to add
	 */
	public void prepare( final int size )
	{
		if ( size < 0 )
			throw new IllegalArgumentException( "Size must not be negative: " + size );

		l = Arrays.copyOf( l, l.length + size );
	}

	/**
	 * Appends the first size values of points.
	 * 
	 * @param points - the new values
	 * @param size - how many of them to append
	 */
	public void setPoints( final double[] points, final int size )
	{
		if ( size < 0 || size > points.length )
			throw new IllegalArgumentException( "Cannot append " + size + " values from an array of length " + points.length );

		final int offset = l.length;
		l = Arrays.copyOf( l, offset + size );
		System.arraycopy( points, 0, l, offset, size );
	}

	public void setValue( final double value, final int pos )
	{
		checkIndex( pos );
		l[ pos ] = value;
	}

	public double get( final int pos )
	{
		checkIndex( pos );
		return l[ pos ];
	}

	public int size() { return l.length; }

	public Point copy() { return new Point( l.clone() ); }

	/**
	 * Computes this - other. The result has the size of other, this point has to have
	 * at least as many coordinates.
	 * 
	 * @param other - the point to subtract
	 * @return a new point holding the difference
	 */
	public Point subtract( final Point other )
	{
		if ( size() < other.size() )
			throw new IllegalArgumentException( "Cannot subtract a point of size " + other.size() + " from a point of size " + size() );

		final Point p = new Point();
		p.prepare( other.size() );

		for ( int i = 0; i < other.size(); ++i )
			p.l[ i ] = l[ i ] - other.l[ i ];

		return p;
	}

	/**
	 * @param other - the other point
	 * @return the euclidean distance between this point and other (computed over the coordinates of other)
	 */
	public double distanceTo( final Point other )
	{
		final Point diff = subtract( other );

		double sum = 0.0;

		for ( final double d : diff.l )
			sum += d * d;

		return Math.sqrt( sum );
	}

	@Override
	public int numDimensions() { return l.length; }

	@Override
	public void localize( final float[] position )
	{
		for ( int d = 0; d < l.length; ++d )
			position[ d ] = (float)l[ d ];
	}

	@Override
	public void localize( final double[] position )
	{
		for ( int d = 0; d < l.length; ++d )
			position[ d ] = l[ d ];
	}

	@Override
	public float getFloatPosition( final int d ) { return (float)l[ d ]; }

	@Override
	public double getDoublePosition( final int d ) { return l[ d ]; }

	@Override
	public String toString() { return "Point " + Util.printCoordinates( l ); }

	/**
	 * @param matrix - one point per row
	 * @param row - the row to read
	 * @return a point holding the values of the row
	 */
	public static Point fromRow( final RealMatrix matrix, final int row )
	{
		final Point p = new Point();
		p.prepare( matrix.getColumnDimension() );

		for ( int c = 0; c < matrix.getColumnDimension(); ++c )
			p.setValue( matrix.getEntry( row, c ), c );

		return p;
	}

	/**
	 * @param points - a non-empty list of points of equal size
	 * @return a matrix with one point per row
	 */
	public static RealMatrix toMatrix( final List< ? extends Point > points )
	{
		if ( points.isEmpty() )
			throw new IllegalArgumentException( "Cannot create a matrix from an empty list of points." );

		final int cols = points.get( 0 ).size();
		final RealMatrix matrix = new Array2DRowRealMatrix( points.size(), cols );

		for ( int r = 0; r < points.size(); ++r )
		{
			final Point p = points.get( r );

			if ( p.size() != cols )
				throw new IllegalArgumentException( "Point " + r + " has size " + p.size() + ", expected " + cols );

			for ( int c = 0; c < cols; ++c )
				matrix.setEntry( r, c, p.l[ c ] );
		}

		return matrix;
	}

	private void checkIndex( final int pos )
	{
		if ( pos < 0 || pos >= l.length )
			throw new IndexOutOfBoundsException( "Position " + pos + " is out of bounds for a point of size " + l.length );
	}
}
