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
package net.preibisch.rigidicp.process.pointcloud.kabsch;

import static net.preibisch.rigidicp.process.pointcloud.exception.ShapeMismatchException.shape;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.util.RealSum;
import net.preibisch.rigidicp.process.pointcloud.exception.DegenerateInputException;
import net.preibisch.rigidicp.process.pointcloud.exception.ShapeMismatchException;

/**
 * Static helpers that compute the optimal rotation and translation between two sets of
 * corresponding points using the Kabsch method. All matrices hold one point per row.
 * 
 * @author Stephan Preibisch (stephan.preibisch@gmx.de)
 *
 */
public class OptimalPointMatcher
{
	private static final Logger LOG = LoggerFactory.getLogger( OptimalPointMatcher.class );

	private OptimalPointMatcher() {}

	/**
	 * Solves for the optimal translation between the reference and target points given the
	 * rotation computed by {@link #solveForOptimalRotation(RealMatrix, RealMatrix)}. This is
	 * trying to map the reference to the target, the result is centroid(ref) - R * centroid(target).
	 * 
	 * @param ref - the reference points
	 * @param target - the target points
	 * @param optimalRotation - the optimal rotation matrix
	 * @return the translation as a column vector
	 * @throws ShapeMismatchException if the point sets or the rotation do not fit together
	 * @throws DegenerateInputException if the point sets are empty
	 */
	public static RealMatrix solveForOptimalTranslation(
			final RealMatrix ref,
			final RealMatrix target,
			final RealMatrix optimalRotation ) throws ShapeMismatchException, DegenerateInputException
	{
		checkSameShape( ref, target );
		checkRotation( optimalRotation, ref.getColumnDimension() );

		final RealMatrix centroidTarget = getCentroid( target );
		final RealMatrix centroidRef = getCentroid( ref );

		return optimalRotation.scalarMultiply( -1.0 ).multiply( centroidTarget ).add( centroidRef );
	}

	/**
	 * Solves for the optimal rotation matrix using singular value decomposition of the
	 * covariance matrix. This is trying to map the reference to the target. If the result
	 * is a reflection, the last row is negated so that the determinant is +1.
	 * 
	 * @param ref - the reference points
	 * @param target - the target points
	 * @return the optimal rotation matrix (cols x cols)
	 * @throws ShapeMismatchException if ref and target have different dimensions
	 * @throws DegenerateInputException if the point sets are empty
	 */
	public static RealMatrix solveForOptimalRotation( final RealMatrix ref, final RealMatrix target ) throws ShapeMismatchException, DegenerateInputException
	{
		checkSameShape( ref, target );

		final RealMatrix centroidTarget = getCentroid( target );
		final RealMatrix centroidRef = getCentroid( ref );

		// center points at centroid
		final RealMatrix refCentered = center( ref, centroidRef );
		final RealMatrix targetCentered = center( target, centroidTarget );

		final RealMatrix cov = targetCentered.transpose().multiply( refCentered );

		// if svd(H) = [U, S, V], then rotation R = V*U(transpose)
		final SingularValueDecomposition svd = new SingularValueDecomposition( cov );
		final RealMatrix rotation = svd.getV().multiply( svd.getUT() );

		if ( determinant( rotation ) < 0 )
		{
			LOG.debug( "Optimal rotation is a reflection, negating the last row." );

			final int last = rotation.getRowDimension() - 1;
			rotation.setRowMatrix( last, rotation.getRowMatrix( last ).scalarMultiply( -1.0 ) );
		}

		return rotation;
	}

	/**
	 * Sums up the euclidean distances between corresponding rows of the two matrices. Note
	 * that despite its name this is not a root mean square, the row residuals are not averaged.
	 * 
	 * @param dataOne - the first matrix
	 * @param dataTwo - the second matrix
	 * @return sum over all rows of sqrt( sum( (dataOne - dataTwo)^2 ) )
	 * @throws ShapeMismatchException if the matrices do not have the same number of rows and columns
	 */
	public static double RMSE( final RealMatrix dataOne, final RealMatrix dataTwo ) throws ShapeMismatchException
	{
		if ( dataOne.getRowDimension() != dataTwo.getRowDimension() || dataOne.getColumnDimension() != dataTwo.getColumnDimension() )
			throw new ShapeMismatchException(
					"Matrix size mismatch: " + shape( dataOne.getRowDimension(), dataOne.getColumnDimension() ) +
					" vs " + shape( dataTwo.getRowDimension(), dataTwo.getColumnDimension() ) );

		final RealMatrix result = dataOne.subtract( dataTwo );

		double rmse = 0.0;

		for ( int r = 0; r < result.getRowDimension(); ++r )
		{
			double sum = 0.0;

			for ( int c = 0; c < result.getColumnDimension(); ++c )
			{
				final double val = result.getEntry( r, c );
				sum += val * val;
			}

			rmse += FastMath.sqrt( sum );
		}

		return rmse;
	}

	/**
	 * Applies a translation followed by a rotation to the data: (data + translation) * rotation.
	 * The translation is either of the same size as the data or a row or column vector with one
	 * entry per column of the data, which is then added to every row.
	 * 
	 * @param data - the points, one per row
	 * @param translation - the translation
	 * @param rotation - the rotation matrix (cols x cols)
	 * @return the transformed points
	 * @throws ShapeMismatchException if translation or rotation do not fit the data
	 */
	public static RealMatrix applyTransformation(
			final RealMatrix data,
			final RealMatrix translation,
			final RealMatrix rotation ) throws ShapeMismatchException
	{
		final int rows = data.getRowDimension();
		final int cols = data.getColumnDimension();

		checkRotation( rotation, cols );

		final RealMatrix trans;

		if ( translation.getRowDimension() == rows && translation.getColumnDimension() == cols )
		{
			trans = translation;
		}
		else if ( translation.getColumnDimension() == 1 && translation.getRowDimension() == cols )
		{
			// column vector
			trans = new Array2DRowRealMatrix( rows, cols );
			for ( int c = 0; c < cols; ++c )
				for ( int r = 0; r < rows; ++r )
					trans.setEntry( r, c, translation.getEntry( c, 0 ) );
		}
		else if ( translation.getRowDimension() == 1 && translation.getColumnDimension() == cols )
		{
			// row vector
			trans = new Array2DRowRealMatrix( rows, cols );
			for ( int c = 0; c < cols; ++c )
				for ( int r = 0; r < rows; ++r )
					trans.setEntry( r, c, translation.getEntry( 0, c ) );
		}
		else
		{
			throw new ShapeMismatchException(
					"Translation of size " + shape( translation.getRowDimension(), translation.getColumnDimension() ) +
					" cannot be applied to data of size " + shape( rows, cols ) );
		}

		return data.add( trans ).multiply( rotation );
	}

	/**
	 * Returns the centroid of the points. If the input is of size n x i, the result is a
	 * column vector of size i x 1 where row i holds the mean of column i of the data.
	 * 
	 * @param points - the data, one point per row
	 * @return the centroid as column vector
	 * @throws DegenerateInputException if there are no points
	 */
	public static RealMatrix getCentroid( final RealMatrix points ) throws DegenerateInputException
	{
		final int rows = points.getRowDimension();
		final int columns = points.getColumnDimension();

		if ( rows == 0 || columns == 0 )
			throw new DegenerateInputException( "Cannot compute the centroid of an empty point set (" + shape( rows, columns ) + ")." );

		final RealMatrix centroid = new Array2DRowRealMatrix( columns, 1 );

		for ( int c = 0; c < columns; ++c )
		{
			final RealSum sum = new RealSum();

			for ( int r = 0; r < rows; ++r )
				sum.add( points.getEntry( r, c ) );

			centroid.setEntry( c, 0, sum.getSum() / rows );
		}

		return centroid;
	}

	public static double determinant( final RealMatrix matrix )
	{
		return new LUDecomposition( matrix ).getDeterminant();
	}

	protected static RealMatrix center( final RealMatrix points, final RealMatrix centroid )
	{
		final RealMatrix centered = points.copy();

		for ( int r = 0; r < centered.getRowDimension(); ++r )
			for ( int c = 0; c < centered.getColumnDimension(); ++c )
				centered.addToEntry( r, c, -centroid.getEntry( c, 0 ) );

		return centered;
	}

	private static void checkSameShape( final RealMatrix ref, final RealMatrix target ) throws ShapeMismatchException
	{
		if ( ref.getRowDimension() != target.getRowDimension() || ref.getColumnDimension() != target.getColumnDimension() )
			throw new ShapeMismatchException(
					"Reference (" + shape( ref.getRowDimension(), ref.getColumnDimension() ) +
					") and target (" + shape( target.getRowDimension(), target.getColumnDimension() ) + ") differ in size." );
	}

	private static void checkRotation( final RealMatrix rotation, final int numDimensions ) throws ShapeMismatchException
	{
		if ( rotation.getRowDimension() != numDimensions || rotation.getColumnDimension() != numDimensions )
			throw new ShapeMismatchException(
					"Rotation of size " + shape( rotation.getRowDimension(), rotation.getColumnDimension() ) +
					" does not fit points with " + numDimensions + " dimensions." );
	}
}
