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
package net.preibisch.rigidicp.process.pointcloud.icp;

import static net.preibisch.rigidicp.process.pointcloud.exception.ShapeMismatchException.shape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.rigidicp.process.pointcloud.Point;
import net.preibisch.rigidicp.process.pointcloud.exception.DegenerateInputException;
import net.preibisch.rigidicp.process.pointcloud.exception.InvalidConfigurationException;
import net.preibisch.rigidicp.process.pointcloud.exception.RegistrationException;
import net.preibisch.rigidicp.process.pointcloud.exception.ShapeMismatchException;
import net.preibisch.rigidicp.process.pointcloud.kabsch.OptimalPointMatcher;

/**
 * Iterative closest point algorithm. Every row of the reference and the target matrix is one
 * point, both need to have the same number of points. Each iteration matches every target
 * point to its closest point in the current reference, fits a rotation and translation to
 * these correspondences using {@link OptimalPointMatcher} and applies them to the current
 * reference. The algorithm always runs the maximal number of iterations.
 * 
 * @author Stephan Preibisch (stephan.preibisch@gmx.de)
 *
 */
public class IterativeClosestPoint
{
	private static final Logger LOG = LoggerFactory.getLogger( IterativeClosestPoint.class );

	final RealMatrix mRef, mTarget;
	final IterativeClosestPointParameters params;
	final PointMatchIdentification pointMatchIdentification;
	final List< IterationListener > listeners = new ArrayList<>();
	final List< Double > errors = new ArrayList<>();

	RealMatrix curRef;
	RealMatrix transform, lastTransform;
	RealMatrix rotation, lastRotation;
	int iterations;
	boolean solved = false;

	/**
	 * @param reference - the reference points, one per row
	 * @param target - the target points, one per row
	 * @param params - the settings
	 * @param pointMatchIdentification - how correspondences are found in every iteration
	 * @throws RegistrationException if the point sets are empty, differ in size or do not fit the point type
	 */
	public IterativeClosestPoint(
			final RealMatrix reference,
			final RealMatrix target,
			final IterativeClosestPointParameters params,
			final PointMatchIdentification pointMatchIdentification ) throws RegistrationException
	{
		if ( params == null )
			throw new InvalidConfigurationException( "No parameters specified." );

		if ( pointMatchIdentification == null )
			throw new InvalidConfigurationException( "No point match identification specified." );

		if ( reference == null || target == null || reference.getRowDimension() == 0 || target.getRowDimension() == 0 )
			throw new DegenerateInputException( "Reference and target need to contain at least one point." );

		if ( reference.getRowDimension() != target.getRowDimension() )
			throw new ShapeMismatchException(
					"Reference (" + shape( reference.getRowDimension(), reference.getColumnDimension() ) +
					") and target (" + shape( target.getRowDimension(), target.getColumnDimension() ) +
					") need to have the same number of points." );

		final int n = params.numDimensions();

		if ( reference.getColumnDimension() != n || target.getColumnDimension() != n )
			throw new InvalidConfigurationException(
					"Point type " + params.getPointType() + " requires " + n + " columns, but reference has " +
					reference.getColumnDimension() + " and target has " + target.getColumnDimension() );

		this.mRef = reference.copy();
		this.mTarget = target.copy();
		this.curRef = reference.copy();
		this.params = params;
		this.pointMatchIdentification = pointMatchIdentification;
		this.iterations = params.getMaxNumIterations();
	}

	public IterativeClosestPoint(
			final RealMatrix reference,
			final RealMatrix target,
			final IterativeClosestPointParameters params ) throws RegistrationException
	{
		this( reference, target, params, new BruteForcePointMatchIdentification() );
	}

	public void addIterationListener( final IterationListener listener ) { listeners.add( listener ); }

	/**
	 * Runs all iterations. Can only be called once.
	 * 
	 * @throws RegistrationException if matching or fitting fails
	 */
	public void solve() throws RegistrationException
	{
		if ( solved )
			throw new IllegalStateException( "ICP has already been solved." );

		solved = true;

		final int n = mRef.getColumnDimension();

		rotation = MatrixUtils.createRealIdentityMatrix( n );
		transform = MatrixUtils.createRealMatrix( n, 1 );

		int iteration = 0;

		while ( iterations > 0 )
		{
			lastTransform = transform;
			lastRotation = rotation;

			final RealMatrix closest = match();

			// get rotation and translation
			final RealMatrix newRot = OptimalPointMatcher.solveForOptimalRotation( closest, mTarget );
			final RealMatrix newTrans = OptimalPointMatcher.solveForOptimalTranslation( closest, mTarget, newRot );

			if ( params.getRotationComposition() == RotationComposition.ANGLE )
			{
				final double lastAngle = rotMatrixToDegrees( lastRotation );
				final double angle = rotMatrixToDegrees( newRot );

				rotation = angleToRotMatrix( lastAngle + angle, lastRotation.getRowDimension() );
			}
			else
			{
				rotation = newRot.multiply( lastRotation );
			}

			transform = newTrans;

			// update the reference
			final RealMatrix newRef = OptimalPointMatcher.applyTransformation( curRef, transform, rotation );
			final double error = OptimalPointMatcher.RMSE( mTarget, newRef );

			errors.add( error );
			LOG.info( "Iteration {}: error {}", iteration, error );

			for ( final IterationListener listener : listeners )
				listener.iterationFinished( iteration, error );

			curRef = newRef;

			++iteration;
			--iterations;
		}

		LOG.info( "Final rotation: {}, translation: {}", rotation, transform.transpose() );
	}

	public RealMatrix getBestTranslation() { return copy( transform ); }
	public RealMatrix getBestRotation() { return copy( rotation ); }
	public RealMatrix getLastTranslation() { return copy( lastTransform ); }
	public RealMatrix getLastRotation() { return copy( lastRotation ); }
	public RealMatrix getCurrentReference() { return curRef.copy(); }
	public List< Double > getErrors() { return Collections.unmodifiableList( errors ); }
	public IterativeClosestPointParameters getParameters() { return params; }
	public boolean isSolved() { return solved; }

	/**
	 * For every target point, finds the closest point of the current reference.
	 * 
	 * @return the closest reference points, in the order of the target points
	 * @throws DegenerateInputException if there are no points
	 */
	protected RealMatrix match() throws DegenerateInputException
	{
		final int rows = mRef.getRowDimension();

		final ArrayList< Point > refPoints = new ArrayList<>( rows );
		final ArrayList< Point > tarPoints = new ArrayList<>( rows );

		for ( int r = 0; r < rows; ++r )
		{
			refPoints.add( Point.fromRow( curRef, r ) );
			tarPoints.add( Point.fromRow( mTarget, r ) );
		}

		final List< PointMatch > matches = pointMatchIdentification.assignPointMatches( tarPoints, refPoints );

		final ArrayList< Point > closestPoints = new ArrayList<>( matches.size() );

		for ( final PointMatch pm : matches )
			closestPoints.add( pm.getReference() );

		return Point.toMatrix( closestPoints );
	}

	/**
	 * @param rot - a rotation matrix
	 * @return asin( rot[1,0] ) in degrees
	 */
	protected static double rotMatrixToDegrees( final RealMatrix rot )
	{
		// rounding can push the sine slightly outside of [-1,1]
		final double sin = Math.max( -1.0, Math.min( 1.0, rot.getEntry( 1, 0 ) ) );

		return FastMath.toDegrees( FastMath.asin( sin ) );
	}

	/**
	 * @param angle - in degrees
	 * @param size - dimensionality of the rotation matrix
	 * @return an identity matrix with the upper left 2x2 block replaced by a rotation of angle
	 */
	protected static RealMatrix angleToRotMatrix( final double angle, final int size )
	{
		final double rad = FastMath.toRadians( angle );
		final double cos = FastMath.cos( rad );
		final double sin = FastMath.sin( rad );

		final RealMatrix rot = MatrixUtils.createRealIdentityMatrix( size );
		rot.setEntry( 0, 0, cos );
		rot.setEntry( 0, 1, -sin );
		rot.setEntry( 1, 0, sin );
		rot.setEntry( 1, 1, cos );

		return rot;
	}

	private static RealMatrix copy( final RealMatrix m )
	{
		return m == null ? null : m.copy();
	}
}
