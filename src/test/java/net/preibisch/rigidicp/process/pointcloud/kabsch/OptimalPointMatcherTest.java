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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static net.preibisch.rigidicp.process.pointcloud.MatrixTestUtil.assertMatrixEquals;
import static net.preibisch.rigidicp.process.pointcloud.MatrixTestUtil.centered;
import static net.preibisch.rigidicp.process.pointcloud.MatrixTestUtil.random;
import static net.preibisch.rigidicp.process.pointcloud.MatrixTestUtil.rotation2d;
import static net.preibisch.rigidicp.process.pointcloud.MatrixTestUtil.rotationX;
import static net.preibisch.rigidicp.process.pointcloud.MatrixTestUtil.rotationZ;
import static net.preibisch.rigidicp.process.pointcloud.MatrixTestUtil.translated;

import java.util.Random;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.Test;

import net.preibisch.rigidicp.process.pointcloud.exception.DegenerateInputException;
import net.preibisch.rigidicp.process.pointcloud.exception.ShapeMismatchException;

public class OptimalPointMatcherTest
{
	private static final double EPS = 1e-9;

	@Test
	public void testCentroidIsColumnMean() throws Exception
	{
		final Random rnd = new Random( 31 );

		for ( int t = 0; t < 20; ++t )
		{
			final int rows = 1 + rnd.nextInt( 50 );
			final int cols = 2 + rnd.nextInt( 2 );
			final RealMatrix points = random( rnd, rows, cols );

			final RealMatrix centroid = OptimalPointMatcher.getCentroid( points );

			assertEquals( cols, centroid.getRowDimension() );
			assertEquals( 1, centroid.getColumnDimension() );

			for ( int c = 0; c < cols; ++c )
			{
				double sum = 0;
				for ( int r = 0; r < rows; ++r )
					sum += points.getEntry( r, c );

				assertEquals( sum / rows, centroid.getEntry( c, 0 ), 1e-12 );
			}
		}
	}

	@Test( expected = DegenerateInputException.class )
	public void testCentroidOfNoPoints() throws Exception
	{
		OptimalPointMatcher.getCentroid( new Array2DRowRealMatrix() );
	}

	@Test
	public void testRotationIsProper() throws Exception
	{
		final Random rnd = new Random( 4711 );

		for ( int t = 0; t < 50; ++t )
		{
			final int cols = 2 + ( t % 2 );
			final RealMatrix ref = random( rnd, 20, cols );
			final RealMatrix target = random( rnd, 20, cols );

			assertProperRotation( OptimalPointMatcher.solveForOptimalRotation( ref, target ) );
		}
	}

	@Test
	public void testReflectionIsCorrected() throws Exception
	{
		final RealMatrix ref = new Array2DRowRealMatrix( new double[][] { { 0, 0 }, { 4, 1 }, { 1, 3 }, { -2, 5 } } );
		final RealMatrix mirrored = ref.copy();

		for ( int r = 0; r < mirrored.getRowDimension(); ++r )
			mirrored.setEntry( r, 0, -mirrored.getEntry( r, 0 ) );

		assertProperRotation( OptimalPointMatcher.solveForOptimalRotation( ref, mirrored ) );
	}

	@Test
	public void testExactRecovery2d() throws Exception
	{
		final RealMatrix ref = centered( new double[][] { { 0, 0 }, { 10, 1 }, { 3, 8 }, { -7, 4 }, { -5, -9 } } );
		final RealMatrix r0 = rotation2d( 25 );

		// rows are points, so rotating them by r0 means multiplying with its transpose
		final RealMatrix target = ref.multiply( r0.transpose() );

		final RealMatrix rotation = OptimalPointMatcher.solveForOptimalRotation( ref, target );
		final RealMatrix translation = OptimalPointMatcher.solveForOptimalTranslation( ref, target, rotation );

		assertMatrixEquals( r0.transpose(), rotation, EPS );
		assertMatrixEquals( MatrixUtils.createRealMatrix( 2, 1 ), translation, EPS );

		final RealMatrix transformed = OptimalPointMatcher.applyTransformation( ref, translation, rotation );
		assertEquals( 0.0, OptimalPointMatcher.RMSE( target, transformed ), EPS );
	}

	@Test
	public void testExactRecovery3d() throws Exception
	{
		final RealMatrix ref = centered( new double[][] { { 0, 0, 0 }, { 10, 1, 2 }, { 3, 8, -4 }, { -7, 4, 6 }, { -5, -9, 1 }, { 2, -3, 9 } } );
		final RealMatrix r0 = rotationZ( 40 ).multiply( rotationX( 15 ) );
		final RealMatrix target = ref.multiply( r0.transpose() );

		final RealMatrix rotation = OptimalPointMatcher.solveForOptimalRotation( ref, target );
		final RealMatrix translation = OptimalPointMatcher.solveForOptimalTranslation( ref, target, rotation );

		assertMatrixEquals( r0.transpose(), rotation, EPS );
		assertEquals( 0.0, OptimalPointMatcher.RMSE( target, OptimalPointMatcher.applyTransformation( ref, translation, rotation ) ), EPS );
	}

	@Test
	public void testTranslationIsReferenceCentroidMinusRotatedTargetCentroid() throws Exception
	{
		final RealMatrix target = new Array2DRowRealMatrix( new double[][] { { 0, 0 }, { 1, 0 }, { 1, 1 }, { 0, 1 } } );
		final RealMatrix ref = target.scalarAdd( 0 );

		for ( int r = 0; r < ref.getRowDimension(); ++r )
		{
			ref.addToEntry( r, 0, 2 );
			ref.addToEntry( r, 1, 3 );
		}

		final RealMatrix rotation = OptimalPointMatcher.solveForOptimalRotation( ref, target );
		assertMatrixEquals( MatrixUtils.createRealIdentityMatrix( 2 ), rotation, EPS );

		final RealMatrix translation = OptimalPointMatcher.solveForOptimalTranslation( ref, target, rotation );
		assertEquals( 2.0, translation.getEntry( 0, 0 ), EPS );
		assertEquals( 3.0, translation.getEntry( 1, 0 ), EPS );
	}

	@Test
	public void testTranslatedTargetIsMissedByTwiceTheOffset() throws Exception
	{
		final RealMatrix ref = centered( new double[][] { { 0, 0 }, { 10, 1 }, { 3, 8 }, { -7, 4 }, { -5, -9 } } );
		final RealMatrix r0 = rotation2d( 25 );
		final double[] t0 = new double[] { 1, 0.5 };
		final RealMatrix target = translated( ref.multiply( r0.transpose() ), t0 );

		final RealMatrix rotation = OptimalPointMatcher.solveForOptimalRotation( ref, target );
		final RealMatrix translation = OptimalPointMatcher.solveForOptimalTranslation( ref, target, rotation );

		assertMatrixEquals( r0.transpose(), rotation, EPS );

		// centroid(ref) - R * centroid(target) with centroid(ref) = 0 and centroid(target) = t0
		final RealMatrix expected = rotation.multiply( new Array2DRowRealMatrix( t0 ) ).scalarMultiply( -1.0 );
		assertMatrixEquals( expected, translation, EPS );

		// (ref + t) * R then equals target - 2 * t0 for every point, the translation
		// points the wrong way once the points are rows
		final RealMatrix transformed = OptimalPointMatcher.applyTransformation( ref, translation, rotation );
		assertMatrixEquals( translated( target, -2 * t0[ 0 ], -2 * t0[ 1 ] ), transformed, EPS );

		final double error = OptimalPointMatcher.RMSE( target, transformed );
		assertEquals( 2 * ref.getRowDimension() * Math.sqrt( 1.25 ), error, EPS );
		assertTrue( error > 1 );
	}

	@Test
	public void testRMSEIsSumOfRowDistances() throws Exception
	{
		final RealMatrix a = new Array2DRowRealMatrix( new double[][] { { 3, 4 }, { 6, 8 }, { 1, 1 } } );
		final RealMatrix b = new Array2DRowRealMatrix( new double[][] { { 0, 0 }, { 0, 0 }, { 1, 1 } } );

		assertEquals( 15.0, OptimalPointMatcher.RMSE( a, b ), 1e-12 );
		assertEquals( 15.0, OptimalPointMatcher.RMSE( b, a ), 1e-12 );
		assertEquals( 0.0, OptimalPointMatcher.RMSE( a, a ), 0 );
	}

	@Test( expected = ShapeMismatchException.class )
	public void testRMSEShapeMismatch() throws Exception
	{
		OptimalPointMatcher.RMSE( new Array2DRowRealMatrix( 2, 2 ), new Array2DRowRealMatrix( 3, 2 ) );
	}

	@Test( expected = ShapeMismatchException.class )
	public void testRMSESameNumberOfElementsDifferentShape() throws Exception
	{
		final RealMatrix a = new Array2DRowRealMatrix( new double[][] { { 1, 2, 3 }, { 4, 5, 6 } } );
		final RealMatrix b = new Array2DRowRealMatrix( new double[][] { { 1, 2 }, { 3, 4 }, { 5, 6 } } );

		OptimalPointMatcher.RMSE( a, b );
	}

	@Test
	public void testTranslationBroadcast() throws Exception
	{
		final Random rnd = new Random( 7 );
		final RealMatrix data = random( rnd, 5, 3 );
		final RealMatrix rotation = rotationZ( 30 );

		final RealMatrix column = new Array2DRowRealMatrix( new double[][] { { 1 }, { 2 }, { 3 } } );
		final RealMatrix row = new Array2DRowRealMatrix( new double[][] { { 1, 2, 3 } } );

		final RealMatrix fromColumn = OptimalPointMatcher.applyTransformation( data, column, rotation );
		final RealMatrix fromRow = OptimalPointMatcher.applyTransformation( data, row, rotation );

		assertMatrixEquals( fromColumn, fromRow, 0 );

		for ( int r = 0; r < data.getRowDimension(); ++r )
		{
			final RealMatrix shifted = data.getRowMatrix( r ).add( row ).multiply( rotation );
			assertArrayEquals( shifted.getRow( 0 ), fromRow.getRow( r ), 1e-12 );
		}
	}

	@Test
	public void testFullTranslation() throws Exception
	{
		final RealMatrix data = new Array2DRowRealMatrix( new double[][] { { 1, 1 }, { 2, 2 } } );
		final RealMatrix translation = new Array2DRowRealMatrix( new double[][] { { 1, 0 }, { 0, 1 } } );

		final RealMatrix result = OptimalPointMatcher.applyTransformation( data, translation, MatrixUtils.createRealIdentityMatrix( 2 ) );

		assertArrayEquals( new double[] { 2, 1 }, result.getRow( 0 ), 0 );
		assertArrayEquals( new double[] { 2, 3 }, result.getRow( 1 ), 0 );
	}

	@Test( expected = ShapeMismatchException.class )
	public void testInvalidTranslation() throws Exception
	{
		OptimalPointMatcher.applyTransformation( new Array2DRowRealMatrix( 5, 3 ), new Array2DRowRealMatrix( 2, 2 ), MatrixUtils.createRealIdentityMatrix( 3 ) );
	}

	@Test( expected = ShapeMismatchException.class )
	public void testInvalidRotation() throws Exception
	{
		OptimalPointMatcher.applyTransformation( new Array2DRowRealMatrix( 5, 3 ), new Array2DRowRealMatrix( 3, 1 ), MatrixUtils.createRealIdentityMatrix( 2 ) );
	}

	@Test( expected = ShapeMismatchException.class )
	public void testRotationShapeMismatch() throws Exception
	{
		OptimalPointMatcher.solveForOptimalRotation( new Array2DRowRealMatrix( 4, 2 ), new Array2DRowRealMatrix( 5, 2 ) );
	}

	static void assertProperRotation( final RealMatrix rotation )
	{
		final int n = rotation.getRowDimension();

		assertEquals( n, rotation.getColumnDimension() );
		assertEquals( 1.0, OptimalPointMatcher.determinant( rotation ), EPS );
		assertMatrixEquals( MatrixUtils.createRealIdentityMatrix( n ), rotation.transpose().multiply( rotation ), EPS );
	}
}
