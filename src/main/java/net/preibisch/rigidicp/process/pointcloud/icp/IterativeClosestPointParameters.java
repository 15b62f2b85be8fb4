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

import net.preibisch.rigidicp.process.pointcloud.exception.InvalidConfigurationException;

public class IterativeClosestPointParameters
{
	public static PointType defaultPointType = PointType.TWO_D;
	public static int defaultMaxIterations = 100;
	public static RotationComposition defaultRotationComposition = RotationComposition.ANGLE;

	final private PointType pointType;
	final private int maxIt;
	final private RotationComposition rotationComposition;

	public IterativeClosestPointParameters(
			final PointType pointType,
			final int maxIterations,
			final RotationComposition rotationComposition ) throws InvalidConfigurationException
	{
		if ( pointType == null )
			throw new InvalidConfigurationException( "No point type specified." );

		if ( rotationComposition == null )
			throw new InvalidConfigurationException( "No rotation composition specified." );

		if ( maxIterations <= 0 )
			throw new InvalidConfigurationException( "Number of iterations must be positive, but is " + maxIterations );

		this.pointType = pointType;
		this.maxIt = maxIterations;
		this.rotationComposition = rotationComposition;
	}

	public IterativeClosestPointParameters( final PointType pointType, final int maxIterations ) throws InvalidConfigurationException
	{
		this( pointType, maxIterations, defaultRotationComposition );
	}

	public IterativeClosestPointParameters( final PointType pointType ) throws InvalidConfigurationException
	{
		this( pointType, defaultMaxIterations, defaultRotationComposition );
	}

	public IterativeClosestPointParameters() throws InvalidConfigurationException
	{
		this( defaultPointType, defaultMaxIterations, defaultRotationComposition );
	}

	public PointType getPointType() { return pointType; }
	public int numDimensions() { return pointType.numDimensions(); }
	public int getMaxNumIterations() { return maxIt; }
	public RotationComposition getRotationComposition() { return rotationComposition; }

	@Override
	public String toString()
	{
		return "IterativeClosestPointParameters [pointType=" + pointType + ", maxIterations=" + maxIt + ", rotationComposition=" + rotationComposition + "]";
	}
}
