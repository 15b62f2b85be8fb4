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

import java.util.ArrayList;
import java.util.List;

import net.preibisch.rigidicp.process.pointcloud.Point;
import net.preibisch.rigidicp.process.pointcloud.exception.DegenerateInputException;

/**
 * Finds for every target point the closest reference point by linear search. If several
 * reference points have the same distance, the one with the lowest index is used.
 */
public class BruteForcePointMatchIdentification implements PointMatchIdentification
{
	@Override
	public ArrayList< PointMatch > assignPointMatches( final List< Point > target, final List< Point > reference ) throws DegenerateInputException
	{
		if ( target.isEmpty() || reference.isEmpty() )
			throw new DegenerateInputException( "Cannot match empty point sets (|target|=" + target.size() + ", |reference|=" + reference.size() + ")" );

		final ArrayList< PointMatch > pointMatches = new ArrayList<>( target.size() );

		for ( int i = 0; i < target.size(); ++i )
		{
			final Point tar = target.get( i );

			double bestDistance = Double.POSITIVE_INFINITY;
			int best = -1;

			// linear search
			for ( int j = 0; j < reference.size(); ++j )
			{
				final double dist = tar.distanceTo( reference.get( j ) );

				if ( dist < bestDistance )
				{
					bestDistance = dist;
					best = j;
				}
			}

			// only NaN coordinates leave nothing selected
			if ( best < 0 )
				best = 0;

			pointMatches.add( new PointMatch( tar, i, reference.get( best ), best, bestDistance ) );
		}

		return pointMatches;
	}
}
