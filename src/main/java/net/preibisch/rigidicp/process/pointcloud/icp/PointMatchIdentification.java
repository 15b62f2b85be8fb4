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

import java.util.List;

import net.preibisch.rigidicp.process.pointcloud.Point;
import net.preibisch.rigidicp.process.pointcloud.exception.DegenerateInputException;

public interface PointMatchIdentification
{
	/**
	 * @param target - the target points
	 * @param reference - the reference points
	 * @return one match per target point, in the order of the target points
	 * @throws DegenerateInputException if one of the lists is empty
	 */
	public List< PointMatch > assignPointMatches( final List< Point > target, final List< Point > reference ) throws DegenerateInputException;
}
