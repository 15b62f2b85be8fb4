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

/**
 * How the rotation found in one iteration is combined with the rotation accumulated so far.
 */
public enum RotationComposition
{
	/**
	 * Reads an angle from entry [1,0] of both rotations (asin, in degrees), adds them and
	 * builds a new rotation in the xy-plane from the sum. In 3d the remaining entries are
	 * the ones of the identity, i.e. the result always rotates around z.
	 */
	ANGLE,

	/**
	 * R = R_new * R_previous
	 */
	MATRIX
}
