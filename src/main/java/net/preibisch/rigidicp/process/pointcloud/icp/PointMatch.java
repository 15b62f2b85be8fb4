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

import net.preibisch.rigidicp.process.pointcloud.Point;

/**
 * A correspondence between a target point and the closest reference point.
 */
public class PointMatch
{
	final private Point target, reference;
	final private int targetIndex, referenceIndex;
	final private double distance;

	public PointMatch( final Point target, final int targetIndex, final Point reference, final int referenceIndex, final double distance )
	{
		this.target = target;
		this.targetIndex = targetIndex;
		this.reference = reference;
		this.referenceIndex = referenceIndex;
		this.distance = distance;
	}

	public Point getTarget() { return target; }
	public Point getReference() { return reference; }
	public int getTargetIndex() { return targetIndex; }
	public int getReferenceIndex() { return referenceIndex; }
	public double getDistance() { return distance; }

	@Override
	public String toString()
	{
		return "PointMatch target[" + targetIndex + "]=" + target + " <-> reference[" + referenceIndex + "]=" + reference + ", d=" + distance;
	}
}
