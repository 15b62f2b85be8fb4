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
package net.preibisch.rigidicp.process.pointcloud.exception;

/**
 * Thrown if a point set is empty.
 */
public class DegenerateInputException extends RegistrationException
{
	private static final long serialVersionUID = 1L;

	public DegenerateInputException( final String message ) { super( message ); }
}
