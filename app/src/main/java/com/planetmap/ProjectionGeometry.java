package com.planetmap;

import java.awt.Dimension;

/**
 * Sizes of projected images. A disk of diameter {@code d} maps to a hemisphere strip
 * {@code d·π/2} pixels wide; successive frames are offset by the rotation compensation.
 */
final class ProjectionGeometry
{
	static final double HALF_PI = Math.PI / 2;

	private ProjectionGeometry() {}

	static double stripWidth(SourceParameters params)
	{
		return HALF_PI * params.diskDiameter();
	}

	static Dimension size(SourceParameters params, float rotationComp, ProjectionType type)
	{
		double strip = stripWidth(params);
		int width = (int) Math.ceil(strip + (params.numImages() - 1) * rotationComp);
		int height = type == ProjectionType.EQUIRECTANGULAR
				? (int) Math.ceil(strip)
				: (int) params.diskDiameter();
		return new Dimension(width, height);
	}

	/**
	 * Horizontal shift in pixels between consecutive frames that cancels the planet's
	 * rotation during one frame interval.
	 */
	static float automaticRotationComp(SourceParameters params)
	{
		double halfRotation = 0.5 * params.siderealRotationPeriod().toMillis();
		double interval = params.frameInterval().toMillis();
		return (float) (stripWidth(params) / (halfRotation / interval));
	}

	/**
	 * Left edge of frame {@code index}'s strip; the first frame sits at the right edge
	 * and each later one moves left by {@code rotationComp}.
	 */
	static double stripOffset(SourceParameters params, float rotationComp, int index)
	{
		return (double) (params.numImages() - 1 - index) * rotationComp;
	}
}
