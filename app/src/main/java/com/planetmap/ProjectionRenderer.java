package com.planetmap;

import java.awt.image.BufferedImage;

/**
 * Draws the visible hemisphere of one source frame as a map strip.
 */
public interface ProjectionRenderer
{
	/**
	 * Clears {@code target} and draws frame {@code frameIndex} into it at the strip
	 * offset given by {@code rotationComp}. {@code target} is expected to have
	 * {@link ProjectionGeometry#size} dimensions.
	 */
	void render(BufferedImage source, int frameIndex, SourceParameters params, float rotationComp,
			ProjectionType type, BufferedImage target);
}
