package com.planetmap;

/**
 * File names of exported projection frames.
 */
final class ExportNaming
{
	private ExportNaming() {}

	/** {@code index} is 1-based. */
	static String outputFileName(int index)
	{
		return String.format("output_%05d.png", index);
	}

	/**
	 * 1-based index of the copy of frame {@code frameIndex} (0-based) that plays the
	 * sequence backwards after the last frame. The last frame gets no copy.
	 */
	static int bounceBackIndex(int frameIndex, int count)
	{
		return 2 * count - (frameIndex + 1);
	}
}
