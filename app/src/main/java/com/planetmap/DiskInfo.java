package com.planetmap;

/**
 * Location of the planetary disk in a source image, in pixels.
 */
public record DiskInfo(float centerX, float centerY, float diameter)
{
	public static final float MIN_DIAMETER = 2 * DiskDetector.MIN_RADIUS;

	public DiskInfo
	{
		if (!(diameter >= MIN_DIAMETER))
		{
			throw new IllegalArgumentException("disk diameter must be at least " + MIN_DIAMETER + " px, got " + diameter);
		}
	}

	public float radius()
	{
		return diameter / 2;
	}
}
