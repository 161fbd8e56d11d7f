package com.planetmap;

import java.time.Duration;

/**
 * Everything a dependent view needs to know about the loaded sequence. Always
 * published as a whole; angles are in degrees, disk geometry in source pixels.
 */
public record SourceParameters(
		int numImages,
		float inclination,
		float roll,
		Duration frameInterval,
		float diskCenterX,
		float diskCenterY,
		float diskDiameter,
		float flattening,
		Duration siderealRotationPeriod)
{
	static SourceParameters initial(int numImages, DiskInfo disk, Planet planet, Duration frameInterval)
	{
		return new SourceParameters(numImages, 0, 0, frameInterval,
				disk.centerX(), disk.centerY(), disk.diameter(),
				planet.flattening(), planet.siderealRotation());
	}

	public SourceParameters withNumImages(int value)
	{
		return new SourceParameters(value, inclination, roll, frameInterval,
				diskCenterX, diskCenterY, diskDiameter, flattening, siderealRotationPeriod);
	}

	public SourceParameters withInclination(float value)
	{
		return new SourceParameters(numImages, value, roll, frameInterval,
				diskCenterX, diskCenterY, diskDiameter, flattening, siderealRotationPeriod);
	}

	public SourceParameters withRoll(float value)
	{
		return new SourceParameters(numImages, inclination, value, frameInterval,
				diskCenterX, diskCenterY, diskDiameter, flattening, siderealRotationPeriod);
	}

	public SourceParameters withFrameInterval(Duration value)
	{
		return new SourceParameters(numImages, inclination, roll, value,
				diskCenterX, diskCenterY, diskDiameter, flattening, siderealRotationPeriod);
	}

	public SourceParameters withDiskCenter(float x, float y)
	{
		return new SourceParameters(numImages, inclination, roll, frameInterval,
				x, y, diskDiameter, flattening, siderealRotationPeriod);
	}

	public SourceParameters withDiskDiameter(float value)
	{
		return new SourceParameters(numImages, inclination, roll, frameInterval,
				diskCenterX, diskCenterY, value, flattening, siderealRotationPeriod);
	}

	public SourceParameters withFlattening(float value)
	{
		return new SourceParameters(numImages, inclination, roll, frameInterval,
				diskCenterX, diskCenterY, diskDiameter, value, siderealRotationPeriod);
	}

	public SourceParameters withSiderealRotationPeriod(Duration value)
	{
		return new SourceParameters(numImages, inclination, roll, frameInterval,
				diskCenterX, diskCenterY, diskDiameter, flattening, value);
	}

	public SourceParameters withDisk(DiskInfo disk)
	{
		return new SourceParameters(numImages, inclination, roll, frameInterval,
				disk.centerX(), disk.centerY(), disk.diameter(), flattening, siderealRotationPeriod);
	}
}
