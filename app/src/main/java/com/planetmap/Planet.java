package com.planetmap;

import java.time.Duration;

public enum Planet
{
	JUPITER("Jupiter", 0.06487f, Duration.ofHours(9).plusMinutes(55).plusSeconds(30)),
	MARS("Mars", 0.00589f, Duration.ofHours(24).plusMinutes(37).plusSeconds(23));

	private final String displayName;
	private final float flattening;
	private final Duration siderealRotation;

	Planet(String displayName, float flattening, Duration siderealRotation)
	{
		this.displayName = displayName;
		this.flattening = flattening;
		this.siderealRotation = siderealRotation;
	}

	/** 1 - polar radius / equatorial radius. */
	public float flattening()
	{
		return flattening;
	}

	public Duration siderealRotation()
	{
		return siderealRotation;
	}

	@Override
	public String toString()
	{
		return displayName;
	}
}
