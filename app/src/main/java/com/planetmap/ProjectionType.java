package com.planetmap;

public enum ProjectionType
{
	EQUIRECTANGULAR("Equirectangular"),
	LAMBERT_CYLINDRICAL_EQUAL_AREA("Lambert cylindrical equal-area");

	private final String label;

	ProjectionType(String label)
	{
		this.label = label;
	}

	@Override
	public String toString()
	{
		return label;
	}
}
