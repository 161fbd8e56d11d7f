package com.planetmap;

public record ProgressMessage(String description, float fraction)
{
	public ProgressMessage
	{
		if (!(fraction >= 0 && fraction <= 1))
		{
			throw new IllegalArgumentException("progress fraction out of range: " + fraction);
		}
	}
}
