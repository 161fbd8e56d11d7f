package com.planetmap;

/**
 * Thrown when no complete planetary disk can be located in an image.
 */
public class DiskNotFoundException extends Exception
{
	public DiskNotFoundException(String message)
	{
		super(message);
	}
}
