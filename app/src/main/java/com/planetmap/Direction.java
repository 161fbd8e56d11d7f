package com.planetmap;

public enum Direction
{
	FORWARD,
	BACKWARD
}
