package com.planetmap;

@FunctionalInterface
public interface Subscriber<T>
{
	void onChange(T value);
}
