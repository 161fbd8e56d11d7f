package com.planetmap;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ViewRegistryTest
{

	@Test
	void idsAreStableAndNotReused()
	{
		ViewRegistry<String> registry = new ViewRegistry<>();
		int a = registry.add("a");
		int b = registry.add("b");
		assertNotEquals(a, b);
		assertEquals("a", registry.remove(a));
		int c = registry.add("c");
		assertNotEquals(a, c);
		assertEquals("b", registry.get(b));
		assertNull(registry.get(a));
		assertEquals(List.of("b", "c"), List.copyOf(registry.views()));
		assertEquals(2, registry.size());
	}
}
