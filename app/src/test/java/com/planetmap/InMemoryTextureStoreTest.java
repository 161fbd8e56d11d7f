package com.planetmap;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTextureStoreTest
{

	@Test
	void writeCopiesPixelsIntoAllocatedBuffer()
	{
		InMemoryTextureStore store = new InMemoryTextureStore();
		int handle = store.allocate(3, 2);

		BufferedImage pixels = new BufferedImage(3, 2, BufferedImage.TYPE_INT_ARGB);
		pixels.setRGB(2, 1, 0xFF336699);
		store.write(handle, pixels);
		pixels.setRGB(2, 1, 0xFF000000);

		BufferedImage stored = store.read(handle);
		assertEquals(BufferedImage.TYPE_INT_RGB, stored.getType());
		assertEquals(0x336699, stored.getRGB(2, 1) & 0xFFFFFF);
	}

	@Test
	void handlesAreDistinct()
	{
		InMemoryTextureStore store = new InMemoryTextureStore();
		assertNotEquals(store.allocate(1, 1), store.allocate(1, 1));
		assertEquals(2, store.size());
	}

	@Test
	void sizeMismatchRejected()
	{
		InMemoryTextureStore store = new InMemoryTextureStore();
		int handle = store.allocate(4, 4);
		assertThrows(IllegalArgumentException.class,
				() -> store.write(handle, new BufferedImage(4, 5, BufferedImage.TYPE_INT_RGB)));
	}

	@Test
	void releasedHandleIsUnknown()
	{
		InMemoryTextureStore store = new InMemoryTextureStore();
		int handle = store.allocate(2, 2);
		store.release(handle);
		assertThrows(IllegalArgumentException.class, () -> store.read(handle));
		assertEquals(0, store.size());
	}
}
