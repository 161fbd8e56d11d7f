package com.planetmap;

import java.awt.image.BufferedImage;

/**
 * Frame storage addressed by opaque integer handles. Handles are valid on every
 * thread; only the handle crosses the worker boundary, never the buffer owner.
 */
public interface TextureStore
{
	/** Allocates a blank RGB8 buffer and returns its handle. */
	int allocate(int width, int height);

	/** Overwrites the buffer behind {@code handle}; dimensions must match. */
	void write(int handle, BufferedImage pixels);

	BufferedImage read(int handle);

	void release(int handle);
}
