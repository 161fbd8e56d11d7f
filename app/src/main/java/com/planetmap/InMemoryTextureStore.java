package com.planetmap;

import java.awt.image.BufferedImage;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryTextureStore implements TextureStore
{
	private final Map<Integer, BufferedImage> buffers = new ConcurrentHashMap<>();
	private final AtomicInteger nextHandle = new AtomicInteger(1);

	@Override
	public int allocate(int width, int height)
	{
		if (width <= 0 || height <= 0)
		{
			throw new IllegalArgumentException("invalid texture size " + width + "x" + height);
		}
		int handle = nextHandle.getAndIncrement();
		buffers.put(handle, new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB));
		return handle;
	}

	@Override
	public void write(int handle, BufferedImage pixels)
	{
		BufferedImage target = read(handle);
		if (pixels.getWidth() != target.getWidth() || pixels.getHeight() != target.getHeight())
		{
			throw new IllegalArgumentException(String.format("texture %d is %dx%d, got %dx%d pixels",
					handle, target.getWidth(), target.getHeight(), pixels.getWidth(), pixels.getHeight()));
		}
		target.getRaster().setRect(ImageLoader.toRgb8(pixels).getRaster());
	}

	@Override
	public BufferedImage read(int handle)
	{
		BufferedImage image = buffers.get(handle);
		if (image == null)
		{
			throw new IllegalArgumentException("unknown texture handle " + handle);
		}
		return image;
	}

	@Override
	public void release(int handle)
	{
		buffers.remove(handle);
	}

	int size()
	{
		return buffers.size();
	}
}
