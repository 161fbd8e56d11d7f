package com.planetmap;

import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.SampleModel;

public enum PixelFormat
{
	MONO8(1, 8),
	MONO16(1, 16),
	RGB8(3, 8),
	RGB16(3, 16),
	RGBA8(4, 8),
	RGBA16(4, 16);

	private final int channels;
	private final int bitsPerChannel;

	PixelFormat(int channels, int bitsPerChannel)
	{
		this.channels = channels;
		this.bitsPerChannel = bitsPerChannel;
	}

	public int channels()
	{
		return channels;
	}

	public int bitsPerChannel()
	{
		return bitsPerChannel;
	}

	/**
	 * Classifies a decoded image by its raster layout. Palette images are reported
	 * as the format their palette expands to.
	 */
	public static PixelFormat of(BufferedImage image)
	{
		return of(image.getColorModel(), image.getSampleModel());
	}

	public static PixelFormat of(ColorModel cm, SampleModel sm)
	{
		if (cm instanceof IndexColorModel icm)
		{
			return icm.hasAlpha() ? RGBA8 : RGB8;
		}

		int bands = sm.getNumBands();
		boolean wide = sm.getSampleSize(0) > 8;

		return switch (bands)
		{
			case 1, 2 -> wide ? MONO16 : MONO8;
			case 3 -> wide ? RGB16 : RGB8;
			default -> cm.hasAlpha()
					? (wide ? RGBA16 : RGBA8)
					: (wide ? RGB16 : RGB8);
		};
	}
}
