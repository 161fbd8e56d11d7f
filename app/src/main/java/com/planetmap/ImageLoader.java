package com.planetmap;

import org.apache.commons.imaging.ImageInfo;
import org.apache.commons.imaging.Imaging;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.stream.ImageInputStream;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes source images and reads the metadata needed to set up a load job.
 */
public class ImageLoader
{
	private static final Logger logger = LoggerFactory.getLogger(ImageLoader.class);

	public record Metadata(int width, int height, PixelFormat pixelFormat) {}

	private static final Pattern NATURAL_SORT_SPLIT = Pattern.compile("(\\d+|\\D+)");

	static final Comparator<File> NATURAL_ORDER = (a, b) -> {
		List<String> partsA = splitNatural(a.getName());
		List<String> partsB = splitNatural(b.getName());
		int len = Math.min(partsA.size(), partsB.size());
		for (int i = 0; i < len; i++)
		{
			String pa = partsA.get(i);
			String pb = partsB.get(i);
			boolean aDigit = Character.isDigit(pa.charAt(0));
			boolean bDigit = Character.isDigit(pb.charAt(0));
			int cmp;
			if (aDigit && bDigit)
			{
				cmp = compareDigitRuns(pa, pb);
			}
			else
			{
				cmp = pa.compareToIgnoreCase(pb);
			}
			if (cmp != 0) return cmp;
		}
		return Integer.compare(partsA.size(), partsB.size());
	};

	// Numeric order of arbitrarily long digit runs; equal values order by their raw text
	private static int compareDigitRuns(String a, String b)
	{
		String trimmedA = stripLeadingZeros(a);
		String trimmedB = stripLeadingZeros(b);
		int cmp = Integer.compare(trimmedA.length(), trimmedB.length());
		if (cmp == 0) cmp = trimmedA.compareTo(trimmedB);
		if (cmp == 0) cmp = a.compareTo(b);
		return cmp;
	}

	private static String stripLeadingZeros(String digits)
	{
		int i = 0;
		while (i < digits.length() - 1 && digits.charAt(i) == '0')
		{
			i++;
		}
		return digits.substring(i);
	}

	private static List<String> splitNatural(String s)
	{
		List<String> parts = new ArrayList<>();
		Matcher m = NATURAL_SORT_SPLIT.matcher(s);
		while (m.find())
		{
			parts.add(m.group());
		}
		return parts;
	}

	/**
	 * Returns a copy of {@code files} in capture order (natural filename order).
	 */
	public static List<File> sortForSequence(List<File> files)
	{
		List<File> sorted = new ArrayList<>(files);
		sorted.sort(NATURAL_ORDER);
		return sorted;
	}

	/**
	 * Reads the dimensions and pixel format a batch will be checked against. Only the
	 * header is read; files whose header cannot be interpreted are decoded in full.
	 */
	public static Metadata probe(File file) throws IOException
	{
		if (!file.isFile())
		{
			throw new IOException("file not found: " + file);
		}

		ImageInfo info;
		try
		{
			info = Imaging.getImageInfo(file);
		}
		catch (IOException | IllegalArgumentException e)
		{
			logger.debug("{}: no header metadata ({}), decoding", file.getName(), e.getMessage());
			return probeByDecoding(file);
		}

		PixelFormat format = readRawPixelFormat(file);
		if (format == null)
		{
			logger.debug("{}: no raw image type, decoding", file.getName());
			return probeByDecoding(file);
		}
		logger.debug("{}: {} {}x{}, {} bpp", file.getName(), info.getFormat().getName(),
				info.getWidth(), info.getHeight(), info.getBitsPerPixel());
		return new Metadata(info.getWidth(), info.getHeight(), format);
	}

	private static Metadata probeByDecoding(File file) throws IOException
	{
		BufferedImage image = decode(file);
		return new Metadata(image.getWidth(), image.getHeight(), PixelFormat.of(image));
	}

	// Pixel layout ImageIO would decode to, or null when no reader reports one
	private static PixelFormat readRawPixelFormat(File file) throws IOException
	{
		try (ImageInputStream in = ImageIO.createImageInputStream(file))
		{
			if (in == null) return null;
			Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
			if (!readers.hasNext()) return null;

			ImageReader reader = readers.next();
			try
			{
				reader.setInput(in, true, true);
				ImageTypeSpecifier type = reader.getRawImageType(0);
				return type == null ? null : PixelFormat.of(type.getColorModel(), type.getSampleModel());
			}
			finally
			{
				reader.dispose();
			}
		}
	}

	public static BufferedImage decode(File file) throws IOException
	{
		if (!file.isFile())
		{
			throw new IOException("file not found: " + file);
		}

		BufferedImage image = ImageIO.read(file);
		if (image != null) return image;

		// No ImageIO reader for this format; Commons Imaging also covers PNM, PCX and ICNS
		try
		{
			image = Imaging.getBufferedImage(file);
		}
		catch (IOException | IllegalArgumentException e)
		{
			// Commons Imaging reports an unrecognized format as IllegalArgumentException
			throw new IOException("unsupported image format: " + file.getName(), e);
		}
		if (image == null)
		{
			throw new IOException("unsupported image format: " + file.getName());
		}
		return image;
	}

	/**
	 * Converts to packed 8-bit RGB, the layout every stored frame uses.
	 */
	public static BufferedImage toRgb8(BufferedImage src)
	{
		if (src.getType() == BufferedImage.TYPE_INT_RGB) return src;

		BufferedImage dst = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
		Graphics2D g = dst.createGraphics();
		try
		{
			g.drawImage(src, 0, 0, null);
		}
		finally
		{
			g.dispose();
		}
		return dst;
	}
}
