package com.planetmap;

import java.awt.Point;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.util.ArrayList;
import java.util.List;

/**
 * Locates the planetary disk in a source image without user input.
 *
 * The image is reduced to a binary mask (anything above 2% of the peak value
 * counts as disk), the mask's centroid becomes the center, and the radius is
 * found by binary search over concentric rasterized circles.
 */
public class DiskDetector
{
	static final int MIN_RADIUS = 2;

	// Percentage of the peak value treated as background glow
	private static final int BACKGROUND_PERCENT = 2;

	private DiskDetector() {}

	public static DiskInfo detect(BufferedImage image) throws DiskNotFoundException
	{
		int w = image.getWidth();
		int h = image.getHeight();
		int[] mono = toMono8(image);

		int max = 0;
		for (int value : mono)
		{
			max = Math.max(max, value);
		}

		// Cut the lower part of the signal so a bright background does not pull the centroid
		int cutoff = BACKGROUND_PERCENT * max / 100;
		double sumX = 0;
		double sumY = 0;
		long count = 0;
		for (int y = 0; y < h; y++)
		{
			for (int x = 0; x < w; x++)
			{
				int i = x + y * w;
				if (mono[i] <= cutoff)
				{
					mono[i] = 0;
				}
				else
				{
					mono[i] = 0xFF;
					sumX += x;
					sumY += y;
					count++;
				}
			}
		}

		if (count == 0)
		{
			throw new DiskNotFoundException("image contains no signal");
		}

		float centerX = (float) (sumX / count);
		float centerY = (float) (sumY / count);
		int cx = Math.round(centerX);
		int cy = Math.round(centerY);

		int upper = Math.min(Math.min(cx, cy), Math.min(w - 1 - cx, h - 1 - cy));
		int lower = MIN_RADIUS;
		if (upper < lower)
		{
			throw new DiskNotFoundException("disk center too close to the image edge");
		}

		if (isOutsideDisk(mono, w, rasterizeCircle(cx, cy, lower)))
		{
			throw new DiskNotFoundException("disk radius is less than " + MIN_RADIUS + " pixels");
		}
		if (!isOutsideDisk(mono, w, rasterizeCircle(cx, cy, upper)))
		{
			throw new DiskNotFoundException("disk extends outside the image");
		}

		// Invariant: circle(lower) touches the disk, circle(upper) does not
		while (upper - lower > 1)
		{
			int mid = lower + (upper - lower) / 2;
			if (isOutsideDisk(mono, w, rasterizeCircle(cx, cy, mid)))
			{
				upper = mid;
			}
			else
			{
				lower = mid;
			}
		}

		return new DiskInfo(centerX, centerY, 2 * lower);
	}

	private static boolean isOutsideDisk(int[] mask, int width, List<Point> circle)
	{
		for (Point p : circle)
		{
			if (mask[p.x + p.y * width] != 0) return false;
		}
		return true;
	}

	/**
	 * Returns circle points clockwise (in a right-handed coordinate system), starting
	 * from the leftmost point {@code (cx - radius, cy)}.
	 *
	 * Only the first octant is scanned; the other seven are reflections of it. The
	 * four cardinal points and each octant's diagonal point are emitted once.
	 */
	static List<Point> rasterizeCircle(int cx, int cy, int radius)
	{
		List<Point> octant = new ArrayList<>();
		Point diagonal = null;

		int x = -radius;
		int y = 0;
		int r2 = radius * radius;
		while (-x > y)
		{
			x++;
			y++;
			if (x * x + y * y < r2)
			{
				x--;
			}
			if (Math.abs(x) == Math.abs(y))
			{
				diagonal = new Point(x, y);
			}
			else
			{
				octant.add(new Point(x, y));
			}
		}

		//              y
		//              ^
		//        oct2  |  oct3
		//     oct1     |     oct4
		//  ------------0------------> x
		//     oct8     |     oct5
		//        oct7  |  oct6

		List<Point> points = new ArrayList<>(8 * octant.size() + 8);
		int n = octant.size();

		points.add(new Point(-radius, 0));
		for (Point p : octant) points.add(new Point(p.x, p.y));                              // 1
		if (diagonal != null) points.add(new Point(diagonal.x, diagonal.y));
		for (int i = n - 1; i >= 0; i--) points.add(flip(octant.get(i), -1, -1, true));  // 2
		points.add(new Point(0, radius));
		for (Point p : octant) points.add(new Point(p.y, -p.x));                            // 3
		if (diagonal != null) points.add(new Point(-diagonal.x, diagonal.y));
		for (int i = n - 1; i >= 0; i--) points.add(flip(octant.get(i), -1, 1, false));  // 4
		points.add(new Point(radius, 0));
		for (Point p : octant) points.add(new Point(-p.x, -p.y));                           // 5
		if (diagonal != null) points.add(new Point(-diagonal.x, -diagonal.y));
		for (int i = n - 1; i >= 0; i--) points.add(flip(octant.get(i), 1, 1, true));    // 6
		points.add(new Point(0, -radius));
		for (Point p : octant) points.add(new Point(-p.y, p.x));                            // 7
		if (diagonal != null) points.add(new Point(diagonal.x, -diagonal.y));
		for (int i = n - 1; i >= 0; i--) points.add(flip(octant.get(i), 1, -1, false));  // 8

		for (Point p : points)
		{
			p.translate(cx, cy);
		}
		return points;
	}

	// (sx * y, sy * x) when swapping, (sx * x, sy * y) otherwise
	private static Point flip(Point p, int sx, int sy, boolean swap)
	{
		return swap ? new Point(sx * p.y, sy * p.x) : new Point(sx * p.x, sy * p.y);
	}

	/**
	 * Single-channel 8-bit intensity: the mean of the colour bands, alpha ignored.
	 */
	static int[] toMono8(BufferedImage image)
	{
		int w = image.getWidth();
		int h = image.getHeight();
		int[] mono = new int[w * h];
		ColorModel cm = image.getColorModel();

		if (cm instanceof IndexColorModel)
		{
			for (int y = 0; y < h; y++)
			{
				for (int x = 0; x < w; x++)
				{
					int rgb = image.getRGB(x, y);
					mono[x + y * w] = (((rgb >> 16) & 0xFF) + ((rgb >> 8) & 0xFF) + (rgb & 0xFF)) / 3;
				}
			}
			return mono;
		}

		Raster raster = image.getRaster();
		int bands = raster.getNumBands();
		int colorBands = cm.hasAlpha() ? bands - 1 : bands;
		int[] maxSample = new int[colorBands];
		for (int b = 0; b < colorBands; b++)
		{
			maxSample[b] = Math.max(1, (1 << raster.getSampleModel().getSampleSize(b)) - 1);
		}

		int[] row = new int[w * bands];
		for (int y = 0; y < h; y++)
		{
			raster.getPixels(0, y, w, 1, row);
			for (int x = 0; x < w; x++)
			{
				int sum = 0;
				for (int b = 0; b < colorBands; b++)
				{
					sum += row[x * bands + b] * 255 / maxSample[b];
				}
				mono[x + y * w] = sum / colorBands;
			}
		}
		return mono;
	}
}
