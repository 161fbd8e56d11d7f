package com.planetmap;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Software projection: for every output pixel, the matching point of the flattened,
 * inclined and rolled globe is looked up in the source disk (nearest neighbour).
 */
public class CpuProjectionRenderer implements ProjectionRenderer
{
	@Override
	public void render(BufferedImage source, int frameIndex, SourceParameters params, float rotationComp,
			ProjectionType type, BufferedImage target)
	{
		int tw = target.getWidth();
		int th = target.getHeight();
		int[] out = new int[tw * th];
		Arrays.fill(out, 0xFF000000);

		double strip = ProjectionGeometry.stripWidth(params);
		double x0 = ProjectionGeometry.stripOffset(params, rotationComp, frameIndex);
		int firstColumn = Math.max(0, (int) Math.floor(x0));
		int lastColumn = Math.min(tw, (int) Math.ceil(x0 + strip));

		double inclination = Math.toRadians(params.inclination());
		double roll = Math.toRadians(params.roll());
		double sinI = Math.sin(inclination);
		double cosI = Math.cos(inclination);
		double sinR = Math.sin(roll);
		double cosR = Math.cos(roll);
		double polarScale = 1 - params.flattening();
		double radius = params.diskDiameter() / 2;
		int sw = source.getWidth();
		int sh = source.getHeight();

		for (int py = 0; py < th; py++)
		{
			double v = (py + 0.5) / th;
			double sinLat;
			if (type == ProjectionType.EQUIRECTANGULAR)
			{
				sinLat = Math.sin((0.5 - v) * Math.PI);
			}
			else
			{
				sinLat = 1 - 2 * v;
			}
			double cosLat = Math.sqrt(Math.max(0, 1 - sinLat * sinLat));

			for (int px = firstColumn; px < lastColumn; px++)
			{
				double u = (px + 0.5 - x0) / strip;
				if (u < 0 || u >= 1) continue;
				double lon = (u - 0.5) * Math.PI;

				// Globe point facing the viewer along +z
				double gx = cosLat * Math.sin(lon);
				double gy = sinLat * polarScale;
				double gz = cosLat * Math.cos(lon);

				double iy = gy * cosI - gz * sinI;
				double rx = gx * cosR - iy * sinR;
				double ry = gx * sinR + iy * cosR;

				int sx = (int) Math.floor(params.diskCenterX() + rx * radius);
				int sy = (int) Math.floor(params.diskCenterY() - ry * radius);
				if (sx >= 0 && sy >= 0 && sx < sw && sy < sh)
				{
					out[px + py * tw] = source.getRGB(sx, sy);
				}
			}
		}
		target.setRGB(0, 0, tw, th, out, 0, tw);
	}
}
