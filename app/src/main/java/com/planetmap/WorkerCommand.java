package com.planetmap;

import java.io.File;
import java.util.List;
import java.util.Objects;

/**
 * Messages accepted by {@link TaskWorker}. Each job brings its own progress and result channels.
 */
public sealed interface WorkerCommand
{
	/** Cancels the running job whose results go to {@code job}. */
	record Cancel(ResultChannel job) implements WorkerCommand
	{
		public Cancel
		{
			Objects.requireNonNull(job, "job");
		}
	}

	/**
	 * Decodes {@code items} into the given texture handles. Every image must be
	 * {@code width}x{@code height} in {@code pixelFormat}.
	 */
	record LoadImages(
			int width,
			int height,
			PixelFormat pixelFormat,
			List<Item> items,
			ProgressChannel progress,
			ResultChannel results) implements WorkerCommand
	{
		public record Item(int handle, File path) {}

		public LoadImages
		{
			Objects.requireNonNull(pixelFormat, "pixelFormat");
			Objects.requireNonNull(progress, "progress");
			Objects.requireNonNull(results, "results");
			if (items.isEmpty())
			{
				throw new IllegalArgumentException("nothing to load");
			}
			items = List.copyOf(items);
		}
	}

	record Projection(
			File outputDir,
			List<Integer> sourceHandles,
			int imageWidth,
			int imageHeight,
			SourceParameters srcParams,
			float rotationComp,
			ProjectionType projectionType,
			boolean bounceBack,
			ProgressChannel progress,
			ResultChannel results) implements WorkerCommand
	{
		public Projection
		{
			Objects.requireNonNull(outputDir, "outputDir");
			Objects.requireNonNull(srcParams, "srcParams");
			Objects.requireNonNull(projectionType, "projectionType");
			Objects.requireNonNull(progress, "progress");
			Objects.requireNonNull(results, "results");
			if (sourceHandles.isEmpty())
			{
				throw new IllegalArgumentException("nothing to project");
			}
			if (srcParams.diskDiameter() < DiskInfo.MIN_DIAMETER)
			{
				throw new IllegalArgumentException("disk diameter too small: " + srcParams.diskDiameter());
			}
			sourceHandles = List.copyOf(sourceHandles);
		}
	}
}
