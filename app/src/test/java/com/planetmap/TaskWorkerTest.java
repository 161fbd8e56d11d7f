package com.planetmap;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TaskWorkerTest
{
	private static final long TIMEOUT_S = 20;

	private final InMemoryTextureStore textures = new InMemoryTextureStore();
	private TaskWorker worker;

	@AfterEach
	void stopWorker() throws Exception
	{
		if (worker != null)
		{
			worker.close();
			worker.awaitTermination(TIMEOUT_S, TimeUnit.SECONDS);
		}
	}

	// --- Load jobs ---

	@Test
	void loadsImagesAndDetectsDiskInFirstImage(@TempDir Path tempDir) throws Exception
	{
		worker = TaskWorker.start(textures, new CpuProjectionRenderer());
		List<File> files = writeDiskSequence(tempDir, 3, 64, 64, 10);

		Job job = submitLoad(files, 64, 64, PixelFormat.MONO8);
		JobResult result = job.results.await(TIMEOUT_S, TimeUnit.SECONDS);

		JobResult.Success success = assertInstanceOf(JobResult.Success.class, result);
		assertEquals(32f, success.diskInfo().centerX(), 1e-3);
		assertEquals(32f, success.diskInfo().centerY(), 1e-3);
		assertEquals(20f, success.diskInfo().diameter());

		for (int handle : job.handles)
		{
			BufferedImage stored = textures.read(handle);
			assertNotEquals(0, stored.getRGB(32, 32) & 0xFFFFFF, "disk pixel");
			assertEquals(0, stored.getRGB(1, 1) & 0xFFFFFF, "background pixel");
		}
	}

	@Test
	void lastProgressMessageSurvivesUndrainedChannel(@TempDir Path tempDir) throws Exception
	{
		worker = TaskWorker.start(textures, new CpuProjectionRenderer());
		List<File> files = writeDiskSequence(tempDir, 4, 48, 48, 8);

		Job job = submitLoad(files, 48, 48, PixelFormat.MONO8);
		assertInstanceOf(JobResult.Success.class, job.results.await(TIMEOUT_S, TimeUnit.SECONDS));

		ProgressMessage last = job.progress.poll();
		assertNotNull(last);
		assertEquals("Loaded " + files.get(3) + ".", last.description());
		assertEquals(0.75f, last.fraction());
		assertNull(job.progress.poll());
	}

	@Test
	void dimensionMismatchFailsBatch(@TempDir Path tempDir) throws Exception
	{
		worker = TaskWorker.start(textures, new CpuProjectionRenderer());
		List<File> files = new ArrayList<>(writeDiskSequence(tempDir, 2, 64, 64, 10));
		File odd = tempDir.resolve("odd.png").toFile();
		ImageIO.write(grayDisk(64, 48, 32, 24, 10), "png", odd);
		files.add(odd);

		Job job = submitLoad(files, 64, 64, PixelFormat.MONO8);
		JobResult.Failed failed = assertInstanceOf(JobResult.Failed.class,
				job.results.await(TIMEOUT_S, TimeUnit.SECONDS));
		assertEquals("unexpected image dimensions (expected 64x64, found 64x48)", failed.message());
	}

	@Test
	void pixelFormatMismatchFailsBatch(@TempDir Path tempDir) throws Exception
	{
		worker = TaskWorker.start(textures, new CpuProjectionRenderer());
		List<File> files = new ArrayList<>(writeDiskSequence(tempDir, 1, 64, 64, 10));
		File color = tempDir.resolve("color.png").toFile();
		BufferedImage rgb = new BufferedImage(64, 64, BufferedImage.TYPE_INT_RGB);
		rgb.setRGB(32, 32, 0xFF8040);
		ImageIO.write(rgb, "png", color);
		files.add(color);

		Job job = submitLoad(files, 64, 64, PixelFormat.MONO8);
		JobResult.Failed failed = assertInstanceOf(JobResult.Failed.class,
				job.results.await(TIMEOUT_S, TimeUnit.SECONDS));
		assertEquals("unexpected pixel format (expected MONO8, found RGB8)", failed.message());
	}

	@Test
	void missingDiskFailsBatch(@TempDir Path tempDir) throws Exception
	{
		worker = TaskWorker.start(textures, new CpuProjectionRenderer());
		File blank = tempDir.resolve("blank.png").toFile();
		ImageIO.write(new BufferedImage(32, 32, BufferedImage.TYPE_BYTE_GRAY), "png", blank);

		Job job = submitLoad(List.of(blank), 32, 32, PixelFormat.MONO8);
		JobResult.Failed failed = assertInstanceOf(JobResult.Failed.class,
				job.results.await(TIMEOUT_S, TimeUnit.SECONDS));
		assertEquals("could not find planetary disk", failed.message());
	}

	@Test
	void unreadableFileFailsBatch(@TempDir Path tempDir) throws Exception
	{
		worker = TaskWorker.start(textures, new CpuProjectionRenderer());
		File missing = tempDir.resolve("missing.png").toFile();

		Job job = submitLoad(List.of(missing), 32, 32, PixelFormat.MONO8);
		JobResult.Failed failed = assertInstanceOf(JobResult.Failed.class,
				job.results.await(TIMEOUT_S, TimeUnit.SECONDS));
		assertTrue(failed.message().contains("missing.png"), failed.message());
	}

	// --- Cancellation ---

	@Test
	void cancelBeforeCompletionYieldsCancelled(@TempDir Path tempDir) throws Exception
	{
		CountDownLatch gate = new CountDownLatch(1);
		worker = TaskWorker.start(new GatedTextureStore(textures, gate), new CpuProjectionRenderer());
		List<File> files = writeDiskSequence(tempDir, 3, 32, 32, 6);

		Job job = submitLoad(files, 32, 32, PixelFormat.MONO8);
		worker.submit(new WorkerCommand.Cancel(job.results));
		gate.countDown();

		assertInstanceOf(JobResult.Cancelled.class, job.results.await(TIMEOUT_S, TimeUnit.SECONDS));
		assertNull(job.results.poll());
		assertTrue(worker.isAlive());
	}

	@Test
	void firstItemReportsZeroFraction(@TempDir Path tempDir) throws Exception
	{
		worker = TaskWorker.start(textures, new CpuProjectionRenderer());
		List<File> files = writeDiskSequence(tempDir, 1, 32, 32, 6);

		Job job = submitLoad(files, 32, 32, PixelFormat.MONO8);
		assertInstanceOf(JobResult.Success.class, job.results.await(TIMEOUT_S, TimeUnit.SECONDS));
		assertEquals(0f, job.progress.poll().fraction());
	}

	@Test
	void cancelQueuedBehindAnotherJobStillCancelsRunningJob(@TempDir Path tempDir) throws Exception
	{
		CountDownLatch gate = new CountDownLatch(1);
		worker = TaskWorker.start(new GatedTextureStore(textures, gate), new CpuProjectionRenderer());
		List<File> files = writeDiskSequence(tempDir, 2, 32, 32, 6);

		Job running = submitLoad(files, 32, 32, PixelFormat.MONO8);
		Job queued = submitLoad(files, 32, 32, PixelFormat.MONO8);
		worker.submit(new WorkerCommand.Cancel(running.results));
		gate.countDown();

		assertInstanceOf(JobResult.Cancelled.class, running.results.await(TIMEOUT_S, TimeUnit.SECONDS));
		assertInstanceOf(JobResult.Success.class, queued.results.await(TIMEOUT_S, TimeUnit.SECONDS));
		assertTrue(worker.isAlive());
	}

	@Test
	void cancelForQueuedJobWaitsForThatJob(@TempDir Path tempDir) throws Exception
	{
		CountDownLatch gate = new CountDownLatch(1);
		worker = TaskWorker.start(new GatedTextureStore(textures, gate), new CpuProjectionRenderer());
		List<File> files = writeDiskSequence(tempDir, 2, 32, 32, 6);

		Job running = submitLoad(files, 32, 32, PixelFormat.MONO8);
		Job queued = submitLoad(files, 32, 32, PixelFormat.MONO8);
		worker.submit(new WorkerCommand.Cancel(queued.results));
		gate.countDown();

		assertInstanceOf(JobResult.Success.class, running.results.await(TIMEOUT_S, TimeUnit.SECONDS));
		assertInstanceOf(JobResult.Cancelled.class, queued.results.await(TIMEOUT_S, TimeUnit.SECONDS));
		assertTrue(worker.isAlive());
	}

	@Test
	void staleCancelIsIgnored(@TempDir Path tempDir) throws Exception
	{
		worker = TaskWorker.start(textures, new CpuProjectionRenderer());
		List<File> files = writeDiskSequence(tempDir, 1, 32, 32, 6);

		Job first = submitLoad(files, 32, 32, PixelFormat.MONO8);
		assertInstanceOf(JobResult.Success.class, first.results.await(TIMEOUT_S, TimeUnit.SECONDS));
		worker.submit(new WorkerCommand.Cancel(first.results));

		Job second = submitLoad(files, 32, 32, PixelFormat.MONO8);
		assertInstanceOf(JobResult.Success.class, second.results.await(TIMEOUT_S, TimeUnit.SECONDS));
		assertTrue(worker.isAlive());
	}

	@Test
	void cancelWhileIdleTerminatesWorker() throws Exception
	{
		worker = TaskWorker.start(textures, new CpuProjectionRenderer());
		worker.submit(new WorkerCommand.Cancel(new ResultChannel()));

		assertTrue(worker.awaitTermination(TIMEOUT_S, TimeUnit.SECONDS));
		assertThrows(IllegalStateException.class,
				() -> worker.submit(new WorkerCommand.Cancel(new ResultChannel())));
	}

	@Test
	void closeStopsWorkerAndRejectsCommands() throws Exception
	{
		worker = TaskWorker.start(textures, new CpuProjectionRenderer());
		worker.close();
		assertThrows(IllegalStateException.class,
				() -> worker.submit(new WorkerCommand.Cancel(new ResultChannel())));
		assertTrue(worker.awaitTermination(TIMEOUT_S, TimeUnit.SECONDS));
	}

	// --- Projection jobs ---

	@Test
	void exportsNumberedFramesWithBounceBackCopies(@TempDir Path tempDir) throws Exception
	{
		worker = TaskWorker.start(textures, new CpuProjectionRenderer());
		List<Integer> handles = storeDisks(3, 40, 40, 20, 20, 10);
		Path outDir = tempDir.resolve("out");

		ProgressChannel progress = new ProgressChannel();
		ResultChannel results = new ResultChannel();
		worker.submit(new WorkerCommand.Projection(outDir.toFile(), handles, 40, 40, params(3, 20),
				5f, ProjectionType.EQUIRECTANGULAR, true, progress, results));

		JobResult.Success success = assertInstanceOf(JobResult.Success.class,
				results.await(TIMEOUT_S, TimeUnit.SECONDS));
		assertEquals(20f, success.diskInfo().diameter());

		for (int i = 1; i <= 5; i++)
		{
			File file = outDir.resolve(ExportNaming.outputFileName(i)).toFile();
			assertTrue(file.isFile(), file.getName());
			BufferedImage image = ImageIO.read(file);
			assertEquals(42, image.getWidth());
			assertEquals(32, image.getHeight());
		}
		assertFalse(Files.exists(outDir.resolve("output_00006.png")));

		// Frame 2 and its bounce copy are byte-identical
		assertArrayEquals(Files.readAllBytes(outDir.resolve("output_00002.png")),
				Files.readAllBytes(outDir.resolve("output_00004.png")));

		ProgressMessage last = progress.poll();
		assertEquals("Saved " + outDir.resolve("output_00003.png").toFile().getPath() + ".", last.description());
		assertEquals(2f / 3f, last.fraction());
	}

	@Test
	void exportsWithoutBounceBack(@TempDir Path tempDir) throws Exception
	{
		worker = TaskWorker.start(textures, new CpuProjectionRenderer());
		List<Integer> handles = storeDisks(2, 40, 40, 20, 20, 10);

		ResultChannel results = new ResultChannel();
		worker.submit(new WorkerCommand.Projection(tempDir.toFile(), handles, 40, 40, params(2, 20),
				0f, ProjectionType.LAMBERT_CYLINDRICAL_EQUAL_AREA, false, new ProgressChannel(), results));

		assertInstanceOf(JobResult.Success.class, results.await(TIMEOUT_S, TimeUnit.SECONDS));
		assertTrue(Files.exists(tempDir.resolve("output_00001.png")));
		assertTrue(Files.exists(tempDir.resolve("output_00002.png")));
		assertFalse(Files.exists(tempDir.resolve("output_00003.png")));

		BufferedImage image = ImageIO.read(tempDir.resolve("output_00001.png").toFile());
		assertEquals(32, image.getWidth());
		assertEquals(20, image.getHeight());
	}

	@Test
	void exportFailsWhenOutputIsNotADirectory(@TempDir Path tempDir) throws Exception
	{
		worker = TaskWorker.start(textures, new CpuProjectionRenderer());
		List<Integer> handles = storeDisks(1, 40, 40, 20, 20, 10);
		Path notADir = Files.writeString(tempDir.resolve("file.txt"), "x");

		ResultChannel results = new ResultChannel();
		worker.submit(new WorkerCommand.Projection(notADir.toFile(), handles, 40, 40, params(1, 20),
				0f, ProjectionType.EQUIRECTANGULAR, false, new ProgressChannel(), results));

		assertInstanceOf(JobResult.Failed.class, results.await(TIMEOUT_S, TimeUnit.SECONDS));
		assertTrue(worker.isAlive());
	}

	@Test
	void cancelledExportStopsWriting(@TempDir Path tempDir) throws Exception
	{
		CountDownLatch gate = new CountDownLatch(1);
		GatedRenderer renderer = new GatedRenderer(gate);
		worker = TaskWorker.start(textures, renderer);
		List<Integer> handles = storeDisks(4, 40, 40, 20, 20, 10);

		ResultChannel results = new ResultChannel();
		worker.submit(new WorkerCommand.Projection(tempDir.toFile(), handles, 40, 40, params(4, 20),
				0f, ProjectionType.EQUIRECTANGULAR, false, new ProgressChannel(), results));
		worker.submit(new WorkerCommand.Cancel(results));
		gate.countDown();

		assertInstanceOf(JobResult.Cancelled.class, results.await(TIMEOUT_S, TimeUnit.SECONDS));
		// The cancel is seen at the first or second checkpoint at the latest
		assertFalse(Files.exists(tempDir.resolve("output_00002.png")));
		assertFalse(Files.exists(tempDir.resolve("output_00004.png")));
	}

	// --- Helpers ---

	private record Job(List<Integer> handles, ProgressChannel progress, ResultChannel results) {}

	private Job submitLoad(List<File> files, int width, int height, PixelFormat format)
	{
		List<Integer> handles = new ArrayList<>();
		List<WorkerCommand.LoadImages.Item> items = new ArrayList<>();
		for (File file : files)
		{
			int handle = textures.allocate(width, height);
			handles.add(handle);
			items.add(new WorkerCommand.LoadImages.Item(handle, file));
		}
		Job job = new Job(handles, new ProgressChannel(), new ResultChannel());
		worker.submit(new WorkerCommand.LoadImages(width, height, format, items, job.progress, job.results));
		return job;
	}

	private List<Integer> storeDisks(int count, int w, int h, int cx, int cy, int r)
	{
		List<Integer> handles = new ArrayList<>();
		for (int i = 0; i < count; i++)
		{
			int handle = textures.allocate(w, h);
			textures.write(handle, grayDisk(w, h, cx, cy, r));
			handles.add(handle);
		}
		return handles;
	}

	private static SourceParameters params(int numImages, float diameter)
	{
		return new SourceParameters(numImages, 0, 0, Duration.ofSeconds(60), 20, 20, diameter,
				Planet.JUPITER.flattening(), Planet.JUPITER.siderealRotation());
	}

	private static List<File> writeDiskSequence(Path dir, int count, int w, int h, int r) throws Exception
	{
		List<File> files = new ArrayList<>();
		for (int i = 1; i <= count; i++)
		{
			File file = dir.resolve("frame_" + i + ".png").toFile();
			ImageIO.write(grayDisk(w, h, w / 2, h / 2, r), "png", file);
			files.add(file);
		}
		return files;
	}

	static BufferedImage grayDisk(int w, int h, int cx, int cy, int r)
	{
		BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
		WritableRaster raster = image.getRaster();
		for (int y = 0; y < h; y++)
		{
			for (int x = 0; x < w; x++)
			{
				int dx = x - cx;
				int dy = y - cy;
				raster.setSample(x, y, 0, dx * dx + dy * dy <= r * r ? 220 : 0);
			}
		}
		return image;
	}

	/** Holds the first write until the test opens the gate. */
	private static class GatedTextureStore implements TextureStore
	{
		private final TextureStore delegate;
		private final CountDownLatch gate;

		GatedTextureStore(TextureStore delegate, CountDownLatch gate)
		{
			this.delegate = delegate;
			this.gate = gate;
		}

		@Override
		public int allocate(int width, int height)
		{
			return delegate.allocate(width, height);
		}

		@Override
		public void write(int handle, BufferedImage pixels)
		{
			awaitGate(gate);
			delegate.write(handle, pixels);
		}

		@Override
		public BufferedImage read(int handle)
		{
			return delegate.read(handle);
		}

		@Override
		public void release(int handle)
		{
			delegate.release(handle);
		}
	}

	/** Holds the first render until the test opens the gate. */
	private static class GatedRenderer extends CpuProjectionRenderer
	{
		private final CountDownLatch gate;

		GatedRenderer(CountDownLatch gate)
		{
			this.gate = gate;
		}

		@Override
		public void render(BufferedImage source, int frameIndex, SourceParameters params, float rotationComp,
				ProjectionType type, BufferedImage target)
		{
			awaitGate(gate);
			super.render(source, frameIndex, params, rotationComp, type, target);
		}
	}

	private static void awaitGate(CountDownLatch gate)
	{
		try
		{
			assertTrue(gate.await(TIMEOUT_S, TimeUnit.SECONDS));
		}
		catch (InterruptedException e)
		{
			throw new IllegalStateException(e);
		}
	}
}
