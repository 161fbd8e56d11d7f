package com.planetmap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Runs load and projection jobs one at a time on a dedicated thread.
 *
 * The UI submits a command together with the job's progress and result channels
 * and polls those channels; nothing else is shared. Before each item a running job
 * looks for a {@link WorkerCommand.Cancel} addressed to it anywhere in the command queue.
 */
public class TaskWorker implements AutoCloseable
{
	private static final Logger logger = LoggerFactory.getLogger(TaskWorker.class);

	static final String THREAD_NAME = "planetmap-worker";

	// How often an idle worker re-checks whether it was closed
	private static final long IDLE_POLL_MS = 100;

	private final BlockingQueue<WorkerCommand> commands = new LinkedBlockingQueue<>();
	private final TextureStore textures;
	private final ProjectionRenderer renderer;
	private final Thread thread;
	private volatile boolean closed;

	private TaskWorker(TextureStore textures, ProjectionRenderer renderer)
	{
		this.textures = textures;
		this.renderer = renderer;
		this.thread = new Thread(this::run, THREAD_NAME);
		thread.setDaemon(true);
	}

	public static TaskWorker start(TextureStore textures, ProjectionRenderer renderer)
	{
		TaskWorker worker = new TaskWorker(textures, renderer);
		worker.thread.start();
		return worker;
	}

	public void submit(WorkerCommand command)
	{
		if (closed)
		{
			throw new IllegalStateException("worker command channel closed");
		}
		if (!thread.isAlive())
		{
			throw new IllegalStateException("worker thread has terminated");
		}
		commands.add(command);
	}

	/** {@code false} once the worker has exited, normally or because of a defect. */
	public boolean isAlive()
	{
		return thread.isAlive();
	}

	/**
	 * Disconnects the command channel. Commands already queued still run; the thread
	 * exits once the queue is empty.
	 */
	@Override
	public void close()
	{
		closed = true;
	}

	public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException
	{
		thread.join(unit.toMillis(timeout));
		return !thread.isAlive();
	}

	private void run()
	{
		logger.debug("Worker started");
		try
		{
			while (true)
			{
				WorkerCommand command = commands.poll(IDLE_POLL_MS, TimeUnit.MILLISECONDS);
				if (command == null)
				{
					if (closed) break;
					continue;
				}
				dispatch(command);
			}
			logger.debug("Worker stopped");
		}
		catch (InterruptedException e)
		{
			logger.warn("Worker interrupted, stopping");
			Thread.currentThread().interrupt();
		}
		catch (RuntimeException e)
		{
			logger.error("Worker terminated by a programming error", e);
			throw e;
		}
	}

	private void dispatch(WorkerCommand command)
	{
		if (command instanceof WorkerCommand.LoadImages load)
		{
			loadImages(load);
		}
		else if (command instanceof WorkerCommand.Projection projection)
		{
			project(projection);
		}
		else if (command instanceof WorkerCommand.Cancel cancel)
		{
			if (!cancel.job().isCompleted())
			{
				throw new IllegalStateException("cancel received while no job is running");
			}
			logger.debug("Ignoring cancel for a job that already finished");
		}
	}

	/**
	 * Removes the cancel addressed to {@code job} from the queue, wherever it sits, and
	 * drops stale cancels on the way. Other commands, and cancels for queued jobs, stay put.
	 */
	private boolean cancelRequested(ResultChannel job)
	{
		boolean requested = false;
		Iterator<WorkerCommand> it = commands.iterator();
		while (it.hasNext())
		{
			WorkerCommand command = it.next();
			if (command instanceof WorkerCommand.Cancel cancel)
			{
				if (cancel.job() == job)
				{
					it.remove();
					requested = true;
				}
				else if (cancel.job().isCompleted())
				{
					it.remove();
					logger.debug("Ignoring cancel for a job that already finished");
				}
			}
		}
		return requested;
	}

	private void loadImages(WorkerCommand.LoadImages task)
	{
		List<WorkerCommand.LoadImages.Item> items = task.items();
		ResultChannel results = task.results();
		logger.info("Loading {} images ({}x{}, {})", items.size(), task.width(), task.height(), task.pixelFormat());

		DiskInfo disk = null;
		for (int i = 0; i < items.size(); i++)
		{
			if (cancelRequested(results))
			{
				logger.info("Image loading cancelled after {} of {} images", i, items.size());
				results.complete(JobResult.CANCELLED);
				return;
			}

			WorkerCommand.LoadImages.Item item = items.get(i);
			BufferedImage image;
			try
			{
				image = ImageLoader.toRgb8(loadSingleImage(task, item.path()));
			}
			catch (IOException e)
			{
				logger.warn("Failed to load {}: {}", item.path(), e.getMessage());
				results.complete(new JobResult.Failed(e.getMessage()));
				return;
			}
			textures.write(item.handle(), image);

			if (i == 0)
			{
				try
				{
					disk = DiskDetector.detect(image);
					logger.info("Disk found in {}: {}", item.path().getName(), disk);
				}
				catch (DiskNotFoundException e)
				{
					logger.warn("No disk in {}: {}", item.path(), e.getMessage());
					results.complete(new JobResult.Failed("could not find planetary disk"));
					return;
				}
			}

			publish(task.progress(), "Loaded " + item.path() + ".", (float) i / items.size());
		}

		if (cancelRequested(results))
		{
			logger.info("Image loading cancelled after the last image");
			results.complete(JobResult.CANCELLED);
			return;
		}
		logger.info("Loaded {} images", items.size());
		results.complete(new JobResult.Success(disk));
	}

	private static BufferedImage loadSingleImage(WorkerCommand.LoadImages task, File path) throws IOException
	{
		BufferedImage image = ImageLoader.decode(path);
		if (image.getWidth() != task.width() || image.getHeight() != task.height())
		{
			throw new IOException(String.format("unexpected image dimensions (expected %dx%d, found %dx%d)",
					task.width(), task.height(), image.getWidth(), image.getHeight()));
		}
		PixelFormat format = PixelFormat.of(image);
		if (format != task.pixelFormat())
		{
			throw new IOException(String.format("unexpected pixel format (expected %s, found %s)",
					task.pixelFormat(), format));
		}
		logger.debug("Decoded {}", path);
		return image;
	}

	private void project(WorkerCommand.Projection task)
	{
		List<Integer> handles = task.sourceHandles();
		SourceParameters params = task.srcParams();
		ResultChannel results = task.results();
		int count = handles.size();

		Dimension size = ProjectionGeometry.size(params, task.rotationComp(), task.projectionType());
		logger.info("Exporting {} {} projections ({}x{}) to {}", count, task.projectionType(),
				size.width, size.height, task.outputDir());

		try
		{
			Files.createDirectories(task.outputDir().toPath());
		}
		catch (IOException e)
		{
			logger.warn("Cannot create {}", task.outputDir(), e);
			results.complete(new JobResult.Failed("cannot create output directory: " + e.getMessage()));
			return;
		}

		BufferedImage canvas = new BufferedImage(size.width, size.height, BufferedImage.TYPE_INT_RGB);
		for (int i = 0; i < count; i++)
		{
			if (cancelRequested(results))
			{
				logger.info("Export cancelled after {} of {} frames", i, count);
				results.complete(JobResult.CANCELLED);
				return;
			}

			BufferedImage source = textures.read(handles.get(i));
			renderer.render(source, i, params, task.rotationComp(), task.projectionType(), canvas);

			File output = new File(task.outputDir(), ExportNaming.outputFileName(i + 1));
			StringBuilder description = new StringBuilder("Saved ").append(output.getPath());
			try
			{
				writePng(canvas, output);
				if (task.bounceBack() && i < count - 1)
				{
					String copyName = ExportNaming.outputFileName(ExportNaming.bounceBackIndex(i, count));
					writePng(canvas, new File(task.outputDir(), copyName));
					description.append(", ").append(copyName);
				}
			}
			catch (IOException e)
			{
				logger.warn("Failed to write {}", output, e);
				results.complete(new JobResult.Failed("failed to save " + output.getName() + ": " + e.getMessage()));
				return;
			}

			publish(task.progress(), description.append('.').toString(), (float) i / count);
		}

		if (cancelRequested(results))
		{
			logger.info("Export cancelled after the last frame");
			results.complete(JobResult.CANCELLED);
			return;
		}
		logger.info("Exported {} frames", count);
		results.complete(new JobResult.Success(
				new DiskInfo(params.diskCenterX(), params.diskCenterY(), params.diskDiameter())));
	}

	private static void writePng(BufferedImage image, File file) throws IOException
	{
		if (!ImageIO.write(image, "png", file))
		{
			throw new IOException("no PNG writer available");
		}
	}

	private static void publish(ProgressChannel progress, String description, float fraction)
	{
		if (!progress.publish(new ProgressMessage(description, fraction)))
		{
			logger.trace("Progress consumer behind, replaced pending message");
		}
	}
}
