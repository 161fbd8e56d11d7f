package com.planetmap;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Carries the single {@link JobResult} of one job from the worker to the UI.
 */
public class ResultChannel
{
	private final BlockingQueue<JobResult> queue = new LinkedBlockingQueue<>();
	private final AtomicBoolean completed = new AtomicBoolean();
	private volatile boolean closed;

	public void complete(JobResult result)
	{
		if (closed)
		{
			throw new IllegalStateException("result channel closed by receiver");
		}
		if (!completed.compareAndSet(false, true))
		{
			throw new IllegalStateException("job already completed, rejected " + result);
		}
		queue.add(result);
	}

	/** Non-blocking; returns {@code null} until the result arrives, and after it was taken. */
	public JobResult poll()
	{
		return queue.poll();
	}

	public JobResult await(long timeout, TimeUnit unit) throws InterruptedException
	{
		return queue.poll(timeout, unit);
	}

	/** {@code true} once the worker has sent the result, whether or not it was taken. */
	public boolean isCompleted()
	{
		return completed.get();
	}

	public void close()
	{
		closed = true;
	}
}
