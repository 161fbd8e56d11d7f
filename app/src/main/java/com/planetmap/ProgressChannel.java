package com.planetmap;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Worker-to-UI progress updates with room for a single message. Publishing never
 * blocks: an undrained message is replaced by the newer one.
 */
public class ProgressChannel
{
	private final BlockingQueue<ProgressMessage> slot = new ArrayBlockingQueue<>(1);
	private volatile boolean closed;

	/**
	 * Returns {@code false} if an undrained message had to be discarded.
	 */
	public boolean publish(ProgressMessage message)
	{
		if (closed)
		{
			throw new IllegalStateException("progress channel closed by receiver");
		}
		boolean replaced = false;
		while (!slot.offer(message))
		{
			replaced |= slot.poll() != null;
		}
		return !replaced;
	}

	/** Non-blocking; returns {@code null} when nothing is pending. */
	public ProgressMessage poll()
	{
		return slot.poll();
	}

	public void close()
	{
		closed = true;
		slot.clear();
	}

	public boolean isClosed()
	{
		return closed;
	}
}
