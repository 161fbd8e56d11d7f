package com.planetmap;

import java.util.OptionalInt;

/**
 * Per-view playback state. Time is passed in as {@link System#nanoTime()} readings.
 */
public class PlaybackState
{
	private boolean enabled;
	private long startNanos;
	private int startFrame = -1;     // -1 while stopped
	private Direction initialDirection;
	private Direction currentDirection;
	private int fps;

	public PlaybackState(int fps, boolean bounceBack)
	{
		if (fps <= 0) throw new IllegalArgumentException("fps must be positive: " + fps);
		this.fps = fps;
		if (bounceBack)
		{
			initialDirection = Direction.FORWARD;
			currentDirection = Direction.FORWARD;
		}
	}

	public boolean isEnabled()
	{
		return enabled;
	}

	public int fps()
	{
		return fps;
	}

	public boolean isBounceBack()
	{
		return initialDirection != null;
	}

	public Direction currentDirection()
	{
		return currentDirection;
	}

	public void toggle(int currentFrame, long nowNanos)
	{
		enabled = !enabled;
		if (enabled)
		{
			reset(currentFrame, nowNanos);
		}
		else
		{
			startFrame = -1;
		}
	}

	/**
	 * Restarts the time base from the frame currently shown, keeping the current direction.
	 */
	public void reset(int currentFrame, long nowNanos)
	{
		startNanos = nowNanos;
		startFrame = currentFrame;
		initialDirection = currentDirection;
	}

	public void setFps(int fps, int currentFrame, long nowNanos)
	{
		if (fps <= 0) throw new IllegalArgumentException("fps must be positive: " + fps);
		this.fps = fps;
		if (enabled) reset(currentFrame, nowNanos);
	}

	public void toggleBounceBack(int currentFrame, long nowNanos)
	{
		if (initialDirection == null)
		{
			initialDirection = Direction.FORWARD;
			currentDirection = Direction.FORWARD;
		}
		else
		{
			initialDirection = null;
			currentDirection = null;
		}
		if (enabled) reset(currentFrame, nowNanos);
	}

	/**
	 * Returns the frame to show at {@code nowNanos}, or empty while playback is stopped.
	 */
	public OptionalInt poll(long nowNanos, int total)
	{
		if (!enabled) return OptionalInt.empty();

		double seconds = (nowNanos - startNanos) / 1e9;
		int elapsedFrames = (int) (Math.max(0, seconds) * fps);
		FrameSequencer.Step step = FrameSequencer.advance(
				startFrame, elapsedFrames, total, initialDirection, currentDirection);
		currentDirection = step.direction();
		return OptionalInt.of(step.frame());
	}
}
