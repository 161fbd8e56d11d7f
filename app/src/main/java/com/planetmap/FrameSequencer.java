package com.planetmap;

/**
 * Maps "frames elapsed since playback started" to a frame index, for plain
 * cyclic playback and for bounce-back playback (0, 1, .. n-1, n-2, .. 1, 0, 1, ..).
 */
public class FrameSequencer
{
	public record Step(int frame, Direction direction) {}

	private FrameSequencer() {}

	/**
	 * @param startFrame frame shown when playback (re)started
	 * @param elapsedFrames whole frames elapsed since then
	 * @param total number of frames in the sequence
	 * @param initialDirection direction at the start, or {@code null} for cyclic playback
	 * @param currentDirection direction before this step; returned as-is when it does not change
	 */
	public static Step advance(int startFrame, int elapsedFrames, int total,
							   Direction initialDirection, Direction currentDirection)
	{
		if (total <= 0)
		{
			throw new IllegalArgumentException("sequence is empty");
		}
		if (total == 1) return new Step(0, currentDirection);

		if (initialDirection == null)
		{
			return new Step((startFrame + elapsedFrames) % total, currentDirection);
		}

		int period = 2 * total - 2;
		if (initialDirection == Direction.FORWARD)
		{
			int m = (startFrame + elapsedFrames) % period;
			if (m < total)
			{
				return new Step(m, Direction.FORWARD);
			}
			return new Step(period - m, Direction.BACKWARD);
		}

		// Moving backward: measure the phase from the mirrored start
		int correctedStart = total - startFrame - 2;
		int m = (correctedStart + elapsedFrames) % period;
		if (m < total - 2)
		{
			return new Step(total - 2 - m, Direction.BACKWARD);
		}
		return new Step(m - (total - 2), Direction.FORWARD);
	}
}
