package com.planetmap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.LongSupplier;

/**
 * The loaded image sequence and everything derived from it: the current frame,
 * source parameters, playback. Lives on the UI thread only.
 *
 * Changes are broadcast to weakly held subscribers; parameter changes always send
 * the full {@link SourceParameters} snapshot.
 */
public class SourceSession
{
	private static final Logger logger = LoggerFactory.getLogger(SourceSession.class);

	private final ChangePropagator<CurrentImage> currentImageSubscribers = new ChangePropagator<>();
	private final ChangePropagator<SourceParameters> paramsSubscribers = new ChangePropagator<>();
	private final PlaybackState playback;
	private final LongSupplier clock;

	private List<Integer> handles;
	private int imageWidth;
	private int imageHeight;
	private int currentIndex;
	private SourceParameters params;
	private Planet planet;

	public SourceSession(List<Integer> handles, int imageWidth, int imageHeight, DiskInfo disk, AppConfig config)
	{
		this(handles, imageWidth, imageHeight, disk, config, System::nanoTime);
	}

	SourceSession(List<Integer> handles, int imageWidth, int imageHeight, DiskInfo disk, AppConfig config,
			LongSupplier clock)
	{
		this.clock = clock;
		this.playback = new PlaybackState(config.fps(), config.bounceBack());
		this.planet = config.planet();
		Planet initial = planet != null ? planet : Planet.JUPITER;
		this.params = SourceParameters.initial(handles.size(), disk, initial, config.frameInterval());
		replaceImages(handles, imageWidth, imageHeight);
	}

	private void replaceImages(List<Integer> newHandles, int width, int height)
	{
		if (newHandles.isEmpty())
		{
			throw new IllegalArgumentException("a session needs at least one image");
		}
		handles = List.copyOf(newHandles);
		imageWidth = width;
		imageHeight = height;
		currentIndex = 0;
	}

	/**
	 * Replaces the whole sequence after a successful load. Returns the handles of the
	 * previous sequence so the caller can release them.
	 */
	public List<Integer> setImages(List<Integer> newHandles, int width, int height, DiskInfo disk)
	{
		List<Integer> previous = handles;
		replaceImages(newHandles, width, height);
		params = params.withNumImages(handles.size()).withDisk(disk);
		logger.info("Sequence replaced: {} images {}x{}, {}", handles.size(), width, height, disk);

		currentImageSubscribers.notifySubscribers(currentImage());
		paramsSubscribers.notifySubscribers(params);
		playback.reset(currentIndex, clock.getAsLong());
		return previous;
	}

	public void subscribeCurrentImage(Subscriber<CurrentImage> subscriber)
	{
		currentImageSubscribers.add(subscriber);
	}

	public void subscribeSourceParameters(Subscriber<SourceParameters> subscriber)
	{
		paramsSubscribers.add(subscriber);
	}

	public List<Integer> handles()
	{
		return handles;
	}

	public int imageWidth()
	{
		return imageWidth;
	}

	public int imageHeight()
	{
		return imageHeight;
	}

	public int numImages()
	{
		return handles.size();
	}

	public CurrentImage currentImage()
	{
		return new CurrentImage(currentIndex, handles.get(currentIndex));
	}

	/** Out-of-range indices are ignored. */
	public void setImageIndex(int index)
	{
		if (index < 0 || index >= handles.size()) return;
		currentIndex = index;
		currentImageSubscribers.notifySubscribers(currentImage());
	}

	public SourceParameters sourceParameters()
	{
		return params;
	}

	private void updateParams(SourceParameters updated)
	{
		params = updated;
		paramsSubscribers.notifySubscribers(params);
	}

	public void setInclination(float degrees)
	{
		updateParams(params.withInclination(degrees));
	}

	public void setRoll(float degrees)
	{
		updateParams(params.withRoll(degrees));
	}

	public void setFrameInterval(Duration interval)
	{
		if (interval.isNegative() || interval.isZero())
		{
			throw new IllegalArgumentException("frame interval must be positive: " + interval);
		}
		updateParams(params.withFrameInterval(interval));
	}

	public void setDiskCenter(float x, float y)
	{
		updateParams(params.withDiskCenter(x, y));
	}

	public void setDiskDiameter(float diameter)
	{
		updateParams(params.withDiskDiameter(diameter));
	}

	/** {@code null} while flattening and rotation period are custom values. */
	public Planet planet()
	{
		return planet;
	}

	/**
	 * Selecting a known planet overwrites flattening and rotation period; {@code null}
	 * keeps the current values and makes them editable.
	 */
	public void setPlanet(Planet planet)
	{
		this.planet = planet;
		if (planet != null)
		{
			updateParams(params.withFlattening(planet.flattening())
					.withSiderealRotationPeriod(planet.siderealRotation()));
		}
	}

	public void setFlattening(float flattening)
	{
		requireCustomPlanet();
		updateParams(params.withFlattening(flattening));
	}

	public void setSiderealRotationPeriod(Duration period)
	{
		requireCustomPlanet();
		if (period.isNegative() || period.isZero())
		{
			throw new IllegalArgumentException("rotation period must be positive: " + period);
		}
		updateParams(params.withSiderealRotationPeriod(period));
	}

	private void requireCustomPlanet()
	{
		if (planet != null)
		{
			throw new IllegalStateException("cannot change " + planet + "'s physical parameters");
		}
	}

	public boolean isPlaying()
	{
		return playback.isEnabled();
	}

	public void togglePlaying()
	{
		playback.toggle(currentIndex, clock.getAsLong());
	}

	public int fps()
	{
		return playback.fps();
	}

	public void setFps(int fps)
	{
		playback.setFps(fps, currentIndex, clock.getAsLong());
	}

	public boolean isBounceBack()
	{
		return playback.isBounceBack();
	}

	public void toggleBounceBack()
	{
		playback.toggleBounceBack(currentIndex, clock.getAsLong());
	}

	/**
	 * Advances playback to the frame due now. Returns {@code true} if the current
	 * frame changed (subscribers have been notified).
	 */
	public boolean tick()
	{
		OptionalInt frame = playback.poll(clock.getAsLong(), handles.size());
		if (frame.isEmpty() || frame.getAsInt() == currentIndex) return false;
		currentIndex = frame.getAsInt();
		currentImageSubscribers.notifySubscribers(currentImage());
		return true;
	}
}
