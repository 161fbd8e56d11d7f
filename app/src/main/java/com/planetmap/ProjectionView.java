package com.planetmap;

import java.awt.Dimension;
import java.awt.image.BufferedImage;

/**
 * A dependent view showing the current frame as a map projection. It follows the
 * session's current image and source parameters through its two subscribers, which
 * it holds strongly; the session only holds them weakly.
 */
public class ProjectionView
{
	private final TextureStore textures;
	private final ProjectionRenderer renderer;

	private final Subscriber<CurrentImage> imageSubscriber = this::onCurrentImage;
	private final Subscriber<SourceParameters> paramsSubscriber = this::onSourceParameters;

	private CurrentImage sourceImage;
	private SourceParameters params;
	private ProjectionType type;
	private Float rotationComp;       // null = automatic
	private BufferedImage projection;
	private Runnable onUpdate = () -> {};

	public ProjectionView(SourceSession session, TextureStore textures, ProjectionRenderer renderer,
			ProjectionType type)
	{
		this.textures = textures;
		this.renderer = renderer;
		this.type = type;
		this.sourceImage = session.currentImage();
		this.params = session.sourceParameters();
		this.rotationComp = 0f;
		session.subscribeCurrentImage(imageSubscriber);
		session.subscribeSourceParameters(paramsSubscriber);
		rerender();
	}

	/** Runs after every re-render; used by the panel to repaint. */
	public void setOnUpdate(Runnable onUpdate)
	{
		this.onUpdate = onUpdate;
	}

	private void onCurrentImage(CurrentImage image)
	{
		sourceImage = image;
		rerender();
	}

	private void onSourceParameters(SourceParameters value)
	{
		params = value;
		rerender();
	}

	public BufferedImage projection()
	{
		return projection;
	}

	public SourceParameters sourceParameters()
	{
		return params;
	}

	public CurrentImage sourceImage()
	{
		return sourceImage;
	}

	public ProjectionType projectionType()
	{
		return type;
	}

	public void setProjectionType(ProjectionType type)
	{
		this.type = type;
		rerender();
	}

	public boolean isRotationCompAutomatic()
	{
		return rotationComp == null;
	}

	/** Pixels between consecutive frames' strips, computed when automatic. */
	public float rotationCompValue()
	{
		return rotationComp != null ? rotationComp : ProjectionGeometry.automaticRotationComp(params);
	}

	/** {@code null} selects automatic compensation. */
	public void setRotationComp(Float value)
	{
		if (value != null && value < 0)
		{
			throw new IllegalArgumentException("rotation compensation cannot be negative: " + value);
		}
		rotationComp = value;
		rerender();
	}

	private void rerender()
	{
		Dimension size = ProjectionGeometry.size(params, rotationCompValue(), type);
		if (projection == null || projection.getWidth() != size.width || projection.getHeight() != size.height)
		{
			projection = new BufferedImage(Math.max(1, size.width), Math.max(1, size.height), BufferedImage.TYPE_INT_RGB);
		}
		renderer.render(textures.read(sourceImage.handle()), sourceImage.index(), params, rotationCompValue(),
				type, projection);
		onUpdate.run();
	}
}
