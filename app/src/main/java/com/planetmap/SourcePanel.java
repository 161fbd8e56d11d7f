package com.planetmap;

import javax.swing.BorderFactory;
import javax.swing.JButton;
import javax.swing.JCheckBox;
import javax.swing.JComboBox;
import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.JSeparator;
import javax.swing.JSlider;
import javax.swing.JSpinner;
import javax.swing.SpinnerNumberModel;
import javax.swing.Timer;
import java.awt.BasicStroke;
import java.awt.BorderLayout;
import java.awt.Color;
import java.awt.Component;
import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.GridBagConstraints;
import java.awt.GridBagLayout;
import java.awt.Insets;
import java.awt.RenderingHints;
import java.awt.geom.Ellipse2D;
import java.awt.image.BufferedImage;
import java.time.Duration;

/**
 * Shows the current source frame with the detected disk outline, plus playback and
 * source parameter controls.
 */
class SourcePanel extends JPanel
{
	private static final Color DISK_OUTLINE = new Color(255, 64, 64);
	private static final String CUSTOM_PLANET = "Custom";

	private final SourceSession session;
	private final TextureStore textures;

	// Held strongly; the session keeps only weak references
	private final Subscriber<CurrentImage> imageSubscriber = image -> onCurrentImage();
	private final Subscriber<SourceParameters> paramsSubscriber = params -> syncControls();

	private final ImageArea imageArea = new ImageArea();
	private final Timer playbackTimer = new Timer(10, e -> tick());
	private final JButton playButton = new JButton("Play");
	private final JCheckBox bounceBox = new JCheckBox("Bounce back");
	private final JSpinner fpsSpinner;
	private final JSlider frameSlider = new JSlider(0, 0, 0);
	private final JLabel frameLabel = new JLabel();
	private final JComboBox<Object> planetCombo;
	private final JSpinner flatteningSpinner;
	private final JSpinner rotationPeriodSpinner;
	private final JSpinner frameIntervalSpinner;
	private final JSpinner inclinationSpinner;
	private final JSpinner rollSpinner;
	private final JSpinner diameterSpinner;
	private final JSpinner centerXSpinner;
	private final JSpinner centerYSpinner;
	private boolean syncing;
	private boolean playbackAllowed = true;

	SourcePanel(SourceSession session, TextureStore textures)
	{
		super(new BorderLayout());
		this.session = session;
		this.textures = textures;

		JPanel controls = new JPanel(new GridBagLayout());
		controls.setBorder(BorderFactory.createEmptyBorder(8, 8, 8, 8));
		GridBagConstraints gbc = new GridBagConstraints();
		gbc.insets = new Insets(3, 4, 3, 4);
		gbc.fill = GridBagConstraints.HORIZONTAL;
		int row = 0;

		// Playback
		playButton.addActionListener(e -> {
			session.togglePlaying();
			syncPlayback();
		});
		addRow(controls, gbc, row++, playButton, bounceBox);
		bounceBox.addActionListener(e -> session.toggleBounceBack());

		fpsSpinner = new JSpinner(new SpinnerNumberModel(session.fps(), 1, 200, 1));
		fpsSpinner.addChangeListener(e -> session.setFps((Integer) fpsSpinner.getValue()));
		addRow(controls, gbc, row++, new JLabel("FPS:"), fpsSpinner);

		frameSlider.addChangeListener(e -> {
			if (!syncing) session.setImageIndex(frameSlider.getValue());
		});
		addRow(controls, gbc, row++, frameLabel, frameSlider);

		gbc.gridx = 0;
		gbc.gridy = row++;
		gbc.gridwidth = 2;
		controls.add(new JSeparator(), gbc);
		gbc.gridwidth = 1;

		// Planet
		Object[] planets = new Object[Planet.values().length + 1];
		System.arraycopy(Planet.values(), 0, planets, 0, Planet.values().length);
		planets[planets.length - 1] = CUSTOM_PLANET;
		planetCombo = new JComboBox<>(planets);
		planetCombo.addActionListener(e -> {
			if (syncing) return;
			Object selected = planetCombo.getSelectedItem();
			session.setPlanet(selected instanceof Planet p ? p : null);
			syncControls();
		});
		addRow(controls, gbc, row++, new JLabel("Planet:"), planetCombo);

		flatteningSpinner = new JSpinner(new SpinnerNumberModel(0.0, 0.0, 0.1, 0.0001));
		flatteningSpinner.setEditor(new JSpinner.NumberEditor(flatteningSpinner, "0.00000"));
		flatteningSpinner.addChangeListener(e -> {
			if (!syncing) session.setFlattening(((Number) flatteningSpinner.getValue()).floatValue());
		});
		addRow(controls, gbc, row++, new JLabel("Flattening:"), flatteningSpinner);

		rotationPeriodSpinner = new JSpinner(new SpinnerNumberModel(1, 1, 10_000_000, 60));
		rotationPeriodSpinner.setToolTipText("Sidereal rotation period in seconds");
		rotationPeriodSpinner.addChangeListener(e -> {
			if (!syncing) session.setSiderealRotationPeriod(
					Duration.ofSeconds((Integer) rotationPeriodSpinner.getValue()));
		});
		addRow(controls, gbc, row++, new JLabel("Rotation (s):"), rotationPeriodSpinner);

		frameIntervalSpinner = new JSpinner(new SpinnerNumberModel(1, 1, 86_400, 1));
		frameIntervalSpinner.setToolTipText("Time between consecutive captures in seconds");
		frameIntervalSpinner.addChangeListener(e -> {
			if (!syncing) session.setFrameInterval(Duration.ofSeconds((Integer) frameIntervalSpinner.getValue()));
		});
		addRow(controls, gbc, row++, new JLabel("Frame interval (s):"), frameIntervalSpinner);

		inclinationSpinner = new JSpinner(new SpinnerNumberModel(0.0, -90.0, 90.0, 0.1));
		inclinationSpinner.setToolTipText("Inclination of the rotation axis towards the observer");
		inclinationSpinner.addChangeListener(e -> {
			if (!syncing) session.setInclination(((Number) inclinationSpinner.getValue()).floatValue());
		});
		addRow(controls, gbc, row++, new JLabel("Inclination (°):"), inclinationSpinner);

		rollSpinner = new JSpinner(new SpinnerNumberModel(0.0, -180.0, 180.0, 0.1));
		rollSpinner.addChangeListener(e -> {
			if (!syncing) session.setRoll(((Number) rollSpinner.getValue()).floatValue());
		});
		addRow(controls, gbc, row++, new JLabel("Roll (°):"), rollSpinner);

		diameterSpinner = new JSpinner(new SpinnerNumberModel(
				(double) DiskInfo.MIN_DIAMETER, (double) DiskInfo.MIN_DIAMETER, 100_000.0, 0.5));
		diameterSpinner.addChangeListener(e -> {
			if (!syncing) session.setDiskDiameter(((Number) diameterSpinner.getValue()).floatValue());
		});
		addRow(controls, gbc, row++, new JLabel("Disk diameter:"), diameterSpinner);

		centerXSpinner = new JSpinner(new SpinnerNumberModel(0.0, -100_000.0, 100_000.0, 0.5));
		centerYSpinner = new JSpinner(new SpinnerNumberModel(0.0, -100_000.0, 100_000.0, 0.5));
		centerXSpinner.addChangeListener(e -> onCenterEdited());
		centerYSpinner.addChangeListener(e -> onCenterEdited());
		addRow(controls, gbc, row++, new JLabel("Disk center X:"), centerXSpinner);
		addRow(controls, gbc, row++, new JLabel("Disk center Y:"), centerYSpinner);

		gbc.gridy = row;
		gbc.weighty = 1;
		controls.add(new JPanel(), gbc);

		add(imageArea, BorderLayout.CENTER);
		add(controls, BorderLayout.EAST);

		session.subscribeCurrentImage(imageSubscriber);
		session.subscribeSourceParameters(paramsSubscriber);
		syncControls();
		onCurrentImage();
	}

	private static void addRow(JPanel panel, GridBagConstraints gbc, int row, Component left, Component right)
	{
		gbc.gridy = row;
		gbc.gridx = 0;
		gbc.weightx = 0;
		panel.add(left, gbc);
		gbc.gridx = 1;
		gbc.weightx = 1;
		panel.add(right, gbc);
	}

	/** Suspends playback while a long task runs. */
	void setPlaybackAllowed(boolean allowed)
	{
		playbackAllowed = allowed;
		syncPlayback();
	}

	private void tick()
	{
		if (playbackAllowed) session.tick();
	}

	private void onCenterEdited()
	{
		if (syncing) return;
		session.setDiskCenter(((Number) centerXSpinner.getValue()).floatValue(),
				((Number) centerYSpinner.getValue()).floatValue());
	}

	private void onCurrentImage()
	{
		syncing = true;
		try
		{
			CurrentImage current = session.currentImage();
			frameSlider.setValue(current.index());
			frameLabel.setText("Frame " + (current.index() + 1) + "/" + session.numImages());
		}
		finally
		{
			syncing = false;
		}
		imageArea.repaint();
	}

	private void syncPlayback()
	{
		playButton.setText(session.isPlaying() ? "Stop" : "Play");
		if (session.isPlaying() && playbackAllowed)
		{
			playbackTimer.start();
		}
		else
		{
			playbackTimer.stop();
		}
	}

	private void syncControls()
	{
		SourceParameters params = session.sourceParameters();
		syncing = true;
		try
		{
			bounceBox.setSelected(session.isBounceBack());
			frameSlider.setMaximum(params.numImages() - 1);
			Planet planet = session.planet();
			planetCombo.setSelectedItem(planet != null ? planet : CUSTOM_PLANET);
			flatteningSpinner.setValue((double) params.flattening());
			flatteningSpinner.setEnabled(planet == null);
			rotationPeriodSpinner.setValue((int) Math.max(1, params.siderealRotationPeriod().getSeconds()));
			rotationPeriodSpinner.setEnabled(planet == null);
			frameIntervalSpinner.setValue((int) Math.max(1, params.frameInterval().getSeconds()));
			inclinationSpinner.setValue((double) params.inclination());
			rollSpinner.setValue((double) params.roll());
			diameterSpinner.setValue((double) params.diskDiameter());
			centerXSpinner.setValue((double) params.diskCenterX());
			centerYSpinner.setValue((double) params.diskCenterY());
		}
		finally
		{
			syncing = false;
		}
		syncPlayback();
		onCurrentImage();
	}

	private class ImageArea extends JPanel
	{
		ImageArea()
		{
			setPreferredSize(new Dimension(640, 640));
		}

		@Override
		protected void paintComponent(Graphics g)
		{
			super.paintComponent(g);
			BufferedImage image = textures.read(session.currentImage().handle());
			Graphics2D g2 = (Graphics2D) g;

			double scale = Math.min((double) getWidth() / image.getWidth(), (double) getHeight() / image.getHeight());
			double drawX = (getWidth() - image.getWidth() * scale) / 2;
			double drawY = (getHeight() - image.getHeight() * scale) / 2;

			g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
			g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
			g2.drawImage(image, (int) drawX, (int) drawY,
					(int) Math.round(image.getWidth() * scale), (int) Math.round(image.getHeight() * scale), null);

			SourceParameters params = session.sourceParameters();
			double r = params.diskDiameter() / 2 * scale;
			double cx = drawX + (params.diskCenterX() + 0.5) * scale;
			double cy = drawY + (params.diskCenterY() + 0.5) * scale;
			g2.setColor(DISK_OUTLINE);
			g2.setStroke(new BasicStroke(1.5f));
			g2.draw(new Ellipse2D.Double(cx - r, cy - r, 2 * r, 2 * r));
		}
	}
}
