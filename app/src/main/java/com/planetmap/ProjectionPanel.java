package com.planetmap;

import javax.swing.JButton;
import javax.swing.JCheckBox;
import javax.swing.JComboBox;
import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.JScrollPane;
import javax.swing.JSpinner;
import javax.swing.SpinnerNumberModel;
import java.awt.BorderLayout;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.FlowLayout;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Controls and display of one {@link ProjectionView}.
 */
class ProjectionPanel extends JPanel
{
	private static final Color GRID_COLOR = new Color(255, 0, 0, 190);
	private static final int GRID_DIVISIONS = 4;

	private final ProjectionView view;
	private final ImageArea imageArea = new ImageArea();
	private final JSpinner rotationCompSpinner;
	private final JCheckBox autoBox = new JCheckBox("auto");
	private final JCheckBox gridBox = new JCheckBox("Grid");
	private boolean syncing;

	ProjectionPanel(ProjectionView view, Runnable onExport)
	{
		super(new BorderLayout());
		this.view = view;

		JPanel controls = new JPanel(new FlowLayout(FlowLayout.LEFT, 6, 4));
		JButton exportButton = new JButton("Export...");
		exportButton.addActionListener(e -> onExport.run());
		controls.add(exportButton);

		JComboBox<ProjectionType> typeCombo = new JComboBox<>(ProjectionType.values());
		typeCombo.setSelectedItem(view.projectionType());
		typeCombo.addActionListener(e -> view.setProjectionType((ProjectionType) typeCombo.getSelectedItem()));
		controls.add(typeCombo);

		controls.add(new JLabel("Rotation comp.:"));
		rotationCompSpinner = new JSpinner(new SpinnerNumberModel(0.0, 0.0, 1000.0, 0.1));
		rotationCompSpinner.setToolTipText("Planet rotation compensation in pixels per frame");
		rotationCompSpinner.addChangeListener(e -> {
			if (syncing || autoBox.isSelected()) return;
			view.setRotationComp(((Number) rotationCompSpinner.getValue()).floatValue());
		});
		controls.add(rotationCompSpinner);

		autoBox.addActionListener(e -> {
			view.setRotationComp(autoBox.isSelected() ? null : view.rotationCompValue());
		});
		controls.add(autoBox);

		gridBox.addActionListener(e -> imageArea.repaint());
		controls.add(gridBox);

		add(controls, BorderLayout.NORTH);
		add(new JScrollPane(imageArea), BorderLayout.CENTER);

		view.setOnUpdate(this::onViewUpdated);
		onViewUpdated();
	}

	private void onViewUpdated()
	{
		syncing = true;
		try
		{
			rotationCompSpinner.setValue((double) view.rotationCompValue());
			rotationCompSpinner.setEnabled(!view.isRotationCompAutomatic());
			autoBox.setSelected(view.isRotationCompAutomatic());
		}
		finally
		{
			syncing = false;
		}
		BufferedImage image = view.projection();
		imageArea.setPreferredSize(new Dimension(image.getWidth(), image.getHeight()));
		imageArea.revalidate();
		imageArea.repaint();
	}

	private class ImageArea extends JPanel
	{
		@Override
		protected void paintComponent(Graphics g)
		{
			super.paintComponent(g);
			BufferedImage image = view.projection();
			if (image == null) return;

			Graphics2D g2 = (Graphics2D) g;
			double scale = Math.min((double) getWidth() / image.getWidth(), (double) getHeight() / image.getHeight());
			int drawW = (int) Math.round(image.getWidth() * scale);
			int drawH = (int) Math.round(image.getHeight() * scale);
			int drawX = (getWidth() - drawW) / 2;
			int drawY = (getHeight() - drawH) / 2;

			g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
			g2.drawImage(image, drawX, drawY, drawW, drawH, null);

			if (gridBox.isSelected())
			{
				g2.setColor(GRID_COLOR);
				for (int i = 1; i < GRID_DIVISIONS; i++)
				{
					int y = drawY + drawH * i / GRID_DIVISIONS;
					g2.drawLine(drawX, y, drawX + drawW, y);
				}
				// Vertical lines follow the strip width so they mark the same longitudes in every frame
				double step = ProjectionGeometry.stripWidth(view.sourceParameters()) * scale / GRID_DIVISIONS;
				for (double x = drawX + drawW - step; x > drawX; x -= step)
				{
					g2.drawLine((int) x, drawY, (int) x, drawY + drawH);
				}
			}
		}
	}
}
