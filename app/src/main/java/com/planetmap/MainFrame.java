package com.planetmap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.JButton;
import javax.swing.JFileChooser;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JOptionPane;
import javax.swing.JToolBar;
import javax.swing.SwingConstants;
import javax.swing.WindowConstants;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.BorderLayout;
import java.awt.Dimension;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class MainFrame extends JFrame
{
	private static final Logger logger = LoggerFactory.getLogger(MainFrame.class);

	private final AppConfig config;
	private final TextureStore textures = new InMemoryTextureStore();
	private final ProjectionRenderer renderer = new CpuProjectionRenderer();
	private final TaskWorker worker = TaskWorker.start(textures, renderer);
	private final ViewRegistry<ProjectionView> projectionViews = new ViewRegistry<>();
	private final JButton newProjectionButton = new JButton("New projection view");
	private final JLabel placeholder = new JLabel("Load an image sequence to begin", SwingConstants.CENTER);

	private SourceSession session;
	private SourcePanel sourcePanel;
	private File lastDirectory;
	private File lastExportDirectory;

	public MainFrame(AppConfig config)
	{
		super("PlanetMap");
		this.config = config;
		setDefaultCloseOperation(WindowConstants.EXIT_ON_CLOSE);
		setMinimumSize(new Dimension(900, 640));

		JToolBar toolBar = new JToolBar();
		toolBar.setFloatable(false);
		JButton loadButton = new JButton("Load images...");
		loadButton.addActionListener(e -> loadImages());
		toolBar.add(loadButton);
		newProjectionButton.setEnabled(false);
		newProjectionButton.addActionListener(e -> openProjectionView());
		toolBar.add(newProjectionButton);

		setLayout(new BorderLayout());
		add(toolBar, BorderLayout.NORTH);
		add(placeholder, BorderLayout.CENTER);

		addWindowListener(new WindowAdapter()
		{
			@Override
			public void windowClosing(WindowEvent e)
			{
				worker.close();
			}
		});

		pack();
		setLocationRelativeTo(null);
	}

	private void loadImages()
	{
		JFileChooser chooser = new JFileChooser();
		chooser.setFileSelectionMode(JFileChooser.FILES_ONLY);
		chooser.setMultiSelectionEnabled(true);
		chooser.setDialogTitle("Select image sequence");
		chooser.setFileFilter(new FileNameExtensionFilter(
				"Images (BMP, PNG, TIFF)", "bmp", "png", "tif", "tiff"));
		if (lastDirectory != null)
		{
			chooser.setCurrentDirectory(lastDirectory);
		}
		if (chooser.showOpenDialog(this) != JFileChooser.APPROVE_OPTION) return;

		File[] selectedFiles = chooser.getSelectedFiles();
		if (selectedFiles.length == 0) return;
		lastDirectory = selectedFiles[0].getParentFile();
		List<File> files = ImageLoader.sortForSequence(Arrays.asList(selectedFiles));

		ImageLoader.Metadata metadata;
		try
		{
			metadata = ImageLoader.probe(files.get(0));
		}
		catch (IOException ex)
		{
			logger.warn("Cannot read {}", files.get(0), ex);
			JOptionPane.showMessageDialog(this, "Failed to load images: " + ex.getMessage() + ".",
					"Load Error", JOptionPane.ERROR_MESSAGE);
			return;
		}

		List<Integer> handles = new ArrayList<>();
		List<WorkerCommand.LoadImages.Item> items = new ArrayList<>();
		for (File file : files)
		{
			int handle = textures.allocate(metadata.width(), metadata.height());
			handles.add(handle);
			items.add(new WorkerCommand.LoadImages.Item(handle, file));
		}

		ProgressChannel progress = new ProgressChannel();
		ResultChannel results = new ResultChannel();
		worker.submit(new WorkerCommand.LoadImages(metadata.width(), metadata.height(), metadata.pixelFormat(),
				items, progress, results));
		JobResult result = runLongTask("Image loading", progress, results);

		if (result instanceof JobResult.Success success)
		{
			onImagesLoaded(handles, metadata, success.diskInfo());
			return;
		}
		handles.forEach(textures::release);
		if (result instanceof JobResult.Failed failed)
		{
			JOptionPane.showMessageDialog(this, "Failed to load images: " + failed.message() + ".",
					"Load Error", JOptionPane.ERROR_MESSAGE);
		}
	}

	private void onImagesLoaded(List<Integer> handles, ImageLoader.Metadata metadata, DiskInfo disk)
	{
		if (session == null)
		{
			session = new SourceSession(handles, metadata.width(), metadata.height(), disk, config);
			sourcePanel = new SourcePanel(session, textures);
			remove(placeholder);
			add(sourcePanel, BorderLayout.CENTER);
			newProjectionButton.setEnabled(true);
			revalidate();
			repaint();
		}
		else
		{
			List<Integer> previous = session.setImages(handles, metadata.width(), metadata.height(), disk);
			previous.forEach(textures::release);
		}
	}

	private void openProjectionView()
	{
		if (session == null) return;

		ProjectionView view = new ProjectionView(session, textures, renderer, config.projectionType());
		int id = projectionViews.add(view);

		JFrame window = new JFrame("Projection " + id);
		window.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
		window.setContentPane(new ProjectionPanel(view, () -> exportProjection(view)));
		window.addWindowListener(new WindowAdapter()
		{
			@Override
			public void windowClosed(WindowEvent e)
			{
				projectionViews.remove(id);
				logger.debug("Projection view {} closed, {} open", id, projectionViews.size());
			}
		});
		window.setSize(720, 480);
		window.setLocationRelativeTo(this);
		window.setVisible(true);
	}

	private void exportProjection(ProjectionView view)
	{
		ExportDialog dialog = new ExportDialog(this, lastExportDirectory, session.isBounceBack());
		ExportDialog.Selection selection = dialog.showDialog();
		if (selection == null) return;
		lastExportDirectory = selection.outputDir();

		ProgressChannel progress = new ProgressChannel();
		ResultChannel results = new ResultChannel();
		worker.submit(new WorkerCommand.Projection(selection.outputDir(), session.handles(),
				session.imageWidth(), session.imageHeight(), view.sourceParameters(), view.rotationCompValue(),
				view.projectionType(), selection.bounceBack(), progress, results));
		JobResult result = runLongTask("Export", progress, results);

		if (result instanceof JobResult.Failed failed)
		{
			JOptionPane.showMessageDialog(this, "Export failed: " + failed.message() + ".",
					"Export Error", JOptionPane.ERROR_MESSAGE);
		}
	}

	private JobResult runLongTask(String title, ProgressChannel progress, ResultChannel results)
	{
		if (sourcePanel != null) sourcePanel.setPlaybackAllowed(false);
		try
		{
			LongTaskDialog dialog = new LongTaskDialog(this, title, worker, progress, results,
					config.pollIntervalMs());
			JobResult result = dialog.showDialog();
			logger.info("{} finished: {}", title, result);
			return result;
		}
		finally
		{
			if (sourcePanel != null) sourcePanel.setPlaybackAllowed(true);
		}
	}
}
