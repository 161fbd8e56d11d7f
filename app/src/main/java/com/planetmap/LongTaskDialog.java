package com.planetmap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.BorderFactory;
import javax.swing.JButton;
import javax.swing.JDialog;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.JProgressBar;
import javax.swing.Timer;
import java.awt.BorderLayout;
import java.awt.Dimension;
import java.awt.FlowLayout;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;

/**
 * Modal progress dialog for one worker job. Polls the job's channels on a Swing
 * timer and closes itself once the result arrives.
 */
class LongTaskDialog extends JDialog
{
	private static final Logger logger = LoggerFactory.getLogger(LongTaskDialog.class);

	private final TaskWorker worker;
	private final ProgressChannel progress;
	private final ResultChannel results;
	private final JLabel infoLabel = new JLabel(" ");
	private final JProgressBar progressBar = new JProgressBar(0, 1000);
	private final JButton cancelButton = new JButton("Cancel");
	private final Timer timer;
	private boolean cancelSent;
	private JobResult result;

	LongTaskDialog(JFrame parent, String title, TaskWorker worker, ProgressChannel progress,
			ResultChannel results, int pollIntervalMs)
	{
		super(parent, title, true);
		this.worker = worker;
		this.progress = progress;
		this.results = results;
		this.timer = new Timer(pollIntervalMs, e -> poll());

		setDefaultCloseOperation(DO_NOTHING_ON_CLOSE);
		addWindowListener(new WindowAdapter()
		{
			@Override
			public void windowClosing(WindowEvent e)
			{
				requestCancel();
			}
		});

		JPanel content = new JPanel(new BorderLayout(0, 8));
		content.setBorder(BorderFactory.createEmptyBorder(12, 12, 12, 12));
		infoLabel.setPreferredSize(new Dimension(480, infoLabel.getPreferredSize().height));
		content.add(infoLabel, BorderLayout.NORTH);
		content.add(progressBar, BorderLayout.CENTER);

		JPanel buttons = new JPanel(new FlowLayout(FlowLayout.RIGHT, 0, 0));
		cancelButton.addActionListener(e -> requestCancel());
		buttons.add(cancelButton);
		content.add(buttons, BorderLayout.SOUTH);

		setContentPane(content);
		pack();
		setLocationRelativeTo(parent);
	}

	/**
	 * Shows the dialog until the job finishes and returns its result.
	 */
	JobResult showDialog()
	{
		timer.start();
		setVisible(true);
		return result;
	}

	private void requestCancel()
	{
		if (cancelSent || result != null) return;
		cancelSent = true;
		cancelButton.setEnabled(false);
		infoLabel.setText("Cancelling...");
		worker.submit(new WorkerCommand.Cancel(results));
	}

	private void poll()
	{
		ProgressMessage message = progress.poll();
		if (message != null && !cancelSent)
		{
			infoLabel.setText(message.description());
			progressBar.setValue(Math.round(message.fraction() * progressBar.getMaximum()));
		}

		JobResult received = results.poll();
		if (received != null)
		{
			finish(received);
		}
		else if (!worker.isAlive())
		{
			logger.error("Worker stopped before finishing '{}'", getTitle());
			finish(new JobResult.Failed("background worker stopped unexpectedly"));
		}
	}

	private void finish(JobResult received)
	{
		result = received;
		timer.stop();
		progress.close();
		results.close();
		dispose();
	}
}
