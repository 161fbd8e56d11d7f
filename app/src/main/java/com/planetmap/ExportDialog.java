package com.planetmap;

import javax.swing.BorderFactory;
import javax.swing.JButton;
import javax.swing.JCheckBox;
import javax.swing.JDialog;
import javax.swing.JFileChooser;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JOptionPane;
import javax.swing.JPanel;
import javax.swing.JTextField;
import java.awt.BorderLayout;
import java.awt.FlowLayout;
import java.awt.GridBagConstraints;
import java.awt.GridBagLayout;
import java.awt.Insets;
import java.io.File;

/**
 * Asks for the output directory of a projection export and whether to append the
 * frames in reverse order.
 */
class ExportDialog extends JDialog
{
	record Selection(File outputDir, boolean bounceBack) {}

	private final JTextField dirField = new JTextField(32);
	private final JCheckBox bounceBox = new JCheckBox("Bounce back (append frames in reverse order)");
	private boolean confirmed;

	ExportDialog(JFrame parent, File initialDir, boolean bounceBack)
	{
		super(parent, "Export projections", true);
		setDefaultCloseOperation(DISPOSE_ON_CLOSE);

		if (initialDir != null) dirField.setText(initialDir.getPath());
		bounceBox.setSelected(bounceBack);

		JPanel form = new JPanel(new GridBagLayout());
		form.setBorder(BorderFactory.createEmptyBorder(8, 8, 8, 8));
		GridBagConstraints gbc = new GridBagConstraints();
		gbc.insets = new Insets(4, 4, 4, 4);
		gbc.fill = GridBagConstraints.HORIZONTAL;

		gbc.gridx = 0;
		gbc.gridy = 0;
		form.add(new JLabel("Output folder:"), gbc);
		gbc.gridx = 1;
		gbc.weightx = 1;
		form.add(dirField, gbc);
		gbc.gridx = 2;
		gbc.weightx = 0;
		JButton browse = new JButton("Browse...");
		browse.addActionListener(e -> browse());
		form.add(browse, gbc);

		gbc.gridx = 0;
		gbc.gridy = 1;
		gbc.gridwidth = 3;
		form.add(bounceBox, gbc);

		JPanel okCancel = new JPanel(new FlowLayout(FlowLayout.RIGHT, 8, 4));
		JButton ok = new JButton("Export");
		JButton cancel = new JButton("Cancel");
		ok.addActionListener(e -> confirm());
		cancel.addActionListener(e -> dispose());
		okCancel.add(ok);
		okCancel.add(cancel);

		setLayout(new BorderLayout());
		add(form, BorderLayout.CENTER);
		add(okCancel, BorderLayout.SOUTH);
		getRootPane().setDefaultButton(ok);
		pack();
		setLocationRelativeTo(parent);
	}

	private void browse()
	{
		JFileChooser chooser = new JFileChooser();
		chooser.setFileSelectionMode(JFileChooser.DIRECTORIES_ONLY);
		chooser.setDialogTitle("Output folder");
		if (!dirField.getText().isBlank())
		{
			chooser.setCurrentDirectory(new File(dirField.getText().trim()));
		}
		if (chooser.showOpenDialog(this) == JFileChooser.APPROVE_OPTION)
		{
			dirField.setText(chooser.getSelectedFile().getPath());
		}
	}

	private void confirm()
	{
		if (dirField.getText().isBlank())
		{
			JOptionPane.showMessageDialog(this, "Choose an output folder.", "Export", JOptionPane.WARNING_MESSAGE);
			return;
		}
		confirmed = true;
		dispose();
	}

	/** Returns {@code null} if the user cancelled. */
	Selection showDialog()
	{
		setVisible(true);
		if (!confirmed) return null;
		return new Selection(new File(dirField.getText().trim()), bounceBox.isSelected());
	}
}
