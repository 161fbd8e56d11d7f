package com.planetmap;

import com.formdev.flatlaf.themes.FlatMacDarkLaf;

import javax.swing.SwingUtilities;

public class PlanetMapApp
{

	public static void main(String[] args)
	{
		FlatMacDarkLaf.setup();
		AppConfig config = AppConfig.load();
		SwingUtilities.invokeLater(() -> {
			MainFrame frame = new MainFrame(config);
			frame.setVisible(true);
		});
	}
}
