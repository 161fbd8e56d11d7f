package com.planetmap;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ExportNamingTest
{

	@Test
	void namesAreZeroPaddedToFiveDigits()
	{
		assertEquals("output_00001.png", ExportNaming.outputFileName(1));
		assertEquals("output_00042.png", ExportNaming.outputFileName(42));
		assertEquals("output_99999.png", ExportNaming.outputFileName(99_999));
	}

	@ParameterizedTest
	@CsvSource({
			// frame index, count, copy index
			"0, 3, 5",
			"1, 3, 4",
			"0, 10, 19",
			"8, 10, 11",
	})
	void bounceBackCopiesMirrorTheSequence(int frameIndex, int count, int expected)
	{
		assertEquals(expected, ExportNaming.bounceBackIndex(frameIndex, count));
	}

	@Test
	void copiesFillTheGapAfterTheLastFrame()
	{
		// 5 frames: 1 2 3 4 5 then copies 6..9 of frames 4 3 2 1
		int count = 5;
		for (int i = 0; i < count - 1; i++)
		{
			int copy = ExportNaming.bounceBackIndex(i, count);
			assertTrue(copy > count && copy <= 2 * count - 1);
		}
		assertEquals(2 * count - 1, ExportNaming.bounceBackIndex(0, count));
		assertEquals(count + 1, ExportNaming.bounceBackIndex(count - 2, count));
	}
}
