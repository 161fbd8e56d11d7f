package com.planetmap;

/**
 * The frame a session currently shows: its position in the sequence and its texture handle.
 */
public record CurrentImage(int index, int handle) {}
