package com.ayjx.browser;

/** Rectangle in CSS pixels to capture. */
public record ClipRegion(double x, double y, double width, double height, double scale) {
}
