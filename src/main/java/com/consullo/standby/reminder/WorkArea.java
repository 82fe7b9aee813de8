package com.consullo.standby.reminder;

/**
 * Usable area of a display (excluding task bars and docks), in physical pixels.
 *
 * @param x left edge
 * @param y top edge
 * @param width width
 * @param height height
 * @since 1.0
 */
public record WorkArea(int x, int y, int width, int height) {
}
