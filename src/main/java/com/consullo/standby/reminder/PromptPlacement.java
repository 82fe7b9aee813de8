package com.consullo.standby.reminder;

/**
 * Position and size at which the prompt window should appear.
 *
 * @param x left edge
 * @param y top edge
 * @param width width
 * @param height height
 * @since 1.0
 */
public record PromptPlacement(int x, int y, int width, int height) {

  /**
   * Anchors a prompt of the given size to the bottom-right corner of {@code area}, inset by {@code margin}.
   *
   * @param area work area
   * @param width prompt width
   * @param height prompt height
   * @param margin inset
   * @return placement
   */
  public static PromptPlacement bottomRight(WorkArea area, int width, int height, int margin) {
    if (area == null) {
      throw new IllegalArgumentException("area must not be null.");
    }
    int x = area.x() + area.width() - width - margin;
    int y = area.y() + area.height() - height - margin;
    return new PromptPlacement(x, y, width, height);
  }
}
