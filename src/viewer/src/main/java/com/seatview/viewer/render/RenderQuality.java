package com.seatview.viewer.render;

import java.util.Locale;

/** Output presets sent to the render backend. */
public enum RenderQuality {
  PREVIEW(960, 540, 16),
  FULL(1920, 1080, 64);

  private final int width;
  private final int height;
  private final int samples;

  RenderQuality(int width, int height, int samples) {
    this.width = width;
    this.height = height;
    this.samples = samples;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public int samples() {
    return samples;
  }

  /** Value mixed into the render fingerprint so presets never share a cache entry. */
  public String variant() {
    return name().toLowerCase(Locale.ROOT) + ":" + width + "x" + height + "@" + samples;
  }
}
