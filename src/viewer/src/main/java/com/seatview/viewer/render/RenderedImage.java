package com.seatview.viewer.render;

import java.util.Objects;

/**
 * Encoded image returned by the render backend.
 *
 * <p>The byte array is shared with every reader of the cache and must not be modified.
 *
 * @param data encoded image bytes
 * @param contentType MIME type, usually {@code image/png}
 */
public record RenderedImage(byte[] data, String contentType) {
  public static final String PNG = "image/png";

  public RenderedImage {
    Objects.requireNonNull(data, "data");
    contentType = contentType == null || contentType.isBlank() ? PNG : contentType;
  }

  public long sizeBytes() {
    return data.length;
  }
}
