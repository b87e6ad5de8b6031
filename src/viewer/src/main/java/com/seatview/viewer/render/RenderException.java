package com.seatview.viewer.render;

/**
 * Base class for failures reported by the render backend.
 *
 * <p>The same instance is delivered to every caller waiting on a render, so callers must treat
 * it as shared and never mutate it.
 */
public abstract class RenderException extends RuntimeException {

  protected RenderException(String message) {
    super(message);
  }

  protected RenderException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Whether retrying the same job may succeed. */
  public abstract boolean isRetryable();
}
