package com.seatview.viewer.render;

/** The render did not finish within its time budget. Retryable. */
public class RenderTimeoutException extends RenderException {

  public RenderTimeoutException(String message) {
    super(message);
  }

  public RenderTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
