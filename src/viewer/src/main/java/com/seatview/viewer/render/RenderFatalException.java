package com.seatview.viewer.render;

/**
 * Deterministic failure, for example an unknown template. Retrying the same job cannot succeed.
 */
public class RenderFatalException extends RenderException {

  public RenderFatalException(String message) {
    super(message);
  }

  public RenderFatalException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
