package com.seatview.viewer.render;

/**
 * Transient backend failure such as a network error, throttling or a GPU cold start. Retryable.
 */
public class RenderTransientException extends RenderException {
  private final int statusCode;

  public RenderTransientException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public RenderTransientException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = 0;
  }

  /** HTTP status returned by the backend, or 0 when no response was received. */
  public int getStatusCode() {
    return statusCode;
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
