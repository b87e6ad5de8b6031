package com.seatview.viewer.render;

/** Gateway to the GPU render backend. */
public interface RenderClient {
  /**
   * Renders one view.
   *
   * @param request job description
   * @return encoded image
   * @throws RenderTimeoutException when the backend does not answer in time
   * @throws RenderTransientException on network errors, throttling or backend unavailability
   * @throws RenderFatalException when the backend rejects the job
   */
  RenderedImage render(RenderRequest request);
}
