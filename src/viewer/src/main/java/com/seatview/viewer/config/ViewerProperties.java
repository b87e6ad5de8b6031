package com.seatview.viewer.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the seat view service.
 *
 * <p>Values are bound from {@code viewer.*} in {@code application.yml} and environment
 * variables.
 */
@ConfigurationProperties(prefix = "viewer")
public class ViewerProperties {
  private final Venues venues = new Venues();
  private final Cache cache = new Cache();
  private final Render render = new Render();
  private final Fingerprint fingerprint = new Fingerprint();
  private final Camera camera = new Camera();
  private final Api api = new Api();

  public Venues getVenues() {
    return venues;
  }

  public Cache getCache() {
    return cache;
  }

  public Render getRender() {
    return render;
  }

  public Fingerprint getFingerprint() {
    return fingerprint;
  }

  public Camera getCamera() {
    return camera;
  }

  public Api getApi() {
    return api;
  }

  /** Location of the venue configuration folders. */
  public static class Venues {
    private String dir = "data/venues";

    public String getDir() {
      return dir;
    }

    public void setDir(String dir) {
      this.dir = dir;
    }
  }

  /** Render cache bounds, expiry and render time budget. */
  public static class Cache {
    private long maxBytes = 256L * 1024L * 1024L;
    private int maxEntries = 2000;
    private Duration ttl = Duration.ofHours(24);
    private Duration renderTimeout = Duration.ofSeconds(90);
    private int renderThreads = 4;

    public long getMaxBytes() {
      return maxBytes;
    }

    public void setMaxBytes(long maxBytes) {
      this.maxBytes = maxBytes;
    }

    public int getMaxEntries() {
      return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
      this.maxEntries = maxEntries;
    }

    public Duration getTtl() {
      return ttl;
    }

    public void setTtl(Duration ttl) {
      this.ttl = ttl;
    }

    public Duration getRenderTimeout() {
      return renderTimeout;
    }

    public void setRenderTimeout(Duration renderTimeout) {
      this.renderTimeout = renderTimeout;
    }

    public int getRenderThreads() {
      return renderThreads;
    }

    public void setRenderThreads(int renderThreads) {
      this.renderThreads = renderThreads;
    }
  }

  /** Render backend endpoint, per-attempt timeouts and retry policy. */
  public static class Render {
    private String baseUrl = "http://localhost:8000";
    private String apiToken = "";
    private int connectTimeoutMs = 5000;
    private int requestTimeoutMs = 25000;
    private int maxRetries = 2;
    private long initialBackoffMs = 500;
    private long maxBackoffMs = 5000;

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getApiToken() {
      return apiToken;
    }

    public void setApiToken(String apiToken) {
      this.apiToken = apiToken;
    }

    public int getConnectTimeoutMs() {
      return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
      this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getRequestTimeoutMs() {
      return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
      this.requestTimeoutMs = requestTimeoutMs;
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public long getInitialBackoffMs() {
      return initialBackoffMs;
    }

    public void setInitialBackoffMs(long initialBackoffMs) {
      this.initialBackoffMs = initialBackoffMs;
    }

    public long getMaxBackoffMs() {
      return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
      this.maxBackoffMs = maxBackoffMs;
    }
  }

  /** Quantization grid applied to poses before hashing them into cache keys. */
  public static class Fingerprint {
    private double positionPrecision = 0.5;
    private double fovPrecision = 1.0;

    public double getPositionPrecision() {
      return positionPrecision;
    }

    public void setPositionPrecision(double positionPrecision) {
      this.positionPrecision = positionPrecision;
    }

    public double getFovPrecision() {
      return fovPrecision;
    }

    public void setFovPrecision(double fovPrecision) {
      this.fovPrecision = fovPrecision;
    }
  }

  /** Field-of-view range of the coordinate mapper. */
  public static class Camera {
    private double minFov = 40.0;
    private double maxFov = 75.0;
    private double nearDistance = 15.0;
    private double farDistance = 120.0;

    public double getMinFov() {
      return minFov;
    }

    public void setMinFov(double minFov) {
      this.minFov = minFov;
    }

    public double getMaxFov() {
      return maxFov;
    }

    public void setMaxFov(double maxFov) {
      this.maxFov = maxFov;
    }

    public double getNearDistance() {
      return nearDistance;
    }

    public void setNearDistance(double nearDistance) {
      this.nearDistance = nearDistance;
    }

    public double getFarDistance() {
      return farDistance;
    }

    public void setFarDistance(double farDistance) {
      this.farDistance = farDistance;
    }
  }

  /** API-level behavior configuration. */
  public static class Api {
    private final Cors cors = new Cors();

    public Cors getCors() {
      return cors;
    }
  }

  /** CORS allowlist configuration for the seatmap frontend. */
  public static class Cors {
    private List<String> allowedOrigins = new ArrayList<>();

    public List<String> getAllowedOrigins() {
      return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
      this.allowedOrigins = allowedOrigins;
    }
  }
}
