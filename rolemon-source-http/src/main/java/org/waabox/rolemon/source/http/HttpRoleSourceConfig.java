package org.waabox.rolemon.source.http;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration holder for the HTTPS role source.
 *
 * <p>Holds the cluster manager head nodes, the port and path of the device
 * listing, the client certificate and key used for mutual TLS, the optional
 * CA bundle that verifies the head nodes, and the call timeouts.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HttpRoleSourceConfig {

  /** The default port of the cluster manager REST API. */
  public static final int DEFAULT_PORT = 8081;

  /** The default path of the device listing. */
  public static final String DEFAULT_PATH = "/rest/v1/device";

  /** The default connect timeout. */
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

  /** The default request timeout. */
  public static final Duration DEFAULT_REQUEST_TIMEOUT =
      Duration.ofSeconds(10);

  /** The head nodes, tried in order. */
  private final List<String> headnodes;

  /** The REST API port. */
  private final int port;

  /** The device listing path. */
  private final String path;

  /** The PEM client certificate. */
  private final Path certPath;

  /** The PEM client private key. */
  private final Path keyPath;

  /** The PEM CA bundle, or null to skip server verification. */
  private final Path caPath;

  /** The connect timeout. */
  private final Duration connectTimeout;

  /** The request timeout. */
  private final Duration requestTimeout;

  private HttpRoleSourceConfig(final Builder builder) {
    headnodes = List.copyOf(builder.headnodes);
    port = builder.port;
    path = builder.path;
    certPath = builder.certPath;
    keyPath = builder.keyPath;
    caPath = builder.caPath;
    connectTimeout = builder.connectTimeout;
    requestTimeout = builder.requestTimeout;
  }

  /**
   * Creates a new builder.
   *
   * @param headnodes the head nodes, tried in order, never null nor empty
   * @param certPath  the PEM client certificate, never null
   * @param keyPath   the PEM client private key, never null
   *
   * @return a new builder, never null
   */
  public static Builder builder(final List<String> headnodes,
      final Path certPath, final Path keyPath) {
    return new Builder(headnodes, certPath, keyPath);
  }

  public List<String> headnodes() {
    return headnodes;
  }

  public int port() {
    return port;
  }

  public String path() {
    return path;
  }

  public Path certPath() {
    return certPath;
  }

  public Path keyPath() {
    return keyPath;
  }

  /**
   * Returns the CA bundle that verifies the head nodes.
   *
   * @return the CA bundle path, empty when server certificates are not
   *         verified
   */
  public Optional<Path> caPath() {
    return Optional.ofNullable(caPath);
  }

  public Duration connectTimeout() {
    return connectTimeout;
  }

  public Duration requestTimeout() {
    return requestTimeout;
  }

  /**
   * Returns the device listing URL on the given head node.
   *
   * @param headnode the head node host, never null
   *
   * @return the URL, never null
   */
  String deviceUrl(final String headnode) {
    return "https://" + headnode + ":" + port + path;
  }

  /** Builds an {@link HttpRoleSourceConfig}. */
  public static final class Builder {

    private final List<String> headnodes;

    private final Path certPath;

    private final Path keyPath;

    private int port = DEFAULT_PORT;

    private String path = DEFAULT_PATH;

    private Path caPath;

    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

    private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

    private Builder(final List<String> theHeadnodes, final Path theCertPath,
        final Path theKeyPath) {
      Objects.requireNonNull(theHeadnodes, "headnodes must not be null");
      if (theHeadnodes.isEmpty()) {
        throw new IllegalArgumentException("headnodes must not be empty");
      }
      for (final String headnode : theHeadnodes) {
        if (headnode == null || headnode.isBlank()) {
          throw new IllegalArgumentException(
              "headnodes must not contain blank entries");
        }
      }
      headnodes = theHeadnodes;
      certPath = Objects.requireNonNull(theCertPath,
          "certPath must not be null");
      keyPath = Objects.requireNonNull(theKeyPath,
          "keyPath must not be null");
    }

    /**
     * Sets the REST API port, {@value #DEFAULT_PORT} by default.
     *
     * @param thePort the port, between 1 and 65535
     *
     * @return this builder for chaining, never null
     */
    public Builder port(final int thePort) {
      if (thePort < 1 || thePort > 65535) {
        throw new IllegalArgumentException("port out of range: " + thePort);
      }
      port = thePort;
      return this;
    }

    /**
     * Sets the device listing path.
     *
     * @param thePath the path, starting with a slash, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder path(final String thePath) {
      Objects.requireNonNull(thePath, "path must not be null");
      if (!thePath.startsWith("/")) {
        throw new IllegalArgumentException(
            "path must start with '/', got: " + thePath);
      }
      path = thePath;
      return this;
    }

    /**
     * Sets the CA bundle that verifies the head nodes. Without it the head
     * node certificate is accepted as is.
     *
     * @param theCaPath the PEM CA bundle, null to disable verification
     *
     * @return this builder for chaining, never null
     */
    public Builder caPath(final Path theCaPath) {
      caPath = theCaPath;
      return this;
    }

    /**
     * Sets the connect timeout.
     *
     * @param theTimeout the timeout, never null, positive
     *
     * @return this builder for chaining, never null
     */
    public Builder connectTimeout(final Duration theTimeout) {
      connectTimeout = positive(theTimeout, "connectTimeout");
      return this;
    }

    /**
     * Sets the request timeout.
     *
     * @param theTimeout the timeout, never null, positive
     *
     * @return this builder for chaining, never null
     */
    public Builder requestTimeout(final Duration theTimeout) {
      requestTimeout = positive(theTimeout, "requestTimeout");
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the configuration, never null
     */
    public HttpRoleSourceConfig build() {
      return new HttpRoleSourceConfig(this);
    }

    private static Duration positive(final Duration value,
        final String name) {
      Objects.requireNonNull(value, name + " must not be null");
      if (value.isZero() || value.isNegative()) {
        throw new IllegalArgumentException(name + " must be positive");
      }
      return value;
    }
  }
}
