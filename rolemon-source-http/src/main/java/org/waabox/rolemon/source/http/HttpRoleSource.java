package org.waabox.rolemon.source.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.rolemon.source.AuthException;
import org.waabox.rolemon.source.NetworkException;
import org.waabox.rolemon.source.RoleSnapshot;
import org.waabox.rolemon.source.RoleSource;
import org.waabox.rolemon.source.RoleSourceException;

/**
 * {@link RoleSource} reading the device listing of the cluster manager REST
 * API over mutual TLS.
 *
 * <p>Head nodes are tried in order and the first answer wins. The client
 * certificate and key are read from PEM files; the TLS context is rebuilt
 * when either file changes on disk, so a rotated certificate is picked up
 * on the next fetch.
 *
 * <p>Typical usage:
 * <pre>{@code
 * HttpRoleSourceConfig config = HttpRoleSourceConfig.builder(
 *     List.of("head01", "head02"),
 *     Path.of("/etc/rolemon/cert.pem"),
 *     Path.of("/etc/rolemon/cert.key"))
 *     .build();
 * RoleSource source = new HttpRoleSource(config);
 * RoleSnapshot roles = source.fetch("gpu01");
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class HttpRoleSource implements RoleSource {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(HttpRoleSource.class);

  /** The configuration. */
  private final HttpRoleSourceConfig config;

  /** The time source of the snapshots. */
  private final Clock clock;

  /** The client built from the current PEM files, null until first use. */
  private HttpClient client;

  /** Modification time of the certificate the client was built with. */
  private FileTime certModified;

  /** Modification time of the key the client was built with. */
  private FileTime keyModified;

  /** Whether the missing server verification was already reported. */
  private boolean trustWarningLogged;

  /**
   * Creates a new role source.
   *
   * @param theConfig the configuration, never null
   */
  public HttpRoleSource(final HttpRoleSourceConfig theConfig) {
    this(theConfig, Clock.systemUTC());
  }

  /**
   * Creates a new role source with the given time source.
   *
   * @param theConfig the configuration, never null
   * @param theClock  the time source of the snapshots, never null
   */
  public HttpRoleSource(final HttpRoleSourceConfig theConfig,
      final Clock theClock) {
    config = Objects.requireNonNull(theConfig, "config cannot be null");
    clock = Objects.requireNonNull(theClock, "clock cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public RoleSnapshot fetch(final String nodeId) throws RoleSourceException {
    Objects.requireNonNull(nodeId, "nodeId cannot be null");

    final HttpClient httpClient = client();
    final List<RoleSourceException> failures = new ArrayList<>();

    for (final String headnode : config.headnodes()) {
      try {
        final String body = get(httpClient, config.deviceUrl(headnode));
        final Set<String> roles = DeviceListCodec.rolesOf(body, nodeId);
        log.debug("Head node {} lists roles {} for {}", headnode, roles,
            nodeId);
        return new RoleSnapshot(roles, nodeId, clock.instant());
      } catch (final RoleSourceException e) {
        log.warn("Head node {} failed: {}", headnode, e.getMessage());
        failures.add(e);
      }
    }

    final RoleSourceException last = failures.remove(failures.size() - 1);
    for (final RoleSourceException earlier : failures) {
      last.addSuppressed(earlier);
    }
    throw last;
  }

  private String get(final HttpClient httpClient, final String url)
      throws RoleSourceException {
    final HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .header("Accept", "application/json")
        .timeout(config.requestTimeout())
        .GET()
        .build();

    final HttpResponse<String> response;
    try {
      response = httpClient.send(request,
          HttpResponse.BodyHandlers.ofString());
    } catch (final HttpTimeoutException e) {
      throw new NetworkException("Timed out calling " + url, e);
    } catch (final IOException e) {
      if (isTlsFailure(e)) {
        throw new AuthException("TLS handshake with " + url + " failed: "
            + e.getMessage(), e);
      }
      throw new NetworkException("Cannot reach " + url + ": "
          + e.getMessage(), e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new NetworkException("Interrupted calling " + url, e);
    }

    final int status = response.statusCode();
    if (status == 401 || status == 403) {
      throw new AuthException(url + " rejected the client certificate with "
          + "status " + status);
    }
    if (status < 200 || status >= 300) {
      throw new NetworkException(url + " responded with status " + status);
    }
    return response.body();
  }

  /**
   * Returns the HTTP client, rebuilding it when the PEM files changed.
   *
   * @return the client, never null
   *
   * @throws AuthException if the PEM files cannot be loaded
   */
  synchronized HttpClient client() throws AuthException {
    final FileTime certTime = modified(config.certPath());
    final FileTime keyTime = modified(config.keyPath());
    if (client != null && certTime.equals(certModified)
        && keyTime.equals(keyModified)) {
      return client;
    }

    final Path caPath = config.caPath().orElse(null);
    if (caPath == null && !trustWarningLogged) {
      log.warn("No CA bundle configured, head node certificates are not "
          + "verified");
      trustWarningLogged = true;
    }
    final SSLContext context = PemSslContextFactory.clientContext(
        config.certPath(), config.keyPath(), caPath);

    if (client != null) {
      log.info("Client certificate {} changed, reloading it",
          config.certPath());
    }
    client = HttpClient.newBuilder()
        .sslContext(context)
        .connectTimeout(config.connectTimeout())
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();
    certModified = certTime;
    keyModified = keyTime;
    return client;
  }

  private static FileTime modified(final Path path) throws AuthException {
    try {
      return Files.getLastModifiedTime(path);
    } catch (final IOException e) {
      throw new AuthException("File " + path + " is missing or unreadable",
          e);
    }
  }

  private static boolean isTlsFailure(final Throwable failure) {
    for (Throwable t = failure; t != null; t = t.getCause()) {
      if (t instanceof SSLException) {
        return true;
      }
    }
    return false;
  }
}
