package org.waabox.rolemon.source.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.waabox.rolemon.source.http.PemSslContextFactoryTest.pki;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;

import com.sun.net.httpserver.HttpsConfigurator;
import com.sun.net.httpserver.HttpsParameters;
import com.sun.net.httpserver.HttpsServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.rolemon.source.AuthException;
import org.waabox.rolemon.source.NetworkException;
import org.waabox.rolemon.source.ParseException;
import org.waabox.rolemon.source.RoleSnapshot;
import org.waabox.rolemon.source.RoleSourceException;

/**
 * Integration tests for {@link HttpRoleSource}.
 *
 * <p>These tests start a real HTTPS server on localhost that requires a
 * client certificate issued by the test CA.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HttpRoleSourceTest {

  private static final String DEVICES = "{\"data\":["
      + "{\"hostname\":\"gpu01.cluster.local\",\"roles\":[\"SlurmClient\"]},"
      + "{\"hostname\":\"login01\",\"roles\":[\"login\"]}]}";

  private HttpsServer server;

  private volatile int status = 200;

  private volatile String body = DEVICES;

  @BeforeEach
  void startServer() throws Exception {
    final SSLContext context = PemSslContextFactory.context(
        PemSslContextFactory.keyManagers(pki("server.pem"),
            pki("server.key")),
        PemSslContextFactory.trustManagers(pki("ca.pem")));

    server = HttpsServer.create(new InetSocketAddress("localhost", 0), 0);
    server.setHttpsConfigurator(new HttpsConfigurator(context) {
      @Override
      public void configure(final HttpsParameters params) {
        final SSLParameters parameters =
            getSSLContext().getDefaultSSLParameters();
        parameters.setNeedClientAuth(true);
        params.setSSLParameters(parameters);
      }
    });
    server.createContext(HttpRoleSourceConfig.DEFAULT_PATH, exchange -> {
      final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
      exchange.sendResponseHeaders(status, bytes.length);
      try (OutputStream os = exchange.getResponseBody()) {
        os.write(bytes);
      }
    });
    server.start();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  private HttpRoleSourceConfig.Builder config(final List<String> heads) {
    return HttpRoleSourceConfig.builder(heads, pki("client.pem"),
        pki("client.key"))
        .port(server.getAddress().getPort())
        .caPath(pki("ca.pem"))
        .connectTimeout(Duration.ofSeconds(2))
        .requestTimeout(Duration.ofSeconds(5));
  }

  @Test
  void whenFetching_givenNodeListed_shouldReturnItsRoles() throws Exception {
    final HttpRoleSource source = new HttpRoleSource(
        config(List.of("localhost")).build());

    final RoleSnapshot snapshot = source.fetch("gpu01");

    assertEquals(Set.of("slurmclient"), snapshot.roles());
    assertEquals("gpu01", snapshot.hostname());
  }

  @Test
  void whenFetching_givenNoCaBundle_shouldStillConnect() throws Exception {
    final HttpRoleSource source = new HttpRoleSource(
        config(List.of("localhost")).caPath(null).build());

    assertEquals(Set.of("login"), source.fetch("login01").roles());
  }

  @Test
  void whenFetching_givenUnauthorizedStatus_shouldThrowAuthException() {
    status = 401;
    body = "{\"error\":\"unauthorized\"}";
    final HttpRoleSource source = new HttpRoleSource(
        config(List.of("localhost")).build());

    assertThrows(AuthException.class, () -> source.fetch("gpu01"));
  }

  @Test
  void whenFetching_givenServerError_shouldThrowNetworkException() {
    status = 503;
    final HttpRoleSource source = new HttpRoleSource(
        config(List.of("localhost")).build());

    assertThrows(NetworkException.class, () -> source.fetch("gpu01"));
  }

  @Test
  void whenFetching_givenNodeNotListed_shouldThrowParseException() {
    final HttpRoleSource source = new HttpRoleSource(
        config(List.of("localhost")).build());

    assertThrows(ParseException.class, () -> source.fetch("gpu99"));
  }

  @Test
  void whenFetching_givenFirstHeadNodeDown_shouldFailOver()
      throws Exception {
    final HttpRoleSource source = new HttpRoleSource(
        config(List.of("head-down.invalid", "localhost")).build());

    assertEquals(Set.of("slurmclient"), source.fetch("gpu01").roles());
  }

  @Test
  void whenFetching_givenEveryHeadNodeFailing_shouldKeepEachFailure() {
    status = 500;
    final HttpRoleSource source = new HttpRoleSource(
        config(List.of("head-down.invalid", "localhost")).build());

    final RoleSourceException e = assertThrows(RoleSourceException.class,
        () -> source.fetch("gpu01"));

    assertEquals(NetworkException.class, e.getClass());
    assertEquals(1, e.getSuppressed().length);
  }

  @Test
  void whenFetching_givenMissingKey_shouldThrowAuthException(
      @TempDir final Path dir) {
    final HttpRoleSource source = new HttpRoleSource(
        HttpRoleSourceConfig.builder(List.of("localhost"),
            pki("client.pem"), dir.resolve("missing.key")).build());

    assertThrows(AuthException.class, () -> source.fetch("gpu01"));
  }

  @Test
  void whenCertificateChanges_shouldRebuildTheClient(@TempDir final Path dir)
      throws Exception {
    final Path cert = Files.copy(pki("client.pem"), dir.resolve("c.pem"));
    final Path key = Files.copy(pki("client.key"), dir.resolve("c.key"));
    final HttpRoleSource source = new HttpRoleSource(
        HttpRoleSourceConfig.builder(List.of("localhost"), cert, key)
            .build());

    final HttpClient first = source.client();
    assertSame(first, source.client());

    Files.setLastModifiedTime(cert,
        FileTime.from(Instant.now().plusSeconds(60)));

    assertNotSame(first, source.client());
  }
}
