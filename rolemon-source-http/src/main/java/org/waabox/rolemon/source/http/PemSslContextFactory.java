package org.waabox.rolemon.source.http;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;

import org.waabox.rolemon.source.AuthException;

/**
 * Builds TLS contexts from PEM files.
 *
 * <p>Certificates are read from every {@code CERTIFICATE} block of a file.
 * Private keys may be PKCS#8 ({@code PRIVATE KEY}, RSA or EC) or PKCS#1
 * ({@code RSA PRIVATE KEY}). Encrypted keys are not supported.
 *
 * <p>Error messages name the files, never their content.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PemSslContextFactory {

  /** A PEM block: its label and its base64 body. */
  private static final Pattern PEM_BLOCK = Pattern.compile(
      "-----BEGIN ([A-Z0-9 ]+)-----([A-Za-z0-9+/=\\s]+)-----END \\1-----");

  /** The in-memory key store password; the store never leaves memory. */
  private static final char[] STORE_PASSWORD = "rolemon".toCharArray();

  /** The DER prefix of an RSA PKCS#8 key info, up to the key octets. */
  private static final byte[] RSA_ALGORITHM_ID = {
      0x30, 0x0d, 0x06, 0x09, 0x2a, (byte) 0x86, 0x48, (byte) 0x86,
      (byte) 0xf7, 0x0d, 0x01, 0x01, 0x01, 0x05, 0x00
  };

  /** Private constructor to prevent instantiation. */
  private PemSslContextFactory() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Creates the client context for mutual TLS.
   *
   * @param certPath the PEM client certificate chain, never null
   * @param keyPath  the PEM client private key, never null
   * @param caPath   the PEM CA bundle verifying the server, or null to
   *                 accept any server certificate
   *
   * @return an initialized context, never null
   *
   * @throws AuthException if a file is missing, unreadable or malformed
   */
  public static SSLContext clientContext(final Path certPath,
      final Path keyPath, final Path caPath) throws AuthException {
    final TrustManager[] trustManagers = caPath == null
        ? new TrustManager[] {new AcceptAnyServer()}
        : trustManagers(caPath);
    return context(keyManagers(certPath, keyPath), trustManagers);
  }

  /**
   * Creates key managers presenting the given certificate and key.
   *
   * @param certPath the PEM certificate chain, never null
   * @param keyPath  the PEM private key, never null
   *
   * @return the key managers, never null
   *
   * @throws AuthException if a file is missing, unreadable or malformed
   */
  static KeyManager[] keyManagers(final Path certPath, final Path keyPath)
      throws AuthException {
    final List<X509Certificate> chain = readCertificates(certPath);
    final PrivateKey key = readPrivateKey(keyPath);
    try {
      final KeyStore store = KeyStore.getInstance("PKCS12");
      store.load(null, null);
      store.setKeyEntry("client", key, STORE_PASSWORD,
          chain.toArray(new Certificate[0]));
      final KeyManagerFactory factory = KeyManagerFactory.getInstance(
          KeyManagerFactory.getDefaultAlgorithm());
      factory.init(store, STORE_PASSWORD);
      return factory.getKeyManagers();
    } catch (final GeneralSecurityException | IOException e) {
      throw new AuthException("Certificate " + certPath
          + " does not match key " + keyPath, e);
    }
  }

  /**
   * Creates trust managers accepting certificates issued by the given CAs.
   *
   * @param caPath the PEM CA bundle, never null
   *
   * @return the trust managers, never null
   *
   * @throws AuthException if the bundle is missing, unreadable or malformed
   */
  static TrustManager[] trustManagers(final Path caPath)
      throws AuthException {
    final List<X509Certificate> authorities = readCertificates(caPath);
    try {
      final KeyStore store = KeyStore.getInstance("PKCS12");
      store.load(null, null);
      int index = 0;
      for (final X509Certificate authority : authorities) {
        store.setCertificateEntry("ca-" + index++, authority);
      }
      final TrustManagerFactory factory = TrustManagerFactory.getInstance(
          TrustManagerFactory.getDefaultAlgorithm());
      factory.init(store);
      return factory.getTrustManagers();
    } catch (final GeneralSecurityException | IOException e) {
      throw new AuthException("Cannot load CA bundle " + caPath, e);
    }
  }

  /**
   * Creates a TLS context from the given managers.
   *
   * @param keyManagers   the key managers, never null
   * @param trustManagers the trust managers, never null
   *
   * @return an initialized context, never null
   *
   * @throws AuthException if TLS is not available
   */
  static SSLContext context(final KeyManager[] keyManagers,
      final TrustManager[] trustManagers) throws AuthException {
    try {
      final SSLContext context = SSLContext.getInstance("TLS");
      context.init(keyManagers, trustManagers, null);
      return context;
    } catch (final GeneralSecurityException e) {
      throw new AuthException("Cannot initialize TLS", e);
    }
  }

  private static List<X509Certificate> readCertificates(final Path path)
      throws AuthException {
    final List<X509Certificate> certificates = new ArrayList<>();
    try {
      final CertificateFactory factory = CertificateFactory.getInstance(
          "X.509");
      final Matcher matcher = PEM_BLOCK.matcher(read(path));
      while (matcher.find()) {
        if ("CERTIFICATE".equals(matcher.group(1))) {
          certificates.add((X509Certificate) factory.generateCertificate(
              new ByteArrayInputStream(decode(matcher.group(2), path))));
        }
      }
    } catch (final CertificateException e) {
      throw new AuthException("Malformed certificate in " + path, e);
    }
    if (certificates.isEmpty()) {
      throw new AuthException("No certificate found in " + path);
    }
    return certificates;
  }

  private static PrivateKey readPrivateKey(final Path path)
      throws AuthException {
    final Matcher matcher = PEM_BLOCK.matcher(read(path));
    while (matcher.find()) {
      final String label = matcher.group(1);
      if ("PRIVATE KEY".equals(label)) {
        return pkcs8(decode(matcher.group(2), path), path);
      }
      if ("RSA PRIVATE KEY".equals(label)) {
        return pkcs8(wrapPkcs1(decode(matcher.group(2), path)), path);
      }
      if ("ENCRYPTED PRIVATE KEY".equals(label)
          || "EC PRIVATE KEY".equals(label)) {
        throw new AuthException("Unsupported key format " + label + " in "
            + path + ", convert it to an unencrypted PKCS#8 key");
      }
    }
    throw new AuthException("No private key found in " + path);
  }

  private static PrivateKey pkcs8(final byte[] der, final Path path)
      throws AuthException {
    final PKCS8EncodedKeySpec spec = new PKCS8EncodedKeySpec(der);
    InvalidKeySpecException rejected = null;
    for (final String algorithm : new String[] {"RSA", "EC"}) {
      try {
        return KeyFactory.getInstance(algorithm).generatePrivate(spec);
      } catch (final InvalidKeySpecException e) {
        rejected = e;
      } catch (final GeneralSecurityException e) {
        throw new AuthException("Cannot load private key " + path, e);
      }
    }
    throw new AuthException("Private key in " + path
        + " is neither RSA nor EC", rejected);
  }

  /**
   * Wraps a PKCS#1 RSA key into a PKCS#8 key info.
   *
   * @param pkcs1 the DER PKCS#1 key, never null
   *
   * @return the DER PKCS#8 key info, never null
   */
  static byte[] wrapPkcs1(final byte[] pkcs1) {
    final ByteArrayOutputStream body = new ByteArrayOutputStream();
    body.write(0x02);
    body.write(0x01);
    body.write(0x00);
    body.writeBytes(RSA_ALGORITHM_ID);
    body.write(0x04);
    body.writeBytes(derLength(pkcs1.length));
    body.writeBytes(pkcs1);

    final byte[] content = body.toByteArray();
    final ByteArrayOutputStream info = new ByteArrayOutputStream();
    info.write(0x30);
    info.writeBytes(derLength(content.length));
    info.writeBytes(content);
    return info.toByteArray();
  }

  private static byte[] derLength(final int length) {
    if (length < 0x80) {
      return new byte[] {(byte) length};
    }
    if (length < 0x100) {
      return new byte[] {(byte) 0x81, (byte) length};
    }
    if (length < 0x10000) {
      return new byte[] {(byte) 0x82, (byte) (length >> 8), (byte) length};
    }
    return new byte[] {(byte) 0x83, (byte) (length >> 16),
        (byte) (length >> 8), (byte) length};
  }

  private static String read(final Path path) throws AuthException {
    if (!Files.isReadable(path)) {
      throw new AuthException("File " + path + " is missing or unreadable");
    }
    try {
      return Files.readString(path, StandardCharsets.US_ASCII);
    } catch (final IOException e) {
      throw new AuthException("Cannot read " + path, e);
    }
  }

  private static byte[] decode(final String base64, final Path path)
      throws AuthException {
    try {
      return Base64.getMimeDecoder().decode(base64);
    } catch (final IllegalArgumentException e) {
      throw new AuthException("Malformed PEM block in " + path, e);
    }
  }

  /**
   * Accepts any server certificate, for head nodes with self-signed
   * certificates and no CA bundle configured.
   *
   * <p>Extends {@link X509ExtendedTrustManager} so the TLS stack does not
   * add its own host name check on top.
   */
  private static final class AcceptAnyServer extends X509ExtendedTrustManager {

    @Override
    public void checkClientTrusted(final X509Certificate[] chain,
        final String authType, final Socket socket) {
      throw new UnsupportedOperationException("Client side only");
    }

    @Override
    public void checkServerTrusted(final X509Certificate[] chain,
        final String authType, final Socket socket) {
    }

    @Override
    public void checkClientTrusted(final X509Certificate[] chain,
        final String authType, final SSLEngine engine) {
      throw new UnsupportedOperationException("Client side only");
    }

    @Override
    public void checkServerTrusted(final X509Certificate[] chain,
        final String authType, final SSLEngine engine) {
    }

    @Override
    public void checkClientTrusted(final X509Certificate[] chain,
        final String authType) {
      throw new UnsupportedOperationException("Client side only");
    }

    @Override
    public void checkServerTrusted(final X509Certificate[] chain,
        final String authType) {
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}
