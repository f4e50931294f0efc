package org.waabox.rolemon.daemon;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.waabox.rolemon.BackoffPolicy;
import org.waabox.rolemon.ManagedService;
import org.waabox.rolemon.RoleMapping;
import org.waabox.rolemon.ServiceRetryPolicy;

/**
 * Static utility class reading the daemon configuration from a JSON file.
 *
 * <p>Uses Jackson's tree model. Every key is optional except
 * {@code headnodes}; missing keys take their default value. When neither
 * {@code services} nor {@code roles} is given, the compute client role runs
 * the node, cgroup, GPU and DCGM exporters. When only {@code services} is
 * given, the compute client role runs all of them.
 *
 * <p>Any invalid value raises a {@link ConfigException} naming the key.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DaemonConfigLoader {

  /** The configuration file used when none is given. */
  public static final Path DEFAULT_PATH = Path.of("/etc/rolemon/config.json");

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private DaemonConfigLoader() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Reads the configuration file.
   *
   * @param file the configuration file, never null
   *
   * @return the configuration, never null
   *
   * @throws ConfigException if the file is missing, unreadable or invalid
   */
  public static DaemonConfig load(final Path file) {
    Objects.requireNonNull(file, "file cannot be null");
    final String json;
    try {
      json = Files.readString(file, StandardCharsets.UTF_8);
    } catch (final NoSuchFileException e) {
      throw new ConfigException("Configuration file " + file
          + " does not exist", e);
    } catch (final IOException e) {
      throw new ConfigException("Cannot read configuration file " + file, e);
    }
    try {
      return parse(json);
    } catch (final ConfigException e) {
      throw new ConfigException(file + ": " + e.getMessage(), e);
    }
  }

  /**
   * Parses a configuration document.
   *
   * @param json the JSON document, never null
   *
   * @return the configuration, never null
   *
   * @throws ConfigException if the document is malformed or invalid
   */
  public static DaemonConfig parse(final String json) {
    Objects.requireNonNull(json, "json cannot be null");

    final JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (final JsonProcessingException e) {
      throw new ConfigException("Malformed JSON: "
          + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new ConfigException("Configuration must be a JSON object");
    }

    final List<String> headnodes = headnodes(root);

    final int port = integer(root, "port", 8081);
    if (port < 1 || port > 65535) {
      throw new ConfigException("port out of range: " + port);
    }

    final JsonNode backoff = root.path("backoff");
    final JsonNode retry = root.path("serviceRetry");

    try {
      return new DaemonConfig(
          headnodes,
          port,
          path(root, "certPath", "/etc/rolemon/admin.pem"),
          path(root, "keyPath", "/etc/rolemon/admin.key"),
          path(root, "caPath", null),
          positive(root, "connectTimeoutSeconds", 5),
          positive(root, "requestTimeoutSeconds", 10),
          positive(root, "pollIntervalSeconds", 30),
          path(root, "targetsDir",
              "/cm/shared/apps/dcgm-exporter/prometheus-targets"),
          path(root, "stateFile", "/var/lib/rolemon/state.json"),
          hostname(root),
          nonBlank(root, "clusterName", "slurm"),
          roleMapping(root),
          BackoffPolicy.of(
              positive(backoff, "initialSeconds", 5),
              positive(backoff, "maxSeconds", 300),
              Duration.ofSeconds(nonNegative(backoff, "jitterSeconds", 5))),
          ServiceRetryPolicy.of(
              integer(retry, "maxAttempts", 3),
              Duration.ofSeconds(nonNegative(retry, "cooldownSeconds",
                  600))),
          Duration.ofSeconds(nonNegative(root, "verifyIntervalSeconds",
              600)),
          positive(root, "cycleBudgetSeconds", 120),
          Duration.ofMillis(nonNegative(root, "startSettleMillis", 2000)),
          positive(root, "commandTimeoutSeconds", 30));
    } catch (final IllegalArgumentException e) {
      throw new ConfigException(e.getMessage(), e);
    }
  }

  private static List<String> headnodes(final JsonNode root) {
    final JsonNode node = root.path("headnodes");
    if (!node.isArray() || node.isEmpty()) {
      throw new ConfigException("headnodes must list at least one head node");
    }
    final List<String> headnodes = new ArrayList<>();
    for (final JsonNode item : node) {
      if (!item.isTextual() || item.asText().isBlank()) {
        throw new ConfigException("headnodes must only hold host names");
      }
      headnodes.add(item.asText().trim());
    }
    return headnodes;
  }

  private static String hostname(final JsonNode root) {
    final JsonNode node = root.get("hostname");
    if (node == null || node.isNull()) {
      return null;
    }
    if (!node.isTextual() || node.asText().isBlank()) {
      throw new ConfigException("hostname must not be blank");
    }
    return node.asText().trim();
  }

  private static RoleMapping roleMapping(final JsonNode root) {
    final JsonNode services = root.get("services");
    final JsonNode roles = root.get("roles");
    if (services == null && roles == null) {
      return RoleMapping.defaults();
    }

    final Map<String, ManagedService> catalog = services == null
        ? RoleMapping.defaults().managedServices()
        : catalog(services);

    final RoleMapping.Builder builder = RoleMapping.builder();
    if (roles == null) {
      return builder.role(RoleMapping.COMPUTE_CLIENT_ROLE,
          new ArrayList<>(catalog.values())).build();
    }
    if (!roles.isObject()) {
      throw new ConfigException("roles must map role names to services");
    }

    final Iterator<Map.Entry<String, JsonNode>> entries = roles.fields();
    while (entries.hasNext()) {
      final Map.Entry<String, JsonNode> entry = entries.next();
      if (!entry.getValue().isArray()) {
        throw new ConfigException("roles." + entry.getKey()
            + " must list service names");
      }
      final List<ManagedService> required = new ArrayList<>();
      for (final JsonNode name : entry.getValue()) {
        final ManagedService service = catalog.get(name.asText());
        if (service == null) {
          throw new ConfigException("roles." + entry.getKey()
              + " names unknown service '" + name.asText() + "'");
        }
        required.add(service);
      }
      builder.role(entry.getKey(), required);
    }
    return builder.build();
  }

  private static Map<String, ManagedService> catalog(final JsonNode node) {
    if (!node.isArray()) {
      throw new ConfigException("services must be an array");
    }
    final Map<String, ManagedService> catalog = new LinkedHashMap<>();
    for (final JsonNode item : node) {
      final String name = item.path("name").asText("");
      if (name.isBlank()) {
        throw new ConfigException("every service needs a name");
      }
      final ManagedService service;
      if (item.hasNonNull("port")) {
        final Map<String, String> labels = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields =
            item.path("labels").fields();
        while (fields.hasNext()) {
          final Map.Entry<String, JsonNode> label = fields.next();
          labels.put(label.getKey(), label.getValue().asText());
        }
        service = ManagedService.exporter(name,
            integer(item, "port", 0), item.path("job").asText(name),
            labels);
      } else {
        service = ManagedService.unit(name);
      }
      if (catalog.put(name, service) != null) {
        throw new ConfigException("service '" + name
            + "' is declared twice");
      }
    }
    return catalog;
  }

  private static Path path(final JsonNode node, final String key,
      final String defaultValue) {
    final JsonNode value = node.get(key);
    final String text = value == null || value.isNull()
        ? defaultValue : value.asText();
    if (text == null) {
      return null;
    }
    if (text.isBlank()) {
      throw new ConfigException(key + " must not be blank");
    }
    try {
      return Path.of(text);
    } catch (final InvalidPathException e) {
      throw new ConfigException(key + " is not a valid path: " + text, e);
    }
  }

  private static String nonBlank(final JsonNode node, final String key,
      final String defaultValue) {
    final JsonNode value = node.get(key);
    if (value == null || value.isNull()) {
      return defaultValue;
    }
    if (!value.isTextual() || value.asText().isBlank()) {
      throw new ConfigException(key + " must not be blank");
    }
    return value.asText();
  }

  private static int integer(final JsonNode node, final String key,
      final int defaultValue) {
    final JsonNode value = node.get(key);
    if (value == null || value.isNull()) {
      return defaultValue;
    }
    if (!value.canConvertToInt() || !value.isIntegralNumber()) {
      throw new ConfigException(key + " must be an integer, got: " + value);
    }
    return value.intValue();
  }

  private static long nonNegative(final JsonNode node, final String key,
      final int defaultValue) {
    final int value = integer(node, key, defaultValue);
    if (value < 0) {
      throw new ConfigException(key + " must not be negative, got: "
          + value);
    }
    return value;
  }

  private static Duration positive(final JsonNode node, final String key,
      final int defaultValue) {
    final int value = integer(node, key, defaultValue);
    if (value <= 0) {
      throw new ConfigException(key + " must be positive, got: " + value);
    }
    return Duration.ofSeconds(value);
  }
}
