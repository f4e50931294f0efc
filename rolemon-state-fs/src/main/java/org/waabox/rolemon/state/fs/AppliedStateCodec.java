package org.waabox.rolemon.state.fs;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.rolemon.state.AppliedState;
import org.waabox.rolemon.state.ServiceFailure;

/**
 * Static utility class for serializing and deserializing
 * {@link AppliedState} instances to and from JSON strings.
 *
 * <p>Uses Jackson's tree model. {@link Instant} values are stored as
 * ISO-8601 strings, absent values as JSON nulls. The document carries a
 * {@code version} field; documents of another version are rejected, which
 * the store treats like a missing state.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AppliedStateCodec {

  /** The document format version. */
  static final int VERSION = 1;

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT);

  /** Private constructor to prevent instantiation. */
  private AppliedStateCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a state into a JSON string.
   *
   * @param state the state to serialize, never null.
   * @return the JSON representation of the state, never null.
   */
  public static String serialize(final AppliedState state) {
    Objects.requireNonNull(state, "state cannot be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put("version", VERSION);
    node.put("rolesHash", state.rolesHash());
    strings(node.putArray("servicesStarted"), state.servicesStarted());
    strings(node.putArray("servicesStopped"), state.servicesStopped());
    node.put("publishedHostname", state.publishedHostname());
    node.put("targetFileHash", state.targetFileHash());
    strings(node.putArray("pendingRetractions"),
        state.pendingRetractions());

    final ObjectNode failures = node.putObject("serviceFailures");
    for (final Map.Entry<String, ServiceFailure> entry
        : state.serviceFailures().entrySet()) {
      final ServiceFailure failure = entry.getValue();
      final ObjectNode item = failures.putObject(entry.getKey());
      item.put("desiredRunning", failure.desiredRunning());
      item.put("attempts", failure.attempts());
      item.put("lastAttemptAt", failure.lastAttemptAt().toString());
    }

    node.put("verifiedAt", instant(state.verifiedAt()));
    node.put("updatedAt", instant(state.updatedAt()));

    try {
      return MAPPER.writeValueAsString(node) + "\n";
    } catch (final Exception e) {
      throw new IllegalStateException("Failed to serialize state", e);
    }
  }

  /**
   * Deserializes a JSON string into a state.
   *
   * <p>Missing collections read as empty, missing values as null.
   *
   * @param json the JSON string to parse, never null.
   * @return the parsed state, never null.
   * @throws IllegalArgumentException if the JSON is malformed, of another
   *     version, or holds invalid values.
   */
  public static AppliedState deserialize(final String json) {
    Objects.requireNonNull(json, "json cannot be null");

    try {
      final JsonNode node = MAPPER.readTree(json);
      if (node == null || !node.isObject()) {
        throw new IllegalArgumentException("State is not a JSON object");
      }
      final int version = node.path("version").asInt(-1);
      if (version != VERSION) {
        throw new IllegalArgumentException(
            "Unsupported state version: " + node.path("version"));
      }

      final Map<String, ServiceFailure> failures = new TreeMap<>();
      final JsonNode failuresNode = node.path("serviceFailures");
      final Iterator<Map.Entry<String, JsonNode>> fields =
          failuresNode.fields();
      while (fields.hasNext()) {
        final Map.Entry<String, JsonNode> field = fields.next();
        final JsonNode item = field.getValue();
        failures.put(field.getKey(), new ServiceFailure(
            requireField(item, "desiredRunning").asBoolean(),
            requireField(item, "attempts").asInt(),
            Instant.parse(requireField(item, "lastAttemptAt").asText())));
      }

      return new AppliedState(
          text(node, "rolesHash"),
          strings(node, "servicesStarted"),
          strings(node, "servicesStopped"),
          text(node, "publishedHostname"),
          text(node, "targetFileHash"),
          strings(node, "pendingRetractions"),
          failures,
          instant(node, "verifiedAt"),
          instant(node, "updatedAt"));
    } catch (final IllegalArgumentException e) {
      throw e;
    } catch (final Exception e) {
      throw new IllegalArgumentException(
          "Failed to deserialize state from JSON", e);
    }
  }

  private static void strings(final ArrayNode array,
      final Set<String> values) {
    for (final String value : values) {
      array.add(value);
    }
  }

  private static Set<String> strings(final JsonNode node,
      final String field) {
    final Set<String> values = new LinkedHashSet<>();
    final JsonNode array = node.path(field);
    if (array.isMissingNode() || array.isNull()) {
      return values;
    }
    if (!array.isArray()) {
      throw new IllegalArgumentException(field + " is not an array");
    }
    for (final JsonNode item : array) {
      values.add(item.asText());
    }
    return values;
  }

  private static String text(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    return value.asText();
  }

  private static String instant(final Instant value) {
    return value == null ? null : value.toString();
  }

  private static Instant instant(final JsonNode node, final String field) {
    final String value = text(node, field);
    return value == null ? null : Instant.parse(value);
  }

  /** Returns the field node for the given key or throws if missing.
   *
   * @param node the parent JSON node.
   * @param field the field name to look up.
   * @return the field node, never null.
   * @throws IllegalArgumentException if the field is missing.
   */
  private static JsonNode requireField(final JsonNode node,
      final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException("Missing field: " + field);
    }
    return value;
  }
}
