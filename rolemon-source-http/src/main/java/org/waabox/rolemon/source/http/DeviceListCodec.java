package org.waabox.rolemon.source.http;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.waabox.rolemon.LocalHostname;
import org.waabox.rolemon.source.ParseException;

/**
 * Static utility class that extracts the roles of one node from the device
 * listing of the cluster manager.
 *
 * <p>Uses Jackson's tree model ({@link JsonNode}). The listing is either a
 * JSON array of devices or an object whose {@code data} field holds that
 * array. Each device carries a {@code hostname} and a {@code roles} array,
 * whose entries are role names or objects with a {@code name} field.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DeviceListCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private DeviceListCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Returns the raw roles of the given node.
   *
   * <p>Device hostnames are compared by their first label, ignoring case.
   *
   * @param json   the device listing, never null
   * @param nodeId the short hostname of the node, never null
   *
   * @return the role names as listed, never null
   *
   * @throws ParseException if the listing is malformed or does not list
   *                        the node
   */
  public static Set<String> rolesOf(final String json, final String nodeId)
      throws ParseException {
    Objects.requireNonNull(json, "json cannot be null");
    Objects.requireNonNull(nodeId, "nodeId cannot be null");

    final JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (final JsonProcessingException e) {
      throw new ParseException("Device listing is not valid JSON", e);
    }

    final JsonNode devices = root != null && root.isObject()
        ? root.get("data")
        : root;
    if (devices == null || !devices.isArray()) {
      throw new ParseException("Device listing is not an array of devices");
    }

    final String wanted = LocalHostname.shorten(nodeId);
    for (final JsonNode device : devices) {
      final JsonNode hostname = device.get("hostname");
      if (hostname == null || !hostname.isTextual()) {
        continue;
      }
      if (LocalHostname.shorten(hostname.asText()).equalsIgnoreCase(wanted)) {
        return rolesOf(device);
      }
    }
    throw new ParseException("Node " + wanted
        + " not found in the device listing of " + devices.size()
        + " devices");
  }

  private static Set<String> rolesOf(final JsonNode device)
      throws ParseException {
    final Set<String> roles = new HashSet<>();
    final JsonNode listed = device.get("roles");
    if (listed == null || listed.isNull()) {
      return roles;
    }
    if (!listed.isArray()) {
      throw new ParseException("Field roles of device "
          + device.get("hostname").asText() + " is not an array");
    }
    for (final JsonNode role : listed) {
      if (role.isTextual()) {
        roles.add(role.asText());
      } else if (role.isObject() && role.hasNonNull("name")) {
        roles.add(role.get("name").asText());
      }
    }
    return roles;
  }
}
