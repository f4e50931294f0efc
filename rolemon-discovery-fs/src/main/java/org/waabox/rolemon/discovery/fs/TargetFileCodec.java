package org.waabox.rolemon.discovery.fs;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.rolemon.discovery.TargetSpec;

/**
 * Static utility class writing the file based service discovery descriptor
 * read by the metrics scraper.
 *
 * <p>The descriptor is a JSON array with one entry per target:
 * <pre>
 * [ {
 *   "targets" : [ "gpu01:9400" ],
 *   "labels" : { "job" : "dcgm_exporter", "cluster" : "hpc", ... }
 * } ]
 * </pre>
 *
 * <p>Entries are sorted by job then address, {@code job} is the first label
 * and the other labels follow in name order, so equal target sets always
 * produce the same bytes.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TargetFileCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT);

  /** Private constructor to prevent instantiation. */
  private TargetFileCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Encodes the targets as a descriptor.
   *
   * @param targets the targets, never null
   *
   * @return the UTF-8 descriptor, ending with a new line, never null
   */
  public static byte[] encode(final Set<TargetSpec> targets) {
    Objects.requireNonNull(targets, "targets cannot be null");

    final ArrayNode root = MAPPER.createArrayNode();
    for (final TargetSpec target : new TreeSet<>(targets)) {
      final ObjectNode entry = root.addObject();
      entry.putArray("targets").add(target.endpoint());
      final ObjectNode labels = entry.putObject("labels");
      labels.put("job", target.job());
      for (final Map.Entry<String, String> label
          : target.labels().entrySet()) {
        labels.put(label.getKey(), label.getValue());
      }
    }

    try {
      return (MAPPER.writeValueAsString(root) + "\n")
          .getBytes(StandardCharsets.UTF_8);
    } catch (final JsonProcessingException e) {
      throw new IllegalStateException("Cannot encode targets " + targets, e);
    }
  }
}
