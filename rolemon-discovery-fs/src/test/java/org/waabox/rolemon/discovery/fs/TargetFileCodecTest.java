package org.waabox.rolemon.discovery.fs;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.waabox.rolemon.discovery.TargetSpec;

/**
 * Tests for {@link TargetFileCodec}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class TargetFileCodecTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final Map<String, String> LABELS = Map.of(
      "hostname", "gpu01", "cluster", "hpc", "instance", "gpu01");

  @Test
  void whenEncoding_givenTargets_shouldWriteOneEntryPerTarget()
      throws Exception {
    final Set<TargetSpec> targets = Set.of(
        new TargetSpec("gpu01", 9400, "dcgm_exporter", LABELS),
        new TargetSpec("gpu01", 9100, "node_exporter", LABELS));

    final JsonNode root = MAPPER.readTree(TargetFileCodec.encode(targets));

    assertTrue(root.isArray());
    assertEquals(2, root.size());
    assertEquals("gpu01:9400", root.get(0).get("targets").get(0).asText());
    assertEquals("dcgm_exporter",
        root.get(0).get("labels").get("job").asText());
    assertEquals("gpu01:9100", root.get(1).get("targets").get(0).asText());
    assertEquals("hpc", root.get(1).get("labels").get("cluster").asText());
  }

  @Test
  void whenEncoding_givenLabels_shouldPutJobFirstThenSortedLabels()
      throws Exception {
    final JsonNode labels = MAPPER.readTree(TargetFileCodec.encode(Set.of(
        new TargetSpec("gpu01", 9100, "node_exporter", LABELS))))
        .get(0).get("labels");

    final List<String> names = new ArrayList<>();
    final Iterator<String> it = labels.fieldNames();
    it.forEachRemaining(names::add);

    assertEquals(List.of("job", "cluster", "hostname", "instance"), names);
  }

  @Test
  void whenEncoding_givenSameTargetsInAnyOrder_shouldWriteSameBytes() {
    final TargetSpec node = new TargetSpec("gpu01", 9100, "node_exporter",
        LABELS);
    final TargetSpec gpu = new TargetSpec("gpu01", 9445, "gpu_exporter",
        LABELS);

    final Set<TargetSpec> first = new LinkedHashSet<>(List.of(node, gpu));
    final Set<TargetSpec> second = new LinkedHashSet<>(List.of(gpu, node));

    assertArrayEquals(TargetFileCodec.encode(first),
        TargetFileCodec.encode(second));
  }

  @Test
  void whenEncoding_givenNoTargets_shouldWriteAnEmptyArray() {
    final String text = new String(TargetFileCodec.encode(Set.of()),
        StandardCharsets.UTF_8);

    assertEquals("[ ]\n", text);
  }
}
