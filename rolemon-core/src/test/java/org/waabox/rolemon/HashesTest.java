package org.waabox.rolemon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Hashes}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HashesTest {

  @Test
  void whenHashingBytes_shouldReturnLowercaseHexSha256() {
    assertEquals(
        "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
        Hashes.sha256("abc".getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void whenHashingRoles_givenDifferentOrder_shouldMatch() {
    assertEquals(Hashes.ofRoles(new LinkedHashSet<>(List.of("b", "a"))),
        Hashes.ofRoles(new LinkedHashSet<>(List.of("a", "b"))));
  }

  @Test
  void whenHashingRoles_givenConcatenationAmbiguity_shouldDiffer() {
    assertNotEquals(Hashes.ofRoles(Set.of("ab", "c")),
        Hashes.ofRoles(Set.of("a", "bc")));
  }
}
