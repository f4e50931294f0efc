package org.waabox.rolemon;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link LocalHostname}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class LocalHostnameTest {

  @TempDir
  Path dir;

  @Test
  void whenResolving_givenKernelHostname_shouldUseItsShortForm()
      throws Exception {
    final Path kernel = dir.resolve("hostname");
    Files.writeString(kernel, "gpu-node07.cluster.example.org\n",
        StandardCharsets.UTF_8);

    assertEquals("gpu-node07", LocalHostname.shortName(kernel));
  }

  @Test
  void whenShortening_givenFullyQualifiedName_shouldKeepFirstLabel() {
    assertEquals("node01", LocalHostname.shorten(" node01.hpc.local "));
    assertEquals("node01", LocalHostname.shorten("node01"));
  }
}
