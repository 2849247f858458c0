package io.b2mash.b2b.gobdvault.export;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/** In-memory ZIP bundle. Entry names are recorded in insertion order for manifests. */
public class ZipBundleWriter {

  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final ZipOutputStream zip = new ZipOutputStream(buffer);
  private final List<String> entryNames = new ArrayList<>();
  private boolean finished;

  public ZipBundleWriter add(String name, byte[] content) {
    if (finished) {
      throw new IllegalStateException("Bundle already finished");
    }
    try {
      zip.putNextEntry(new ZipEntry(name));
      zip.write(content);
      zip.closeEntry();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write bundle entry " + name, e);
    }
    entryNames.add(name);
    return this;
  }

  public ZipBundleWriter add(String name, String content) {
    return add(name, content.getBytes(StandardCharsets.UTF_8));
  }

  public List<String> entryNames() {
    return Collections.unmodifiableList(entryNames);
  }

  /** Completes the archive and returns its bytes. No entries can be added afterwards. */
  public byte[] finish() {
    if (!finished) {
      try {
        zip.finish();
        zip.close();
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to generate export ZIP", e);
      }
      finished = true;
    }
    return buffer.toByteArray();
  }

  /** Makes a user-supplied filename safe to use as a single ZIP path segment. */
  public static String safeName(String filename) {
    if (filename == null || filename.isBlank()) {
      return "unnamed";
    }
    String cleaned = filename.replaceAll("[/\\\\:*?\"<>|\\p{Cntrl}]", "_");
    return cleaned.replace("..", "_");
  }
}
