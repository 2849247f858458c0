package io.b2mash.b2b.gobdvault.export;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipInputStream;
import org.junit.jupiter.api.Test;

class ZipBundleWriterTest {

  @Test
  void finish_producesReadableArchiveInInsertionOrder() throws IOException {
    var bundle = new ZipBundleWriter().add("b.txt", "second").add("a.txt", "first");

    byte[] zip = bundle.finish();

    var names = new ArrayList<String>();
    try (var in = new ZipInputStream(new ByteArrayInputStream(zip))) {
      for (var entry = in.getNextEntry(); entry != null; entry = in.getNextEntry()) {
        names.add(entry.getName());
      }
    }
    assertThat(names).containsExactly("b.txt", "a.txt");
    assertThat(bundle.entryNames()).isEqualTo(List.of("b.txt", "a.txt"));
  }

  @Test
  void add_afterFinishIsRejected() {
    var bundle = new ZipBundleWriter().add("a.txt", "x");
    bundle.finish();

    assertThatThrownBy(() -> bundle.add("b.txt", "y")).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void safeName_neutralizesPathSegments() {
    assertThat(ZipBundleWriter.safeName("../../etc/passwd"))
        .doesNotContain("/")
        .doesNotContain("..");
    assertThat(ZipBundleWriter.safeName("C:\\temp\\a.pdf")).isEqualTo("C__temp_a.pdf");
    assertThat(ZipBundleWriter.safeName("  ")).isEqualTo("unnamed");
    assertThat(ZipBundleWriter.safeName("Rechnung 42.pdf")).isEqualTo("Rechnung 42.pdf");
  }
}
