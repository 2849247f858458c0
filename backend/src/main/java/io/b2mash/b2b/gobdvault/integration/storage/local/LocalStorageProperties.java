package io.b2mash.b2b.gobdvault.integration.storage.local;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** @param rootDir directory under which object keys are resolved */
@ConfigurationProperties("storage.local")
public record LocalStorageProperties(Path rootDir) {

  public LocalStorageProperties {
    if (rootDir == null) {
      rootDir = Path.of("data", "archive");
    }
  }
}
