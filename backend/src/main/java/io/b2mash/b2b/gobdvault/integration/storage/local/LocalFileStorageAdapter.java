package io.b2mash.b2b.gobdvault.integration.storage.local;

import io.b2mash.b2b.gobdvault.exception.ResourceConflictException;
import io.b2mash.b2b.gobdvault.exception.ResourceNotFoundException;
import io.b2mash.b2b.gobdvault.exception.StorageUnavailableException;
import io.b2mash.b2b.gobdvault.integration.storage.StorageService;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Filesystem implementation of {@link StorageService} for single-node deployments and tests.
 * Files are created with {@code CREATE_NEW} and, on POSIX filesystems, readable and writable by the
 * owner only.
 */
@Component
@ConditionalOnProperty(name = "storage.provider", havingValue = "local")
@EnableConfigurationProperties(LocalStorageProperties.class)
public class LocalFileStorageAdapter implements StorageService {

  private static final Logger log = LoggerFactory.getLogger(LocalFileStorageAdapter.class);

  private static final Set<PosixFilePermission> OWNER_FILE =
      PosixFilePermissions.fromString("rw-------");
  private static final Set<PosixFilePermission> OWNER_DIR =
      PosixFilePermissions.fromString("rwx------");

  private final Path root;

  public LocalFileStorageAdapter(LocalStorageProperties properties) {
    this.root = properties.rootDir().toAbsolutePath().normalize();
  }

  @Override
  public String upload(String key, byte[] content, String contentType) {
    Path target = resolve(key);
    try {
      createDirectories(target.getParent());
      Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
      if (supportsPosix(target)) {
        Files.setPosixFilePermissions(target, OWNER_FILE);
      }
      return key;
    } catch (FileAlreadyExistsException e) {
      throw new ResourceConflictException(
          "Stored object exists", "An object is already stored under key " + key, e);
    } catch (IOException e) {
      throw new StorageUnavailableException("Failed to write object " + key, e);
    }
  }

  @Override
  public byte[] download(String key) {
    try {
      return Files.readAllBytes(resolve(key));
    } catch (NoSuchFileException e) {
      throw ResourceNotFoundException.withDetail(
          "Stored object not found", "No object stored under key " + key);
    } catch (IOException e) {
      throw new StorageUnavailableException("Failed to read object " + key, e);
    }
  }

  @Override
  public boolean exists(String key) {
    return Files.isRegularFile(resolve(key));
  }

  @Override
  public boolean delete(String key) {
    try {
      return Files.deleteIfExists(resolve(key));
    } catch (IOException e) {
      log.warn("Best-effort file deletion failed for key={}: {}", key, e.getMessage());
      return false;
    }
  }

  private Path resolve(String key) {
    Path resolved = root.resolve(key).normalize();
    if (!resolved.startsWith(root) || resolved.equals(root)) {
      throw new IllegalArgumentException("Invalid storage key: " + key);
    }
    return resolved;
  }

  private void createDirectories(Path dir) throws IOException {
    if (Files.isDirectory(dir)) {
      return;
    }
    if (supportsPosix(root)) {
      Files.createDirectories(dir, PosixFilePermissions.asFileAttribute(OWNER_DIR));
    } else {
      Files.createDirectories(dir);
    }
  }

  private static boolean supportsPosix(Path path) {
    return path.getFileSystem().supportedFileAttributeViews().contains("posix");
  }
}
