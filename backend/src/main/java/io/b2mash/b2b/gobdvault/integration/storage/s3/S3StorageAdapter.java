package io.b2mash.b2b.gobdvault.integration.storage.s3;

import io.b2mash.b2b.gobdvault.config.S3Config.S3Properties;
import io.b2mash.b2b.gobdvault.exception.ResourceConflictException;
import io.b2mash.b2b.gobdvault.exception.ResourceNotFoundException;
import io.b2mash.b2b.gobdvault.exception.StorageUnavailableException;
import io.b2mash.b2b.gobdvault.integration.storage.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/** S3 implementation of {@link StorageService}. All AWS SDK types are confined to this class. */
@Component
@ConditionalOnProperty(name = "storage.provider", havingValue = "s3", matchIfMissing = true)
public class S3StorageAdapter implements StorageService {

  private static final Logger log = LoggerFactory.getLogger(S3StorageAdapter.class);

  private final S3Client s3Client;
  private final String bucketName;

  public S3StorageAdapter(S3Client s3Client, S3Properties s3Properties) {
    this.s3Client = s3Client;
    this.bucketName = s3Properties.bucketName();
  }

  @Override
  public String upload(String key, byte[] content, String contentType) {
    var putRequest =
        PutObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .contentType(contentType)
            .ifNoneMatch("*")
            .build();
    try {
      s3Client.putObject(putRequest, RequestBody.fromBytes(content));
    } catch (S3Exception e) {
      // 412: object exists; 409: a concurrent conditional write to the same key won
      if (e.statusCode() == 412 || e.statusCode() == 409) {
        throw new ResourceConflictException(
            "Stored object exists", "An object is already stored under key " + key, e);
      }
      throw new StorageUnavailableException("Failed to upload object " + key, e);
    } catch (SdkException e) {
      throw new StorageUnavailableException("Failed to upload object " + key, e);
    }
    return key;
  }

  @Override
  public byte[] download(String key) {
    var getRequest = GetObjectRequest.builder().bucket(bucketName).key(key).build();
    try (var response = s3Client.getObject(getRequest)) {
      return response.readAllBytes();
    } catch (NoSuchKeyException e) {
      throw ResourceNotFoundException.withDetail(
          "Stored object not found", "No object stored under key " + key);
    } catch (Exception e) {
      log.warn("Download failed for key: {}", key, e);
      throw new StorageUnavailableException("Failed to download object " + key, e);
    }
  }

  @Override
  public boolean exists(String key) {
    try {
      s3Client.headObject(HeadObjectRequest.builder().bucket(bucketName).key(key).build());
      return true;
    } catch (NoSuchKeyException e) {
      return false;
    } catch (SdkException e) {
      throw new StorageUnavailableException("Failed to check object " + key, e);
    }
  }

  @Override
  public boolean delete(String key) {
    try {
      var deleteRequest = DeleteObjectRequest.builder().bucket(bucketName).key(key).build();
      s3Client.deleteObject(deleteRequest);
      return true;
    } catch (Exception e) {
      log.warn("Best-effort S3 deletion failed for key={}: {}", key, e.getMessage());
      return false;
    }
  }
}
