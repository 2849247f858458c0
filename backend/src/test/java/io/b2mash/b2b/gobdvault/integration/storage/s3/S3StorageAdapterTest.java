package io.b2mash.b2b.gobdvault.integration.storage.s3;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.gobdvault.config.S3Config.S3Properties;
import io.b2mash.b2b.gobdvault.exception.ResourceConflictException;
import io.b2mash.b2b.gobdvault.exception.ResourceNotFoundException;
import io.b2mash.b2b.gobdvault.exception.StorageUnavailableException;
import java.io.ByteArrayInputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

class S3StorageAdapterTest {

  private static final String KEY = "archives/tenant_a/doc-1.enc";

  private S3Client s3Client;
  private S3StorageAdapter adapter;

  @BeforeEach
  void setUp() {
    s3Client = mock(S3Client.class);
    adapter = new S3StorageAdapter(s3Client, new S3Properties(null, "eu-central-1", "vault", null));
  }

  @Test
  void uploadWritesConditionallySoExistingObjectsAreNeverReplaced() {
    String key = adapter.upload(KEY, new byte[] {1, 2, 3}, "application/octet-stream");

    var captor = ArgumentCaptor.forClass(PutObjectRequest.class);
    verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
    verify(s3Client, never()).headObject(any(HeadObjectRequest.class));
    assertThat(key).isEqualTo(KEY);
    assertThat(captor.getValue().bucket()).isEqualTo("vault");
    assertThat(captor.getValue().key()).isEqualTo(KEY);
    assertThat(captor.getValue().ifNoneMatch()).isEqualTo("*");
  }

  @Test
  void uploadOfExistingKeyIsConflict() {
    when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenThrow(S3Exception.builder().statusCode(412).message("PreconditionFailed").build());

    assertThatThrownBy(() -> adapter.upload(KEY, new byte[] {1}, "application/octet-stream"))
        .isInstanceOf(ResourceConflictException.class);
  }

  @Test
  void uploadLosingConcurrentConditionalWriteIsConflict() {
    when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenThrow(
            S3Exception.builder().statusCode(409).message("ConditionalRequestConflict").build());

    assertThatThrownBy(() -> adapter.upload(KEY, new byte[] {1}, "application/octet-stream"))
        .isInstanceOf(ResourceConflictException.class);
  }

  @Test
  void uploadServerErrorIsStorageUnavailable() {
    when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenThrow(S3Exception.builder().statusCode(500).message("InternalError").build());

    assertThatThrownBy(() -> adapter.upload(KEY, new byte[] {1}, "application/octet-stream"))
        .isInstanceOf(StorageUnavailableException.class);
  }

  @Test
  void downloadReturnsObjectBytes() {
    var body =
        new ResponseInputStream<>(
            GetObjectResponse.builder().build(),
            AbortableInputStream.create(new ByteArrayInputStream(new byte[] {7, 8})));
    when(s3Client.getObject(any(GetObjectRequest.class))).thenReturn(body);

    assertThat(adapter.download(KEY)).containsExactly(7, 8);
  }

  @Test
  void downloadOfMissingKeyIsNotFound() {
    when(s3Client.getObject(any(GetObjectRequest.class)))
        .thenThrow(NoSuchKeyException.builder().message("missing").build());

    assertThatThrownBy(() -> adapter.download(KEY))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void clientFailureSurfacesAsStorageUnavailable() {
    when(s3Client.getObject(any(GetObjectRequest.class)))
        .thenThrow(SdkClientException.create("connection reset"));

    assertThatThrownBy(() -> adapter.download(KEY))
        .isInstanceOf(StorageUnavailableException.class);
  }

  @Test
  void deleteReportsFailureInsteadOfThrowing() {
    when(s3Client.deleteObject(any(DeleteObjectRequest.class)))
        .thenThrow(SdkClientException.create("connection reset"));

    assertThat(adapter.delete(KEY)).isFalse();
  }
}
