package com.scholary.videoconcat.objectstore;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

class S3ObjectStoreClientTest {

  @Test
  void translate_shouldReportMissingKey() {
    NoSuchKeyException missing = NoSuchKeyException.builder().message("missing").build();

    ObjectStoreException e =
        S3ObjectStoreClient.translate("retrieve object", "videos", "clips.json", missing);

    assertThat(e).hasMessage("Object not found: bucket=videos, key=clips.json");
    assertThat(e.getCause()).isSameAs(missing);
  }

  @Test
  void translate_shouldIncludeStatusCode() {
    S3Exception denied = (S3Exception) S3Exception.builder().statusCode(403).message("no").build();

    ObjectStoreException e =
        S3ObjectStoreClient.translate("upload object", "videos", "plan.json", denied);

    assertThat(e.getMessage())
        .isEqualTo("Failed to upload object: bucket=videos, key=plan.json, statusCode=403");
  }

  @Test
  void translate_shouldWrapClientErrors() {
    SdkClientException offline = SdkClientException.create("connection refused");

    ObjectStoreException e =
        S3ObjectStoreClient.translate("retrieve object", "videos", "clips.json", offline);

    assertThat(e.getMessage()).startsWith("Unexpected error during retrieve object");
  }

  @Test
  void presignGet_shouldSignWithoutContactingStorage() throws Exception {
    ObjectStoreProperties properties =
        new ObjectStoreProperties(
            "http://localhost:9000", "admin", "admin123", "videos", "us-east-1", true, 168);

    try (S3ObjectStoreClient client = new S3ObjectStoreClient(properties)) {
      String url = client.presignGet("videos", "meta/plan.json", Duration.ofHours(1)).toString();

      assertThat(url).startsWith("http://localhost:9000/videos/meta/plan.json?");
      assertThat(url).contains("X-Amz-Expires=3600");
    }
  }
}
