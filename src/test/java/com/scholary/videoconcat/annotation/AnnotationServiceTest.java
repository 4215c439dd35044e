package com.scholary.videoconcat.annotation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videoconcat.annotation.AnnotationService.AnnotationBatch;
import com.scholary.videoconcat.api.AnnotationRequest;
import com.scholary.videoconcat.api.AnnotationResponse;
import com.scholary.videoconcat.catalog.SourceVideo;
import com.scholary.videoconcat.objectstore.ObjectStoreClient;
import com.scholary.videoconcat.objectstore.ObjectStoreProperties;
import com.scholary.videoconcat.planning.ConcatenationRecord;
import com.scholary.videoconcat.service.ConcatMetadataEntry;
import com.scholary.videoconcat.service.PlanWriter;
import com.scholary.videoconcat.transition.PlaceholderTransitionClient;
import com.scholary.videoconcat.transition.TransitionClient;
import com.scholary.videoconcat.transition.TransitionException;
import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AnnotationServiceTest {

  private static final Executor DIRECT = Runnable::run;

  @Mock private ObjectStoreClient objectStoreClient;
  @Mock private TransitionClient transitionClient;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private PlanWriter planWriter;

  @BeforeEach
  void setUp() {
    planWriter =
        new PlanWriter(
            objectMapper,
            objectStoreClient,
            new ObjectStoreProperties(
                "http://localhost:9000", "key", "secret", "videos", "us-east-1", true, 168));
  }

  private AnnotationService service(TransitionClient client, int batchSize) {
    return new AnnotationService(
        objectStoreClient,
        planWriter,
        new VideoDescriptionLoader(objectMapper),
        client,
        DIRECT,
        batchSize);
  }

  private static ConcatMetadataEntry entry(int id, String... videoIds) {
    List<SourceVideo> videos = new ArrayList<>();
    for (String videoId : videoIds) {
      videos.add(new SourceVideo(videoId, 10.0, "/clips/" + videoId + ".mp4"));
    }
    return ConcatMetadataEntry.from(ConcatenationRecord.fromSelection(id, videos));
  }

  @Test
  void annotateRecord_shouldBridgeConsecutiveDescribedClips() {
    when(transitionClient.generateTransition("dog", "cat")).thenReturn("After the dog, a cat.");

    AnnotationBatch batch =
        service(transitionClient, 4)
            .annotate(List.of(entry(0, "A", "B", "C")), Map.of("A", "dog", "B", "cat"));

    ConcatAnnotation annotation = batch.annotations().get(0);
    assertThat(annotation.video()).isEqualTo("concat_00000");
    assertThat(annotation.data())
        .extracting(AnnotatedSegment::summary)
        .containsExactly("dog", "After the dog, a cat.", "");
    assertThat(annotation.data().get(1).start()).isEqualTo(10.0);
    assertThat(annotation.data().get(1).end()).isEqualTo(20.0);
    assertThat(batch.generated()).isEqualTo(1);
    assertThat(batch.failed()).isZero();
  }

  @Test
  void annotateRecord_shouldSkipTransitionWhenPreviousClipUndescribed() {
    AnnotationBatch batch =
        service(transitionClient, 4).annotate(List.of(entry(0, "A", "B")), Map.of("B", "cat"));

    assertThat(batch.annotations().get(0).data())
        .extracting(AnnotatedSegment::summary)
        .containsExactly("", "cat");
    verify(transitionClient, never()).generateTransition(anyString(), anyString());
  }

  @Test
  void annotateRecord_shouldKeepDescriptionWhenTransitionFails() {
    when(transitionClient.generateTransition("dog", "cat"))
        .thenThrow(new TransitionException("service unavailable"));

    AnnotationBatch batch =
        service(transitionClient, 4)
            .annotate(List.of(entry(0, "A", "B")), Map.of("A", "dog", "B", "cat"));

    assertThat(batch.annotations().get(0).data())
        .extracting(AnnotatedSegment::summary)
        .containsExactly("dog", "cat");
    assertThat(batch.generated()).isZero();
    assertThat(batch.failed()).isEqualTo(1);
  }

  @Test
  void annotate_shouldPreservePlanOrderAcrossBatches() {
    List<ConcatMetadataEntry> plan = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      plan.add(entry(i, "A", "B"));
    }

    AnnotationBatch batch =
        service(new PlaceholderTransitionClient(), 2)
            .annotate(plan, Map.of("A", "dog", "B", "cat"));

    assertThat(batch.annotations())
        .extracting(ConcatAnnotation::video)
        .containsExactly(
            "concat_00000", "concat_00001", "concat_00002", "concat_00003", "concat_00004");
    assertThat(batch.annotations().get(4).data().get(1).summary())
        .isEqualTo("[TRANSITION] cat");
    assertThat(batch.generated()).isEqualTo(5);
  }

  @Test
  void annotate_shouldLoadPlanAndSaveNextToIt() throws Exception {
    byte[] plan = planWriter.writeJson(List.of(entry(0, "A", "B")));
    String descriptions =
        "{\"video\": \"A.mp4\", \"conversations\": [{\"from\": \"gpt\", \"value\": \"dog\"}]}\n"
            + "{\"video\": \"B.mp4\", \"conversations\":"
            + " [{\"from\": \"gpt\", \"value\": \"cat\"}]}";
    when(objectStoreClient.getObjectStream("videos", "plans/clips_concat_metadata.json"))
        .thenReturn(new ByteArrayInputStream(plan));
    when(objectStoreClient.getObjectStream("videos", "captions.jsonl"))
        .thenReturn(new ByteArrayInputStream(descriptions.getBytes(StandardCharsets.UTF_8)));
    when(objectStoreClient.presignGet(
            eq("videos"), eq("plans/clips_concat_metadata_annotations.json"), any()))
        .thenReturn(URI.create("http://localhost:9000/videos/annotations").toURL());

    AnnotationResponse response =
        service(new PlaceholderTransitionClient(), 8)
            .annotate(
                new AnnotationRequest(
                    "videos",
                    "plans/clips_concat_metadata.json",
                    "captions.jsonl",
                    null,
                    null,
                    null));

    assertThat(response.annotations()).hasSize(1);
    assertThat(response.transitionsGenerated()).isEqualTo(1);
    assertThat(response.incompleteDropped()).isZero();
    assertThat(response.storageInfo().key())
        .isEqualTo("plans/clips_concat_metadata_annotations.json");
    verify(objectStoreClient)
        .putBytes(
            eq("videos"),
            eq("plans/clips_concat_metadata_annotations.json"),
            any(),
            eq("application/json"));
  }

  @Test
  void dropIncomplete_shouldRemoveConcatenationsWithBlankSummaries() {
    ConcatAnnotation complete =
        new ConcatAnnotation(
            "concat_00000",
            List.of(
                new AnnotatedSegment(0.0, 10.0, "dog"),
                new AnnotatedSegment(10.0, 20.0, "cat")));
    ConcatAnnotation blank =
        new ConcatAnnotation(
            "concat_00001",
            List.of(
                new AnnotatedSegment(0.0, 10.0, "dog"),
                new AnnotatedSegment(10.0, 20.0, "  ")));
    ConcatAnnotation empty =
        new ConcatAnnotation("concat_00002", List.of(new AnnotatedSegment(0.0, 10.0, "")));

    List<ConcatAnnotation> kept =
        AnnotationService.dropIncomplete(List.of(complete, blank, empty));

    assertThat(kept).containsExactly(complete);
  }

  @Test
  void annotate_shouldReportDroppedConcatenationsWithoutSaving() throws Exception {
    byte[] plan = planWriter.writeJson(List.of(entry(0, "A", "B"), entry(1, "A", "C")));
    String descriptions =
        "[{\"video_id\": \"A\", \"data\": [{\"summary\": \"dog\"}]},"
            + " {\"video_id\": \"B\", \"data\": [{\"summary\": \"cat\"}]}]";
    when(objectStoreClient.getObjectStream("videos", "plan.json"))
        .thenReturn(new ByteArrayInputStream(plan));
    when(objectStoreClient.getObjectStream("videos", "captions.json"))
        .thenReturn(new ByteArrayInputStream(descriptions.getBytes(StandardCharsets.UTF_8)));

    AnnotationResponse response =
        service(new PlaceholderTransitionClient(), 8)
            .annotate(
                new AnnotationRequest("videos", "plan.json", "captions.json", null, false, true));

    assertThat(response.annotations())
        .extracting(ConcatAnnotation::video)
        .containsExactly("concat_00000");
    assertThat(response.incompleteDropped()).isEqualTo(1);
    assertThat(response.storageInfo()).isNull();
    verify(objectStoreClient, never()).putBytes(any(), any(), any(), any());
  }

  @Test
  void constructor_shouldRejectNonPositiveBatchSize() {
    assertThatThrownBy(() -> service(transitionClient, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
