package com.scholary.videoconcat.annotation;

import com.scholary.videoconcat.api.AnnotationRequest;
import com.scholary.videoconcat.api.AnnotationResponse;
import com.scholary.videoconcat.api.StorageInfo;
import com.scholary.videoconcat.logging.StructuredLogger;
import com.scholary.videoconcat.objectstore.ObjectStoreClient;
import com.scholary.videoconcat.service.ConcatMetadataEntry;
import com.scholary.videoconcat.service.ConcatMetadataEntry.BoundaryEntry;
import com.scholary.videoconcat.service.PlanWriter;
import com.scholary.videoconcat.transition.TransitionClient;
import com.scholary.videoconcat.transition.TransitionException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Builds annotations for a saved plan.
 *
 * <p>Each clip's summary is its own description. For every clip after the first, when both it and
 * the clip before it have a description, the summary is replaced by transition text bridging the
 * two. Records are annotated in parallel on the task executor, at most {@code batchSize} at a
 * time. A failed transition keeps the clip's description and is counted, it never fails the
 * request.
 */
@Service
public class AnnotationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnnotationService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String ANNOTATION_SUFFIX = "_annotations.json";
  private static final String VIDEO_SUFFIX = ".mp4";

  private final ObjectStoreClient objectStoreClient;
  private final PlanWriter planWriter;
  private final VideoDescriptionLoader descriptionLoader;
  private final TransitionClient transitionClient;
  private final Executor executor;
  private final int batchSize;

  public AnnotationService(
      ObjectStoreClient objectStoreClient,
      PlanWriter planWriter,
      VideoDescriptionLoader descriptionLoader,
      TransitionClient transitionClient,
      @Qualifier("taskExecutor") Executor executor,
      @Value("${annotation.batch-size:8}") int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("annotation.batch-size must be positive");
    }
    this.objectStoreClient = objectStoreClient;
    this.planWriter = planWriter;
    this.descriptionLoader = descriptionLoader;
    this.transitionClient = transitionClient;
    this.executor = executor;
    this.batchSize = batchSize;
  }

  /** Annotate a saved plan and save the annotations when the request asks for it. */
  public AnnotationResponse annotate(AnnotationRequest request) throws IOException {
    MDC.put("correlationId", UUID.randomUUID().toString());

    try {
      LOGGER.info(
          "Starting annotation: bucket={}, planKey={}, descriptionsKey={}",
          request.bucket(),
          request.planKey(),
          request.descriptionsKey());

      List<ConcatMetadataEntry> plan = planWriter.readPlan(request.bucket(), request.planKey());
      Map<String, String> descriptions =
          descriptionLoader.load(
              objectStoreClient.getObjectStream(request.bucket(), request.descriptionsKey()),
              request.descriptionsKey());

      AnnotationBatch batch = annotate(plan, descriptions);
      List<ConcatAnnotation> annotations = batch.annotations();
      if (request.dropIncomplete()) {
        annotations = dropIncomplete(annotations);
      }
      int dropped = batch.annotations().size() - annotations.size();

      StorageInfo storageInfo = null;
      if (request.save()) {
        String outputKey =
            request.outputKey() != null && !request.outputKey().isBlank()
                ? request.outputKey()
                : PlanWriter.deriveKey(request.planKey(), ANNOTATION_SUFFIX);
        storageInfo = planWriter.saveDocument(request.bucket(), outputKey, annotations);
      }

      LOGGER.info(
          "Annotated {} videos: transitionsGenerated={}, transitionsFailed={}, dropped={}",
          annotations.size(),
          batch.generated(),
          batch.failed(),
          dropped);

      return new AnnotationResponse(
          annotations, batch.generated(), batch.failed(), dropped, storageInfo);

    } finally {
      MDC.remove("correlationId");
    }
  }

  /** Annotate every entry of a plan, preserving plan order. */
  AnnotationBatch annotate(List<ConcatMetadataEntry> plan, Map<String, String> descriptions) {
    List<ConcatAnnotation> annotations = new ArrayList<>(plan.size());
    int generated = 0;
    int failed = 0;

    for (int from = 0; from < plan.size(); from += batchSize) {
      List<CompletableFuture<RecordAnnotation>> futures = new ArrayList<>();
      int to = Math.min(from + batchSize, plan.size());
      for (ConcatMetadataEntry entry : plan.subList(from, to)) {
        futures.add(
            CompletableFuture.supplyAsync(() -> annotateRecord(entry, descriptions), executor));
      }
      for (CompletableFuture<RecordAnnotation> future : futures) {
        RecordAnnotation result = join(future);
        annotations.add(result.annotation());
        generated += result.generated();
        failed += result.failed();
      }
    }
    return new AnnotationBatch(annotations, generated, failed);
  }

  RecordAnnotation annotateRecord(ConcatMetadataEntry entry, Map<String, String> descriptions) {
    String video = entry.concatVideo().replace(VIDEO_SUFFIX, "");
    List<BoundaryEntry> boundaries = entry.boundaries();
    List<AnnotatedSegment> segments = new ArrayList<>(boundaries.size());
    int generated = 0;
    int failed = 0;

    for (int i = 0; i < boundaries.size(); i++) {
      BoundaryEntry boundary = boundaries.get(i);
      String summary = descriptions.getOrDefault(boundary.videoId(), "");

      if (i > 0 && !summary.isEmpty()) {
        String previous = descriptions.getOrDefault(boundaries.get(i - 1).videoId(), "");
        if (!previous.isEmpty()) {
          try {
            summary = transitionClient.generateTransition(previous, summary);
            generated++;
          } catch (TransitionException e) {
            STRUCTURED_LOGGER.logTransitionFailed(entry.concatVideo(), i, e.getMessage());
            failed++;
          }
        }
      }
      segments.add(new AnnotatedSegment(boundary.startTime(), boundary.endTime(), summary));
    }
    return new RecordAnnotation(new ConcatAnnotation(video, segments), generated, failed);
  }

  /** Keep only the annotations whose every segment has a non-blank summary. */
  static List<ConcatAnnotation> dropIncomplete(List<ConcatAnnotation> annotations) {
    List<ConcatAnnotation> kept = new ArrayList<>(annotations.size());
    for (ConcatAnnotation annotation : annotations) {
      long blank =
          annotation.data().stream()
              .filter(segment -> segment.summary() == null || segment.summary().isBlank())
              .count();
      if (blank == 0) {
        kept.add(annotation);
      } else {
        STRUCTURED_LOGGER.logIncompleteDropped(annotation.video(), (int) blank);
      }
    }
    return kept;
  }

  private static RecordAnnotation join(CompletableFuture<RecordAnnotation> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw e;
    }
  }

  record RecordAnnotation(ConcatAnnotation annotation, int generated, int failed) {}

  record AnnotationBatch(List<ConcatAnnotation> annotations, int generated, int failed) {}
}
