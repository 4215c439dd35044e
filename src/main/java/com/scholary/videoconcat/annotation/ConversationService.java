package com.scholary.videoconcat.annotation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videoconcat.api.ConversationRequest;
import com.scholary.videoconcat.api.ConversationResponse;
import com.scholary.videoconcat.api.StorageInfo;
import com.scholary.videoconcat.objectstore.ObjectStoreClient;
import com.scholary.videoconcat.service.ConcatMetadataEntry;
import com.scholary.videoconcat.service.DocumentFormatException;
import com.scholary.videoconcat.service.PlanWriter;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Builds training conversations for a saved plan from its annotations document.
 *
 * <p>Annotations are matched to plan entries by video name. Entries without an annotation are
 * skipped and counted.
 */
@Service
public class ConversationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConversationService.class);

  static final String CONVERSATION_SUFFIX = "_train_conversations.json";
  private static final String VIDEO_SUFFIX = ".mp4";

  private static final TypeReference<List<ConcatAnnotation>> ANNOTATIONS_TYPE =
      new TypeReference<>() {};

  private final ObjectStoreClient objectStoreClient;
  private final PlanWriter planWriter;
  private final ObjectMapper objectMapper;
  private final TrainConversationBuilder conversationBuilder;

  public ConversationService(
      ObjectStoreClient objectStoreClient,
      PlanWriter planWriter,
      ObjectMapper objectMapper,
      TrainConversationBuilder conversationBuilder) {
    this.objectStoreClient = objectStoreClient;
    this.planWriter = planWriter;
    this.objectMapper = objectMapper;
    this.conversationBuilder = conversationBuilder;
  }

  /** Build conversations and save them when the request asks for it. */
  public ConversationResponse convert(ConversationRequest request) throws IOException {
    MDC.put("correlationId", UUID.randomUUID().toString());

    try {
      LOGGER.info(
          "Building training conversations: bucket={}, planKey={}, annotationsKey={}",
          request.bucket(),
          request.planKey(),
          request.annotationsKey());

      List<ConcatMetadataEntry> plan = planWriter.readPlan(request.bucket(), request.planKey());
      List<ConcatAnnotation> annotations =
          readAnnotations(
              objectStoreClient.getObjectStream(request.bucket(), request.annotationsKey()),
              request.annotationsKey());

      Map<String, ConcatAnnotation> byVideo = new HashMap<>();
      for (ConcatAnnotation annotation : annotations) {
        byVideo.put(annotation.video(), annotation);
      }

      List<TrainConversation> conversations = new ArrayList<>(plan.size());
      int skipped = 0;
      for (ConcatMetadataEntry entry : plan) {
        ConcatAnnotation annotation = byVideo.get(entry.concatVideo().replace(VIDEO_SUFFIX, ""));
        if (annotation == null) {
          LOGGER.debug("No annotation for {}, skipping", entry.concatVideo());
          skipped++;
          continue;
        }
        conversations.add(conversationBuilder.build(entry, annotation));
      }

      StorageInfo storageInfo = null;
      if (request.save()) {
        String outputKey =
            request.outputKey() != null && !request.outputKey().isBlank()
                ? request.outputKey()
                : PlanWriter.deriveKey(request.planKey(), CONVERSATION_SUFFIX);
        storageInfo = planWriter.saveDocument(request.bucket(), outputKey, conversations);
      }

      LOGGER.info("Built {} training conversations, skipped={}", conversations.size(), skipped);
      return new ConversationResponse(conversations, skipped, storageInfo);

    } finally {
      MDC.remove("correlationId");
    }
  }

  /**
   * Parse an annotations document.
   *
   * @throws DocumentFormatException if the document is not a well-formed annotations array
   */
  List<ConcatAnnotation> readAnnotations(InputStream input, String source) {
    List<ConcatAnnotation> annotations;
    try (input) {
      annotations = objectMapper.readValue(input, ANNOTATIONS_TYPE);
    } catch (IOException e) {
      throw new DocumentFormatException(
          "Annotations are not a valid annotations document: " + source, e);
    }
    if (annotations == null) {
      throw new DocumentFormatException("Annotations document is empty: " + source);
    }
    for (int i = 0; i < annotations.size(); i++) {
      ConcatAnnotation annotation = annotations.get(i);
      if (annotation == null || annotation.video() == null) {
        throw new DocumentFormatException(
            String.format("Annotation %d lacks a video name: %s", i, source));
      }
    }
    return annotations;
  }
}
