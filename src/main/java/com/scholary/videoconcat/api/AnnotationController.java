package com.scholary.videoconcat.api;

import com.scholary.videoconcat.annotation.AnnotationService;
import com.scholary.videoconcat.annotation.ConversationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** REST API for annotating planned concatenations and building training conversations. */
@RestController
@Tag(name = "Annotation", description = "Concatenated video annotation API")
public class AnnotationController {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnnotationController.class);

  private final AnnotationService annotationService;
  private final ConversationService conversationService;

  public AnnotationController(
      AnnotationService annotationService, ConversationService conversationService) {
    this.annotationService = annotationService;
    this.conversationService = conversationService;
  }

  @PostMapping("/api/annotations")
  @Operation(
      summary = "Annotate a plan",
      description =
          "Build per-clip annotations for a saved plan, with transition text between clips")
  public ResponseEntity<AnnotationResponse> annotate(
      @Valid @RequestBody AnnotationRequest request) {
    try {
      LOGGER.info(
          "Annotation request: bucket={}, planKey={}", request.bucket(), request.planKey());
      return ResponseEntity.ok(annotationService.annotate(request));
    } catch (Exception e) {
      LOGGER.error("Annotation failed: {}", e.getMessage());
      throw ErrorStatus.from(e);
    }
  }

  @PostMapping("/api/conversations")
  @Operation(
      summary = "Build training conversations",
      description =
          "Turn a saved plan and its annotations into per-second streaming conversations")
  public ResponseEntity<ConversationResponse> conversations(
      @Valid @RequestBody ConversationRequest request) {
    try {
      LOGGER.info(
          "Conversation request: bucket={}, planKey={}", request.bucket(), request.planKey());
      return ResponseEntity.ok(conversationService.convert(request));
    } catch (Exception e) {
      LOGGER.error("Conversation build failed: {}", e.getMessage());
      throw ErrorStatus.from(e);
    }
  }
}
