package com.scholary.videoconcat.annotation;

import com.scholary.videoconcat.service.ConcatMetadataEntry;
import com.scholary.videoconcat.service.ConcatMetadataEntry.BoundaryEntry;
import com.scholary.videoconcat.service.DocumentFormatException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns a planned concatenation and its annotation into a streaming training conversation.
 *
 * <p>Frames are sampled at one per second and each clip's frames are numbered from zero, so a clip
 * spanning {@code d} seconds contributes frames {@code 0..floor(d)} from
 * {@code <video_id>/frame_%05d.jpg}. Every frame is a {@code <image>} turn answered with
 * {@code <|silent|>}, except the last frame of a summarized clip, which is answered with
 * {@code <|response|> <summary>}. The final clip's summary is held back: its last frame is shown
 * once more, followed by {@code <|END_OF_STREAMING|>} and then the response.
 */
@Component
public class TrainConversationBuilder {

  static final String HUMAN = "human";
  static final String ASSISTANT = "gpt";
  static final String IMAGE_TOKEN = "<image>";
  static final String SILENT = "<|silent|>";
  static final String RESPONSE_PREFIX = "<|response|> ";
  static final String END_OF_STREAMING = "<|END_OF_STREAMING|>";
  private static final String FRAME_PATH = "%s/frame_%05d.jpg";

  private final String prompt;

  public TrainConversationBuilder(
      @Value("${annotation.conversation-prompt:Describe what happens in the video.}")
          String prompt) {
    this.prompt = prompt;
  }

  /**
   * Build the conversation for one plan entry.
   *
   * @param annotation segments paired with the entry's boundaries by position
   * @throws DocumentFormatException if the annotation does not have one segment per boundary
   */
  public TrainConversation build(ConcatMetadataEntry entry, ConcatAnnotation annotation) {
    List<BoundaryEntry> boundaries = entry.boundaries();
    List<AnnotatedSegment> segments = annotation.data();
    if (segments.size() != boundaries.size()) {
      throw new DocumentFormatException(
          String.format(
              "Annotation %s has %d segments but the plan has %d boundaries",
              annotation.video(), segments.size(), boundaries.size()));
    }

    List<String> images = new ArrayList<>();
    List<ConversationTurn> turns = new ArrayList<>();
    turns.add(new ConversationTurn(HUMAN, prompt));

    int last = boundaries.size() - 1;
    for (int i = 0; i < boundaries.size(); i++) {
      BoundaryEntry boundary = boundaries.get(i);
      String summary = segments.get(i).summary();
      int lastFrame = lastFrame(boundary);

      for (int frame = 0; frame <= lastFrame; frame++) {
        images.add(framePath(boundary.videoId(), frame));
        turns.add(new ConversationTurn(HUMAN, IMAGE_TOKEN));
        if (frame == lastFrame && hasText(summary) && i < last) {
          turns.add(new ConversationTurn(ASSISTANT, RESPONSE_PREFIX + summary));
        } else {
          turns.add(new ConversationTurn(ASSISTANT, SILENT));
        }
      }
    }

    if (!boundaries.isEmpty()) {
      BoundaryEntry tail = boundaries.get(last);
      images.add(framePath(tail.videoId(), lastFrame(tail)));
      turns.add(new ConversationTurn(HUMAN, IMAGE_TOKEN));
      turns.add(new ConversationTurn(HUMAN, END_OF_STREAMING));
      String summary = segments.get(last).summary();
      if (hasText(summary)) {
        turns.add(new ConversationTurn(ASSISTANT, RESPONSE_PREFIX + summary));
      }
    }
    return new TrainConversation(entry.concatVideo(), images, turns);
  }

  private static int lastFrame(BoundaryEntry boundary) {
    return (int) Math.floor(boundary.endTime() - boundary.startTime());
  }

  static String framePath(String videoId, int frame) {
    return String.format(FRAME_PATH, videoId, frame);
  }

  private static boolean hasText(String summary) {
    return summary != null && !summary.isEmpty();
  }
}
