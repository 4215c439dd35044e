package com.scholary.videoconcat.annotation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videoconcat.service.DocumentFormatException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads per-video descriptions used to annotate concatenated videos.
 *
 * <p>Two layouts are accepted. JSONL (chosen by a {@code .jsonl} source name), one object per
 * line:
 *
 * <pre>
 * {"video": "clip_001.mp4", "conversations": [{"from": "gpt", "value": "..."}]}
 * </pre>
 *
 * <p>Otherwise a JSON array whose items carry {@code video_name} or {@code video_id} plus either
 * {@code conversations} (as above) or {@code data: [{"summary": "..."}, ...]}, whose summaries are
 * joined with spaces.
 *
 * <p>A {@code .mp4} suffix is removed from ids so they match catalog ids. Items without a
 * description are ignored; a later item for the same id replaces an earlier one.
 */
@Component
public class VideoDescriptionLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(VideoDescriptionLoader.class);

  static final String VIDEO_SUFFIX = ".mp4";
  private static final String ASSISTANT_ROLE = "gpt";

  private final ObjectMapper objectMapper;

  public VideoDescriptionLoader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Load descriptions keyed by video id.
   *
   * @param input the descriptions document (closed by this method)
   * @param source the object key, which also selects the layout
   * @throws DocumentFormatException if the document cannot be parsed
   */
  public Map<String, String> load(InputStream input, String source) {
    Map<String, String> descriptions;
    try (input) {
      descriptions =
          source.endsWith(".jsonl") ? readJsonLines(input, source) : readJsonArray(input, source);
    } catch (IOException e) {
      throw new DocumentFormatException("Failed to read descriptions: " + source, e);
    }
    LOGGER.info("Loaded {} video descriptions from {}", descriptions.size(), source);
    return descriptions;
  }

  private Map<String, String> readJsonLines(InputStream input, String source) throws IOException {
    Map<String, String> descriptions = new LinkedHashMap<>();
    BufferedReader reader =
        new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
    String line;
    int lineNumber = 0;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      JsonNode item;
      try {
        item = objectMapper.readTree(line);
      } catch (IOException e) {
        throw new DocumentFormatException(
            String.format("Invalid JSON on line %d of %s", lineNumber, source), e);
      }
      String videoId = stripSuffix(item.path("video").asText(""));
      String description = assistantReply(item.path("conversations"));
      if (description != null) {
        descriptions.put(videoId, description);
      }
    }
    return descriptions;
  }

  private Map<String, String> readJsonArray(InputStream input, String source) {
    JsonNode root;
    try {
      root = objectMapper.readTree(input);
    } catch (IOException e) {
      throw new DocumentFormatException("Descriptions are not valid JSON: " + source, e);
    }
    if (root == null || !root.isArray()) {
      throw new DocumentFormatException("Descriptions must be a JSON array: " + source);
    }

    Map<String, String> descriptions = new LinkedHashMap<>();
    for (JsonNode item : root) {
      String rawId =
          item.hasNonNull("video_name")
              ? item.get("video_name").asText()
              : item.path("video_id").asText("");
      String videoId = stripSuffix(rawId);

      String description = null;
      if (item.has("conversations")) {
        description = assistantReply(item.get("conversations"));
      } else if (item.has("data")) {
        description = joinedSummaries(item.get("data"));
      }
      if (description != null) {
        descriptions.put(videoId, description);
      }
    }
    return descriptions;
  }

  /** First reply of the assistant in a conversation, or null. */
  private static String assistantReply(JsonNode conversations) {
    for (JsonNode turn : conversations) {
      if (ASSISTANT_ROLE.equals(turn.path("from").asText())) {
        return turn.path("value").asText("");
      }
    }
    return null;
  }

  // shot-level summaries
  private static String joinedSummaries(JsonNode data) {
    List<String> summaries = new ArrayList<>();
    for (JsonNode shot : data) {
      summaries.add(shot.path("summary").asText(""));
    }
    return String.join(" ", summaries);
  }

  static String stripSuffix(String videoId) {
    return videoId.replace(VIDEO_SUFFIX, "");
  }
}
