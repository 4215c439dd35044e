package com.scholary.videoconcat.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Parses video metadata documents into a {@link VideoCatalog}.
 *
 * <p>The expected document is a JSON array produced by the metadata generator:
 *
 * <pre>
 * [
 *   {"video_name": "clip_001", "duration_sec": 12.4, "video_path": "/data/clips/clip_001.mp4"}
 * ]
 * </pre>
 *
 * <p>Structural problems (not an array, missing fields, duplicate ids) fail the whole load. Entries
 * that are well formed but unusable (non-positive or too short duration) are skipped with a
 * warning. If nothing survives, the load fails with {@link EmptyCatalogException}.
 */
@Component
public class VideoCatalogLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(VideoCatalogLoader.class);

  static final String ID_FIELD = "video_name";
  static final String DURATION_FIELD = "duration_sec";
  static final String PATH_FIELD = "video_path";

  private final ObjectMapper objectMapper;
  private final CatalogProperties properties;

  public VideoCatalogLoader(ObjectMapper objectMapper, CatalogProperties properties) {
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * Load a catalog from a metadata stream.
   *
   * @param input the metadata document (closed by this method)
   * @param source a label for log and error messages, usually the object key
   * @return the loaded catalog
   * @throws InvalidCatalogException if the document is empty or malformed
   * @throws EmptyCatalogException if no entry is usable
   */
  public VideoCatalog load(InputStream input, String source) {
    LOGGER.info("Loading video catalog from {}", source);

    JsonNode root;
    try (input) {
      root = objectMapper.readTree(input);
    } catch (JsonProcessingException e) {
      throw new InvalidCatalogException("Catalog is not valid JSON: " + source, e);
    } catch (IOException e) {
      throw new InvalidCatalogException("Failed to read catalog: " + source, e);
    }

    if (root == null || root.isMissingNode() || root.isNull()) {
      throw new InvalidCatalogException("Catalog is empty: " + source);
    }
    if (!root.isArray()) {
      throw new InvalidCatalogException("Catalog must be a JSON array: " + source);
    }

    List<SourceVideo> videos = new ArrayList<>();
    int skipped = 0;
    for (int i = 0; i < root.size(); i++) {
      SourceVideo video = parseEntry(root.get(i), i, source);
      if (video == null) {
        skipped++;
        continue;
      }
      videos.add(video);
    }

    LOGGER.info(
        "Loaded {} videos from {} ({} entries skipped)", videos.size(), source, skipped);

    if (videos.isEmpty()) {
      throw new EmptyCatalogException("No valid videos found in catalog: " + source);
    }
    return new VideoCatalog(videos);
  }

  /**
   * Convert one array entry. Returns null for entries that are well formed but unusable.
   */
  private SourceVideo parseEntry(JsonNode entry, int index, String source) {
    if (entry == null || !entry.isObject()) {
      throw new InvalidCatalogException(
          String.format("Catalog entry %d is not an object: %s", index, source));
    }

    JsonNode id = entry.get(ID_FIELD);
    JsonNode duration = entry.get(DURATION_FIELD);
    JsonNode path = entry.get(PATH_FIELD);

    if (id == null || !id.isTextual() || id.asText().isBlank()) {
      throw new InvalidCatalogException(
          String.format("Catalog entry %d has no %s: %s", index, ID_FIELD, source));
    }
    if (duration == null || !duration.isNumber()) {
      throw new InvalidCatalogException(
          String.format(
              "Catalog entry %d (%s) has no numeric %s", index, id.asText(), DURATION_FIELD));
    }
    if (path == null || !path.isTextual()) {
      throw new InvalidCatalogException(
          String.format("Catalog entry %d (%s) has no %s", index, id.asText(), PATH_FIELD));
    }

    double seconds = duration.asDouble();
    if (!(seconds > 0) || seconds < properties.minDurationSeconds()) {
      LOGGER.warn(
          "Skipping video {} (duration {}s, minimum {}s)",
          id.asText(),
          seconds,
          properties.minDurationSeconds());
      return null;
    }

    return new SourceVideo(id.asText(), seconds, path.asText());
  }
}
