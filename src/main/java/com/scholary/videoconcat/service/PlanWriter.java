package com.scholary.videoconcat.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videoconcat.api.StorageInfo;
import com.scholary.videoconcat.objectstore.ObjectStoreClient;
import com.scholary.videoconcat.objectstore.ObjectStoreProperties;
import com.scholary.videoconcat.planning.ConcatenationRecord;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads and writes planner documents in object storage.
 *
 * <p>Documents are pretty-printed JSON. Saving returns a presigned URL valid for
 * {@code objectstore.presign-ttl-hours}.
 */
@Component
public class PlanWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlanWriter.class);

  static final String JSON_CONTENT_TYPE = "application/json";
  static final String PLAN_SUFFIX = "_concat_metadata.json";

  private static final TypeReference<List<ConcatMetadataEntry>> PLAN_TYPE =
      new TypeReference<>() {};

  private final ObjectMapper objectMapper;
  private final ObjectStoreClient objectStoreClient;
  private final Duration presignTtl;

  public PlanWriter(
      ObjectMapper objectMapper,
      ObjectStoreClient objectStoreClient,
      ObjectStoreProperties properties) {
    this.objectMapper = objectMapper;
    this.objectStoreClient = objectStoreClient;
    this.presignTtl = Duration.ofHours(properties.presignTtlHours());
  }

  /** Map records to the {@code concat_metadata.json} entries. */
  public List<ConcatMetadataEntry> toEntries(List<ConcatenationRecord> records) {
    return records.stream().map(ConcatMetadataEntry::from).toList();
  }

  /** Serialize a plan or any other document as pretty-printed JSON. */
  public byte[] writeJson(Object document) throws JsonProcessingException {
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
  }

  /**
   * Parse a {@code concat_metadata.json} document.
   *
   * @throws DocumentFormatException if the document is not a well-formed plan
   */
  public List<ConcatMetadataEntry> readJson(InputStream input, String source) {
    List<ConcatMetadataEntry> entries;
    try (input) {
      entries = objectMapper.readValue(input, PLAN_TYPE);
    } catch (IOException e) {
      throw new DocumentFormatException(
          "Plan is not a valid concat metadata document: " + source, e);
    }
    if (entries == null) {
      throw new DocumentFormatException("Plan is empty: " + source);
    }
    for (int i = 0; i < entries.size(); i++) {
      ConcatMetadataEntry entry = entries.get(i);
      if (entry == null || entry.concatVideo() == null || entry.boundaries() == null) {
        throw new DocumentFormatException(
            String.format("Plan entry %d lacks concat_video or boundaries: %s", i, source));
      }
      for (ConcatMetadataEntry.BoundaryEntry boundary : entry.boundaries()) {
        if (boundary == null || boundary.videoId() == null) {
          throw new DocumentFormatException(
              String.format("Plan entry %d has a boundary without video_id: %s", i, source));
        }
      }
    }
    return entries;
  }

  /** Load a saved plan from object storage. */
  public List<ConcatMetadataEntry> readPlan(String bucket, String key) {
    return readJson(objectStoreClient.getObjectStream(bucket, key), key);
  }

  /**
   * Save a plan to object storage.
   *
   * @return storage info with a presigned URL
   */
  public StorageInfo savePlan(String bucket, String key, List<ConcatMetadataEntry> entries)
      throws IOException {
    StorageInfo info = saveDocument(bucket, key, entries);
    LOGGER.info("Saved plan: bucket={}, key={}, records={}", bucket, key, entries.size());
    return info;
  }

  /**
   * Save any document as pretty-printed JSON.
   *
   * @return storage info with a presigned URL
   */
  public StorageInfo saveDocument(String bucket, String key, Object document)
      throws IOException {
    byte[] json = writeJson(document);
    objectStoreClient.putBytes(bucket, key, json, JSON_CONTENT_TYPE);

    URL url = objectStoreClient.presignGet(bucket, key, presignTtl);
    return new StorageInfo(bucket, key, url.toString());
  }

  /** Plan key derived from the catalog key, {@code clips.json -> clips_concat_metadata.json}. */
  public static String defaultPlanKey(String catalogKey) {
    return stripExtension(catalogKey) + PLAN_SUFFIX;
  }

  /** Replace the key's extension with the given suffix. */
  public static String deriveKey(String key, String suffix) {
    return stripExtension(key) + suffix;
  }

  private static String stripExtension(String key) {
    return key.replaceAll("\\.[^./]+$", "");
  }
}
