package com.scholary.videoconcat.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videoconcat.api.PlanRequest;
import com.scholary.videoconcat.api.PlanResponse;
import com.scholary.videoconcat.cache.InMemoryCatalogCache;
import com.scholary.videoconcat.catalog.CatalogProperties;
import com.scholary.videoconcat.catalog.CatalogProperties.CacheProperties;
import com.scholary.videoconcat.catalog.EmptyCatalogException;
import com.scholary.videoconcat.catalog.VideoCatalogLoader;
import com.scholary.videoconcat.config.PlannerProperties;
import com.scholary.videoconcat.objectstore.ObjectStoreClient;
import com.scholary.videoconcat.objectstore.ObjectStoreProperties;
import com.scholary.videoconcat.planning.BalancedSelectionStrategy;
import com.scholary.videoconcat.planning.ConcatenationPlanner;
import com.scholary.videoconcat.planning.PlanProgressListener;
import com.scholary.videoconcat.planning.PlanningConfig;
import com.scholary.videoconcat.planning.RandomSelectionStrategy;
import com.scholary.videoconcat.planning.ReuseMode;
import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PlanningServiceTest {

  private static final String CATALOG =
      "[{\"video_name\": \"A\", \"duration_sec\": 10.0, \"video_path\": \"/c/A.mp4\"},"
          + " {\"video_name\": \"B\", \"duration_sec\": 15.0, \"video_path\": \"/c/B.mp4\"},"
          + " {\"video_name\": \"C\", \"duration_sec\": 40.0, \"video_path\": \"/c/C.mp4\"}]";

  @Mock private ObjectStoreClient objectStoreClient;

  private PlanningService service;

  @BeforeEach
  void setUp() {
    ObjectMapper objectMapper = new ObjectMapper();
    CatalogProperties catalogProperties = new CatalogProperties(2.0, new CacheProperties(10, 10));
    PlannerProperties defaults =
        new PlannerProperties(
            5, 2, 2, 20.0, 30.0, true, ReuseMode.BALANCED, 2.0, 42L, 100, 0.5, 100);

    service =
        new PlanningService(
            objectStoreClient,
            new VideoCatalogLoader(objectMapper, catalogProperties),
            new InMemoryCatalogCache(catalogProperties),
            new ConcatenationPlanner(
                new BalancedSelectionStrategy(), new RandomSelectionStrategy()),
            new PlanWriter(
                objectMapper,
                objectStoreClient,
                new ObjectStoreProperties(
                    "http://localhost:9000", "key", "secret", "videos", "us-east-1", true, 168)),
            defaults);
  }

  private void stubCatalog(String content) {
    when(objectStoreClient.getObjectStream("videos", "meta/clips.json"))
        .thenAnswer(
            invocation -> new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void preview_shouldPlanWithoutSaving() throws Exception {
    stubCatalog(CATALOG);

    PlanResponse response = service.preview(PlanRequest.withDefaults("videos", "meta/clips.json"));

    assertThat(response.records()).hasSize(5);
    assertThat(response.records())
        .allSatisfy(entry -> assertThat(entry.videos()).containsExactlyInAnyOrder("A", "B"));
    assertThat(response.statistics().produced()).isEqualTo(5);
    assertThat(response.usage()).containsEntry("A", 5).containsEntry("B", 5);
    assertThat(response.storageInfo()).isNull();
    verify(objectStoreClient, never()).putBytes(anyString(), anyString(), any(), anyString());
  }

  @Test
  void plan_shouldSaveNextToCatalog() throws Exception {
    stubCatalog(CATALOG);
    when(objectStoreClient.presignGet(eq("videos"), eq("meta/clips_concat_metadata.json"), any()))
        .thenReturn(URI.create("http://localhost:9000/videos/plan").toURL());

    PlanRequest request = PlanRequest.withDefaults("videos", "meta/clips.json");

    PlanResponse response = service.plan(request, PlanProgressListener.NONE);

    verify(objectStoreClient)
        .putBytes(
            eq("videos"), eq("meta/clips_concat_metadata.json"), any(), eq("application/json"));
    assertThat(response.storageInfo().key()).isEqualTo("meta/clips_concat_metadata.json");
  }

  @Test
  void plan_shouldHonourOutputKeyAndSaveFlag() throws Exception {
    stubCatalog(CATALOG);
    PlanRequest request =
        new PlanRequest(
            "videos", "meta/clips.json", null, false, 3, null, null, null, null, null, null, null,
            null);

    PlanResponse response = service.plan(request, PlanProgressListener.NONE);

    assertThat(response.records()).hasSize(3);
    assertThat(response.storageInfo()).isNull();
    verify(objectStoreClient, never()).putBytes(anyString(), anyString(), any(), anyString());
  }

  @Test
  void resolveConfig_shouldMergeOverridesOntoDefaults() {
    PlanRequest request =
        new PlanRequest(
            "videos", "clips.json", null, null, 50, 1, 3, 10.0, 90.0, false, ReuseMode.RANDOM,
            0.5, 7L);

    PlanningConfig config = service.resolveConfig(request);

    assertThat(config.totalConcats()).isEqualTo(50);
    assertThat(config.minVideosPerConcat()).isEqualTo(1);
    assertThat(config.maxVideosPerConcat()).isEqualTo(3);
    assertThat(config.targetDurationMax()).isEqualTo(90.0);
    assertThat(config.allowReuse()).isFalse();
    assertThat(config.reuseMode()).isEqualTo(ReuseMode.RANDOM);
    assertThat(config.seed()).isEqualTo(7L);
    assertThat(config.maxAttemptsPerRecord()).isEqualTo(100);
  }

  @Test
  void preview_shouldRejectInvalidConfigBeforeLoadingCatalog() {
    PlanRequest request =
        new PlanRequest(
            "videos", "clips.json", null, null, null, 5, 2, null, null, null, null, null, null);

    assertThatThrownBy(() -> service.preview(request))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Maximum videos per concatenation");
    verifyNoInteractions(objectStoreClient);
  }

  @Test
  void preview_shouldReuseCachedCatalog() throws Exception {
    stubCatalog(CATALOG);
    PlanRequest request = PlanRequest.withDefaults("videos", "meta/clips.json");

    service.preview(request);
    service.preview(request);

    verify(objectStoreClient, times(1)).getObjectStream("videos", "meta/clips.json");
  }

  @Test
  void preview_shouldPropagateCatalogErrors() {
    stubCatalog("[{\"video_name\": \"x\", \"duration_sec\": 0.5, \"video_path\": \"p\"}]");

    assertThatThrownBy(() -> service.preview(PlanRequest.withDefaults("videos", "meta/clips.json")))
        .isInstanceOf(EmptyCatalogException.class);
  }
}
