package dev.harvester.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.harvester.crawl.CrawlOptions;
import dev.harvester.extract.FilterType;
import dev.harvester.extract.SchemaField;
import dev.harvester.render.WaitCondition;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CrawlRequestTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void defaultsApplyToMissingFields() throws Exception {
    CrawlRequest request =
        objectMapper.readValue("{\"urls\": [\"https://example.com\"]}", CrawlRequest.class);

    assertThat(request.priority()).isEqualTo(1);
    assertThat(request.useLlm()).isFalse();
    assertThat(request.extractJson()).isTrue();
    assertThat(request.contentFilter()).isEqualTo(FilterType.PRUNING);
    assertThat(request.filterThreshold()).isEqualTo(0.5);
    assertThat(request.waitFor()).isEqualTo(WaitCondition.DOMCONTENTLOADED);
    assertThat(request.pageTimeout()).isEqualTo(30_000);
  }

  @Test
  void singleUrlStringIsAccepted() throws Exception {
    CrawlRequest request =
        objectMapper.readValue("{\"urls\": \"https://example.com\"}", CrawlRequest.class);

    assertThat(request.urls()).containsExactly("https://example.com");
  }

  @Test
  void snakeCaseFieldsAreBound() throws Exception {
    String json =
        """
        {"urls": ["https://a.example", "https://b.example"], "priority": 7, "use_llm": false,
         "search_query": "release notes", "content_filter": "bm25", "filter_threshold": 1.5,
         "wait_for": "networkidle0", "page_timeout": 45000, "extract_json": false}
        """;

    CrawlRequest request = objectMapper.readValue(json, CrawlRequest.class);

    assertThat(request.firstUrl()).isEqualTo("https://a.example");
    assertThat(request.priority()).isEqualTo(7);
    assertThat(request.searchQuery()).isEqualTo("release notes");
    assertThat(request.contentFilter()).isEqualTo(FilterType.BM25);
    assertThat(request.filterThreshold()).isEqualTo(1.5);
    assertThat(request.waitFor()).isEqualTo(WaitCondition.NETWORKIDLE0);
    assertThat(request.extractJson()).isFalse();
  }

  @Test
  void emptyUrlListIsRejected() {
    assertThatThrownBy(() -> objectMapper.readValue("{\"urls\": []}", CrawlRequest.class))
        .isInstanceOf(JsonMappingException.class)
        .hasMessageContaining("urls");
    assertThatThrownBy(
            () ->
                new CrawlRequest(List.of(" "), null, null, null, null, null, null, null, null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void priorityOutsideRangeIsRejected() {
    assertThatThrownBy(
            () -> new CrawlRequest(List.of("https://x"), 0, null, null, null, null, null, null, null, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("priority");
    assertThatThrownBy(
            () -> new CrawlRequest(List.of("https://x"), 11, null, null, null, null, null, null, null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void pageTimeoutOutsideRangeIsRejected() {
    assertThatThrownBy(
            () -> new CrawlRequest(List.of("https://x"), null, null, null, null, null, null, null, null, 999))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("page_timeout");
    assertThatThrownBy(
            () -> new CrawlRequest(List.of("https://x"), null, null, null, null, null, null, null, null, 60_001))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void unknownFilterIsRejected() {
    assertThatThrownBy(
            () ->
                objectMapper.readValue(
                    "{\"urls\": \"https://x\", \"content_filter\": \"llm\"}", CrawlRequest.class))
        .isInstanceOf(JsonMappingException.class);
  }

  @Test
  void renderTimeoutIsCappedAtThirtySeconds() {
    CrawlRequest longTimeout =
        new CrawlRequest(List.of("https://x"), null, null, null, null, null, null, null, null, 60_000);
    CrawlRequest shortTimeout =
        new CrawlRequest(List.of("https://x"), null, null, null, null, null, null, null, null, 5_000);

    assertThat(longTimeout.effectivePageTimeoutMs()).isEqualTo(30_000);
    assertThat(longTimeout.toCrawlOptions().pageTimeoutMs()).isEqualTo(30_000);
    assertThat(shortTimeout.toCrawlOptions().pageTimeoutMs()).isEqualTo(5_000);
  }

  @Test
  void customSchemaIsParsedOnlyWhenJsonExtractionIsOn() {
    Map<String, Object> schema =
        Map.of(
            "name", "posts",
            "baseSelector", "article",
            "fields", List.of(Map.of("name", "title", "selector", "h2", "type", "text")));

    CrawlOptions withSchema =
        new CrawlRequest(List.of("https://x"), null, null, schema, null, true, null, null, null, null)
            .toCrawlOptions();
    CrawlOptions withoutSchema =
        new CrawlRequest(List.of("https://x"), null, null, schema, null, false, null, null, null, null)
            .toCrawlOptions();

    assertThat(withSchema.schema()).isNotNull();
    assertThat(withSchema.schema().baseSelector()).isEqualTo("article");
    assertThat(withSchema.schema().fields()).containsExactly(SchemaField.text("title", "h2"));
    assertThat(withoutSchema.schema()).isNull();
  }

  @Test
  void filterPolicyCarriesQueryAndThreshold() {
    CrawlOptions options =
        new CrawlRequest(
                List.of("https://x"), null, null, null, "pricing", null, FilterType.BM25, 0.8,
                WaitCondition.LOAD, null)
            .toCrawlOptions();

    assertThat(options.filterPolicy().type()).isEqualTo(FilterType.BM25);
    assertThat(options.filterPolicy().query()).isEqualTo("pricing");
    assertThat(options.filterPolicy().threshold()).isEqualTo(0.8);
    assertThat(options.waitUntil()).isEqualTo(WaitCondition.LOAD);
  }
}
