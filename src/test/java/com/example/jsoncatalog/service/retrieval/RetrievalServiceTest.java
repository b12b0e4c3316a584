package com.example.jsoncatalog.service.retrieval;

import com.example.jsoncatalog.exception.DatasetNotFoundException;
import com.example.jsoncatalog.exception.InvalidRequestException;
import com.example.jsoncatalog.model.StorageBackend;
import com.example.jsoncatalog.service.analysis.JsonFieldAnalyzer;
import com.example.jsoncatalog.service.analysis.JsonPipelineService;
import com.example.jsoncatalog.service.backend.BackendSelector;
import com.example.jsoncatalog.service.ingest.DatasetSummary;
import com.example.jsoncatalog.service.ingest.JsonIngestOrchestrator;
import com.example.jsoncatalog.service.ingest.StagedFile;
import com.example.jsoncatalog.service.schema.SchemaGeneratorService;
import com.example.jsoncatalog.service.storage.DualBackendWriter;
import com.example.jsoncatalog.support.InMemoryCatalogStore;
import com.example.jsoncatalog.support.InMemoryDocumentStore;
import com.example.jsoncatalog.support.InMemoryRelationalStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetrievalServiceTest {

    @TempDir
    Path tempDir;

    private InMemoryCatalogStore catalogStore;
    private JsonIngestOrchestrator orchestrator;
    private RetrievalService retrievalService;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        InMemoryRelationalStore relationalStore = new InMemoryRelationalStore();
        InMemoryDocumentStore documentStore = new InMemoryDocumentStore();
        catalogStore = new InMemoryCatalogStore();
        orchestrator = new JsonIngestOrchestrator(
                new JsonPipelineService(mapper, new JsonFieldAnalyzer()),
                new SchemaGeneratorService(mapper),
                new BackendSelector(),
                new DualBackendWriter(relationalStore, documentStore),
                catalogStore);
        retrievalService = new RetrievalService(catalogStore, relationalStore, documentStore, mapper);
    }

    @Test
    void requiresDatasetAndEntity() {
        assertThatThrownBy(() -> retrievalService.retrieve(RetrievalRequest.of(null, "t")))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("dataset");
        assertThatThrownBy(() -> retrievalService.retrieve(RetrievalRequest.of("d", " ")))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("entity");
    }

    @Test
    void unknownDatasetOrEntityIsNotFound() throws IOException {
        DatasetSummary people = ingestPeople(3);

        assertThatThrownBy(() -> retrievalService.retrieve(RetrievalRequest.of("missing", "whatever")))
                .isInstanceOf(DatasetNotFoundException.class);
        assertThatThrownBy(() -> retrievalService.retrieve(RetrievalRequest.of(people.datasetId(), "other_table")))
                .isInstanceOf(DatasetNotFoundException.class);
    }

    @Test
    void defaultLimitIsTen() throws IOException {
        DatasetSummary people = ingestPeople(25);

        List<Map<String, Object>> records = retrievalService.retrieve(RetrievalRequest.of(people.datasetId(), people.defaultEntity()));

        assertThat(records).hasSize(10);
        assertThat(records.get(0)).containsEntry("id", 1L);
    }

    @Test
    void datasetCanBeAddressedByOriginalName() throws IOException {
        DatasetSummary people = ingestPeople(2);

        List<Map<String, Object>> records = retrievalService.retrieve(RetrievalRequest.of("people.json", people.defaultEntity()));

        assertThat(records).hasSize(2);
    }

    @Test
    void stringFilterIsCoercedToColumnType() throws IOException {
        DatasetSummary people = ingestPeople(10);

        List<Map<String, Object>> records = retrievalService.retrieve(new RetrievalRequest(people.datasetId(),
                people.defaultEntity(), Map.of("age", "23", "active", "false"), null, null, null, null, null, null));

        assertThat(records).singleElement().satisfies(r -> assertThat(r).containsEntry("id", 3L));
    }

    @Test
    void unknownFieldIsRejectedForRelationalDatasets() throws IOException {
        DatasetSummary people = ingestPeople(2);

        assertThatThrownBy(() -> retrievalService.retrieve(new RetrievalRequest(people.datasetId(),
                people.defaultEntity(), Map.of("nope", 1), null, null, null, null, null, null)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void sortSpecificationWinsOverOrderBy() throws IOException {
        DatasetSummary people = ingestPeople(5);
        Map<String, Object> sort = new LinkedHashMap<>();
        sort.put("age", -1);

        List<Map<String, Object>> records = retrievalService.retrieve(new RetrievalRequest(people.datasetId(),
                people.defaultEntity(), null, null, null, 5, 0, "name", sort));

        assertThat(records).extracting(r -> r.get("age")).containsExactly(25L, 24L, 23L, 22L, 21L);
    }

    @Test
    void orderByAndOffset() throws IOException {
        DatasetSummary people = ingestPeople(5);

        List<Map<String, Object>> records = retrievalService.retrieve(new RetrievalRequest(people.datasetId(),
                people.defaultEntity(), null, null, null, 2, 1, "name", null));

        assertThat(records).extracting(r -> r.get("name")).containsExactly("person-2", "person-3");
    }

    @Test
    void invalidSortDirectionIsRejected() throws IOException {
        DatasetSummary people = ingestPeople(2);

        assertThatThrownBy(() -> retrievalService.retrieve(new RetrievalRequest(people.datasetId(),
                people.defaultEntity(), null, null, null, null, null, null, Map.of("age", "sideways"))))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void projectionReturnsOnlyRequestedFields() throws IOException {
        DatasetSummary people = ingestPeople(2);

        List<Map<String, Object>> records = retrievalService.retrieve(new RetrievalRequest(people.datasetId(),
                people.defaultEntity(), null, List.of("name"), List.of("ignored"), null, null, null, null));

        assertThat(records).allSatisfy(r -> assertThat(r).containsOnlyKeys("name"));
    }

    @Test
    void datasetPagesReportTotals() throws IOException {
        DatasetSummary people = ingestPeople(25);

        DatasetRecords page = retrievalService.queryDataset(people.datasetId(), DatasetQuery.page(3, 10));

        assertThat(page.data()).hasSize(5);
        assertThat(page.storage()).isEqualTo(StorageBackend.POSTGRES);
        assertThat(page.pagination().total()).isEqualTo(25);
        assertThat(page.pagination().totalPages()).isEqualTo(3);
        assertThat(page.data().get(0)).containsEntry("id", 21L);
    }

    @Test
    void datasetBrowsingDefaultsToHundredRows() throws IOException {
        DatasetSummary people = ingestPeople(120);

        DatasetRecords page = retrievalService.retrieveDataset(people.datasetId(), null, null);

        assertThat(page.data()).hasSize(100);
        assertThat(page.pagination().page()).isEqualTo(1);
        assertThat(page.pagination().totalPages()).isEqualTo(2);
    }

    @Test
    void documentDatasetsAreReadThroughTheSameRequestShape() throws IOException {
        DatasetSummary orders = ingest("orders.json", """
                [{"orderId": "o-1", "status": "open", "customer": {"name": "Ada"}},
                 {"orderId": "o-2", "status": "closed", "customer": {"name": "Bo"}},
                 {"orderId": "o-3", "status": "open", "customer": {"name": "Cy"}}]
                """);

        List<Map<String, Object>> open = retrievalService.retrieve(new RetrievalRequest(orders.datasetId(),
                orders.defaultEntity(), Map.of("status", "open"), null, null, null, null, null, null));

        assertThat(orders.backend()).isEqualTo("nosql");
        assertThat(open).extracting(r -> r.get("orderId")).containsExactly("o-1", "o-3");
        assertThat(open.get(0)).doesNotContainKey("_datasetId");
        assertThat(open.get(0).get("customer")).isEqualTo(Map.of("name", "Ada"));
    }

    @Test
    void queryStringFiltersAreTypedForDocumentDatasets() throws IOException {
        DatasetSummary readings = ingest("readings.json", """
                [{"n": 1, "ok": true, "code": "1", "meta": {"x": 1}},
                 {"n": 2, "ok": false, "code": "2", "meta": {"x": 2}},
                 {"n": 3, "ok": true, "code": "3", "meta": {"x": 3}}]
                """);

        List<Map<String, Object>> byNumber = retrievalService.retrieve(new RetrievalRequest(readings.datasetId(),
                readings.defaultEntity(), Map.of("n", "1"), null, null, null, null, null, null));
        List<Map<String, Object>> byBoolean = retrievalService.retrieve(new RetrievalRequest(readings.datasetId(),
                readings.defaultEntity(), Map.of("ok", "false"), null, null, null, null, null, null));
        List<Map<String, Object>> byText = retrievalService.retrieve(new RetrievalRequest(readings.datasetId(),
                readings.defaultEntity(), Map.of("code", "3"), null, null, null, null, null, null));

        assertThat(readings.backend()).isEqualTo("nosql");
        assertThat(byNumber).extracting(r -> r.get("code")).containsExactly("1");
        assertThat(byBoolean).extracting(r -> r.get("code")).containsExactly("2");
        assertThat(byText).extracting(r -> r.get("code")).containsExactly("3");

        DatasetRecords page = retrievalService.queryDataset(readings.datasetId(),
                new DatasetQuery(1, 10, Map.of("n", "2"), null, null, null));
        assertThat(page.pagination().total()).isEqualTo(1);
    }

    @Test
    void statsDescribeCatalogEntry() throws IOException {
        DatasetSummary people = ingestPeople(4);

        DatasetStats stats = retrievalService.getDatasetStats(people.datasetId());

        assertThat(stats.recordCount()).isEqualTo(4);
        assertThat(stats.storage()).isEqualTo(StorageBackend.POSTGRES);
        assertThat(stats.fields()).extracting("name").containsExactly("id", "name", "age", "active");
        assertThatThrownBy(() -> retrievalService.getDatasetStats("missing"))
                .isInstanceOf(DatasetNotFoundException.class);
    }

    private DatasetSummary ingestPeople(int count) throws IOException {
        String json = IntStream.rangeClosed(1, count)
                .mapToObj(i -> String.format("{\"id\": %d, \"name\": \"person-%d\", \"age\": %d, \"active\": %s}",
                        i, i, 20 + i, i % 3 != 0))
                .collect(Collectors.joining(",\n", "[", "]"));
        return ingest("people.json", json);
    }

    private DatasetSummary ingest(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return orchestrator.processStagingFile(new StagedFile(file, name, Files.size(file)), null).summary();
    }
}
