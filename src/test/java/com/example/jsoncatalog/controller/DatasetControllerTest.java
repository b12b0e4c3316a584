package com.example.jsoncatalog.controller;

import com.example.jsoncatalog.exception.DatasetNotFoundException;
import com.example.jsoncatalog.model.DatasetCatalogEntry;
import com.example.jsoncatalog.model.StorageBackend;
import com.example.jsoncatalog.model.ir.SchemaDescriptor;
import com.example.jsoncatalog.service.catalog.CatalogFilter;
import com.example.jsoncatalog.service.catalog.CatalogPage;
import com.example.jsoncatalog.service.catalog.CatalogStore;
import com.example.jsoncatalog.service.catalog.PageOptions;
import com.example.jsoncatalog.service.catalog.Pagination;
import com.example.jsoncatalog.service.ingest.JsonIngestOrchestrator;
import com.example.jsoncatalog.service.retrieval.DatasetQuery;
import com.example.jsoncatalog.service.retrieval.DatasetRecords;
import com.example.jsoncatalog.service.retrieval.RetrievalService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DatasetController.class)
@ActiveProfiles("test")
class DatasetControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CatalogStore catalogStore;
    @MockBean
    private RetrievalService retrievalService;
    @MockBean
    private JsonIngestOrchestrator orchestrator;

    @Test
    void listReturnsEntriesAndPagination() throws Exception {
        when(catalogStore.list(any(), any()))
                .thenReturn(new CatalogPage(List.of(entry("abc", StorageBackend.POSTGRES)), new Pagination(2, 10, 11, 2)));

        mockMvc.perform(get("/api/datasets").param("page", "2").param("limit", "10").param("backend", "sql"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data[0].datasetId").value("abc"))
                .andExpect(jsonPath("$.data[0].storage").value("postgres"))
                .andExpect(jsonPath("$.data[0].entity").value("dataset_people_abc"))
                .andExpect(jsonPath("$.data[0].schema").doesNotExist())
                .andExpect(jsonPath("$.pagination.totalPages").value(2));

        ArgumentCaptor<CatalogFilter> filter = ArgumentCaptor.forClass(CatalogFilter.class);
        ArgumentCaptor<PageOptions> options = ArgumentCaptor.forClass(PageOptions.class);
        verify(catalogStore).list(filter.capture(), options.capture());
        assertThat(filter.getValue().storage()).isEqualTo(StorageBackend.POSTGRES);
        assertThat(options.getValue()).isEqualTo(new PageOptions(2, 10, "createdAt", "desc"));
    }

    @Test
    void unknownBackendFilterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/datasets").param("storage", "oracle"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void getReturnsDetailAndSummary() throws Exception {
        when(catalogStore.get("abc")).thenReturn(Optional.of(entry("abc", StorageBackend.MONGODB)));

        mockMvc.perform(get("/api/datasets/abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.datasetId").value("abc"))
                .andExpect(jsonPath("$.summary.backend").value("nosql"))
                .andExpect(jsonPath("$.summary.default_entity").value("dataset_abc"))
                .andExpect(jsonPath("$.summary.schema_version").value("1.0"))
                .andExpect(jsonPath("$.summary.connection_info.collection").value("dataset_abc"));
    }

    @Test
    void unknownDatasetIsNotFound() throws Exception {
        when(catalogStore.get("missing")).thenReturn(Optional.empty());
        when(catalogStore.findByIdOrName("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/datasets/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.operation").value("dataset.get"))
                .andExpect(jsonPath("$.datasetId").value("missing"));
    }

    @Test
    void dataEndpointTurnsExtraParamsIntoFilters() throws Exception {
        when(retrievalService.queryDataset(eq("abc"), any())).thenReturn(new DatasetRecords("abc", "people.json",
                StorageBackend.POSTGRES, List.of(Map.of("name", "Ada")), new Pagination(2, 5, 6, 2)));

        mockMvc.perform(get("/api/datasets/abc/data").param("page", "2").param("limit", "5").param("status", "open"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dataset.storage").value("postgres"))
                .andExpect(jsonPath("$.data[0].name").value("Ada"))
                .andExpect(jsonPath("$.pagination.page").value(2));

        verify(retrievalService).queryDataset("abc", new DatasetQuery(2, 5, Map.of("status", "open"), null, null, null));
    }

    @Test
    void updateOfUnknownDatasetIsNotFound() throws Exception {
        when(catalogStore.update(eq("missing"), any(), any())).thenReturn(Optional.empty());

        mockMvc.perform(patch("/api/datasets/missing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tags\": [\"a\"]}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void deleteDelegatesToOrchestrator() throws Exception {
        mockMvc.perform(delete("/api/datasets/abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(orchestrator).deleteDataset("abc");
    }

    @Test
    void deleteOfUnknownDatasetIsNotFound() throws Exception {
        doThrow(new DatasetNotFoundException("dataset.delete", "gone")).when(orchestrator).deleteDataset("gone");

        mockMvc.perform(delete("/api/datasets/gone"))
                .andExpect(status().isNotFound());
    }

    @Test
    void searchReturnsMatches() throws Exception {
        when(catalogStore.search("people")).thenReturn(List.of(entry("abc", StorageBackend.POSTGRES)));

        mockMvc.perform(get("/api/datasets/search/people"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.data[0].originalName").value("people.json"));
    }

    private static DatasetCatalogEntry entry(String datasetId, StorageBackend storage) {
        return DatasetCatalogEntry.builder()
                .datasetId(datasetId)
                .originalName("people.json")
                .filePath("/staging/people.json")
                .fileSize(42)
                .mimeType("application/json")
                .extension("json")
                .category("json")
                .storage(storage)
                .recordCount(3)
                .schema(new SchemaDescriptor("dataset_people_abc", "CREATE TABLE ...", null, List.of()))
                .build();
    }
}
