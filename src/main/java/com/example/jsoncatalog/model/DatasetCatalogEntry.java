package com.example.jsoncatalog.model;

import com.example.jsoncatalog.model.ir.FieldInfo;
import com.example.jsoncatalog.model.ir.SchemaDescriptor;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.Length;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog record of one ingested dataset. Storage, schema and record count are fixed at ingest time;
 * only tags and description can change afterwards.
 */
@Entity
@Table(name = "dataset_catalog", indexes = {
        @Index(columnList = "category, created_at DESC"),
        @Index(columnList = "storage"),
        @Index(columnList = "original_name")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@ToString(exclude = {"metadata", "schema"})
public class DatasetCatalogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "dataset_id", nullable = false, unique = true, updatable = false, length = 64)
    private String datasetId;

    @Column(name = "original_name", nullable = false, length = 500)
    private String originalName;

    // display name given at ingest, or derived from the file name
    @Column(name = "dataset_name", updatable = false, length = 500)
    private String datasetName;

    @Column(nullable = false, length = 2048)
    private String filePath;

    @Column(nullable = false)
    private long fileSize;

    @Column(nullable = false, length = 100)
    private String mimeType;

    @Column(nullable = false, length = 50)
    private String extension;

    @Column(nullable = false, length = 50)
    private String category;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private StorageBackend storage;

    @Column(nullable = false, updatable = false)
    private int recordCount;

    @Convert(converter = FieldInfoMapConverter.class)
    @Column(length = Length.LONG32, updatable = false)
    private Map<String, FieldInfo> metadata = new LinkedHashMap<>();

    @Convert(converter = SchemaDescriptorConverter.class)
    @Column(name = "dataset_schema", length = Length.LONG32, updatable = false)
    private SchemaDescriptor schema;

    @Embedded
    private ProcessingStatus processing;

    // EAGER so cached entries stay readable outside a session
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "dataset_catalog_tags", joinColumns = @JoinColumn(name = "catalog_entry_id"))
    @Column(name = "tag", length = 255)
    @OrderColumn(name = "tag_order")
    private List<String> tags = new ArrayList<>();

    @Column(length = 4000)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Builder
    private DatasetCatalogEntry(String datasetId, String originalName, String datasetName, String filePath, long fileSize,
                                String mimeType, String extension, String category, StorageBackend storage,
                                int recordCount, Map<String, FieldInfo> metadata, SchemaDescriptor schema,
                                ProcessingStatus processing, List<String> tags, String description) {
        this.datasetId = datasetId;
        this.originalName = originalName;
        this.datasetName = datasetName;
        this.filePath = filePath;
        this.fileSize = fileSize;
        this.mimeType = mimeType;
        this.extension = extension;
        this.category = category;
        this.storage = storage;
        this.recordCount = recordCount;
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        this.schema = schema;
        this.processing = processing != null ? processing : ProcessingStatus.done();
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
        this.description = description;
    }

    /**
     * Applies the user-editable fields. A null argument leaves that field untouched.
     * Always advances {@code updatedAt}, even when nothing changed.
     */
    public void applyUserEdits(List<String> newTags, String newDescription) {
        if (newTags != null) {
            this.tags.clear();
            this.tags.addAll(newTags);
        }
        if (newDescription != null) {
            this.description = newDescription;
        }
        LocalDateTime now = LocalDateTime.now();
        this.updatedAt = now.isAfter(updatedAt) ? now : updatedAt.plusNanos(1000);
    }

    /**
     * Name of the document collection that would hold this dataset's rows.
     */
    public String getCollectionName() {
        return collectionNameFor(datasetId);
    }

    public static String collectionNameFor(String datasetId) {
        return "dataset_" + datasetId;
    }

    public String getTableName() {
        return schema != null ? schema.getTableName() : null;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }
}
