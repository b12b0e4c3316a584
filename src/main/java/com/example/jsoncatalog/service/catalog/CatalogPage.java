package com.example.jsoncatalog.service.catalog;

import com.example.jsoncatalog.model.DatasetCatalogEntry;

import java.util.List;

public record CatalogPage(List<DatasetCatalogEntry> entries, Pagination pagination) {
}
