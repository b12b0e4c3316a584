package com.example.jsoncatalog.service.catalog;

import com.example.jsoncatalog.model.StorageBackend;

/**
 * Optional list criteria; null members are ignored.
 */
public record CatalogFilter(StorageBackend storage, String category) {

    public static CatalogFilter none() {
        return new CatalogFilter(null, null);
    }
}
