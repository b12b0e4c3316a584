package com.example.jsoncatalog.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Embeddable
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingStatus {

    @Column(name = "processed", nullable = false)
    private boolean processed;

    @Column(name = "processing_error", length = 2048)
    private String error;

    public static ProcessingStatus done() {
        return new ProcessingStatus(true, null);
    }
}
