package com.deepansh.wordplay.persistence;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Document {

    private Long id;
    private Long projectId;
    private String title;
    private String content;
    private Map<String, Object> styleMetrics;
    private Integer wordCount;
    private Instant createdAt;
    private Instant updatedAt;
}
