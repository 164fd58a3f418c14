package com.deepansh.wordplay.persistence;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Source {

    private Long id;
    private Long projectId;
    /** url, file, pdf, note */
    private String type;
    private String name;
    private String content;
    private String url;
    private Instant createdAt;
}
