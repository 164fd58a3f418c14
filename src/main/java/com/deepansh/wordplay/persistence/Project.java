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
public class Project {

    private Long id;
    private String userId;
    private String name;
    private String type;
    private String style;
    private Instant createdAt;
    private Instant updatedAt;
}
