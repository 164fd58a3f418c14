package com.deepansh.wordplay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResearchFinding {

    String title;
    String url;
    String snippet;
    /** Leading excerpt of scraped content, when the page was scraped. */
    String excerpt;
}
