package com.deepansh.wordplay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial context sent by the client with a request. Null fields leave the live
 * context untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContextUpdate {

    private Long currentProjectId;
    private Long currentDocumentId;
    private EditorState editorState;

    /** Optional model override for the AI-writing tools, e.g. "gpt-4o-mini". */
    private String llmModel;
}
