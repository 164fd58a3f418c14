package com.deepansh.wordplay.model;

import com.deepansh.wordplay.text.TextOperations;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Snapshot of the user's editor as last reported by the client or mutated by a tool. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EditorState {

    private String title;
    private String content;
    private int wordCount;
    private boolean dirty;

    public static EditorState of(String title, String content, boolean dirty) {
        String body = content != null ? content : "";
        return new EditorState(title, body, TextOperations.countWords(body), dirty);
    }
}
