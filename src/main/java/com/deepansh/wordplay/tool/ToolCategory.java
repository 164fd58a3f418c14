package com.deepansh.wordplay.tool;

public enum ToolCategory {
    PROJECTS,
    DOCUMENTS,
    RESEARCH,
    GENERATION,
    TEXT_PROCESSING,
    EDITOR,
    MEMORY
}
