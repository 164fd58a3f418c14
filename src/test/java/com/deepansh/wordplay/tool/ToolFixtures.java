package com.deepansh.wordplay.tool;

import com.deepansh.wordplay.config.AgentProperties;
import com.deepansh.wordplay.core.ExecutionContext;
import com.deepansh.wordplay.model.AutonomyLevel;
import com.deepansh.wordplay.persistence.WritingStore;
import com.deepansh.wordplay.research.WebResearchClient;
import com.deepansh.wordplay.tool.impl.*;
import com.deepansh.wordplay.writing.WritingAssistant;

import java.util.List;

/** Builds the full tool set outside Spring for tests. */
public final class ToolFixtures {

    private ToolFixtures() {
    }

    public static List<AgentTool> allTools(WritingStore store, WritingAssistant writingAssistant,
                                           WebResearchClient researchClient) {
        return List.of(
                new ListProjectsTool(store),
                new GetProjectTool(store),
                new CreateProjectTool(store),
                new UpdateProjectTool(store),
                new ListDocumentsTool(store),
                new GetDocumentTool(store),
                new CreateDocumentTool(store),
                new UpdateDocumentTool(store),
                new DeleteDocumentTool(store),
                new WebSearchTool(researchClient),
                new ScrapeWebpageTool(researchClient),
                new SaveSourceTool(store),
                new GetSourcesTool(store),
                new GenerateTextTool(writingAssistant),
                new AnalyzeWritingStyleTool(writingAssistant, store),
                new GetWritingSuggestionsTool(writingAssistant),
                new ProcessTextCommandTool(writingAssistant),
                new AnalyzeDocumentStructureTool(),
                new SearchInTextTool(),
                new ReplaceInTextTool(),
                new AnalyzeDocumentStatsTool(),
                new GetEditorContentTool(),
                new AppendToEditorTool(),
                new PrependToEditorTool(),
                new ReplaceEditorContentTool(),
                new RegexReplaceInEditorTool(),
                new EditParagraphTool(),
                new SetGoalTool(),
                new UpdateGoalStatusTool(),
                new StoreMemoryTool(),
                new RecallMemoryTool());
    }

    public static ExecutionContext context(WritingStore store) {
        AgentProperties properties = new AgentProperties();
        return new ExecutionContext("session-1", "default", store,
                properties.settingsFor(AutonomyLevel.MODERATE), properties.getHistoryCap());
    }
}
