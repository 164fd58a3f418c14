package com.deepansh.wordplay.agent;

import com.deepansh.wordplay.model.ContinuousOperationPlan;
import com.deepansh.wordplay.model.ResearchFinding;
import com.deepansh.wordplay.model.SynthesisResult;
import com.deepansh.wordplay.model.ToolExecution;
import com.deepansh.wordplay.model.ToolResult;
import com.deepansh.wordplay.research.ScrapedPage;
import com.deepansh.wordplay.research.SearchResult;
import com.deepansh.wordplay.research.SearchResults;
import com.deepansh.wordplay.text.TextOperations;
import com.deepansh.wordplay.tool.AgentTool;
import com.deepansh.wordplay.tool.ToolCategory;
import com.deepansh.wordplay.tool.ToolRegistry;
import com.deepansh.wordplay.writing.StyleAnalysis;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Model-free synthesis: a narrative grouped by tool category, suggested actions, the next
 * operation phase and research findings, all derived from the execution results alone.
 *
 * The phase plan and findings are always computed here, even when the model tier
 * wrote the narrative.
 */
@Component
@RequiredArgsConstructor
public class TemplateSynthesizer {

    private static final int EXCERPT_LENGTH = 300;

    private final ToolRegistry toolRegistry;

    public SynthesisResult synthesize(String request, List<ToolExecution> executions) {
        return SynthesisResult.builder()
                .narrative(narrative(request, executions))
                .suggestedActions(suggestedActions(executions))
                .additionalToolCalls(List.of())
                .continuousOperationPlan(operationPlan(executions))
                .researchFindings(researchFindings(executions))
                .fallback(true)
                .build();
    }

    String narrative(String request, List<ToolExecution> executions) {
        if (executions.isEmpty()) {
            return "I looked at your request \"" + request + "\" but did not need to run any operations.";
        }

        long succeeded = executions.stream().filter(ToolExecution::isSuccess).count();
        StringBuilder sb = new StringBuilder()
                .append("I completed ").append(succeeded).append(" of ").append(executions.size())
                .append(" operations for your request \"").append(request).append("\".");

        Map<ToolCategory, List<String>> sections = new EnumMap<>(ToolCategory.class);
        List<ToolExecution> failed = new ArrayList<>();
        for (ToolExecution execution : executions) {
            if (!execution.isSuccess()) {
                failed.add(execution);
                continue;
            }
            ToolCategory category = toolRegistry.find(execution.getToolName())
                    .map(AgentTool::getCategory)
                    .orElse(ToolCategory.MEMORY);
            sections.computeIfAbsent(category, c -> new ArrayList<>()).add(describe(execution));
        }

        sections.forEach((category, lines) -> {
            sb.append("\n\n**").append(heading(category)).append("**");
            lines.forEach(line -> sb.append("\n- ").append(line));
        });

        if (!failed.isEmpty()) {
            sb.append("\n\n").append(failed.size())
                    .append(failed.size() == 1 ? " operation had issues: " : " operations had issues: ")
                    .append(failed.stream()
                            .map(e -> e.getToolName() + " (" + e.getResult().describe() + ")")
                            .collect(Collectors.joining("; ")));
        }
        return sb.toString();
    }

    private String describe(ToolExecution execution) {
        ToolResult result = execution.getResult();
        Object data = result.getData();
        return switch (execution.getToolName()) {
            case "web_search" -> data instanceof SearchResults search
                    ? "Found " + search.results().size() + " search results for '"
                            + execution.getParameters().get("query") + "'"
                    : result.describe();
            case "scrape_webpage" -> data instanceof ScrapedPage page
                    ? "Extracted " + page.wordCount() + " words from " + page.domain()
                    : result.describe();
            case "generate_text" -> data instanceof String text
                    ? "Generated " + TextOperations.countWords(text) + " words of new content"
                    : result.describe();
            case "analyze_writing_style" -> data instanceof StyleAnalysis style
                    ? "Style scores: formality " + style.getFormality() + ", complexity " + style.getComplexity()
                            + ", engagement " + style.getEngagement()
                    : result.describe();
            case "analyze_document_stats" -> data instanceof TextOperations.DocumentStats stats
                    ? stats.wordCount() + " words, " + stats.paragraphCount() + " paragraphs, about "
                            + stats.estimatedReadingTimeMinutes() + " min read"
                    : result.describe();
            default -> result.describe();
        };
    }

    private static String heading(ToolCategory category) {
        return switch (category) {
            case PROJECTS -> "Projects";
            case DOCUMENTS -> "Documents";
            case RESEARCH -> "Research";
            case GENERATION -> "Writing";
            case TEXT_PROCESSING -> "Text analysis";
            case EDITOR -> "Editor";
            case MEMORY -> "Goals and memory";
        };
    }

    List<String> suggestedActions(List<ToolExecution> executions) {
        Set<String> succeeded = succeededTools(executions);
        List<String> actions = new ArrayList<>();
        if (succeeded.contains("web_search")) {
            actions.add("Review the research findings and pick the sources worth citing");
        }
        if (succeeded.contains("scrape_webpage") && !succeeded.contains("create_document")) {
            actions.add("Create a document from the extracted content");
        }
        if (succeeded.contains("create_document") || succeeded.contains("update_document")) {
            actions.add("Refine the document's structure and style");
        }
        if (succeeded.contains("analyze_writing_style") || succeeded.contains("get_writing_suggestions")) {
            actions.add("Apply the style suggestions to your draft");
        }
        if (executions.stream().anyMatch(e -> !e.isSuccess())) {
            actions.add("Retry the operations that had issues");
        }
        if (actions.isEmpty()) {
            actions.add("Ask a follow-up question or give a more specific instruction");
        }
        return actions;
    }

    /**
     * Next phase from the successful tool types, in order of the research-to-writing pipeline:
     * search → extraction → creation → style refinement → improvement → review.
     */
    ContinuousOperationPlan operationPlan(List<ToolExecution> executions) {
        Set<String> done = succeededTools(executions);
        if (done.contains("web_search") && !done.contains("scrape_webpage")) {
            return phase("Content Extraction", "Extract detailed content from the most relevant search results",
                    List.of("scrape_webpage", "save_source"), true);
        }
        if (done.contains("scrape_webpage") && !done.contains("create_document")) {
            return phase("Content Creation", "Turn the extracted research into a new document",
                    List.of("create_document", "generate_text"), true);
        }
        if (done.contains("create_document") && !done.contains("analyze_writing_style")) {
            return phase("Style Refinement", "Analyze the new document's style",
                    List.of("analyze_writing_style"), true);
        }
        if (done.contains("analyze_writing_style") && !done.contains("get_writing_suggestions")) {
            return phase("Content Improvement", "Apply targeted improvements based on the style analysis",
                    List.of("get_writing_suggestions", "edit_paragraph"), true);
        }
        return phase("Review", "Review the results and decide on the next step",
                List.of("get_editor_content", "analyze_document_stats"), false);
    }

    private static ContinuousOperationPlan phase(String name, String description, List<String> tools,
                                                 boolean ready) {
        return ContinuousOperationPlan.builder()
                .nextPhase(name)
                .description(description)
                .suggestedTools(tools)
                .readyForAutonomousExecution(ready)
                .build();
    }

    /** Search hits in result order; a scraped page attaches its excerpt to the matching hit. */
    List<ResearchFinding> researchFindings(List<ToolExecution> executions) {
        Map<String, ResearchFinding> byUrl = new LinkedHashMap<>();
        List<ResearchFinding> findings = new ArrayList<>();

        for (ToolExecution execution : executions) {
            if (!execution.isSuccess()) {
                continue;
            }
            Object data = execution.getResult().getData();
            if ("web_search".equals(execution.getToolName()) && data instanceof SearchResults search) {
                for (SearchResult hit : search.results()) {
                    ResearchFinding finding = ResearchFinding.builder()
                            .title(hit.title()).url(hit.url()).snippet(hit.snippet()).build();
                    if (hit.url() == null || byUrl.putIfAbsent(hit.url(), finding) == null) {
                        findings.add(finding);
                    }
                }
            } else if ("scrape_webpage".equals(execution.getToolName()) && data instanceof ScrapedPage page) {
                String url = String.valueOf(execution.getParameters().get("url"));
                String excerpt = page.content() == null ? "" : page.content().length() > EXCERPT_LENGTH
                        ? page.content().substring(0, EXCERPT_LENGTH) : page.content();
                ResearchFinding existing = byUrl.get(url);
                ResearchFinding scraped = ResearchFinding.builder()
                        .title(existing != null ? existing.getTitle() : page.title())
                        .url(url)
                        .snippet(existing != null ? existing.getSnippet() : null)
                        .excerpt(excerpt)
                        .build();
                if (existing != null) {
                    findings.set(findings.indexOf(existing), scraped);
                } else {
                    findings.add(scraped);
                }
                byUrl.put(url, scraped);
            }
        }
        return findings;
    }

    private static Set<String> succeededTools(List<ToolExecution> executions) {
        return executions.stream()
                .filter(ToolExecution::isSuccess)
                .map(ToolExecution::getToolName)
                .collect(Collectors.toSet());
    }
}
