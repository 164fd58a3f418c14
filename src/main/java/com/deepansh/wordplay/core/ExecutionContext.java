package com.deepansh.wordplay.core;

import com.deepansh.wordplay.model.AutonomySettings;
import com.deepansh.wordplay.model.ContextUpdate;
import com.deepansh.wordplay.model.EditorState;
import com.deepansh.wordplay.model.ExecutionStep;
import com.deepansh.wordplay.model.Goal;
import com.deepansh.wordplay.model.GoalStatus;
import com.deepansh.wordplay.model.MemoryEntry;
import com.deepansh.wordplay.model.Reflection;
import com.deepansh.wordplay.persistence.Document;
import com.deepansh.wordplay.persistence.Project;
import com.deepansh.wordplay.persistence.Source;
import com.deepansh.wordplay.persistence.WritingStore;
import com.deepansh.wordplay.text.TextOperations;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable state of one agent session.
 *
 * Every mutation goes through a named method on this class. Instances are not thread-safe;
 * the orchestrator serialises requests per session, and sessions never share a context.
 */
@Slf4j
public class ExecutionContext {

    @Getter private final String sessionId;
    @Getter private final String userId;
    @Getter private final Instant createdAt = Instant.now();

    private final WritingStore store;
    private final int historyCap;

    @Getter private AutonomySettings autonomy;
    @Getter private Project currentProject;
    @Getter private Document currentDocument;
    @Getter private EditorState editorState;
    @Getter private String modelSelection;

    private List<Document> projectDocuments = List.of();
    private List<Source> projectSources = List.of();

    private final Deque<ExecutionStep> executionHistory = new ArrayDeque<>();
    private final Map<String, MemoryEntry> persistentMemory = new LinkedHashMap<>();
    private final List<Goal> currentGoals = new ArrayList<>();
    private final List<Reflection> reflections = new ArrayList<>();

    public ExecutionContext(String sessionId, String userId, WritingStore store,
                            AutonomySettings autonomy, int historyCap) {
        if (historyCap < 1) {
            throw new IllegalArgumentException("historyCap must be positive");
        }
        this.sessionId = sessionId;
        this.userId = userId;
        this.store = store;
        this.autonomy = autonomy;
        this.historyCap = historyCap;
    }

    // ─── Context merge ───────────────────────────────────────────────────────

    /**
     * Merges a client-supplied partial context. Null fields are ignored. A project id
     * reloads the project's documents and sources; an editor snapshot is mirrored into
     * the held document.
     */
    public void update(ContextUpdate update) {
        if (update == null) {
            return;
        }
        if (update.getCurrentProjectId() != null) {
            store.getProject(update.getCurrentProjectId()).ifPresentOrElse(
                    this::selectProject,
                    () -> log.warn("Context update names unknown project [{}]", update.getCurrentProjectId()));
        }
        if (update.getCurrentDocumentId() != null) {
            store.getDocument(update.getCurrentDocumentId()).ifPresentOrElse(
                    this::selectDocument,
                    () -> log.warn("Context update names unknown document [{}]", update.getCurrentDocumentId()));
        }
        if (update.getEditorState() != null) {
            EditorState incoming = update.getEditorState();
            applyEditorState(EditorState.of(incoming.getTitle(), incoming.getContent(), incoming.isDirty()));
        }
        if (update.getLlmModel() != null && !update.getLlmModel().isBlank()) {
            modelSelection = update.getLlmModel();
        }
    }

    public void selectProject(Project project) {
        currentProject = project;
        refreshProjectData();
        log.debug("Session [{}] switched to project [{}] with {} documents, {} sources",
                sessionId, project.getId(), projectDocuments.size(), projectSources.size());
    }

    /** Re-reads the current project's documents and sources from the store. */
    public void refreshProjectData() {
        if (currentProject == null || currentProject.getId() == null) {
            projectDocuments = List.of();
            projectSources = List.of();
            return;
        }
        projectDocuments = store.getDocuments(currentProject.getId());
        projectSources = store.getSources(currentProject.getId());
    }

    /**
     * Holds the document. The editor is reseeded from it when no snapshot exists yet or the
     * held document changes; a snapshot in the same update is applied afterwards.
     */
    public void selectDocument(Document document) {
        boolean switched = document != null
                && (currentDocument == null || !Objects.equals(currentDocument.getId(), document.getId()));
        currentDocument = document;
        if (document != null && (editorState == null || switched)) {
            editorState = EditorState.of(document.getTitle(), document.getContent(), false);
        }
    }

    public void setAutonomy(AutonomySettings autonomy) {
        this.autonomy = autonomy;
    }

    // ─── Editor ──────────────────────────────────────────────────────────────

    public String editorContent() {
        return editorState != null && editorState.getContent() != null ? editorState.getContent() : "";
    }

    /** Replaces the editor body, marks it dirty and mirrors it into the held document. */
    public EditorState replaceEditorContent(String content) {
        String title = editorState != null ? editorState.getTitle()
                : currentDocument != null ? currentDocument.getTitle() : null;
        applyEditorState(EditorState.of(title, content, true));
        return editorState;
    }

    private void applyEditorState(EditorState state) {
        editorState = state;
        if (currentDocument != null) {
            if (state.getTitle() != null) {
                currentDocument.setTitle(state.getTitle());
            }
            currentDocument.setContent(state.getContent());
            currentDocument.setWordCount(TextOperations.countWords(state.getContent()));
        }
    }

    // ─── History ─────────────────────────────────────────────────────────────

    public void recordStep(ExecutionStep step) {
        executionHistory.addLast(step);
        while (executionHistory.size() > historyCap) {
            executionHistory.removeFirst();
        }
    }

    public List<ExecutionStep> getExecutionHistory() {
        return List.copyOf(executionHistory);
    }

    /** The last {@code n} steps in chronological order. */
    public List<ExecutionStep> recentHistory(int n) {
        List<ExecutionStep> all = getExecutionHistory();
        return all.subList(Math.max(0, all.size() - n), all.size());
    }

    public int historySize() {
        return executionHistory.size();
    }

    // ─── Memory ──────────────────────────────────────────────────────────────

    public MemoryEntry storeMemory(String key, Object value, String category) {
        MemoryEntry entry = new MemoryEntry(key, value, category);
        persistentMemory.put(key, entry);
        return entry;
    }

    /** Reads an entry, counting the access. */
    public Optional<MemoryEntry> recallMemory(String key) {
        MemoryEntry entry = persistentMemory.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        entry.read();
        return Optional.of(entry);
    }

    public Map<String, MemoryEntry> getPersistentMemory() {
        return Collections.unmodifiableMap(persistentMemory);
    }

    // ─── Goals ───────────────────────────────────────────────────────────────

    public void addGoal(Goal goal) {
        currentGoals.add(goal);
    }

    public Optional<Goal> findGoal(String goalId) {
        return currentGoals.stream().filter(g -> g.getId().equals(goalId)).findFirst();
    }

    /** Most recently added goal that has not reached a terminal status. */
    public Optional<Goal> activeGoal() {
        for (int i = currentGoals.size() - 1; i >= 0; i--) {
            Goal goal = currentGoals.get(i);
            if (!goal.getStatus().isTerminal()) {
                return Optional.of(goal);
            }
        }
        return Optional.empty();
    }

    public void advanceGoal(Goal goal, GoalStatus status, String notes) {
        goal.transitionTo(status, notes);
    }

    public List<Goal> getCurrentGoals() {
        return Collections.unmodifiableList(currentGoals);
    }

    // ─── Reflection ──────────────────────────────────────────────────────────

    public void recordReflection(Reflection reflection) {
        reflections.add(reflection);
    }

    public List<Reflection> getReflections() {
        return Collections.unmodifiableList(reflections);
    }

    // ─── Read views ──────────────────────────────────────────────────────────

    public List<Document> getProjectDocuments() {
        return projectDocuments;
    }

    public List<Source> getProjectSources() {
        return projectSources;
    }

    public Optional<Long> currentProjectId() {
        return Optional.ofNullable(currentProject).map(Project::getId);
    }

    public ContextSummary summary(List<String> availableTools) {
        return ContextSummary.of(this, availableTools);
    }

    /** One-line description used in logs and prompts. */
    public String describe() {
        return "Current context: "
                + (currentProject != null ? "Project \"" + currentProject.getName() + "\"" : "No project selected")
                + ", " + projectDocuments.size() + " documents, " + projectSources.size() + " sources";
    }
}
