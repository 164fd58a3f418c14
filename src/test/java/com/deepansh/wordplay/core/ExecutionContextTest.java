package com.deepansh.wordplay.core;

import com.deepansh.wordplay.model.ContextUpdate;
import com.deepansh.wordplay.model.EditorState;
import com.deepansh.wordplay.model.ExecutionStep;
import com.deepansh.wordplay.model.Goal;
import com.deepansh.wordplay.model.GoalStatus;
import com.deepansh.wordplay.model.AutonomyLevel;
import com.deepansh.wordplay.config.AgentProperties;
import com.deepansh.wordplay.persistence.Document;
import com.deepansh.wordplay.persistence.InMemoryWritingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionContextTest {

    private InMemoryWritingStore store;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        store = new InMemoryWritingStore();
        context = new ExecutionContext("s1", "default", store,
                new AgentProperties().settingsFor(AutonomyLevel.MODERATE), 3);
    }

    @Test
    void update_projectId_loadsDocumentsAndSources() {
        context.update(ContextUpdate.builder().currentProjectId(1L).build());

        assertThat(context.getCurrentProject().getName()).isEqualTo("Novel Draft");
        assertThat(context.getProjectDocuments()).hasSize(1);
        assertThat(context.currentProjectId()).contains(1L);
    }

    @Test
    void update_unknownProject_leavesContextUntouched() {
        context.update(ContextUpdate.builder().currentProjectId(999L).build());
        assertThat(context.getCurrentProject()).isNull();
    }

    @Test
    void update_documentWithoutEditor_seedsEditorFromDocument() {
        context.update(ContextUpdate.builder().currentDocumentId(1L).build());

        assertThat(context.getEditorState()).isNotNull();
        assertThat(context.editorContent()).startsWith("The integration of artificial intelligence");
        assertThat(context.getEditorState().isDirty()).isFalse();
    }

    @Test
    void replaceEditorContent_marksDirtyAndMirrorsIntoDocument() {
        context.update(ContextUpdate.builder().currentDocumentId(1L).build());

        EditorState state = context.replaceEditorContent("Fresh start here");

        assertThat(state.isDirty()).isTrue();
        assertThat(state.getWordCount()).isEqualTo(3);
        assertThat(context.getCurrentDocument().getContent()).isEqualTo("Fresh start here");
    }

    @Test
    void update_switchDocument_reseedsEditorBeforeEdit() {
        Document second = store.createDocument(Document.builder()
                .projectId(1L).title("Chapter Two").content("The harbour was quiet.").build());
        context.update(ContextUpdate.builder().currentDocumentId(1L).build());

        context.update(ContextUpdate.builder().currentDocumentId(second.getId()).build());
        context.replaceEditorContent(context.editorContent() + " Gulls circled.");

        assertThat(context.getEditorState().getTitle()).isEqualTo("Chapter Two");
        assertThat(context.getCurrentDocument().getTitle()).isEqualTo("Chapter Two");
        assertThat(context.getCurrentDocument().getContent()).isEqualTo("The harbour was quiet. Gulls circled.");
    }

    @Test
    void update_switchDocumentWithSnapshot_snapshotWins() {
        Document second = store.createDocument(Document.builder()
                .projectId(1L).title("Chapter Two").content("The harbour was quiet.").build());
        context.update(ContextUpdate.builder().currentDocumentId(1L).build());

        context.update(ContextUpdate.builder()
                .currentDocumentId(second.getId())
                .editorState(EditorState.of("Chapter Two", "Unsaved draft text", true))
                .build());

        assertThat(context.editorContent()).isEqualTo("Unsaved draft text");
        assertThat(context.getCurrentDocument().getContent()).isEqualTo("Unsaved draft text");
    }

    @Test
    void recordStep_beyondCap_evictsOldest() {
        for (int i = 0; i < 5; i++) {
            context.recordStep(ExecutionStep.builder().id("step_" + i).action("result").build());
        }

        assertThat(context.historySize()).isEqualTo(3);
        assertThat(context.getExecutionHistory()).extracting(ExecutionStep::getId)
                .containsExactly("step_2", "step_3", "step_4");
        assertThat(context.recentHistory(2)).extracting(ExecutionStep::getId)
                .containsExactly("step_3", "step_4");
    }

    @Test
    void recallMemory_countsAccess() {
        context.storeMemory("tone", "playful", "preferences");

        context.recallMemory("tone");
        context.recallMemory("tone");

        assertThat(context.getPersistentMemory().get("tone").getAccessCount()).isEqualTo(2);
        assertThat(context.recallMemory("missing")).isEmpty();
    }

    @Test
    void activeGoal_skipsTerminalGoals() {
        Goal first = new Goal("first", 1, List.of(), 2);
        Goal second = new Goal("second", 1, List.of(), 2);
        context.addGoal(first);
        context.addGoal(second);

        context.advanceGoal(second, GoalStatus.COMPLETED, "done");

        assertThat(context.activeGoal()).contains(first);
    }

    @Test
    void advanceGoal_backwards_throws() {
        Goal goal = new Goal("g", 1, List.of(), 1);
        context.addGoal(goal);
        context.advanceGoal(goal, GoalStatus.COMPLETED, null);

        assertThatThrownBy(() -> context.advanceGoal(goal, GoalStatus.IN_PROGRESS, null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void summary_reportsProjectAndTools() {
        context.update(ContextUpdate.builder().currentProjectId(1L).currentDocumentId(1L).build());
        context.storeMemory("k", "v", "general");

        ContextSummary summary = context.summary(List.of("web_search"));

        assertThat(summary.sessionId()).isEqualTo("s1");
        assertThat(summary.currentProject().name()).isEqualTo("Novel Draft");
        assertThat(summary.documentCount()).isEqualTo(1);
        assertThat(summary.memoryKeys()).containsExactly("k");
        assertThat(summary.availableTools()).containsExactly("web_search");
    }

    @Test
    void constructor_nonPositiveCap_throws() {
        assertThatThrownBy(() -> new ExecutionContext("s", "u", store,
                new AgentProperties().settingsFor(AutonomyLevel.MODERATE), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
