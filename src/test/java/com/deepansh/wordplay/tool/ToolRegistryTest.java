package com.deepansh.wordplay.tool;

import com.deepansh.wordplay.exception.DuplicateToolException;
import com.deepansh.wordplay.exception.UnknownToolException;
import com.deepansh.wordplay.persistence.InMemoryWritingStore;
import com.deepansh.wordplay.research.WebResearchClient;
import com.deepansh.wordplay.tool.impl.ListProjectsTool;
import com.deepansh.wordplay.writing.WritingAssistant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class ToolRegistryTest {

    private InMemoryWritingStore store;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryWritingStore();
        registry = new ToolRegistry(ToolFixtures.allTools(store,
                mock(WritingAssistant.class), mock(WebResearchClient.class)));
    }

    @Test
    void constructor_registersEveryTool() {
        assertThat(registry.toolCount()).isEqualTo(31);
        assertThat(registry.hasTool("web_search")).isTrue();
        assertThat(registry.hasTool("edit_paragraph")).isTrue();
    }

    @Test
    void register_duplicateName_throws() {
        assertThatThrownBy(() -> registry.register(new ListProjectsTool(store)))
                .isInstanceOf(DuplicateToolException.class)
                .hasMessageContaining("list_projects");
    }

    @Test
    void get_unknownTool_throws() {
        assertThatThrownBy(() -> registry.get("launch_rocket"))
                .isInstanceOf(UnknownToolException.class);
    }

    @Test
    void find_null_isEmpty() {
        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.hasTool(null)).isFalse();
    }

    @Test
    void list_sortedByCategoryThenName() {
        List<ToolDefinition> definitions = registry.list();
        assertThat(definitions.get(0).getCategory()).isEqualTo(ToolCategory.PROJECTS);
        assertThat(definitions.get(definitions.size() - 1).getCategory()).isEqualTo(ToolCategory.MEMORY);
        assertThat(definitions).extracting(ToolDefinition::getName).doesNotHaveDuplicates();
    }

    @Test
    void list_definitionsCarryJsonSchema() {
        ToolDefinition webSearch = registry.list().stream()
                .filter(d -> d.getName().equals("web_search"))
                .findFirst()
                .orElseThrow();
        assertThat(webSearch.getParameters()).containsEntry("type", "object");
        assertThat(webSearch.getParameters().get("required").toString()).contains("query");
    }
}
