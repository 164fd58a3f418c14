package com.deepansh.wordplay.persistence;

import com.deepansh.wordplay.text.TextOperations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local store seeded with a demo project and document.
 *
 * Updates merge non-null fields of the change object into the stored entity and
 * bump {@code updatedAt}; content changes recompute the word count.
 */
@Component
@Slf4j
public class InMemoryWritingStore implements WritingStore {

    public static final String DEMO_USER = "default";

    private final Map<Long, Project> projects = new ConcurrentHashMap<>();
    private final Map<Long, Document> documents = new ConcurrentHashMap<>();
    private final Map<Long, Source> sources = new ConcurrentHashMap<>();

    private final AtomicLong projectIds = new AtomicLong();
    private final AtomicLong documentIds = new AtomicLong();
    private final AtomicLong sourceIds = new AtomicLong();

    public InMemoryWritingStore() {
        seed();
    }

    private void seed() {
        Project project = createProject(Project.builder()
                .userId(DEMO_USER)
                .name("Novel Draft")
                .type("Novel")
                .style("Creative")
                .build());

        createDocument(Document.builder()
                .projectId(project.getId())
                .title("AI-Powered Writing: The Future of Content Creation")
                .content("""
                        The integration of artificial intelligence into writing tools has revolutionized the way we create content. These sophisticated AI companions assist writers by providing context-aware suggestions, automating routine tasks, and enhancing the creative process.

                        Modern writing assistants can analyze the existing content to understand the author's intent and style. They maintain awareness of the entire document context, allowing them to provide relevant suggestions that maintain consistency throughout longer works.

                        One of the most impressive capabilities of these tools is how they adapt to individual writing styles.""")
                .build());

        log.info("Seeded writing store with demo project [id={}]", project.getId());
    }

    // ─── Projects ────────────────────────────────────────────────────────────

    @Override
    public List<Project> getProjects(String userId) {
        return projects.values().stream()
                .filter(p -> p.getUserId() == null || p.getUserId().equals(userId))
                .sorted(Comparator.comparing(Project::getId))
                .map(p -> p.toBuilder().build())
                .toList();
    }

    @Override
    public Optional<Project> getProject(long id) {
        return Optional.ofNullable(projects.get(id)).map(p -> p.toBuilder().build());
    }

    @Override
    public Project createProject(Project project) {
        Instant now = Instant.now();
        Project stored = project.toBuilder()
                .id(projectIds.incrementAndGet())
                .createdAt(now)
                .updatedAt(now)
                .build();
        projects.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    @Override
    public Optional<Project> updateProject(long id, Project changes) {
        Project updated = projects.computeIfPresent(id, (key, existing) -> existing.toBuilder()
                .name(changes.getName() != null ? changes.getName() : existing.getName())
                .type(changes.getType() != null ? changes.getType() : existing.getType())
                .style(changes.getStyle() != null ? changes.getStyle() : existing.getStyle())
                .updatedAt(Instant.now())
                .build());
        return Optional.ofNullable(updated).map(p -> p.toBuilder().build());
    }

    @Override
    public boolean deleteProject(long id) {
        return projects.remove(id) != null;
    }

    // ─── Documents ───────────────────────────────────────────────────────────

    @Override
    public List<Document> getDocuments(long projectId) {
        return documents.values().stream()
                .filter(d -> d.getProjectId() != null && d.getProjectId() == projectId)
                .sorted(Comparator.comparing(Document::getId))
                .map(d -> d.toBuilder().build())
                .toList();
    }

    @Override
    public Optional<Document> getDocument(long id) {
        return Optional.ofNullable(documents.get(id)).map(d -> d.toBuilder().build());
    }

    @Override
    public Document createDocument(Document document) {
        Instant now = Instant.now();
        String content = document.getContent() != null ? document.getContent() : "";
        Document stored = document.toBuilder()
                .id(documentIds.incrementAndGet())
                .content(content)
                .wordCount(TextOperations.countWords(content))
                .createdAt(now)
                .updatedAt(now)
                .build();
        documents.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    @Override
    public Optional<Document> updateDocument(long id, Document changes) {
        Document updated = documents.computeIfPresent(id, (key, existing) -> {
            String content = changes.getContent() != null ? changes.getContent() : existing.getContent();
            return existing.toBuilder()
                    .title(changes.getTitle() != null ? changes.getTitle() : existing.getTitle())
                    .content(content)
                    .wordCount(TextOperations.countWords(content))
                    .styleMetrics(changes.getStyleMetrics() != null
                            ? changes.getStyleMetrics() : existing.getStyleMetrics())
                    .updatedAt(Instant.now())
                    .build();
        });
        return Optional.ofNullable(updated).map(d -> d.toBuilder().build());
    }

    @Override
    public boolean deleteDocument(long id) {
        return documents.remove(id) != null;
    }

    // ─── Sources ─────────────────────────────────────────────────────────────

    @Override
    public List<Source> getSources(long projectId) {
        return sources.values().stream()
                .filter(s -> s.getProjectId() != null && s.getProjectId() == projectId)
                .sorted(Comparator.comparing(Source::getId))
                .map(s -> s.toBuilder().build())
                .toList();
    }

    @Override
    public Optional<Source> getSource(long id) {
        return Optional.ofNullable(sources.get(id)).map(s -> s.toBuilder().build());
    }

    @Override
    public Source createSource(Source source) {
        Source stored = source.toBuilder()
                .id(sourceIds.incrementAndGet())
                .createdAt(Instant.now())
                .build();
        sources.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    @Override
    public boolean deleteSource(long id) {
        return sources.remove(id) != null;
    }
}
