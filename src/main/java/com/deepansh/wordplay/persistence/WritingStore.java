package com.deepansh.wordplay.persistence;

import java.util.List;
import java.util.Optional;

/**
 * CRUD over the writing app's projects, documents and research sources.
 *
 * Implementations return detached copies: callers may mutate what they get back
 * without affecting stored state until they call an update method.
 */
public interface WritingStore {

    List<Project> getProjects(String userId);

    Optional<Project> getProject(long id);

    Project createProject(Project project);

    Optional<Project> updateProject(long id, Project changes);

    boolean deleteProject(long id);

    List<Document> getDocuments(long projectId);

    Optional<Document> getDocument(long id);

    Document createDocument(Document document);

    Optional<Document> updateDocument(long id, Document changes);

    boolean deleteDocument(long id);

    List<Source> getSources(long projectId);

    Optional<Source> getSource(long id);

    Source createSource(Source source);

    boolean deleteSource(long id);
}
