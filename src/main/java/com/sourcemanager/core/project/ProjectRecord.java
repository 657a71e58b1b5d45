package com.sourcemanager.core.project;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The per-project document: identity, customer, the regional sources the
 * project uses and its citations.
 * <p>
 * Adding a source or citation whose id is already present removes the old
 * entry and appends the new one, so the entry moves to the end of its list.
 * Citation references to sources are not checked against the project's
 * source list; {@link #danglingReferences()} reports them.
 */
@JsonPropertyOrder({"project_id", "project_suffix", "project_type", "created_date", "metadata", "uuid",
        "customer", "title", "document_title", "description", "sources", "citations"})
public class ProjectRecord {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private final String projectId;
    private final String projectSuffix;
    private final String projectType;
    private final String createdDate;
    private final ProjectMetadata metadata;
    private final String uuid;
    private final CustomerInfo customer;
    private final String title;
    private final String documentTitle;
    private final String description;
    private final List<ProjectSource> sources;
    private final List<ProjectCitation> citations;

    @JsonCreator
    public ProjectRecord(@JsonProperty("project_id") String projectId,
                         @JsonProperty("project_suffix") String projectSuffix,
                         @JsonProperty("project_type") String projectType,
                         @JsonProperty("created_date") String createdDate,
                         @JsonProperty("metadata") ProjectMetadata metadata,
                         @JsonProperty("uuid") String uuid,
                         @JsonProperty("customer") CustomerInfo customer,
                         @JsonProperty("title") String title,
                         @JsonProperty("document_title") String documentTitle,
                         @JsonProperty("description") String description,
                         @JsonProperty("sources") List<ProjectSource> sources,
                         @JsonProperty("citations") List<ProjectCitation> citations) {
        this.projectId = projectId;
        this.projectSuffix = projectSuffix;
        this.projectType = projectType;
        this.createdDate = createdDate;
        this.metadata = metadata;
        this.uuid = uuid;
        this.customer = customer;
        this.title = title;
        this.documentTitle = documentTitle;
        this.description = description;
        this.sources = sources == null ? new ArrayList<>() : new ArrayList<>(sources);
        this.citations = citations == null ? new ArrayList<>() : new ArrayList<>(citations);
    }

    /** A citation reference to a source id that the project does not list. */
    public record DanglingReference(String citationId, String sourceId) {}

    @JsonProperty("project_id")
    public String getProjectId() { return projectId; }

    @JsonProperty("project_suffix")
    public String getProjectSuffix() { return projectSuffix; }

    @JsonProperty("project_type")
    public String getProjectType() { return projectType; }

    @JsonProperty("created_date")
    public String getCreatedDate() { return createdDate; }

    @JsonProperty("metadata")
    public ProjectMetadata getMetadata() { return metadata; }

    @JsonProperty("uuid")
    public String getUuid() { return uuid; }

    @JsonProperty("customer")
    public CustomerInfo getCustomer() { return customer; }

    @JsonProperty("title")
    public String getTitle() { return title; }

    @JsonProperty("document_title")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getDocumentTitle() { return documentTitle; }

    @JsonProperty("description")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getDescription() { return description; }

    @JsonProperty("sources")
    public List<ProjectSource> getSources() {
        return Collections.unmodifiableList(sources);
    }

    @JsonProperty("citations")
    public List<ProjectCitation> getCitations() {
        return Collections.unmodifiableList(citations);
    }

    // --- Sources ---

    public ProjectSource addSource(String sourceId, String usageNotes, String userDescription,
                                   String addedBy, String citationFormat) {
        return addSource(sourceId, usageNotes, userDescription, addedBy, citationFormat, Clock.systemDefaultZone());
    }

    public ProjectSource addSource(String sourceId, String usageNotes, String userDescription,
                                   String addedBy, String citationFormat, Clock clock) {
        Objects.requireNonNull(sourceId, "sourceId");
        sources.removeIf(s -> sourceId.equals(s.sourceId()));
        var added = new ProjectSource(sourceId, usageNotes, userDescription, now(clock), addedBy, citationFormat);
        sources.add(added);
        return added;
    }

    public boolean removeSource(String sourceId) {
        return sources.removeIf(s -> Objects.equals(sourceId, s.sourceId()));
    }

    public Optional<ProjectSource> getSource(String sourceId) {
        return sources.stream().filter(s -> Objects.equals(sourceId, s.sourceId())).findFirst();
    }

    // --- Citations ---

    public ProjectCitation addCitation(String citationId, String title, String content,
                                       List<String> sourceReferences, Integer slideNumber, String createdBy) {
        return addCitation(citationId, title, content, sourceReferences, slideNumber, createdBy,
                Clock.systemDefaultZone());
    }

    public ProjectCitation addCitation(String citationId, String title, String content,
                                       List<String> sourceReferences, Integer slideNumber, String createdBy,
                                       Clock clock) {
        Objects.requireNonNull(citationId, "citationId");
        citations.removeIf(c -> citationId.equals(c.citationId()));
        String timestamp = now(clock);
        var added = new ProjectCitation(citationId, title, content, sourceReferences, slideNumber,
                timestamp, createdBy, timestamp, createdBy);
        citations.add(added);
        return added;
    }

    public boolean removeCitation(String citationId) {
        return citations.removeIf(c -> Objects.equals(citationId, c.citationId()));
    }

    public Optional<ProjectCitation> getCitation(String citationId) {
        return citations.stream().filter(c -> Objects.equals(citationId, c.citationId())).findFirst();
    }

    public List<ProjectCitation> getCitationsBySource(String sourceId) {
        var matching = new ArrayList<ProjectCitation>();
        for (ProjectCitation citation : citations) {
            if (citation.references(sourceId)) {
                matching.add(citation);
            }
        }
        return matching;
    }

    /** Citation references whose source id is not in {@link #getSources()}, in citation order. */
    public List<DanglingReference> danglingReferences() {
        Set<String> known = new HashSet<>();
        sources.forEach(s -> known.add(s.sourceId()));
        var dangling = new ArrayList<DanglingReference>();
        for (ProjectCitation citation : citations) {
            for (String ref : citation.sourceReferences()) {
                if (!known.contains(ref)) {
                    dangling.add(new DanglingReference(citation.citationId(), ref));
                }
            }
        }
        return dangling;
    }

    private static String now(Clock clock) {
        return LocalDateTime.now(clock).format(TIMESTAMP);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectRecord that)) return false;
        return Objects.equals(projectId, that.projectId)
                && Objects.equals(projectSuffix, that.projectSuffix)
                && Objects.equals(projectType, that.projectType)
                && Objects.equals(createdDate, that.createdDate)
                && Objects.equals(metadata, that.metadata)
                && Objects.equals(uuid, that.uuid)
                && Objects.equals(customer, that.customer)
                && Objects.equals(title, that.title)
                && Objects.equals(documentTitle, that.documentTitle)
                && Objects.equals(description, that.description)
                && sources.equals(that.sources)
                && citations.equals(that.citations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectId, uuid, title, sources, citations);
    }

    @Override
    public String toString() {
        return "ProjectRecord{projectId=" + projectId + ", title=" + title
                + ", sources=" + sources.size() + ", citations=" + citations.size() + "}";
    }
}
