package com.arenasync.source;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.arenasync.template.Template;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArenaTemplateSourceStatus {
    private SourcePhase phase;
    private List<Condition> conditions = new ArrayList<>();
    private long observedGeneration;
    private int templateCount;
    private List<Template> templates = new ArrayList<>();
    private Instant lastFetchTime;
    private Instant nextFetchTime;
    private String headVersion;
    private ArtifactStatus artifact;
    private String message;

    public SourcePhase getPhase() {
        return phase;
    }

    public void setPhase(SourcePhase phase) {
        this.phase = phase;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public void setConditions(List<Condition> conditions) {
        this.conditions = conditions == null ? new ArrayList<>() : new ArrayList<>(conditions);
    }

    public long getObservedGeneration() {
        return observedGeneration;
    }

    public void setObservedGeneration(long observedGeneration) {
        this.observedGeneration = observedGeneration;
    }

    public int getTemplateCount() {
        return templateCount;
    }

    public void setTemplateCount(int templateCount) {
        this.templateCount = templateCount;
    }

    public List<Template> getTemplates() {
        return templates;
    }

    public void setTemplates(List<Template> templates) {
        this.templates = templates == null ? new ArrayList<>() : new ArrayList<>(templates);
    }

    public Instant getLastFetchTime() {
        return lastFetchTime;
    }

    public void setLastFetchTime(Instant lastFetchTime) {
        this.lastFetchTime = lastFetchTime;
    }

    public Instant getNextFetchTime() {
        return nextFetchTime;
    }

    public void setNextFetchTime(Instant nextFetchTime) {
        this.nextFetchTime = nextFetchTime;
    }

    public String getHeadVersion() {
        return headVersion;
    }

    public void setHeadVersion(String headVersion) {
        this.headVersion = headVersion;
    }

    public ArtifactStatus getArtifact() {
        return artifact;
    }

    public void setArtifact(ArtifactStatus artifact) {
        this.artifact = artifact;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public ArenaTemplateSourceStatus copy() {
        ArenaTemplateSourceStatus copy = new ArenaTemplateSourceStatus();
        copy.phase = phase;
        copy.conditions = new ArrayList<>(conditions);
        copy.observedGeneration = observedGeneration;
        copy.templateCount = templateCount;
        copy.templates = new ArrayList<>(templates);
        copy.lastFetchTime = lastFetchTime;
        copy.nextFetchTime = nextFetchTime;
        copy.headVersion = headVersion;
        copy.artifact = artifact;
        copy.message = message;
        return copy;
    }
}
