package com.herzen.bel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties("bel.parser")
public class BelParserProperties {
    private boolean allowNakedNames = false;
    private boolean citationClearing = true;
    private boolean requireCitation = false;
    private boolean allowNested = false;
    private boolean failFast = false;
    private int workers = 4;
    private boolean namespaceValidation = false;
    private Map<String, String> namespacePatterns = new LinkedHashMap<>();
    private Map<String, String> annotationValues = new LinkedHashMap<>();

    public boolean isAllowNakedNames() {
        return allowNakedNames;
    }

    public void setAllowNakedNames(boolean allowNakedNames) {
        this.allowNakedNames = allowNakedNames;
    }

    public boolean isCitationClearing() {
        return citationClearing;
    }

    public void setCitationClearing(boolean citationClearing) {
        this.citationClearing = citationClearing;
    }

    public boolean isRequireCitation() {
        return requireCitation;
    }

    public void setRequireCitation(boolean requireCitation) {
        this.requireCitation = requireCitation;
    }

    public boolean isAllowNested() {
        return allowNested;
    }

    public void setAllowNested(boolean allowNested) {
        this.allowNested = allowNested;
    }

    public boolean isFailFast() {
        return failFast;
    }

    public void setFailFast(boolean failFast) {
        this.failFast = failFast;
    }

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public boolean isNamespaceValidation() {
        return namespaceValidation;
    }

    public void setNamespaceValidation(boolean namespaceValidation) {
        this.namespaceValidation = namespaceValidation;
    }

    public Map<String, String> getNamespacePatterns() {
        return namespacePatterns;
    }

    public void setNamespacePatterns(Map<String, String> namespacePatterns) {
        this.namespacePatterns = namespacePatterns;
    }

    public Map<String, String> getAnnotationValues() {
        return annotationValues;
    }

    public void setAnnotationValues(Map<String, String> annotationValues) {
        this.annotationValues = annotationValues;
    }
}
