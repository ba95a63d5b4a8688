package com.cadence.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of a workflow graph.
 *
 * config is type specific, e.g.
 *   wait:   {"duration_days": 3, "until": {condition}}
 *   send:   {"template_id": "intro-1", "subject": "...", "body": "..."}
 *   branch: {"condition": {condition}}
 *   update: {"fields": {...}, "score_delta": 10}
 *   notify: {"message": "...", "channel": "sales"}
 *   enrol:  {"target_workflow_id": "..."}
 *   stop:   {"reason": "replied"}
 *
 * edges maps a handle ("default", "yes", "no", "suppressed", "met") to the id
 * of the next node.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowNode {

    public static final String EDGE_DEFAULT = "default";
    public static final String EDGE_YES = "yes";
    public static final String EDGE_NO = "no";
    public static final String EDGE_SUPPRESSED = "suppressed";
    public static final String EDGE_MET = "met";

    @JsonProperty("node_id")
    private String nodeId;

    private NodeType type;

    private String label;

    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, String> edges = new LinkedHashMap<>();

    public String edge(String handle) {
        return edges == null ? null : edges.get(handle);
    }

    /**
     * Edge for the given handle, or the "default" edge when that handle is not wired.
     */
    public String edgeOrDefault(String handle) {
        String target = edge(handle);
        return target != null ? target : edge(EDGE_DEFAULT);
    }

    public Object configValue(String key) {
        return config == null ? null : config.get(key);
    }
}
