package com.cadence.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The directed node graph of a workflow: a list of nodes and the id of the
 * node every new enrollment starts at.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowGraph {

    @JsonProperty("entry_node_id")
    private String entryNodeId;

    @Builder.Default
    private List<WorkflowNode> nodes = new ArrayList<>();

    @JsonIgnore
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private transient Map<String, WorkflowNode> index;

    public void setNodes(List<WorkflowNode> nodes) {
        this.nodes = nodes;
        this.index = null;
    }

    public Optional<WorkflowNode> node(String nodeId) {
        if (nodeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(nodeIndex().get(nodeId));
    }

    @JsonIgnore
    public Map<String, WorkflowNode> nodeIndex() {
        if (index == null) {
            Map<String, WorkflowNode> built = new LinkedHashMap<>();
            if (nodes != null) {
                for (WorkflowNode node : nodes) {
                    built.putIfAbsent(node.getNodeId(), node);
                }
            }
            index = built;
        }
        return index;
    }
}
