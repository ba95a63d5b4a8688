package com.cadence.service;

import com.cadence.exception.InvalidWorkflowException;
import com.cadence.model.NodeType;
import com.cadence.model.WorkflowGraph;
import com.cadence.model.WorkflowNode;
import com.cadence.model.condition.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a workflow graph before it is stored. Collects every problem instead
 * of stopping at the first, and rejects the graph if there is any.
 *
 * Checks:
 *   - entry node is set and exists
 *   - node ids are present and unique
 *   - node types are in the vocabulary
 *   - every edge points at an existing node
 *   - branch conditions and wait "until" conditions use known types and operators
 *   - send has template_id or subject
 *   - enrol has target_workflow_id
 */
@Component
@RequiredArgsConstructor
public class WorkflowDefinitionValidator {

    private final ObjectMapper objectMapper;

    public void validate(WorkflowGraph graph) {
        List<String> problems = check(graph);
        if (!problems.isEmpty()) {
            throw new InvalidWorkflowException(problems);
        }
    }

    public List<String> check(WorkflowGraph graph) {
        List<String> problems = new ArrayList<>();
        if (graph == null) {
            problems.add("graph is required");
            return problems;
        }
        List<WorkflowNode> nodes = graph.getNodes() != null ? graph.getNodes() : List.of();
        if (nodes.isEmpty()) {
            problems.add("graph has no nodes");
        }

        Set<String> ids = new HashSet<>();
        for (WorkflowNode node : nodes) {
            if (node.getNodeId() == null || node.getNodeId().isBlank()) {
                problems.add("a node has no node_id");
            } else if (!ids.add(node.getNodeId())) {
                problems.add("duplicate node_id '" + node.getNodeId() + "'");
            }
        }

        if (graph.getEntryNodeId() == null || graph.getEntryNodeId().isBlank()) {
            problems.add("entry_node_id is required");
        } else if (!ids.contains(graph.getEntryNodeId())) {
            problems.add("entry_node_id '" + graph.getEntryNodeId() + "' does not match any node");
        }

        for (WorkflowNode node : nodes) {
            checkNode(node, ids, problems);
        }
        return problems;
    }

    private void checkNode(WorkflowNode node, Set<String> ids, List<String> problems) {
        String where = "node '" + node.getNodeId() + "'";

        if (node.getType() == null || node.getType() == NodeType.UNKNOWN) {
            problems.add(where + " has an unknown type");
        }
        if (node.getEdges() != null) {
            for (Map.Entry<String, String> edge : node.getEdges().entrySet()) {
                if (edge.getValue() == null || !ids.contains(edge.getValue())) {
                    problems.add(where + " edge '" + edge.getKey() + "' points at unknown node '"
                            + edge.getValue() + "'");
                }
            }
        }
        if (node.getType() == null) {
            return;
        }

        switch (node.getType()) {
            case SEND -> {
                if (isBlank(node.configValue("template_id")) && isBlank(node.configValue("subject"))) {
                    problems.add(where + " needs template_id or subject");
                }
            }
            case ENROL -> {
                if (isBlank(node.configValue("target_workflow_id"))) {
                    problems.add(where + " needs target_workflow_id");
                }
            }
            case BRANCH -> checkConditionConfig(node.configValue("condition"), where + " condition", problems);
            case WAIT -> checkConditionConfig(node.configValue("until"), where + " until", problems);
            default -> {
            }
        }
    }

    private void checkConditionConfig(Object raw, String where, List<String> problems) {
        if (raw == null) {
            return;
        }
        Condition condition;
        try {
            condition = objectMapper.convertValue(raw, Condition.class);
        } catch (IllegalArgumentException e) {
            problems.add(where + " is malformed");
            return;
        }
        checkCondition(condition, where, problems);
    }

    private void checkCondition(Condition condition, String where, List<String> problems) {
        if (condition == null) {
            problems.add(where + " contains an empty condition");
        } else if (condition instanceof UnknownCondition) {
            problems.add(where + " has unknown condition type '" + ((UnknownCondition) condition).getType() + "'");
        } else if (condition instanceof AndCondition) {
            checkChildren(((AndCondition) condition).getConditions(), where, problems);
        } else if (condition instanceof OrCondition) {
            checkChildren(((OrCondition) condition).getConditions(), where, problems);
        } else if (condition instanceof EventWindowCondition) {
            EventWindowCondition ew = (EventWindowCondition) condition;
            if (ew.getEventType() == null) {
                problems.add(where + " event_window needs event_type");
            }
            if (ew.getWindowMs() <= 0) {
                problems.add(where + " event_window needs a positive window_ms");
            }
        } else if (condition instanceof FieldCompareCondition) {
            FieldCompareCondition fc = (FieldCompareCondition) condition;
            if (fc.getField() == null || fc.getField().isBlank()) {
                problems.add(where + " field_compare needs field");
            }
            if (fc.getOperator() == null) {
                problems.add(where + " field_compare has an unknown operator");
            }
        } else if (condition instanceof ScoreThresholdCondition) {
            if (((ScoreThresholdCondition) condition).getOperator() == null) {
                problems.add(where + " score_threshold has an unknown operator");
            }
        }
    }

    private void checkChildren(List<Condition> children, String where, List<String> problems) {
        if (children == null || children.isEmpty()) {
            problems.add(where + " combines no conditions");
            return;
        }
        for (Condition child : children) {
            checkCondition(child, where, problems);
        }
    }

    private static boolean isBlank(Object value) {
        return value == null || String.valueOf(value).isBlank();
    }
}
