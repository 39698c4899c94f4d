package com.taskgraph.core.graph;

import com.taskgraph.core.model.NodeType;
import com.taskgraph.core.model.VariableDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable task graph shared by every runner bound to it.
 * <p>
 * Holds the blackboard schema, the node table and the root id. The id-to-node
 * index is built once in the constructor and never changes, so a template may
 * be read concurrently by any number of runners.
 */
public final class TaskGraphTemplate {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphTemplate.class);

    /** Cursor value meaning "no node": the graph has finished. */
    public static final int NODE_NONE = -1;

    private final String name;
    private final String description;
    private final List<VariableDefinition> variables;
    private final List<TaskNodeDefinition> nodes;
    private final int rootNodeId;
    private final Map<Integer, TaskNodeDefinition> index;

    public TaskGraphTemplate(String name, String description, List<VariableDefinition> variables,
                             List<TaskNodeDefinition> nodes, int rootNodeId) {
        this.name = name != null ? name : "Unnamed";
        this.description = description != null ? description : "";
        this.variables = variables != null ? List.copyOf(variables) : List.of();
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.rootNodeId = rootNodeId;

        var lookup = new HashMap<Integer, TaskNodeDefinition>();
        for (var node : this.nodes) {
            lookup.putIfAbsent(node.id(), node);
        }
        this.index = Collections.unmodifiableMap(lookup);
        log.debug("Built lookup index with {} entries for template '{}'", index.size(), this.name);
    }

    public TaskGraphTemplate(String name, List<VariableDefinition> variables,
                             List<TaskNodeDefinition> nodes, int rootNodeId) {
        this(name, "", variables, nodes, rootNodeId);
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public List<VariableDefinition> variables() {
        return variables;
    }

    public List<TaskNodeDefinition> nodes() {
        return nodes;
    }

    public int rootNodeId() {
        return rootNodeId;
    }

    /**
     * Looks up a node by id. {@link #NODE_NONE} and unknown ids yield empty.
     */
    public Optional<TaskNodeDefinition> node(int nodeId) {
        if (nodeId == NODE_NONE) {
            return Optional.empty();
        }
        return Optional.ofNullable(index.get(nodeId));
    }

    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Checks structural integrity and returns every problem found.
     * <ul>
     *   <li>at least one node, unique node ids</li>
     *   <li>the root id resolves</li>
     *   <li>child and transition ids resolve or are {@link #NODE_NONE}</li>
     *   <li>decorators have exactly one child, atomic nodes name a task</li>
     *   <li>variable names are unique and defaults match their declared type</li>
     * </ul>
     */
    public List<String> validate() {
        var problems = new ArrayList<String>();
        if (nodes.isEmpty()) {
            problems.add("template has no nodes");
            return problems;
        }

        Set<Integer> seen = new HashSet<>();
        for (var node : nodes) {
            if (!seen.add(node.id())) {
                problems.add("duplicate node id " + node.id());
            }
        }

        if (!index.containsKey(rootNodeId)) {
            problems.add("root node " + rootNodeId + " does not exist");
        }

        for (var node : nodes) {
            for (int child : node.children()) {
                if (!index.containsKey(child)) {
                    problems.add("node " + node.id() + " references unknown child " + child);
                }
            }
            checkTransition(node, "nextOnSuccess", node.nextOnSuccess(), problems);
            checkTransition(node, "nextOnFailure", node.nextOnFailure(), problems);

            if (node.type() == NodeType.DECORATOR && node.children().size() != 1) {
                problems.add("decorator " + node.id() + " must have exactly one child, has " + node.children().size());
            }
            if (node.isAtomic() && (node.atomicTaskId() == null || node.atomicTaskId().isBlank())) {
                problems.add("atomic node " + node.id() + " has no task id");
            }
        }

        Set<String> names = new HashSet<>();
        for (var variable : variables) {
            if (!names.add(variable.name())) {
                problems.add("duplicate variable '" + variable.name() + "'");
            }
            if (variable.defaultValue().type() != variable.type()) {
                problems.add("variable '" + variable.name() + "' default is " + variable.defaultValue().type().displayName()
                        + " but declared " + variable.type().displayName());
            }
        }
        return problems;
    }

    /**
     * Validates and throws {@link TemplateValidationException} when anything is wrong.
     *
     * @return this template, for chaining
     */
    public TaskGraphTemplate requireValid() {
        var problems = validate();
        if (!problems.isEmpty()) {
            log.error("Template '{}' failed validation: {}", name, problems);
            throw new TemplateValidationException(name, problems);
        }
        log.debug("Template '{}' passed validation", name);
        return this;
    }

    private void checkTransition(TaskNodeDefinition node, String field, int target, List<String> problems) {
        if (target != NODE_NONE && !index.containsKey(target)) {
            problems.add("node " + node.id() + " " + field + " references unknown node " + target);
        }
    }

    @Override
    public String toString() {
        return "TaskGraphTemplate[" + name + ", nodes=" + nodes.size() + ", variables=" + variables.size()
                + ", root=" + rootNodeId + "]";
    }
}
