package com.taskgraph.core.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.model.NodeType;
import com.taskgraph.core.model.ParameterBinding;
import com.taskgraph.core.model.TaskValue;
import com.taskgraph.core.model.VariableDefinition;
import com.taskgraph.core.model.VariableType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads task graph templates from JSON.
 * <p>
 * Two schemas are accepted, selected by the top-level {@code schema_version} (default 2):
 * <ul>
 *   <li>v3: node types {@code AtomicTask|Sequence|Selector|Parallel|Decorator|Root},
 *       atomic nodes name their task in {@code atomicTaskId};</li>
 *   <li>v2: node types {@code Action|Condition|Sequence|Selector|Parallel|Repeater},
 *       with {@code actionType}/{@code conditionType} and {@code decoratorChildId}/{@code repeatCount}.</li>
 * </ul>
 * Graph structure lives under {@code data}: {@code rootNodeId}, {@code nodes} and the optional
 * {@code localVariables}. Every loaded template is validated before it is returned.
 */
public class TaskGraphLoader {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphLoader.class);

    public static final int DEFAULT_SCHEMA_VERSION = 2;
    public static final String UNKNOWN_TASK_ID = "unknown";

    private final ObjectMapper objectMapper;

    public TaskGraphLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws TaskGraphLoadException       if the file cannot be read or is not a graph document
     * @throws TemplateValidationException if the graph is structurally invalid
     */
    public TaskGraphTemplate load(Path path) {
        log.info("Loading task graph from {}", path);
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new TaskGraphLoadException("Failed to read task graph file: " + path, e);
        }
        return parse(json);
    }

    public TaskGraphTemplate parse(String json) {
        return parse(json, new ArrayList<>());
    }

    /**
     * @param warnings receives non-fatal problems such as unknown node types
     */
    public TaskGraphTemplate parse(String json, List<String> warnings) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TaskGraphLoadException("Invalid task graph JSON: " + e.getOriginalMessage(), e);
        }
        return parse(root, warnings);
    }

    public TaskGraphTemplate parse(JsonNode root, List<String> warnings) {
        if (root == null || !root.isObject()) {
            throw new TaskGraphLoadException("Task graph document must be a JSON object");
        }
        requireStructure(root);

        int schemaVersion = root.path("schema_version").asInt(DEFAULT_SCHEMA_VERSION);
        String name = root.path("name").asText("Unnamed");
        String description = root.path("description").asText("");
        JsonNode data = root.get("data");
        int rootNodeId = data.path("rootNodeId").asInt(TaskGraphTemplate.NODE_NONE);
        log.debug("Parsing template '{}' with schema v{}", name, schemaVersion);

        List<TaskNodeDefinition> nodes = new ArrayList<>();
        for (JsonNode nodeJson : data.get("nodes")) {
            nodes.add(schemaVersion == 3 ? parseNodeV3(nodeJson, warnings) : parseNodeV2(nodeJson, warnings));
        }

        List<VariableDefinition> variables = new ArrayList<>();
        JsonNode vars = data.get("localVariables");
        if (vars != null && vars.isArray()) {
            for (JsonNode varJson : vars) {
                parseVariable(varJson, warnings, variables);
            }
        }

        for (String warning : warnings) {
            log.warn("Template '{}': {}", name, warning);
        }

        var template = new TaskGraphTemplate(name, description, variables, nodes, rootNodeId).requireValid();
        log.info("Loaded template '{}' with {} nodes and {} variables", name, nodes.size(), variables.size());
        return template;
    }

    private void requireStructure(JsonNode root) {
        List<String> missing = new ArrayList<>();
        JsonNode data = root.get("data");
        if (data == null || !data.isObject()) {
            missing.add("'data' object");
        } else {
            if (!data.path("nodes").isArray()) {
                missing.add("'data.nodes' array");
            }
            if (!data.has("rootNodeId")) {
                missing.add("'data.rootNodeId'");
            }
        }
        if (!missing.isEmpty()) {
            throw new TaskGraphLoadException("Task graph document is missing " + String.join(", ", missing));
        }
    }

    private TaskNodeDefinition parseNodeV3(JsonNode nodeJson, List<String> warnings) {
        int id = nodeJson.path("id").asInt(TaskGraphTemplate.NODE_NONE);
        String typeName = nodeJson.path("type").asText("");
        NodeType type;
        String taskId = null;
        Map<String, ParameterBinding> params = new LinkedHashMap<>();
        List<Integer> children = readChildren(nodeJson);

        switch (typeName) {
            case "Sequence" -> type = NodeType.SEQUENCE;
            case "Selector" -> type = NodeType.SELECTOR;
            case "Parallel" -> type = NodeType.PARALLEL;
            case "Root" -> type = NodeType.ROOT;
            case "Decorator" -> {
                type = NodeType.DECORATOR;
                int childId = nodeJson.path("decoratorChildId").asInt(TaskGraphTemplate.NODE_NONE);
                if (childId >= 0 && children.isEmpty()) {
                    children.add(childId);
                }
                params.put("repeatCount", ParameterBinding.literal(TaskValue.ofInt(nodeJson.path("repeatCount").asInt(1))));
            }
            case "AtomicTask" -> {
                type = NodeType.ATOMIC_TASK;
                taskId = nodeJson.path("atomicTaskId").asText("");
            }
            default -> {
                warnings.add("node " + id + " has unknown type '" + typeName + "'; treating as AtomicTask(unknown)");
                type = NodeType.ATOMIC_TASK;
                taskId = UNKNOWN_TASK_ID;
            }
        }
        return finishNode(nodeJson, id, type, children, taskId, params);
    }

    private TaskNodeDefinition parseNodeV2(JsonNode nodeJson, List<String> warnings) {
        int id = nodeJson.path("id").asInt(TaskGraphTemplate.NODE_NONE);
        String typeName = nodeJson.path("type").asText("");
        NodeType type;
        String taskId = null;
        Map<String, ParameterBinding> params = new LinkedHashMap<>();
        List<Integer> children;

        if (typeName.equals("Repeater")) {
            type = NodeType.DECORATOR;
            children = new ArrayList<>();
            int childId = nodeJson.path("decoratorChildId").asInt(TaskGraphTemplate.NODE_NONE);
            if (childId >= 0) {
                children.add(childId);
            }
            params.put("repeatCount", ParameterBinding.literal(TaskValue.ofInt(nodeJson.path("repeatCount").asInt(1))));
        } else {
            children = readChildren(nodeJson);
            switch (typeName) {
                case "Sequence" -> type = NodeType.SEQUENCE;
                case "Selector" -> type = NodeType.SELECTOR;
                case "Parallel" -> type = NodeType.PARALLEL;
                case "Action" -> {
                    type = NodeType.ATOMIC_TASK;
                    taskId = nodeJson.path("actionType").asText("");
                }
                case "Condition" -> {
                    type = NodeType.ATOMIC_TASK;
                    taskId = nodeJson.path("conditionType").asText("");
                }
                default -> {
                    warnings.add("node " + id + " has unknown type '" + typeName + "'; treating as AtomicTask(unknown)");
                    type = NodeType.ATOMIC_TASK;
                    taskId = UNKNOWN_TASK_ID;
                }
            }
        }
        return finishNode(nodeJson, id, type, children, taskId, params);
    }

    private TaskNodeDefinition finishNode(JsonNode nodeJson, int id, NodeType type, List<Integer> children,
                                          String taskId, Map<String, ParameterBinding> params) {
        JsonNode paramsJson = nodeJson.get("parameters");
        if (paramsJson != null && paramsJson.isObject()) {
            paramsJson.fields().forEachRemaining(e -> params.put(e.getKey(), parseBinding(e.getValue())));
        }
        return new TaskNodeDefinition(
                id,
                nodeJson.path("name").asText(""),
                type,
                children,
                taskId,
                params,
                nodeJson.path("nextOnSuccess").asInt(TaskGraphTemplate.NODE_NONE),
                nodeJson.path("nextOnFailure").asInt(TaskGraphTemplate.NODE_NONE));
    }

    private List<Integer> readChildren(JsonNode nodeJson) {
        List<Integer> children = new ArrayList<>();
        JsonNode array = nodeJson.get("children");
        if (array != null && array.isArray()) {
            for (JsonNode child : array) {
                if (child.isIntegralNumber()) {
                    children.add(child.asInt());
                }
            }
        }
        return children;
    }

    private ParameterBinding parseBinding(JsonNode value) {
        if (value.isObject() && value.has("bindingType")) {
            String bindingType = value.path("bindingType").asText("Literal");
            if (bindingType.equals("LocalVariable") || bindingType.equals("Variable")) {
                return ParameterBinding.variable(value.path("variableName").asText(""));
            }
            JsonNode literal = value.get("value");
            return ParameterBinding.literal(literal != null ? parseLiteral(literal) : TaskValue.none());
        }
        return ParameterBinding.literal(parseLiteral(value));
    }

    /**
     * Literal values: booleans, integers (Int), other numbers (Float), strings,
     * {@code {"x","y","z"}} vectors and {@code {"entity": n}} entity references.
     * Anything else becomes None.
     */
    static TaskValue parseLiteral(JsonNode value) {
        if (value.isBoolean()) {
            return TaskValue.ofBool(value.booleanValue());
        }
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return TaskValue.ofInt(value.intValue());
        }
        if (value.isNumber()) {
            return TaskValue.ofFloat(value.floatValue());
        }
        if (value.isTextual()) {
            return TaskValue.ofString(value.textValue());
        }
        if (value.isObject()) {
            if (value.has("entity")) {
                return TaskValue.ofEntity(value.get("entity").asLong());
            }
            if (value.has("x") || value.has("y") || value.has("z")) {
                return TaskValue.ofVector(
                        (float) value.path("x").asDouble(0),
                        (float) value.path("y").asDouble(0),
                        (float) value.path("z").asDouble(0));
            }
        }
        return TaskValue.none();
    }

    private void parseVariable(JsonNode varJson, List<String> warnings, List<VariableDefinition> out) {
        String name = varJson.path("name").asText("");
        if (name.isEmpty()) {
            warnings.add("local variable without a name ignored");
            return;
        }
        String typeName = varJson.path("type").asText("None");
        VariableType type = VariableType.fromName(typeName);
        if (type == VariableType.NONE) {
            warnings.add("variable '" + name + "' has unknown type '" + typeName + "'");
        }
        JsonNode defaultJson = varJson.get("default");
        TaskValue defaultValue = defaultJson == null || defaultJson.isNull()
                ? TaskValue.defaultFor(type)
                : defaultFor(type, defaultJson);
        out.add(new VariableDefinition(name, type, defaultValue));
    }

    /**
     * Reads a variable default in the declared type, widening integer literals to Float and
     * EntityID. An incompatible literal is kept as parsed so validation reports it.
     */
    private TaskValue defaultFor(VariableType type, JsonNode json) {
        if (type == VariableType.FLOAT && json.isNumber()) {
            return TaskValue.ofFloat(json.floatValue());
        }
        if (type == VariableType.ENTITY_ID && json.isIntegralNumber()) {
            return TaskValue.ofEntity(json.longValue());
        }
        return parseLiteral(json);
    }
}
