package io.fullerstack.rosdiscover.summary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fullerstack.rosdiscover.config.HierarchicalConfig;

import java.util.*;

/**
 * Serializes node summaries to JSON for the tools that render the recovered architecture.
 * <p>
 * Nodes are ordered by full name and every interaction list is sorted, so the same summaries
 * always produce the same document:
 * <pre>
 * [ {
 *   "name" : "amcl",
 *   "fullname" : "/amcl",
 *   "namespace" : "/",
 *   "kind" : "amcl",
 *   "package" : "amcl",
 *   "nodelet" : false,
 *   "placeholder" : false,
 *   "reads" : [ { "name" : "/amcl/laser_model_type", "dynamic" : false } ],
 *   "writes" : [ ],
 *   "pubs" : [ { "name" : "/amcl_pose", "format" : "geometry_msgs/PoseWithCovarianceStamped" } ],
 *   ...
 * } ]
 * </pre>
 */
public final class SummaryWriter {

    private static final Comparator<NodeSummary> NODE_ORDER =
        Comparator.comparing(NodeSummary::fullName).thenComparing(NodeSummary::kind);

    private final ObjectMapper mapper;

    public SummaryWriter(boolean prettyPrint) {
        this.mapper = new ObjectMapper();
        if (prettyPrint) {
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    public static SummaryWriter fromConfig(HierarchicalConfig config) {
        return new SummaryWriter(config.getBoolean("summary.pretty-print", true));
    }

    /**
     * @return JSON array with one object per node
     */
    public String write(Collection<NodeSummary> summaries) {
        List<NodeSummary> ordered = new ArrayList<>(summaries);
        ordered.sort(NODE_ORDER);

        ArrayNode root = mapper.createArrayNode();
        for (NodeSummary summary : ordered) {
            root.add(toJson(summary));
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize node summaries", e);
        }
    }

    ObjectNode toJson(NodeSummary summary) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", summary.name());
        node.put("fullname", summary.fullName());
        node.put("namespace", summary.namespace());
        node.put("kind", summary.kind());
        node.put("package", summary.packageName());
        node.put("nodelet", summary.nodelet());
        node.put("placeholder", summary.placeholder());

        ArrayNode reads = node.putArray("reads");
        for (ParameterRead read : new TreeSet<>(summary.reads())) {
            reads.addObject().put("name", read.name()).put("dynamic", read.dynamic());
        }
        ArrayNode writes = node.putArray("writes");
        new TreeSet<>(summary.writes()).forEach(writes::add);

        putTyped(node, "pubs", summary.pubs());
        putTyped(node, "subs", summary.subs());
        putTyped(node, "provides", summary.provides());
        putTyped(node, "uses", summary.uses());
        putTyped(node, "action-servers", summary.actionServers());
        putTyped(node, "action-clients", summary.actionClients());
        return node;
    }

    private static void putTyped(ObjectNode node, String field, Set<TypedName> names) {
        ArrayNode array = node.putArray(field);
        for (TypedName name : new TreeSet<>(names)) {
            array.addObject().put("name", name.name()).put("format", name.format());
        }
    }
}
