package io.fullerstack.rosdiscover.context;

import io.fullerstack.rosdiscover.io.FileSystem;
import io.fullerstack.rosdiscover.parameter.ParameterServer;
import io.fullerstack.rosdiscover.parameter.ParameterValue;
import io.fullerstack.rosdiscover.summary.NodeSummary;
import io.fullerstack.rosdiscover.summary.ParameterRead;
import io.fullerstack.rosdiscover.summary.TypedName;
import lombok.Builder;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Records the architectural effects of a single node while its model is evaluated.
 * <p>
 * A context is created for one node load, handed to the node's {@link io.fullerstack.rosdiscover.model.Behavior},
 * and then closed with {@link #summarize()}. Every effect call resolves the given name
 * against the node, applies the node's remappings and records the result. Declarations are
 * kept in sets, so declaring the same interaction twice has no further effect.
 *
 * <p><b>Name resolution:</b>
 * <ul>
 *   <li>{@code /a/b} is already fully qualified and is returned unchanged</li>
 *   <li>{@code ~a} is private to the node: {@code /<node-name>/a}</li>
 *   <li>{@code a} is relative and resolves to {@code /a}; the node's namespace is not applied</li>
 * </ul>
 *
 * <p>A context is single-use: once summarized, any further effect call fails.
 */
public final class NodeContext {

    private static final Logger logger = LoggerFactory.getLogger(NodeContext.class);

    private final String name;
    private final String namespace;
    private final String kind;
    private final String packageName;
    private final String args;
    private final ParameterServer params;
    private final FileSystem files;
    private final Map<String, String> remappings;

    private final Set<TypedName> pubs = new HashSet<>();
    private final Set<TypedName> subs = new HashSet<>();
    private final Set<TypedName> provides = new HashSet<>();
    private final Set<TypedName> uses = new HashSet<>();
    private final Set<TypedName> actionServers = new HashSet<>();
    private final Set<TypedName> actionClients = new HashSet<>();
    private final Set<ParameterRead> reads = new HashSet<>();
    private final Set<String> writes = new HashSet<>();

    private boolean nodelet;
    private boolean placeholder;
    private boolean summarized;

    /**
     * @param name        node name
     * @param namespace   namespace the node is launched into
     * @param kind        node type
     * @param packageName package providing the node type
     * @param args        raw command-line arguments (null is treated as empty)
     * @param remappings  raw remappings, old name to new name (null is treated as empty)
     * @param params      parameter server of the interpreter session
     * @param files       file system the node reads from
     */
    @Builder(builderMethodName = "builder")
    public NodeContext(@NonNull String name,
                       @NonNull String namespace,
                       @NonNull String kind,
                       @NonNull String packageName,
                       String args,
                       Map<String, String> remappings,
                       @NonNull ParameterServer params,
                       @NonNull FileSystem files) {
        this.name = name;
        this.namespace = namespace;
        this.kind = kind;
        this.packageName = packageName;
        this.args = args == null ? "" : args;
        this.params = params;
        this.files = files;

        Map<String, String> resolved = new LinkedHashMap<>();
        if (remappings != null) {
            remappings.forEach((from, to) -> resolved.put(resolve(from), resolve(to)));
        }
        this.remappings = Collections.unmodifiableMap(resolved);
    }

    public String name() {
        return name;
    }

    public String namespace() {
        return namespace;
    }

    public String kind() {
        return kind;
    }

    public String packageName() {
        return packageName;
    }

    /**
     * @return raw command-line arguments of the node, never null
     */
    public String args() {
        return args;
    }

    /**
     * @return resolved remapping table, fully-qualified old name to fully-qualified new name
     */
    public Map<String, String> remappings() {
        return remappings;
    }

    public ParameterServer parameters() {
        return params;
    }

    /**
     * @return the namespace-qualified name of the node (e.g., "/robot/camera")
     */
    public String fullName() {
        if (namespace.endsWith("/")) {
            return namespace + name;
        }
        return namespace + "/" + name;
    }

    /**
     * Resolves a name within the context of this node.
     *
     * @param name global, private ({@code ~}) or relative name
     * @return the fully-qualified form of the name
     */
    public String resolve(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("cannot resolve an empty name");
        }
        if (name.charAt(0) == '/') {
            return name;
        }
        if (name.charAt(0) == '~') {
            return "/" + this.name + "/" + name.substring(1);
        }
        return "/" + name;
    }

    private String remap(String qualified) {
        String target = remappings.get(qualified);
        if (target == null) {
            return qualified;
        }
        logger.info("applying remapping from [{}] to [{}]", qualified, target);
        return target;
    }

    private String resolveAndRemap(String name) {
        return remap(resolve(name));
    }

    /**
     * Instructs the node to publish to a topic.
     *
     * @param topic  unqualified topic name
     * @param format message format used on the topic
     */
    public void publish(String topic, String format) {
        ensureOpen();
        logger.debug("node [{}] publishes to topic [{}] with format [{}]", name, topic, format);
        pubs.add(new TypedName(resolveAndRemap(topic), format));
    }

    /**
     * Subscribes the node to a topic.
     *
     * @param topic  unqualified topic name
     * @param format message format used on the topic
     */
    public void subscribe(String topic, String format) {
        ensureOpen();
        logger.debug("node [{}] subscribes to topic [{}] with format [{}]", name, topic, format);
        subs.add(new TypedName(resolveAndRemap(topic), format));
    }

    public void provideService(String service, String format) {
        ensureOpen();
        logger.debug("node [{}] provides service [{}] using format [{}]", name, service, format);
        provides.add(new TypedName(resolveAndRemap(service), format));
    }

    public void useService(String service, String format) {
        ensureOpen();
        logger.debug("node [{}] uses service [{}] with format [{}]", name, service, format);
        uses.add(new TypedName(resolveAndRemap(service), format));
    }

    /**
     * Reads a parameter from the parameter server.
     *
     * @param param        parameter name
     * @param defaultValue value returned when the parameter is not set (may be null)
     * @param dynamic      whether the node reacts to runtime updates of the parameter
     * @return current value of the parameter, or {@code defaultValue}
     */
    public ParameterValue readParameter(String param, ParameterValue defaultValue, boolean dynamic) {
        ensureOpen();
        logger.debug("node [{}] reads parameter [{}]", name, param);
        String qualified = resolve(param);
        reads.add(new ParameterRead(qualified, dynamic));
        return params.get(qualified, defaultValue);
    }

    public ParameterValue readParameter(String param, ParameterValue defaultValue) {
        return readParameter(param, defaultValue, false);
    }

    public Optional<ParameterValue> readParameter(String param) {
        return Optional.ofNullable(readParameter(param, null, false));
    }

    public void writeParameter(String param, ParameterValue value) {
        ensureOpen();
        logger.debug("node [{}] writes [{}] to parameter [{}]", name, value, param);
        String qualified = resolve(param);
        writes.add(qualified);
        params.set(qualified, value);
    }

    /**
     * Reads the contents of a text file. Not recorded as an interaction.
     */
    public String readFile(String path) {
        ensureOpen();
        return files.read(path);
    }

    /**
     * Creates an action server and the five protocol topics it uses.
     *
     * @param ns     namespace of the action server
     * @param format action format (e.g., "move_base_msgs/MoveBaseAction")
     */
    public void provideAction(String ns, String format) {
        ensureOpen();
        logger.debug("node [{}] provides action server [{}] with format [{}]", name, ns, format);
        String qualified = resolve(ns);
        actionServers.add(new TypedName(qualified, format));

        subscribe(ActionTopics.goal(qualified), ActionTopics.goalFormat(format));
        subscribe(ActionTopics.cancel(qualified), ActionTopics.CANCEL_FORMAT);
        publish(ActionTopics.status(qualified), ActionTopics.STATUS_FORMAT);
        publish(ActionTopics.feedback(qualified), ActionTopics.feedbackFormat(format));
        publish(ActionTopics.result(qualified), ActionTopics.resultFormat(format));
    }

    /**
     * Creates an action client and the five protocol topics it uses.
     *
     * @param ns     namespace of the action server the client talks to
     * @param format action format
     */
    public void useAction(String ns, String format) {
        ensureOpen();
        logger.debug("node [{}] provides action client [{}] with format [{}]", name, ns, format);
        String qualified = resolve(ns);
        actionClients.add(new TypedName(qualified, format));

        publish(ActionTopics.goal(qualified), ActionTopics.goalFormat(format));
        publish(ActionTopics.cancel(qualified), ActionTopics.CANCEL_FORMAT);
        subscribe(ActionTopics.status(qualified), ActionTopics.STATUS_FORMAT);
        subscribe(ActionTopics.feedback(qualified), ActionTopics.feedbackFormat(format));
        subscribe(ActionTopics.result(qualified), ActionTopics.resultFormat(format));
    }

    public void markNodelet() {
        ensureOpen();
        nodelet = true;
    }

    public void markPlaceholder() {
        ensureOpen();
        placeholder = true;
    }

    /**
     * Closes this context and returns the interactions it recorded.
     *
     * @throws IllegalStateException if the context was already summarized
     */
    public NodeSummary summarize() {
        ensureOpen();
        summarized = true;
        return new NodeSummary(
            name,
            fullName(),
            namespace,
            kind,
            packageName,
            nodelet,
            placeholder,
            reads,
            writes,
            pubs,
            subs,
            provides,
            uses,
            actionServers,
            actionClients
        );
    }

    private void ensureOpen() {
        if (summarized) {
            throw new IllegalStateException("context of node [" + name + "] has already been summarized");
        }
    }

    @Override
    public String toString() {
        return "NodeContext[" + fullName() + ", " + packageName + "/" + kind + "]";
    }
}
