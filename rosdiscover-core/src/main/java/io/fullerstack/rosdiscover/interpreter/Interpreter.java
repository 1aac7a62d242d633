package io.fullerstack.rosdiscover.interpreter;

import io.fullerstack.rosdiscover.config.HierarchicalConfig;
import io.fullerstack.rosdiscover.context.NodeContext;
import io.fullerstack.rosdiscover.io.FileSystem;
import io.fullerstack.rosdiscover.io.LocalFileSystem;
import io.fullerstack.rosdiscover.io.LocalShell;
import io.fullerstack.rosdiscover.io.Shell;
import io.fullerstack.rosdiscover.launch.Launch;
import io.fullerstack.rosdiscover.launch.LaunchConfig;
import io.fullerstack.rosdiscover.launch.LaunchFileReader;
import io.fullerstack.rosdiscover.launch.NodeDescriptor;
import io.fullerstack.rosdiscover.launch.XmlLaunchFileReader;
import io.fullerstack.rosdiscover.model.Model;
import io.fullerstack.rosdiscover.model.ModelNotFoundException;
import io.fullerstack.rosdiscover.model.ModelRegistry;
import io.fullerstack.rosdiscover.parameter.ParameterServer;
import io.fullerstack.rosdiscover.summary.NodeSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Simulates the architectural effects of {@code roslaunch}.
 * <p>
 * An interpreter is one simulation session. It owns a {@link ParameterServer} and the set of
 * {@link NodeSummary summaries} produced so far, and borrows a read-only {@link ModelRegistry}
 * that may be shared with other sessions.
 *
 * <p><strong>Launch flow:</strong>
 * <ol>
 *   <li>Rewrite {@code $(find xacro)/xacro } to {@code $(find xacro)/xacro.py } in the launch file</li>
 *   <li>Read parameters and nodes through the {@link LaunchFileReader}</li>
 *   <li>Copy every parameter into the parameter server</li>
 *   <li>Load the nodes in file order; the first node that fails aborts the launch</li>
 * </ol>
 *
 * <p><strong>Usage:</strong>
 * <pre>
 * ModelRegistry registry = RosDiscoverBootstrap.registry();
 * Interpreter interpreter = Interpreter.builder(registry).build();
 * interpreter.launch("/ros_ws/src/robot/launch/bringup.launch");
 * Set&lt;NodeSummary&gt; nodes = interpreter.nodes();
 * </pre>
 */
public final class Interpreter {

    private static final Logger logger = LoggerFactory.getLogger(Interpreter.class);

    /** Node type of nodelet managers and nodelet loaders. */
    public static final String NODELET = "nodelet";

    /**
     * roslaunch resolves {@code $(find xacro)/xacro} to the wrong package folder on some
     * distributions; pointing it at {@code xacro.py} avoids that.
     */
    static final String XACRO_WORKAROUND = "s#$(find xacro)/xacro #$(find xacro)/xacro.py #g";

    private final ModelRegistry registry;
    private final FileSystem files;
    private final Shell shell;
    private final LaunchFileReader reader;
    private final MissingModelPolicy missingModelPolicy;

    private final ParameterServer params = new ParameterServer();
    private final Set<NodeSummary> nodes = new LinkedHashSet<>();
    private final Set<String> managers = new LinkedHashSet<>();

    private Interpreter(Builder builder) {
        this.registry = builder.registry;
        this.files = builder.files;
        this.shell = builder.shell;
        this.reader = builder.reader;
        this.missingModelPolicy = builder.missingModelPolicy;
    }

    /**
     * @param registry models to evaluate nodes with
     * @return builder for an interpreter session
     */
    public static Builder builder(ModelRegistry registry) {
        return new Builder(registry);
    }

    /**
     * The simulated parameter server of this session.
     */
    public ParameterServer parameters() {
        return params;
    }

    /**
     * @return snapshot of the summaries produced so far, in load order
     */
    public Set<NodeSummary> nodes() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(nodes));
    }

    /**
     * @return names of the nodelet managers seen so far
     */
    public Set<String> managers() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(managers));
    }

    public MissingModelPolicy missingModelPolicy() {
        return missingModelPolicy;
    }

    /**
     * Simulates {@code roslaunch} on a launch file without arguments.
     */
    public void launch(String file) {
        launch(Launch.of(file));
    }

    /**
     * Simulates {@code roslaunch} on a launch file.
     *
     * @throws io.fullerstack.rosdiscover.RosDiscoverException if reading the file or loading any node fails
     */
    public void launch(Launch launch) {
        Objects.requireNonNull(launch, "launch cannot be null");
        String file = launch.filename();
        logger.info("simulating launch: {} {}", file, launch.argv());

        shell.runAndCapture("sed -i '" + XACRO_WORKAROUND + "' " + quote(file));
        LaunchConfig config = reader.read(file, launch.arguments());

        config.parameters().forEach(params::set);

        for (NodeDescriptor node : config.nodes()) {
            logger.debug("launching node: {}", node.name());
            try {
                load(node.packageName(),
                     node.type(),
                     node.name(),
                     node.namespace(),
                     node.remappingTable(),
                     node.args());
            } catch (RuntimeException e) {
                logger.error("failed to launch node: {}", node.name(), e);
                throw e;
            }
        }
    }

    /**
     * Loads a node.
     *
     * @param packageName package to which the node type belongs
     * @param nodeType    type of the node, or {@value #NODELET} for nodelet managers and loaders
     * @param name        name assigned to the node
     * @param namespace   namespace the node is loaded into
     * @param remappings  old name to new name, as written in the launch file
     * @param args        command-line arguments of the node
     * @throws MalformedNodeletArgsException if a nodelet's arguments cannot be parsed
     * @throws ModelNotFoundException if no model exists and the policy is {@link MissingModelPolicy#FAIL}
     */
    public void load(String packageName,
                     String nodeType,
                     String name,
                     String namespace,
                     Map<String, String> remappings,
                     String args) {
        String trimmedArgs = args == null ? "" : args.trim();
        Map<String, String> remaps = remappings == null ? Map.of() : remappings;

        if (NODELET.equals(nodeType)) {
            NodeletCommand command = NodeletCommand.parse(trimmedArgs);
            switch (command.kind()) {
                case MANAGER -> createNodeletManager(name);
                case STANDALONE -> loadNodelet(command.packageName(), command.nodeType(), name, namespace, remaps, null);
                case LOAD -> loadNodelet(command.packageName(), command.nodeType(), name, namespace, remaps, command.manager());
            }
            return;
        }

        loadNode(packageName, nodeType, name, namespace, remaps, trimmedArgs, false);
    }

    private void createNodeletManager(String name) {
        managers.add(name);
        logger.info("launched nodelet manager: {}", name);
    }

    private void loadNodelet(String packageName,
                             String nodeType,
                             String name,
                             String namespace,
                             Map<String, String> remappings,
                             String manager) {
        if (manager != null) {
            logger.info("launching nodelet [{}] inside manager [{}]", name, manager);
        } else {
            logger.info("launching standalone nodelet [{}]", name);
        }
        loadNode(packageName, nodeType, name, namespace, remappings, "", true);
    }

    private void loadNode(String packageName,
                          String nodeType,
                          String name,
                          String namespace,
                          Map<String, String> remappings,
                          String args,
                          boolean nodelet) {
        if (!remappings.isEmpty()) {
            logger.info("using remappings: {}", remappings);
        }

        Model model = registry.find(packageName, nodeType);
        if (model.isPlaceholder() && missingModelPolicy == MissingModelPolicy.FAIL) {
            throw new ModelNotFoundException(model.key());
        }

        NodeContext context = NodeContext.builder()
            .name(name)
            .namespace(namespace)
            .kind(nodeType)
            .packageName(packageName)
            .args(args)
            .remappings(remappings)
            .params(params)
            .files(files)
            .build();
        if (nodelet) {
            context.markNodelet();
        }

        model.eval(context);
        nodes.add(context.summarize());
    }

    private static String quote(String file) {
        return "'" + file.replace("'", "'\\''") + "'";
    }

    @Override
    public String toString() {
        return "Interpreter[nodes=" + nodes.size() + ", parameters=" + params.size() + "]";
    }

    /**
     * Builder for interpreter sessions.
     * <p>
     * Collaborators that are not set explicitly are created from the configuration:
     * a {@link LocalFileSystem}, a {@link LocalShell} bounded by {@code shell.timeout-ms},
     * an {@link XmlLaunchFileReader} and the policy in {@code interpreter.missing-model-policy}.
     */
    public static final class Builder {

        private final ModelRegistry registry;
        private HierarchicalConfig config;
        private FileSystem files;
        private Shell shell;
        private LaunchFileReader reader;
        private MissingModelPolicy missingModelPolicy;

        private Builder(ModelRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        }

        public Builder config(HierarchicalConfig config) {
            this.config = Objects.requireNonNull(config);
            return this;
        }

        public Builder files(FileSystem files) {
            this.files = Objects.requireNonNull(files);
            return this;
        }

        public Builder shell(Shell shell) {
            this.shell = Objects.requireNonNull(shell);
            return this;
        }

        public Builder reader(LaunchFileReader reader) {
            this.reader = Objects.requireNonNull(reader);
            return this;
        }

        public Builder missingModelPolicy(MissingModelPolicy policy) {
            this.missingModelPolicy = Objects.requireNonNull(policy);
            return this;
        }

        public Interpreter build() {
            HierarchicalConfig cfg = config != null ? config : HierarchicalConfig.global();
            if (files == null) {
                files = new LocalFileSystem();
            }
            if (shell == null) {
                shell = LocalShell.fromConfig(cfg);
            }
            if (reader == null) {
                reader = new XmlLaunchFileReader(files, shell, cfg);
            }
            if (missingModelPolicy == null) {
                missingModelPolicy = cfg.getEnum(
                    "interpreter.missing-model-policy", MissingModelPolicy.class, MissingModelPolicy.PLACEHOLDER);
            }
            return new Interpreter(this);
        }
    }
}
