package io.fullerstack.rosdiscover.summary;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable record of the architectural interactions declared by a single node.
 * <p>
 * Produced exactly once per node by {@link io.fullerstack.rosdiscover.context.NodeContext#summarize()}.
 * Every collection is an immutable value set, so two summaries with the same identity and the
 * same declared interactions are equal and collapse under set semantics.
 *
 * @param name          node name, as given in the launch file
 * @param fullName      namespace-qualified node name
 * @param namespace     namespace the node was launched into
 * @param kind          node type
 * @param packageName   package that provides the node type
 * @param nodelet       whether the node was loaded as a nodelet
 * @param placeholder   whether no model was registered and a placeholder stood in
 * @param reads         parameter reads
 * @param writes        fully-qualified names of written parameters
 * @param pubs          published topics
 * @param subs          subscribed topics
 * @param provides      provided services
 * @param uses          called services
 * @param actionServers provided actions
 * @param actionClients called actions
 */
public record NodeSummary(
        String name,
        String fullName,
        String namespace,
        String kind,
        String packageName,
        boolean nodelet,
        boolean placeholder,
        Set<ParameterRead> reads,
        Set<String> writes,
        Set<TypedName> pubs,
        Set<TypedName> subs,
        Set<TypedName> provides,
        Set<TypedName> uses,
        Set<TypedName> actionServers,
        Set<TypedName> actionClients
) {
    public NodeSummary {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(fullName, "fullName cannot be null");
        Objects.requireNonNull(namespace, "namespace cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(packageName, "packageName cannot be null");
        reads = Set.copyOf(reads);
        writes = Set.copyOf(writes);
        pubs = Set.copyOf(pubs);
        subs = Set.copyOf(subs);
        provides = Set.copyOf(provides);
        uses = Set.copyOf(uses);
        actionServers = Set.copyOf(actionServers);
        actionClients = Set.copyOf(actionClients);
    }
}
