package io.ringcluster.core.model;

import java.util.Objects;

/**
 * Address of an actor or service. The owning {@link NodeId} is what the cluster server routes on.
 */
public record Pid(String name, String group, NodeId node) {

    public Pid {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(node, "node");
    }

    public static Pid of(final String name, final NodeId node) {
        return new Pid(name, null, node);
    }

    @Override
    public String toString() {
        return group == null
                ? name + "::" + node
                : group + "::" + name + "::" + node;
    }
}
