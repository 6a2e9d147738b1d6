package com.sitedigest.core.model;

/**
 * Named nodes of the content pipeline graph.
 * <p>
 * The four working nodes ({@link #DISCOVERY}, {@link #RETRIEVAL},
 * {@link #TRANSFORMATION}, {@link #PERSISTENCE}) can fail and be retried
 * through {@link #ERROR_RECOVERY}. {@link #COMPLETE} is terminal for both
 * success and give-up failure.
 */
public enum WorkflowNode {
    INITIALIZE("initialize"),
    DISCOVERY("discovery"),
    RETRIEVAL("retrieval"),
    TRANSFORMATION("transformation"),
    PERSISTENCE("persistence"),
    ERROR_RECOVERY("error_recovery"),
    COMPLETE("complete");

    private final String graphId;

    WorkflowNode(String graphId) {
        this.graphId = graphId;
    }

    /** Node id used when registering the node in the state graph. */
    public String graphId() {
        return graphId;
    }

    public boolean isWorking() {
        return this == DISCOVERY || this == RETRIEVAL || this == TRANSFORMATION || this == PERSISTENCE;
    }

    public static WorkflowNode fromGraphId(String graphId) {
        for (var node : values()) {
            if (node.graphId.equals(graphId)) {
                return node;
            }
        }
        throw new IllegalArgumentException("Unknown workflow node: " + graphId);
    }
}
