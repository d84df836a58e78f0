package com.deviceagents.device;

/**
 * An action a node advertises, e.g. an IME "Search" action on a text field.
 */
public final class NodeAction {

    private final int id;
    private final String label;

    public NodeAction(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int getId() {
        return id;
    }

    /** May be null for unlabeled standard actions. */
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return "NodeAction{" + id + ", " + label + "}";
    }
}
