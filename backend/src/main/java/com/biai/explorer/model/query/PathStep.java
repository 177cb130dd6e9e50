package com.biai.explorer.model.query;

import com.biai.explorer.model.enums.EdgeDirection;

/**
 * One hop of a relationship path. {@code foreignKey} and {@code referencedColumn}
 * always describe the declared relationship, whatever the traversal direction.
 */
public record PathStep(
    String from,
    String to,
    String foreignKey,
    String referencedColumn,
    EdgeDirection direction
) {

    /**
     * Column of {@code from} that links this hop.
     */
    public String fromColumn() {
        return direction == EdgeDirection.FORWARD ? foreignKey : referencedColumn;
    }

    /**
     * Column of {@code to} that links this hop.
     */
    public String toColumn() {
        return direction == EdgeDirection.FORWARD ? referencedColumn : foreignKey;
    }
}
