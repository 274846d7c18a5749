// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.document;

/**
 * Hands out sequential {@link NodeId}s. Confined to the thread building the tree.
 */
public final class NodeIdGenerator {
    public NodeId next() {
        nextValue += 1;
        return new NodeId(nextValue);
    }

    private int nextValue = 0;
}
