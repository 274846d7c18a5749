// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.document;

/**
 * A node identifier, stable for a given input: identifiers are handed out in parse order.
 */
public record NodeId(int value) implements Comparable<NodeId> {
    @Override
    public int compareTo(final NodeId other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "n" + value;
    }
}
