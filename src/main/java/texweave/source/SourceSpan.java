// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.source;

/**
 * The original-source extent of a document node.
 *
 * @param start The origin of the first character of the node.
 * @param end   The origin just past the last character of the node.
 */
public record SourceSpan(SourceOrigin start, SourceOrigin end) {
    public static SourceSpan at(final SourceOrigin origin) {
        return new SourceSpan(origin, origin);
    }

    /**
     * Returns the span from the start of this span to the end of {@code other}.
     */
    public SourceSpan to(final SourceSpan other) {
        return new SourceSpan(start, other.end);
    }

    @Override
    public String toString() {
        return start + "-" + end.line() + ":" + end.column();
    }
}
