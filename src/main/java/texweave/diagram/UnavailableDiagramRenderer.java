// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.diagram;

/**
 * The renderer used when no TeX engine is available: every diagram fails, so every diagram keeps its source.
 */
public final class UnavailableDiagramRenderer implements DiagramRenderer {
    private UnavailableDiagramRenderer() {
    }

    public static UnavailableDiagramRenderer instance() {
        return instance;
    }

    @Override
    public String render(final DiagramRequest request) throws DiagramRenderingException {
        throw new DiagramRenderingException("no diagram renderer is available");
    }

    private static final UnavailableDiagramRenderer instance = new UnavailableDiagramRenderer();
}
