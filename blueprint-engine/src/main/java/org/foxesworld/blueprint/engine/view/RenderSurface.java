package org.foxesworld.blueprint.engine.view;

/** Receives repaint requests for views attached under a root. */
@FunctionalInterface
public interface RenderSurface {

    void repaint(View view);

    RenderSurface NONE = view -> {};
}
