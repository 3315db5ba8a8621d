package org.foxesworld.blueprint.engine.tree;

import org.foxesworld.blueprint.core.layout.ShadowView;
import org.foxesworld.blueprint.engine.view.View;

import java.util.Objects;

/** Render node plus its geometry node; {@code shadow} is null for raw text. */
public record ViewPair(View view, ShadowView shadow) {

    public ViewPair {
        Objects.requireNonNull(view, "view");
    }

    public boolean hasShadow() {
        return shadow != null;
    }
}
