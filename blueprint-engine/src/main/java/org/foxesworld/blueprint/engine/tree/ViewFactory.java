package org.foxesworld.blueprint.engine.tree;

import org.foxesworld.blueprint.core.ViewId;
import org.foxesworld.blueprint.core.layout.ShadowView;
import org.foxesworld.blueprint.engine.view.View;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/** Builds the view/shadow pair for one registered type id, given the freshly allocated id. */
@FunctionalInterface
public interface ViewFactory {

    ViewPair create(ViewId id);

    /**
     * Factory from a constructor pair. The shadow constructor receives the view so it can use it
     * as its layout target.
     */
    static <V extends View> ViewFactory of(Function<ViewId, V> viewCtor,
                                           BiFunction<ViewId, ? super V, ? extends ShadowView> shadowCtor) {
        Objects.requireNonNull(viewCtor, "viewCtor");
        Objects.requireNonNull(shadowCtor, "shadowCtor");
        return id -> {
            V view = viewCtor.apply(id);
            return new ViewPair(view, shadowCtor.apply(id, view));
        };
    }
}
