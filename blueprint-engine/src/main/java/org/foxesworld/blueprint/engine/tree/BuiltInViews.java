package org.foxesworld.blueprint.engine.tree;

import org.foxesworld.blueprint.core.layout.ScrollContentShadowView;
import org.foxesworld.blueprint.core.layout.ShadowView;
import org.foxesworld.blueprint.core.layout.TextMeasure;
import org.foxesworld.blueprint.core.layout.TextShadowView;
import org.foxesworld.blueprint.engine.view.ImageView;
import org.foxesworld.blueprint.engine.view.ScrollView;
import org.foxesworld.blueprint.engine.view.TextView;
import org.foxesworld.blueprint.engine.view.View;
import org.foxesworld.blueprint.engine.view.ViewKind;

/** View types every root knows about. */
public final class BuiltInViews {

    public static final String VIEW = "View";
    public static final String TEXT = "Text";
    public static final String IMAGE = "Image";
    public static final String SCROLL_VIEW = "ScrollView";
    public static final String SCROLL_CONTENT = "ScrollViewContentView";

    private BuiltInViews() {}

    public static void install(ViewFactoryRegistry registry, TextMeasure textMeasure) {
        registry.register(VIEW, ViewFactory.<View>of(View::new, ShadowView::new));
        registry.register(TEXT, ViewFactory.<TextView>of(TextView::new,
                (id, view) -> new TextShadowView(id, view, view, textMeasure)));
        registry.register(IMAGE, ViewFactory.of(ImageView::new, ShadowView::new));
        registry.register(SCROLL_VIEW, ViewFactory.of(ScrollView::new, ShadowView::new));
        registry.register(SCROLL_CONTENT, ViewFactory.<View>of(
                id -> new View(id, ViewKind.SCROLL_CONTENT), ScrollContentShadowView::new));
    }
}
