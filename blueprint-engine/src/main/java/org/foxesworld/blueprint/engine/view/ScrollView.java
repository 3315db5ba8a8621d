package org.foxesworld.blueprint.engine.view;

import com.jme3.scene.Node;
import org.foxesworld.blueprint.core.ViewId;
import org.foxesworld.blueprint.core.layout.LayoutBounds;

/**
 * Scroll container. Children hang off an inner node that is translated by the scroll offset;
 * the offset is clamped to the extent of the content.
 */
public class ScrollView extends View {

    private final Node scrollNode;

    private float scrollX;
    private float scrollY;

    public ScrollView(ViewId id) {
        super(id, ViewKind.SCROLL_CONTAINER);
        this.scrollNode = new Node(node.getName() + ":scroll");
        this.node.attachChild(scrollNode);
    }

    @Override
    protected Node childContainer() {
        return scrollNode;
    }

    public float scrollX() { return scrollX; }
    public float scrollY() { return scrollY; }

    public void scrollTo(float x, float y) {
        float contentW = 0f;
        float contentH = 0f;
        for (View c : children()) {
            LayoutBounds b = c.bounds();
            contentW = Math.max(contentW, b.right());
            contentH = Math.max(contentH, b.bottom());
        }

        scrollX = clamp(x, Math.max(0f, contentW - bounds().width()));
        scrollY = clamp(y, Math.max(0f, contentH - bounds().height()));
        scrollNode.setLocalTranslation(-scrollX, scrollY, 0f);
    }

    private static float clamp(float v, float max) {
        if (Float.isNaN(v) || v < 0f) return 0f;
        return Math.min(v, max);
    }
}
