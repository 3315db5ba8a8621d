package org.foxesworld.blueprint.core.layout;

import org.foxesworld.blueprint.core.ViewId;

public class ScrollContentShadowView extends ShadowView {

    public ScrollContentShadowView(ViewId viewId, LayoutTarget target) {
        super(viewId, target);
    }

    @Override
    public boolean sizesToContent() {
        return true;
    }
}
