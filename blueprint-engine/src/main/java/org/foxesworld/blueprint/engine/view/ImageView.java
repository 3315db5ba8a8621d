package org.foxesworld.blueprint.engine.view;

import org.foxesworld.blueprint.core.ViewId;

import java.util.Map;

public class ImageView extends View {

    private String source;

    public ImageView(ViewId id) {
        super(id, ViewKind.IMAGE);
    }

    /** Image location, or {@code null} when unset. Accepts a string or an object with {@code uri}. */
    public String source() {
        return source;
    }

    @Override
    protected void onPropertyChanged(String key, Object value) {
        if (!"source".equals(key)) return;
        if (value instanceof String s) source = s;
        else if (value instanceof Map<?, ?> m && m.get("uri") instanceof String uri) source = uri;
        else source = null;
    }
}
