package org.foxesworld.blueprint.engine.view;

import org.foxesworld.blueprint.core.ViewId;

/** Text run owned by a {@link TextView}. Has no geometry node. */
public class RawTextView extends View {

    private String text;

    public RawTextView(ViewId id, String text) {
        super(id, ViewKind.RAW_TEXT);
        this.text = text != null ? text : "";
    }

    public String text() {
        return text;
    }

    public void setText(String text) {
        this.text = text != null ? text : "";
    }
}
