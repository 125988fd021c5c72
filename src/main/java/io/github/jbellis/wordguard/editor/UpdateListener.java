package io.github.jbellis.wordguard.editor;

import io.github.jbellis.wordguard.dom.UpdateEvent;

@FunctionalInterface
public interface UpdateListener {
    void onUpdate(UpdateEvent event);
}
