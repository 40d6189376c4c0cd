package org.tessera.scene;

import java.io.IOException;

/**
 * Thrown when a scene's metadata or pixel data cannot be read.
 * <p>
 * Compositing treats this as a per-scene failure: the scene is skipped and the build continues.
 */
public class SceneReadException extends IOException {

    public SceneReadException(String message) {
        super(message);
    }

    public SceneReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
