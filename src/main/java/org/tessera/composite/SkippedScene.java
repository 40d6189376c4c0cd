package org.tessera.composite;

/**
 * A scene left out of a composite because it could not be read.
 *
 * @param sceneId the scene identifier.
 * @param stage   where it failed, e.g. {@code classification} or a band name.
 * @param reason  the failure message.
 */
public record SkippedScene(String sceneId, String stage, String reason) {
}
