package com.agentfleet.core.model;

import java.io.Serializable;

/**
 * Something a task produced.
 *
 * @param type    "file", "doc" or "code"
 * @param path    location of the artifact, relative to the project root
 * @param content optional inline content
 */
public record Artifact(
    String type,
    String path,
    String content
) implements Serializable {}
