package com.leanspec.sync.bridge.config;

import java.nio.file.Path;

/**
 * A resolved local project: stable id, display name, root and specs directory (both absolute).
 */
public record ProjectConfig(String id, String name, Path root, Path specsDir) {
}
