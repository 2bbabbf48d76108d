/*
 * Copyright (c) 2025 Stacktrail Contributors
 * Licensed under the Apache License 2.0
 */
package io.stacktrail.spring;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "stacktrail")
public class StackTrailProperties {

    private boolean enabled = true;

    /** Directory that rendered file paths are shown relative to; blank = process working directory. */
    private String workingDir;

    /** Whether the renderer becomes the process-wide default used by {@code %#s}. */
    private boolean installDefault = true;
}
