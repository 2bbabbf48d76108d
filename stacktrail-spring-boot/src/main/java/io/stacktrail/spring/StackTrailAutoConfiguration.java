/*
 * Copyright (c) 2025 Stacktrail Contributors
 * Licensed under the Apache License 2.0
 */
package io.stacktrail.spring;

import io.stacktrail.core.stack.FrameRenderer;
import io.stacktrail.core.stack.WorkingDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Fixes the working directory used to render call sites.
 *
 * <p>The default renderer can only be installed once per process; if something already rendered
 * a trail (or installed another renderer) before this runs, the existing one stays and a warning
 * is logged.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(StackTrailProperties.class)
@ConditionalOnProperty(prefix = "stacktrail", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StackTrailAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public FrameRenderer stackTrailFrameRenderer(StackTrailProperties props) {
        String dir = props.getWorkingDir();
        WorkingDirectory wd = (dir == null || dir.isBlank()) ? WorkingDirectory.current() : WorkingDirectory.of(dir);
        FrameRenderer renderer = new FrameRenderer(wd);

        if (props.isInstallDefault()) {
            if (FrameRenderer.installDefault(renderer)) {
                log.debug("stacktrail: rendering call sites relative to '{}'", wd);
            } else {
                log.warn(
                        "stacktrail: default renderer already fixed to '{}', ignoring working-dir '{}'",
                        FrameRenderer.defaultRenderer().workingDirectory(),
                        wd);
            }
        }
        return renderer;
    }
}
