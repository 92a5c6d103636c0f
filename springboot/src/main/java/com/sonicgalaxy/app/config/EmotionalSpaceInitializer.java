package com.sonicgalaxy.app.config;

import com.sonicgalaxy.app.dto.profile.SonicDnaProfile;
import com.sonicgalaxy.app.provider.DnaProfileProvider;
import com.sonicgalaxy.app.service.EmotionalSpaceService;
import com.sonicgalaxy.app.service.VisualizationExportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the emotional space from the profile store once the context is up, and optionally
 * writes the visualization export right after.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmotionalSpaceInitializer implements ApplicationRunner {

    private final DnaProfileProvider profileProvider;
    private final EmotionalSpaceService spaceService;
    private final VisualizationExportService exportService;

    @Value("${app.emotional-space.build-on-startup:true}")
    private boolean buildOnStartup;

    @Value("${app.emotional-space.export-on-startup:false}")
    private boolean exportOnStartup;

    @Override
    public void run(ApplicationArguments args) {
        if (!buildOnStartup) {
            log.info("Emotional space build on startup disabled (app.emotional-space.build-on-startup=false)");
            return;
        }

        List<SonicDnaProfile> profiles = profileProvider.loadProfiles();
        if (profiles.isEmpty()) {
            log.warn("No tracks available for emotional mapping, space stays empty until the next rebuild");
            return;
        }

        spaceService.rebuild(profiles);

        if (exportOnStartup) {
            exportService.writeExport();
        }
    }
}
