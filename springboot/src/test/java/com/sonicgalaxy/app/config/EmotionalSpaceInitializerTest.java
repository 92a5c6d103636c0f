package com.sonicgalaxy.app.config;

import com.sonicgalaxy.app.ProfileFixtures;
import com.sonicgalaxy.app.dto.profile.SonicDnaProfile;
import com.sonicgalaxy.app.provider.DnaProfileProvider;
import com.sonicgalaxy.app.service.EmotionalSpaceService;
import com.sonicgalaxy.app.service.VisualizationExportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EmotionalSpaceInitializerTest {

    private DnaProfileProvider provider;
    private EmotionalSpaceService spaceService;
    private VisualizationExportService exportService;
    private EmotionalSpaceInitializer initializer;

    @BeforeEach
    void setUp() {
        provider = mock(DnaProfileProvider.class);
        spaceService = mock(EmotionalSpaceService.class);
        exportService = mock(VisualizationExportService.class);
        initializer = new EmotionalSpaceInitializer(provider, spaceService, exportService);
        ReflectionTestUtils.setField(initializer, "buildOnStartup", true);
    }

    @Test
    void buildsFromStoredProfiles() {
        List<SonicDnaProfile> profiles = ProfileFixtures.chain(4, 0.2);
        when(provider.loadProfiles()).thenReturn(profiles);

        initializer.run(new DefaultApplicationArguments());

        verify(spaceService).rebuild(profiles);
        verify(exportService, never()).writeExport();
    }

    @Test
    void emptyStoreSkipsTheBuild() {
        when(provider.loadProfiles()).thenReturn(List.of());

        initializer.run(new DefaultApplicationArguments());

        verify(spaceService, never()).rebuild(anyList());
    }

    @Test
    void exportFollowsTheBuildWhenEnabled() {
        ReflectionTestUtils.setField(initializer, "exportOnStartup", true);
        when(provider.loadProfiles()).thenReturn(ProfileFixtures.chain(4, 0.2));

        initializer.run(new DefaultApplicationArguments());

        verify(spaceService).rebuild(any());
        verify(exportService).writeExport();
    }

    @Test
    void disabledBuildLeavesStoreUntouched() {
        ReflectionTestUtils.setField(initializer, "buildOnStartup", false);

        initializer.run(new DefaultApplicationArguments());

        verify(provider, never()).loadProfiles();
    }
}
