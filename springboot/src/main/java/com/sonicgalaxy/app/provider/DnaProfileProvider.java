package com.sonicgalaxy.app.provider;

import com.sonicgalaxy.app.dto.profile.SonicDnaProfile;

import java.util.List;

/**
 * Source of analyzed tracks. The audio analysis itself lives outside this application.
 */
public interface DnaProfileProvider {

    List<SonicDnaProfile> loadProfiles();
}
