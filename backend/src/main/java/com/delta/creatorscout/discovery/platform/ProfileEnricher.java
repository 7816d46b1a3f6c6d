package com.delta.creatorscout.discovery.platform;

import com.delta.creatorscout.discovery.model.CandidateCreator;
import com.delta.creatorscout.discovery.model.Platform;
import com.delta.creatorscout.discovery.model.ProfileEnrichment;

import java.time.Duration;

public interface ProfileEnricher {
    ProfileEnrichment enrich(Platform platform, CandidateCreator candidate, Duration timeout);
}
