package com.fintech.enrichment.service;

import com.fintech.enrichment.model.SocialPlatform;

import java.util.List;
import java.util.Optional;

/**
 * Picks the best social-profile candidate: the first candidate of the highest
 * priority platform, otherwise the first candidate seen.
 */
public class SocialCandidateRanker {

    public static final List<SocialPlatform> DEFAULT_PRIORITY = List.of(
            SocialPlatform.FACEBOOK,
            SocialPlatform.LINKEDIN,
            SocialPlatform.INSTAGRAM,
            SocialPlatform.TWITTER);

    private final List<SocialPlatform> priority;

    public SocialCandidateRanker() {
        this(DEFAULT_PRIORITY);
    }

    public SocialCandidateRanker(List<SocialPlatform> priority) {
        this.priority = List.copyOf(priority);
    }

    public Optional<String> best(List<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        for (SocialPlatform platform : priority) {
            for (String candidate : candidates) {
                if (SocialPlatform.of(candidate).filter(platform::equals).isPresent()) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.of(candidates.get(0));
    }

    public List<SocialPlatform> getPriority() {
        return priority;
    }
}
