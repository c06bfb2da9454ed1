package com.repo.scorecard.source;

import com.repo.scorecard.core.BotFilter;
import com.repo.scorecard.model.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Merges per-repository contributor listings into one team roster.
 * Contributions are summed by login and each repository's share is kept.
 */
public class RosterMerger {

    private static final Logger log = LoggerFactory.getLogger(RosterMerger.class);

    private final BotFilter botFilter;

    public RosterMerger(BotFilter botFilter) {
        this.botFilter = botFilter;
    }

    /**
     * Fetch and merge the listings of all repositories. A repository whose
     * listing fails is logged and left out; the rest are still merged.
     *
     * @return roster sorted by total contributions, highest first
     */
    public List<RosterEntry> merge(List<String> repositories, ContributorSource source) {
        Map<String, List<RepositoryContributor>> listings = new LinkedHashMap<>();
        for (String repository : repositories) {
            try {
                listings.put(repository, source.fetch(repository));
            } catch (IOException e) {
                log.warn("Error fetching contributors for {}: {}", repository, e.getMessage());
            }
        }
        return merge(listings);
    }

    /**
     * Merge listings already in memory, keyed by repository name.
     */
    public List<RosterEntry> merge(Map<String, List<RepositoryContributor>> listings) {
        Map<String, Builder> byLogin = new LinkedHashMap<>();

        for (Map.Entry<String, List<RepositoryContributor>> listing : listings.entrySet()) {
            String repository = listing.getKey();
            for (RepositoryContributor contributor : listing.getValue()) {
                if (contributor == null || contributor.login() == null || contributor.login().isBlank()) {
                    log.warn("Skipping contributor without a login in {}", repository);
                    continue;
                }
                if (isBot(contributor)) {
                    continue;
                }
                byLogin.computeIfAbsent(contributor.login(), login -> new Builder(contributor))
                        .add(repository, contributor.contributions());
            }
        }

        return byLogin.values().stream()
                .map(Builder::build)
                .sorted(Comparator.comparingInt(RosterEntry::contributions).reversed())
                .collect(Collectors.toList());
    }

    public static List<Identity> toIdentities(List<RosterEntry> roster) {
        return roster.stream().map(RosterEntry::toIdentity).collect(Collectors.toList());
    }

    private boolean isBot(RepositoryContributor contributor) {
        return "bot".equalsIgnoreCase(contributor.type()) || botFilter.isBot(contributor.login());
    }

    // The first listing a login appears in supplies its profile fields
    private static final class Builder {
        private final RepositoryContributor profile;
        private final List<RosterEntry.RepositoryShare> shares = new ArrayList<>();
        private int contributions;

        Builder(RepositoryContributor profile) {
            this.profile = profile;
        }

        void add(String repository, int count) {
            contributions += count;
            shares.add(new RosterEntry.RepositoryShare(repository, count));
        }

        RosterEntry build() {
            return new RosterEntry(profile.login(), profile.id(), profile.avatarUrl(), profile.htmlUrl(),
                    profile.type(), contributions, shares);
        }
    }
}
