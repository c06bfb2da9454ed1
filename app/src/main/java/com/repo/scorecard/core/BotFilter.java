package com.repo.scorecard.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Classifies usernames as automated accounts (CI systems, dependency bots).
 * Matching is a case-insensitive substring test against a denylist.
 */
public class BotFilter {

    /** GitHub bot logins and common CI/dependency service accounts */
    public static final List<String> DEFAULT_PATTERNS = List.of(
            "bot",
            "jenkins",
            "travis",
            "circleci",
            "github-actions",
            "dependabot",
            "renovate",
            "snyk",
            "github-actions[bot]",
            "dependabot[bot]",
            "renovate[bot]");

    private final List<String> patterns;

    public BotFilter(Collection<String> extraPatterns) {
        List<String> all = new ArrayList<>(DEFAULT_PATTERNS);
        if (extraPatterns != null) {
            for (String pattern : extraPatterns) {
                if (pattern != null && !pattern.isBlank()) {
                    all.add(pattern.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        this.patterns = Collections.unmodifiableList(all);
    }

    public static BotFilter defaults() {
        return new BotFilter(List.of());
    }

    /**
     * @return true if the username matches any bot pattern; false for null or
     *         empty names
     */
    public boolean isBot(String username) {
        if (username == null || username.isEmpty()) {
            return false;
        }
        String lower = username.toLowerCase(Locale.ROOT);
        for (String pattern : patterns) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    public List<String> getPatterns() {
        return patterns;
    }
}
