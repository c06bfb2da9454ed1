package com.repo.scorecard;

import com.repo.scorecard.core.ScorecardConfig;
import com.repo.scorecard.model.ContributorScorecard;
import com.repo.scorecard.model.Identity;
import com.repo.scorecard.report.CsvReporter;
import com.repo.scorecard.report.DurationFormatter;
import com.repo.scorecard.report.JsonReporter;
import com.repo.scorecard.report.TeamSummary;
import com.repo.scorecard.rules.PodiumRanker;
import com.repo.scorecard.source.EventBatch;
import com.repo.scorecard.source.EventFileLoader;
import com.repo.scorecard.source.RosterEntry;
import com.repo.scorecard.source.RosterMerger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Contributor Scorecard - builds per-contributor DORA scorecards from an events
 * file.
 *
 * Usage: java -jar contributor-scorecard.jar --events &lt;file&gt; [--roster
 * &lt;file&gt;] [--config &lt;dir&gt;] [--output &lt;dir&gt;]
 */
public class ScorecardApp {

    public static void main(String[] args) {
        System.out.println("=== Contributor Scorecard ===");

        CliArgs cliArgs = parseArgs(args);
        if (cliArgs == null) {
            printUsage();
            System.exit(1);
        }

        try {
            new ScorecardApp().run(cliArgs);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.err.println("""
                Usage: java -jar contributor-scorecard.jar --events <file> [--roster <file>] [--config <dir>] [--output <dir>]

                Arguments:
                  --events <file>    YAML file with pull_requests, deployments and incidents (required)
                  --roster <file>    YAML file with per-repository contributor listings (optional)
                  --config <dir>     Directory containing scorecard.yaml (default: current directory)
                  --output <dir>     Output directory for reports (default: current directory)
                """);
    }

    record CliArgs(
            Path eventsFile,
            Path rosterFile,
            Path configDir,
            Path outputDir) {
    }

    static CliArgs parseArgs(String[] args) {
        Path eventsFile = null;
        Path rosterFile = null;
        Path configDir = Path.of(".");
        Path outputDir = Path.of(".");

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--events" -> {
                    if (i + 1 < args.length)
                        eventsFile = Path.of(args[++i]);
                }
                case "--roster" -> {
                    if (i + 1 < args.length)
                        rosterFile = Path.of(args[++i]);
                }
                case "--config" -> {
                    if (i + 1 < args.length)
                        configDir = Path.of(args[++i]);
                }
                case "--output" -> {
                    if (i + 1 < args.length)
                        outputDir = Path.of(args[++i]);
                }
                default -> System.err.println("Ignoring unknown argument: " + args[i]);
            }
        }

        if (eventsFile == null) {
            return null;
        }
        return new CliArgs(eventsFile, rosterFile, configDir, outputDir);
    }

    void run(CliArgs args) throws Exception {
        ScorecardConfig config = ScorecardConfig.load(args.configDir());
        EventFileLoader loader = new EventFileLoader();

        System.out.println("\n>>> PHASE 1: LOADING EVENTS <<<");
        EventBatch batch = loader.load(args.eventsFile());
        System.out.printf("Loaded %d pull requests, %d deployments, %d incidents.%n",
                batch.pullRequests().size(), batch.deployments().size(), batch.incidents().size());

        List<Identity> identities = List.of();
        if (args.rosterFile() != null) {
            List<RosterEntry> roster = new RosterMerger(config.botFilter())
                    .merge(loader.loadRoster(args.rosterFile()));
            identities = RosterMerger.toIdentities(roster);
            System.out.println("Merged roster of " + roster.size() + " contributors.");
        }

        System.out.println("\n>>> PHASE 2: AGGREGATING <<<");
        List<ContributorScorecard> scorecards = new ScorecardAggregator(config)
                .aggregate(batch.pullRequests(), batch.deployments(), batch.incidents(), identities);
        printTable(scorecards);

        List<PodiumRanker.Placement> podium = new PodiumRanker(config.getPodiumSize()).rank(scorecards);
        if (!podium.isEmpty()) {
            System.out.println("\nPodium:");
            for (PodiumRanker.Placement p : podium) {
                System.out.printf("  %d. %s (%.1f)%n", p.position(), p.contributor().displayName(), p.score());
            }
        }

        TeamSummary summary = TeamSummary.of(scorecards);
        System.out.printf("%nTeam: %d contributors, %d commits, %d PRs, +%d/-%d lines, avg lead time %s%n",
                summary.totalContributors(), summary.totalCommits(), summary.totalPullRequests(),
                summary.totalAdditions(), summary.totalDeletions(),
                DurationFormatter.format(summary.reportedLeadTimeMs()));

        System.out.println("\n>>> PHASE 3: REPORTING <<<");
        Files.createDirectories(args.outputDir());
        new CsvReporter().generate(scorecards, args.outputDir().resolve("scorecards.csv"));
        new JsonReporter().generate(scorecards, podium, args.outputDir().resolve("scorecards.json"));
    }

    private static void printTable(List<ContributorScorecard> scorecards) {
        System.out.println("\n| %-25s | %-7s | %-5s | %-10s | %-7s | %-5s | %-6s |".formatted(
                "Contributor", "Commits", "PRs", "Lead Time", "Deploys", "DORA", "Share"));
        System.out.println("|" + "-".repeat(27) + "|" + "-".repeat(9) + "|" + "-".repeat(7) + "|" + "-".repeat(12)
                + "|" + "-".repeat(9) + "|" + "-".repeat(7) + "|" + "-".repeat(8) + "|");

        for (ContributorScorecard c : scorecards) {
            System.out.println("| %-25s | %-7d | %-5d | %-10s | %-7d | %-5s | %-5d%% |".formatted(
                    truncate(c.displayName(), 25),
                    c.commitCount(),
                    c.prCount(),
                    DurationFormatter.format(c.avgLeadTimeMs()),
                    c.deploymentCount(),
                    c.doraScore().isPresent() ? String.valueOf(c.doraScore().getAsInt()) : "-",
                    c.contributionPercentage()));
        }
    }

    private static String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return s.substring(0, len - 3) + "...";
    }
}
