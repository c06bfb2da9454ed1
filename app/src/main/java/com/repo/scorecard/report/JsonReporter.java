package com.repo.scorecard.report;

import com.repo.scorecard.model.ContributorScorecard;
import com.repo.scorecard.rules.PodiumRanker;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class JsonReporter {

    private final JsonDataConverter converter = new JsonDataConverter();

    public void generate(List<ContributorScorecard> data, List<PodiumRanker.Placement> podium, Path outputPath)
            throws IOException {
        Files.writeString(outputPath, converter.convertToSelfDescribingJson(data, podium));
        System.out.println("JSON Report generated at: " + outputPath.toAbsolutePath());
    }
}
