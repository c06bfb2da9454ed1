package com.repo.scorecard.source;

import com.repo.scorecard.model.DeploymentEvent;
import com.repo.scorecard.model.DeploymentStatus;
import com.repo.scorecard.model.IncidentEvent;
import com.repo.scorecard.model.PullRequestEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Reads event and roster files written in YAML.
 *
 * <pre>
 * pull_requests:
 *   - author: alice
 *     commits: 5
 *     additions: 120
 *     lead_time_ms: 3600000
 *     reviewers: [bob]
 * deployments:
 *   - actor: alice
 *     status: success
 *     timestamp: 2024-05-01T10:00:00Z
 * incidents:
 *   - assignee: alice
 * </pre>
 *
 * Entries without an identity field are passed through and dropped later by the
 * joiner; entries with unparseable values are rejected.
 */
public class EventFileLoader {

    private static final Logger log = LoggerFactory.getLogger(EventFileLoader.class);

    public EventBatch load(Path eventsFile) throws IOException {
        try (InputStream is = Files.newInputStream(eventsFile)) {
            Object data = new Yaml().load(is);
            EventBatch batch = parseEvents(data);
            log.info("Loaded {} pull requests, {} deployments, {} incidents from {}",
                    batch.pullRequests().size(), batch.deployments().size(), batch.incidents().size(), eventsFile);
            return batch;
        }
    }

    public EventBatch parse(String yamlContent) throws IOException {
        try (Reader reader = new StringReader(yamlContent)) {
            return parseEvents(new Yaml().load(reader));
        }
    }

    /**
     * Read per-repository contributor listings.
     *
     * <pre>
     * repositories:
     *   - name: api
     *     contributors:
     *       - login: alice
     *         contributions: 40
     * </pre>
     *
     * @return listings keyed by repository name, in file order
     */
    public Map<String, List<RepositoryContributor>> loadRoster(Path rosterFile) throws IOException {
        try (InputStream is = Files.newInputStream(rosterFile)) {
            return parseRoster(new Yaml().load(is));
        }
    }

    @SuppressWarnings("unchecked")
    private EventBatch parseEvents(Object data) throws IOException {
        if (data == null) {
            return EventBatch.empty();
        }
        if (!(data instanceof Map)) {
            throw new IOException("Events file must contain a mapping at the top level");
        }
        Map<String, Object> root = (Map<String, Object>) data;

        List<PullRequestEvent> pullRequests = new ArrayList<>();
        List<Map<String, Object>> prEntries = entries(root, "pull_requests");
        for (int i = 0; i < prEntries.size(); i++) {
            pullRequests.add(parsePullRequest(prEntries.get(i), i));
        }

        List<DeploymentEvent> deployments = new ArrayList<>();
        List<Map<String, Object>> deploymentEntries = entries(root, "deployments");
        for (int i = 0; i < deploymentEntries.size(); i++) {
            deployments.add(parseDeployment(deploymentEntries.get(i), i));
        }

        List<IncidentEvent> incidents = new ArrayList<>();
        for (Map<String, Object> entry : entries(root, "incidents")) {
            incidents.add(new IncidentEvent(getString(entry, "assignee")));
        }

        return new EventBatch(pullRequests, deployments, incidents);
    }

    private PullRequestEvent parsePullRequest(Map<String, Object> entry, int index) throws EventFileException {
        String section = "pull_requests";
        return new PullRequestEvent(
                getString(entry, "author"),
                getString(entry, "author_name"),
                getString(entry, "avatar_url"),
                (int) getCount(entry, "commits", section, index),
                getCount(entry, "additions", section, index),
                getCount(entry, "deletions", section, index),
                (int) getCount(entry, "comments", section, index),
                (int) getCount(entry, "rework_cycles", section, index),
                getOptionalLong(entry, "lead_time_ms", section, index),
                getOptionalLong(entry, "merge_time_ms", section, index),
                getOptionalLong(entry, "rework_time_ms", section, index),
                getStringList(entry, "reviewers"));
    }

    private DeploymentEvent parseDeployment(Map<String, Object> entry, int index) throws EventFileException {
        String section = "deployments";
        DeploymentStatus status;
        try {
            status = DeploymentStatus.parse(getString(entry, "status"));
        } catch (IllegalArgumentException e) {
            throw new EventFileException(section, index, e.getMessage(), e);
        }
        return new DeploymentEvent(getString(entry, "actor"), status, getInstant(entry, "timestamp", section, index));
    }

    @SuppressWarnings("unchecked")
    private Map<String, List<RepositoryContributor>> parseRoster(Object data) throws IOException {
        Map<String, List<RepositoryContributor>> listings = new LinkedHashMap<>();
        if (data == null) {
            return listings;
        }
        if (!(data instanceof Map)) {
            throw new IOException("Roster file must contain a mapping at the top level");
        }
        List<Map<String, Object>> repositories = entries((Map<String, Object>) data, "repositories");
        for (int i = 0; i < repositories.size(); i++) {
            Map<String, Object> repository = repositories.get(i);
            String name = getString(repository, "name");
            if (name == null) {
                throw new EventFileException("repositories", i, "repository name is missing");
            }
            List<RepositoryContributor> contributors = new ArrayList<>();
            List<Map<String, Object>> contributorEntries = entries(repository, "contributors");
            for (int j = 0; j < contributorEntries.size(); j++) {
                Map<String, Object> c = contributorEntries.get(j);
                String section = "repositories." + name + ".contributors";
                contributors.add(new RepositoryContributor(
                        getString(c, "login"),
                        getLong(c, "id", 0, section, j),
                        getString(c, "avatar_url"),
                        getString(c, "html_url"),
                        getString(c, "type"),
                        (int) getCount(c, "contributions", section, j)));
            }
            listings.put(name, contributors);
        }
        return listings;
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> entries(Map<String, Object> root, String key) throws IOException {
        Object value = root.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new IOException("'" + key + "' must be a list");
        }
        List<Map<String, Object>> result = new ArrayList<>();
        List<Object> items = (List<Object>) value;
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            if (!(item instanceof Map)) {
                throw new EventFileException(key, i, "entry must be a mapping");
            }
            result.add((Map<String, Object>) item);
        }
        return result;
    }

    private String getString(Map<String, Object> map, String key) {
        Object val = map.get(key);
        return val == null ? null : val.toString();
    }

    private long getLong(Map<String, Object> map, String key, long defaultVal, String section, int index)
            throws EventFileException {
        Long val = getOptionalLong(map, key, section, index);
        return val == null ? defaultVal : val;
    }

    private long getCount(Map<String, Object> map, String key, String section, int index)
            throws EventFileException {
        long val = getLong(map, key, 0, section, index);
        if (val < 0) {
            throw new EventFileException(section, index, "'" + key + "' must not be negative, got: " + val);
        }
        return val;
    }

    private Long getOptionalLong(Map<String, Object> map, String key, String section, int index)
            throws EventFileException {
        Object val = map.get(key);
        if (val == null) {
            return null;
        }
        if (val instanceof Number) {
            return ((Number) val).longValue();
        }
        throw new EventFileException(section, index, "'" + key + "' must be a number, got: " + val);
    }

    private List<String> getStringList(Map<String, Object> map, String key) {
        Object val = map.get(key);
        if (!(val instanceof List)) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) val) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private Instant getInstant(Map<String, Object> map, String key, String section, int index)
            throws EventFileException {
        Object val = map.get(key);
        if (val == null) {
            return null;
        }
        // SnakeYAML resolves unquoted ISO timestamps to java.util.Date
        if (val instanceof Date) {
            return ((Date) val).toInstant();
        }
        try {
            return Instant.parse(val.toString());
        } catch (DateTimeParseException e) {
            throw new EventFileException(section, index, "'" + key + "' is not an ISO-8601 instant: " + val, e);
        }
    }
}
