package com.autofix.orchestrator.tracker;

import com.autofix.orchestrator.config.AutofixProperties;
import com.autofix.orchestrator.executor.CommandExecutor;
import com.autofix.orchestrator.executor.ExecutionResult;
import com.autofix.orchestrator.model.Issue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link IssueTracker} over the GitHub {@code gh} command-line tool.
 *
 * Every command is scoped to the configured repository with {@code -R owner/name}.
 * Responses are read with {@code --json} field selections.
 */
@Component
public class GhIssueTracker implements IssueTracker {

    private static final Logger log = LoggerFactory.getLogger(GhIssueTracker.class);

    private static final Duration GH_TIMEOUT = Duration.ofMinutes(1);

    private final CommandExecutor executor;
    private final ObjectMapper    json;
    private final String          repo;
    private final Path            workDir;

    public GhIssueTracker(CommandExecutor executor, ObjectMapper objectMapper, AutofixProperties properties) {
        this.executor = executor;
        this.json     = objectMapper;
        this.repo     = properties.githubRepo();
        this.workDir  = properties.projectDir();
    }

    @Override
    public Issue fetchIssue(int number) {
        JsonNode data = readJson(gh("issue", "view", String.valueOf(number),
                "--json", "number,title,body,labels,url"), "issue view");
        List<String> labels = new ArrayList<>();
        for (JsonNode label : data.path("labels")) {
            labels.add(label.path("name").asText());
        }
        return new Issue(
                data.path("number").asInt(number),
                data.path("title").asText(""),
                data.path("body").isNull() ? "" : data.path("body").asText(""),
                labels,
                data.path("url").asText(""));
    }

    @Override
    public void postComment(int issueNumber, String body) {
        log.info("Commenting on issue #{}", issueNumber);
        gh("issue", "comment", String.valueOf(issueNumber), "--body", body);
    }

    @Override
    public Optional<ChangeRequest> findOpenChangeRequest(String headBranch) {
        ExecutionResult result = ghUnchecked("pr", "list",
                "--head", headBranch,
                "--state", "open",
                "--json", "number,url,headRefName");
        if (!result.success() || result.out().isEmpty()) {
            return Optional.empty();
        }
        JsonNode prs = readJson(result.out(), "pr list");
        if (!prs.isArray() || prs.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toChangeRequest(prs.get(0)));
    }

    @Override
    public void closeChangeRequest(int number) {
        log.info("Closing PR #{}", number);
        gh("pr", "close", String.valueOf(number));
    }

    @Override
    public ChangeRequest createChangeRequest(String title, String body, String head, String base,
                                             boolean draft, List<String> labels) {
        List<String> args = new ArrayList<>(List.of(
                "pr", "create",
                "--title", title,
                "--body", body,
                "--head", head,
                "--base", base));
        if (draft) {
            args.add("--draft");
        }
        for (String label : labels) {
            args.add("--label");
            args.add(label);
        }
        String url = gh(args.toArray(String[]::new));
        log.info("Created PR {}", url);

        JsonNode data = readJson(gh("pr", "view", url, "--json", "number,url,headRefName"), "pr view");
        return toChangeRequest(data);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ChangeRequest toChangeRequest(JsonNode node) {
        return new ChangeRequest(
                node.path("number").asInt(),
                node.path("url").asText(""),
                node.path("headRefName").asText(""));
    }

    private JsonNode readJson(String body, String operation) {
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IssueTrackerException("Failed to parse gh " + operation + " response", e);
        }
    }

    private String gh(String... args) {
        ExecutionResult result = ghUnchecked(args);
        if (!result.success()) {
            throw new IssueTrackerException("gh %s %s failed: %s".formatted(args[0], args[1], result.describeFailure()));
        }
        return result.out();
    }

    private ExecutionResult ghUnchecked(String... args) {
        List<String> command = new ArrayList<>(args.length + 3);
        command.add("gh");
        command.addAll(List.of(args));
        command.add("-R");
        command.add(repo);
        return executor.run(command, workDir, GH_TIMEOUT);
    }
}
