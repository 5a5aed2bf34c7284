package com.autofix.orchestrator.agent;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptTemplatesTest {

    @TempDir
    Path dir;

    @Test
    void substitute_replacesKnownPlaceholdersOnly() {
        String out = PromptTemplates.substitute("Fix #${ISSUE_NUMBER}: ${ISSUE_TITLE} ${UNKNOWN}",
                Map.of("ISSUE_NUMBER", "42", "ISSUE_TITLE", "Crash"));

        assertThat(out).isEqualTo("Fix #42: Crash ${UNKNOWN}");
    }

    @Test
    void substitute_valueWithRegexCharacters_insertedLiterally() {
        String out = PromptTemplates.substitute("diff: ${CURRENT_DIFF}", Map.of("CURRENT_DIFF", "$1 \\d+ a.*b"));

        assertThat(out).isEqualTo("diff: $1 \\d+ a.*b");
    }

    @Test
    void load_overrideDirectoryWins() throws IOException {
        Files.writeString(dir.resolve("triage.md"), "custom ${ISSUE_TITLE}");

        PromptTemplates templates = new PromptTemplates(dir);

        assertThat(templates.render("triage", Map.of("ISSUE_TITLE", "t"))).isEqualTo("custom t");
    }

    @Test
    void load_missingOverride_fallsBackToBundledTemplates() {
        PromptTemplates templates = new PromptTemplates(dir);

        for (String name : new String[] {"triage", "research", "fix", "fix-revision", "review"}) {
            assertThat(templates.load(name)).contains("${ISSUE_NUMBER}");
        }
    }

    @Test
    void load_unknownTemplate_throws() {
        PromptTemplates templates = new PromptTemplates(dir);

        assertThatThrownBy(() -> templates.load("nope"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope");
    }
}
