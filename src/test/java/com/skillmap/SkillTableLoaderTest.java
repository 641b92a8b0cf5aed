package com.skillmap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillmap.config.SkillMapProperties;
import com.skillmap.domain.SkillModels.Difficulty;
import com.skillmap.domain.SkillModels.SkillType;
import com.skillmap.table.SkillTable;
import com.skillmap.table.SkillTableDocument;
import com.skillmap.table.SkillTableException;
import com.skillmap.table.SkillTableLoader;
import com.skillmap.table.SkillTableValidator;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SkillTableLoaderTest {
    private final SkillTableLoader loader = new SkillTableLoader(
            new ObjectMapper(), new SkillTableValidator(), new DefaultResourceLoader(), new SkillMapProperties());

    @Test
    void loadsBundledTableWithoutIssues() {
        SkillTable table = loader.load();

        assertTrue(table.issues().isEmpty(), () -> "unexpected issues: " + table.issues());
        assertEquals(List.of("JavaScript"), table.prerequisites("React"));
        assertEquals(List.of("Java", "SQL"), table.prerequisites("Spring Boot"));
        assertEquals("Node.js", table.resolveAlias("NodeJS").orElseThrow());
        assertEquals("AWS", table.resolveAlias("Amazon Web Services").orElseThrow());
        assertEquals("PowerBI", table.resolveAlias("power bi").orElseThrow());
        var ml = table.find("Machine Learning").orElseThrow();
        assertEquals(8, ml.durationWeeks());
        assertEquals(Difficulty.ADVANCED, ml.difficulty());
        assertEquals(SkillType.SOFT, table.find("Communication").orElseThrow().type());
    }

    @Test
    void rejectsSkillListingItselfAsPrerequisite() {
        String json = """
                {"skills": {"Java": {"type": "technical", "prerequisites": ["Java"], "durationWeeks": 6}}}
                """;

        SkillTableException error = assertThrows(SkillTableException.class, () -> read(json));
        assertTrue(error.getMessage().contains(SkillTableDocument.SELF_PREREQUISITE));
    }

    @Test
    void paddedSelfPrerequisiteIsRejectedAsTableError() {
        String json = """
                {"skills": {"Java": {"type": "technical", "prerequisites": [" Java "]}}}
                """;

        SkillTableException error = assertThrows(SkillTableException.class, () -> read(json));
        assertTrue(error.getMessage().contains(SkillTableDocument.SELF_PREREQUISITE));
    }

    @Test
    void nullAndBlankPrerequisitesAreReportedAndDropped() {
        String json = """
                {"skills": {
                  "SQL": {"type": "technical"},
                  "Java": {"type": "technical", "prerequisites": [null, "  ", " SQL"]}
                }}
                """;

        SkillTable table = read(json);

        assertEquals(List.of("SQL"), table.prerequisites("Java"));
        List<String> codes = table.issues().stream().map(SkillTableDocument.TableValidationIssue::code).toList();
        assertEquals(List.of(SkillTableDocument.BLANK_PREREQUISITE), codes);
    }

    @Test
    void blankSkillIdIsRejected() {
        assertThrows(SkillTableException.class, () -> read("{\"skills\": {\" \": {\"type\": \"technical\"}}}"));
    }

    @Test
    void rejectsMalformedAndEmptyTables() {
        assertThrows(SkillTableException.class, () -> read("{\"skills\": ["));
        assertThrows(SkillTableException.class, () -> read("{\"aliases\": {}}"));
        assertThrows(SkillTableException.class, () -> loader.load("classpath:no-such-table.json"));
    }

    @Test
    void toleratesCyclesAndDanglingReferencesButReportsThem() {
        String json = """
                {
                  "aliases": {"k8s": "Kubernetes", "golang": "Go"},
                  "skills": {
                    "A": {"type": "technical", "prerequisites": ["B"], "durationWeeks": 2},
                    "B": {"type": "technical", "prerequisites": ["A"], "durationWeeks": 0, "difficulty": "Expert"},
                    "Kubernetes": {"type": "technical", "prerequisites": ["Docker"]}
                  }
                }
                """;

        SkillTable table = read(json);

        List<String> codes = table.issues().stream().map(SkillTableDocument.TableValidationIssue::code).toList();
        assertTrue(codes.contains(SkillTableDocument.CYCLE_DETECTED));
        assertTrue(codes.contains(SkillTableDocument.PREREQUISITE_NOT_FOUND));
        assertTrue(codes.contains(SkillTableDocument.ALIAS_TARGET_NOT_FOUND));
        assertTrue(codes.contains(SkillTableDocument.INVALID_DURATION));
        assertTrue(codes.contains(SkillTableDocument.INVALID_DIFFICULTY));

        var b = table.find("B").orElseThrow();
        assertEquals(4, b.durationWeeks());
        assertEquals(Difficulty.INTERMEDIATE, b.difficulty());
        assertEquals("Kubernetes", table.resolveAlias("K8S").orElseThrow());
    }

    private SkillTable read(String json) {
        return loader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "inline");
    }
}
