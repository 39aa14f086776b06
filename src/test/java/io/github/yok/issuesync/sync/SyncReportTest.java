package io.github.yok.issuesync.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class SyncReportTest {

    @Test
    void getWarnings_正常ケース_警告のみが抽出されること() {
        SyncReport report = new SyncReport(List.of(StepResult.success("commit", "ok"),
                StepResult.warning("export", "export failed: x"),
                StepResult.skipped("push", "no remote origin configured")));

        assertEquals(1, report.getWarnings().size());
        assertEquals("export", report.getWarnings().get(0).getStep());
        assertFalse(report.isHalted());
        assertFalse(report.isEmpty());
    }

    @Test
    void empty_正常ケース_空のレポートが返ること() {
        assertTrue(SyncReport.empty().isEmpty());
        assertTrue(SyncReport.empty().getWarnings().isEmpty());
    }

    @Test
    void json_正常ケース_警告一覧を含まずステップが出力されること() throws Exception {
        SyncReport report = new SyncReport(List.of(StepResult.warning("push", "Dolt push failed")));

        JsonNode node = new ObjectMapper().readTree(new ObjectMapper().writeValueAsString(report));

        assertFalse(node.has("warnings"));
        assertEquals("WARNING", node.get("steps").get(0).get("status").asText());
        assertEquals("push", node.get("steps").get(0).get("step").asText());
    }
}
