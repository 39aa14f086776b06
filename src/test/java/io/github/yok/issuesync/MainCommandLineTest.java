package io.github.yok.issuesync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * アプリケーション全体を起動し、標準出力と標準エラー出力の内容を検証します。
 */
@ExtendWith(OutputCaptureExtension.class)
class MainCommandLineTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setup() {
        System.setProperty("store.url", "");
        System.setProperty("metadata-path", tempDir.resolve(".issues").toString());
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("store.url");
        System.clearProperty("metadata-path");
    }

    @Test
    void main_正常ケース_sync_jsonを指定する_標準出力全体がJSONとして解析できること(CapturedOutput output)
            throws Exception {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        try (ConfigurableApplicationContext ctx = app.run("sync", "--json")) {
            assertTrue(ctx.isActive());
        }

        JsonNode report = new ObjectMapper().readTree(output.getOut());

        assertTrue(report.get("steps").isArray());
        assertEquals(0, report.get("steps").size());
        assertTrue(report.get("empty").asBoolean());
        assertFalse(output.getOut().contains("Application started"));
        assertTrue(output.getErr().contains("Command: sync"));
    }

    @Test
    void main_正常ケース_migrateを指定する_標準出力に何も出力されないこと(CapturedOutput output) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        try (ConfigurableApplicationContext ctx = app.run("migrate")) {
            assertTrue(ctx.isActive());
        }

        assertTrue(output.getOut().isBlank());
        assertTrue(output.getErr().contains("Command completed: migrate"));
    }
}
