package org.dxworks.docmark;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AppTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void run_WritesOutputsAndReport() throws Exception {
        Path input = tempDir.resolve("in");
        Files.createDirectories(input.resolve("sub"));
        Files.writeString(input.resolve("a.md"), "# A", StandardCharsets.UTF_8);
        Files.write(input.resolve("bad.md"), new byte[]{(byte) 0xFF, (byte) 0xFE});
        Files.writeString(input.resolve("sub/b.md"), "B", StandardCharsets.UTF_8);
        Files.writeString(input.resolve("ignored.txt"), "skip me", StandardCharsets.UTF_8);
        Path output = Files.createDirectories(tempDir.resolve("out"));

        App.Summary summary = App.run(input, output, DocmarkConfig.defaults());

        assertEquals(2, summary.converted);
        assertEquals(1, summary.errors);
        assertTrue(Files.isRegularFile(output.resolve("a.docx")));
        assertTrue(Files.isRegularFile(output.resolve("sub/b.docx")));

        List<JsonNode> lines = new ArrayList<>();
        for (String line : Files.readAllLines(output.resolve(App.REPORT_FILE_NAME))) {
            lines.add(MAPPER.readTree(line));
        }
        assertEquals(5, lines.size());
        assertEquals("run", lines.get(0).get("kind").asText());
        assertEquals(3, lines.get(0).get("total_files").asInt());

        JsonNode done = lines.get(4);
        assertEquals("done", done.get("kind").asText());
        assertEquals(2, done.get("files_converted").asInt());
        assertEquals(1, done.get("files_with_errors").asInt());

        JsonNode error = lines.stream().filter(n -> "error".equals(n.get("kind").asText())).findFirst().orElseThrow();
        assertEquals("parse", error.get("category").asText());
        assertTrue(error.get("file").asText().endsWith("bad.md"));
    }

    @Test
    void outputPath_MirrorsRelativeDirectories() {
        Path base = tempDir.resolve("in");

        assertEquals(tempDir.resolve("out/x/y/doc.md"),
                App.outputPath(base.resolve("x/y/doc.docx"), base, tempDir.resolve("out")));
        assertEquals(tempDir.resolve("out/top.docx"),
                App.outputPath(base.resolve("top.md"), base, tempDir.resolve("out")));
    }

    @Test
    void collectInputFiles_SingleFile() throws Exception {
        Path file = Files.writeString(tempDir.resolve("one.docx"), "x");

        assertEquals(List.of(file), App.collectInputFiles(file));
        assertTrue(App.collectInputFiles(Files.writeString(tempDir.resolve("two.txt"), "x")).isEmpty());
    }
}
