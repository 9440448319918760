package com.turnhub.turnservice.process;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 从引擎错误日志里提取有效错误：先去掉已知噪音行，再优先保留带错误特征的行，最多取最后 3 行。
 */
public final class ErrorLogReader {

    private static final List<String> NOISE = List.of(
            "Setup port",
            "seconds, open:",
            "kdialog: not found",
            "zenity: not found",
            "Error: Can't open display:",
            "sh: 1:"
    );

    private static final List<String> ERROR_MARKERS = List.of(
            "Map specified by --mapfile was not found",
            "Can't find mod:",
            "Error:",
            "Failed to",
            "Could not",
            "No such file or directory",
            "Permission denied"
    );

    private static final int MAX_LINES = 3;

    private ErrorLogReader() {}

    public static String summarize(Path logFile) {
        if (!Files.exists(logFile)) {
            return "No log file found";
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "Could not read log file: " + e.getMessage();
        }
        return summarize(lines);
    }

    static String summarize(List<String> lines) {
        if (lines.isEmpty()) {
            return "Log file is empty";
        }
        List<String> kept = new ArrayList<>();
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty()) continue;
            if (NOISE.stream().anyMatch(line::contains)) continue;
            kept.add(line);
        }
        List<String> errors = kept.stream()
                .filter(l -> ERROR_MARKERS.stream().anyMatch(l::contains))
                .toList();
        List<String> picked = !errors.isEmpty() ? errors : kept;
        if (picked.isEmpty()) {
            return "No meaningful errors found in log";
        }
        return String.join(" | ", picked.subList(Math.max(0, picked.size() - MAX_LINES), picked.size()));
    }
}
