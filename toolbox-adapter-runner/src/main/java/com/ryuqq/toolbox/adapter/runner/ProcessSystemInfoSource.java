package com.ryuqq.toolbox.adapter.runner;

import com.ryuqq.toolbox.core.spi.SystemInfoSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 호스트 명령으로 시스템 정보를 수집하는 {@link SystemInfoSource} 구현체.
 *
 * <p><strong>수집 항목:</strong></p>
 * <ul>
 *   <li>system: {@code uname -a}</li>
 *   <li>distribution: {@code lsb_release -d}, 실패 시 os-release 파일의 PRETTY_NAME</li>
 *   <li>architecture: {@code uname -m}</li>
 * </ul>
 *
 * <p>수집에 실패한 항목은 결과에서 빠집니다.</p>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public final class ProcessSystemInfoSource implements SystemInfoSource {

    private static final Logger log = LoggerFactory.getLogger(ProcessSystemInfoSource.class);

    private static final String PRETTY_NAME_PREFIX = "PRETTY_NAME=";

    private final Path osReleasePath;

    public ProcessSystemInfoSource() {
        this(Path.of("/etc/os-release"));
    }

    /**
     * 생성자.
     *
     * @param osReleasePath os-release 파일 경로
     * @throws IllegalArgumentException osReleasePath가 null인 경우
     */
    public ProcessSystemInfoSource(Path osReleasePath) {
        if (osReleasePath == null) {
            throw new IllegalArgumentException("osReleasePath cannot be null");
        }
        this.osReleasePath = osReleasePath;
    }

    @Override
    public Map<String, String> describe() {
        Map<String, String> info = new LinkedHashMap<>();
        capture("uname", "-a").ifPresent(value -> info.put("system", value));
        capture("lsb_release", "-d")
            .or(this::prettyNameFromOsRelease)
            .ifPresent(value -> info.put("distribution", value));
        capture("uname", "-m").ifPresent(value -> info.put("architecture", value));
        return info;
    }

    /**
     * os-release 파일의 PRETTY_NAME 값 (따옴표 제거).
     */
    Optional<String> prettyNameFromOsRelease() {
        List<String> lines;
        try {
            lines = Files.readAllLines(osReleasePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", osReleasePath, e.getMessage());
            return Optional.empty();
        }
        for (String line : lines) {
            if (line.startsWith(PRETTY_NAME_PREFIX)) {
                String value = line.substring(PRETTY_NAME_PREFIX.length());
                return Optional.of(stripQuotes(value));
            }
        }
        return Optional.empty();
    }

    private Optional<String> capture(String... argv) {
        try {
            Process process = new ProcessBuilder(argv).redirectErrorStream(true).start();
            process.getOutputStream().close();
            String output;
            try (InputStream in = process.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            }
            if (process.waitFor() != 0 || output.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(output);
        } catch (IOException e) {
            log.debug("System probe {} unavailable: {}", argv[0], e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("System probe {} interrupted", argv[0]);
            return Optional.empty();
        }
    }

    private static String stripQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '"') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '"') {
            end--;
        }
        return value.substring(start, end);
    }
}
