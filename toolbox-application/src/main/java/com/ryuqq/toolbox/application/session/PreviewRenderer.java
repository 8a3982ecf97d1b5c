package com.ryuqq.toolbox.application.session;

import com.ryuqq.toolbox.core.command.CommandSpec;
import com.ryuqq.toolbox.core.command.LocalFileCommand;
import com.ryuqq.toolbox.core.command.RawCommand;
import com.ryuqq.toolbox.core.model.CatalogNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * 노드 미리보기 텍스트 생성기.
 *
 * <p><strong>형식:</strong></p>
 * <pre>
 * Raw       → "Raw Command:\n{cmd}\n\nDescription:\n{desc}"
 * Script    → "Script Preview:\n{content}\n\nExecution Info:\n...\n\nDescription:\n{desc}"
 * Directory → "Directory: {name}\n\nDescription:\n{desc}"
 * </pre>
 *
 * <p>스크립트 파일을 읽을 수 없으면 내용 자리에 안내 문구를 넣습니다. 읽기 전용이며 부작용이 없습니다.</p>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public final class PreviewRenderer {

    private static final Logger log = LoggerFactory.getLogger(PreviewRenderer.class);

    /**
     * 미리보기 생성.
     *
     * @param node 대상 노드
     * @return 미리보기 텍스트
     */
    public String render(CatalogNode node) {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        CommandSpec command = node.command();
        if (command instanceof RawCommand raw) {
            return "Raw Command:\n" + raw.shellText() + "\n\nDescription:\n" + node.description();
        }
        if (command instanceof LocalFileCommand file) {
            String executionInfo = "Executable: " + file.executable()
                + "\nArguments: " + String.join(" ", file.args())
                + "\nScript File: " + file.sourcePath();
            return "Script Preview:\n" + readScript(file)
                + "\n\nExecution Info:\n" + executionInfo
                + "\n\nDescription:\n" + node.description();
        }
        return "Directory: " + node.name() + "\n\nDescription:\n" + node.description();
    }

    private String readScript(LocalFileCommand file) {
        try {
            return Files.readString(file.sourcePath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Script preview unavailable for {}: {}", file.sourcePath(), e.getMessage());
            return "Could not read script file: " + file.sourcePath();
        }
    }
}
