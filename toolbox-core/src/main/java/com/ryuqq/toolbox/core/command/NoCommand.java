package com.ryuqq.toolbox.core.command;

/**
 * 명령이 없는 그룹(디렉터리) 노드.
 *
 * <p>실행 요청 시 Worker에 도달하기 전에 {@code NotExecutableException}으로 거부됩니다.</p>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public record NoCommand() implements CommandSpec {

    /**
     * 공유 인스턴스.
     */
    public static final NoCommand INSTANCE = new NoCommand();
}
