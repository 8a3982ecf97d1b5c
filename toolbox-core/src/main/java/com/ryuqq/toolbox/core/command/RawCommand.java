package com.ryuqq.toolbox.core.command;

/**
 * 셸 명령 문자열.
 *
 * <p>하나의 명령 문자열로 셸({@code sh -c})에 전달됩니다.</p>
 *
 * @param shellText 셸 명령 문자열
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public record RawCommand(String shellText) implements CommandSpec {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException shellText가 null이거나 빈 문자열인 경우
     */
    public RawCommand {
        if (shellText == null || shellText.isBlank()) {
            throw new IllegalArgumentException("shellText cannot be null or blank");
        }
    }

    public static RawCommand of(String shellText) {
        return new RawCommand(shellText);
    }
}
