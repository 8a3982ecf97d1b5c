package com.ryuqq.toolbox.core.contract;

import com.ryuqq.toolbox.core.outcome.ExecutionResult;

/**
 * 결과 채널로 전달되는 완료 항목 (요청 + 결과).
 *
 * @param request 원본 요청
 * @param result 실행 결과
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public record Completion(
    ExecutionRequest request,
    ExecutionResult result
) {

    public Completion {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
    }
}
