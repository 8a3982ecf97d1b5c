package com.ryuqq.toolbox.core.error;

/**
 * 코어에서 발생하는 오류 종류.
 *
 * <p><strong>전달 방식:</strong></p>
 * <ul>
 *   <li>NOT_FOUND, NOT_EXECUTABLE: 호출자 입력 오류, 디스패치 전에 동기적으로 예외 발생</li>
 *   <li>SPAWN_FAILURE, NON_ZERO_EXIT: ExecutionResult에 담겨 결과 채널로 전달</li>
 * </ul>
 *
 * <p>어떤 오류도 재시도되지 않으며 세션을 종료시키지 않습니다.</p>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 존재하지 않는 카테고리 또는 노드.
     */
    NOT_FOUND,

    /**
     * 그룹 노드에 대한 실행 요청.
     */
    NOT_EXECUTABLE,

    /**
     * 프로세스 시작 실패 (실행 파일 없음, 권한 없음 등).
     */
    SPAWN_FAILURE,

    /**
     * 프로세스는 실행되었으나 실패 상태로 종료.
     */
    NON_ZERO_EXIT;

    /**
     * 호출자에게 동기적으로 전달되는 오류인지 확인.
     *
     * @return NOT_FOUND 또는 NOT_EXECUTABLE인 경우 true
     */
    public boolean isCallerError() {
        return this == NOT_FOUND || this == NOT_EXECUTABLE;
    }
}
