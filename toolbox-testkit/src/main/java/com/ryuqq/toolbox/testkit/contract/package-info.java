/**
 * 세션 Contract Test 지원 도구.
 *
 * <p>어댑터나 세션 구현을 바꿔 끼워도 동일한 계약을 만족하는지 검증하기 위한
 * 추상 테스트 베이스, 고정 카탈로그, 기록용 CommandRunner를 제공합니다.</p>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
package com.ryuqq.toolbox.testkit.contract;
