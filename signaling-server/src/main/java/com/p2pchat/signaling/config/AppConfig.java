package com.p2pchat.signaling.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 공용 Bean 정의를 담고 있는 설정 클래스.
 */
@Configuration
@EnableScheduling
public class AppConfig {

	/**
	 * 토큰 만료, rate limit 충전, 유휴 세션 판정에 공통으로 쓰는 시계.
	 * 테스트에서는 고정/가변 Clock으로 교체한다.
	 */
	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

}
