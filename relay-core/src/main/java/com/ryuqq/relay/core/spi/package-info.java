/**
 * Service Provider Interface (SPI) package.
 *
 * <p>전송 계층 어댑터가 구현해야 하는 인터페이스를 정의합니다.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.spi.HttpTransport} - 호스트 하나에 대한 HTTP 전송</li>
 *   <li>{@link com.ryuqq.relay.core.spi.TransportFactory} - 호스트별 Transport 생성</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>relay-adapter-jdkhttp (java.net.http 기반), relay-adapter-inmemory (테스트용 스크립트 응답)가
 * 구현을 제공합니다.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core는 인터페이스만 정의, 어댑터가 구현</li>
 *   <li><strong>Dependency Inversion:</strong> Core는 HTTP 클라이언트 라이브러리에 의존하지 않음</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.core.spi;
