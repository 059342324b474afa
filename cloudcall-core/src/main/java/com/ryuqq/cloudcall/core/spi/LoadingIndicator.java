package com.ryuqq.cloudcall.core.spi;

/**
 * 로딩 인디케이터(스피너) SPI.
 *
 * <p>여러 독립적인 요청자가 같은 인디케이터를 공유할 수 있으므로, 표시 요청은
 * owner 단위의 claim으로 관리됩니다. 엔진은 자기 자신을 owner로 전달합니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public interface LoadingIndicator {

    /**
     * owner의 표시 claim 추가.
     *
     * @param owner claim 소유자
     */
    void show(Object owner);

    /**
     * owner의 모든 표시 claim 제거.
     *
     * @param owner claim 소유자
     */
    void hide(Object owner);
}
