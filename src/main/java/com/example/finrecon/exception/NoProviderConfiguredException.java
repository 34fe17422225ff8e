package com.example.finrecon.exception;

/**
 * 수집 실행 시 활성화된(API 키가 설정된) 제공자가 하나도 없을 때.
 */
public class NoProviderConfiguredException extends RuntimeException {
    public NoProviderConfiguredException(String pipeline) {
        super("No " + pipeline + " provider is configured; set providers.<id>.api-key");
    }
}
