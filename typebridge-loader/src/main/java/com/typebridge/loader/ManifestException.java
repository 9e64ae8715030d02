package com.typebridge.loader;

/**
 * 宇宙清单格式错误：JSON 语法、缺失字段或无法解析的类型引用。
 */
public class ManifestException extends RuntimeException {

    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
