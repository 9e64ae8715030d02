package com.typebridge.retarget;

/**
 * 跨类型宇宙改写失败的基础异常。所有子类都在首次失败处同步抛出，不做重试，不返回部分结果。
 */
public class RetargetException extends RuntimeException {

    private final Direction direction;

    public RetargetException(Direction direction, String message) {
        super(message);
        this.direction = direction;
    }

    public RetargetException(Direction direction, String message, Throwable cause) {
        super(message, cause);
        this.direction = direction;
    }

    public Direction getDirection() {
        return direction;
    }
}
