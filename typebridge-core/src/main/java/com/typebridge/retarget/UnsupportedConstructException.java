package com.typebridge.retarget;

/**
 * 表达式中含有无法跨宇宙表示的结构。目前只有一等 lambda 值（柯里化函数值）。
 */
public class UnsupportedConstructException extends RetargetException {

    public UnsupportedConstructException(Direction direction, String message) {
        super(direction, message);
    }
}
