package org.kleis.verify.structures;

import org.kleis.verify.KleisException;

/**
 * 结构注册或闭包计算失败：重复注册、extends 循环、未知结构等。
 */
public class StructureException extends KleisException {

    public StructureException(String message) {
        super(message);
    }
}
