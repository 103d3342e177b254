package org.csu.gemcode.common.exception;

/**
 * @description: 编译过程中所有错误的公共父类
 * 词法与语法阶段都只抛出第一个错误，不做恢复。
 */
public class CompileException extends RuntimeException {

    public CompileException(String message) {
        super(message);
    }
}
