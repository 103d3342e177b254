package org.csu.gemcode.common.exception;

import lombok.Getter;

/**
 * @description: 词法分析阶段的自定义异常
 * 消息中只包含出错的文本；行列号仅供调用方查询，不拼入消息。
 */
@Getter
public class LexException extends CompileException {

    private final String text;
    private final int line;
    private final int column;

    public LexException(String message, String text, int line, int column) {
        super(message);
        this.text = text;
        this.line = line;
        this.column = column;
    }
}
