package org.csu.gemcode.common.config;

import lombok.Getter;
import lombok.Setter;

/**
 * 代码生成相关的可调参数，默认值即标准输出格式
 */
@Getter
@Setter
public class CompilerOptions {

    public static final String DEFAULT_ENGINE_NAME = "GemCode";
    public static final String DEFAULT_INDENT_UNIT = "    "; // 4 个空格

    private String engineName = DEFAULT_ENGINE_NAME; // 出现在生成文件头注释中
    private String indentUnit = DEFAULT_INDENT_UNIT; // 每层嵌套的缩进

    public String headerComment() {
        return "# Generated by " + engineName;
    }
}
