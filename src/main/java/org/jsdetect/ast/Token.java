package org.jsdetect.ast;

/**
 * 解析器给出的词法单元，type 取 Esprima 的名称（Keyword、Identifier、Punctuator ...）
 */
public record Token(String type, String value, SourceRange range) {
}
