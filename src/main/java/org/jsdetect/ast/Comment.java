package org.jsdetect.ast;

/**
 * 注释，type 为 Line 或 Block
 */
public record Comment(String type, String value, SourceRange range) {
}
