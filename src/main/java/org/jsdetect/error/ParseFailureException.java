package org.jsdetect.error;

/**
 * AST JSON 无法读取或结构不符合 ESTree
 */
public class ParseFailureException extends AnalysisException {

    public ParseFailureException(String message) {
        super(message);
    }

    public ParseFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FileStatus status() {
        return FileStatus.PARSE_FAILURE;
    }
}
