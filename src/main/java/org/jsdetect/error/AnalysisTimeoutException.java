package org.jsdetect.error;

public class AnalysisTimeoutException extends AnalysisException {

    public AnalysisTimeoutException(String message) {
        super(message);
    }

    @Override
    public FileStatus status() {
        return FileStatus.TIMEOUT;
    }
}
