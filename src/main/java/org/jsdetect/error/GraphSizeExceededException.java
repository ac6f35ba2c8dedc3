package org.jsdetect.error;

public class GraphSizeExceededException extends AnalysisException {

    private final String resource;
    private final long limit;

    public GraphSizeExceededException(String resource, long actual, long limit) {
        super(resource + " exceeds limit: " + actual + " > " + limit);
        this.resource = resource;
        this.limit = limit;
    }

    public String resource() {
        return resource;
    }

    public long limit() {
        return limit;
    }

    @Override
    public FileStatus status() {
        return FileStatus.GRAPH_SIZE_EXCEEDED;
    }
}
