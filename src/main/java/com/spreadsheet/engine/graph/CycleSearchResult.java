package com.spreadsheet.engine.graph;

import com.spreadsheet.engine.models.CellAddress;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of a cycle search from one cell.
 * For a cycle the path starts and ends with the repeated cell;
 * for an exceeded ceiling it is the chain walked so far.
 */
public final class CycleSearchResult {

    public enum Status {
        NONE,
        CYCLE,
        DEPTH_EXCEEDED
    }

    private static final CycleSearchResult NONE = new CycleSearchResult(Status.NONE, Collections.emptyList());

    private final Status status;
    private final List<CellAddress> path;

    private CycleSearchResult(Status status, List<CellAddress> path) {
        this.status = status;
        this.path = Collections.unmodifiableList(path);
    }

    public static CycleSearchResult none() {
        return NONE;
    }

    public static CycleSearchResult cycle(List<CellAddress> path) {
        return new CycleSearchResult(Status.CYCLE, path);
    }

    public static CycleSearchResult depthExceeded(List<CellAddress> path) {
        return new CycleSearchResult(Status.DEPTH_EXCEEDED, path);
    }

    public Status getStatus() {
        return status;
    }

    public boolean hasCycle() {
        return status == Status.CYCLE;
    }

    public List<CellAddress> getPath() {
        return path;
    }

    public String describePath() {
        return path.stream().map(CellAddress::toText).collect(Collectors.joining(" -> "));
    }

    @Override
    public String toString() {
        return status == Status.NONE ? "NONE" : status + " " + describePath();
    }
}
