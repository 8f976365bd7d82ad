package com.lux032.genreenricher.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 批处理汇总: 部分结果 + 失败数, 单个文件失败不会中止整个批次
 */
@Data
public class BatchSummary {

    private final int total;
    private int success;
    private int noGenres;
    private int failed;
    private int cancelled;
    private boolean aborted;
    private final List<EnrichmentResult> details = new ArrayList<>();
    private final Map<String, String> failures = new LinkedHashMap<>();

    public synchronized void addResult(EnrichmentResult result) {
        details.add(result);
        if (result.getOutcome().isSuccess()) {
            success++;
        } else if (result.getOutcome().isFailure()) {
            failed++;
            failures.put(result.getFile().getAbsolutePath(), result.getMessage());
        } else {
            noGenres++;
        }
    }

    public synchronized void addFailure(String filePath, String error) {
        failed++;
        failures.put(filePath, error);
    }

    public synchronized void addCancelled(int count) {
        cancelled += count;
    }

    public synchronized int getProcessed() {
        return success + noGenres + failed;
    }

    public synchronized List<EnrichmentResult> getDetails() {
        return Collections.unmodifiableList(new ArrayList<>(details));
    }

    public synchronized Map<String, String> getFailures() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }
}
