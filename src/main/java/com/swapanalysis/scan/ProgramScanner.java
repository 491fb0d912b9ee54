package com.swapanalysis.scan;

import com.google.common.base.Stopwatch;
import com.swapanalysis.pojo.FileResult;
import com.swapanalysis.pojo.Finding;
import com.swapanalysis.pojo.LintKind;
import com.swapanalysis.pojo.SourceUnit;
import com.swapanalysis.syntax.Block;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Scans every block of every source unit. Blocks are independent, so with more than one thread
 * they are scanned on a worker pool; results keep file and block order either way.
 * An interrupt stops the scan between blocks.
 */
public class ProgramScanner {

    private static final Logger log = LoggerFactory.getLogger(ProgramScanner.class);

    private final BlockScanner blockScanner;
    private final int threads;

    public ProgramScanner(BlockScanner blockScanner, int threads) {
        this.blockScanner = blockScanner;
        this.threads = Math.max(1, threads);
    }

    public List<FileResult> scanAll(List<SourceUnit> units) {
        Stopwatch sw = Stopwatch.createStarted();
        List<List<Finding>> perBlock = threads == 1 ? scanSequentially(units) : scanInParallel(units);

        List<FileResult> results = new ArrayList<>(units.size());
        int next = 0;
        int total = 0;
        for (SourceUnit unit : units) {
            List<Finding> findings = new ArrayList<>();
            for (int i = 0; i < unit.blocks().size(); i++) {
                findings.addAll(perBlock.get(next++));
            }
            total += findings.size();
            results.add(FileResult.builder()
                    .name(unit.name())
                    .lineMap(unit.lineMap())
                    .findings(List.copyOf(findings))
                    .metrics(countByLint(findings))
                    .build());
        }
        sw.stop();
        log.info("Scanned {} blocks in {} files in {} ms, {} findings",
                perBlock.size(), units.size(), sw.elapsed(TimeUnit.MILLISECONDS), total);
        return results;
    }

    private List<List<Finding>> scanSequentially(List<SourceUnit> units) {
        List<List<Finding>> perBlock = new ArrayList<>();
        for (SourceUnit unit : units) {
            for (Block block : unit.blocks()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("Scan interrupted after " + perBlock.size() + " blocks");
                }
                perBlock.add(blockScanner.scan(block, unit.typeOracle(), unit.sourceText()));
            }
        }
        return perBlock;
    }

    private List<List<Finding>> scanInParallel(List<SourceUnit> units) {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<List<Finding>>> futures = new ArrayList<>();
        try {
            for (SourceUnit unit : units) {
                for (Block block : unit.blocks()) {
                    futures.add(executor.submit(() -> blockScanner.scan(block, unit.typeOracle(), unit.sourceText())));
                }
            }
            List<List<Finding>> perBlock = new ArrayList<>(futures.size());
            for (Future<List<Finding>> future : futures) {
                perBlock.add(future.get());
            }
            return perBlock;
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new CancellationException("Scan interrupted");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Block scan failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private static Map<String, Integer> countByLint(List<Finding> findings) {
        Map<String, Integer> metrics = new LinkedHashMap<>();
        for (LintKind kind : LintKind.values()) {
            metrics.put(kind.lintName(), 0);
        }
        for (Finding finding : findings) {
            metrics.merge(finding.kind().lintName(), 1, Integer::sum);
        }
        return metrics;
    }
}
