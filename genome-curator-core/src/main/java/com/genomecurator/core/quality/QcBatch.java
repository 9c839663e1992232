package com.genomecurator.core.quality;

import com.genomecurator.core.exception.CurationException;
import com.genomecurator.core.exception.MissingFieldException;
import com.genomecurator.core.model.MarkerPercentage;
import com.genomecurator.core.model.MetadataRecord;
import com.genomecurator.core.model.QcOutcome;
import com.genomecurator.core.util.GenomeIdIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Applies {@link QcFilter} to every genome of a metadata table.
 *
 * <p>Sequential runs visit genomes in input order with a single tally. Parallel runs
 * split the genomes into contiguous chunks, evaluate each chunk on a fixed thread pool
 * with its own {@link QcFailureCounters}, and merge the tallies once all chunks finish.
 * Both produce the same outcomes in the same order.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * QcBatch batch = new QcBatch(config.qc());
 * QcBatchResult result = batch.run(metadata, markerPercentages, 4);
 * runCounters.merge(result.counters());
 * }</pre>
 */
public class QcBatch {

    private static final Logger log = LoggerFactory.getLogger(QcBatch.class);

    private final QcThresholds thresholds;

    public QcBatch(QcThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
    }

    /**
     * Runs QC sequentially.
     *
     * @param metadata metadata keyed by genome id
     * @param markerPercentages marker percentages keyed by genome id
     * @return batch result
     */
    public QcBatchResult run(Map<String, MetadataRecord> metadata, Map<String, MarkerPercentage> markerPercentages) {
        return run(metadata, markerPercentages, 1);
    }

    /**
     * Runs QC with the given number of worker threads.
     *
     * @param metadata metadata keyed by genome id
     * @param markerPercentages marker percentages keyed by genome id
     * @param threads number of worker threads; 1 runs on the calling thread
     * @return batch result
     * @throws com.genomecurator.core.exception.InconsistentIdException if the two inputs
     *         spell a genome id with different origin prefixes
     * @throws MissingFieldException if a genome has no marker percentage
     */
    public QcBatchResult run(Map<String, MetadataRecord> metadata,
                             Map<String, MarkerPercentage> markerPercentages,
                             int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1");
        }

        GenomeIdIndex index = new GenomeIdIndex();
        index.registerAll(metadata.keySet(), "metadata");
        index.registerAll(markerPercentages.keySet(), "marker percentages");

        List<MetadataRecord> records = new ArrayList<>(metadata.values());
        log.info("Quality checking {} genomes with {} thread(s)", records.size(), threads);

        QcBatchResult result = threads == 1 || records.size() < 2
            ? evaluateChunk(records, markerPercentages)
            : runParallel(records, markerPercentages, threads);

        log.info("{} genomes passed QC, {} failed; failures by category: {}",
            result.passedCount(), result.failedCount(), result.counters());
        return result;
    }

    private QcBatchResult runParallel(List<MetadataRecord> records,
                                      Map<String, MarkerPercentage> markerPercentages,
                                      int threads) {
        int chunkSize = (records.size() + threads - 1) / threads;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<QcBatchResult>> futures = new ArrayList<>();
            for (int start = 0; start < records.size(); start += chunkSize) {
                List<MetadataRecord> chunk = records.subList(start, Math.min(start + chunkSize, records.size()));
                futures.add(executor.submit(() -> evaluateChunk(chunk, markerPercentages)));
            }

            List<QcOutcome> outcomes = new ArrayList<>(records.size());
            QcFailureCounters counters = new QcFailureCounters();
            for (Future<QcBatchResult> future : futures) {
                QcBatchResult partial = future.get();
                outcomes.addAll(partial.outcomes());
                counters.merge(partial.counters());
            }
            return new QcBatchResult(outcomes, counters);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new CurationException("Quality control worker failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CurationException("Quality control interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private QcBatchResult evaluateChunk(List<MetadataRecord> records, Map<String, MarkerPercentage> markerPercentages) {
        QcFailureCounters counters = new QcFailureCounters();
        List<QcOutcome> outcomes = new ArrayList<>(records.size());

        for (MetadataRecord record : records) {
            MarkerPercentage marker = markerPercentages.get(record.genomeId());
            if (marker == null) {
                throw new MissingFieldException(record.genomeId(), "marker_percentage");
            }

            QcOutcome outcome = QcFilter.evaluate(record, marker.percentage(), thresholds);
            counters.recordAll(outcome.failures());
            outcomes.add(outcome);

            if (!outcome.passed()) {
                log.debug("Genome {} failed QC: {}", record.genomeId(), outcome.failures());
            }
        }
        return new QcBatchResult(outcomes, counters);
    }

    public QcThresholds getThresholds() {
        return thresholds;
    }
}
