package com.largomodo.gamemeta.core;

import com.largomodo.gamemeta.core.domain.DiscoveredCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Sequential batch over discovered collections with fail-soft error handling.
 * <p>
 * Each collection is independent: a failure (I/O error, closure mismatch, unexpected
 * runtime error) is reported to the observer and counted, and the loop moves on. The
 * platform key is put in the MDC under {@code collection} while a collection is processed.
 */
public class BatchRunner {

    public static final String MDC_KEY = "collection";

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final CollectionProcessor processor;

    public BatchRunner(CollectionProcessor processor) {
        this.processor = processor;
    }

    /**
     * Process every collection in iteration order.
     *
     * @param collections collections to process
     * @param mode        processing mode applied to each
     * @param observer    lifecycle callbacks (counts, failure logging)
     * @return per-batch success and failure counts
     */
    public BatchResult run(Collection<DiscoveredCollection> collections, ProcessingMode mode,
                           CollectionObserver observer) {
        int succeeded = 0;
        List<String> failed = new ArrayList<>();

        for (DiscoveredCollection collection : collections) {
            MDC.put(MDC_KEY, collection.key());
            try {
                observer.onStart(collection);
                int games = processor.process(collection, mode);
                succeeded++;
                observer.onSuccess(collection, games);
            } catch (Exception e) {
                // Catch all exceptions so one collection cannot abort the batch
                failed.add(collection.key());
                observer.onFailure(collection, e);
            } finally {
                MDC.remove(MDC_KEY);
            }
        }

        log.info("Batch complete: {} successful, {} failed", succeeded, failed.size());
        return new BatchResult(succeeded, failed);
    }

    /**
     * @param succeeded  number of collections processed successfully
     * @param failedKeys platform keys of failed collections, in processing order
     */
    public record BatchResult(int succeeded, List<String> failedKeys) {

        public BatchResult {
            failedKeys = List.copyOf(failedKeys);
        }

        public int failed() {
            return failedKeys.size();
        }
    }
}
